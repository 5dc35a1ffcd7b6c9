package com.z254.conductor.workflow;

/**
 * A collaborator required to run workflows is not configured.
 */
public class WorkflowConfigurationException extends RuntimeException {

    public WorkflowConfigurationException(String message) {
        super(message);
    }
}
