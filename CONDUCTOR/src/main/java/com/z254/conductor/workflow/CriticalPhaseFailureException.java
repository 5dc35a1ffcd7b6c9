package com.z254.conductor.workflow;

import com.z254.conductor.domain.model.ExecutionContext;
import lombok.Getter;

/**
 * Terminal error of a workflow whose critical phase failed.
 */
@Getter
public class CriticalPhaseFailureException extends RuntimeException {

    private final String phaseName;
    private final transient ExecutionContext context;

    public CriticalPhaseFailureException(String phaseName, String cause, ExecutionContext context) {
        super("Critical phase '" + phaseName + "' failed: " + cause);
        this.phaseName = phaseName;
        this.context = context;
    }
}
