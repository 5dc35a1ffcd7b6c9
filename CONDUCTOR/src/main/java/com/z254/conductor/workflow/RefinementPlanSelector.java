package com.z254.conductor.workflow;

import com.z254.conductor.domain.model.QualityReport;
import com.z254.conductor.domain.model.WorkflowPlan;

/**
 * Chooses the reduced plan run by the refinement pass.
 */
public interface RefinementPlanSelector {

    String METADATA_REFINEMENT_TYPE = "refinementType";

    WorkflowPlan select(String workflowId, String domain, QualityReport feedback);
}
