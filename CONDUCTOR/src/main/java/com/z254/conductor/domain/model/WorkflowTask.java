package com.z254.conductor.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * A unit of delegated work. Opaque to the executor.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class WorkflowTask {

    String name;

    /**
     * Logical agent the task is delegated to.
     */
    String agentType;

    @Singular("payloadEntry")
    Map<String, Object> payload;
}
