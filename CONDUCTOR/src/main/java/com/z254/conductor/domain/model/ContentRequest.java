package com.z254.conductor.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Request for a piece of online support content.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContentRequest {

    /**
     * Content type, e.g. therapeutic-program or assessment-tool.
     */
    private String type;

    private String description;
    private String domain;
    private String targetAudience;
    private String culturalContext;
    private boolean accessibility;

    @Builder.Default
    private List<String> objectives = new ArrayList<>();

    @Builder.Default
    private Map<String, Object> parameters = new HashMap<>();
}
