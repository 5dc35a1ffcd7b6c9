package com.z254.conductor.api.dto;

import com.z254.conductor.domain.model.ContentRequest;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Request DTO for creating a piece of content.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContentCreationRequest {

    private String type;

    @NotBlank(message = "Description is required")
    @Size(max = 10000, message = "Description must be less than 10000 characters")
    private String description;

    private String domain;

    private String targetAudience;

    private String culturalContext;

    private boolean accessibility;

    private List<String> objectives;

    private Map<String, Object> parameters;

    /**
     * Convert to domain model.
     */
    public ContentRequest toContentRequest() {
        return ContentRequest.builder()
                .type(type)
                .description(description)
                .domain(domain)
                .targetAudience(targetAudience)
                .culturalContext(culturalContext)
                .accessibility(accessibility)
                .objectives(objectives != null ? new ArrayList<>(objectives) : new ArrayList<>())
                .parameters(parameters != null ? new HashMap<>(parameters) : new HashMap<>())
                .build();
    }
}
