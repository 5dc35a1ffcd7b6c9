package com.z254.conductor.api.v1;

import com.z254.conductor.api.dto.ContentCreationRequest;
import com.z254.conductor.domain.model.ContentResult;
import com.z254.conductor.orchestration.ContentOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * REST controller for content creation.
 */
@RestController
@RequestMapping("/api/v1/content")
@Tag(name = "Content", description = "Content workflow operations")
@Slf4j
public class ContentController {

    private final ContentOrchestrator orchestrator;

    public ContentController(ContentOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping
    @Operation(summary = "Create content",
               description = "Plan and run a content workflow; failed workflows are reported in the body")
    @ApiResponse(responseCode = "200", description = "Workflow finished")
    @ApiResponse(responseCode = "400", description = "Invalid request")
    public Mono<ResponseEntity<ContentResult>> createContent(@Valid @RequestBody ContentCreationRequest request) {
        log.info("Creating {} content for domain {}", request.getType(), request.getDomain());

        return orchestrator.createContent(request.toContentRequest())
                .map(ResponseEntity::ok)
                .doOnSuccess(r -> log.info("Workflow {} finished - success={}",
                        r.getBody().getWorkflowId(), r.getBody().isSuccess()));
    }
}
