package com.z254.conductor.api.v1;

import com.z254.conductor.domain.model.OrchestratorStatus;
import com.z254.conductor.orchestration.ContentOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * REST controller for orchestrator status.
 */
@RestController
@RequestMapping("/api/v1/status")
@Tag(name = "Status", description = "Orchestrator status")
public class StatusController {

    private final ContentOrchestrator orchestrator;

    public StatusController(ContentOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @GetMapping
    @Operation(summary = "Get status", description = "Workflow, retrieval and external API statistics")
    @ApiResponse(responseCode = "200", description = "Status snapshot")
    public Mono<ResponseEntity<OrchestratorStatus>> getStatus() {
        return Mono.fromCallable(orchestrator::getStatus)
                .map(ResponseEntity::ok);
    }
}
