package com.z254.conductor.api.v1;

import com.z254.conductor.api.dto.KnowledgeSearchRequest;
import com.z254.conductor.domain.model.CandidateDocument;
import com.z254.conductor.domain.model.KnowledgeContext;
import com.z254.conductor.orchestration.ContentOrchestrator;
import com.z254.conductor.retrieval.KnowledgeRetrievalService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * REST controller for knowledge retrieval.
 */
@RestController
@RequestMapping("/api/v1/knowledge")
@Tag(name = "Knowledge", description = "Knowledge retrieval operations")
@Slf4j
public class KnowledgeController {

    private final ContentOrchestrator orchestrator;
    private final KnowledgeRetrievalService retrievalService;

    public KnowledgeController(ContentOrchestrator orchestrator, KnowledgeRetrievalService retrievalService) {
        this.orchestrator = orchestrator;
        this.retrievalService = retrievalService;
    }

    @PostMapping("/search")
    @Operation(summary = "Search knowledge", description = "Ranked documents from all search strategies")
    @ApiResponse(responseCode = "200", description = "Search finished, possibly with no results")
    public Mono<ResponseEntity<List<CandidateDocument>>> search(@Valid @RequestBody KnowledgeSearchRequest request) {
        return orchestrator.searchRelevantKnowledge(request.getQuery(), request.getDomain(), request.toOptions())
                .map(ResponseEntity::ok);
    }

    @PostMapping("/context")
    @Operation(summary = "Prepare knowledge context",
               description = "Search, then digest the results per source for a task type")
    @ApiResponse(responseCode = "200", description = "Context prepared")
    public Mono<ResponseEntity<KnowledgeContext>> prepareContext(@Valid @RequestBody KnowledgeSearchRequest request) {
        String taskType = request.getTaskType() != null ? request.getTaskType() : "general";
        return retrievalService.search(request.getQuery(), request.getDomain(), request.toOptions())
                .map(results -> retrievalService.prepareContext(results, taskType))
                .map(ResponseEntity::ok);
    }

    @DeleteMapping("/cache")
    @Operation(summary = "Reset retrieval state", description = "Clear the cache, search history and counters")
    @ApiResponse(responseCode = "204", description = "Reset")
    public Mono<ResponseEntity<Void>> reset() {
        return Mono.fromRunnable(retrievalService::reset)
                .then(Mono.just(ResponseEntity.noContent().<Void>build()));
    }
}
