package com.z254.conductor.workflow.impl;

import com.z254.conductor.domain.model.PhaseResult;
import com.z254.conductor.domain.model.TaskResult;
import com.z254.conductor.workflow.ContentIntegrator;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * One markdown section per phase with successful output, in execution order.
 */
public class SectionedContentIntegrator implements ContentIntegrator {

    @Override
    public Mono<String> merge(Map<String, PhaseResult> phaseResults) {
        return Mono.fromCallable(() -> phaseResults.values().stream()
                .map(SectionedContentIntegrator::section)
                .filter(section -> !section.isEmpty())
                .collect(Collectors.joining("\n\n")));
    }

    private static String section(PhaseResult phase) {
        List<String> outputs = phase.getTaskResults().stream()
                .filter(TaskResult::isSuccess)
                .map(TaskResult::getOutput)
                .filter(output -> output != null && !output.isBlank())
                .collect(Collectors.toList());
        if (outputs.isEmpty()) {
            return "";
        }
        return "## " + phase.getPhaseName() + "\n\n" + String.join("\n\n", outputs);
    }
}
