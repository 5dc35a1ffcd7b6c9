package com.z254.conductor.workflow.impl;

import com.z254.conductor.config.ConductorProperties;
import com.z254.conductor.domain.model.CandidateDocument;
import com.z254.conductor.domain.model.ContentRequest;
import com.z254.conductor.domain.model.Phase;
import com.z254.conductor.domain.model.WorkflowPlan;
import com.z254.conductor.domain.model.WorkflowTask;
import com.z254.conductor.workflow.WorkflowPlanner;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Builds plans from content-type templates, then applies complexity, domain and
 * request-specific rules, knowledge integration points, timing and quality checkpoints.
 */
@Slf4j
public class TemplateWorkflowPlanner implements WorkflowPlanner {

    static final String DEFAULT_TEMPLATE = "therapeutic-program";
    static final Duration AGENT_TIME = Duration.ofMinutes(3);
    static final int MAX_KNOWLEDGE_DOCUMENTS = 5;
    static final double KNOWLEDGE_RELEVANCE_FLOOR = 0.7;

    private static final Map<String, Template> TEMPLATES = Map.of(
            "therapeutic-program", new Template(Duration.ofMinutes(30), List.of(
                    phase("research", false, true, "research"),
                    phase("assessment", false, true, "test-generator"),
                    phase("architecture", false, true, "architect"),
                    phase("content-generation", true, true, "nlp-generator", "technique-designer"),
                    phase("integration", false, true, "integrator"),
                    phase("validation", false, true, "quality-guardian"))),
            "assessment-tool", new Template(Duration.ofMinutes(20), List.of(
                    phase("research", false, true, "research"),
                    phase("psychometric-design", true, true, "test-generator", "psychometrician"),
                    phase("validation-design", false, true, "quality-guardian"),
                    phase("implementation", false, false, "nlp-generator"))),
            "technique-library", new Template(Duration.ofMinutes(15), List.of(
                    phase("research", false, true, "research"),
                    phase("technique-development", true, true, "nlp-generator", "technique-designer"),
                    phase("categorization", false, false, "architect"),
                    phase("validation", false, true, "quality-guardian"))),
            "comprehensive-program", new Template(Duration.ofMinutes(60), List.of(
                    phase("strategic-research", true, true, "research", "domain-expert"),
                    phase("needs-assessment", false, true, "test-generator"),
                    phase("program-architecture", true, true, "architect", "curriculum-designer"),
                    phase("content-creation", true, true, "nlp-generator", "technique-designer", "assessment-creator"),
                    phase("integration-synthesis", false, true, "integrator"),
                    phase("quality-assurance", true, true, "quality-guardian", "peer-reviewer"),
                    phase("pilot-preparation", false, false, "implementation-specialist")))
    );

    private static final Map<String, DomainRule> DOMAIN_RULES = Map.of(
            "clinical-psychology", new DomainRule(
                    List.of("clinical-expert", "ethics-reviewer"),
                    List.of("ethical-review", "clinical-validation")),
            "educational-psychology", new DomainRule(
                    List.of("pedagogy-expert", "curriculum-designer"),
                    List.of("educational-alignment", "learning-outcome-validation")),
            "organizational-psychology", new DomainRule(
                    List.of("organizational-expert", "change-management"),
                    List.of("stakeholder-analysis", "implementation-planning")),
            "research-psychology", new DomainRule(
                    List.of("research-methodologist", "statistical-analyst"),
                    List.of("methodology-design", "statistical-planning"))
    );

    private static final double[] COMPLEXITY_TIME_MULTIPLIERS = {1.0, 1.2, 1.5, 2.0, 2.5};

    private static final Map<String, List<String>> KNOWLEDGE_QUERIES = Map.of(
            "research", List.of("methodology", "evidence-base", "best-practices"),
            "architecture", List.of("framework", "structure", "design-patterns"),
            "content-generation", List.of("templates", "examples", "techniques")
    );

    private final ConductorProperties.WorkflowProperties config;

    public TemplateWorkflowPlanner(ConductorProperties conductorProperties) {
        this.config = conductorProperties.getWorkflow();
    }

    @Override
    public Mono<WorkflowPlan> plan(ContentRequest request, List<CandidateDocument> knowledge) {
        return Mono.fromCallable(() -> buildPlan(request, knowledge != null ? knowledge : List.of()));
    }

    WorkflowPlan buildPlan(ContentRequest request, List<CandidateDocument> knowledge) {
        String contentType = request.getType() != null ? request.getType() : config.getDefaultContentType();
        String domain = request.getDomain() != null ? request.getDomain() : config.getDefaultDomain();
        int complexity = assessComplexity(request);

        Template template = TEMPLATES.getOrDefault(contentType, TEMPLATES.get(DEFAULT_TEMPLATE));
        List<PhaseSpec> phases = template.phases.stream().map(PhaseSpec::copy).collect(Collectors.toList());

        applyComplexityRules(phases, complexity);
        applyDomainRules(phases, domain);
        addDynamicPhases(phases, request);
        optimizeAgentAllocation(phases);
        if (!knowledge.isEmpty()) {
            addKnowledgeIntegrationPoints(phases, knowledge);
        }
        Duration estimatedDuration = estimateDuration(phases);
        if (config.isCheckpointsEnabled()) {
            addQualityCheckpoints(phases);
        }

        WorkflowPlan plan = WorkflowPlan.builder()
                .planId("wf_" + UUID.randomUUID().toString().substring(0, 12))
                .contentType(contentType)
                .domain(domain)
                .complexity(complexity)
                .estimatedDuration(estimatedDuration)
                .phases(phases.stream().map(PhaseSpec::toPhase).collect(Collectors.toList()))
                .metadataEntry("templateDuration", scaled(template.baseDuration, complexity))
                .metadataEntry("totalAgents", phases.stream().flatMap(p -> p.agents.stream()).distinct().count())
                .metadataEntry("criticalPhases", phases.stream().filter(p -> p.critical).count())
                .build();

        log.info("Created workflow plan {} for {} / {} with {} phases and {} tasks (complexity {})",
                plan.getPlanId(), contentType, domain, plan.getPhases().size(), plan.getTaskCount(), complexity);
        return plan;
    }

    /**
     * Complexity from 1 to 5 derived from the size of the request.
     */
    public static int assessComplexity(ContentRequest request) {
        int complexity = 1;
        if (request.getObjectives() != null && request.getObjectives().size() > 3) complexity++;
        if (request.getDescription() != null && request.getDescription().length() > 1000) complexity++;
        if (request.getParameters() != null && request.getParameters().size() > 5) complexity++;
        if ("comprehensive-program".equals(request.getType())) complexity += 2;
        return Math.min(complexity, 5);
    }

    private void applyComplexityRules(List<PhaseSpec> phases, int complexity) {
        if (complexity >= 4) {
            phases.add(phase("peer-review", true, false, "peer-reviewer", "domain-expert"));
        }
        if (complexity == 5) {
            phases.add(phase("expert-consultation", false, true, "senior-expert", "methodology-expert"));
        }
    }

    private void applyDomainRules(List<PhaseSpec> phases, String domain) {
        DomainRule rule = DOMAIN_RULES.get(domain);
        if (rule == null) {
            return;
        }
        phases.forEach(phase -> rule.requiredAgents.forEach(agent -> {
            if (!phase.agents.contains(agent)) {
                phase.agents.add(agent);
            }
        }));
        for (String phaseName : rule.additionalPhases) {
            boolean present = phases.stream().anyMatch(p -> p.name.equals(phaseName));
            if (!present) {
                phases.add(new PhaseSpec(phaseName, false, true, new ArrayList<>(rule.requiredAgents)));
            }
        }
    }

    private void addDynamicPhases(List<PhaseSpec> phases, ContentRequest request) {
        if (notBlank(request.getTargetAudience())) {
            PhaseSpec audience = phase("audience-adaptation", false, false, "audience-specialist", "adaptation-expert");
            int validationIndex = indexOf(phases, "validation");
            if (validationIndex > -1) {
                phases.add(validationIndex, audience);
            } else {
                phases.add(audience);
            }
        }
        if (notBlank(request.getCulturalContext())) {
            phases.add(phase("cultural-adaptation", false, true, "cultural-expert", "adaptation-specialist"));
        }
        if (request.isAccessibility()) {
            phases.add(phase("accessibility-optimization", false, false, "accessibility-expert", "inclusive-design"));
        }
    }

    private void optimizeAgentAllocation(List<PhaseSpec> phases) {
        for (PhaseSpec phase : phases) {
            List<String> unique = new ArrayList<>(new LinkedHashSet<>(phase.agents));
            phase.agents.clear();
            phase.agents.addAll(unique);
            if (phase.parallel && phase.agents.size() < 2) {
                phase.parallel = false;
            }
        }
    }

    private void addKnowledgeIntegrationPoints(List<PhaseSpec> phases, List<CandidateDocument> knowledge) {
        for (PhaseSpec phase : phases) {
            List<String> queries = KNOWLEDGE_QUERIES.get(phase.name);
            if (queries == null) {
                continue;
            }
            phase.knowledgeDocumentIds = knowledge.stream()
                    .filter(doc -> doc.getRawRelevance() != null && doc.getRawRelevance() > KNOWLEDGE_RELEVANCE_FLOOR)
                    .filter(doc -> doc.hasCategory(phase.name))
                    .limit(MAX_KNOWLEDGE_DOCUMENTS)
                    .map(CandidateDocument::getId)
                    .collect(Collectors.toList());
            phase.knowledgeQueries = queries;
        }
    }

    Duration estimateDuration(List<PhaseSpec> phases) {
        long total = 0;
        long current = 0;
        long previousStart = 0;
        for (int i = 0; i < phases.size(); i++) {
            PhaseSpec phase = phases.get(i);
            long phaseTime = estimatePhaseTime(phase);
            if (phase.parallel && i > 0) {
                // starts together with its predecessor
                total = Math.max(total, previousStart + phaseTime);
            } else {
                previousStart = current;
                current += phaseTime;
                total = current;
            }
        }
        return Duration.ofMillis(total);
    }

    private static long estimatePhaseTime(PhaseSpec phase) {
        double time = phase.agents.size() * (double) AGENT_TIME.toMillis();
        if (phase.critical) time *= 1.5;
        if (phase.parallel) time /= 1.5;
        return (long) time;
    }

    /**
     * Inserts a checkpoint every {@code ceil(n / 3)} positions. Plans with fewer than four
     * phases get none: an interval of one would advance no faster than the list grows.
     */
    static void addQualityCheckpoints(List<PhaseSpec> phases) {
        int interval = (int) Math.ceil(phases.size() / 3.0);
        if (interval < 2) {
            return;
        }
        for (int i = interval; i < phases.size(); i += interval) {
            phases.add(i, phase("quality-checkpoint-" + (i / interval), false, false, "quality-guardian"));
        }
    }

    private static Duration scaled(Duration base, int complexity) {
        return Duration.ofMillis((long) (base.toMillis() * COMPLEXITY_TIME_MULTIPLIERS[complexity - 1]));
    }

    private static int indexOf(List<PhaseSpec> phases, String name) {
        for (int i = 0; i < phases.size(); i++) {
            if (phases.get(i).name.equals(name)) {
                return i;
            }
        }
        return -1;
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }

    private static PhaseSpec phase(String name, boolean parallel, boolean critical, String... agents) {
        return new PhaseSpec(name, parallel, critical, new ArrayList<>(Arrays.asList(agents)));
    }

    private static final class Template {
        private final Duration baseDuration;
        private final List<PhaseSpec> phases;

        private Template(Duration baseDuration, List<PhaseSpec> phases) {
            this.baseDuration = baseDuration;
            this.phases = phases;
        }
    }

    private static final class DomainRule {
        private final List<String> requiredAgents;
        private final List<String> additionalPhases;

        private DomainRule(List<String> requiredAgents, List<String> additionalPhases) {
            this.requiredAgents = requiredAgents;
            this.additionalPhases = additionalPhases;
        }
    }

    /**
     * Mutable phase under construction.
     */
    static final class PhaseSpec {
        private final String name;
        private boolean parallel;
        private final boolean critical;
        private final List<String> agents;
        private List<String> knowledgeDocumentIds = List.of();
        private List<String> knowledgeQueries = List.of();

        PhaseSpec(String name, boolean parallel, boolean critical, List<String> agents) {
            this.name = name;
            this.parallel = parallel;
            this.critical = critical;
            this.agents = agents;
        }

        PhaseSpec copy() {
            return new PhaseSpec(name, parallel, critical, new ArrayList<>(agents));
        }

        Phase toPhase() {
            Phase.PhaseBuilder builder = Phase.builder()
                    .name(name)
                    .parallel(parallel)
                    .critical(critical);
            for (String agent : agents) {
                WorkflowTask.WorkflowTaskBuilder task = WorkflowTask.builder()
                        .name(name + ":" + agent)
                        .agentType(agent)
                        .payloadEntry("phase", name);
                if (!knowledgeQueries.isEmpty()) {
                    task.payloadEntry("knowledgeDocumentIds", knowledgeDocumentIds);
                    task.payloadEntry("knowledgeQueries", knowledgeQueries);
                }
                builder.task(task.build());
            }
            return builder.build();
        }
    }
}
