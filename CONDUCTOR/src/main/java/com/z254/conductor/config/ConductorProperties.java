package com.z254.conductor.config;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for CONDUCTOR service.
 */
@Data
@Component
@ConfigurationProperties(prefix = "conductor")
public class ConductorProperties {

    private RetrievalProperties retrieval = new RetrievalProperties();
    private SourceProperties source = new SourceProperties();
    private WorkflowProperties workflow = new WorkflowProperties();
    private DelegationProperties delegation = new DelegationProperties();
    private ExternalApiProperties externalApi = new ExternalApiProperties();
    private QualityProperties quality = new QualityProperties();

    @Data
    public static class RetrievalProperties {
        private boolean enabled = true;
        private int defaultMatchCount = 5;
        private double relevanceThreshold = 0.7;
        private boolean cacheEnabled = true;
        private Duration cacheTtl = Duration.ofSeconds(300);
        private long maxCacheEntries = 1000;
        private Duration strategyTimeout = Duration.ofSeconds(30);
        private int historySize = 100;
        private int specializedTermLimit = 3;
        private int specializedMatchCount = 2;
        private Map<String, DomainProfile> domains = defaultDomainProfiles();
    }

    /**
     * Search profile for one psychology domain.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DomainProfile {
        private List<String> priorityTerms = new ArrayList<>();
        private List<String> requiredDomains = new ArrayList<>();
        private List<String> searchModifiers = new ArrayList<>();
    }

    @Data
    public static class SourceProperties {
        private ClientMode mode = ClientMode.SIMULATED;
        private String baseUrl;
        private String knowledgeBasePath = "/api/v1/rag/search";
        private String codeExamplesPath = "/api/v1/rag/code-examples";
        private Duration timeout = Duration.ofSeconds(30);
    }

    @Data
    public static class WorkflowProperties {
        private double qualityThreshold = 0.8;
        private Duration taskTimeout = Duration.ofSeconds(30);
        private int maxParallelTasks = 8;
        private boolean refinementEnabled = true;
        private boolean checkpointsEnabled = true;
        private String defaultContentType = "therapeutic-program";
        private String defaultDomain = "general-psychology";
    }

    @Data
    public static class DelegationProperties {
        private ClientMode mode = ClientMode.SIMULATED;
        private String baseUrl;
        private String delegatePath = "/api/v1/agents/{agentType}/tasks";
        private Duration simulatedLatency = Duration.ZERO;
        private Duration timeout = Duration.ofSeconds(30);
    }

    @Data
    public static class ExternalApiProperties {
        private int maxConcurrentRequests = 10;
        private Duration rateLimitWindow = Duration.ofSeconds(60);
        private int maxRequestsPerWindow = 100;
        private Duration timeout = Duration.ofSeconds(30);
        private Duration slotWaitTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class QualityProperties {
        private int minContentLength = 200;
        private int expectedSections = 3;
    }

    public enum ClientMode {
        SIMULATED,
        REMOTE,
        NONE
    }

    private static Map<String, DomainProfile> defaultDomainProfiles() {
        Map<String, DomainProfile> profiles = new LinkedHashMap<>();
        profiles.put("clinical-psychology", new DomainProfile(
                new ArrayList<>(List.of("evidence-based", "clinical-trial", "therapy", "treatment", "diagnosis")),
                new ArrayList<>(List.of("clinical", "therapeutic", "medical")),
                new ArrayList<>(List.of("efficacy", "safety", "contraindications"))));
        profiles.put("educational-psychology", new DomainProfile(
                new ArrayList<>(List.of("learning", "pedagogy", "curriculum", "assessment", "instruction")),
                new ArrayList<>(List.of("educational", "academic", "learning")),
                new ArrayList<>(List.of("age-appropriate", "developmental", "outcomes"))));
        profiles.put("organizational-psychology", new DomainProfile(
                new ArrayList<>(List.of("workplace", "organizational", "leadership", "team", "performance")),
                new ArrayList<>(List.of("business", "organizational", "management")),
                new ArrayList<>(List.of("roi", "implementation", "culture"))));
        profiles.put("health-psychology", new DomainProfile(
                new ArrayList<>(List.of("health-behavior", "wellness", "prevention", "chronic-disease")),
                new ArrayList<>(List.of("health", "medical", "behavioral")),
                new ArrayList<>(List.of("intervention", "outcome", "adherence"))));
        return profiles;
    }
}
