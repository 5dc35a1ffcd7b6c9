package com.z254.conductor.retrieval;

import com.z254.conductor.config.ConductorProperties;
import com.z254.conductor.config.ConductorProperties.DomainProfile;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Domain search profiles and the source-side domain filter.
 */
@Component
public class DomainSearchProfiles {

    // First matching key wins
    private static final Map<String, String> SOURCE_FILTERS = new LinkedHashMap<>();

    static {
        SOURCE_FILTERS.put("clinical", "clinical");
        SOURCE_FILTERS.put("educational", "education");
        SOURCE_FILTERS.put("organizational", "business");
        SOURCE_FILTERS.put("health", "health");
        SOURCE_FILTERS.put("positive", "wellbeing");
        SOURCE_FILTERS.put("cognitive", "cognitive");
        SOURCE_FILTERS.put("social", "social");
    }

    private final Map<String, DomainProfile> profiles;

    @Autowired
    public DomainSearchProfiles(ConductorProperties conductorProperties) {
        this(conductorProperties.getRetrieval().getDomains());
    }

    public DomainSearchProfiles(Map<String, DomainProfile> profiles) {
        this.profiles = profiles == null ? Map.of() : Map.copyOf(profiles);
    }

    public Optional<DomainProfile> find(String domain) {
        return domain == null ? Optional.empty() : Optional.ofNullable(profiles.get(domain));
    }

    /**
     * Source-side filter for a domain, or null when the source should not filter.
     */
    public String sourceFilter(String domain) {
        if (domain == null) {
            return null;
        }
        for (Map.Entry<String, String> entry : SOURCE_FILTERS.entrySet()) {
            if (domain.contains(entry.getKey())) {
                return entry.getValue();
            }
        }
        return null;
    }
}
