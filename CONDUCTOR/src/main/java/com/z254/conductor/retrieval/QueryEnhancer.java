package com.z254.conductor.retrieval;

import com.z254.conductor.config.ConductorProperties.DomainProfile;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Appends the domain's leading priority term and, when the raw query asks about
 * assessment or treatment, the matching search modifier.
 */
@Component
public class QueryEnhancer {

    private final DomainSearchProfiles profiles;

    public QueryEnhancer(DomainSearchProfiles profiles) {
        this.profiles = profiles;
    }

    public String enhance(String query, String domain) {
        Optional<DomainProfile> profile = profiles.find(domain);
        if (profile.isEmpty()) {
            return query;
        }

        StringBuilder enhanced = new StringBuilder(query);
        List<String> priorityTerms = profile.get().getPriorityTerms();
        if (!priorityTerms.isEmpty()) {
            enhanced.append(' ').append(priorityTerms.get(0));
        }

        selectModifier(query.toLowerCase(Locale.ROOT), profile.get().getSearchModifiers())
                .ifPresent(modifier -> enhanced.append(' ').append(modifier));
        return enhanced.toString();
    }

    Optional<String> selectModifier(String lowerQuery, List<String> modifiers) {
        if (lowerQuery.contains("assess")) {
            return firstContaining(modifiers, "outcome");
        }
        if (lowerQuery.contains("treat") || lowerQuery.contains("intervention")) {
            return firstContaining(modifiers, "efficacy", "implementation");
        }
        return Optional.empty();
    }

    private static Optional<String> firstContaining(List<String> modifiers, String... needles) {
        for (String modifier : modifiers) {
            for (String needle : needles) {
                if (modifier.contains(needle)) {
                    return Optional.of(modifier);
                }
            }
        }
        return Optional.empty();
    }
}
