package kinet.newsfeed.profile;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Extraction recipe for one site. API profiles carry no selectors; every other
 * strategy must have them.
 */
public record Profile(String baseUrl, String domain, SearchStrategy strategy, boolean requiresJs,
                      Selectors selectors, List<String> cleaningRules, boolean deepScrape,
                      Instant detectedAt) {

    public Profile {
        Objects.requireNonNull(baseUrl, "baseUrl");
        Objects.requireNonNull(domain, "domain");
        Objects.requireNonNull(strategy, "strategy");
        if (strategy instanceof SearchStrategy.Api) {
            if (selectors != null) throw new IllegalArgumentException("API profile must not carry selectors");
        } else if (selectors == null) {
            throw new IllegalArgumentException("HTML profile needs selectors");
        }
        cleaningRules = cleaningRules == null ? List.of() : List.copyOf(cleaningRules);
    }

    public boolean usesApi() {
        return strategy instanceof SearchStrategy.Api;
    }
}
