package kinet.newsfeed;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

/**
 * Runtime settings. {@link #fromEnv()} reads {@code NEWSFEED_*} variables, falling back to defaults.
 */
public record NewsFeedConfig(Path profileDir, double callsPerSecond, int workers, int enrichWorkers,
                             Duration taskTimeout, int taskRetries, Duration retryDelay,
                             Duration fetchTimeout, String renderUrl, Duration profileMaxAge) {

    public static NewsFeedConfig defaults() {
        return from(Map.of());
    }

    public static NewsFeedConfig fromEnv() {
        return from(System.getenv());
    }

    static NewsFeedConfig from(Map<String, String> env) {
        String render = env.get("NEWSFEED_RENDER_URL");
        return new NewsFeedConfig(
                Path.of(env.getOrDefault("NEWSFEED_PROFILE_DIR", "profiles")),
                Double.parseDouble(env.getOrDefault("NEWSFEED_CALLS_PER_SECOND", "3")),
                intOf(env, "NEWSFEED_WORKERS", 8),
                intOf(env, "NEWSFEED_ENRICH_WORKERS", 15),
                Duration.ofSeconds(intOf(env, "NEWSFEED_TASK_TIMEOUT_SECONDS", 90)),
                intOf(env, "NEWSFEED_TASK_RETRIES", 2),
                Duration.ofMillis(intOf(env, "NEWSFEED_RETRY_DELAY_MILLIS", 1000)),
                Duration.ofSeconds(intOf(env, "NEWSFEED_FETCH_TIMEOUT_SECONDS", 15)),
                render == null || render.isBlank() ? null : render.strip(),
                Duration.ofHours(intOf(env, "NEWSFEED_PROFILE_MAX_AGE_HOURS", 0)));
    }

    private static int intOf(Map<String, String> env, String key, int def) {
        String v = env.get(key);
        if (v == null || v.isBlank()) return def;
        try {
            return Integer.parseInt(v.strip());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " is not a number: " + v, e);
        }
    }
}
