package kinet.newsfeed.profile;

import com.fasterxml.jackson.databind.ObjectMapper;
import kinet.newsfeed.net.Urls;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Maps a site's canonical domain to its last detected profile. Reads never throw:
 * a missing, unreadable or expired entry is a miss.
 */
public class ProfileCache {
    private static final Logger log = LoggerFactory.getLogger(ProfileCache.class);

    private final ProfileStore store;
    private final ObjectMapper mapper;
    private final Duration maxAge;
    private final Clock clock;

    /**
     * @param maxAge profiles older than this are treated as absent; {@link Duration#ZERO} keeps them forever
     */
    public ProfileCache(ProfileStore store, ObjectMapper mapper, Duration maxAge, Clock clock) {
        this.store = store;
        this.mapper = mapper;
        this.maxAge = maxAge;
        this.clock = clock;
    }

    public Optional<Profile> get(String url) {
        String domain = Urls.domainOf(url);
        if (domain.isEmpty()) return Optional.empty();
        try {
            Optional<byte[]> bytes = store.get(keyFor(domain));
            if (bytes.isEmpty()) return Optional.empty();
            Profile profile = mapper.readValue(bytes.get(), Profile.class);
            if (isExpired(profile)) {
                log.info("Cached profile for {} is older than {}h, ignoring", domain, maxAge.toHours());
                return Optional.empty();
            }
            return Optional.of(profile);
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Unreadable profile for {}: {}", domain, e.getMessage());
            return Optional.empty();
        }
    }

    public void save(String url, Profile profile) throws IOException {
        String domain = Urls.domainOf(url);
        if (domain.isEmpty()) throw new IllegalArgumentException("No host in " + url);
        store.put(keyFor(domain), mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(profile));
    }

    /** @return false when nothing was cached for the domain */
    public boolean delete(String domain) throws IOException {
        String d = Urls.canonicalDomain(domain);
        if (d.isEmpty()) return false;
        return store.delete(keyFor(d));
    }

    public List<CachedProfile> list() throws IOException {
        List<CachedProfile> out = new ArrayList<>();
        for (String key : store.keys()) {
            try {
                Optional<byte[]> bytes = store.get(key);
                if (bytes.isEmpty()) continue;
                Profile p = mapper.readValue(bytes.get(), Profile.class);
                out.add(new CachedProfile(p.domain(), p.baseUrl(), p.requiresJs(),
                        SearchStrategy.describe(p.strategy()), p.detectedAt()));
            } catch (IOException | IllegalArgumentException e) {
                log.warn("Skipping unreadable profile {}: {}", key, e.getMessage());
            }
        }
        return out;
    }

    private boolean isExpired(Profile p) {
        if (maxAge.isZero() || maxAge.isNegative() || p.detectedAt() == null) return false;
        return p.detectedAt().plus(maxAge).isBefore(clock.instant());
    }

    /** Store-safe key: {@code example.co.uk} becomes {@code example_co_uk}. */
    static String keyFor(String domain) {
        return domain.replaceAll("[^a-z0-9-]", "_");
    }
}
