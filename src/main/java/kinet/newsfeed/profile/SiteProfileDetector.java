package kinet.newsfeed.profile;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import kinet.newsfeed.net.FetchException;
import kinet.newsfeed.net.FetchedPage;
import kinet.newsfeed.net.PageFetcher;
import kinet.newsfeed.net.Urls;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;

/**
 * Probes a site and produces its {@link Profile}. When nothing works the result is a
 * conservative fallback profile. An interrupted caller gets a {@link CancellationException}
 * instead, so a fallback always means every probe really failed.
 */
public class SiteProfileDetector {
    private static final Logger log = LoggerFactory.getLogger(SiteProfileDetector.class);

    public static final String DEFAULT_SAMPLE_QUERY = "news";
    static final int MIN_PAGE_BYTES = 1000;

    static final List<String> API_PATHS = List.of(
            "/api/search?q={query}",
            "/api/articles?search={query}",
            "/wp-json/wp/v2/posts?search={query}",
            "/api/v1/search?query={query}",
            "/graphql");

    static final List<String> SEARCH_PATHS = List.of(
            "/search?q={query}",
            "/search?query={query}",
            "/search?search={query}",
            "/search/{query}",
            "/?s={query}",
            "/?search={query}",
            "/news",
            "/news/latest",
            "/latest",
            "/articles",
            "/stories",
            "/category/news",
            "/news/all",
            "",
            "/index.html");

    private final PageFetcher fetcher;
    private final ObjectMapper mapper;
    private final Duration apiTimeout;
    private final Duration pageTimeout;
    private final Clock clock;

    public SiteProfileDetector(PageFetcher fetcher, ObjectMapper mapper, Clock clock) {
        this(fetcher, mapper, Duration.ofSeconds(10), Duration.ofSeconds(15), clock);
    }

    public SiteProfileDetector(PageFetcher fetcher, ObjectMapper mapper,
                               Duration apiTimeout, Duration pageTimeout, Clock clock) {
        this.fetcher = fetcher;
        this.mapper = mapper;
        this.apiTimeout = apiTimeout;
        this.pageTimeout = pageTimeout;
        this.clock = clock;
    }

    public Profile detectProfile(String baseUrl) {
        return detectProfile(baseUrl, DEFAULT_SAMPLE_QUERY);
    }

    public Profile detectProfile(String baseUrl, String sampleQuery) {
        String base = Urls.stripTrailingSlash(Urls.withScheme(baseUrl));
        String query = sampleQuery == null || sampleQuery.isBlank() ? DEFAULT_SAMPLE_QUERY : sampleQuery.strip();
        try {
            Optional<Profile> api = detectApi(base, query);
            if (api.isPresent()) {
                log.info("API endpoint detected for {}: {}", base, SearchStrategy.describe(api.get().strategy()));
                return api.get();
            }

            Optional<Probe> probe = probeListingPages(base, query);
            if (probe.isEmpty()) {
                checkCancelled(base);
                log.warn("No usable search or listing page on {}, using fallback profile", base);
                return fallback(base);
            }
            return fromPage(base, probe.get());
        } catch (CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            checkCancelled(base);
            log.warn("Profile detection error for {}: {}", base, e.toString());
            return fallback(base);
        }
    }

    Optional<Profile> detectApi(String base, String query) {
        for (String path : API_PATHS) {
            checkCancelled(base);
            String url = base + path.replace("{query}", encode(query));
            try {
                FetchedPage page = fetcher.fetch(url, apiTimeout);
                JsonNode json = mapper.readTree(page.body());
                if (json != null && (json.isArray() || json.isObject()) && json.size() > 0) {
                    String endpoint = base + path;
                    return Optional.of(new Profile(base, Urls.domainOf(base),
                            new SearchStrategy.Api(endpoint, ApiKind.classify(endpoint)),
                            false, null, List.of(), false, clock.instant()));
                }
            } catch (FetchException e) {
                log.debug("API probe {} failed: {}", url, e.getMessage());
            } catch (IOException e) {
                log.debug("API probe {} is not JSON: {}", url, e.getMessage());
            }
        }
        return Optional.empty();
    }

    Optional<Probe> probeListingPages(String base, String query) {
        for (String path : SEARCH_PATHS) {
            checkCancelled(base);
            String url = base + path.replace("{query}", encode(query));
            try {
                FetchedPage page = fetcher.fetch(url, pageTimeout);
                if (page.size() < MIN_PAGE_BYTES) {
                    log.debug("Probe {}: only {} bytes", url, page.size());
                    continue;
                }
                Document doc = Jsoup.parse(page.text(), url);
                if (JsRequirement.hasMeaningfulContent(doc)) {
                    log.info("Found working URL: {}", url);
                    SearchStrategy strategy = path.contains("{query}")
                            ? new SearchStrategy.SearchUrl(base + path)
                            : new SearchStrategy.Homepage(path.isEmpty() ? base : url);
                    return Optional.of(new Probe(strategy, doc, page.size()));
                }
                log.debug("Probe {}: no article-like content", url);
            } catch (FetchException e) {
                log.debug("Probe {} failed: {}", url, e.getMessage());
            }
        }
        return Optional.empty();
    }

    private Profile fromPage(String base, Probe probe) {
        Document doc = probe.doc();
        String domain = Urls.domainOf(base);
        boolean requiresJs = JsRequirement.requiresJs(doc, probe.responseBytes());
        Selectors selectors = new Selectors(
                SelectorSynthesizer.containers(doc),
                SelectorSynthesizer.headlines(doc),
                SelectorSynthesizer.descriptions(doc),
                SelectorSynthesizer.content(doc),
                SelectorSynthesizer.dates(doc),
                SelectorSynthesizer.authors(doc),
                LinkFilterRules.forDomain(domain));
        log.debug("Profile for {}: js={} containers={}", base, requiresJs, selectors.containers());
        return new Profile(base, domain, probe.strategy(), requiresJs, selectors,
                SelectorSynthesizer.cleaningRules(doc), true, clock.instant());
    }

    public Profile fallback(String baseUrl) {
        String base = Urls.stripTrailingSlash(Urls.withScheme(baseUrl));
        String domain = Urls.domainOf(base);
        return new Profile(base, domain, new SearchStrategy.Homepage(base), true,
                Selectors.generic(domain),
                List.of("script", "style", "nav", "footer", "header", "aside",
                        "[class~=(?i)(^|\\s|-|_)(ad|ads|advert|advertisement)(\\s|-|_|$)]", "[class*=related]"),
                true, clock.instant());
    }

    // прерванная задача не должна выдавать fallback за результат детекции
    private static void checkCancelled(String base) {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Profile detection for " + base + " interrupted");
        }
    }

    static String encode(String query) {
        return URLEncoder.encode(query, StandardCharsets.UTF_8).replace("+", "%20");
    }

    record Probe(SearchStrategy strategy, Document doc, int responseBytes) {}
}
