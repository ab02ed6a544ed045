package kinet.newsfeed.scrape;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import kinet.newsfeed.net.FetchException;
import kinet.newsfeed.net.FetchedPage;
import kinet.newsfeed.net.PageFetcher;
import kinet.newsfeed.net.PageRenderer;
import kinet.newsfeed.net.RenderOptions;
import kinet.newsfeed.net.Urls;
import kinet.newsfeed.profile.Profile;
import kinet.newsfeed.profile.SearchStrategy;
import kinet.newsfeed.profile.Selectors;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Applies a {@link Profile} to a query: API or search page, homepage fallback, deep
 * content, relevance filter, dedup. Stage failures mean fewer results, never an exception.
 */
public class UniversalScraper {
    private static final Logger log = LoggerFactory.getLogger(UniversalScraper.class);

    static final List<String> LISTING_PATHS = List.of("/news", "/latest", "/articles", "/stories");

    private final PageFetcher fetcher;
    private final PageRenderer renderer;
    private final ContentEnricher enricher;
    private final ObjectMapper mapper;
    private final Duration fetchTimeout;
    private final RenderOptions renderOptions;

    public UniversalScraper(PageFetcher fetcher, PageRenderer renderer, ContentEnricher enricher,
                            ObjectMapper mapper, Duration fetchTimeout) {
        this.fetcher = fetcher;
        this.renderer = renderer;
        this.enricher = enricher;
        this.mapper = mapper;
        this.fetchTimeout = fetchTimeout;
        this.renderOptions = RenderOptions.defaults();
    }

    public List<Article> scrape(Profile profile, String query, int maxResults) {
        if (maxResults < 1) return List.of();
        String q = query == null ? "" : query.strip();

        if (profile.strategy() instanceof SearchStrategy.Api api) {
            List<Candidate> viaApi = scrapeApi(profile, api, q);
            if (!viaApi.isEmpty()) {
                log.info("API scraping successful for {}: {} articles", profile.domain(), viaApi.size());
                return toArticles(viaApi, maxResults);
            }
            log.warn("API for {} returned nothing, falling back to generic HTML extraction", profile.domain());
        }

        Selectors selectors = selectorsOf(profile);
        PageExtractor extractor = new PageExtractor(selectors, profile.domain());
        int target = maxResults * 2;

        List<Candidate> candidates = new ArrayList<>(primary(profile, q, extractor, target));
        log.info("Initial extraction on {}: {} candidates", profile.domain(), candidates.size());

        if (candidates.size() * 2 < maxResults) {
            log.info("Low results on {}, trying homepage and listing pages", profile.domain());
            candidates.addAll(homepage(profile, extractor, maxResults));
            log.info("After homepage scraping: {} candidates", candidates.size());
        }

        if (profile.deepScrape() && !candidates.isEmpty()) {
            candidates = enricher.enrich(candidates, selectors, profile.cleaningRules());
        }

        candidates = RelevanceScorer.filter(candidates, q);
        candidates = Deduplicator.scoreAndDeduplicate(candidates);
        return toArticles(candidates, maxResults);
    }

    List<Candidate> scrapeApi(Profile profile, SearchStrategy.Api api, String query) {
        String url = SearchUrls.build(api, query);
        try {
            FetchedPage page = fetcher.fetch(url, fetchTimeout);
            JsonNode json = mapper.readTree(page.body());
            return ApiResultParser.parse(json, api.kind(), profile.baseUrl(), profile.domain());
        } catch (FetchException e) {
            log.warn("API scraping error for {}: {}", url, e.getMessage());
        } catch (IOException e) {
            log.warn("API response of {} is not JSON: {}", url, e.getMessage());
        }
        return List.of();
    }

    List<Candidate> primary(Profile profile, String query, PageExtractor extractor, int target) {
        SearchStrategy strategy = profile.usesApi() ? new SearchStrategy.Homepage(profile.baseUrl()) : profile.strategy();
        String url = SearchUrls.build(strategy, query);
        log.debug("Scraping {} (js={})", url, profile.requiresJs());
        return load(url, profile.requiresJs())
                .map(doc -> extractor.extract(doc, target))
                .orElse(List.of());
    }

    List<Candidate> homepage(Profile profile, PageExtractor extractor, int maxResults) {
        List<Candidate> out = new ArrayList<>();
        String base = Urls.stripTrailingSlash(profile.baseUrl());
        load(base, false).ifPresent(doc -> out.addAll(extractor.extract(doc, maxResults)));
        for (String path : LISTING_PATHS) {
            load(base + path, false).ifPresent(doc -> out.addAll(extractor.extract(doc, maxResults)));
        }
        return out;
    }

    private Optional<Document> load(String url, boolean render) {
        try {
            String html = render ? renderer.render(url, renderOptions) : fetcher.fetch(url, fetchTimeout).text();
            return Optional.of(Jsoup.parse(html, url));
        } catch (FetchException e) {
            log.debug("Could not load {}: {}", url, e.getMessage());
            return Optional.empty();
        }
    }

    private static Selectors selectorsOf(Profile profile) {
        return profile.selectors() != null ? profile.selectors() : Selectors.generic(profile.domain());
    }

    private static List<Article> toArticles(List<Candidate> candidates, int maxResults) {
        List<Article> out = new ArrayList<>();
        for (Candidate c : candidates) {
            Article.from(c).ifPresent(out::add);
            if (out.size() >= maxResults) break;
        }
        return out;
    }
}
