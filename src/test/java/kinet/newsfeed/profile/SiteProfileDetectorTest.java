package kinet.newsfeed.profile;

import kinet.newsfeed.Fixtures;
import kinet.newsfeed.net.FakePageFetcher;
import kinet.newsfeed.net.Json;
import kinet.newsfeed.net.PageFetcher;
import kinet.newsfeed.net.RateLimitedPageFetcher;
import kinet.newsfeed.net.RateLimiter;
import org.testng.annotations.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.testng.Assert.*;

public class SiteProfileDetectorTest {
    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private static SiteProfileDetector detector(PageFetcher fetcher) {
        return new SiteProfileDetector(fetcher, Json.newMapper(), Duration.ofSeconds(1), Duration.ofSeconds(1),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    public void detectsWordPressApi() {
        FakePageFetcher fetcher = new FakePageFetcher()
                .json("https://blog.test/wp-json/wp/v2/posts?search=news", "[{\"id\":1}]");
        Profile p = detector(fetcher).detectProfile("blog.test/");

        assertTrue(p.usesApi());
        SearchStrategy.Api api = (SearchStrategy.Api) p.strategy();
        assertEquals(api.endpoint(), "https://blog.test/wp-json/wp/v2/posts?search={query}");
        assertEquals(api.kind(), ApiKind.WORDPRESS);
        assertNull(p.selectors());
        assertEquals(p.domain(), "blog.test");
        assertEquals(p.detectedAt(), NOW);
    }

    @Test
    public void emptyJsonIsNotAnApi() {
        FakePageFetcher fetcher = new FakePageFetcher()
                .json("https://site.test/api/search?q=news", "[]")
                .html("https://site.test/search?q=news", Fixtures.listingPage("site.test"));
        Profile p = detector(fetcher).detectProfile("https://site.test");
        assertFalse(p.usesApi());
    }

    @Test
    public void detectsSearchUrlAndSynthesizesSelectors() {
        FakePageFetcher fetcher = new FakePageFetcher()
                .html("https://site.test/search?q=economy", Fixtures.listingPage("site.test"));
        Profile p = detector(fetcher).detectProfile("https://site.test", "economy");

        assertEquals(p.strategy(), new SearchStrategy.SearchUrl("https://site.test/search?q={query}"));
        assertFalse(p.requiresJs());
        assertTrue(p.deepScrape());
        assertEquals(p.selectors().containers().get(0), "article.post-card");
        assertTrue(p.selectors().containers().contains("article"));
        assertTrue(p.selectors().dates().contains("time[datetime]"));
        assertEquals(p.selectors().linkRules().requireDomain(), "site.test");
        assertTrue(p.cleaningRules().contains("nav"));
    }

    @Test
    public void listingPageWithoutQueryBecomesHomepageStrategy() {
        FakePageFetcher fetcher = new FakePageFetcher()
                .html("https://site.test/news", Fixtures.listingPage("site.test"));
        Profile p = detector(fetcher).detectProfile("https://site.test");
        assertEquals(p.strategy(), new SearchStrategy.Homepage("https://site.test/news"));
    }

    @Test
    public void tinyOrEmptyPagesFallBack() {
        FakePageFetcher fetcher = new FakePageFetcher()
                .html("https://dead.test/search?q=news", "<html><body>nothing</body></html>")
                .status("https://dead.test", 500);
        Profile p = detector(fetcher).detectProfile("https://dead.test");

        assertEquals(p.strategy(), new SearchStrategy.Homepage("https://dead.test"));
        assertTrue(p.requiresJs());
        assertNotNull(p.selectors());
        assertEquals(p, detector(fetcher).fallback("dead.test"));
    }

    @Test
    public void interruptedDetectionIsCancelledNotFallback() {
        FakePageFetcher fetcher = new FakePageFetcher()
                .html("https://site.test", Fixtures.listingPage("site.test"));
        Thread.currentThread().interrupt();
        try {
            detector(fetcher).detectProfile("https://site.test");
            fail("Ожидали CancellationException");
        } catch (CancellationException e) {
            assertTrue(e.getMessage().contains("site.test"));
        } finally {
            Thread.interrupted();
        }
        assertTrue(fetcher.requested().isEmpty(), fetcher.requested().toString());
    }

    @Test
    public void everyProbeWaitsForSharedLimiter() {
        FakePageFetcher fetcher = new FakePageFetcher()
                .html("https://site.test", Fixtures.listingPage("site.test"));
        List<Long> starts = new CopyOnWriteArrayList<>();
        PageFetcher timed = (url, headers, timeout) -> {
            starts.add(System.nanoTime());
            return fetcher.fetch(url, headers, timeout);
        };
        RateLimiter limiter = new RateLimiter(50);   // 20 ms

        Profile p = detector(new RateLimitedPageFetcher(timed, limiter)).detectProfile("https://site.test");

        assertEquals(p.strategy(), new SearchStrategy.Homepage("https://site.test"));
        int n = starts.size();
        assertTrue(n > 5, "probes: " + n);
        long spanMs = TimeUnit.NANOSECONDS.toMillis(starts.get(n - 1) - starts.get(0));
        assertTrue(spanMs >= (n - 1) * 20L - 5, n + " probes in " + spanMs + " ms");
    }
}
