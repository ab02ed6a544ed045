package kinet.newsfeed.net;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Serves canned pages by URL (trailing slash ignored). Unknown URLs answer 404; URLs on a
 * slow host block until interrupted.
 */
public class FakePageFetcher implements PageFetcher {
    private final Map<String, FetchedPage> pages = new ConcurrentHashMap<>();
    private final Set<String> slowHosts = ConcurrentHashMap.newKeySet();
    private final List<String> requested = new CopyOnWriteArrayList<>();

    public FakePageFetcher html(String url, String html) {
        return page(url, 200, html, "text/html; charset=UTF-8");
    }

    public FakePageFetcher json(String url, String json) {
        return page(url, 200, json, "application/json");
    }

    public FakePageFetcher status(String url, int status) {
        return page(url, status, "", "text/html");
    }

    public FakePageFetcher slowHost(String host) {
        slowHosts.add(host);
        return this;
    }

    private FakePageFetcher page(String url, int status, String body, String type) {
        pages.put(key(url), new FetchedPage(url, status, body.getBytes(StandardCharsets.UTF_8), type));
        return this;
    }

    public List<String> requested() {
        return requested;
    }

    @Override
    public FetchedPage fetch(String url, Map<String, String> headers, Duration timeout) throws FetchException {
        requested.add(url);
        if (Thread.currentThread().isInterrupted()) {
            throw new FetchException(url, "Interrupted", null);
        }
        if (slowHosts.contains(Urls.hostOf(url))) {
            try {
                Thread.sleep(60_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new FetchException(url, "Interrupted", e);
            }
        }
        FetchedPage page = pages.get(key(url));
        if (page == null) throw new FetchException(url, 404);
        if (page.statusCode() < 200 || page.statusCode() >= 300) throw new FetchException(url, page.statusCode());
        return page;
    }

    private static String key(String url) {
        return Urls.stripTrailingSlash(url);
    }
}
