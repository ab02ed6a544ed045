package kinet.newsfeed.net;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Used when no browser service is configured: returns the server-side HTML as is.
 */
public final class StaticPageRenderer implements PageRenderer {
    private static final Logger log = LoggerFactory.getLogger(StaticPageRenderer.class);

    private final PageFetcher fetcher;
    private final AtomicBoolean warned = new AtomicBoolean();

    public StaticPageRenderer(PageFetcher fetcher) {
        this.fetcher = fetcher;
    }

    @Override
    public String render(String url, RenderOptions options) throws FetchException {
        if (warned.compareAndSet(false, true)) {
            log.warn("No render service configured, JS-heavy pages are fetched without rendering");
        }
        return fetcher.fetch(url, options.pageTimeout()).text();
    }
}
