package kinet.newsfeed.net;

import java.time.Duration;
import java.util.Map;

/** Takes a permit from the shared {@link RateLimiter} before every request. */
public final class RateLimitedPageFetcher implements PageFetcher {
    private final PageFetcher delegate;
    private final RateLimiter limiter;

    public RateLimitedPageFetcher(PageFetcher delegate, RateLimiter limiter) {
        this.delegate = delegate;
        this.limiter = limiter;
    }

    @Override
    public FetchedPage fetch(String url, Map<String, String> headers, Duration timeout) throws FetchException {
        try {
            limiter.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException(url, "Interrupted while waiting for rate limit", e);
        }
        return delegate.fetch(url, headers, timeout);
    }
}
