package kinet.newsfeed.net;

import java.time.Duration;
import java.util.Map;

public interface PageFetcher {

    /**
     * Fetches {@code url}. Any non-2xx status, timeout or connection failure is
     * reported as a single {@link FetchException}.
     */
    FetchedPage fetch(String url, Map<String, String> headers, Duration timeout) throws FetchException;

    default FetchedPage fetch(String url, Duration timeout) throws FetchException {
        return fetch(url, Map.of(), timeout);
    }
}
