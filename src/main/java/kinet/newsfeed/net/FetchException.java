package kinet.newsfeed.net;

import java.io.IOException;

/**
 * Network-level failure of a single fetch: non-2xx status, timeout, connection error
 * or an interrupted calling thread.
 */
public class FetchException extends IOException {
    private final String url;
    private final int statusCode;

    public FetchException(String url, int statusCode) {
        super("HTTP " + statusCode + " for " + url);
        this.url = url;
        this.statusCode = statusCode;
    }

    public FetchException(String url, String message, Throwable cause) {
        super(message + " for " + url, cause);
        this.url = url;
        this.statusCode = -1;
    }

    public String getUrl() { return url; }

    /** -1 when the request never produced a response. */
    public int getStatusCode() { return statusCode; }
}
