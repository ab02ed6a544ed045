package kinet.newsfeed.net;

import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.Map;

public final class JsoupPageFetcher implements PageFetcher {
    private static final Logger log = LoggerFactory.getLogger(JsoupPageFetcher.class);

    static final String UA = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 "
            + "(KHTML, like Gecko) Chrome/126.0.0.0 Safari/537.36";
    private static final int MAX_BODY = 5 * 1024 * 1024;

    @Override
    public FetchedPage fetch(String url, Map<String, String> headers, Duration timeout) throws FetchException {
        // задача могла быть снята по таймауту, не начинаем новый запрос
        if (Thread.currentThread().isInterrupted()) {
            throw new FetchException(url, "Interrupted before request", null);
        }
        try {
            Connection.Response resp = Jsoup.connect(url)
                    .userAgent(UA)
                    .referrer("https://www.google.com")
                    .header("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8")
                    .header("Accept-Language", "en-US,en;q=0.9")
                    .headers(headers)
                    .timeout((int) timeout.toMillis())
                    .maxBodySize(MAX_BODY)
                    .followRedirects(true)
                    .ignoreHttpErrors(true)
                    .ignoreContentType(true)
                    .execute();

            int status = resp.statusCode();
            log.debug("GET {} -> {} ({})", url, status, resp.contentType());
            if (status < 200 || status >= 300) {
                throw new FetchException(url, status);
            }
            return new FetchedPage(resp.url().toString(), status, resp.bodyAsBytes(), resp.contentType());
        } catch (FetchException e) {
            throw e;
        } catch (SocketTimeoutException e) {
            throw new FetchException(url, "Timed out after " + timeout.toSeconds() + "s", e);
        } catch (IOException | IllegalArgumentException e) {
            throw new FetchException(url, "Request failed: " + e.getMessage(), e);
        }
    }
}
