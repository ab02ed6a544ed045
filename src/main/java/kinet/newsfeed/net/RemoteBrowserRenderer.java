package kinet.newsfeed.net;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.time.Duration;

/**
 * Delegates rendering to a headless-browser HTTP service. The service loads the page,
 * scrolls to the bottom up to {@code maxScrolls} times (stopping once the document
 * height stops growing) and answers with {@code {"html": "..."}}.
 */
public final class RemoteBrowserRenderer implements PageRenderer {
    private static final Logger log = LoggerFactory.getLogger(RemoteBrowserRenderer.class);

    // запас сверх таймаута страницы: скроллы + сериализация DOM
    private static final Duration OVERHEAD = Duration.ofSeconds(15);

    private final String endpoint;
    private final ObjectMapper mapper;
    private final RateLimiter limiter;

    public RemoteBrowserRenderer(String endpoint, ObjectMapper mapper, RateLimiter limiter) {
        this.endpoint = endpoint;
        this.mapper = mapper;
        this.limiter = limiter;
    }

    @Override
    public String render(String url, RenderOptions options) throws FetchException {
        if (Thread.currentThread().isInterrupted()) {
            throw new FetchException(url, "Interrupted before render", null);
        }
        try {
            limiter.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException(url, "Interrupted while waiting for rate limit", e);
        }
        ObjectNode body = mapper.createObjectNode();
        body.put("url", url);
        body.put("headless", options.headless());
        body.putObject("viewport")
                .put("width", options.viewportWidth())
                .put("height", options.viewportHeight());
        body.put("timeoutSeconds", options.pageTimeout().toSeconds());
        body.put("maxScrolls", options.maxScrolls());

        try {
            Connection.Response resp = Jsoup.connect(endpoint)
                    .method(Connection.Method.POST)
                    .header("Content-Type", "application/json")
                    .requestBody(mapper.writeValueAsString(body))
                    .timeout((int) options.pageTimeout().plus(OVERHEAD).toMillis())
                    .maxBodySize(0)
                    .ignoreContentType(true)
                    .ignoreHttpErrors(true)
                    .execute();

            if (resp.statusCode() != 200) {
                throw new FetchException(url, resp.statusCode());
            }
            JsonNode json = mapper.readTree(resp.body());
            String html = json.path("html").asText("");
            log.debug("Rendered {}: {} chars", url, html.length());
            return html;
        } catch (FetchException e) {
            throw e;
        } catch (SocketTimeoutException e) {
            throw new FetchException(url, "Render timed out", e);
        } catch (IOException e) {
            throw new FetchException(url, "Render failed: " + e.getMessage(), e);
        }
    }
}
