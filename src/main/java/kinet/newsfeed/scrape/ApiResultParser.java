package kinet.newsfeed.scrape;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import kinet.newsfeed.profile.ApiKind;
import org.jsoup.Jsoup;

import java.net.URI;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

public final class ApiResultParser {
    static final int MAX_ITEMS = 50;

    private static final List<String> HEADLINE_FIELDS = List.of("title", "headline", "name", "heading");
    private static final List<String> URL_FIELDS = List.of("url", "link", "href", "permalink");
    private static final List<String> DESCRIPTION_FIELDS = List.of("description", "excerpt", "summary", "snippet");
    private static final List<String> LIST_FIELDS = List.of("results", "items", "articles", "data", "posts");

    private ApiResultParser() {}

    public static List<Candidate> parse(JsonNode json, ApiKind kind, String baseUrl, String source) {
        return kind == ApiKind.WORDPRESS ? wordpress(json, source) : generic(json, baseUrl, source);
    }

    static List<Candidate> wordpress(JsonNode json, String source) {
        List<Candidate> out = new ArrayList<>();
        if (!json.isArray()) return out;
        for (JsonNode item : limit(json)) {
            String headline = stripHtml(item.path("title").path("rendered").asText(""));
            String url = item.path("link").asText("");
            String excerpt = cut(stripHtml(item.path("excerpt").path("rendered").asText("")), 300);
            String content = cut(stripHtml(item.path("content").path("rendered").asText("")), 1000);
            if (headline.isEmpty() || url.isEmpty()) continue;
            out.add(new Candidate(headline, url, excerpt, content, null, null, source, 0, 0));
        }
        return out;
    }

    static List<Candidate> generic(JsonNode json, String baseUrl, String source) {
        List<Candidate> out = new ArrayList<>();
        for (JsonNode item : limit(items(json))) {
            if (!item.isObject()) continue;
            String headline = firstText(item, HEADLINE_FIELDS);
            String url = firstText(item, URL_FIELDS);
            String desc = firstText(item, DESCRIPTION_FIELDS);
            if (headline.isEmpty() || url.isEmpty()) continue;
            out.add(Candidate.of(cut(stripHtml(headline), 300), resolve(baseUrl, url), cut(stripHtml(desc), 300), source));
        }
        return out;
    }

    /** The array of items: the root itself, a well-known list field, or the first array under {@code data}. */
    static JsonNode items(JsonNode json) {
        if (json.isArray()) return json;
        for (String f : LIST_FIELDS) {
            JsonNode n = json.path(f);
            if (n.isArray()) return n;
        }
        JsonNode data = json.path("data");
        if (data.isObject()) {
            JsonNode nested = firstArray(data, 3);
            if (nested != null) return nested;
        }
        return MissingNode.getInstance();
    }

    private static JsonNode firstArray(JsonNode node, int depth) {
        if (depth < 0) return null;
        Iterator<JsonNode> it = node.elements();
        while (it.hasNext()) {
            JsonNode child = it.next();
            if (child.isArray()) return child;
            if (child.isObject()) {
                JsonNode found = firstArray(child, depth - 1);
                if (found != null) return found;
            }
        }
        return null;
    }

    private static String firstText(JsonNode item, List<String> fields) {
        for (String f : fields) {
            JsonNode n = item.get(f);
            if (n == null || n.isNull()) continue;
            String v = n.isObject() ? n.path("rendered").asText("") : n.asText("");
            if (!v.isBlank()) return v.strip();
        }
        return "";
    }

    private static List<JsonNode> limit(JsonNode array) {
        List<JsonNode> out = new ArrayList<>();
        for (JsonNode n : array) {
            out.add(n);
            if (out.size() >= MAX_ITEMS) break;
        }
        return out;
    }

    private static String resolve(String baseUrl, String url) {
        try {
            return URI.create(baseUrl + "/").resolve(url.strip()).toString();
        } catch (IllegalArgumentException e) {
            return url;
        }
    }

    private static String stripHtml(String html) {
        return html.isEmpty() ? "" : Jsoup.parse(html).text().strip();
    }

    private static String cut(String s, int max) {
        return s.length() > max ? s.substring(0, max) : s;
    }
}
