package kinet.newsfeed.scrape;

import kinet.newsfeed.profile.SearchStrategy;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class SearchUrls {
    private static final Pattern QUERY_PARAM = Pattern.compile("([?&](?:q|s|search)=)[^&]*");

    private SearchUrls() {}

    public static String build(SearchStrategy strategy, String query) {
        String q = encode(query == null ? "" : query.strip());
        if (strategy instanceof SearchStrategy.Api api) {
            String url = api.endpoint();
            if (url.contains("{query}")) return url.replace("{query}", q);
            if (url.contains("?") && !url.contains("query")) return url + "&search=" + q;
            return url;
        }
        if (strategy instanceof SearchStrategy.SearchUrl su) {
            return fillPattern(su.pattern(), q);
        }
        return ((SearchStrategy.Homepage) strategy).url();
    }

    /** {@code {query}} placeholder first, else rewrite q=/s=/search= parameters, else as is. */
    static String fillPattern(String pattern, String encodedQuery) {
        if (pattern.contains("{query}")) return pattern.replace("{query}", encodedQuery);
        Matcher m = QUERY_PARAM.matcher(pattern);
        if (m.find()) {
            return m.reset().replaceAll("$1" + Matcher.quoteReplacement(encodedQuery));
        }
        return pattern;
    }

    static String encode(String query) {
        return URLEncoder.encode(query, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
