package kinet.newsfeed.job;

import kinet.newsfeed.net.Urls;

import java.util.ArrayList;
import java.util.List;

/**
 * Validated job input. URLs get a scheme when typed without one; blank entries are dropped.
 */
public record ScrapeJobRequest(List<String> urls, List<String> filters, List<String> categories,
                               int maxResults, boolean forceRefresh) {
    public static final int MAX_RESULTS_LIMIT = 100;

    public ScrapeJobRequest {
        urls = normalizeUrls(urls);
        filters = nonBlank(filters);
        categories = categories == null ? List.of() : nonBlank(categories);
        if (urls.isEmpty()) throw new IllegalArgumentException("At least one URL is required");
        if (filters.isEmpty()) throw new IllegalArgumentException("At least one filter is required");
        if (maxResults < 1 || maxResults > MAX_RESULTS_LIMIT) {
            throw new IllegalArgumentException("maxResults must be between 1 and " + MAX_RESULTS_LIMIT + ", got " + maxResults);
        }
    }

    public ScrapeJobRequest(List<String> urls, List<String> filters, int maxResults) {
        this(urls, filters, List.of(), maxResults, false);
    }

    /** Cartesian product url × filter (× category), url-major. */
    public List<ScrapeTask> tasks() {
        List<ScrapeTask> out = new ArrayList<>();
        for (String url : urls) {
            for (String filter : filters) {
                if (categories.isEmpty()) {
                    out.add(new ScrapeTask(url, filter, null));
                } else {
                    for (String category : categories) out.add(new ScrapeTask(url, filter, category));
                }
            }
        }
        return out;
    }

    /** Upper bound on the merged result set. */
    public int globalCap() {
        return maxResults * urls.size();
    }

    private static List<String> normalizeUrls(List<String> in) {
        List<String> out = new ArrayList<>();
        if (in == null) return out;
        for (String u : in) {
            String s = Urls.withScheme(u);
            if (s.isEmpty()) continue;
            if (Urls.hostOf(s).isEmpty()) throw new IllegalArgumentException("Not a URL: " + u);
            out.add(s);
        }
        return List.copyOf(out);
    }

    private static List<String> nonBlank(List<String> in) {
        List<String> out = new ArrayList<>();
        if (in == null) return out;
        for (String s : in) {
            if (s != null && !s.isBlank()) out.add(s.strip());
        }
        return List.copyOf(out);
    }
}
