package kinet.newsfeed.profile;

import kinet.newsfeed.net.Urls;

import java.util.List;
import java.util.Locale;

public record LinkFilterRules(int minTextLength, int maxTextLength, List<String> excludePatterns,
                              String requireDomain, boolean allowRelative) {

    public static final List<String> EXCLUDED = List.of(
            "/tag/", "/tags/", "/category/", "/categories/",
            "/author/", "/about", "/contact", "/privacy", "/terms",
            "/login", "/register", "/signup", "/subscribe", "/newsletter",
            "#", "javascript:", "mailto:", "tel:",
            "/feed", "/rss", "/sitemap", "/search",
            ".pdf", ".jpg", ".png", ".gif", ".mp4", ".xml");

    public LinkFilterRules {
        excludePatterns = List.copyOf(excludePatterns);
    }

    public static LinkFilterRules forDomain(String domain) {
        return new LinkFilterRules(15, 300, EXCLUDED, domain, true);
    }

    /** Whether an anchor with this href and text looks like a link to an article. */
    public boolean accepts(String href, String text) {
        if (href == null || text == null) return false;
        int len = text.length();
        if (len <= minTextLength || len >= maxTextLength) return false;

        String h = href.strip().toLowerCase(Locale.ROOT);
        for (String p : excludePatterns) {
            if (h.contains(p)) return false;
        }
        if (h.isEmpty() || "/".equals(h) || h.length() < 5) return false;

        if (Urls.isHttp(h) || h.startsWith("//")) {
            String host = Urls.canonicalDomain(Urls.hostOf(h.startsWith("//") ? "https:" + h : h));
            return requireDomain == null || requireDomain.isEmpty()
                    || host.equals(requireDomain) || host.endsWith("." + requireDomain);
        }
        return allowRelative;
    }
}
