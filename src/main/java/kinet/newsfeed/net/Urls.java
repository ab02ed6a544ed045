package kinet.newsfeed.net;

import java.net.IDN;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

public final class Urls {
    private Urls() {}

    /** Adds {@code https://} when the user typed a bare host. */
    public static String withScheme(String url) {
        String u = url == null ? "" : url.strip();
        if (u.isEmpty()) return u;
        String lower = u.toLowerCase(Locale.ROOT);
        if (lower.startsWith("http://") || lower.startsWith("https://")) return u;
        return "https://" + u;
    }

    /** Lower-cased host without a leading {@code www.}; empty when the URL has no host. */
    public static String domainOf(String url) {
        String host = hostOf(withScheme(url));
        return canonicalDomain(host);
    }

    public static String canonicalDomain(String host) {
        String h = host == null ? "" : host.strip().toLowerCase(Locale.ROOT);
        if (h.endsWith(".")) h = h.substring(0, h.length() - 1);
        return h.startsWith("www.") ? h.substring(4) : h;
    }

    /**
     * Host of the URL; an internationalized name comes back in its ASCII (punycode) form.
     * Empty when the URL has no usable host.
     */
    public static String hostOf(String url) {
        if (url == null) return "";
        String u = url.strip();
        URI uri = parse(u);
        if (uri != null && uri.getHost() != null) return uri.getHost();
        return idnHost(u);
    }

    private static URI parse(String url) {
        try {
            return new URI(url);
        } catch (URISyntaxException e) {
            return null;
        }
    }

    // java.net.URI признаёт только ASCII-хосты, кириллицу и прочие IDN разбираем сами
    private static String idnHost(String url) {
        int scheme = url.indexOf("://");
        if (scheme < 0) return "";
        String rest = url.substring(scheme + 3);
        int end = rest.length();
        for (char c : new char[]{'/', '?', '#'}) {
            int i = rest.indexOf(c);
            if (i >= 0 && i < end) end = i;
        }
        String host = rest.substring(0, end);
        host = host.substring(host.lastIndexOf('@') + 1);
        int colon = host.lastIndexOf(':');
        if (colon >= 0) host = host.substring(0, colon);
        if (host.isEmpty() || host.chars().allMatch(c -> c < 128)) return "";
        try {
            return IDN.toASCII(host, IDN.USE_STD3_ASCII_RULES);
        } catch (IllegalArgumentException e) {
            return "";
        }
    }

    public static boolean isHttp(String url) {
        if (url == null) return false;
        String l = url.toLowerCase(Locale.ROOT);
        return l.startsWith("http://") || l.startsWith("https://");
    }

    /** Key under which two spellings of one article URL collapse. */
    public static String dedupKey(String url) {
        if (url == null) return "";
        String u = url.strip().toLowerCase(Locale.ROOT);
        int hash = u.indexOf('#');
        if (hash >= 0) u = u.substring(0, hash);
        if (u.startsWith("https://")) u = u.substring(8);
        else if (u.startsWith("http://")) u = u.substring(7);
        if (u.startsWith("www.")) u = u.substring(4);
        return stripTrailingSlash(u);
    }

    public static String stripTrailingSlash(String s) {
        String r = s;
        while (r.endsWith("/")) r = r.substring(0, r.length() - 1);
        return r;
    }
}
