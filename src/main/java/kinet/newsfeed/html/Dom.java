package kinet.newsfeed.html;

import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.jsoup.select.Selector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Selector helpers. jsoup's {@code select} includes the root itself when it matches;
 * the descendant variants here skip it. Selector strings come from cached profiles
 * and may be unparseable: the {@code *Safe} variants treat that as "no match".
 */
public final class Dom {
    private static final Logger log = LoggerFactory.getLogger(Dom.class);

    private Dom() {}

    public static Elements selectSafe(Element root, String css) {
        try {
            return root.select(css);
        } catch (Selector.SelectorParseException e) {
            log.debug("Bad selector [{}]: {}", css, e.getMessage());
            return new Elements();
        }
    }

    public static Element firstSafe(Element root, String css) {
        try {
            return root.selectFirst(css);
        } catch (Selector.SelectorParseException e) {
            log.debug("Bad selector [{}]: {}", css, e.getMessage());
            return null;
        }
    }

    public static Element firstDescendant(Element root, String css) {
        for (Element e : root.select(css)) {
            if (e != root) return e;
        }
        return null;
    }

    public static List<Element> descendants(Element root, String css, int limit) {
        List<Element> out = new ArrayList<>();
        for (Element e : root.select(css)) {
            if (e == root) continue;
            out.add(e);
            if (out.size() >= limit) break;
        }
        return out;
    }

    /** First {@code limit} elements with this tag, in document order. */
    public static List<Element> byTag(Element root, String tag, int limit) {
        Elements all = root.getElementsByTag(tag);
        return all.size() <= limit ? all : all.subList(0, limit);
    }

    public static String text(Element e) {
        return e == null ? "" : e.text().strip();
    }

    /** Lower-cased class names and id, space separated. */
    public static String classAndId(Element e) {
        return (e.className() + " " + e.id()).toLowerCase(Locale.ROOT).strip();
    }

    /** Nearest enclosing {@code <a>}, excluding the element itself. */
    public static Element parentLink(Element e) {
        for (Element p : e.parents()) {
            if ("a".equals(p.normalName())) return p;
        }
        return null;
    }
}
