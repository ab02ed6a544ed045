package kinet.newsfeed.profile;

import kinet.newsfeed.html.Dom;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Derives selector lists from a sample page. Every list is structure-aware candidates
 * first, then fixed fallbacks, duplicates removed with order preserved.
 */
public final class SelectorSynthesizer {
    private static final Pattern CSS_IDENT = Pattern.compile("[A-Za-z_][A-Za-z0-9_-]*");

    private static final List<String> CONTAINER_TAGS = List.of("article", "div", "li", "section", "a");
    private static final int SCAN_PER_TAG = 200;
    private static final int TOP_CONTAINERS = 10;
    private static final int MAX_CONTAINERS = 15;
    private static final int MAX_LIST = 20;

    private static final List<String> CONTAINER_FALLBACKS = List.of(
            "article",
            "div[class*=article]",
            "div[class*=post]",
            "div[class*=story]",
            "li[class*=item]",
            "div[class*=card]",
            "[class*=news-item]",
            "[class*=article-item]");

    private static final List<String> HEADLINE_KEYWORDS = List.of(
            "headline", "title", "heading", "name", "header", "caption");

    private static final List<String> HEADLINE_FALLBACKS = List.of(
            "h1", "h2", "h3", "h4",
            "a h1", "a h2", "a h3", "a h4",
            "[class*=headline]", "[class*=title]", "[class*=heading]",
            "article h1", "article h2", "article h3",
            "div[class*=article] h2", "div[class*=article] h3",
            "div[class*=post] h2", "div[class*=post] h3",
            "a[class*=title]", "a[class*=headline]",
            "h1 a", "h2 a", "h3 a",
            "[role=heading]");

    private static final Pattern DESCRIPTION_HINT = Pattern.compile(
            "excerpt|summary|description|teaser|dek|standfirst|intro|lead|snippet|abstract");

    private static final List<String> DESCRIPTION_FALLBACKS = List.of(
            "p",
            "div[class*=excerpt]", "div[class*=description]",
            "div[class*=summary]", "div[class*=snippet]",
            "span[class*=excerpt]", "span[class*=description]",
            "div[class*=teaser]", "div[class*=intro]",
            "[class*=desc]", "[class*=abstract]",
            "article p:first-of-type",
            "div[class*=article] p:first-of-type",
            "p[class*=lead]", "p[class*=intro]",
            "div[class*=content] p:first-of-type");

    private static final Pattern CONTENT_HINT = Pattern.compile(
            "article-body|article-content|articlebody|post-content|post-body|entry-content|story-body|content|body|text");

    private static final List<String> CONTENT_FALLBACKS = List.of(
            "article",
            "[class*=article-content]", "[class*=article-body]",
            "[class*=post-content]", "[class*=post-body]",
            "[class*=entry-content]", "[class*=story-body]",
            "[id*=article]", "[id*=content]",
            "main article", "main [role=main]",
            ".content", "#content",
            "[itemprop=articleBody]",
            "div[class*=text]", "div[class*=body]");

    private static final Pattern DATE_HINT = Pattern.compile("date|published|timestamp|dateline");
    private static final List<String> DATE_FALLBACKS = List.of(
            "time", "[datetime]", "[class*=date]", "[class*=time]",
            "[class*=published]", "[itemprop=datePublished]");

    private static final Pattern AUTHOR_HINT = Pattern.compile("author|byline|writer");
    private static final List<String> AUTHOR_FALLBACKS = List.of(
            "[rel=author]", "[class*=author]", "[itemprop=author]",
            "a[href*=/author/]", "[class*=byline]");

    private static final List<String> CLEANING_RULES = List.of(
            "script", "style", "nav", "footer", "header", "aside",
            "[class*=sidebar]", "[class~=(?i)(^|\\s|-|_)(ad|ads|advert|advertisement)(\\s|-|_|$)]",
            "[class*=related]", "[class*=recommended]",
            "[class*=share]", "[class*=social]",
            "[class*=comment]", "[class*=newsletter]",
            "iframe", "form");

    private SelectorSynthesizer() {}

    public static List<String> containers(Document doc) {
        Map<String, Integer> table = new LinkedHashMap<>();
        for (String tag : CONTAINER_TAGS) {
            for (Element elem : Dom.byTag(doc, tag, SCAN_PER_TAG)) {
                int score = ContainerScorer.score(elem);
                if (score >= ContainerScorer.KEEP_THRESHOLD) {
                    table.merge(selectorFor(elem), score, Integer::sum);
                }
            }
        }
        List<String> out = new ArrayList<>();
        table.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder()))
                .limit(TOP_CONTAINERS)
                .forEach(e -> out.add(e.getKey()));
        out.addAll(CONTAINER_FALLBACKS);
        return distinct(out, MAX_CONTAINERS);
    }

    public static List<String> headlines(Document doc) {
        List<String> out = new ArrayList<>();
        for (String tag : List.of("h1", "h2", "h3", "h4")) {
            for (Element elem : Dom.byTag(doc, tag, 30)) {
                String attrs = Dom.classAndId(elem);
                for (String kw : HEADLINE_KEYWORDS) {
                    if (attrs.contains(kw)) {
                        out.add(selectorFor(elem));
                        break;
                    }
                }
                if (Dom.parentLink(elem) != null) out.add("a > " + tag);
            }
        }
        out.addAll(HEADLINE_FALLBACKS);
        return distinct(out, MAX_LIST);
    }

    public static List<String> descriptions(Document doc) {
        List<String> out = hinted(doc, "p, div, span", DESCRIPTION_HINT, 60, 3);
        out.addAll(DESCRIPTION_FALLBACKS);
        return distinct(out, MAX_LIST);
    }

    public static List<String> content(Document doc) {
        List<String> out = new ArrayList<>();
        for (Element elem : doc.select("div, section, article, main")) {
            if (!CONTENT_HINT.matcher(Dom.classAndId(elem)).find()) continue;
            if (Dom.descendants(elem, "p", 3).size() < 3) continue;
            out.add(selectorFor(elem));
            if (out.size() >= 3) break;
        }
        if (doc.selectFirst("[itemprop=articleBody]") != null) out.add("[itemprop=articleBody]");
        out.addAll(CONTENT_FALLBACKS);
        return distinct(out, MAX_LIST);
    }

    public static List<String> dates(Document doc) {
        List<String> out = new ArrayList<>();
        if (doc.selectFirst("time[datetime]") != null) out.add("time[datetime]");
        out.addAll(hinted(doc, "span, div, p, time", DATE_HINT, 200, 2));
        out.addAll(DATE_FALLBACKS);
        return distinct(out, MAX_LIST);
    }

    public static List<String> authors(Document doc) {
        List<String> out = hinted(doc, "span, div, p, a", AUTHOR_HINT, 200, 2);
        out.addAll(AUTHOR_FALLBACKS);
        return distinct(out, MAX_LIST);
    }

    public static List<String> cleaningRules(Document doc) {
        List<String> out = new ArrayList<>(CLEANING_RULES);
        if (doc.selectFirst("[role=complementary]") != null) out.add("[role=complementary]");
        return distinct(out, Integer.MAX_VALUE);
    }

    public static List<String> defaultCleaningRules() {
        return CLEANING_RULES;
    }

    /** tag#id, else tag.firstMeaningfulClass, else bare tag. */
    public static String selectorFor(Element elem) {
        String tag = elem.normalName();
        String id = elem.id();
        if (!id.isEmpty() && CSS_IDENT.matcher(id).matches()) {
            return tag + "#" + id;
        }
        for (String cls : elem.classNames()) {
            if (cls.length() > 2 && !cls.startsWith("js-") && !cls.startsWith("is-")
                    && CSS_IDENT.matcher(cls).matches()) {
                return tag + "." + cls;
            }
        }
        return tag;
    }

    private static List<String> hinted(Document doc, String css, Pattern hint, int scan, int max) {
        List<String> out = new ArrayList<>();
        int seen = 0;
        for (Element elem : doc.select(css)) {
            if (++seen > scan) break;
            if (!hint.matcher(Dom.classAndId(elem)).find()) continue;
            String sel = selectorFor(elem);
            // голый тег без класса ничего не уточняет
            if (sel.equals(elem.normalName()) || out.contains(sel)) continue;
            out.add(sel);
            if (out.size() >= max) break;
        }
        return out;
    }

    static List<String> distinct(List<String> in, int max) {
        return new ArrayList<>(new LinkedHashSet<>(in)).stream().limit(max).toList();
    }
}
