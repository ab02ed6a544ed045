package kinet.newsfeed.scrape;

import kinet.newsfeed.html.Dom;
import kinet.newsfeed.profile.LinkFilterRules;
import kinet.newsfeed.profile.Selectors;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Pulls article candidates out of one listing page in three passes: profile containers,
 * link mining, then semantic markup. A pass runs only while the running total is below target.
 */
public final class PageExtractor {
    private static final Logger log = LoggerFactory.getLogger(PageExtractor.class);

    static final int MAX_LINKS = 300;
    static final int MAX_SEMANTIC = 100;
    static final int MAX_DESCRIPTION = 400;

    private final Selectors selectors;
    private final String source;

    public PageExtractor(Selectors selectors, String source) {
        this.selectors = selectors;
        this.source = source;
    }

    public List<Candidate> extract(Document doc, int target) {
        List<Candidate> out = new ArrayList<>(fromContainers(doc, target * 3));
        int containers = out.size();
        if (out.size() < target) out.addAll(fromLinks(doc));
        int links = out.size() - containers;
        if (out.size() < target) out.addAll(fromSemanticMarkup(doc));
        log.debug("{}: containers={} links={} semantic={}", doc.location(), containers, links,
                out.size() - containers - links);
        return out;
    }

    List<Candidate> fromContainers(Document doc, int limit) {
        List<Candidate> out = new ArrayList<>();
        for (Element container : findContainers(doc, limit)) {
            Candidate c = fromContainer(container);
            if (CandidateValidator.isValid(c)) out.add(c);
        }
        return out;
    }

    List<Element> findContainers(Document doc, int limit) {
        List<Element> found = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (String css : selectors.containers()) {
            for (Element e : Dom.selectSafe(doc, css)) {
                String text = Dom.text(e);
                String key = text.length() > 100 ? text.substring(0, 100) : text;
                if (!seen.add(key)) continue;
                found.add(e);
                if (found.size() >= limit) return found;
            }
        }
        return found;
    }

    Candidate fromContainer(Element container) {
        String headline = "";
        for (String css : selectors.headlines()) {
            Element e = Dom.firstSafe(container, css);
            if (e == null) continue;
            String text = Dom.text(e);
            if (text.length() > 15 && text.length() < 500) {
                headline = text;
                break;
            }
        }

        String url = "";
        Element link = findArticleLink(container);
        if (link != null) url = link.absUrl("href");

        String description = "";
        for (String css : selectors.descriptions()) {
            Element e = Dom.firstSafe(container, css);
            if (e == null) continue;
            String text = Dom.text(e);
            if (isDescription(text, headline)) {
                description = truncate(text);
                break;
            }
        }
        if (description.isEmpty()) {
            for (Element p : Dom.descendants(container, "p", 3)) {
                String text = Dom.text(p);
                if (isDescription(text, headline)) {
                    description = truncate(text);
                    break;
                }
            }
        }
        return Candidate.of(headline, url, description, source);
    }

    /** The headline's own link, its enclosing link, a link inside it, else any link with real text. */
    Element findArticleLink(Element container) {
        for (String css : selectors.headlines()) {
            Element e = Dom.firstSafe(container, css);
            if (e == null) continue;
            if ("a".equals(e.normalName()) && e.hasAttr("href")) return e;
            Element parent = Dom.parentLink(e);
            if (parent != null && parent.hasAttr("href")) return parent;
            Element child = Dom.firstDescendant(e, "a[href]");
            if (child != null) return child;
        }
        for (Element a : Dom.descendants(container, "a[href]", 5)) {
            if (Dom.text(a).length() > 15) return a;
        }
        return null;
    }

    List<Candidate> fromLinks(Document doc) {
        LinkFilterRules rules = selectors.linkRules();
        List<Candidate> out = new ArrayList<>();
        for (Element a : Dom.descendants(doc, "a[href]", MAX_LINKS)) {
            String href = a.attr("href");
            String text = Dom.text(a);
            if (!rules.accepts(href, text)) continue;
            String headline = text.length() > 300 ? text.substring(0, 300) : text;
            Candidate c = Candidate.of(headline, a.absUrl("href"), descriptionNear(a), source);
            if (CandidateValidator.isValid(c)) out.add(c);
        }
        return out;
    }

    String descriptionNear(Element link) {
        Element parent = link.parent();
        if (parent == null) return "";
        for (Element p : Dom.descendants(parent, "p", 2)) {
            String text = Dom.text(p);
            if (text.length() > 30 && text.length() < 1000) return truncate(text);
        }
        int checked = 0;
        for (Element sibling = parent.nextElementSibling(); sibling != null && checked < 3;
             sibling = sibling.nextElementSibling(), checked++) {
            if (!"p".equals(sibling.normalName())) continue;
            String text = Dom.text(sibling);
            if (text.length() > 30 && text.length() < 1000) return truncate(text);
        }
        return "";
    }

    List<Candidate> fromSemanticMarkup(Document doc) {
        List<Candidate> out = new ArrayList<>();
        for (Element article : Dom.byTag(doc, "article", MAX_SEMANTIC)) {
            Element heading = Dom.firstDescendant(article, "h1, h2, h3, h4");
            Element link = Dom.firstDescendant(article, "a[href]");
            if (heading == null || link == null) continue;
            Element p = Dom.firstDescendant(article, "p");
            String desc = p == null ? "" : cut(Dom.text(p), 300);
            Candidate c = Candidate.of(Dom.text(heading), link.absUrl("href"), desc, source);
            if (CandidateValidator.isValid(c)) out.add(c);
        }

        for (Element item : doc.select("[itemtype~=(?i)Article|NewsArticle]")) {
            Element headline = Dom.firstDescendant(item, "[itemprop=headline]");
            Element url = Dom.firstDescendant(item, "[itemprop=url]");
            if (headline == null || url == null) continue;
            String href = url.hasAttr("href") ? url.absUrl("href") : url.absUrl("content");
            Element d = Dom.firstDescendant(item, "[itemprop=description]");
            String desc = d == null ? "" : cut(Dom.text(d), 300);
            Candidate c = Candidate.of(Dom.text(headline), href, desc, source);
            if (CandidateValidator.isValid(c)) out.add(c);
        }
        return out;
    }

    private static boolean isDescription(String text, String headline) {
        return text.length() > 30 && text.length() < 1000 && !text.equals(headline);
    }

    private static String truncate(String text) {
        return cut(text, MAX_DESCRIPTION);
    }

    private static String cut(String text, int max) {
        return text.length() > max ? text.substring(0, max) : text;
    }
}
