package kinet.newsfeed.profile;

import kinet.newsfeed.html.Dom;
import org.jsoup.nodes.Element;

import java.util.List;

/**
 * Scores how much an element looks like one article teaser in a listing.
 */
public final class ContainerScorer {
    public static final int KEEP_THRESHOLD = 6;

    static final List<String> KEYWORDS = List.of(
            "article", "post", "story", "news", "item", "entry",
            "card", "teaser", "listing", "feed", "result", "tile");

    private ContainerScorer() {}

    public static int score(Element elem) {
        int score = 0;

        Element heading = Dom.firstDescendant(elem, "h1, h2, h3, h4, h5, h6");
        if (heading != null) {
            score += 5;
            if (Dom.text(heading).length() > 15) score += 3;
        }

        for (Element a : Dom.descendants(elem, "a[href]", 3)) {
            int len = Dom.text(a).length();
            if (len > 20 && len < 300) {
                score += 3;
                break;
            }
        }

        List<Element> ps = Dom.descendants(elem, "p", 2);
        if (!ps.isEmpty() && Dom.text(ps.get(0)).length() > 30) score += 2;

        String attrs = Dom.classAndId(elem);
        for (String kw : KEYWORDS) {
            if (attrs.contains(kw)) score += 2;
        }

        if (Dom.firstDescendant(elem, "img") != null) score += 1;

        if (Dom.firstDescendant(elem, "time") != null
                || Dom.firstDescendant(elem, "[class~=(?i)date|time]") != null) {
            score += 2;
        }

        int textLength = Dom.text(elem).length();
        if (textLength > 50 && textLength < 2000) score += 1;

        return score;
    }
}
