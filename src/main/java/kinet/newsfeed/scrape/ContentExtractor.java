package kinet.newsfeed.scrape;

import kinet.newsfeed.html.Dom;
import kinet.newsfeed.html.TextCleaner;
import org.jsoup.nodes.Comment;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.select.Elements;
import org.jsoup.select.NodeTraversor;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Readability-style body extraction for a single article page.
 */
public final class ContentExtractor {

    static final List<String> NOISE = List.of(
            "script", "style", "nav", "footer", "header", "aside",
            "[class*=sidebar]", "[class*=menu]",
            "[class~=(?i)(^|\\s|-|_)(ad|ads|advert|advertisement)(\\s|-|_|$)]", "[class*=banner]",
            "[class*=related]", "[class*=recommended]", "[class*=popular]",
            "[class*=share]", "[class*=social]", "[class*=comment]",
            "[class*=newsletter]", "[class*=subscribe]",
            "iframe", "form", "[role=complementary]");

    static final List<String> CONTENT_REGIONS = List.of(
            "article",
            "[role=main]",
            "main",
            "[class*=article-content]",
            "[class*=article-body]",
            "[class*=post-content]",
            "[class*=post-body]",
            "[class*=entry-content]",
            "[class*=story-body]",
            "[class*=article__body]",
            "[itemprop=articleBody]",
            "#article-body",
            "#content",
            ".content");

    static final int MIN_REGION_PARAGRAPHS = 3;
    static final int MIN_TEXT = 200;
    static final int LOOSE_PARAGRAPHS = 10;

    public enum Source { CONTENT_REGION, DENSEST_BLOCK, LOOSE_PARAGRAPHS, NONE }

    public record Extraction(String text, Source source) {
        public static final Extraction NONE = new Extraction("", Source.NONE);

        public boolean found() {
            return source != Source.NONE;
        }
    }

    private ContentExtractor() {}

    /** Removes noise blocks (plus the profile's own rules) and HTML comments, in place. */
    public static void stripNoise(Document doc, List<String> cleaningRules) {
        LinkedHashSet<String> rules = new LinkedHashSet<>(NOISE);
        rules.addAll(cleaningRules);
        for (String css : rules) {
            Dom.selectSafe(doc, css).remove();
        }
        List<Node> comments = new ArrayList<>();
        NodeTraversor.traverse((node, depth) -> {
            if (node instanceof Comment) comments.add(node);
        }, doc);
        comments.forEach(Node::remove);
    }

    public static Extraction extract(Document doc, List<String> contentSelectors) {
        LinkedHashSet<String> regions = new LinkedHashSet<>(contentSelectors);
        regions.addAll(CONTENT_REGIONS);
        for (String css : regions) {
            for (Element region : Dom.selectSafe(doc, css)) {
                Elements ps = region.select("p");
                if (ps.size() < MIN_REGION_PARAGRAPHS) continue;
                String text = joinText(ps);
                if (text.length() > MIN_TEXT) return new Extraction(TextCleaner.clean(text), Source.CONTENT_REGION);
            }
        }

        Element best = null;
        String bestText = "";
        double bestScore = 0;
        for (Element block : doc.select("div, section, article, main")) {
            List<Element> ps = directParagraphs(block);
            if (ps.size() < 2) continue;
            String text = joinText(ps);
            if (text.length() <= MIN_TEXT) continue;
            double score = blockScore(text.length(), ps.size(), linkTextLength(block));
            if (score > bestScore) {
                bestScore = score;
                best = block;
                bestText = text;
            }
        }
        if (best != null) return new Extraction(TextCleaner.clean(bestText), Source.DENSEST_BLOCK);

        Elements all = doc.select("p");
        if (all.size() >= MIN_REGION_PARAGRAPHS) {
            List<Element> first = all.subList(0, Math.min(LOOSE_PARAGRAPHS, all.size()));
            return new Extraction(TextCleaner.clean(joinText(first)), Source.LOOSE_PARAGRAPHS);
        }
        return Extraction.NONE;
    }

    /** text length + 50 per paragraph, damped by the share of text that sits inside links. */
    static double blockScore(int textLength, int paragraphs, int linkTextLength) {
        double score = textLength + 50.0 * paragraphs;
        double density = textLength > 0 ? (double) linkTextLength / textLength : 1;
        return density < 0.3 ? score * (1 - density) : score * 0.5;
    }

    private static List<Element> directParagraphs(Element block) {
        List<Element> out = new ArrayList<>();
        for (Element child : block.children()) {
            if ("p".equals(child.normalName())) out.add(child);
        }
        return out;
    }

    private static int linkTextLength(Element block) {
        int n = 0;
        for (Element a : block.select("a")) n += Dom.text(a).length();
        return n;
    }

    private static String joinText(List<Element> ps) {
        return ps.stream().map(Dom::text).filter(t -> !t.isEmpty()).collect(Collectors.joining(" "));
    }
}
