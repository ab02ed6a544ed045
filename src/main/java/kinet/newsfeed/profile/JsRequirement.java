package kinet.newsfeed.profile;

import kinet.newsfeed.html.Dom;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.regex.Pattern;

/**
 * Page-level signals: does a fetched page list articles, and does it need a browser to do so.
 */
public final class JsRequirement {
    private static final Pattern ARTICLE_LIKE = Pattern.compile("article|post|story|news", Pattern.CASE_INSENSITIVE);
    static final double MIN_TEXT_RATIO = 0.05;

    private JsRequirement() {}

    public static boolean hasMeaningfulContent(Document doc) {
        int articleLinks = 0;
        for (Element a : Dom.descendants(doc, "a[href]", 100)) {
            int len = Dom.text(a).length();
            if (len > 20 && len < 200) articleLinks++;
        }
        int headings = doc.select("h1, h2, h3, h4").size();
        int articleElems = 0;
        for (Element e : doc.select("article, div")) {
            if (ARTICLE_LIKE.matcher(Dom.classAndId(e)).find()) articleElems++;
        }
        return articleLinks >= 5 || headings >= 10 || articleElems >= 3;
    }

    public static boolean requiresJs(Document doc, int responseBytes) {
        boolean appRoot = !doc.select("div[id~=root|app|react]").isEmpty();
        boolean angular = doc.selectFirst("[ng-app], [ng-controller]") != null;

        double ratio = responseBytes > 0 ? (double) doc.text().length() / responseBytes : 0;
        boolean minimalText = ratio < MIN_TEXT_RATIO;

        int articles = Math.min(20, doc.select("article, h2, h3").size());
        int linksWithText = 0;
        for (Element a : Dom.descendants(doc, "a[href]", 50)) {
            if (Dom.text(a).length() > 15) linksWithText++;
        }
        boolean fewElements = articles < 3 && linksWithText < 10;

        boolean loading = doc.selectFirst("[class~=(?i)loading|spinner|skeleton]") != null;

        return appRoot || angular || minimalText || fewElements || loading;
    }
}
