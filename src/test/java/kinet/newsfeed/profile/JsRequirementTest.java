package kinet.newsfeed.profile;

import kinet.newsfeed.Fixtures;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.testng.annotations.Test;

import java.nio.charset.StandardCharsets;

import static org.testng.Assert.*;

public class JsRequirementTest {

    private static int bytes(String html) {
        return html.getBytes(StandardCharsets.UTF_8).length;
    }

    @Test
    public void spaShellNeedsJs() {
        String html = "<html><head><script src=\"/bundle.js\"></script></head><body><div id=\"root\"></div></body></html>";
        Document doc = Jsoup.parse(html);
        assertTrue(JsRequirement.requiresJs(doc, bytes(html)));
        assertFalse(JsRequirement.hasMeaningfulContent(doc));
    }

    @Test
    public void staticListingDoesNotNeedJs() {
        String html = Fixtures.listingPage("site.test");
        Document doc = Jsoup.parse(html);
        assertFalse(JsRequirement.requiresJs(doc, bytes(html)));
        assertTrue(JsRequirement.hasMeaningfulContent(doc));
    }

    @Test
    public void skeletonPlaceholdersNeedJs() {
        String html = Fixtures.listingPage("site.test")
                .replace("<main>", "<main><div class=\"feed skeleton\"></div>");
        assertTrue(JsRequirement.requiresJs(Jsoup.parse(html), bytes(html)));
    }

    @Test
    public void headingsAloneMakeAPageMeaningful() {
        StringBuilder sb = new StringBuilder("<body>");
        for (int i = 0; i < 10; i++) sb.append("<h3>Item ").append(i).append("</h3>");
        assertTrue(JsRequirement.hasMeaningfulContent(Jsoup.parse(sb.toString())));
    }
}
