package kinet.newsfeed;

import org.testng.annotations.Test;

import static org.testng.Assert.*;

public class MarkdownTest {

    @Test
    public void escapesEveryReservedCharacter() {
        assertEquals(Markdown.escapeV2("a_b*c[d](e)~`>#+-=|{}.!\\"),
                "a\\_b\\*c\\[d\\]\\(e\\)\\~\\`\\>\\#\\+\\-\\=\\|\\{\\}\\.\\!\\\\");
        assertEquals(Markdown.escapeV2(null), "");
        assertEquals(Markdown.escapeV2("Привет, мир"), "Привет, мир");
    }

    @Test
    public void urlInParenthesesIsSafe() {
        assertEquals(Markdown.escapeUrl("https://a.test/x (1)"), "https://a.test/x%20%281%29");
    }

    @Test
    public void htmlCaptionNeverEndsInsideEntity() {
        assertEquals(Markdown.escapeHtml("<b>&"), "&lt;b&gt;&amp;");
        String trimmed = Markdown.trimHtml("abc&amp;def", 5);
        assertEquals(trimmed, "abc…");
        assertEquals(Markdown.trimHtml("short", 10), "short");
    }
}
