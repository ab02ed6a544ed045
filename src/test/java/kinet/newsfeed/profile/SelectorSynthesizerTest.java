package kinet.newsfeed.profile;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.testng.annotations.Test;

import java.util.List;

import static org.testng.Assert.*;

public class SelectorSynthesizerTest {

    @Test
    public void teaserOutscoresLayoutBlock() {
        Document doc = Jsoup.parse("""
                <div class="news-item">
                  <h3><a href="/a/1">Parliament passes the annual budget bill</a></h3>
                  <p>The vote followed a long debate over spending on schools and roads.</p>
                  <span class="date">Today</span>
                </div>
                <div class="wrapper"><span>Menu</span></div>
                """);
        Element teaser = doc.selectFirst("div.news-item");
        Element wrapper = doc.selectFirst("div.wrapper");

        // 5+3 заголовок, 3 ссылка, 2 абзац, 2 "news" + 2 "item", 2 дата, 1 длина текста
        assertEquals(ContainerScorer.score(teaser), 20);
        assertTrue(ContainerScorer.score(wrapper) < ContainerScorer.KEEP_THRESHOLD);
    }

    @Test
    public void selectorPrefersIdThenMeaningfulClass() {
        Document doc = Jsoup.parse("""
                <div id="main-feed"></div>
                <li class="js-track is-active story-row"></li>
                <section class="x1"></section>
                <span class="2col"></span>
                """);
        assertEquals(SelectorSynthesizer.selectorFor(doc.selectFirst("div")), "div#main-feed");
        assertEquals(SelectorSynthesizer.selectorFor(doc.selectFirst("li")), "li.story-row");
        assertEquals(SelectorSynthesizer.selectorFor(doc.selectFirst("section")), "section");
        assertEquals(SelectorSynthesizer.selectorFor(doc.selectFirst("span")), "span");
    }

    @Test
    public void containersAreCappedAndDistinct() {
        List<String> containers = SelectorSynthesizer.containers(Jsoup.parse("<p>empty</p>"));
        assertEquals(containers.get(0), "article");
        assertEquals(containers.size(), containers.stream().distinct().count());
        assertTrue(containers.size() <= 15);
    }

    @Test
    public void headlinesPickUpTitledHeadingsAndLinkedHeadings() {
        Document doc = Jsoup.parse("""
                <h2 class="card-title">A headline that is long enough</h2>
                <a href="/x"><h3>Another linked headline here</h3></a>
                """);
        List<String> headlines = SelectorSynthesizer.headlines(doc);
        assertEquals(headlines.get(0), "h2.card-title");
        assertEquals(headlines.get(1), "a > h3");
        assertTrue(headlines.contains("h1"));
    }

    @Test
    public void adNoiseRuleDoesNotHitHeaders() {
        Document doc = Jsoup.parse("""
                <div class="ad-banner">buy</div>
                <div class="sidebar ads">buy</div>
                <h2 class="headline">keep</h2>
                <div class="read-more">keep</div>
                """);
        String adRule = SelectorSynthesizer.defaultCleaningRules().stream()
                .filter(r -> r.contains("advert")).findFirst().orElseThrow();
        assertEquals(doc.select(adRule).size(), 2);
    }
}
