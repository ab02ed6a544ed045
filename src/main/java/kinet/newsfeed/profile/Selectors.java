package kinet.newsfeed.profile;

import java.util.List;

/**
 * Ordered extraction rules per field; earlier selectors are tried first.
 */
public record Selectors(List<String> containers, List<String> headlines, List<String> descriptions,
                        List<String> content, List<String> dates, List<String> authors,
                        LinkFilterRules linkRules) {

    public Selectors {
        containers = List.copyOf(containers);
        headlines = List.copyOf(headlines);
        descriptions = List.copyOf(descriptions);
        content = List.copyOf(content);
        dates = List.copyOf(dates);
        authors = List.copyOf(authors);
    }

    /** Conservative set covering the usual article/post/story/card naming. */
    public static Selectors generic(String domain) {
        return new Selectors(
                List.of("article", "div[class*=article]", "div[class*=post]",
                        "div[class*=story]", "li[class*=item]", "div[class*=card]",
                        "section[class*=content]", "div[class*=entry]",
                        "[class*=news]", "[itemtype*=Article]"),
                List.of("h1", "h2", "h3", "h4",
                        "a > h2", "a > h3", "a > h4",
                        "[class*=headline]", "[class*=title]",
                        "article h2", "article h3",
                        "div[class*=article] h2"),
                List.of("p", "div[class*=excerpt]", "div[class*=description]",
                        "span[class*=summary]", "article p:first-of-type"),
                List.of("article", "[class*=content]", "[class*=body]", "main", "[role=main]"),
                List.of("time", "[class*=date]"),
                List.of("[class*=author]"),
                LinkFilterRules.forDomain(domain));
    }
}
