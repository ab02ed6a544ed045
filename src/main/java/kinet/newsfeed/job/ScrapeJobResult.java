package kinet.newsfeed.job;

import kinet.newsfeed.scrape.Article;

import java.time.Duration;
import java.util.List;

/**
 * @param totalCount unique articles before the global cap
 * @param sourcesScrapedCount distinct job URLs that yielded at least one article
 * @param errors one message per failed task, in task order
 */
public record ScrapeJobResult(List<Article> articles, int totalCount, int sourcesScrapedCount,
                              Duration elapsed, List<String> errors) {

    public ScrapeJobResult {
        articles = List.copyOf(articles);
        errors = List.copyOf(errors);
    }

    public double elapsedSeconds() {
        return elapsed.toMillis() / 1000.0;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
