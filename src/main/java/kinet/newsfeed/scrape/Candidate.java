package kinet.newsfeed.scrape;

import java.time.Instant;
import java.util.Objects;

/**
 * In-flight extraction record, not yet validated. Description and content are never null.
 */
public record Candidate(String headline, String url, String description, String content,
                        Instant publishedDate, String author, String source,
                        int relevanceScore, int qualityScore) {

    public Candidate {
        headline = Objects.requireNonNullElse(headline, "");
        url = Objects.requireNonNullElse(url, "");
        description = Objects.requireNonNullElse(description, "");
        content = Objects.requireNonNullElse(content, "");
        source = Objects.requireNonNullElse(source, "");
    }

    public static Candidate of(String headline, String url, String description, String source) {
        return new Candidate(headline, url, description, "", null, null, source, 0, 0);
    }

    public Candidate withContent(String content, Instant publishedDate, String author) {
        return new Candidate(headline, url, description, content,
                publishedDate != null ? publishedDate : this.publishedDate,
                author != null ? author : this.author,
                source, relevanceScore, qualityScore);
    }

    public Candidate withRelevance(int score) {
        return new Candidate(headline, url, description, content, publishedDate, author, source, score, qualityScore);
    }

    public Candidate withQuality(int score) {
        return new Candidate(headline, url, description, content, publishedDate, author, source, relevanceScore, score);
    }
}
