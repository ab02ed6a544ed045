package kinet.newsfeed.scrape;

import kinet.newsfeed.html.TextCleaner;

import java.time.Instant;
import java.util.Optional;

/**
 * Validated output unit. Only built through {@link #from(Candidate)}.
 */
public record Article(String headline, String url, String description, String source,
                      Instant publishedDate, String content, int relevanceScore,
                      String sentiment, String category) {

    public static Optional<Article> from(Candidate c) {
        if (!CandidateValidator.isValid(c)) return Optional.empty();
        return Optional.of(new Article(c.headline(), c.url(), blankToNull(c.description()), c.source(),
                c.publishedDate(), blankToNull(c.content()), c.relevanceScore(), null, null));
    }

    public Article withCategory(String category) {
        return new Article(headline, url, description, source, publishedDate, content, relevanceScore, sentiment, category);
    }

    /** Strips characters that downstream encoders reject; a blank source becomes "unknown". */
    public Article sanitized() {
        String src = TextCleaner.sanitize(source);
        return new Article(TextCleaner.sanitize(headline), TextCleaner.sanitize(url),
                blankToNull(TextCleaner.sanitize(description)), src.isEmpty() ? "unknown" : src,
                publishedDate, content == null ? null : TextCleaner.sanitize(content),
                relevanceScore, sentiment, category);
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }
}
