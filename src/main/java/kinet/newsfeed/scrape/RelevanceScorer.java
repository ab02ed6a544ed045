package kinet.newsfeed.scrape;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

public final class RelevanceScorer {
    private static final Logger log = LoggerFactory.getLogger(RelevanceScorer.class);

    static final Set<String> GENERIC_QUERIES = Set.of("news", "latest", "today", "all");

    /**
     * A single-term query shorter than this keeps zero-score candidates too. Tunable: the
     * value carries no deeper meaning than "short words are often abbreviations".
     */
    public static final int LENIENT_QUERY_LENGTH = 5;

    private RelevanceScorer() {}

    public static boolean isGeneric(String query) {
        return query == null || query.isBlank() || GENERIC_QUERIES.contains(query.strip().toLowerCase(Locale.ROOT));
    }

    public static int score(Candidate c, String query) {
        String q = query.strip().toLowerCase(Locale.ROOT);
        Set<String> terms = terms(q);
        String text = String.join(" ", c.headline(), c.description(), c.content()).toLowerCase(Locale.ROOT);
        String headline = c.headline().toLowerCase(Locale.ROOT);

        int score = 0;
        if (text.contains(q)) score += 10;
        for (String t : terms) {
            if (text.contains(t)) score += 3;
        }
        if (headline.contains(q)) score += 15;
        for (String t : terms) {
            if (headline.contains(t)) score += 5;
        }
        for (String t : terms) {
            if (t.length() > 4 && text.contains(t.substring(0, 4))) score += 1;
        }
        return score;
    }

    /**
     * Keeps relevant candidates sorted by score. Returns the input untouched for generic
     * queries, and when nothing at all would survive.
     */
    public static List<Candidate> filter(List<Candidate> candidates, String query) {
        if (isGeneric(query)) return candidates;

        String q = query.strip();
        boolean lenient = terms(q.toLowerCase(Locale.ROOT)).size() == 1 && q.length() < LENIENT_QUERY_LENGTH;

        List<Candidate> kept = new ArrayList<>();
        for (Candidate c : candidates) {
            int s = score(c, q);
            if (s > 0 || lenient) kept.add(c.withRelevance(s));
        }
        if (kept.isEmpty()) {
            log.info("No relevance matches for '{}', returning all {} candidates", q, candidates.size());
            return candidates;
        }
        kept.sort(Comparator.comparingInt(Candidate::relevanceScore).reversed());
        return kept;
    }

    static Set<String> terms(String lowerQuery) {
        Set<String> out = new LinkedHashSet<>();
        for (String t : lowerQuery.split("\\s+")) {
            if (!t.isEmpty()) out.add(t);
        }
        return out;
    }
}
