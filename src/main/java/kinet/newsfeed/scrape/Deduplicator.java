package kinet.newsfeed.scrape;

import kinet.newsfeed.net.Urls;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

public final class Deduplicator {
    private Deduplicator() {}

    /**
     * Drops candidates whose URL or lower-cased headline was already seen (first one wins),
     * assigns quality scores and sorts by (relevance, quality) descending. The sort is stable.
     */
    public static List<Candidate> scoreAndDeduplicate(List<Candidate> candidates) {
        Set<String> seenUrls = new HashSet<>();
        Set<String> seenHeadlines = new HashSet<>();
        List<Candidate> unique = new ArrayList<>();

        for (Candidate c : candidates) {
            String urlKey = Urls.dedupKey(c.url());
            String headlineKey = c.headline().toLowerCase(Locale.ROOT);
            if (seenUrls.contains(urlKey) || seenHeadlines.contains(headlineKey)) continue;
            seenUrls.add(urlKey);
            seenHeadlines.add(headlineKey);
            unique.add(c.withQuality(QualityScorer.score(c)));
        }

        unique.sort(Comparator.comparingInt(Candidate::relevanceScore)
                .thenComparingInt(Candidate::qualityScore)
                .reversed());
        return unique;
    }
}
