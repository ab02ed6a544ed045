package kinet.newsfeed.scrape;

import org.testng.annotations.Test;

import java.util.List;

import static org.testng.Assert.*;

public class RelevanceScorerTest {

    private static Candidate c(String headline, String description) {
        return Candidate.of(headline, "https://example.com/" + headline.hashCode(), description, "example.com");
    }

    @Test
    public void scoreFollowsTheFormula() {
        Candidate headlineHit = c("Stock markets rally today strongly", "");
        // +10 фраза, +3+3 слова, +15 фраза в заголовке, +5+5 слова в заголовке, +1+1 префиксы
        assertEquals(RelevanceScorer.score(headlineHit, "stock markets"), 43);

        Candidate bodyHit = c("Quiet day in the city centre", "Traders say stock markets were calm.");
        assertEquals(RelevanceScorer.score(bodyHit, "Stock Markets"), 10 + 3 + 3 + 1 + 1);

        Candidate partial = c("Marketing budgets shrink again", "");
        assertEquals(RelevanceScorer.score(partial, "markets"), 1);
    }

    @Test
    public void keepsOnlyMatchesSortedByScore() {
        Candidate weak = c("Oil prices edge higher today", "Analysts watch emerging markets closely.");
        Candidate none = c("Museum opens a new wing", "Visitors queue for the opening.");
        Candidate strong = c("Global markets slide on fears", "");

        List<Candidate> out = RelevanceScorer.filter(List.of(weak, none, strong), "markets");
        assertEquals(out.size(), 2);
        assertEquals(out.get(0).headline(), strong.headline());
        assertEquals(out.get(1).headline(), weak.headline());
        assertTrue(out.get(0).relevanceScore() > out.get(1).relevanceScore());
    }

    @Test
    public void returnsEverythingWhenNothingMatches() {
        List<Candidate> in = List.of(c("Museum opens a new wing", ""), c("Team wins the final match", ""));
        List<Candidate> out = RelevanceScorer.filter(in, "volcano");
        assertEquals(out, in);
    }

    @Test
    public void shortSingleTermIsLenient() {
        Candidate hit = c("New AI model tops benchmarks", "");
        Candidate miss = c("Museum opens a new wing", "");
        List<Candidate> out = RelevanceScorer.filter(List.of(miss, hit), "AI");
        assertEquals(out.size(), 2);
        assertEquals(out.get(0).headline(), hit.headline());
        assertEquals(out.get(1).relevanceScore(), 0);
    }

    @Test
    public void genericQueriesSkipFiltering() {
        List<Candidate> in = List.of(c("Museum opens a new wing", ""));
        assertSame(RelevanceScorer.filter(in, " Latest "), in);
        assertSame(RelevanceScorer.filter(in, ""), in);
        assertTrue(RelevanceScorer.isGeneric(null));
        assertFalse(RelevanceScorer.isGeneric("news today"));
    }
}
