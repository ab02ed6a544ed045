package kinet.newsfeed.scrape;

import org.testng.annotations.Test;

import java.time.Instant;
import java.util.List;

import static org.testng.Assert.*;

public class DeduplicatorTest {

    @Test
    public void firstOccurrenceWinsForUrlAndHeadline() {
        Candidate first = Candidate.of("Budget vote passes in parliament", "https://www.example.com/a/", "first", "example.com");
        Candidate sameUrl = Candidate.of("Different headline entirely here", "http://example.com/a#top", "second", "example.com");
        Candidate sameHeadline = Candidate.of("BUDGET VOTE PASSES IN PARLIAMENT", "https://example.com/b", "third", "example.com");
        Candidate other = Candidate.of("Storm closes mountain roads", "https://example.com/c", "fourth", "example.com");

        List<Candidate> out = Deduplicator.scoreAndDeduplicate(List.of(first, sameUrl, sameHeadline, other));

        assertEquals(out.size(), 2);
        assertEquals(out.stream().map(Candidate::description).toList(), List.of("first", "fourth"));
    }

    @Test
    public void sortsByRelevanceThenQuality() {
        Candidate plain = Candidate.of("Plain story about the town", "https://example.com/1", "", "example.com");
        Candidate rich = new Candidate("Rich story about the town", "https://example.com/2",
                "A description that is clearly longer than fifty characters in total.",
                "", Instant.parse("2024-01-01T00:00:00Z"), "Jane Roe", "example.com", 0, 0);
        Candidate relevant = Candidate.of("Relevant story about markets", "https://example.com/3", "", "example.com")
                .withRelevance(5);

        List<Candidate> out = Deduplicator.scoreAndDeduplicate(List.of(plain, rich, relevant));

        assertEquals(out.get(0).url(), "https://example.com/3");
        assertEquals(out.get(1).url(), "https://example.com/2");
        assertEquals(out.get(2).url(), "https://example.com/1");
        // 2 описание, 1 дата, 1 автор, 1 длина заголовка, 1 не капс
        assertEquals(out.get(1).qualityScore(), 6);
        assertEquals(out.get(2).qualityScore(), 2);
    }
}
