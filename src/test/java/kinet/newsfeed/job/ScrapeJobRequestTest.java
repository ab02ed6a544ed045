package kinet.newsfeed.job;

import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.List;

import static org.testng.Assert.*;

public class ScrapeJobRequestTest {

    @Test
    public void normalizesUrlsAndDropsBlanks() {
        ScrapeJobRequest r = new ScrapeJobRequest(Arrays.asList(" example.com ", "", null, "http://b.test"),
                List.of("ai", "  "), 5);
        assertEquals(r.urls(), List.of("https://example.com", "http://b.test"));
        assertEquals(r.filters(), List.of("ai"));
        assertEquals(r.globalCap(), 10);
    }

    @Test
    public void tasksAreTheCartesianProduct() {
        ScrapeJobRequest r = new ScrapeJobRequest(List.of("a.test", "b.test"), List.of("ai", "chips"),
                List.of("tech"), 5, false);
        List<ScrapeTask> tasks = r.tasks();
        assertEquals(tasks.size(), 4);
        assertEquals(tasks.get(0), new ScrapeTask("https://a.test", "ai", "tech"));
        assertEquals(tasks.get(0).effectiveQuery(), "ai tech");
        assertEquals(new ScrapeTask("https://a.test", "ai", null).effectiveQuery(), "ai");
    }

    @Test
    public void acceptsInternationalizedDomain() {
        ScrapeJobRequest r = new ScrapeJobRequest(List.of("пример.рф"), List.of("новости"), 10);
        assertEquals(r.urls(), List.of("https://пример.рф"));
        assertEquals(r.tasks().size(), 1);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void emptyUrlsAreRejected() {
        new ScrapeJobRequest(List.of(), List.of("news"), 10);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void emptyFiltersAreRejected() {
        new ScrapeJobRequest(List.of("a.test"), List.of(" "), 10);
    }

    @Test
    public void maxResultsBounds() {
        assertThrows(IllegalArgumentException.class, () -> new ScrapeJobRequest(List.of("a.test"), List.of("x"), 0));
        assertThrows(IllegalArgumentException.class, () -> new ScrapeJobRequest(List.of("a.test"), List.of("x"), 101));
        assertEquals(new ScrapeJobRequest(List.of("a.test"), List.of("x"), 100).maxResults(), 100);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void garbageUrlIsRejected() {
        new ScrapeJobRequest(List.of("not a url"), List.of("news"), 10);
    }
}
