package kinet.newsfeed.scrape;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import kinet.newsfeed.net.Json;
import kinet.newsfeed.profile.ApiKind;
import org.testng.annotations.Test;

import java.util.List;

import static org.testng.Assert.*;

public class ApiResultParserTest {
    private final ObjectMapper mapper = Json.newMapper();

    @Test
    public void wordPressRenderedFieldsAreStripped() throws Exception {
        JsonNode json = mapper.readTree("""
                [{"title":{"rendered":"Markets &amp; <em>money</em> weekly"},
                  "link":"https://blog.test/markets-money",
                  "excerpt":{"rendered":"<p>Short summary of the week.</p>"},
                  "content":{"rendered":"<p>Full body.</p>"}},
                 {"title":{"rendered":""},"link":"https://blog.test/empty"}]
                """);
        List<Candidate> out = ApiResultParser.parse(json, ApiKind.WORDPRESS, "https://blog.test", "blog.test");
        assertEquals(out.size(), 1);
        Candidate c = out.get(0);
        assertEquals(c.headline(), "Markets & money weekly");
        assertEquals(c.description(), "Short summary of the week.");
        assertEquals(c.content(), "Full body.");
        assertEquals(c.source(), "blog.test");
    }

    @Test
    public void genericResponseGuessesFieldsAndResolvesLinks() throws Exception {
        JsonNode json = mapper.readTree("""
                {"meta":{"total":2},
                 "results":[
                   {"headline":"Council approves new budget plan","url":"/news/budget","summary":"Vote was close."},
                   {"name":"No link here at all"}]}
                """);
        List<Candidate> out = ApiResultParser.parse(json, ApiKind.REST, "https://site.test", "site.test");
        assertEquals(out.size(), 1);
        assertEquals(out.get(0).url(), "https://site.test/news/budget");
        assertEquals(out.get(0).description(), "Vote was close.");
    }

    @Test
    public void nestedGraphQlArrayIsFound() throws Exception {
        JsonNode json = mapper.readTree("""
                {"data":{"search":{"edges":[{"title":"Graph headline number one","link":"https://g.test/1"}]}}}
                """);
        assertEquals(ApiResultParser.parse(json, ApiKind.GRAPHQL, "https://g.test", "g.test").size(), 1);
    }

    @Test
    public void unexpectedShapeYieldsNothing() throws Exception {
        assertTrue(ApiResultParser.parse(mapper.readTree("{\"ok\":true}"), ApiKind.REST, "https://x.test", "x.test").isEmpty());
        assertTrue(ApiResultParser.parse(mapper.readTree("{\"ok\":true}"), ApiKind.WORDPRESS, "https://x.test", "x.test").isEmpty());
    }
}
