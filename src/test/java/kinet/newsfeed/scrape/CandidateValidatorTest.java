package kinet.newsfeed.scrape;

import org.testng.annotations.Test;

import static org.testng.Assert.*;

public class CandidateValidatorTest {

    private static Candidate c(String headline, String url) {
        return Candidate.of(headline, url, "", "example.com");
    }

    @Test
    public void headlineLengthBounds() {
        assertFalse(CandidateValidator.isValid(c("Ten chars!", "https://example.com/a")));
        assertTrue(CandidateValidator.isValid(c("Fifteen chars!!", "https://example.com/a")));
        assertFalse(CandidateValidator.isValid(c("x".repeat(501), "https://example.com/a")));
        assertTrue(CandidateValidator.isValid(c("Long story " + "x".repeat(489), "https://example.com/a")));
    }

    @Test
    public void urlMustBeHttp() {
        assertFalse(CandidateValidator.isValid(c("A perfectly fine headline", "")));
        assertFalse(CandidateValidator.isValid(c("A perfectly fine headline", "/relative/path")));
        assertFalse(CandidateValidator.isValid(c("A perfectly fine headline", "ftp://example.com/a")));
        assertTrue(CandidateValidator.isValid(c("A perfectly fine headline", "HTTP://example.com/a")));
    }

    @Test
    public void spamHeadlinesAreRejected() {
        assertTrue(CandidateValidator.isSpam("12345"));
        assertTrue(CandidateValidator.isSpam("CLICK HERE NOW"));
        assertTrue(CandidateValidator.isSpam("Read more about this"));
        assertFalse(CandidateValidator.isSpam("NASA launches new probe"));
        assertFalse(CandidateValidator.isSpam("Why you should read more books"));

        assertFalse(CandidateValidator.isValid(c("123456789012345678", "https://example.com/a")));
        assertFalse(CandidateValidator.isValid(c("CLICK HERE NOW FOR DEALS", "https://example.com/a")));
    }

    @Test
    public void nullIsInvalid() {
        assertFalse(CandidateValidator.isValid(null));
    }
}
