package kinet.newsfeed;

import org.testng.annotations.Test;

import java.util.List;

import static org.testng.Assert.*;

public class MessageSplitterTest {

    @Test
    public void shortTextIsOnePart() {
        assertEquals(MessageSplitter.split("hello", 100), List.of("hello"));
        assertTrue(MessageSplitter.split("   ", 100).isEmpty());
        assertTrue(MessageSplitter.split(null, 100).isEmpty());
    }

    @Test
    public void prefersParagraphThenWordBreaks() {
        String text = "first paragraph here\n\nsecond paragraph";
        assertEquals(MessageSplitter.split(text, 30), List.of("first paragraph here", "second paragraph"));

        List<String> words = MessageSplitter.split("alpha beta gamma delta", 12);
        assertEquals(words, List.of("alpha beta", "gamma delta"));
    }

    @Test
    public void hardCutWhenNoBreakExists() {
        List<String> parts = MessageSplitter.split("x".repeat(25), 10);
        assertEquals(parts.size(), 3);
        assertEquals(parts.get(0).length(), 10);
        assertEquals(String.join("", parts), "x".repeat(25));
    }
}
