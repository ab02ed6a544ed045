package kinet.newsfeed.html;

import java.util.regex.Pattern;

public final class TextCleaner {
    private static final Pattern SPACES = Pattern.compile("\\s+");
    private static final Pattern SPECIAL = Pattern.compile("[^\\w\\s\\-.,!?:;()'\"]+",
            Pattern.UNICODE_CHARACTER_CLASS);
    // непарные суррогаты и управляющие символы, кроме переводов строк и табуляции
    private static final Pattern INVALID = Pattern.compile(
            "[\\p{Cc}&&[^\\n\\t\\r]]|[\\x{D800}-\\x{DFFF}]");

    private TextCleaner() {}

    /** Collapses whitespace and drops symbols other than basic punctuation. */
    public static String clean(String text) {
        if (text == null) return "";
        String t = SPACES.matcher(text).replaceAll(" ");
        t = SPECIAL.matcher(t).replaceAll("");
        return t.strip();
    }

    /** Removes characters that break JSON/chat encoders; {@code null} becomes empty. */
    public static String sanitize(String text) {
        if (text == null) return "";
        return INVALID.matcher(text).replaceAll("").strip();
    }

    public static String truncate(String text, int max) {
        if (text == null) return "";
        return text.length() <= max ? text : text.substring(0, max);
    }
}
