package kinet.newsfeed.scrape;

import kinet.newsfeed.net.Urls;

import java.util.regex.Pattern;

public final class CandidateValidator {
    public static final int MIN_HEADLINE = 15;
    public static final int MAX_HEADLINE = 500;

    private static final Pattern DIGITS_ONLY = Pattern.compile("^\\d+$");
    private static final Pattern ALL_CAPS = Pattern.compile("^[A-Z\\s]+$");
    private static final Pattern CALL_TO_ACTION = Pattern.compile("^(click here|read more)", Pattern.CASE_INSENSITIVE);

    private CandidateValidator() {}

    public static boolean isValid(Candidate c) {
        if (c == null) return false;
        String headline = c.headline();
        String url = c.url();
        if (headline.isEmpty() || url.isEmpty()) return false;
        if (headline.length() < MIN_HEADLINE || headline.length() > MAX_HEADLINE) return false;
        if (!Urls.isHttp(url)) return false;
        return !isSpam(headline);
    }

    static boolean isSpam(String headline) {
        return DIGITS_ONLY.matcher(headline).matches()
                || ALL_CAPS.matcher(headline).matches()
                || CALL_TO_ACTION.matcher(headline).find();
    }
}
