package kinet.newsfeed;

/**
 * Canned HTML for tests.
 */
public final class Fixtures {
    private Fixtures() {}

    static final String[] TITLES = {
            "Central bank keeps rates unchanged for now",
            "City council approves new cycling lanes",
            "Local team wins the regional championship",
            "Researchers publish study on sleep habits",
            "Weather service warns of heavy rain tonight",
            "Museum opens exhibition of early photographs"};

    /** A static listing page with six teaser cards linking to {@code https://<host>/story/<i>}. */
    public static String listingPage(String host) {
        StringBuilder sb = new StringBuilder("<html><head><title>Daily</title></head><body>");
        sb.append("<nav><a href=\"/about\">About</a></nav><main>");
        for (int i = 0; i < TITLES.length; i++) {
            sb.append("<article class=\"post-card\"><h2><a href=\"https://").append(host)
                    .append("/story/").append(i).append("\">").append(TITLES[i]).append("</a></h2>")
                    .append("<p class=\"excerpt\">A longer teaser paragraph describing the story number ")
                    .append(i).append(" in enough words to count.</p>")
                    .append("<time datetime=\"2024-04-30T10:00:00Z\">30 April</time></article>");
        }
        sb.append("</main></body></html>");
        return sb.toString();
    }
}
