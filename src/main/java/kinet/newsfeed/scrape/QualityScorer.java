package kinet.newsfeed.scrape;

public final class QualityScorer {
    private QualityScorer() {}

    public static int score(Candidate c) {
        int score = 0;
        if (c.description().length() > 50) score += 2;
        if (c.content().length() > 200) score += 3;
        if (c.publishedDate() != null) score += 1;
        if (c.author() != null && !c.author().isBlank()) score += 1;
        int len = c.headline().length();
        if (len > 20 && len < 200) score += 1;
        if (!isUpperCase(c.headline())) score += 1;
        return score;
    }

    /** Same idea as "has cased letters and all of them are upper". */
    static boolean isUpperCase(String s) {
        boolean cased = false;
        for (int i = 0; i < s.length(); i++) {
            char ch = s.charAt(i);
            if (Character.isLowerCase(ch)) return false;
            if (Character.isUpperCase(ch)) cased = true;
        }
        return cased;
    }
}
