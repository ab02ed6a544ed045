package kinet.newsfeed;

import java.util.ArrayList;
import java.util.List;

/**
 * Cuts plain text into message-sized parts, preferring paragraph, then line, then word breaks.
 * Escaping happens after splitting so no part ends inside an escape sequence.
 */
public final class MessageSplitter {
    private MessageSplitter(){}

    public static List<String> split(String text, int limit){
        if (limit < 1) throw new IllegalArgumentException("limit must be positive");
        List<String> out = new ArrayList<>();
        if (text == null || text.isBlank()) return out;

        int i = 0;
        while (i < text.length()){
            int end = Math.min(text.length(), i + limit);
            int cut = end == text.length() ? end : lastBreak(text, i, end);
            if (cut <= i) cut = end;
            String part = text.substring(i, cut).strip();
            if (!part.isEmpty()) out.add(part);
            i = cut;
        }
        return out;
    }

    private static int lastBreak(String s, int start, int end){
        int min = start + (end - start) / 4;
        for (String sep : new String[]{"\n\n", "\n", " "}){
            int idx = s.lastIndexOf(sep, end - sep.length());
            if (idx > min) return idx + sep.length();
        }
        return -1;
    }
}
