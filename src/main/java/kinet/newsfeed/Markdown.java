package kinet.newsfeed;

public final class Markdown {
    private Markdown(){}

    public static String escapeV2(String s){
        if (s == null || s.isEmpty()) return "";
        StringBuilder sb = new StringBuilder(s.length() + 16);
        for (char ch : s.toCharArray()){
            switch (ch){
                case '\\','_','*','[',']','(',')','~','`','>','#','+','-','=','|','{','}','.','!' -> sb.append('\\').append(ch);
                default -> sb.append(ch);
            }
        }
        return sb.toString();
    }

    // для ссылок в круглых скобках MarkdownV2
    public static String escapeUrl(String url){
        if (url == null) return "";
        return url.replace("\\", "%5C").replace("(", "%28").replace(")", "%29").replace(" ", "%20");
    }

    // для caption в ParseMode.HTML
    public static String escapeHtml(String s){
        if (s == null) return "";
        StringBuilder sb = new StringBuilder((int)(s.length()*1.1));
        for (int i = 0; i < s.length(); i++) {
            char ch = s.charAt(i);
            switch (ch) {
                case '&' -> sb.append("&amp;");
                case '<' -> sb.append("&lt;");
                case '>' -> sb.append("&gt;");
                default  -> sb.append(ch);
            }
        }
        return sb.toString();
    }

    // обрезка HTML без незакрытой сущности (&... без ;) на конце
    public static String trimHtml(String html, int max){
        if (html.length() <= max) return html;
        String cut = html.substring(0, Math.max(0, max));
        int amp = cut.lastIndexOf('&');
        if (amp != -1 && cut.indexOf(';', amp) == -1) cut = cut.substring(0, amp);
        return cut + "…";
    }
}
