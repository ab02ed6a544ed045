package kinet.newsfeed.net;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

public record FetchedPage(String url, int statusCode, byte[] body, String contentType) {

    public int size() {
        return body == null ? 0 : body.length;
    }

    public String text() {
        if (body == null) return "";
        return new String(body, charset());
    }

    private Charset charset() {
        if (contentType != null) {
            int i = contentType.toLowerCase().indexOf("charset=");
            if (i >= 0) {
                String name = contentType.substring(i + 8).replace("\"", "").split(";")[0].trim();
                try {
                    return Charset.forName(name);
                } catch (IllegalArgumentException e) {
                    // неизвестная кодировка в заголовке, читаем как UTF-8
                    return StandardCharsets.UTF_8;
                }
            }
        }
        return StandardCharsets.UTF_8;
    }
}
