package kinet.newsfeed.net;

import java.time.Duration;

public record RenderOptions(boolean headless, int viewportWidth, int viewportHeight,
                            Duration pageTimeout, int maxScrolls) {

    public static RenderOptions defaults() {
        return new RenderOptions(true, 1920, 1080, Duration.ofSeconds(30), 4);
    }
}
