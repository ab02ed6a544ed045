package kinet.newsfeed;

import kinet.newsfeed.job.ScrapeJobRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.telegram.telegrambots.client.okhttp.OkHttpTelegramClient;
import org.telegram.telegrambots.longpolling.TelegramBotsLongPollingApplication;

public class Bot {
    private static final Logger log = LoggerFactory.getLogger(Bot.class);

    public static void main(String[] args) throws Exception {
        String token = System.getenv("token");
        if (token == null || token.isBlank()) {
            log.error("Environment variable 'token' is not set");
            System.exit(1);
        }
        NewsFeedConfig config = NewsFeedConfig.fromEnv();
        var runner = ScrapeJobRunner.create(config);
        var app = new TelegramBotsLongPollingApplication();
        app.registerBot(token, new NewsFeedBot(new OkHttpTelegramClient(token), runner));
        log.info("NewsFeed bot started, profiles in {}", config.profileDir().toAbsolutePath());
    }
}
