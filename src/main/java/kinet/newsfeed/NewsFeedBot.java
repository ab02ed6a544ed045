package kinet.newsfeed;

import kinet.newsfeed.job.ScrapeJobRequest;
import kinet.newsfeed.job.ScrapeJobResult;
import kinet.newsfeed.job.ScrapeJobRunner;
import kinet.newsfeed.profile.CachedProfile;
import kinet.newsfeed.profile.Profile;
import kinet.newsfeed.profile.SearchStrategy;
import kinet.newsfeed.scrape.Article;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.telegram.telegrambots.longpolling.util.LongPollingSingleThreadUpdateConsumer;
import org.telegram.telegrambots.meta.api.methods.AnswerCallbackQuery;
import org.telegram.telegrambots.meta.api.methods.ParseMode;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.InlineKeyboardMarkup;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.ReplyKeyboardMarkup;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.InlineKeyboardButton;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.InlineKeyboardRow;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.KeyboardButton;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.KeyboardRow;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.exceptions.TelegramApiRequestException;
import org.telegram.telegrambots.meta.generics.TelegramClient;

import java.io.IOException;
import java.time.format.DateTimeFormatter;
import java.time.ZoneOffset;
import java.util.*;
import java.util.concurrent.*;

public class NewsFeedBot implements LongPollingSingleThreadUpdateConsumer {
    private static final Logger log = LoggerFactory.getLogger(NewsFeedBot.class);

    static final int TG_MSG_LIMIT = 4096;      // лимит текста сообщений
    static final int TG_CAPTION_SAFE = 900;    // держим caption <1024 (запас под теги/сущности)
    static final int PLAIN_PART = 2000;        // после экранирования MarkdownV2 влезает в лимит
    static final int PAGE_SIZE = 3;
    static final int MAX_RESULTS = 10;

    private final TelegramClient tg;
    private final ScrapeJobRunner runner;

    private final Map<Long, FeedState> state = new ConcurrentHashMap<>();

    // пул для тяжёлых задач, чтобы не блокировать consume
    private final ExecutorService workers = Executors.newFixedThreadPool(
            Math.max(2, Runtime.getRuntime().availableProcessors() / 2),
            r -> { Thread t = new Thread(r, "newsfeed-bot-worker"); t.setDaemon(true); return t; });

    public NewsFeedBot(TelegramClient telegramClient, ScrapeJobRunner runner) {
        this.tg = telegramClient;
        this.runner = runner;
    }

    @Override
    public void consume(Update upd) {
        try {
            if (upd.hasCallbackQuery()) {
                onCallback(upd);
                return;
            }
            if (upd.hasMessage() && upd.getMessage().hasText()) {
                onMessage(upd);
            }
        } catch (Exception e) {
            log.warn("consume failed: {}", e.getMessage(), e);
        }
    }

    private void onMessage(Update upd) throws TelegramApiException {
        var msg = upd.getMessage();
        long chatId = msg.getChatId();
        String text = msg.getText().trim();

        state.putIfAbsent(chatId, new FeedState());

        String command = text.split("\\s+", 2)[0];
        String args = text.length() > command.length() ? text.substring(command.length()).trim() : "";
        // /scrape@MyBot -> /scrape
        int at = command.indexOf('@');
        if (at > 0) command = command.substring(0, at);

        switch (command) {
            case "/start", "/help" -> sendText(chatId, HELP, replyKb());
            case "/scrape" -> startJob(chatId, args, false);
            case "/refresh" -> startJob(chatId, args, true);
            case "/profiles", "📚 Профили" -> workers.submit(() -> runSafely(chatId, () -> listProfiles(chatId)));
            case "/forget" -> workers.submit(() -> runSafely(chatId, () -> forget(chatId, args)));
            case "/probe" -> workers.submit(() -> runSafely(chatId, () -> probe(chatId, args)));
            case "▶️" , "▶️ Вперёд" -> showPage(chatId, +1);
            case "◀️", "◀️ Назад" -> showPage(chatId, -1);
            default -> sendText(chatId, "Не понял. " + HELP, replyKb());
        }
    }

    private static final String HELP = """
            Я собираю новости с любых сайтов.
            /scrape <url>[,<url>...] <запрос> - найти статьи
            /refresh <url> <запрос> - то же, но заново определить структуру сайта
            /profiles - сохранённые профили сайтов
            /forget <домен> - забыть профиль сайта
            /probe <url> - показать, как я вижу сайт
            Листай результаты кнопками «◀️ Назад» и «▶️ Вперёд».
            """;

    private void onCallback(Update upd) {
        var cq = upd.getCallbackQuery();
        Long chatId = cq.getMessage() != null ? cq.getMessage().getChatId() : null;
        String data = cq.getData();
        log.debug("callback from={} chat={} data={}", cq.getFrom() != null ? cq.getFrom().getId() : null, chatId, data);

        try {
            if (data != null && data.startsWith("f:")) {
                safeAnswerOk(cq.getId(), "Открываю…"); // гасим «часики» сразу
                FeedState st = chatId == null ? null : state.get(chatId);
                Article article = st == null ? null : st.byToken(data);
                if (article == null) {
                    safeAnswerAlert(cq.getId(), "Кнопка устарела");
                    return;
                }
                if (chatId == null) return;
                workers.submit(() -> runSafely(chatId, () -> sendFullArticle(chatId, article)));
                return;
            }

            switch (String.valueOf(data)) {
                case "page:prev" -> { if (chatId != null) showPage(chatId, -1); safeAnswerOk(cq.getId(), "◀️"); }
                case "page:next" -> { if (chatId != null) showPage(chatId, +1); safeAnswerOk(cq.getId(), "▶️"); }
                case "noop"      -> safeAnswerOk(cq.getId(), null);
                default          -> safeAnswerAlert(cq.getId(), "Неизвестная команда");
            }
        } catch (Exception e) {
            log.warn("callback {} failed: {}", data, e.getMessage());
            safeAnswerOk(cq.getId(), null);
        }
    }

    // ---- задания ----

    private void startJob(long chatId, String args, boolean forceRefresh) throws TelegramApiException {
        ScrapeCommand cmd = ScrapeCommand.parse(args);
        if (cmd == null) {
            sendText(chatId, "Формат: /scrape <url>[,<url>...] <запрос>", replyKb());
            return;
        }
        sendText(chatId, "Ищу «" + cmd.query() + "» на " + String.join(", ", cmd.urls()) + "…", null);
        workers.submit(() -> runSafely(chatId, () -> {
            ScrapeJobResult result;
            try {
                result = runner.run(new ScrapeJobRequest(cmd.urls(), List.of(cmd.query()), List.of(),
                        MAX_RESULTS, forceRefresh));
            } catch (IllegalArgumentException e) {
                sendText(chatId, "Неверный запрос: " + e.getMessage(), replyKb());
                return;
            }
            var st = state.computeIfAbsent(chatId, k -> new FeedState());
            st.replace(result.articles());
            sendText(chatId, summary(result), replyKb());
            if (!result.articles().isEmpty()) showPage(chatId, +1);
        }));
    }

    static String summary(ScrapeJobResult result) {
        StringBuilder sb = new StringBuilder();
        sb.append("Найдено статей: ").append(result.articles().size())
                .append(" (уникальных ").append(result.totalCount()).append(")")
                .append(", источников: ").append(result.sourcesScrapedCount())
                .append(String.format(Locale.ROOT, ", %.1f с", result.elapsedSeconds()));
        if (result.hasErrors()) {
            sb.append("\nОшибки:");
            result.errors().stream().limit(5).forEach(e -> sb.append("\n• ").append(e));
            if (result.errors().size() > 5) sb.append("\n… и ещё ").append(result.errors().size() - 5);
        }
        return sb.toString();
    }

    private void listProfiles(long chatId) throws IOException, TelegramApiException {
        List<CachedProfile> profiles = runner.profiles();
        if (profiles.isEmpty()) {
            sendText(chatId, "Профилей пока нет.", replyKb());
            return;
        }
        StringBuilder sb = new StringBuilder("Профили сайтов:");
        for (CachedProfile p : profiles) {
            sb.append("\n• ").append(p.domain()).append(" - ").append(p.strategy())
                    .append(p.requiresJs() ? ", JS" : "");
            if (p.cachedAt() != null) sb.append(", ").append(DATE.format(p.cachedAt()));
        }
        sendText(chatId, sb.toString(), replyKb());
    }

    private void forget(long chatId, String domain) throws IOException, TelegramApiException {
        if (domain.isBlank()) {
            sendText(chatId, "Формат: /forget <домен>", replyKb());
            return;
        }
        boolean removed = runner.forget(domain);
        sendText(chatId, removed ? "Профиль " + domain + " удалён." : "Профиль " + domain + " не найден.", replyKb());
    }

    private void probe(long chatId, String url) throws TelegramApiException {
        if (url.isBlank()) {
            sendText(chatId, "Формат: /probe <url>", replyKb());
            return;
        }
        Profile p;
        try {
            p = runner.probe(url);
        } catch (IllegalArgumentException e) {
            sendText(chatId, e.getMessage(), replyKb());
            return;
        }
        sendText(chatId, describe(p), replyKb());
    }

    static String describe(Profile p) {
        StringBuilder sb = new StringBuilder();
        sb.append(p.domain()).append("\nСтратегия: ").append(SearchStrategy.describe(p.strategy()));
        sb.append("\nНужен JS: ").append(p.requiresJs() ? "да" : "нет");
        if (p.selectors() != null) {
            sb.append("\nКонтейнеры: ").append(String.join(", ", p.selectors().containers().stream().limit(5).toList()));
            sb.append("\nЗаголовки: ").append(String.join(", ", p.selectors().headlines().stream().limit(5).toList()));
        }
        return sb.toString();
    }

    // ---- лента/карточки ----

    private void showPage(long chatId, int delta) throws TelegramApiException {
        var st = state.computeIfAbsent(chatId, k -> new FeedState());
        if (st.articles.isEmpty()) {
            sendText(chatId, "Пусто. Начни с /scrape <url> <запрос>.", replyKb());
            return;
        }
        int pages = (st.articles.size() + PAGE_SIZE - 1) / PAGE_SIZE;
        int next = Math.max(1, Math.min(pages, st.page + (st.page == 0 ? 1 : delta)));
        st.page = next;

        int from = (next - 1) * PAGE_SIZE;
        for (int i = from; i < Math.min(st.articles.size(), from + PAGE_SIZE); i++) {
            sendCard(chatId, st.articles.get(i), st.tokenFor(i), next, pages);
        }
    }

    private void sendCard(long chatId, Article a, String fullToken, int page, int pages) throws TelegramApiException {
        InlineKeyboardRow row1 = new InlineKeyboardRow();
        row1.add(InlineKeyboardButton.builder().text("🔗 Открыть").url(a.url()).build());
        row1.add(InlineKeyboardButton.builder().text("📖 Показать полностью").callbackData(fullToken).build());

        InlineKeyboardRow row2 = new InlineKeyboardRow();
        row2.add(InlineKeyboardButton.builder().text("◀️").callbackData("page:prev").build());
        row2.add(InlineKeyboardButton.builder().text("Стр. " + page + "/" + pages).callbackData("noop").build());
        row2.add(InlineKeyboardButton.builder().text("▶️").callbackData("page:next").build());

        var kb = InlineKeyboardMarkup.builder().keyboardRow(row1).keyboardRow(row2).build();

        tg.execute(SendMessage.builder()
                .chatId(chatId)
                .text(cardHtml(a))
                .parseMode(ParseMode.HTML)
                .replyMarkup(kb)
                .disableWebPagePreview(true)
                .build());
    }

    static String cardHtml(Article a) {
        StringBuilder sb = new StringBuilder("<b>").append(Markdown.escapeHtml(a.headline())).append("</b>");
        if (a.description() != null) sb.append("\n").append(Markdown.escapeHtml(a.description()));
        StringBuilder meta = new StringBuilder(a.source());
        if (a.publishedDate() != null) meta.append(" · ").append(DATE.format(a.publishedDate()));
        if (a.category() != null) meta.append(" · #").append(a.category());
        sb.append("\n<i>").append(Markdown.escapeHtml(meta.toString())).append("</i>");
        return Markdown.trimHtml(sb.toString(), TG_CAPTION_SAFE);
    }

    // ---- отправка полной статьи ----

    private void sendFullArticle(long chatId, Article a) throws TelegramApiException {
        String body = a.content() != null ? a.content() : a.description();
        if (body == null || body.isBlank()) {
            safeSendPlainLink(chatId, a.url());
            return;
        }
        List<String> parts = new ArrayList<>();
        parts.add("*" + Markdown.escapeV2(a.headline()) + "*");
        for (String p : MessageSplitter.split(body, PLAIN_PART)) parts.add(Markdown.escapeV2(p));
        parts.add("[" + Markdown.escapeV2("Источник") + "](" + Markdown.escapeUrl(a.url()) + ")");
        sendParts(chatId, mergeParts(parts));
    }

    // склеиваем короткие части, чтобы не слать три сообщения подряд
    static List<String> mergeParts(List<String> parts) {
        List<String> out = new ArrayList<>();
        StringBuilder cur = new StringBuilder();
        for (String p : parts) {
            if (cur.length() > 0 && cur.length() + 2 + p.length() > TG_MSG_LIMIT) {
                out.add(cur.toString());
                cur.setLength(0);
            }
            if (cur.length() > 0) cur.append("\n\n");
            cur.append(p);
        }
        if (cur.length() > 0) out.add(cur.toString());
        return out;
    }

    // надёжная отправка текста с фоллбэком на простой текст
    private void sendParts(long chatId, List<String> parts) throws TelegramApiException {
        for (String p : parts) {
            if (p == null || p.isBlank()) continue;
            try {
                tg.execute(SendMessage.builder()
                        .chatId(chatId)
                        .text(p)
                        .parseMode(ParseMode.MARKDOWNV2)
                        .disableWebPagePreview(true)
                        .build());
            } catch (TelegramApiRequestException e) {
                log.debug("MarkdownV2 rejected ({}), sending plain text", e.getMessage());
                tg.execute(SendMessage.builder()
                        .chatId(chatId)
                        .text(unescapeV2(p))
                        .disableWebPagePreview(true)
                        .build());
            }
        }
    }

    // ---- утилиты ----

    private void runSafely(long chatId, BotAction action) {
        try {
            action.run();
        } catch (Exception e) {
            log.warn("chat {}: {}", chatId, e.getMessage(), e);
            try {
                sendText(chatId, "Что-то пошло не так: " + e.getMessage(), replyKb());
            } catch (TelegramApiException ex) {
                log.warn("chat {}: could not report failure: {}", chatId, ex.getMessage());
            }
        }
    }

    private void sendText(long chatId, String text, ReplyKeyboardMarkup kb) throws TelegramApiException {
        for (String part : MessageSplitter.split(text, PLAIN_PART)) {
            tg.execute(SendMessage.builder()
                    .chatId(chatId)
                    .text(Markdown.escapeV2(part))
                    .parseMode(ParseMode.MARKDOWNV2)
                    .replyMarkup(kb)
                    .disableWebPagePreview(true)
                    .build());
        }
    }

    private ReplyKeyboardMarkup replyKb() {
        KeyboardRow r1 = new KeyboardRow(); r1.add(new KeyboardButton("📚 Профили"));
        KeyboardRow r2 = new KeyboardRow(); r2.add(new KeyboardButton("◀️ Назад")); r2.add(new KeyboardButton("▶️ Вперёд"));
        return ReplyKeyboardMarkup.builder().resizeKeyboard(true).keyboardRow(r1).keyboardRow(r2).build();
    }

    private void safeAnswerOk(String callbackId, String text) {
        try {
            tg.execute(AnswerCallbackQuery.builder()
                    .callbackQueryId(callbackId)
                    .text((text == null || text.isBlank()) ? null : (text.length() > 200 ? text.substring(0, 200) : text))
                    .cacheTime(1)
                    .build());
        } catch (Exception e) {
            log.debug("answerOk failed: {}", e.getMessage());
        }
    }

    private void safeAnswerAlert(String callbackId, String text) {
        try {
            tg.execute(AnswerCallbackQuery.builder()
                    .callbackQueryId(callbackId)
                    .text(text == null ? "" : (text.length() > 200 ? text.substring(0, 200) : text))
                    .showAlert(true)
                    .cacheTime(0)
                    .build());
        } catch (Exception e) {
            log.debug("answerAlert failed: {}", e.getMessage());
        }
    }

    private void safeSendPlainLink(long chatId, String url) throws TelegramApiException {
        var txt = Markdown.escapeV2("Текста статьи нет. Открой по ссылке: ")
                + "[" + Markdown.escapeV2(url) + "](" + Markdown.escapeUrl(url) + ")";
        tg.execute(SendMessage.builder()
                .chatId(chatId)
                .text(txt)
                .parseMode(ParseMode.MARKDOWNV2)
                .disableWebPagePreview(false)
                .build());
    }

    static String unescapeV2(String p) {
        return p.replaceAll("\\\\(.)", "$1");
    }

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("dd.MM.yyyy").withZone(ZoneOffset.UTC);

    @FunctionalInterface
    private interface BotAction { void run() throws Exception; }

    /**
     * Result of the last job in one chat. The "show full" button carries
     * {@code f:<generation>:<index>}, so a button from an older job resolves to nothing.
     */
    static final class FeedState {
        volatile List<Article> articles = List.of();
        volatile int page = 0;
        private int generation = 0;

        synchronized void replace(List<Article> fresh) {
            articles = List.copyOf(fresh);
            page = 0;
            generation++;
        }

        synchronized String tokenFor(int index) {
            return "f:" + generation + ":" + index;
        }

        synchronized Article byToken(String data) {
            if (data == null || !data.startsWith("f:")) return null;
            String[] parts = data.substring(2).split(":");
            if (parts.length != 2) return null;
            try {
                int gen = Integer.parseInt(parts[0]);
                int index = Integer.parseInt(parts[1]);
                if (gen != generation || index < 0 || index >= articles.size()) return null;
                return articles.get(index);
            } catch (NumberFormatException e) {
                return null;
            }
        }
    }

    /** {@code <url>[,<url>...] <query words>}; query defaults to "news". */
    record ScrapeCommand(List<String> urls, String query) {
        static ScrapeCommand parse(String args) {
            if (args == null || args.isBlank()) return null;
            String[] parts = args.trim().split("\\s+", 2);
            List<String> urls = new ArrayList<>();
            for (String u : parts[0].split(",")) {
                if (!u.isBlank()) urls.add(u.trim());
            }
            if (urls.isEmpty()) return null;
            String query = parts.length > 1 && !parts[1].isBlank() ? parts[1].trim() : "news";
            return new ScrapeCommand(List.copyOf(urls), query);
        }
    }
}
