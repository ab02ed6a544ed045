package kinet.newsfeed.job;

import com.fasterxml.jackson.databind.ObjectMapper;
import kinet.newsfeed.NewsFeedConfig;
import kinet.newsfeed.net.ExhaustedRetriesException;
import kinet.newsfeed.net.Json;
import kinet.newsfeed.net.JsoupPageFetcher;
import kinet.newsfeed.net.PageFetcher;
import kinet.newsfeed.net.PageRenderer;
import kinet.newsfeed.net.RateLimitedPageFetcher;
import kinet.newsfeed.net.RateLimiter;
import kinet.newsfeed.net.RemoteBrowserRenderer;
import kinet.newsfeed.net.RetryPolicy;
import kinet.newsfeed.net.StaticPageRenderer;
import kinet.newsfeed.net.Urls;
import kinet.newsfeed.profile.CachedProfile;
import kinet.newsfeed.profile.FileProfileStore;
import kinet.newsfeed.profile.Profile;
import kinet.newsfeed.profile.ProfileCache;
import kinet.newsfeed.profile.SiteProfileDetector;
import kinet.newsfeed.scrape.Article;
import kinet.newsfeed.scrape.ContentEnricher;
import kinet.newsfeed.scrape.DateParser;
import kinet.newsfeed.scrape.MetadataExtractor;
import kinet.newsfeed.scrape.UniversalScraper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.FutureTask;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs every task of a job on a fixed worker pool and merges the results. A failing or
 * timed-out task becomes an error line; it never stops its siblings.
 */
public class ScrapeJobRunner implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ScrapeJobRunner.class);

    private final ProfileCache cache;
    private final SiteProfileDetector detector;
    private final UniversalScraper scraper;
    private final Duration taskTimeout;
    private final int retries;
    private final Duration retryDelay;

    private final ExecutorService workers;
    private final ScheduledExecutorService watchdog;

    public ScrapeJobRunner(ProfileCache cache, SiteProfileDetector detector, UniversalScraper scraper,
                           int workerCount, Duration taskTimeout, int retries, Duration retryDelay) {
        this.cache = cache;
        this.detector = detector;
        this.scraper = scraper;
        this.taskTimeout = taskTimeout;
        this.retries = retries;
        this.retryDelay = retryDelay;

        AtomicInteger n = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(Math.max(1, workerCount), r -> {
            Thread t = new Thread(r, "scrape-worker-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.watchdog = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "scrape-watchdog");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Production wiring: jsoup fetcher, file cache, remote renderer when configured. One
     * rate limiter gates every outbound request of the detector, scraper and enricher.
     */
    public static ScrapeJobRunner create(NewsFeedConfig config) throws IOException {
        ObjectMapper mapper = Json.newMapper();
        Clock clock = Clock.systemUTC();
        RateLimiter limiter = new RateLimiter(config.callsPerSecond());
        PageFetcher fetcher = new RateLimitedPageFetcher(new JsoupPageFetcher(), limiter);
        PageRenderer renderer = config.renderUrl() == null
                ? new StaticPageRenderer(fetcher)
                : new RemoteBrowserRenderer(config.renderUrl(), mapper, limiter);
        ProfileCache cache = new ProfileCache(new FileProfileStore(config.profileDir()), mapper,
                config.profileMaxAge(), clock);
        SiteProfileDetector detector = new SiteProfileDetector(fetcher, mapper,
                Duration.ofSeconds(10), config.fetchTimeout(), clock);
        ContentEnricher enricher = new ContentEnricher(fetcher, config.enrichWorkers(),
                Duration.ofSeconds(10), new MetadataExtractor(new DateParser(clock)));
        UniversalScraper scraper = new UniversalScraper(fetcher, renderer, enricher, mapper, config.fetchTimeout());
        return new ScrapeJobRunner(cache, detector, scraper, config.workers(), config.taskTimeout(),
                config.taskRetries(), config.retryDelay());
    }

    public ScrapeJobResult run(ScrapeJobRequest request) {
        long started = System.nanoTime();
        List<ScrapeTask> tasks = request.tasks();
        log.info("Starting job: {} url(s) x {} filter(s) = {} task(s)",
                request.urls().size(), request.filters().size(), tasks.size());

        List<TimedTask> running = new ArrayList<>(tasks.size());
        for (ScrapeTask task : tasks) {
            TimedTask t = new TimedTask(task, request.maxResults(), request.forceRefresh());
            running.add(t);
            workers.execute(t.future);
        }

        List<String> errors = new ArrayList<>();
        Map<String, Article> merged = new LinkedHashMap<>();
        Set<String> productiveUrls = new HashSet<>();
        boolean interrupted = false;

        for (TimedTask t : running) {
            if (interrupted) {
                t.future.cancel(true);
                errors.add(String.format("Error scraping %s: job interrupted", t.task.describe()));
                continue;
            }
            try {
                List<Article> articles = t.future.get();
                if (!articles.isEmpty()) productiveUrls.add(t.task.url());
                for (Article a : articles) {
                    Article clean = a.sanitized();
                    if (clean.headline().isEmpty() || clean.url().isEmpty()) continue;
                    merged.putIfAbsent(Urls.dedupKey(clean.url()), clean);
                }
            } catch (CancellationException e) {
                String msg = t.timedOut
                        ? String.format("Timed out scraping %s after %ds", t.task.describe(), taskTimeout.toSeconds())
                        : String.format("Error scraping %s: cancelled", t.task.describe());
                log.error(msg);
                errors.add(msg);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() instanceof ExhaustedRetriesException ex && ex.getCause() != null
                        ? ex.getCause() : e.getCause();
                String msg = String.format("Error scraping %s: %s", t.task.describe(), cause);
                log.error(msg);
                errors.add(msg);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                interrupted = true;
                t.future.cancel(true);
                errors.add(String.format("Error scraping %s: job interrupted", t.task.describe()));
            }
        }

        List<Article> all = new ArrayList<>(merged.values());
        int total = all.size();
        List<Article> capped = all.size() > request.globalCap() ? all.subList(0, request.globalCap()) : all;
        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
        log.info("Job completed: {} articles ({} unique) from {} source(s) in {} ms, {} error(s)",
                capped.size(), total, productiveUrls.size(), elapsed.toMillis(), errors.size());
        return new ScrapeJobResult(capped, total, productiveUrls.size(), elapsed, errors);
    }

    List<Article> runTask(ScrapeTask task, int maxResults, boolean forceRefresh)
            throws ExhaustedRetriesException, InterruptedException {
        String query = task.effectiveQuery();
        List<Article> articles = RetryPolicy.execute(() -> {
            Profile profile = profileFor(task.url(), query, forceRefresh);
            return scraper.scrape(profile, query, maxResults);
        }, retries, retryDelay);

        log.info("Scraped {} articles from {} for '{}'", articles.size(), task.url(), query);
        if (task.category() == null) return articles;
        List<Article> tagged = new ArrayList<>(articles.size());
        for (Article a : articles) tagged.add(a.withCategory(task.category()));
        return tagged;
    }

    private Profile profileFor(String url, String query, boolean forceRefresh) {
        if (!forceRefresh) {
            Optional<Profile> cached = cache.get(url);
            if (cached.isPresent()) {
                log.info("Using cached profile for {}", url);
                return cached.get();
            }
        }
        log.info("Generating new profile for {}", url);
        Profile profile = detector.detectProfile(url, query);
        if (Thread.currentThread().isInterrupted()) {
            log.info("Task for {} was cancelled, not caching its profile", url);
            return profile;
        }
        try {
            cache.save(url, profile);
        } catch (IOException e) {
            log.warn("Could not cache profile for {}: {}", url, e.getMessage());
        }
        return profile;
    }

    /** Detects a profile without caching it. */
    public Profile probe(String url) {
        String u = Urls.withScheme(url);
        if (Urls.hostOf(u).isEmpty()) throw new IllegalArgumentException("Not a URL: " + url);
        return detector.detectProfile(u);
    }

    public List<CachedProfile> profiles() throws IOException {
        return cache.list();
    }

    public boolean forget(String domain) throws IOException {
        return cache.delete(domain);
    }

    @Override
    public void close() {
        workers.shutdownNow();
        watchdog.shutdownNow();
    }

    /** A task whose timeout clock starts when a worker picks it up. */
    private final class TimedTask implements Callable<List<Article>> {
        final ScrapeTask task;
        final int maxResults;
        final boolean forceRefresh;
        final FutureTask<List<Article>> future = new FutureTask<>(this);
        volatile boolean timedOut;

        TimedTask(ScrapeTask task, int maxResults, boolean forceRefresh) {
            this.task = task;
            this.maxResults = maxResults;
            this.forceRefresh = forceRefresh;
        }

        @Override
        public List<Article> call() throws Exception {
            ScheduledFuture<?> alarm = watchdog.schedule(() -> {
                timedOut = true;
                future.cancel(true);
            }, taskTimeout.toMillis(), TimeUnit.MILLISECONDS);
            try {
                return runTask(task, maxResults, forceRefresh);
            } finally {
                alarm.cancel(false);
            }
        }
    }
}
