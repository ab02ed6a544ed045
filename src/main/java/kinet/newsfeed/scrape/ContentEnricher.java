package kinet.newsfeed.scrape;

import kinet.newsfeed.html.TextCleaner;
import kinet.newsfeed.net.FetchException;
import kinet.newsfeed.net.FetchedPage;
import kinet.newsfeed.net.PageFetcher;
import kinet.newsfeed.profile.Selectors;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Fetches article pages in parallel and fills in body text, date and author. A failed or
 * slow page leaves its candidate as it was; order is preserved.
 */
public class ContentEnricher {
    private static final Logger log = LoggerFactory.getLogger(ContentEnricher.class);

    public static final int MAX_ENRICHED = 40;
    public static final int MAX_CONTENT = 1500;
    static final int MIN_CONTENT = 100;
    private static final Duration SLACK = Duration.ofSeconds(2);

    private final PageFetcher fetcher;
    private final int workers;
    private final Duration fetchTimeout;
    private final MetadataExtractor metadata;

    public ContentEnricher(PageFetcher fetcher, int workers, Duration fetchTimeout, MetadataExtractor metadata) {
        this.fetcher = fetcher;
        this.workers = workers;
        this.fetchTimeout = fetchTimeout;
        this.metadata = metadata;
    }

    public List<Candidate> enrich(List<Candidate> candidates, Selectors selectors, List<String> cleaningRules) {
        int n = Math.min(MAX_ENRICHED, candidates.size());
        if (n == 0) return candidates;

        List<Callable<Candidate>> jobs = new ArrayList<>(n);
        for (Candidate c : candidates.subList(0, n)) {
            jobs.add(() -> enrichOne(c, selectors, cleaningRules));
        }

        int poolSize = Math.max(1, Math.min(workers, n));
        ExecutorService pool = Executors.newFixedThreadPool(poolSize, r -> {
            Thread t = new Thread(r, "enrich-worker");
            t.setDaemon(true);
            return t;
        });
        // каждая волна воркеров укладывается в таймаут одного запроса
        long rounds = (n + poolSize - 1) / poolSize;
        Duration budget = fetchTimeout.plus(SLACK).multipliedBy(rounds);

        List<Candidate> out = new ArrayList<>(candidates.size());
        int enriched = 0;
        try {
            List<Future<Candidate>> futures = pool.invokeAll(jobs, budget.toMillis(), TimeUnit.MILLISECONDS);
            for (int i = 0; i < futures.size(); i++) {
                try {
                    Candidate c = futures.get(i).get();
                    if (!c.content().isEmpty()) enriched++;
                    out.add(c);
                } catch (CancellationException | ExecutionException e) {
                    log.debug("Enrichment of {} abandoned: {}", candidates.get(i).url(), e.toString());
                    out.add(candidates.get(i));
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Enrichment interrupted, keeping {} candidates as they were", candidates.size());
            return candidates;
        } finally {
            pool.shutdownNow();
        }

        out.addAll(candidates.subList(n, candidates.size()));
        log.info("Deep extraction: {}/{} articles got content", enriched, n);
        return out;
    }

    Candidate enrichOne(Candidate c, Selectors selectors, List<String> cleaningRules) {
        try {
            FetchedPage page = fetcher.fetch(c.url(), fetchTimeout);
            Document doc = Jsoup.parse(page.text(), c.url());
            ContentExtractor.stripNoise(doc, cleaningRules);
            ContentExtractor.Extraction body = ContentExtractor.extract(doc, selectors.content());
            if (!body.found() || body.text().length() <= MIN_CONTENT) {
                log.debug("No body text on {} ({})", c.url(), body.source());
                return c;
            }
            MetadataExtractor.Metadata meta = metadata.extract(doc, selectors.dates(), selectors.authors());
            return c.withContent(TextCleaner.truncate(body.text(), MAX_CONTENT), meta.published(), meta.author());
        } catch (FetchException e) {
            log.debug("Deep fetch failed for {}: {}", c.url(), e.getMessage());
            return c;
        }
    }
}
