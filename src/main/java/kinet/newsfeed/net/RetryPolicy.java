package kinet.newsfeed.net;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;

/**
 * Runs an operation up to {@code maxRetries} times in total, pausing
 * {@code baseDelay * attempt} between attempts. Every exception is retryable except
 * interruption and cancellation, which end the loop at once.
 */
public final class RetryPolicy {
    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    private RetryPolicy() {}

    public static <T> T execute(Callable<T> operation, int maxRetries, Duration baseDelay)
            throws ExhaustedRetriesException, InterruptedException {
        if (maxRetries < 1) throw new IllegalArgumentException("maxRetries must be >= 1");

        long baseMillis = Math.max(1, baseDelay.toMillis());
        IntervalFunction linear = attempt -> baseMillis * attempt;
        Retry retry = Retry.of("scrape-task", RetryConfig.custom()
                .maxAttempts(maxRetries)
                .intervalFunction(linear)
                .retryExceptions(Exception.class)
                .ignoreExceptions(InterruptedException.class, CancellationException.class)
                .build());
        retry.getEventPublisher().onRetry(e -> log.debug("Attempt {}/{} failed ({}), retrying in {} ms",
                e.getNumberOfRetryAttempts(), maxRetries,
                e.getLastThrowable() == null ? "?" : e.getLastThrowable().getMessage(),
                e.getWaitInterval().toMillis()));

        try {
            return retry.executeCallable(() -> {
                if (Thread.currentThread().isInterrupted()) {
                    throw new InterruptedException("Interrupted before attempt");
                }
                return operation.call();
            });
        } catch (InterruptedException | CancellationException e) {
            throw e;
        } catch (Exception e) {
            // пауза между попытками прервана
            if (Thread.interrupted()) {
                InterruptedException ie = new InterruptedException("Interrupted between attempts");
                ie.addSuppressed(e);
                throw ie;
            }
            throw new ExhaustedRetriesException(maxRetries, e);
        }
    }
}
