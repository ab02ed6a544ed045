package kinet.newsfeed.net;

import org.testng.annotations.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.testng.Assert.*;

public class RateLimiterTest {

    @Test
    public void sequentialCallsAreSpacedByInterval() throws Exception {
        RateLimiter limiter = new RateLimiter(20);   // 50 ms
        List<Long> done = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            limiter.acquire();
            done.add(System.nanoTime());
        }
        for (int i = 1; i < done.size(); i++) {
            long gapMs = TimeUnit.NANOSECONDS.toMillis(done.get(i) - done.get(i - 1));
            assertTrue(gapMs >= 45, "Интервал " + i + " слишком мал: " + gapMs + " ms");
        }
    }

    @Test
    public void concurrentCallersAreSerialized() throws Exception {
        RateLimiter limiter = new RateLimiter(25);   // 40 ms
        ExecutorService pool = Executors.newFixedThreadPool(4);
        long start = System.nanoTime();
        for (int i = 0; i < 8; i++) {
            pool.submit(() -> {
                limiter.acquire();
                return null;
            });
        }
        pool.shutdown();
        assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
        // восемь разрешений - это семь интервалов после первого
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        assertTrue(elapsedMs >= 7 * 40 - 1, "Слишком быстро: " + elapsedMs + " ms");
    }

    @Test
    public void firstCallDoesNotWait() throws Exception {
        RateLimiter limiter = new RateLimiter(0.5);
        long start = System.nanoTime();
        limiter.acquire();
        assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start) < 500);
        assertEquals(limiter.intervalMillis(), 2000);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void rejectsNonPositiveRate() {
        new RateLimiter(0);
    }
}
