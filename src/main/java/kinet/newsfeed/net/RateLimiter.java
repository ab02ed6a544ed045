package kinet.newsfeed.net;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-wide throttle: consecutive permits are at least {@code 1 / callsPerSecond}
 * apart, whatever site they are for. The lock is held through the pause so two callers
 * can never read the same stale "last call" time.
 */
public final class RateLimiter {
    private final long intervalNanos;
    private final ReentrantLock lock = new ReentrantLock(true);
    private long lastCall;
    private boolean first = true;

    public RateLimiter(double callsPerSecond) {
        if (callsPerSecond <= 0) throw new IllegalArgumentException("callsPerSecond must be > 0");
        this.intervalNanos = (long) (TimeUnit.SECONDS.toNanos(1) / callsPerSecond);
    }

    public void acquire() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            if (!first) {
                long wait = intervalNanos - (System.nanoTime() - lastCall);
                while (wait > 0) {
                    TimeUnit.NANOSECONDS.sleep(wait);
                    wait = intervalNanos - (System.nanoTime() - lastCall);
                }
            }
            first = false;
            lastCall = System.nanoTime();
        } finally {
            lock.unlock();
        }
    }

    public long intervalMillis() {
        return TimeUnit.NANOSECONDS.toMillis(intervalNanos);
    }
}
