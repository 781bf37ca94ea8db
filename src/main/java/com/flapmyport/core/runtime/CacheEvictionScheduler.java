package com.flapmyport.core.runtime;

import com.flapmyport.core.spi.EventStore;
import com.flapmyport.core.spi.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Calls {@link EventStore#cleanup()} on a fixed period. The first sweep runs one period after
 * {@link #start()}. A failed sweep is logged and the next one still runs on time.
 */
public class CacheEvictionScheduler implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CacheEvictionScheduler.class);

    private final EventStore store;
    private final Duration period;
    private final ScheduledExecutorService timer;

    private final AtomicLong succeeded = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    public CacheEvictionScheduler(EventStore store, Duration period) {
        this.store = Objects.requireNonNull(store, "store");
        if (period == null || period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("cleanup period must be positive: " + period);
        }
        this.period = period;
        this.timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "cache-eviction");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        long millis = period.toMillis();
        timer.scheduleAtFixedRate(this::tick, millis, millis, TimeUnit.MILLISECONDS);
        log.info("[start] cache cleanup every {}", period);
    }

    void tick() {
        try {
            log.debug("Cleanup DB started");
            store.cleanup();
            succeeded.incrementAndGet();
        } catch (StoreException e) {
            failed.incrementAndGet();
            log.error("Cache cleanup failed: {}", e.getMessage(), e);
        } catch (RuntimeException e) {
            // an escaping exception would cancel every later run
            failed.incrementAndGet();
            log.error("Cache cleanup failed unexpectedly", e);
        }
    }

    /** Stops the timer; an in-progress sweep is interrupted rather than awaited. */
    public void stop() {
        timer.shutdownNow();
        log.info("[stop] cache cleanup stopped succeeded={} failed={}", succeeded.get(), failed.get());
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isStopped() {
        return timer.isShutdown();
    }

    public long getSucceeded() { return succeeded.get(); }
    public long getFailed() { return failed.get(); }
}
