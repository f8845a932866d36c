package sm.java.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sm.core.cache.QueryCache;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically drops expired cache entries so memory stays bounded between lookups.
 */
public final class CacheJanitor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CacheJanitor.class);

    private final QueryCache cache;
    private final ScheduledExecutorService executorService;

    public CacheJanitor(QueryCache cache) {
        this(cache, Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "cache-janitor");
            t.setDaemon(true);
            return t;
        }));
    }

    CacheJanitor(QueryCache cache, ScheduledExecutorService executorService) {
        if (cache == null) throw new IllegalArgumentException("cache cannot be null");
        this.cache = cache;
        this.executorService = executorService;
    }

    /**
     * Schedules the sweep at the cache's purge interval. A zero interval or a disabled
     * cache schedules nothing.
     */
    public void start() {
        Duration interval = cache.config().purgeInterval();
        if (!cache.isEnabled() || interval.isZero()) {
            log.info("CACHE_JANITOR disabled");
            return;
        }
        long millis = interval.toMillis();
        executorService.scheduleWithFixedDelay(this::sweep, millis, millis, TimeUnit.MILLISECONDS);
        log.info("CACHE_JANITOR started intervalMs={}", millis);
    }

    void sweep() {
        try {
            int removed = cache.purgeExpired();
            if (removed > 0) {
                log.info("CACHE_JANITOR purged={} size={}", removed, cache.size());
            }
        } catch (RuntimeException e) {
            // a throwing task would cancel every later run
            log.error("CACHE_JANITOR sweep failed", e);
        }
    }

    @Override
    public void close() {
        executorService.shutdownNow();
    }
}
