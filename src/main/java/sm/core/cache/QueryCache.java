package sm.core.cache;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sm.core.clock.Clock;
import sm.core.error.InvariantViolationException;
import sm.core.model.CacheEntry;
import sm.core.model.QueryFamily;
import sm.core.model.QueryFingerprint;
import sm.core.model.TtlClass;

import java.time.Duration;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BiConsumer;

/**
 * Fingerprint-keyed store of upstream results with per-entry expiry.
 *
 * <p>Behavior:
 * <ul>
 *   <li>Lazy expiry: an expired entry is dropped by the lookup that finds it</li>
 *   <li>Last write wins: a store replaces any entry under the same fingerprint</li>
 *   <li>LRU eviction above {@code maxEntries}, non-permanent entries first</li>
 *   <li>{@link TtlClass#NONE} results are never stored</li>
 * </ul>
 *
 * <p>Thread-safety: lookups are lock-free reads of a ConcurrentHashMap; recency is a
 * per-slot tick. Stores, evictions and invalidations are serialized by one lock.
 */
public final class QueryCache {

    private static final Logger log = LoggerFactory.getLogger(QueryCache.class);

    private final Clock clock;
    private final CacheConfig config;
    private final BiConsumer<QueryFingerprint, CacheEntry> evictionListener;

    private final ConcurrentHashMap<QueryFingerprint, Slot> slots = new ConcurrentHashMap<>();
    private final ReentrantLock writeLock = new ReentrantLock();
    private final AtomicLong ticks = new AtomicLong();

    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final LongAdder evictions = new LongAdder();
    private final LongAdder expirations = new LongAdder();

    /**
     * @param clock Clock instance for expiry (injected for testability)
     * @param config Cache configuration
     * @param evictionListener Callback invoked when capacity evicts an entry (can be null)
     */
    public QueryCache(Clock clock, CacheConfig config, BiConsumer<QueryFingerprint, CacheEntry> evictionListener) {
        if (clock == null) throw new IllegalArgumentException("clock cannot be null");
        if (config == null) throw new IllegalArgumentException("config cannot be null");
        this.clock = clock;
        this.config = config;
        this.evictionListener = evictionListener;
    }

    public QueryCache(Clock clock, CacheConfig config) {
        this(clock, config, null);
    }

    public boolean isEnabled() {
        return config.enabled();
    }

    /**
     * Returns the live entry for a fingerprint, marking it recently used.
     *
     * @throws InvariantViolationException if the stored entry belongs to a different query
     *         with the same digest
     */
    public Optional<CacheEntry> lookup(QueryFingerprint fingerprint) throws InvariantViolationException {
        return find(fingerprint, true);
    }

    /**
     * Same as {@link #lookup} but a miss is not counted. For a second look at a query
     * whose miss was already recorded.
     */
    public Optional<CacheEntry> peek(QueryFingerprint fingerprint) throws InvariantViolationException {
        return find(fingerprint, false);
    }

    private Optional<CacheEntry> find(QueryFingerprint fingerprint, boolean countMiss)
        throws InvariantViolationException {
        if (!config.enabled()) {
            return Optional.empty();
        }
        Slot slot = slots.get(fingerprint);
        if (slot == null) {
            if (countMiss) {
                misses.increment();
                log.debug("CACHE_MISS fingerprint={}", fingerprint);
            }
            return Optional.empty();
        }
        checkSameQuery(fingerprint, slot.entry);

        if (slot.entry.isExpired(clock.nowNanos())) {
            if (slots.remove(fingerprint, slot)) {
                expirations.increment();
            }
            if (countMiss) {
                misses.increment();
                log.debug("CACHE_MISS fingerprint={} reason=expired", fingerprint);
            }
            return Optional.empty();
        }

        slot.lastAccess = ticks.incrementAndGet();
        hits.increment();
        log.debug("CACHE_HIT fingerprint={} ttlClass={}", fingerprint, slot.entry.ttlClass());
        return Optional.of(slot.entry);
    }

    /**
     * Stores a result, computing its expiry from the TTL class at write time.
     */
    public void store(QueryFingerprint fingerprint, JsonNode payload, TtlClass ttlClass)
        throws InvariantViolationException {
        if (fingerprint == null) throw new IllegalArgumentException("fingerprint cannot be null");
        if (ttlClass == null) throw new IllegalArgumentException("ttlClass cannot be null");
        if (!config.enabled()) {
            return;
        }

        writeLock.lock();
        try {
            Slot existing = slots.get(fingerprint);
            if (existing != null) {
                checkSameQuery(fingerprint, existing.entry);
            }
            if (!ttlClass.cacheable()) {
                if (existing != null) {
                    slots.remove(fingerprint);
                }
                return;
            }

            long now = clock.nowNanos();
            Duration ttl = config.ttlFor(ttlClass);
            long expiresAt = ttl == null ? CacheEntry.NEVER : now + ttl.toNanos();
            CacheEntry entry = new CacheEntry(fingerprint, payload, ttlClass, now, clock.wallMillis(), expiresAt);
            slots.put(fingerprint, new Slot(entry, ticks.incrementAndGet()));
            log.debug("CACHE_STORE fingerprint={} ttlClass={} size={}", fingerprint, ttlClass, slots.size());

            if (slots.size() > config.maxEntries()) {
                enforceLimit(now, fingerprint);
            }
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * @return 1 if an entry was removed, 0 otherwise
     */
    public int invalidate(QueryFingerprint fingerprint) {
        writeLock.lock();
        try {
            return slots.remove(fingerprint) != null ? 1 : 0;
        } finally {
            writeLock.unlock();
        }
    }

    public int invalidateFamily(QueryFamily family) {
        writeLock.lock();
        try {
            int removed = 0;
            Iterator<QueryFingerprint> it = slots.keySet().iterator();
            while (it.hasNext()) {
                if (it.next().family() == family) {
                    it.remove();
                    removed++;
                }
            }
            log.info("CACHE_INVALIDATE family={} removed={}", family, removed);
            return removed;
        } finally {
            writeLock.unlock();
        }
    }

    public int clear() {
        writeLock.lock();
        try {
            int removed = slots.size();
            slots.clear();
            log.info("CACHE_CLEAR removed={}", removed);
            return removed;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Drops every expired entry.
     *
     * @return number of entries removed
     */
    public int purgeExpired() {
        writeLock.lock();
        try {
            int removed = purgeExpired(clock.nowNanos());
            if (removed > 0) {
                log.debug("CACHE_PURGE removed={} size={}", removed, slots.size());
            }
            return removed;
        } finally {
            writeLock.unlock();
        }
    }

    public int size() {
        return slots.size();
    }

    public CacheStats stats() {
        return new CacheStats(
            config.enabled(),
            slots.size(),
            config.maxEntries(),
            hits.sum(),
            misses.sum(),
            evictions.sum(),
            expirations.sum()
        );
    }

    public CacheConfig config() {
        return config;
    }

    private int purgeExpired(long now) {
        int removed = 0;
        Iterator<Map.Entry<QueryFingerprint, Slot>> it = slots.entrySet().iterator();
        while (it.hasNext()) {
            if (it.next().getValue().entry.isExpired(now)) {
                it.remove();
                removed++;
            }
        }
        expirations.add(removed);
        return removed;
    }

    // Must hold writeLock. The entry just stored is never its own victim.
    private void enforceLimit(long now, QueryFingerprint justStored) {
        purgeExpired(now);
        while (slots.size() > config.maxEntries()) {
            Map.Entry<QueryFingerprint, Slot> victim = leastRecentlyUsed(justStored, false);
            if (victim == null) {
                victim = leastRecentlyUsed(justStored, true);
            }
            if (victim == null) {
                return;
            }
            slots.remove(victim.getKey());
            evictions.increment();
            log.debug("CACHE_EVICT fingerprint={} permanent={}", victim.getKey(), victim.getValue().entry.isPermanent());
            if (evictionListener != null) {
                evictionListener.accept(victim.getKey(), victim.getValue().entry);
            }
        }
    }

    private Map.Entry<QueryFingerprint, Slot> leastRecentlyUsed(QueryFingerprint exclude, boolean permanent) {
        Map.Entry<QueryFingerprint, Slot> oldest = null;
        for (Map.Entry<QueryFingerprint, Slot> e : slots.entrySet()) {
            if (e.getKey().equals(exclude) || e.getValue().entry.isPermanent() != permanent) {
                continue;
            }
            if (oldest == null || e.getValue().lastAccess < oldest.getValue().lastAccess) {
                oldest = e;
            }
        }
        return oldest;
    }

    private static void checkSameQuery(QueryFingerprint requested, CacheEntry entry) throws InvariantViolationException {
        String stored = entry.fingerprint().canonical();
        if (!stored.equals(requested.canonical())) {
            log.error("FINGERPRINT_COLLISION fingerprint={} stored={} requested={}",
                requested, stored, requested.canonical());
            throw new InvariantViolationException(
                "fingerprint collision on " + requested + ": '" + stored + "' vs '" + requested.canonical() + "'");
        }
    }

    private static final class Slot {
        final CacheEntry entry;
        volatile long lastAccess;

        Slot(CacheEntry entry, long lastAccess) {
            this.entry = entry;
            this.lastAccess = lastAccess;
        }
    }
}
