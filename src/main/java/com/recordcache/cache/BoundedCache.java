package com.recordcache.cache;

import com.recordcache.exception.InvalidConfigException;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Thread-safe, fixed-capacity LRU cache with hit/miss accounting.
 * <p>
 * Structural changes ({@code put}, {@code invalidate}, {@code clear}, eviction)
 * and the recency bump of a hit take the write lock. Membership and size
 * queries share the read lock. Hit and miss counters are atomics updated
 * outside the lock.
 * <p>
 * Values are handed out by reference; eviction drops the cache's reference
 * only, so a value already returned stays valid for its holder. Values should
 * be immutable.
 */
public class BoundedCache<K, V> {
    private final int capacity;
    private final Cache<K, V> cache;
    private final ReadWriteLock cacheLock;
    private final AtomicLong hits;
    private final AtomicLong misses;
    // bumped under the write lock by every invalidate and clear
    private final AtomicLong invalidations;

    public BoundedCache(int capacity) {
        if (capacity <= 0) {
            throw new InvalidConfigException("Cache capacity must be positive, got " + capacity);
        }
        this.capacity = capacity;
        this.cache = new LRUCache<>(capacity);
        this.cacheLock = new ReentrantReadWriteLock();
        this.hits = new AtomicLong();
        this.misses = new AtomicLong();
        this.invalidations = new AtomicLong();
    }

    public Optional<V> get(K key) {
        Objects.requireNonNull(key, "key");
        Optional<V> value = Optional.empty();

        // Misses are settled under the shared lock and never touch recency.
        boolean present;
        cacheLock.readLock().lock();
        try {
            present = cache.containsKey(key);
        } finally {
            cacheLock.readLock().unlock();
        }

        if (present) {
            cacheLock.writeLock().lock();
            try {
                value = cache.get(key);
            } finally {
                cacheLock.writeLock().unlock();
            }
        }

        if (value.isPresent()) {
            hits.incrementAndGet();
        } else {
            misses.incrementAndGet();
        }
        return value;
    }

    public boolean contains(K key) {
        Objects.requireNonNull(key, "key");
        cacheLock.readLock().lock();
        try {
            return cache.containsKey(key);
        } finally {
            cacheLock.readLock().unlock();
        }
    }

    public void put(K key, V value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        cacheLock.writeLock().lock();
        try {
            cache.put(key, value);
            assert cache.size() <= capacity : "cache grew past capacity " + capacity;
        } finally {
            cacheLock.writeLock().unlock();
        }
    }

    /**
     * Inserts {@code value} only if no invalidation or clear has happened since
     * {@code stamp} was taken with {@link #invalidationStamp()}. Loaders read the
     * stamp before going to the backing store, so a value loaded before a
     * concurrent write cannot be cached after that write's invalidation.
     *
     * @return whether the value was cached
     */
    public boolean putIfNotInvalidatedSince(K key, V value, long stamp) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        cacheLock.writeLock().lock();
        try {
            if (invalidations.get() != stamp) {
                return false;
            }
            cache.put(key, value);
            assert cache.size() <= capacity : "cache grew past capacity " + capacity;
            return true;
        } finally {
            cacheLock.writeLock().unlock();
        }
    }

    public long invalidationStamp() {
        return invalidations.get();
    }

    public void invalidate(K key) {
        Objects.requireNonNull(key, "key");
        cacheLock.writeLock().lock();
        try {
            cache.evict(key);
            invalidations.incrementAndGet();
        } finally {
            cacheLock.writeLock().unlock();
        }
    }

    /**
     * Drops every entry. Hit and miss counters survive; use {@link #resetStats()}
     * to zero them.
     */
    public void clear() {
        cacheLock.writeLock().lock();
        try {
            cache.clear();
            invalidations.incrementAndGet();
        } finally {
            cacheLock.writeLock().unlock();
        }
    }

    public long size() {
        cacheLock.readLock().lock();
        try {
            return cache.size();
        } finally {
            cacheLock.readLock().unlock();
        }
    }

    public boolean isEmpty() {
        cacheLock.readLock().lock();
        try {
            return cache.isEmpty();
        } finally {
            cacheLock.readLock().unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

    public double hitRate() {
        long h = hits.get();
        long total = h + misses.get();
        return total == 0 ? 0.0 : (double) h / total;
    }

    public CacheStats stats() {
        cacheLock.readLock().lock();
        try {
            return new CacheStats(hits.get(), misses.get(), cache.evictionCount(), cache.size(), capacity);
        } finally {
            cacheLock.readLock().unlock();
        }
    }

    public void resetStats() {
        cacheLock.writeLock().lock();
        try {
            hits.set(0);
            misses.set(0);
            cache.resetEvictionCount();
        } finally {
            cacheLock.writeLock().unlock();
        }
    }
}
