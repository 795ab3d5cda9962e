package com.recordcache.cache;

/**
 * Point-in-time snapshot of a cache's counters.
 */
public final class CacheStats {
    private final long hitCount;
    private final long missCount;
    private final long evictionCount;
    private final long size;
    private final int capacity;

    public CacheStats(long hitCount, long missCount, long evictionCount, long size, int capacity) {
        this.hitCount = hitCount;
        this.missCount = missCount;
        this.evictionCount = evictionCount;
        this.size = size;
        this.capacity = capacity;
    }

    public long getHitCount() { return hitCount; }
    public long getMissCount() { return missCount; }
    public long getEvictionCount() { return evictionCount; }
    public long getSize() { return size; }
    public int getCapacity() { return capacity; }

    public long getLookupCount() {
        return hitCount + missCount;
    }

    /**
     * Hits over lookups, or 0.0 before the first lookup.
     */
    public double hitRate() {
        long lookups = getLookupCount();
        return lookups == 0 ? 0.0 : (double) hitCount / lookups;
    }

    @Override
    public String toString() {
        return String.format("CacheStats{hits=%d, misses=%d, evictions=%d, size=%d/%d, hitRate=%.3f}",
                             hitCount, missCount, evictionCount, size, capacity, hitRate());
    }
}
