package com.recordcache.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Least-recently-used policy bounded by entry count.
 * <p>
 * Backed by an access-ordered {@link LinkedHashMap}: every hit and every put
 * moves the key to the tail, so the head is always the eviction victim. Keys
 * never touched since insertion keep their insertion order, which makes the
 * choice between them deterministic.
 */
public class LRUCache<K, V> implements Cache<K, V> {
    private static final Logger log = LoggerFactory.getLogger(LRUCache.class);

    private final int maxEntries;
    private final LinkedHashMap<K, CacheEntry<V>> cache;
    private long evictionCount;

    public LRUCache(int maxEntries) {
        this.maxEntries = maxEntries;
        this.cache = new LinkedHashMap<>(16, 0.75f, true);
        this.evictionCount = 0;
    }

    @Override
    public Optional<V> get(K key) {
        CacheEntry<V> entry = cache.get(key);
        return entry != null ? Optional.of(entry.getValue()) : Optional.empty();
    }

    @Override
    public boolean containsKey(K key) {
        return cache.containsKey(key);
    }

    @Override
    public void put(K key, V value) {
        if (!cache.containsKey(key) && cache.size() >= maxEntries) {
            evictEldest();
        }
        cache.put(key, new CacheEntry<>(value));
    }

    @Override
    public void evict(K key) {
        cache.remove(key);
    }

    @Override
    public void clear() {
        cache.clear();
    }

    @Override
    public long size() {
        return cache.size();
    }

    @Override
    public boolean isEmpty() {
        return cache.isEmpty();
    }

    @Override
    public long evictionCount() {
        return evictionCount;
    }

    @Override
    public void resetEvictionCount() {
        evictionCount = 0;
    }

    private void evictEldest() {
        Iterator<Map.Entry<K, CacheEntry<V>>> it = cache.entrySet().iterator();
        if (!it.hasNext()) {
            return;
        }
        Map.Entry<K, CacheEntry<V>> eldest = it.next();
        it.remove();
        evictionCount++;
        log.debug("Evicted least recently used key {} after {} ms in cache",
                  eldest.getKey(), System.currentTimeMillis() - eldest.getValue().getCreatedAt());
    }
}
