package com.recordcache.cache;

import java.util.Optional;

/**
 * Eviction-policy store behind {@link BoundedCache}. Implementations are not
 * required to be thread safe; callers serialize access.
 */
public interface Cache<K, V> {
    /**
     * Looks up a key. A hit counts as a use of the entry for eviction purposes.
     */
    Optional<V> get(K key);

    /**
     * Membership test that leaves eviction order untouched.
     */
    boolean containsKey(K key);

    void put(K key, V value);
    void evict(K key);
    void clear();

    long size();
    boolean isEmpty();
    long evictionCount();
    void resetEvictionCount();
}
