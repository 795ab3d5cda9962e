package com.recordcache.store;

import com.recordcache.config.RecordCacheConfig;
import com.recordcache.exception.StoreException;

/**
 * Builds the backing store named by a configuration.
 */
public final class RecordStores {

    private RecordStores() {
    }

    public static RecordStore create(RecordCacheConfig config) throws StoreException {
        switch (config.getStoreType()) {
            case MEMORY:
                return new InMemoryRecordStore();
            case S3:
                return new S3RecordStore(config);
            default:
                throw new IllegalArgumentException("Unsupported store type: " + config.getStoreType());
        }
    }
}
