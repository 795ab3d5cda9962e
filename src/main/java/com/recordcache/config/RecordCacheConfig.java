package com.recordcache.config;

import com.recordcache.exception.InvalidConfigException;

/**
 * Configuration for the record cache and its backing store
 */
public class RecordCacheConfig {
    public static final int DEFAULT_CACHE_CAPACITY = 1000;

    private final int cacheCapacity;
    private final StoreType storeType;
    private final String s3Bucket;
    private final String s3Region;
    private final String s3Prefix;
    private final String s3Endpoint;
    private final int asyncThreads;

    private RecordCacheConfig(int cacheCapacity, StoreType storeType, String s3Bucket, String s3Region,
                              String s3Prefix, String s3Endpoint, int asyncThreads) {
        this.cacheCapacity = cacheCapacity;
        this.storeType = storeType;
        this.s3Bucket = s3Bucket;
        this.s3Region = s3Region;
        this.s3Prefix = s3Prefix;
        this.s3Endpoint = s3Endpoint;
        this.asyncThreads = asyncThreads;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int cacheCapacity = DEFAULT_CACHE_CAPACITY;
        private StoreType storeType = StoreType.MEMORY;
        private String s3Bucket;
        private String s3Region = "us-east-1";
        private String s3Prefix = "records/";
        // LocalStack and other S3-compatible endpoints
        private String s3Endpoint = System.getenv("S3_ENDPOINT");
        private int asyncThreads = 4;

        public Builder cacheCapacity(int capacity) {
            this.cacheCapacity = capacity;
            return this;
        }

        public Builder storeType(StoreType type) {
            this.storeType = type;
            return this;
        }

        public Builder s3Bucket(String bucket) {
            this.s3Bucket = bucket;
            return this;
        }

        public Builder s3Region(String region) {
            this.s3Region = region;
            return this;
        }

        public Builder s3Prefix(String prefix) {
            this.s3Prefix = prefix;
            return this;
        }

        public Builder s3Endpoint(String endpoint) {
            this.s3Endpoint = endpoint;
            return this;
        }

        public Builder asyncThreads(int threads) {
            this.asyncThreads = threads;
            return this;
        }

        /**
         * Builds and validates the configuration.
         *
         * @throws InvalidConfigException if any setting is unusable
         */
        public RecordCacheConfig build() {
            RecordCacheConfig config = new RecordCacheConfig(cacheCapacity, storeType, s3Bucket, s3Region,
                                                             s3Prefix, s3Endpoint, asyncThreads);
            config.validate();
            return config;
        }
    }

    public void validate() {
        if (cacheCapacity <= 0) {
            throw new InvalidConfigException("cacheCapacity must be positive, got " + cacheCapacity);
        }
        if (asyncThreads <= 0) {
            throw new InvalidConfigException("asyncThreads must be positive, got " + asyncThreads);
        }
        if (storeType == null) {
            throw new InvalidConfigException("storeType is required");
        }
        if (storeType == StoreType.S3 && (s3Bucket == null || s3Bucket.isBlank())) {
            throw new InvalidConfigException("s3Bucket is required for the S3 store");
        }
        if (s3Prefix == null) {
            throw new InvalidConfigException("s3Prefix must not be null");
        }
    }

    // Getters
    public int getCacheCapacity() { return cacheCapacity; }
    public StoreType getStoreType() { return storeType; }
    public String getS3Bucket() { return s3Bucket; }
    public String getS3Region() { return s3Region; }
    public String getS3Prefix() { return s3Prefix; }
    public String getS3Endpoint() { return s3Endpoint; }
    public int getAsyncThreads() { return asyncThreads; }
}
