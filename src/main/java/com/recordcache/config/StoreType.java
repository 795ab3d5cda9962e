package com.recordcache.config;

/**
 * Backing store implementations selectable from configuration
 */
public enum StoreType {
    MEMORY,
    S3
}
