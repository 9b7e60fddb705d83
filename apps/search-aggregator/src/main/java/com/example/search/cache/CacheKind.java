package com.example.search.cache;

/**
 * Operation kind, the first component of every cache key.
 */
public enum CacheKind {
    SEARCH,
    DOCUMENT,
    UPDATES,
    SUMMARIZE
}
