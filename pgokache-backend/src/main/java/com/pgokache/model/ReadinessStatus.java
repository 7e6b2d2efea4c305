package com.pgokache.model;

/**
 * Setup classification of an instance, in evaluation priority order.
 */
public enum ReadinessStatus {
    /** pg_stat_statements is not an available extension on the server. */
    BLOCKED,
    /** Available, but missing from shared_preload_libraries. */
    NEEDS_PRELOAD,
    /** Preloaded, but CREATE EXTENSION has not been run in this database. */
    NEEDS_CREATE_EXTENSION,
    READY
}
