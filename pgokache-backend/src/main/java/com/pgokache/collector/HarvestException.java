package com.pgokache.collector;

/**
 * Thrown when the pg_stat_statements extraction query fails.
 */
public class HarvestException extends RuntimeException {
    public HarvestException(String message, Throwable cause) {
        super(message, cause);
    }
}
