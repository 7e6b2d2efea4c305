package com.pgokache.service;

/**
 * Thrown when a monitored instance cannot be reached or authenticated against.
 */
public class InstanceConnectionException extends RuntimeException {
    public InstanceConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
