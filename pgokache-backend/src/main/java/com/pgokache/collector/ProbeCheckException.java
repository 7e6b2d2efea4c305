package com.pgokache.collector;

/**
 * Thrown when one of the mandatory readiness queries fails. No partial report is produced.
 */
public class ProbeCheckException extends RuntimeException {
    public ProbeCheckException(String message, Throwable cause) {
        super(message, cause);
    }
}
