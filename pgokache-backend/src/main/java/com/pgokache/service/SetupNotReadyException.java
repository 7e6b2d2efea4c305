package com.pgokache.service;

/**
 * Thrown when collection is requested for an instance whose last readiness check did not pass.
 */
public class SetupNotReadyException extends RuntimeException {
    public SetupNotReadyException(long instanceId) {
        super("setup not ready for instance " + instanceId);
    }
}
