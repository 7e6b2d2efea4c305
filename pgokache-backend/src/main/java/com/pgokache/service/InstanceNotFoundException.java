package com.pgokache.service;

public class InstanceNotFoundException extends RuntimeException {
    public InstanceNotFoundException(long instanceId) {
        super("Instance not found: " + instanceId);
    }
}
