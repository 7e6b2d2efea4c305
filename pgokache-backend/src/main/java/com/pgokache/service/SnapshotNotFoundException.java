package com.pgokache.service;

public class SnapshotNotFoundException extends RuntimeException {
    public SnapshotNotFoundException(long snapshotId) {
        super("Snapshot not found: " + snapshotId);
    }
}
