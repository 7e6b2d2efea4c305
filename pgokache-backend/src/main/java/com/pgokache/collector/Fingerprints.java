package com.pgokache.collector;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Stable recommendation keys. Values are persisted, so the input format must never change.
 */
public final class Fingerprints {
    private static final String READ_REPLICA_MARKER = "read_replica";

    private Fingerprints() {
    }

    /**
     * Key for a per-query recommendation.
     *
     * @param queryid pg_stat_statements queryid, as text
     * @param instanceId instance id
     * @return 64-char lowercase hex SHA-256
     */
    public static String forQuery(String queryid, long instanceId) {
        return sha256Hex(instanceId + ":" + queryid);
    }

    /**
     * Key of the single read-replica recommendation an instance can have.
     *
     * @param instanceId instance id
     * @return 64-char lowercase hex SHA-256
     */
    public static String forReadReplica(long instanceId) {
        return sha256Hex(instanceId + ":" + READ_REPLICA_MARKER);
    }

    private static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // SHA-256 is mandatory on every JRE
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
