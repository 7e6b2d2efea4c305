package com.pgokache.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

/**
 * Optimization hint for an instance, unique per (instanceId, fingerprint).
 *
 * <p>{@code status} and {@code createdAt} belong to whoever manages the recommendation lifecycle;
 * regeneration only overwrites the descriptive fields.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Recommendation {
    public static final String STATUS_OPEN = "open";

    private Long id;
    private Long instanceId;
    private String fingerprint;
    private RecommendationType type;
    private String title;
    private String details;
    @Builder.Default
    private String sql = "";
    private Confidence confidence;
    private double score;
    @Builder.Default
    private String status = STATUS_OPEN;
    private OffsetDateTime createdAt;
}
