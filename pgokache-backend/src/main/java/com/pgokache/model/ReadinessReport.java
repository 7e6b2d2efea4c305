package com.pgokache.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Outcome of one readiness probe.
 *
 * <p>{@code status} is derived from availability, preload and creation only, while {@code ready}
 * additionally requires the pg_stat_statements view to be visible. Both are reported.
 */
@Value
@Builder
public class ReadinessReport {
    ReadinessStatus status;
    boolean ready;
    int pgVersionNum;
    boolean preloadOk;
    boolean extCreated;
    ReadinessChecks checks;
    Map<String, String> params;
}
