package com.pgokache.collector;

import lombok.Builder;
import lombok.Value;

/**
 * Thresholds for one harvest. Unset fields keep the defaults.
 */
@Value
@Builder(toBuilder = true)
public class HarvestOptions {
    public static final int DEFAULT_LIMIT = 200;
    public static final long DEFAULT_MIN_CALLS = 5;
    public static final double DEFAULT_MIN_TOTAL_TIME_MS = 50;

    @Builder.Default
    int limit = DEFAULT_LIMIT;
    @Builder.Default
    long minCalls = DEFAULT_MIN_CALLS;
    @Builder.Default
    double minTotalTimeMs = DEFAULT_MIN_TOTAL_TIME_MS;
    /** Keep the raw query text instead of the normalized form. */
    @Builder.Default
    boolean storeFullQueryText = false;

    public static HarvestOptions defaults() {
        return HarvestOptions.builder().build();
    }
}
