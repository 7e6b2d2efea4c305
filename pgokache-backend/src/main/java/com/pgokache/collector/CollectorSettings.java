package com.pgokache.collector;

import lombok.Builder;
import lombok.Data;

/**
 * Collection settings read from {@code pgokache.collector.*}.
 */
@Data
@Builder
public class CollectorSettings {
    /** Polling never runs more often than this. */
    public static final int MIN_INTERVAL_SEC = 10;

    @Builder.Default
    private int intervalSec = 60;
    @Builder.Default
    private int limit = HarvestOptions.DEFAULT_LIMIT;
    @Builder.Default
    private long minCalls = HarvestOptions.DEFAULT_MIN_CALLS;
    @Builder.Default
    private double minTotalTimeMs = HarvestOptions.DEFAULT_MIN_TOTAL_TIME_MS;
    @Builder.Default
    private boolean storeFullQueryText = false;
    @Builder.Default
    private long connectionTimeoutMs = 5000;
    @Builder.Default
    private long statementTimeoutMs = 30000;

    /**
     * Polling interval floored at {@link #MIN_INTERVAL_SEC}.
     *
     * @return seconds between passes
     */
    public int resolveIntervalSec() {
        return Math.max(intervalSec, MIN_INTERVAL_SEC);
    }

    public HarvestOptions toHarvestOptions() {
        return HarvestOptions.builder()
                .limit(limit)
                .minCalls(minCalls)
                .minTotalTimeMs(minTotalTimeMs)
                .storeFullQueryText(storeFullQueryText)
                .build();
    }
}
