package com.pgokache.model;

import lombok.Builder;
import lombok.Value;

/**
 * Raw answers of the six mandatory readiness queries.
 */
@Value
@Builder
public class ReadinessChecks {
    String serverVersion;
    int serverVersionNum;
    String sharedPreloadLibraries;
    boolean available;
    boolean created;
    boolean hasView;
}
