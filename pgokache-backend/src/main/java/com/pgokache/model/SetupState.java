package com.pgokache.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

/**
 * Last known pg_stat_statements setup of an instance. {@code ready} gates scheduled collection.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SetupState {
    private Long instanceId;
    private Integer pgVersionNum;
    private boolean preloadOk;
    private boolean extCreated;
    private boolean ready;
    private OffsetDateTime lastCheckedAt;
}
