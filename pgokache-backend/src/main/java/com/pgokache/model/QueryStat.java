package com.pgokache.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One pg_stat_statements row captured in a snapshot.
 *
 * <p>The harvester produces rows without {@code id}/{@code snapshotId}; the record store
 * assigns both when the snapshot is created.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class QueryStat {
    private Long id;
    private Long snapshotId;
    private String queryid;
    private String queryNorm;
    private long calls;
    private double totalTimeMs;
    private double meanTimeMs;
    private long rows;
    private long sharedBlksRead;
    private long sharedBlksHit;
    private long tempBlksWritten;
    private long walBytes;
}
