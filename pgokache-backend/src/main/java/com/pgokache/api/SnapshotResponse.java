package com.pgokache.api;

import com.pgokache.model.QueryStat;
import com.pgokache.model.Snapshot;
import lombok.Builder;
import lombok.Data;

import java.time.OffsetDateTime;
import java.util.List;

@Data
@Builder
public class SnapshotResponse {
    private Long id;
    private Long instanceId;
    private OffsetDateTime capturedAt;
    private List<QueryStat> queryStats;

    public static SnapshotResponse from(Snapshot snapshot, List<QueryStat> queryStats) {
        return SnapshotResponse.builder()
                .id(snapshot.getId())
                .instanceId(snapshot.getInstanceId())
                .capturedAt(snapshot.getCapturedAt())
                .queryStats(queryStats)
                .build();
    }
}
