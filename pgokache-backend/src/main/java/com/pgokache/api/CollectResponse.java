package com.pgokache.api;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class CollectResponse {
    private Long snapshotId;
    private int rows;
    private int recommendations;
}
