package com.pgokache.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Snapshot {
    private Long id;
    private Long instanceId;
    private OffsetDateTime capturedAt;
}
