package com.pgokache.api;

import com.pgokache.model.Instance;
import lombok.Builder;
import lombok.Data;

import java.time.OffsetDateTime;

@Data
@Builder
public class InstanceResponse {
    private Long id;
    private String name;
    private String host;
    private int port;
    private String dbname;
    private String user;
    private String sslMode;
    private OffsetDateTime createdAt;

    public static InstanceResponse from(Instance instance) {
        return InstanceResponse.builder()
                .id(instance.getId())
                .name(instance.getName())
                .host(instance.getHost())
                .port(instance.getPort())
                .dbname(instance.getDbname())
                .user(instance.getUser())
                .sslMode(instance.getSslMode())
                .createdAt(instance.getCreatedAt())
                .build();
    }
}
