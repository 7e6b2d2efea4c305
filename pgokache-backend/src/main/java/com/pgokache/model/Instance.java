package com.pgokache.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

/**
 * A monitored PostgreSQL database. The password is only ever held encrypted.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Instance {
    private Long id;
    private String name;
    private String host;
    @Builder.Default
    private int port = 5432;
    private String dbname;
    private String user;
    private byte[] passwordEnc;
    @Builder.Default
    private String sslMode = "prefer";
    private OffsetDateTime createdAt;
}
