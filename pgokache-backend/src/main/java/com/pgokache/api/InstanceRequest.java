package com.pgokache.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.pgokache.model.Instance;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

/**
 * Create/update payload for a monitored instance. The password is write-only.
 */
@Data
public class InstanceRequest {
    @NotBlank(message = "Name is required")
    private String name;

    @NotBlank(message = "Host is required")
    private String host;

    @Min(value = 1, message = "Port must be between 1 and 65535")
    @Max(value = 65535, message = "Port must be between 1 and 65535")
    private int port = 5432;

    @NotBlank(message = "Database name is required")
    private String dbname;

    @NotBlank(message = "User is required")
    private String user;

    @JsonProperty(access = JsonProperty.Access.WRITE_ONLY)
    private String password;

    @Pattern(regexp = "disable|allow|prefer|require|verify-ca|verify-full",
            message = "ssl_mode must be one of disable, allow, prefer, require, verify-ca, verify-full")
    private String sslMode = "prefer";

    public Instance toInstance() {
        return Instance.builder()
                .name(name)
                .host(host)
                .port(port)
                .dbname(dbname)
                .user(user)
                .sslMode(sslMode)
                .build();
    }
}
