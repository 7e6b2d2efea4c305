package com.pgokache.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RecommendationType {
    READ_REPLICA("read_replica"),
    INDEX("index");

    private final String value;

    RecommendationType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
