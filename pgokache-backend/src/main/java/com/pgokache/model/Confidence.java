package com.pgokache.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Confidence {
    LOW,
    MEDIUM,
    HIGH;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
