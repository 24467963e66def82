package com.journeynsw.backend.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum InfoPriority {
    VERY_LOW("veryLow"),
    LOW("low"),
    NORMAL("normal"),
    HIGH("high"),
    VERY_HIGH("veryHigh");

    private final String value;

    InfoPriority(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
