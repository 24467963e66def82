package com.journeynsw.backend.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Modes a trip query can be filtered by. The planner only accepts exclusions, one
 * {@code exclMOT_<code>} parameter per excluded mode.
 */
public enum ModeOfTransport {
    TRAIN("train", 1),
    LIGHT_RAIL("light_rail", 4),
    BUS("bus", 5),
    COACH("coach", 7),
    FERRY("ferry", 9),
    SCHOOL_BUS("school_bus", 11);

    private final String key;
    private final int code;

    ModeOfTransport(String key, int code) {
        this.key = key;
        this.code = code;
    }

    @JsonValue
    public String getKey() {
        return key;
    }

    public String getExclusionParam() {
        return "exclMOT_" + code;
    }

    @JsonCreator
    public static ModeOfTransport fromKey(String key) {
        for (ModeOfTransport mode : values()) {
            if (mode.key.equalsIgnoreCase(key) || mode.name().equalsIgnoreCase(key)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown mode of transport: " + key);
    }
}
