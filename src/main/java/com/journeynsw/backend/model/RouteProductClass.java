package com.journeynsw.backend.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Product classes used by the trip planner. The set is closed: an unknown code
 * fails the parse instead of being dropped.
 */
public enum RouteProductClass {
    TRAIN(1),
    LIGHT_RAIL(4),
    BUS(5),
    COACH(7),
    FERRY(9),
    SCHOOL_BUS(11),
    WALKING(99),
    WALKING_FOOTPATH(100),
    BICYCLE(101),
    TAKE_BICYCLE_ON_PUBLIC_TRANSPORT(102),
    KISS_AND_RIDE(103),
    PARK_AND_RIDE(104),
    TAXI(105),
    CAR(106);

    public static final String DEFAULT_ICON = "mdi:clock";

    private final int code;

    RouteProductClass(int code) {
        this.code = code;
    }

    @JsonValue
    public int getCode() {
        return code;
    }

    /**
     * Both 99 and 100 are pedestrian segments.
     */
    public boolean isWalking() {
        return this == WALKING || this == WALKING_FOOTPATH;
    }

    /**
     * Display icon for a journey whose first vehicle leg has this class.
     */
    public String getIcon() {
        return switch (this) {
            case TRAIN -> "mdi:train";
            case LIGHT_RAIL -> "mdi:tram";
            case BUS, COACH, SCHOOL_BUS -> "mdi:bus";
            case FERRY -> "mdi:ferry";
            case WALKING, WALKING_FOOTPATH, BICYCLE, TAKE_BICYCLE_ON_PUBLIC_TRANSPORT, KISS_AND_RIDE, PARK_AND_RIDE,
                    TAXI, CAR -> DEFAULT_ICON;
        };
    }

    @JsonCreator
    public static RouteProductClass fromCode(int code) {
        for (RouteProductClass klass : values()) {
            if (klass.code == code) {
                return klass;
            }
        }
        throw new IllegalArgumentException("Unknown route product class: " + code);
    }
}
