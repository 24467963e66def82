package com.journeynsw.backend.model;

import java.util.Optional;

/**
 * Per-mode vehicle position endpoints of the realtime feed.
 */
public enum GtfsMode {
    BUSES("buses"),
    FERRIES("ferries"),
    LIGHT_RAIL("lightrail"),
    SYDNEY_TRAINS("sydneytrains");

    private final String key;

    GtfsMode(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    public static Optional<GtfsMode> forProductClass(RouteProductClass klass) {
        GtfsMode mode = switch (klass) {
            case BUS -> BUSES;
            case FERRY -> FERRIES;
            case LIGHT_RAIL -> LIGHT_RAIL;
            case TRAIN -> SYDNEY_TRAINS;
            case COACH, SCHOOL_BUS, WALKING, WALKING_FOOTPATH, BICYCLE, TAKE_BICYCLE_ON_PUBLIC_TRANSPORT,
                    KISS_AND_RIDE, PARK_AND_RIDE, TAXI, CAR -> null;
        };
        return Optional.ofNullable(mode);
    }
}
