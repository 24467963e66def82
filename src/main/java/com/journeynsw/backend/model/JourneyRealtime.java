package com.journeynsw.backend.model;

import lombok.Value;

import java.util.Optional;

/**
 * A journey paired with the live position of the vehicle on its first non-walking leg, if one was found.
 */
@Value
public class JourneyRealtime {

    Journey journey;
    VehiclePosition realtime;

    public Optional<VehiclePosition> getRealtime() {
        return Optional.ofNullable(realtime);
    }

    public static JourneyRealtime of(Journey journey, Optional<VehiclePosition> realtime) {
        return new JourneyRealtime(journey, realtime.orElse(null));
    }
}
