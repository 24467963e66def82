package com.journeynsw.backend.model;

import lombok.Builder;
import lombok.Value;

/**
 * One vehicle entity of a realtime feed, reduced to the fields used for trip correlation.
 */
@Value
@Builder
public class VehiclePosition {
    String entityId;
    String tripId;
    String routeId;
    String vehicleId;
    Double latitude;
    Double longitude;
    Float bearing;
    Long timestamp; // POSIX seconds
}
