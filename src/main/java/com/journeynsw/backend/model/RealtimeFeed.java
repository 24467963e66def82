package com.journeynsw.backend.model;

import com.google.transit.realtime.GtfsRealtime;
import lombok.Value;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Immutable snapshot of one mode's vehicle position feed, decoded at fetch time.
 */
@Value
public class RealtimeFeed {

    String modeKey;
    Instant fetchedAt;
    Long feedTimestamp;
    List<VehiclePosition> vehicles;

    public RealtimeFeed(String modeKey, Instant fetchedAt, Long feedTimestamp, List<VehiclePosition> vehicles) {
        this.modeKey = modeKey;
        this.fetchedAt = fetchedAt;
        this.feedTimestamp = feedTimestamp;
        this.vehicles = List.copyOf(vehicles);
    }

    public Optional<VehiclePosition> findByTripId(String tripId) {
        return vehicles.stream()
                .filter(v -> tripId.equals(v.getTripId()))
                .findFirst();
    }

    public static RealtimeFeed fromFeedMessage(String modeKey, GtfsRealtime.FeedMessage message, Instant fetchedAt) {
        List<VehiclePosition> vehicles = new ArrayList<>(message.getEntityCount());
        for (GtfsRealtime.FeedEntity entity : message.getEntityList()) {
            if (!entity.hasVehicle()) {
                continue;
            }
            GtfsRealtime.VehiclePosition vehicle = entity.getVehicle();
            VehiclePosition.VehiclePositionBuilder position = VehiclePosition.builder()
                    .entityId(entity.getId());
            if (vehicle.hasTrip()) {
                position.tripId(vehicle.getTrip().hasTripId() ? vehicle.getTrip().getTripId() : null)
                        .routeId(vehicle.getTrip().hasRouteId() ? vehicle.getTrip().getRouteId() : null);
            }
            if (vehicle.hasVehicle() && vehicle.getVehicle().hasId()) {
                position.vehicleId(vehicle.getVehicle().getId());
            }
            if (vehicle.hasPosition()) {
                position.latitude((double) vehicle.getPosition().getLatitude())
                        .longitude((double) vehicle.getPosition().getLongitude())
                        .bearing(vehicle.getPosition().hasBearing() ? vehicle.getPosition().getBearing() : null);
            }
            if (vehicle.hasTimestamp()) {
                position.timestamp(vehicle.getTimestamp());
            }
            vehicles.add(position.build());
        }
        Long feedTimestamp = message.getHeader().hasTimestamp() ? message.getHeader().getTimestamp() : null;
        return new RealtimeFeed(modeKey, fetchedAt, feedTimestamp, vehicles);
    }
}
