package com.journeynsw.backend.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.List;
import java.util.Optional;

@Value
@JsonIgnoreProperties(ignoreUnknown = true)
public class JourneyLeg {

    int duration; // seconds
    Integer distance;
    Boolean isRealtimeControlled;
    JourneyLegStop origin;
    JourneyLegStop destination;
    TripTransportation transportation;
    List<JourneyLegStopInfo> infos;

    @Builder
    @JsonCreator
    public JourneyLeg(
            @JsonProperty("duration") @NonNull Integer duration,
            @JsonProperty("distance") Integer distance,
            @JsonProperty("isRealtimeControlled") Boolean isRealtimeControlled,
            @JsonProperty("origin") @NonNull JourneyLegStop origin,
            @JsonProperty("destination") @NonNull JourneyLegStop destination,
            @JsonProperty("transportation") TripTransportation transportation,
            @JsonProperty("infos") @NonNull List<JourneyLegStopInfo> infos) {
        this.duration = duration;
        this.distance = distance;
        this.isRealtimeControlled = isRealtimeControlled;
        this.origin = origin;
        this.destination = destination;
        this.transportation = transportation;
        this.infos = List.copyOf(infos);
    }

    @JsonIgnore
    public Optional<TripTransportation> getTransportationIfPresent() {
        return Optional.ofNullable(transportation);
    }

    /**
     * A leg without transportation, or whose product class is pedestrian, is a walking leg.
     */
    @JsonIgnore
    public boolean isWalking() {
        return transportation == null || transportation.getProduct().getKlass().isWalking();
    }
}
