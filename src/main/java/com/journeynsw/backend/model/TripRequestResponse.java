package com.journeynsw.backend.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.List;

/**
 * Root of one trip planner response. Journeys keep the order the planner sent them in.
 */
@Value
@JsonIgnoreProperties(ignoreUnknown = true)
public class TripRequestResponse {

    String version;
    List<Journey> journeys;

    @Builder
    @JsonCreator
    public TripRequestResponse(
            @JsonProperty("version") @NonNull String version,
            @JsonProperty("journeys") @NonNull List<Journey> journeys) {
        this.version = version;
        this.journeys = List.copyOf(journeys);
    }
}
