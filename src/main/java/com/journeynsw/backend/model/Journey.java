package com.journeynsw.backend.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.List;

/**
 * One complete itinerary option. Legs are in travel order and never empty.
 */
@Value
@JsonIgnoreProperties(ignoreUnknown = true)
public class Journey {

    Integer rating;
    int isAdditional;
    List<JourneyLeg> legs;
    Fare fare;

    @Builder
    @JsonCreator
    public Journey(
            @JsonProperty("rating") Integer rating,
            @JsonProperty("isAdditional") @JsonDeserialize(using = IntegerFlagDeserializer.class) @NonNull Integer isAdditional,
            @JsonProperty("legs") @NonNull List<JourneyLeg> legs,
            @JsonProperty("fare") @NonNull Fare fare) {
        if (legs.isEmpty()) {
            throw new IllegalArgumentException("Journey has no legs");
        }
        this.rating = rating;
        this.isAdditional = isAdditional;
        this.legs = List.copyOf(legs);
        this.fare = fare;
    }
}
