package com.journeynsw.backend.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.Optional;

/**
 * The vehicle service a leg rides on.
 */
@Value
@JsonIgnoreProperties(ignoreUnknown = true)
public class TripTransportation {

    String id;
    String name;
    String disassembledName; // short line label, e.g. "T1"
    String number; // line label, e.g. "T1 North Shore & Western Line"
    Integer iconId;
    String description;
    RouteProduct product;
    Properties properties;

    @Builder
    @JsonCreator
    public TripTransportation(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("disassembledName") String disassembledName,
            @JsonProperty("number") String number,
            @JsonProperty("iconId") Integer iconId,
            @JsonProperty("description") String description,
            @JsonProperty("product") @NonNull RouteProduct product,
            @JsonProperty("properties") @NonNull Properties properties) {
        this.id = id;
        this.name = name;
        this.disassembledName = disassembledName;
        this.number = number;
        this.iconId = iconId;
        this.description = description;
        this.product = product;
        this.properties = properties;
    }

    /**
     * The join key into the realtime vehicle position feed, when the planner supplied one.
     */
    @JsonIgnore
    public Optional<String> getRealtimeTripId() {
        return Optional.ofNullable(properties.getRealtimeTripId());
    }

    @Value
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Properties {
        @JsonProperty("RealtimeTripId")
        String realtimeTripId;

        @JsonCreator
        public Properties(@JsonProperty("RealtimeTripId") String realtimeTripId) {
            this.realtimeTripId = realtimeTripId;
        }
    }
}
