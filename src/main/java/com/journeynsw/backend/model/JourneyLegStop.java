package com.journeynsw.backend.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.ZonedDateTime;

@Value
@JsonIgnoreProperties(ignoreUnknown = true)
public class JourneyLegStop {

    String id;
    String name;
    String disassembledName;
    String type;
    ZonedDateTime departureTimeEstimated;
    ZonedDateTime departureTimePlanned;
    ZonedDateTime arrivalTimeEstimated;
    ZonedDateTime arrivalTimePlanned;
    Properties properties;

    @Builder
    @JsonCreator
    public JourneyLegStop(
            @JsonProperty("id") @NonNull String id,
            @JsonProperty("name") @NonNull String name,
            @JsonProperty("disassembledName") String disassembledName,
            @JsonProperty("type") @NonNull String type,
            @JsonProperty("departureTimeEstimated") ZonedDateTime departureTimeEstimated,
            @JsonProperty("departureTimePlanned") ZonedDateTime departureTimePlanned,
            @JsonProperty("arrivalTimeEstimated") ZonedDateTime arrivalTimeEstimated,
            @JsonProperty("arrivalTimePlanned") ZonedDateTime arrivalTimePlanned,
            @JsonProperty("properties") @NonNull Properties properties) {
        this.id = id;
        this.name = name;
        this.disassembledName = disassembledName;
        this.type = type;
        this.departureTimeEstimated = departureTimeEstimated;
        this.departureTimePlanned = departureTimePlanned;
        this.arrivalTimeEstimated = arrivalTimeEstimated;
        this.arrivalTimePlanned = arrivalTimePlanned;
        this.properties = properties;
    }

    @Value
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Properties {
        // e.g. MANY_SEATS, FEW_SEATS, STANDING_ONLY
        String occupancy;

        @JsonCreator
        public Properties(@JsonProperty("occupancy") String occupancy) {
            this.occupancy = occupancy;
        }

        public static Properties empty() {
            return new Properties(null);
        }
    }
}
