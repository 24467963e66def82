package com.journeynsw.backend.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.List;

@Value
@JsonIgnoreProperties(ignoreUnknown = true)
public class Fare {

    List<JourneyFareTicket> tickets;
    // Only presence is used, the zone structure is left as raw JSON.
    List<JsonNode> zones;

    @Builder
    @JsonCreator
    public Fare(
            @JsonProperty("tickets") @NonNull List<JourneyFareTicket> tickets,
            @JsonProperty("zones") List<JsonNode> zones) {
        this.tickets = List.copyOf(tickets);
        this.zones = zones == null ? null : List.copyOf(zones);
    }
}
