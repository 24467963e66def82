package com.journeynsw.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.ZonedDateTime;

/**
 * Flattened view of one journey: where and when it leaves, what it rides on, what it costs and
 * where the vehicle currently is.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JourneySummary {
    private Long dueMinutes;

    private String originStopId;
    private String originName;
    private String destinationStopId;
    private String destinationName;

    private ZonedDateTime departureTimeEstimated;
    private ZonedDateTime departureTimePlanned;
    private ZonedDateTime arrivalTimeEstimated;
    private ZonedDateTime arrivalTimePlanned;

    private Integer originTransportType; // product class code
    private String originTransportName;
    private String originLineName;
    private String originLineNameShort;
    private String icon;

    private int changes; // -1 for an all-walking journey
    private String occupancy;
    private String realTimeTripId;

    private FarePerson fareType;
    private String farePrice; // exact decimal, null when no ticket for fareType

    private Double latitude;
    private Double longitude;
}
