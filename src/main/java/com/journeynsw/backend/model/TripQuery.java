package com.journeynsw.backend.model;

import lombok.Builder;
import lombok.Value;

import java.time.ZonedDateTime;
import java.util.List;

/**
 * Parameters of a single trip planner request. At most one of {@code departAt} / {@code arriveBy}
 * and at most one of {@code includeModes} / {@code excludeModes} may be set.
 */
@Value
@Builder
public class TripQuery {
    String origin;
    String destination;
    @Builder.Default
    int numJourneys = 1;
    ZonedDateTime departAt;
    ZonedDateTime arriveBy;
    List<ModeOfTransport> includeModes;
    List<ModeOfTransport> excludeModes;
}
