package com.journeynsw.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TripDefinition {
    private String name;
    private String originStopId;
    private String destinationStopId;
    @Builder.Default
    private int numJourneys = 1;
    @Builder.Default
    private FarePerson fareType = FarePerson.ADULT;
    // Sent as an inclusion list; null means every mode
    private List<ModeOfTransport> modesOfTransport;

    public TripQuery toQuery() {
        return TripQuery.builder()
                .origin(originStopId)
                .destination(destinationStopId)
                .numJourneys(numJourneys)
                .includeModes(modesOfTransport)
                .build();
    }
}
