package com.journeynsw.backend.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Latest retrieval for one configured trip. A failed refresh keeps the previous journeys and
 * only flips {@code available}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TripBoardEntry {
    private String tripName;
    private boolean available;
    private LocalDateTime lastUpdatedTime;
    private LocalDateTime lastAttemptTime;
    private String lastError;

    @Builder.Default
    private List<JourneySummary> journeys = new ArrayList<>();

    @JsonIgnore
    @Builder.Default
    private List<JourneyRealtime> results = new ArrayList<>();
}
