package com.journeynsw.backend.service;

public interface MonitoringService {
    /**
     * Records the duration and status of a trip refresh.
     *
     * @param tripName   The configured trip name, or "total" for a full refresh
     * @param durationMs The duration of the operation in milliseconds
     * @param status     The status of the operation (e.g., "SUCCESS", "FAILED")
     */
    void recordRefreshDuration(String tripName, long durationMs, String status);

    /**
     * Records how many journeys a refresh returned and how many of them carry a vehicle position.
     */
    void recordJourneyCount(String tripName, int journeys, int withRealtime);
}
