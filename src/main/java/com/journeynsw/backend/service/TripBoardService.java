package com.journeynsw.backend.service;

import com.journeynsw.backend.config.TransportNswProperties;
import com.journeynsw.backend.exception.TripNotFoundException;
import com.journeynsw.backend.exception.TripPlannerException;
import com.journeynsw.backend.model.FareSummary;
import com.journeynsw.backend.model.JourneyRealtime;
import com.journeynsw.backend.model.JourneySummary;
import com.journeynsw.backend.model.TripBoardEntry;
import com.journeynsw.backend.model.TripDefinition;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;

/**
 * Latest journeys of every configured trip. Refreshes are triggered from outside (REST or the
 * diagnostic runner); nothing here polls on its own.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TripBoardService {

        private final TransportNswProperties properties;
        private final TripRetrievalService tripRetrievalService;
        private final JourneyTransformationService transformationService;
        private final MonitoringService monitoringService;
        private final Clock clock;

        private final Map<String, TripBoardEntry> board = new ConcurrentHashMap<>();

        /**
         * Refresh all configured trips in parallel
         *
         * @return One entry per trip, in configuration order
         */
        public List<TripBoardEntry> refreshAll() {
                List<TripDefinition> trips = properties.getTrips();
                if (trips.isEmpty()) {
                        log.warn("⚠️ No trips configured, nothing to refresh");
                        return List.of();
                }
                long startMillis = clock.millis();

                log.info("═══════════════════════════════════════════════════════════════════");
                log.info("🚆 TRIP REFRESH STARTED | Trips: {}", trips.size());
                log.info("═══════════════════════════════════════════════════════════════════");

                ExecutorService executor = Executors.newFixedThreadPool(Math.min(trips.size(), 8));
                try {
                        List<CompletableFuture<TripBoardEntry>> futures = trips.stream()
                                        .map(trip -> CompletableFuture.supplyAsync(() -> refresh(trip), executor))
                                        .collect(Collectors.toList());

                        List<TripBoardEntry> entries = futures.stream()
                                        .map(CompletableFuture::join)
                                        .collect(Collectors.toList());

                        long totalDuration = clock.millis() - startMillis;
                        monitoringService.recordRefreshDuration("total", totalDuration,
                                        entries.stream().allMatch(TripBoardEntry::isAvailable) ? "SUCCESS" : "PARTIAL");
                        log.info("🚆 TRIP REFRESH ENDED | Total Time: {}ms", totalDuration);
                        return entries;
                } finally {
                        executor.shutdown();
                }
        }

        public TripBoardEntry refresh(String tripName) {
                return refresh(findTrip(tripName));
        }

        /**
         * Refresh one trip. On failure the previous journeys stay in place and the entry is marked
         * unavailable.
         */
        public TripBoardEntry refresh(TripDefinition trip) {
                String name = trip.getName();
                long startMillis = clock.millis();
                LocalDateTime attempt = LocalDateTime.now(clock);

                log.info("───────────────────────────────────────────────────────────────────");
                log.info("🚆 REFRESHING TRIP: {} | {} → {}", name, trip.getOriginStopId(), trip.getDestinationStopId());

                try {
                        List<JourneyRealtime> results = tripRetrievalService.retrieve(trip);
                        List<JourneySummary> summaries = results.stream()
                                        .map(result -> transformationService.toSummary(result, trip.getFareType()))
                                        .collect(Collectors.toList());
                        int withRealtime = (int) results.stream().filter(r -> r.getRealtime().isPresent()).count();

                        TripBoardEntry entry = TripBoardEntry.builder()
                                        .tripName(name)
                                        .available(true)
                                        .lastUpdatedTime(attempt)
                                        .lastAttemptTime(attempt)
                                        .journeys(summaries)
                                        .results(results)
                                        .build();
                        board.put(name, entry);

                        long duration = clock.millis() - startMillis;
                        log.info("✅ SUMMARY: Trip={} | {} journeys | {} with vehicle position | Took: {}ms",
                                        name, results.size(), withRealtime, duration);
                        monitoringService.recordRefreshDuration(name, duration, "SUCCESS");
                        monitoringService.recordJourneyCount(name, results.size(), withRealtime);
                        return entry;

                } catch (TripPlannerException e) {
                        long duration = clock.millis() - startMillis;
                        log.error("❌ STATUS: FAILED | Error refreshing trip: {} | Took: {}ms", name, duration, e);
                        monitoringService.recordRefreshDuration(name, duration, "FAILED");

                        return board.compute(name, (key, previous) -> (previous == null
                                        ? TripBoardEntry.builder().tripName(name)
                                        : previous.toBuilder())
                                        .available(false)
                                        .lastAttemptTime(attempt)
                                        .lastError(e.getMessage())
                                        .build());
                }
        }

        public List<TripBoardEntry> getEntries() {
                List<TripBoardEntry> entries = new ArrayList<>();
                for (TripDefinition trip : properties.getTrips()) {
                        entries.add(getEntry(trip.getName()));
                }
                return entries;
        }

        public TripBoardEntry getEntry(String tripName) {
                findTrip(tripName);
                return board.getOrDefault(tripName, TripBoardEntry.builder()
                                .tripName(tripName)
                                .available(false)
                                .build());
        }

        public List<FareSummary> getFares(String tripName, int journeyIndex) {
                List<JourneyRealtime> results = getEntry(tripName).getResults();
                if (journeyIndex < 0 || journeyIndex >= results.size()) {
                        throw new TripNotFoundException("Trip " + tripName + " has no journey at index " + journeyIndex);
                }
                return transformationService.toFares(results.get(journeyIndex).getJourney());
        }

        private TripDefinition findTrip(String tripName) {
                return properties.getTrips().stream()
                                .filter(trip -> trip.getName().equals(tripName))
                                .findFirst()
                                .orElseThrow(() -> new TripNotFoundException("No trip configured with name: " + tripName));
        }
}
