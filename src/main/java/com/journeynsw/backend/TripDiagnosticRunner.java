package com.journeynsw.backend;

import com.journeynsw.backend.model.JourneyRealtime;
import com.journeynsw.backend.model.JourneySummary;
import com.journeynsw.backend.model.ModeOfTransport;
import com.journeynsw.backend.model.TripDefinition;
import com.journeynsw.backend.service.JourneyTransformationService;
import com.journeynsw.backend.service.TripRetrievalService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Runs a single query and logs the normalized fields of every journey.
 * Usage: {@code --spring.profiles.active=diagnostic [origin] [destination] [modes]}
 */
@Component
@Profile("diagnostic")
@RequiredArgsConstructor
@Slf4j
public class TripDiagnosticRunner implements CommandLineRunner {

    private static final String DEFAULT_ORIGIN = "222310";
    private static final String DEFAULT_DESTINATION = "200060";
    private static final String DEFAULT_MODES = "bus";

    private final TripRetrievalService tripRetrievalService;
    private final JourneyTransformationService transformationService;

    @Override
    public void run(String... args) {
        List<String> positional = Arrays.stream(args)
                .filter(arg -> !arg.startsWith("--"))
                .collect(Collectors.toList());

        TripDefinition trip = TripDefinition.builder()
                .name("diagnostic")
                .originStopId(positional.size() > 0 ? positional.get(0) : DEFAULT_ORIGIN)
                .destinationStopId(positional.size() > 1 ? positional.get(1) : DEFAULT_DESTINATION)
                .modesOfTransport(parseModes(positional.size() > 2 ? positional.get(2) : DEFAULT_MODES))
                .build();

        log.info("🔎 Diagnostic query {} → {} modes={}", trip.getOriginStopId(), trip.getDestinationStopId(),
                trip.getModesOfTransport());

        List<JourneyRealtime> results = tripRetrievalService.retrieve(trip);
        for (JourneyRealtime result : results) {
            JourneySummary summary = transformationService.toSummary(result, trip.getFareType());
            log.info("Origin {} {}", summary.getOriginStopId(), summary.getOriginName());
            log.info("Destination {} {}", summary.getDestinationStopId(), summary.getDestinationName());
            log.info("Trip Changes {}", summary.getChanges());
            log.info("Origin Mode {} ({})", summary.getOriginTransportName(), summary.getOriginTransportType());
            log.info("Departure Time (est) {}", summary.getDepartureTimeEstimated());
            log.info("Departure Time (planned) {}", summary.getDepartureTimePlanned());
            log.info("Due {} min", summary.getDueMinutes());
            log.info("Arrival Time (est) {}", summary.getArrivalTimeEstimated());
            log.info("Arrival Time (planned) {}", summary.getArrivalTimePlanned());
            log.info("Occupancy {}", summary.getOccupancy());
            log.info("RealTimeTrip {}", summary.getRealTimeTripId());
            log.info("Origin Line (short) {}", summary.getOriginLineNameShort());
            log.info("Origin Line {}", summary.getOriginLineName());
            log.info("Fare {} {}", summary.getFareType(), summary.getFarePrice());
            result.getRealtime().ifPresentOrElse(
                    position -> log.info("Vehicle position {}, {}", position.getLatitude(), position.getLongitude()),
                    () -> log.info("Vehicle position unavailable"));
        }
    }

    static List<ModeOfTransport> parseModes(String modes) {
        if (modes == null || modes.isBlank() || modes.equalsIgnoreCase("all")) {
            return null;
        }
        return Arrays.stream(modes.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(ModeOfTransport::fromKey)
                .collect(Collectors.toList());
    }
}
