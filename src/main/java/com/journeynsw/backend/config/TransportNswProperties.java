package com.journeynsw.backend.config;

import com.journeynsw.backend.exception.ConfigurationException;
import com.journeynsw.backend.model.TripDefinition;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Data
@ConfigurationProperties(prefix = "transportnsw")
public class TransportNswProperties {

    private String apiKey;
    private Api api = new Api();
    private List<TripDefinition> trips = new ArrayList<>();

    @Data
    public static class Api {
        private String baseUrl = "https://api.transport.nsw.gov.au";
        private Duration timeout = Duration.ofSeconds(10);
        // Vehicle position feeds for buses run to several MB
        private int maxInMemorySize = 16 * 1024 * 1024;
        private ZoneId timeZone = ZoneId.of("Australia/Sydney");
    }

    @PostConstruct
    public void validate() {
        if (apiKey == null || apiKey.isBlank()) {
            throw new ConfigurationException("transportnsw.api-key must be set");
        }
        Set<String> names = new HashSet<>();
        for (TripDefinition trip : trips) {
            if (trip.getName() == null || trip.getName().isBlank()) {
                throw new ConfigurationException("Every trip needs a name");
            }
            if (!names.add(trip.getName())) {
                throw new ConfigurationException("Duplicate trip name: " + trip.getName());
            }
            if (trip.getOriginStopId() == null || trip.getOriginStopId().isBlank()
                    || trip.getDestinationStopId() == null || trip.getDestinationStopId().isBlank()) {
                throw new ConfigurationException("Trip " + trip.getName() + " needs an origin and a destination stop id");
            }
            if (trip.getNumJourneys() < 1) {
                throw new ConfigurationException("Trip " + trip.getName() + " must request at least one journey");
            }
            if (trip.getFareType() == null) {
                throw new ConfigurationException("Trip " + trip.getName() + " has no fare type");
            }
        }
    }
}
