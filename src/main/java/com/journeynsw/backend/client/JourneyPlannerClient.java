package com.journeynsw.backend.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.transit.realtime.GtfsRealtime;
import com.journeynsw.backend.config.TransportNswProperties;
import com.journeynsw.backend.exception.ConfigurationException;
import com.journeynsw.backend.exception.MalformedResponseException;
import com.journeynsw.backend.exception.UpstreamException;
import com.journeynsw.backend.model.ModeOfTransport;
import com.journeynsw.backend.model.RealtimeFeed;
import com.journeynsw.backend.model.TripQuery;
import com.journeynsw.backend.model.TripRequestResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeoutException;

@Component
@Slf4j
public class JourneyPlannerClient implements JourneyPlannerApi {

        static final String TRIP_PATH = "/v1/tp/trip";
        static final String VEHICLE_POSITION_PATH = "/v1/gtfs/vehiclepos/{mode}";

        private static final String API_VERSION = "10.2.1.42";
        private static final DateTimeFormatter ITD_DATE = DateTimeFormatter.ofPattern("yyyyMMdd");
        private static final DateTimeFormatter ITD_TIME = DateTimeFormatter.ofPattern("HHmm");

        private final WebClient webClient;
        private final ObjectMapper objectMapper;
        private final Clock clock;
        private final Duration timeout;
        private final ZoneId plannerZone;

        public JourneyPlannerClient(WebClient.Builder webClientBuilder, ObjectMapper objectMapper,
                        TransportNswProperties properties, Clock clock) {
                this.objectMapper = objectMapper;
                this.clock = clock;
                this.timeout = properties.getApi().getTimeout();
                this.plannerZone = properties.getApi().getTimeZone();
                this.webClient = webClientBuilder
                                .baseUrl(properties.getApi().getBaseUrl())
                                .defaultHeader(HttpHeaders.AUTHORIZATION, "apikey " + properties.getApiKey())
                                .codecs(configurer -> configurer
                                                .defaultCodecs()
                                                .maxInMemorySize(properties.getApi().getMaxInMemorySize()))
                                .build();
        }

        @Override
        public TripRequestResponse queryTrip(TripQuery query) {
                MultiValueMap<String, String> params = buildTripParams(query);
                log.debug("📡 Querying trip planner: {} → {} ({} journeys)", query.getOrigin(),
                                query.getDestination(), query.getNumJourneys());

                String body = webClient.get()
                                .uri(uriBuilder -> uriBuilder
                                                .path(TRIP_PATH)
                                                .queryParams(params)
                                                .build())
                                .retrieve()
                                .bodyToMono(String.class)
                                .timeout(timeout)
                                .onErrorMap(e -> toUpstreamError(e, "Trip query"))
                                .block();

                if (body == null) {
                        throw new MalformedResponseException("Trip query returned an empty body", null);
                }
                try {
                        return objectMapper.readValue(body, TripRequestResponse.class);
                } catch (JsonProcessingException e) {
                        throw new MalformedResponseException("Malformed trip response: " + e.getOriginalMessage(), e);
                }
        }

        @Override
        public RealtimeFeed fetchRealtimeFeed(String modeKey) {
                return fetchRealtimeFeedAsync(modeKey).block();
        }

        @Override
        public Mono<RealtimeFeed> fetchRealtimeFeedAsync(String modeKey) {
                return webClient.get()
                                .uri(VEHICLE_POSITION_PATH, modeKey)
                                .retrieve()
                                .bodyToMono(byte[].class)
                                .timeout(timeout)
                                .onErrorMap(e -> toUpstreamError(e, "Realtime feed " + modeKey))
                                .switchIfEmpty(Mono.error(() -> new MalformedResponseException(
                                                "Realtime feed " + modeKey + " returned an empty body", null)))
                                .map(bytes -> parseFeed(modeKey, bytes));
        }

        MultiValueMap<String, String> buildTripParams(TripQuery query) {
                if (query.getDepartAt() != null && query.getArriveBy() != null) {
                        throw new ConfigurationException("Unable to specify both departAt and arriveBy");
                }
                if (query.getIncludeModes() != null && query.getExcludeModes() != null) {
                        throw new ConfigurationException("Unable to specify both includeModes and excludeModes");
                }
                if (query.getNumJourneys() < 1) {
                        throw new ConfigurationException("At least one journey must be requested");
                }

                ZonedDateTime itd = query.getArriveBy() != null ? query.getArriveBy()
                                : query.getDepartAt() != null ? query.getDepartAt()
                                                : ZonedDateTime.now(clock);
                itd = itd.withZoneSameInstant(plannerZone);

                MultiValueMap<String, String> params = new LinkedMultiValueMap<>();
                params.add("outputFormat", "rapidJSON");
                params.add("depArrMacro", query.getArriveBy() != null ? "arr" : "dep");
                params.add("itdDate", itd.format(ITD_DATE));
                params.add("itdTime", itd.format(ITD_TIME));
                params.add("type_origin", "any");
                params.add("type_destination", "any");
                params.add("name_origin", query.getOrigin());
                params.add("name_destination", query.getDestination());
                params.add("calcNumberOfTrips", String.valueOf(query.getNumJourneys()));
                params.add("version", API_VERSION);
                params.add("TfNSWTR", "true");

                Set<ModeOfTransport> excluded = excludedModes(query.getIncludeModes(), query.getExcludeModes());
                if (!excluded.isEmpty()) {
                        params.add("excludedMeans", "checkbox");
                        for (ModeOfTransport mode : excluded) {
                                params.add(mode.getExclusionParam(), "1");
                        }
                }
                return params;
        }

        /**
         * The planner only understands exclusions, so an inclusion list is sent as its complement.
         */
        static Set<ModeOfTransport> excludedModes(List<ModeOfTransport> include, List<ModeOfTransport> exclude) {
                if (include != null && !include.isEmpty()) {
                        Set<ModeOfTransport> excluded = EnumSet.allOf(ModeOfTransport.class);
                        include.forEach(excluded::remove);
                        return excluded;
                }
                if (exclude != null && !exclude.isEmpty()) {
                        return EnumSet.copyOf(exclude);
                }
                return EnumSet.noneOf(ModeOfTransport.class);
        }

        private RealtimeFeed parseFeed(String modeKey, byte[] bytes) {
                try {
                        GtfsRealtime.FeedMessage message = GtfsRealtime.FeedMessage.parseFrom(bytes);
                        RealtimeFeed feed = RealtimeFeed.fromFeedMessage(modeKey, message, clock.instant());
                        log.debug("✅ Decoded realtime feed {}: {} vehicles ({} bytes)", modeKey,
                                        feed.getVehicles().size(), bytes.length);
                        return feed;
                } catch (InvalidProtocolBufferException e) {
                        throw new MalformedResponseException("Malformed realtime feed " + modeKey + ": " + e.getMessage(), e);
                }
        }

        private Throwable toUpstreamError(Throwable e, String what) {
                if (e instanceof WebClientResponseException) {
                        int status = ((WebClientResponseException) e).getStatusCode().value();
                        return new UpstreamException(status, what + " failed with HTTP " + status);
                }
                if (e instanceof TimeoutException) {
                        return new UpstreamException(what + " timed out after " + timeout.toMillis() + "ms", e);
                }
                if (e instanceof WebClientRequestException) {
                        return new UpstreamException(what + " could not reach the planner: " + e.getMessage(), e);
                }
                return e;
        }
}
