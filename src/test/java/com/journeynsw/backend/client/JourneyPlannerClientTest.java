package com.journeynsw.backend.client;

import com.journeynsw.backend.JourneyFixtures;
import com.journeynsw.backend.config.TransportNswProperties;
import com.journeynsw.backend.exception.ConfigurationException;
import com.journeynsw.backend.exception.MalformedResponseException;
import com.journeynsw.backend.exception.UpstreamException;
import com.journeynsw.backend.model.ModeOfTransport;
import com.journeynsw.backend.model.RealtimeFeed;
import com.journeynsw.backend.model.TripQuery;
import com.journeynsw.backend.model.TripRequestResponse;
import com.journeynsw.backend.model.VehiclePosition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;

import static com.journeynsw.backend.JourneyFixtures.feedMessage;
import static com.journeynsw.backend.JourneyFixtures.vehicle;
import static org.junit.jupiter.api.Assertions.*;

class JourneyPlannerClientTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2023-05-01T00:30:00Z"), ZoneOffset.UTC);

    private final List<ClientRequest> requests = new ArrayList<>();
    private TransportNswProperties properties;

    @BeforeEach
    void setUp() {
        properties = new TransportNswProperties();
        properties.setApiKey("secret-key");
        properties.getApi().setTimeout(Duration.ofMillis(200));
    }

    private JourneyPlannerClient client(ExchangeFunction exchange) {
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            requests.add(request);
            return exchange.exchange(request);
        });
        return new JourneyPlannerClient(builder, JourneyFixtures.objectMapper(), properties, CLOCK);
    }

    private static ExchangeFunction json(HttpStatus status, String body) {
        return request -> Mono.just(ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build());
    }

    private static ExchangeFunction binary(byte[] body) {
        DataBuffer buffer = DefaultDataBufferFactory.sharedInstance.wrap(body);
        return request -> Mono.just(ClientResponse.create(HttpStatus.OK)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_OCTET_STREAM_VALUE)
                .body(Flux.just(buffer))
                .build());
    }

    private MultiValueMap<String, String> lastQueryParams() {
        return UriComponentsBuilder.fromUri(requests.get(requests.size() - 1).url()).build().getQueryParams();
    }

    private static TripQuery.TripQueryBuilder query() {
        return TripQuery.builder().origin("222310").destination("200060");
    }

    @Test
    void testQueryTrip_ParsesResponseAndSendsApiKey() {
        JourneyPlannerClient client = client(json(HttpStatus.OK, JourneyFixtures.fixture("trip-response.json")));

        TripRequestResponse response = client.queryTrip(query().numJourneys(2).build());

        assertEquals(2, response.getJourneys().size());
        ClientRequest request = requests.get(0);
        assertEquals(HttpMethod.GET, request.method());
        assertEquals("/v1/tp/trip", request.url().getPath());
        assertEquals("apikey secret-key", request.headers().getFirst(HttpHeaders.AUTHORIZATION));

        MultiValueMap<String, String> params = lastQueryParams();
        assertEquals("rapidJSON", params.getFirst("outputFormat"));
        assertEquals("dep", params.getFirst("depArrMacro"));
        assertEquals("20230501", params.getFirst("itdDate"));
        assertEquals("1030", params.getFirst("itdTime")); // 00:30Z is 10:30 in Sydney
        assertEquals("any", params.getFirst("type_origin"));
        assertEquals("any", params.getFirst("type_destination"));
        assertEquals("222310", params.getFirst("name_origin"));
        assertEquals("200060", params.getFirst("name_destination"));
        assertEquals("2", params.getFirst("calcNumberOfTrips"));
        assertEquals("10.2.1.42", params.getFirst("version"));
        assertEquals("true", params.getFirst("TfNSWTR"));
        assertFalse(params.containsKey("excludedMeans"));
    }

    @Test
    void testQueryTrip_ArriveBySearch() {
        JourneyPlannerClient client = client(json(HttpStatus.OK, JourneyFixtures.fixture("trip-response.json")));

        client.queryTrip(query().arriveBy(ZonedDateTime.parse("2023-05-01T08:15:00Z")).build());

        MultiValueMap<String, String> params = lastQueryParams();
        assertEquals("arr", params.getFirst("depArrMacro"));
        assertEquals("20230501", params.getFirst("itdDate"));
        assertEquals("1815", params.getFirst("itdTime"));
    }

    @Test
    void testQueryTrip_InclusionSentAsComplement() {
        JourneyPlannerClient client = client(json(HttpStatus.OK, JourneyFixtures.fixture("trip-response.json")));

        client.queryTrip(query().includeModes(List.of(ModeOfTransport.BUS)).build());

        MultiValueMap<String, String> params = lastQueryParams();
        assertEquals("checkbox", params.getFirst("excludedMeans"));
        assertEquals("1", params.getFirst("exclMOT_1"));
        assertEquals("1", params.getFirst("exclMOT_4"));
        assertEquals("1", params.getFirst("exclMOT_7"));
        assertEquals("1", params.getFirst("exclMOT_9"));
        assertEquals("1", params.getFirst("exclMOT_11"));
        assertFalse(params.containsKey("exclMOT_5"));
    }

    @Test
    void testQueryTrip_ExclusionSentAsIs() {
        JourneyPlannerClient client = client(json(HttpStatus.OK, JourneyFixtures.fixture("trip-response.json")));

        client.queryTrip(query().excludeModes(List.of(ModeOfTransport.FERRY, ModeOfTransport.COACH)).build());

        MultiValueMap<String, String> params = lastQueryParams();
        assertEquals("checkbox", params.getFirst("excludedMeans"));
        assertEquals("1", params.getFirst("exclMOT_9"));
        assertEquals("1", params.getFirst("exclMOT_7"));
        assertFalse(params.containsKey("exclMOT_1"));
        assertFalse(params.containsKey("exclMOT_5"));
    }

    @Test
    void testQueryTrip_DepartAndArriveBothSet_FailsBeforeRequest() {
        JourneyPlannerClient client = client(json(HttpStatus.OK, JourneyFixtures.fixture("trip-response.json")));
        ZonedDateTime time = ZonedDateTime.parse("2023-05-01T08:15:00Z");

        assertThrows(ConfigurationException.class,
                () -> client.queryTrip(query().departAt(time).arriveBy(time).build()));
        assertTrue(requests.isEmpty());
    }

    @Test
    void testQueryTrip_IncludeAndExcludeBothSet_FailsBeforeRequest() {
        JourneyPlannerClient client = client(json(HttpStatus.OK, JourneyFixtures.fixture("trip-response.json")));

        assertThrows(ConfigurationException.class, () -> client.queryTrip(query()
                .includeModes(List.of(ModeOfTransport.BUS))
                .excludeModes(List.of(ModeOfTransport.TRAIN))
                .build()));
        assertTrue(requests.isEmpty());
    }

    @Test
    void testQueryTrip_ErrorStatus_UpstreamExceptionWithCode() {
        JourneyPlannerClient client = client(json(HttpStatus.SERVICE_UNAVAILABLE, "{}"));

        UpstreamException e = assertThrows(UpstreamException.class, () -> client.queryTrip(query().build()));
        assertEquals(503, e.getStatusCode().getAsInt());
    }

    @Test
    void testQueryTrip_Timeout_UpstreamExceptionWithoutCode() {
        JourneyPlannerClient client = client(request -> Mono.never());

        UpstreamException e = assertThrows(UpstreamException.class, () -> client.queryTrip(query().build()));
        assertTrue(e.getStatusCode().isEmpty());
    }

    @Test
    void testQueryTrip_ConnectionFailure_UpstreamException() {
        JourneyPlannerClient client = client(request -> Mono.error(new WebClientRequestException(
                new IOException("Connection refused"), request.method(), request.url(), request.headers())));

        UpstreamException e = assertThrows(UpstreamException.class, () -> client.queryTrip(query().build()));
        assertTrue(e.getStatusCode().isEmpty());
    }

    @Test
    void testQueryTrip_MalformedBody() {
        JourneyPlannerClient invalidJson = client(json(HttpStatus.OK, "{\"version\": "));
        assertThrows(MalformedResponseException.class, () -> invalidJson.queryTrip(query().build()));

        JourneyPlannerClient missingVersion = client(json(HttpStatus.OK, "{\"journeys\": []}"));
        assertThrows(MalformedResponseException.class, () -> missingVersion.queryTrip(query().build()));
    }

    @Test
    void testFetchRealtimeFeed_DecodesVehiclePositions() {
        byte[] body = feedMessage(vehicle("1", "T1", -33.8f, 151.2f), vehicle("2", "T2", -33.9f, 151.1f))
                .toByteArray();
        JourneyPlannerClient client = client(binary(body));

        RealtimeFeed feed = client.fetchRealtimeFeed("buses");

        assertEquals("/v1/gtfs/vehiclepos/buses", requests.get(0).url().getPath());
        assertEquals("apikey secret-key", requests.get(0).headers().getFirst(HttpHeaders.AUTHORIZATION));
        assertEquals("buses", feed.getModeKey());
        assertEquals(Instant.parse("2023-05-01T00:30:00Z"), feed.getFetchedAt());
        assertEquals(1682901720L, feed.getFeedTimestamp());
        assertEquals(2, feed.getVehicles().size());

        VehiclePosition first = feed.getVehicles().get(0);
        assertEquals("T1", first.getTripId());
        assertEquals("2441_311", first.getRouteId());
        assertEquals("bus-1", first.getVehicleId());
        assertEquals(-33.8, first.getLatitude(), 1e-4);
        assertEquals(151.2, first.getLongitude(), 1e-4);
    }

    @Test
    void testFetchRealtimeFeed_MalformedPayload() {
        JourneyPlannerClient client = client(binary(new byte[] { (byte) 0xFF, 0x01, 0x02 }));

        assertThrows(MalformedResponseException.class, () -> client.fetchRealtimeFeed("ferries"));
    }

    @Test
    void testFetchRealtimeFeed_ErrorStatus() {
        JourneyPlannerClient client = client(json(HttpStatus.NOT_FOUND, "{}"));

        UpstreamException e = assertThrows(UpstreamException.class, () -> client.fetchRealtimeFeed("trams"));
        assertEquals(404, e.getStatusCode().getAsInt());
    }
}
