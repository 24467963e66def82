package com.journeynsw.backend.service;

import com.journeynsw.backend.config.TransportNswProperties;
import com.journeynsw.backend.exception.TripNotFoundException;
import com.journeynsw.backend.exception.UpstreamException;
import com.journeynsw.backend.model.FarePerson;
import com.journeynsw.backend.model.FareSummary;
import com.journeynsw.backend.model.JourneyRealtime;
import com.journeynsw.backend.model.RouteProductClass;
import com.journeynsw.backend.model.TripBoardEntry;
import com.journeynsw.backend.model.TripDefinition;
import com.journeynsw.backend.model.VehiclePosition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static com.journeynsw.backend.JourneyFixtures.footpath;
import static com.journeynsw.backend.JourneyFixtures.journey;
import static com.journeynsw.backend.JourneyFixtures.leg;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TripBoardServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2023-05-01T00:30:00Z"), ZoneOffset.UTC);

    @Mock
    private TripRetrievalService tripRetrievalService;
    @Mock
    private MonitoringService monitoringService;

    private TripDefinition work;
    private TripDefinition home;
    private TripBoardService tripBoardService;

    @BeforeEach
    void setUp() {
        work = TripDefinition.builder().name("Work").originStopId("222310").destinationStopId("200060").build();
        home = TripDefinition.builder().name("Home").originStopId("200060").destinationStopId("222310")
                .fareType(FarePerson.CHILD).build();

        TransportNswProperties properties = new TransportNswProperties();
        properties.setApiKey("secret-key");
        properties.setTrips(List.of(work, home));

        tripBoardService = new TripBoardService(properties, tripRetrievalService,
                new JourneyTransformationService(CLOCK), monitoringService, CLOCK);
    }

    private static List<JourneyRealtime> busResults() {
        VehiclePosition position = VehiclePosition.builder().tripId("T1").latitude(-33.8).longitude(151.2).build();
        return List.of(
                JourneyRealtime.of(journey(footpath("a", "b"), leg("b", "c", RouteProductClass.BUS, "T1")),
                        Optional.of(position)),
                JourneyRealtime.of(journey(footpath("a", "c")), Optional.empty()));
    }

    @Test
    void testRefresh_Success_StoresSummaries() {
        // Given
        when(tripRetrievalService.retrieve(work)).thenReturn(busResults());

        // When
        TripBoardEntry entry = tripBoardService.refresh("Work");

        // Then
        assertTrue(entry.isAvailable());
        assertNull(entry.getLastError());
        assertEquals(2, entry.getJourneys().size());
        assertEquals("T1", entry.getJourneys().get(0).getRealTimeTripId());
        assertEquals(-33.8, entry.getJourneys().get(0).getLatitude());
        assertEquals("4.50", entry.getJourneys().get(0).getFarePrice());
        assertSame(entry, tripBoardService.getEntry("Work"));

        verify(monitoringService).recordRefreshDuration(eq("Work"), anyLong(), eq("SUCCESS"));
        verify(monitoringService).recordJourneyCount("Work", 2, 1);
    }

    @Test
    void testRefresh_Failure_KeepsPreviousJourneys() {
        // Given
        when(tripRetrievalService.retrieve(work))
                .thenReturn(busResults())
                .thenThrow(new UpstreamException(503, "Service Unavailable"));
        tripBoardService.refresh("Work");

        // When
        TripBoardEntry entry = tripBoardService.refresh("Work");

        // Then
        assertFalse(entry.isAvailable());
        assertEquals("Service Unavailable", entry.getLastError());
        assertEquals(2, entry.getJourneys().size());
        assertNotNull(entry.getLastUpdatedTime());
        verify(monitoringService).recordRefreshDuration(eq("Work"), anyLong(), eq("FAILED"));
    }

    @Test
    void testRefresh_FirstAttemptFails_UnavailableWithoutJourneys() {
        // Given
        when(tripRetrievalService.retrieve(home)).thenThrow(new UpstreamException("Read timed out", null));

        // When
        TripBoardEntry entry = tripBoardService.refresh("Home");

        // Then
        assertFalse(entry.isAvailable());
        assertTrue(entry.getJourneys().isEmpty());
        assertNull(entry.getLastUpdatedTime());
        assertNotNull(entry.getLastAttemptTime());
    }

    @Test
    void testRefreshAll_EntriesInConfigurationOrder() {
        // Given
        when(tripRetrievalService.retrieve(any(TripDefinition.class))).thenReturn(busResults());

        // When
        List<TripBoardEntry> entries = tripBoardService.refreshAll();

        // Then
        assertEquals(List.of("Work", "Home"), entries.stream()
                .map(TripBoardEntry::getTripName)
                .collect(Collectors.toList()));
        // fixture journeys only carry an adult ticket
        assertNull(entries.get(1).getJourneys().get(0).getFarePrice());
        verify(monitoringService).recordRefreshDuration(eq("total"), anyLong(), eq("SUCCESS"));
    }

    @Test
    void testGetEntries_BeforeRefresh_Unavailable() {
        List<TripBoardEntry> entries = tripBoardService.getEntries();

        assertEquals(2, entries.size());
        entries.forEach(entry -> assertFalse(entry.isAvailable()));
        verifyNoInteractions(tripRetrievalService);
    }

    @Test
    void testGetEntry_UnknownTrip_Throws() {
        assertThrows(TripNotFoundException.class, () -> tripBoardService.getEntry("Gym"));
        assertThrows(TripNotFoundException.class, () -> tripBoardService.refresh("Gym"));
    }

    @Test
    void testGetFares_ByJourneyIndex() {
        // Given
        when(tripRetrievalService.retrieve(work)).thenReturn(busResults());
        tripBoardService.refresh("Work");

        // When
        List<FareSummary> fares = tripBoardService.getFares("Work", 0);

        // Then
        assertEquals("4.50", fares.get(0).getPrice());
        assertThrows(TripNotFoundException.class, () -> tripBoardService.getFares("Work", 2));
        assertThrows(TripNotFoundException.class, () -> tripBoardService.getFares("Work", -1));
    }
}
