package com.journeynsw.backend.config;

import com.journeynsw.backend.exception.ConfigurationException;
import com.journeynsw.backend.model.TripDefinition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.ZoneId;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TransportNswPropertiesTest {

    private TransportNswProperties properties;

    @BeforeEach
    void setUp() {
        properties = new TransportNswProperties();
        properties.setApiKey("secret-key");
    }

    private static TripDefinition.TripDefinitionBuilder trip(String name) {
        return TripDefinition.builder().name(name).originStopId("222310").destinationStopId("200060");
    }

    @Test
    void testDefaults() {
        assertEquals("https://api.transport.nsw.gov.au", properties.getApi().getBaseUrl());
        assertEquals(Duration.ofSeconds(10), properties.getApi().getTimeout());
        assertEquals(ZoneId.of("Australia/Sydney"), properties.getApi().getTimeZone());
        assertTrue(properties.getTrips().isEmpty());
    }

    @Test
    void testValidate_ValidTrips_Passes() {
        properties.setTrips(List.of(trip("Work").build(), trip("Home").numJourneys(3).build()));

        assertDoesNotThrow(properties::validate);
    }

    @Test
    void testValidate_MissingApiKey_Fails() {
        properties.setApiKey(" ");

        ConfigurationException e = assertThrows(ConfigurationException.class, properties::validate);
        assertTrue(e.getMessage().contains("api-key"));
    }

    @Test
    void testValidate_DuplicateName_Fails() {
        properties.setTrips(List.of(trip("Work").build(), trip("Work").build()));

        assertThrows(ConfigurationException.class, properties::validate);
    }

    @Test
    void testValidate_InvalidTrip_Fails() {
        properties.setTrips(List.of(trip("").build()));
        assertThrows(ConfigurationException.class, properties::validate);

        properties.setTrips(List.of(trip("Work").destinationStopId(null).build()));
        assertThrows(ConfigurationException.class, properties::validate);

        properties.setTrips(List.of(trip("Work").numJourneys(0).build()));
        assertThrows(ConfigurationException.class, properties::validate);

        properties.setTrips(List.of(trip("Work").fareType(null).build()));
        assertThrows(ConfigurationException.class, properties::validate);
    }
}
