package com.journeynsw.backend.exception;

/**
 * Invalid or mutually exclusive request parameters. A caller bug, never retried.
 */
public class ConfigurationException extends TripPlannerException {

    public ConfigurationException(String message) {
        super(message);
    }
}
