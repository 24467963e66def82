package com.journeynsw.backend.exception;

import java.util.OptionalInt;

/**
 * Non-success HTTP status, timeout or connection failure talking to the planner API.
 * The caller may retry on its own schedule.
 */
public class UpstreamException extends TripPlannerException {

    private final Integer statusCode;

    public UpstreamException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public UpstreamException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = null;
    }

    /**
     * @return The HTTP status, empty for timeouts and connection failures
     */
    public OptionalInt getStatusCode() {
        return statusCode == null ? OptionalInt.empty() : OptionalInt.of(statusCode);
    }
}
