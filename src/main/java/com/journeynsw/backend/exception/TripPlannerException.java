package com.journeynsw.backend.exception;

/**
 * Base of every failure raised while querying the trip planner or its realtime feeds.
 */
public abstract class TripPlannerException extends RuntimeException {

    protected TripPlannerException(String message) {
        super(message);
    }

    protected TripPlannerException(String message, Throwable cause) {
        super(message, cause);
    }
}
