package com.journeynsw.backend.exception;

public class MalformedResponseException extends TripPlannerException {

    public MalformedResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}
