package com.journeynsw.backend.model;

/**
 * Scan order over a journey's legs: forward for origin details, reverse for destination details.
 */
public enum LegDirection {
    FORWARD,
    REVERSE
}
