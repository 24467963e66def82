package com.journeynsw.backend.model;

/**
 * Rider categories a fare ticket is priced for.
 */
public enum FarePerson {
    ADULT,
    CHILD,
    SCHOLAR,
    SENIOR
}
