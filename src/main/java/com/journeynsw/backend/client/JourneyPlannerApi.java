package com.journeynsw.backend.client;

import com.journeynsw.backend.model.RealtimeFeed;
import com.journeynsw.backend.model.TripQuery;
import com.journeynsw.backend.model.TripRequestResponse;
import reactor.core.publisher.Mono;

public interface JourneyPlannerApi {

    TripRequestResponse queryTrip(TripQuery query);

    RealtimeFeed fetchRealtimeFeed(String modeKey);

    /**
     * Same request as {@link #fetchRealtimeFeed(String)}; the fetch starts on subscription.
     */
    Mono<RealtimeFeed> fetchRealtimeFeedAsync(String modeKey);
}
