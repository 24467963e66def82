package com.journeynsw.backend.service;

import com.journeynsw.backend.client.JourneyPlannerApi;
import com.journeynsw.backend.model.Journey;
import com.journeynsw.backend.model.JourneyLeg;
import com.journeynsw.backend.model.JourneyRealtime;
import com.journeynsw.backend.model.LegDirection;
import com.journeynsw.backend.model.RealtimeFeed;
import com.journeynsw.backend.model.TripDefinition;
import com.journeynsw.backend.model.TripQuery;
import com.journeynsw.backend.model.TripRequestResponse;
import com.journeynsw.backend.model.TripTransportation;
import com.journeynsw.backend.model.VehiclePosition;
import com.journeynsw.backend.util.JourneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
public class TripRetrievalService {

    private final JourneyPlannerApi journeyPlannerApi;
    private final RealtimeFeedCache realtimeFeedCache;

    public List<JourneyRealtime> retrieve(TripDefinition trip) {
        return retrieve(trip.toQuery());
    }

    /**
     * Queries the planner and pairs every journey, in planner order, with the live position of
     * the vehicle on its first non-walking leg.
     *
     * @param query Trip query
     * @return One pairing per journey; the realtime side is empty when no match was possible
     */
    public List<JourneyRealtime> retrieve(TripQuery query) {
        TripRequestResponse response = journeyPlannerApi.queryTrip(query);

        List<JourneyRealtime> results = new ArrayList<>(response.getJourneys().size());
        for (Journey journey : response.getJourneys()) {
            results.add(JourneyRealtime.of(journey, findRealtime(journey)));
        }
        return results;
    }

    private Optional<VehiclePosition> findRealtime(Journey journey) {
        Optional<JourneyLeg> originLeg = JourneyUtils.firstNonWalkingLeg(journey.getLegs(), LegDirection.FORWARD);
        if (originLeg.isEmpty()) {
            return Optional.empty();
        }

        TripTransportation transportation = originLeg.get().getTransportation();
        Optional<String> realtimeTripId = transportation.getRealtimeTripId();
        Optional<String> modeKey = JourneyUtils.gtfsModeKey(transportation.getProduct().getKlass());
        if (realtimeTripId.isEmpty() || modeKey.isEmpty()) {
            return Optional.empty();
        }

        RealtimeFeed feed = realtimeFeedCache.getFeed(modeKey.get());
        Optional<VehiclePosition> match = JourneyUtils.findRealtimeInfo(feed, realtimeTripId.get());
        if (match.isEmpty()) {
            log.debug("No vehicle for trip {} in the {} feed", realtimeTripId.get(), modeKey.get());
        }
        return match;
    }
}
