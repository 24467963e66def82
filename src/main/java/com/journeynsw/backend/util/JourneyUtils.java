package com.journeynsw.backend.util;

import com.journeynsw.backend.model.FarePerson;
import com.journeynsw.backend.model.GtfsMode;
import com.journeynsw.backend.model.JourneyFareTicket;
import com.journeynsw.backend.model.JourneyLeg;
import com.journeynsw.backend.model.LegDirection;
import com.journeynsw.backend.model.RealtimeFeed;
import com.journeynsw.backend.model.RouteProductClass;
import com.journeynsw.backend.model.VehiclePosition;

import java.util.List;
import java.util.Optional;

public final class JourneyUtils {

    private JourneyUtils() {
    }

    /**
     * Finds the first leg that is not a walking leg, scanning in the given direction.
     *
     * @param legs      Legs in travel order
     * @param direction FORWARD for the earliest such leg, REVERSE for the latest
     * @return The leg, or empty for an all-walking itinerary
     */
    public static Optional<JourneyLeg> firstNonWalkingLeg(List<JourneyLeg> legs, LegDirection direction) {
        if (direction == LegDirection.FORWARD) {
            for (JourneyLeg leg : legs) {
                if (!leg.isWalking()) {
                    return Optional.of(leg);
                }
            }
        } else {
            for (int i = legs.size() - 1; i >= 0; i--) {
                if (!legs.get(i).isWalking()) {
                    return Optional.of(legs.get(i));
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Counts changes between vehicles. Returns -1 when no leg uses a vehicle at all,
     * which callers must treat as "not a transit trip".
     */
    public static int countTransfers(List<JourneyLeg> legs) {
        int changes = -1;
        for (JourneyLeg leg : legs) {
            if (!leg.isWalking()) {
                changes++;
            }
        }
        return changes;
    }

    /**
     * Empty means the fare is unavailable, not free.
     */
    public static Optional<JourneyFareTicket> selectTicket(List<JourneyFareTicket> tickets, FarePerson person) {
        return tickets.stream()
                .filter(ticket -> ticket.getPerson() == person)
                .findFirst();
    }

    public static Optional<String> gtfsModeKey(RouteProductClass klass) {
        return GtfsMode.forProductClass(klass).map(GtfsMode::getKey);
    }

    public static Optional<VehiclePosition> findRealtimeInfo(RealtimeFeed feed, String realtimeTripId) {
        return feed.findByTripId(realtimeTripId);
    }
}
