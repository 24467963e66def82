package com.journeynsw.backend.service;

import com.journeynsw.backend.model.FarePerson;
import com.journeynsw.backend.model.FareSummary;
import com.journeynsw.backend.model.Journey;
import com.journeynsw.backend.model.JourneyFareTicket;
import com.journeynsw.backend.model.JourneyLeg;
import com.journeynsw.backend.model.JourneyLegStop;
import com.journeynsw.backend.model.JourneyRealtime;
import com.journeynsw.backend.model.JourneySummary;
import com.journeynsw.backend.model.LegDirection;
import com.journeynsw.backend.model.RouteProductClass;
import com.journeynsw.backend.model.TripTransportation;
import com.journeynsw.backend.model.VehiclePosition;
import com.journeynsw.backend.util.JourneyUtils;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
public class JourneyTransformationService {

    private final Clock clock;

    /**
     * Flatten a journey into the attributes shown for a trip.
     *
     * @param journeyRealtime Journey and its realtime match
     * @param fareType        Rider category whose fare is reported
     * @return Summary; leg-derived fields stay null for an all-walking journey
     */
    public JourneySummary toSummary(JourneyRealtime journeyRealtime, FarePerson fareType) {
        Journey journey = journeyRealtime.getJourney();
        JourneySummary.JourneySummaryBuilder summary = JourneySummary.builder()
                .changes(JourneyUtils.countTransfers(journey.getLegs()))
                .icon(RouteProductClass.DEFAULT_ICON)
                .fareType(fareType);

        Optional<JourneyLeg> originLeg = JourneyUtils.firstNonWalkingLeg(journey.getLegs(), LegDirection.FORWARD);
        Optional<JourneyLeg> destinationLeg = JourneyUtils.firstNonWalkingLeg(journey.getLegs(), LegDirection.REVERSE);

        originLeg.ifPresent(leg -> {
            JourneyLegStop origin = leg.getOrigin();
            TripTransportation transportation = leg.getTransportation();
            summary.originStopId(origin.getId())
                    .originName(origin.getName())
                    .departureTimeEstimated(origin.getDepartureTimeEstimated())
                    .departureTimePlanned(origin.getDepartureTimePlanned())
                    .dueMinutes(dueMinutes(origin))
                    .originTransportType(transportation.getProduct().getKlass().getCode())
                    .originTransportName(transportation.getProduct().getKlass().name())
                    .originLineName(transportation.getNumber())
                    .originLineNameShort(transportation.getDisassembledName())
                    .icon(transportation.getProduct().getKlass().getIcon())
                    .occupancy(leg.getDestination().getProperties().getOccupancy())
                    .realTimeTripId(transportation.getRealtimeTripId().orElse(null));
        });
        destinationLeg.ifPresent(leg -> {
            JourneyLegStop destination = leg.getDestination();
            summary.destinationStopId(destination.getId())
                    .destinationName(destination.getName())
                    .arrivalTimeEstimated(destination.getArrivalTimeEstimated())
                    .arrivalTimePlanned(destination.getArrivalTimePlanned());
        });

        JourneyUtils.selectTicket(journey.getFare().getTickets(), fareType)
                .ifPresent(ticket -> summary.farePrice(ticket.getPriceBrutto().toPlainString()));

        Optional<VehiclePosition> realtime = journeyRealtime.getRealtime();
        realtime.ifPresent(position -> summary.latitude(position.getLatitude()).longitude(position.getLongitude()));

        return summary.build();
    }

    /**
     * One entry per rider category, in {@link FarePerson} order.
     */
    public List<FareSummary> toFares(Journey journey) {
        List<FareSummary> fares = new ArrayList<>();
        for (FarePerson person : FarePerson.values()) {
            Optional<JourneyFareTicket> ticket = JourneyUtils.selectTicket(journey.getFare().getTickets(), person);
            fares.add(FareSummary.builder()
                    .fareType(person)
                    .available(ticket.isPresent())
                    .ticketName(ticket.map(JourneyFareTicket::getName).orElse(null))
                    .priceLevel(ticket.map(JourneyFareTicket::getPriceLevel).orElse(null))
                    .price(ticket.map(t -> t.getPriceBrutto().toPlainString()).orElse(null))
                    .build());
        }
        return fares;
    }

    /**
     * Whole minutes until departure, never negative. Uses the estimated time when the planner has one.
     */
    Long dueMinutes(JourneyLegStop origin) {
        ZonedDateTime departure = origin.getDepartureTimeEstimated() != null
                ? origin.getDepartureTimeEstimated()
                : origin.getDepartureTimePlanned();
        if (departure == null) {
            return null;
        }
        Duration due = Duration.between(clock.instant(), departure.toInstant());
        return due.isNegative() ? 0L : due.toMinutes();
    }
}
