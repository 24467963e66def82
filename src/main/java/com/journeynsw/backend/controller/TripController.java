package com.journeynsw.backend.controller;

import com.journeynsw.backend.model.FareSummary;
import com.journeynsw.backend.model.TripBoardEntry;
import com.journeynsw.backend.service.TripBoardService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/trips")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Trips", description = "Upcoming journeys of configured trips with live vehicle positions")
public class TripController {

    private final TripBoardService tripBoardService;

    @Operation(summary = "Get All Trips", description = "Retrieves the latest journeys of every configured trip.")
    @GetMapping
    public List<TripBoardEntry> getTrips() {
        return tripBoardService.getEntries();
    }

    @Operation(summary = "Get Trip", description = "Retrieves the latest journeys of one configured trip.")
    @ApiResponse(responseCode = "404", description = "No trip configured with that name")
    @GetMapping("/{name}")
    public TripBoardEntry getTrip(
            @Parameter(description = "Configured trip name", required = true) @PathVariable String name) {
        return tripBoardService.getEntry(name);
    }

    @Operation(summary = "Get Journey Fares", description = "Retrieves the fare of a journey for every rider category.")
    @GetMapping("/{name}/journeys/{index}/fares")
    public List<FareSummary> getFares(
            @Parameter(description = "Configured trip name", required = true) @PathVariable String name,
            @Parameter(description = "Zero-based journey index", required = true) @PathVariable int index) {
        return tripBoardService.getFares(name, index);
    }

    @Operation(summary = "Refresh Trip", description = "Queries the trip planner and realtime feeds for one trip now.")
    @ApiResponse(responseCode = "200", description = "Refresh attempted; check 'available' for the outcome")
    @PostMapping("/{name}/refresh")
    public ResponseEntity<TripBoardEntry> refreshTrip(
            @Parameter(description = "Configured trip name", required = true) @PathVariable String name) {
        log.info("🔄 Manual refresh triggered for trip {}", name);
        return ResponseEntity.ok(tripBoardService.refresh(name));
    }

    @Operation(summary = "Refresh All Trips", description = "Queries the trip planner and realtime feeds for every configured trip now.")
    @PostMapping("/refresh")
    public ResponseEntity<List<TripBoardEntry>> refreshAll() {
        log.info("🔄 Manual refresh triggered for all configured trips");
        return ResponseEntity.ok(tripBoardService.refreshAll());
    }
}
