package com.journeynsw.backend.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class LoggingMonitoringService implements MonitoringService {

    @Override
    public void recordRefreshDuration(String tripName, long durationMs, String status) {
        log.info("📊 METRIC refresh_duration_ms trip={} status={} value={}", tripName, status, durationMs);
    }

    @Override
    public void recordJourneyCount(String tripName, int journeys, int withRealtime) {
        log.info("📊 METRIC journeys trip={} total={} realtime={}", tripName, journeys, withRealtime);
    }
}
