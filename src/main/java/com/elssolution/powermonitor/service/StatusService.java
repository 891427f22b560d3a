package com.elssolution.powermonitor.service;

import com.elssolution.powermonitor.alerts.AlertService;
import com.elssolution.powermonitor.polling.EnergyPollSupervisor;
import com.elssolution.powermonitor.polling.ReadingPollSupervisor;
import com.elssolution.powermonitor.store.StoreStats;
import com.elssolution.powermonitor.store.TimeSeriesStore;
import jakarta.annotation.PostConstruct;
import lombok.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Operational snapshot: store footprint, running loops, ingest counters and
 * per-device freshness. Also logs a one-line summary periodically.
 */
@Slf4j
@Component
public class StatusService {

    private final ScheduledExecutorService scheduler;
    private final TimeSeriesStore store;
    private final TelemetryIngest ingest;
    private final ReadingPollSupervisor readingPoller;
    private final EnergyPollSupervisor energyPoller;
    private final AlertService alerts;
    private final Clock clock;

    @Value("${status.summaryEverySec:60}") private int summaryEverySec;

    public StatusService(ScheduledExecutorService scheduler,
                         TimeSeriesStore store,
                         TelemetryIngest ingest,
                         ReadingPollSupervisor readingPoller,
                         EnergyPollSupervisor energyPoller,
                         AlertService alerts,
                         Clock clock) {
        this.scheduler = scheduler;
        this.store = store;
        this.ingest = ingest;
        this.readingPoller = readingPoller;
        this.energyPoller = energyPoller;
        this.alerts = alerts;
        this.clock = clock;
    }

    @PostConstruct
    void startSummaryLogger() {
        if (summaryEverySec <= 0) return;
        scheduler.scheduleAtFixedRate(this::logSummarySafe, summaryEverySec, summaryEverySec, TimeUnit.SECONDS);
        log.info("Status summary logger started: every {}s", summaryEverySec);
    }

    public StatusView buildStatusView() {
        Instant now = clock.instant();
        StoreStats s = store.stats();

        Map<String, Long> ages = new TreeMap<>();
        ingest.lastReadingTimes().forEach((id, at) -> ages.put(id, Math.max(0, now.toEpochMilli() - at.toEpochMilli())));

        return StatusView.builder()
                .storeSizeBytes(s.getSizeBytes())
                .logSizeBytes(s.getLogSizeBytes())
                .readingCount(s.getReadingCount())
                .energyCount(s.getEnergyCount())
                .oldest(s.getOldest())
                .newest(s.getNewest())
                .diskFreeBytes(s.getDiskFreeBytes())
                .diskUsedPct(round1(s.getDiskUsedPct()))
                .devices(store.listDevices().size())
                .readingLoops(readingPoller.activeLoops().size())
                .energyLoops(energyPoller.activeLoops().size())
                .ingested(ingest.writtenCount())
                .ingestFailures(ingest.failedCount())
                .lastReadingAgeMs(ages)
                .activeAlerts(alerts.snapshot().getActive().size())
                .build();
    }

    private void logSummarySafe() {
        try {
            StatusView v = buildStatusView();
            log.info("Status: devices={} loops={}/{} ingested={} failures={} store={}B wal={}B disk used={}% alerts={}",
                    v.devices, v.readingLoops, v.energyLoops, v.ingested, v.ingestFailures,
                    v.storeSizeBytes, v.logSizeBytes, v.diskUsedPct, v.activeAlerts);
        } catch (Exception e) {
            log.warn("status_summary_failed: {}", e.getMessage());
        }
    }

    private static double round1(double v) { return Math.round(v * 10.0) / 10.0; }

    @Builder @Getter @ToString @EqualsAndHashCode @AllArgsConstructor
    public static class StatusView {
        // store
        long    storeSizeBytes;
        long    logSizeBytes;
        long    readingCount;
        long    energyCount;
        Instant oldest;
        Instant newest;
        long    diskFreeBytes;
        double  diskUsedPct;

        // polling
        int  devices;
        int  readingLoops;
        int  energyLoops;
        long ingested;
        long ingestFailures;
        Map<String, Long> lastReadingAgeMs;

        int activeAlerts;
    }
}
