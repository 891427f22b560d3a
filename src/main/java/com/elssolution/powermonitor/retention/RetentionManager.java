package com.elssolution.powermonitor.retention;

import com.elssolution.powermonitor.alerts.AlertService;
import com.elssolution.powermonitor.store.DiskSpaceProbe;
import com.elssolution.powermonitor.store.StoreStats;
import com.elssolution.powermonitor.store.TimeSeriesStore;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Keeps the store inside its disk budget.
 *
 * Each cycle: checkpoint the WAL (vacuum if it stays oversized), log stats,
 * expire rows past the age limit, and when free space is short, first thin
 * old data down to hourly resolution and only then evict the oldest data in
 * fixed windows. Every step fails on its own; the next one still runs.
 */
@Slf4j
@Service
public class RetentionManager {

    private static final long GIB = 1024L * 1024 * 1024;

    private final TimeSeriesStore store;
    private final DiskSpaceProbe disk;
    private final AlertService alerts;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;

    @Value("${retention.enabled:true}")                private boolean enabled;
    @Value("${retention.periodMs:3600000}")            private long periodMs;
    @Value("${retention.initialDelayMs:3600000}")      private long initialDelayMs;
    @Value("${retention.maxLogBytes:104857600}")       private long maxLogBytes;     // 100 MiB
    @Value("${retention.maxAgeDays:0}")                private int maxAgeDays;       // 0 = keep forever
    @Value("${retention.minFreeBytes:1073741824}")     private long minFreeBytes;    // 1 GiB
    @Value("${retention.compactAfterDays:90}")         private int compactAfterDays;
    @Value("${retention.deleteBatchDays:30}")          private int deleteBatchDays;
    @Value("${retention.safetyMarginBytes:536870912}") private long safetyMarginBytes; // 0.5 GiB

    private volatile ScheduledFuture<?> task;

    public RetentionManager(TimeSeriesStore store, DiskSpaceProbe disk, AlertService alerts,
                            ScheduledExecutorService scheduler, Clock clock) {
        this.store = store;
        this.disk = disk;
        this.alerts = alerts;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    @PostConstruct
    void start() {
        if (!enabled) {
            log.info("Retention cycle disabled");
            return;
        }
        task = scheduler.scheduleWithFixedDelay(this::runCycleSafe, initialDelayMs, periodMs, TimeUnit.MILLISECONDS);
        log.info("Retention cycle scheduled: every {} min, minFree={} GiB, compactAfter={}d",
                periodMs / 60_000, String.format("%.2f", minFreeBytes / (double) GIB), compactAfterDays);
    }

    @PreDestroy
    void stop() {
        ScheduledFuture<?> t = task;
        if (t != null) t.cancel(false);
    }

    private void runCycleSafe() {
        try {
            runCycle();
        } catch (Exception e) {
            // runCycle guards its own steps; this only keeps the periodic task alive
            log.error("retention_cycle_crashed err={}", e.toString(), e);
        }
    }

    /** One full maintenance pass. Also callable on demand. */
    public synchronized MaintenanceReport runCycle() {
        long started = System.nanoTime();
        MaintenanceReport.MaintenanceReportBuilder report = MaintenanceReport.builder();
        boolean failed = false;

        // 1. checkpoint, vacuum when the log will not shrink
        try {
            store.checkpoint();
            long wal = store.logSizeBytes();
            if (wal > maxLogBytes) {
                log.warn("wal_oversized size={}B limit={}B, vacuuming", wal, maxLogBytes);
                store.vacuum();
                store.checkpoint();
                report.vacuumed(true);
            }
        } catch (RuntimeException e) {
            failed = stepFailed(report, "checkpoint", e);
        }

        // 2. stats
        try {
            StoreStats s = store.stats();
            log.info("store_stats size={}B wal={}B readings={} energy={} oldest={} newest={} diskFree={}B used={}%",
                    s.getSizeBytes(), s.getLogSizeBytes(), s.getReadingCount(), s.getEnergyCount(),
                    s.getOldest(), s.getNewest(), s.getDiskFreeBytes(), String.format("%.1f", s.getDiskUsedPct()));
        } catch (RuntimeException e) {
            failed = stepFailed(report, "stats", e);
        }

        // 3. age limit
        if (maxAgeDays > 0) {
            try {
                report.expiredRows(store.deleteOlderThan(clock.instant().minus(Duration.ofDays(maxAgeDays))));
            } catch (RuntimeException e) {
                failed = stepFailed(report, "expire", e);
            }
        }

        long free = safeFree();
        report.freeBytesBefore(free);

        // 4. disk pressure: reduce resolution first
        if (free < minFreeBytes) {
            alerts.raise(AlertService.LOW_DISK,
                    "Free space " + free + "B below minimum " + minFreeBytes + "B", AlertService.Severity.WARN);
            try {
                Instant cutoff = clock.instant().minus(Duration.ofDays(compactAfterDays));
                TimeSeriesStore.CompactionResult readings = store.compactReadingsOlderThan(cutoff);
                TimeSeriesStore.CompactionResult energy = store.compactEnergyOlderThan(cutoff);
                report.compactedInserted(readings.inserted())
                        .compactedDeleted(readings.deleted() + energy.deleted());
                if (readings.deleted() + energy.deleted() > 0) {
                    store.checkpoint();
                    store.vacuum();
                }
            } catch (RuntimeException e) {
                failed = stepFailed(report, "compact", e);
            }
            free = safeFree();
        }

        // 5. still short: evict oldest-first
        if (free < minFreeBytes) {
            try {
                evictOldest(report);
            } catch (RuntimeException e) {
                failed = stepFailed(report, "evict", e);
            }
            free = safeFree();
        }

        report.freeBytesAfter(free);
        if (free >= minFreeBytes) alerts.resolve(AlertService.LOW_DISK);
        if (!failed) alerts.resolve(AlertService.MAINTENANCE_FAILED);

        MaintenanceReport r = report.elapsed(Duration.ofNanos(System.nanoTime() - started)).build();
        log.info("retention_cycle done free={}B->{}B compacted={}/{} evicted={} batches={} failed={} took={}ms",
                r.getFreeBytesBefore(), r.getFreeBytesAfter(), r.getCompactedInserted(), r.getCompactedDeleted(),
                r.getEvictedRows(), r.getEvictionBatches(), r.getFailedSteps(), r.getElapsed().toMillis());
        return r;
    }

    private void evictOldest(MaintenanceReport.MaintenanceReportBuilder report) {
        long target = minFreeBytes + safetyMarginBytes;
        long evicted = 0;
        int batches = 0;
        long free = disk.freeBytes();
        Optional<Instant> oldest = store.oldestTimestamp();
        while (free < target && oldest.isPresent()) {
            Instant cutoff = oldest.get().plus(Duration.ofDays(Math.max(1, deleteBatchDays)));
            evicted += store.deleteOlderThan(cutoff);
            batches++;
            // freed pages only reach the volume after a checkpoint and vacuum
            store.checkpoint();
            store.vacuum();
            free = disk.freeBytes();
            oldest = store.oldestTimestamp();
            log.warn("evict_batch n={} cutoff={} free={}B target={}B", batches, cutoff, free, target);
        }
        report.evictedRows(evicted).evictionBatches(batches);
    }

    private long safeFree() {
        try {
            return disk.freeBytes();
        } catch (RuntimeException e) {
            log.error("disk_probe_failed err={}", e.getMessage());
            return Long.MAX_VALUE; // unknown free space never triggers deletion
        }
    }

    private boolean stepFailed(MaintenanceReport.MaintenanceReportBuilder report, String step, RuntimeException e) {
        log.error("retention_step_failed step={} err={}", step, e.getMessage(), e);
        alerts.raise(AlertService.MAINTENANCE_FAILED, step + ": " + e.getMessage(), AlertService.Severity.ERROR);
        report.failedStep(step);
        return true;
    }
}
