package com.elssolution.powermonitor.retention;

import com.elssolution.powermonitor.alerts.AlertService;
import com.elssolution.powermonitor.store.*;
import com.elssolution.powermonitor.store.TimeSeriesStore.CompactionResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InOrder;
import org.springframework.test.util.ReflectionTestUtils;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;

import static com.elssolution.powermonitor.store.TestStores.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class RetentionManagerTest {

    static final Instant NOW = Instant.parse("2025-06-01T00:00:00Z");
    static final Instant OLD = Instant.parse("2025-01-01T00:00:00Z"); // 151 days back
    static final long ROW_BYTES = 10_000;
    static final long DISK = 10_000_000;

    @TempDir Path dir;

    StoreDataSource db;
    TimeSeriesStore store;
    final AlertService alerts = new AlertService(Clock.systemUTC());

    @AfterEach
    void close() {
        if (db != null) db.close();
    }

    /** Free space shrinks by ROW_BYTES for every stored reading. */
    private DiskSpaceProbe diskFilledByRows() {
        return new FakeDisk(() -> DISK - ROW_BYTES * store.stats().getReadingCount(), DISK);
    }

    private RetentionManager manager(TimeSeriesStore s, DiskSpaceProbe disk, long minFree) {
        RetentionManager m = new RetentionManager(s, disk, alerts, mock(ScheduledExecutorService.class),
                Clock.fixed(NOW, ZoneOffset.UTC));
        ReflectionTestUtils.setField(m, "maxLogBytes", 100L << 20);
        ReflectionTestUtils.setField(m, "minFreeBytes", minFree);
        ReflectionTestUtils.setField(m, "compactAfterDays", 90);
        ReflectionTestUtils.setField(m, "deleteBatchDays", 30);
        ReflectionTestUtils.setField(m, "safetyMarginBytes", 500_000L);
        return m;
    }

    private void openStore() {
        db = dataSource(dir);
        store = new TimeSeriesStore(db, FakeDisk.roomy());
        store.saveDevice(device("m1"));
    }

    @Test
    void compaction_alone_reaching_the_target_deletes_nothing() {
        openStore();
        store.appendReadings(series("m1", OLD, Duration.ofMinutes(1), 180, 100)); // 3 old hours
        store.appendReadings(series("m1", NOW.minusSeconds(60), Duration.ofSeconds(1), 10, 100));
        // 190 rows -> 8.1 MB free, below the 9 MB minimum; 13 rows after compaction -> 9.87 MB
        RetentionManager m = manager(store, diskFilledByRows(), 9_000_000);

        MaintenanceReport r = m.runCycle();

        assertThat(r.getCompactedInserted()).isEqualTo(3);
        assertThat(r.getCompactedDeleted()).isEqualTo(180);
        assertThat(r.getEvictedRows()).isZero();
        assertThat(r.getEvictionBatches()).isZero();
        assertThat(r.ok()).isTrue();
        assertThat(store.countReadings("m1", OLD, OLD.plus(Duration.ofDays(1)))).isEqualTo(3);
        assertThat(store.countReadings("m1", NOW.minusSeconds(60), NOW)).isEqualTo(10);
        assertThat(alerts.isActive(AlertService.LOW_DISK)).isFalse();
    }

    @Test
    void still_short_after_compaction_evicts_oldest_first() {
        openStore();
        store.appendReadings(series("m1", OLD, Duration.ofMinutes(1), 180, 100));
        Instant mid = NOW.minus(Duration.ofDays(60));
        store.appendReadings(series("m1", mid, Duration.ofSeconds(1), 200, 100));
        store.appendReadings(series("m1", NOW.minusSeconds(60), Duration.ofSeconds(1), 10, 100));
        // 213 rows after compaction -> 7.87 MB; dropping the old hours (3 rows) is not enough,
        // dropping everything up to the 60-day-old block still leaves 10 rows -> 9.9 MB
        RetentionManager m = manager(store, diskFilledByRows(), 9_000_000);

        MaintenanceReport r = m.runCycle();

        assertThat(r.getCompactedInserted()).isEqualTo(3);
        assertThat(r.getEvictionBatches()).isPositive();
        assertThat(store.countReadings("m1", OLD, OLD.plus(Duration.ofDays(1)))).isZero();
        assertThat(store.countReadings("m1", NOW.minusSeconds(60), NOW)).isEqualTo(10);
        assertThat(r.getFreeBytesAfter()).isGreaterThanOrEqualTo(9_500_000);
        assertThat(alerts.isActive(AlertService.LOW_DISK)).isFalse();
    }

    @Test
    void eviction_stops_when_nothing_is_left() {
        openStore();
        store.appendReadings(series("m1", OLD, Duration.ofMinutes(1), 180, 100));
        RetentionManager m = manager(store, new FakeDisk(() -> 100, DISK), 9_000_000);

        MaintenanceReport r = m.runCycle();

        assertThat(store.oldestTimestamp()).isEmpty();
        assertThat(r.getEvictedRows()).isEqualTo(3);
        assertThat(r.ok()).isTrue();
        assertThat(alerts.isActive(AlertService.LOW_DISK)).isTrue();
    }

    @Test
    void compaction_always_runs_before_any_deletion() {
        TimeSeriesStore s = mock(TimeSeriesStore.class);
        when(s.stats()).thenReturn(StoreStats.builder().build());
        when(s.compactReadingsOlderThan(any())).thenReturn(new CompactionResult(1, 2));
        when(s.compactEnergyOlderThan(any())).thenReturn(CompactionResult.NONE);
        when(s.oldestTimestamp()).thenReturn(Optional.of(OLD), Optional.empty());
        RetentionManager m = manager(s, new FakeDisk(() -> 100, DISK), 9_000_000);

        m.runCycle();

        InOrder order = inOrder(s);
        order.verify(s).compactReadingsOlderThan(NOW.minus(Duration.ofDays(90)));
        order.verify(s).compactEnergyOlderThan(NOW.minus(Duration.ofDays(90)));
        order.verify(s).deleteOlderThan(OLD.plus(Duration.ofDays(30)));
        order.verify(s).checkpoint();
        order.verify(s).vacuum();
    }

    @Test
    void healthy_disk_touches_no_data() {
        TimeSeriesStore s = mock(TimeSeriesStore.class);
        when(s.stats()).thenReturn(StoreStats.builder().build());
        RetentionManager m = manager(s, new FakeDisk(() -> DISK, DISK), 9_000_000);

        MaintenanceReport r = m.runCycle();

        verify(s).checkpoint();
        verify(s, never()).compactReadingsOlderThan(any());
        verify(s, never()).deleteOlderThan(any());
        verify(s, never()).vacuum();
        assertThat(r.ok()).isTrue();
    }

    @Test
    void oversized_log_is_vacuumed() {
        TimeSeriesStore s = mock(TimeSeriesStore.class);
        when(s.stats()).thenReturn(StoreStats.builder().build());
        when(s.logSizeBytes()).thenReturn(200L << 20);
        RetentionManager m = manager(s, new FakeDisk(() -> DISK, DISK), 9_000_000);

        MaintenanceReport r = m.runCycle();

        assertThat(r.isVacuumed()).isTrue();
        verify(s).vacuum();
        verify(s, times(2)).checkpoint();
    }

    @Test
    void a_failing_step_does_not_abort_the_cycle() {
        TimeSeriesStore s = mock(TimeSeriesStore.class);
        doThrow(new StoreException("disk I/O error")).when(s).checkpoint();
        when(s.stats()).thenReturn(StoreStats.builder().build());
        when(s.compactReadingsOlderThan(any())).thenReturn(CompactionResult.NONE);
        when(s.compactEnergyOlderThan(any())).thenReturn(CompactionResult.NONE);
        when(s.oldestTimestamp()).thenReturn(Optional.empty());
        RetentionManager m = manager(s, new FakeDisk(() -> 100, DISK), 9_000_000);

        MaintenanceReport r = m.runCycle();

        assertThat(r.getFailedSteps()).containsExactly("checkpoint");
        verify(s).stats();
        verify(s).compactReadingsOlderThan(any());
        assertThat(alerts.isActive(AlertService.MAINTENANCE_FAILED)).isTrue();
    }

    @Test
    void age_limit_expires_old_rows() {
        openStore();
        store.appendReadings(series("m1", OLD, Duration.ofMinutes(1), 5, 100));
        store.appendReadings(series("m1", NOW.minusSeconds(60), Duration.ofSeconds(1), 5, 100));
        RetentionManager m = manager(store, FakeDisk.roomy(), 1);
        ReflectionTestUtils.setField(m, "maxAgeDays", 30);

        MaintenanceReport r = m.runCycle();

        assertThat(r.getExpiredRows()).isEqualTo(5);
        assertThat(store.oldestTimestamp()).contains(NOW.minusSeconds(60));
    }
}
