package com.elssolution.powermonitor.polling;

import com.elssolution.powermonitor.alerts.AlertService;
import com.elssolution.powermonitor.domain.Device;
import com.elssolution.powermonitor.domain.EnergyReading;
import com.elssolution.powermonitor.domain.Reading;
import com.elssolution.powermonitor.polling.AbstractPollSupervisor.LoopState;
import com.elssolution.powermonitor.service.TelemetryIngest;
import com.elssolution.powermonitor.store.TimeSeriesStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static com.elssolution.powermonitor.store.TestStores.reading;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class PollSupervisorTest {

    static final String BACKOFF_KEY = AlertService.meterBackoffKey("READING", "m1");

    final FakeMeter meter = new FakeMeter();
    final TelemetryIngest ingest = mock(TelemetryIngest.class);
    final TimeSeriesStore store = mock(TimeSeriesStore.class);
    final AlertService alerts = new AlertService(Clock.systemUTC());

    ScheduledExecutorService scheduler;
    ExecutorService workers;
    ReadingPollSupervisor supervisor;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newSingleThreadScheduledExecutor();
        workers = Executors.newCachedThreadPool();
        supervisor = supervisor(3, 60_000);
    }

    @AfterEach
    void tearDown() {
        supervisor.stop();
        scheduler.shutdownNow();
        workers.shutdownNow();
    }

    private ReadingPollSupervisor supervisor(int threshold, long backoffMs) {
        return new ReadingPollSupervisor(meter, ingest, store, alerts, scheduler, workers,
                threshold, backoffMs, 5_000, false);
    }

    private static Device device(String id, long intervalMs) {
        return Device.builder().deviceId(id).address("10.0.0.9").pollInterval(Duration.ofMillis(intervalMs)).build();
    }

    private static void await(BooleanSupplier condition) {
        long deadline = System.currentTimeMillis() + 5_000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) fail("condition not met within 5s");
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                fail("interrupted");
            }
        }
    }

    @Test
    void successful_polls_are_handed_to_the_write_path() {
        supervisor.start();
        supervisor.add(device("m1", 20));

        verify(ingest, timeout(3_000).atLeast(3)).submitReading(eq("m1"), any(Reading.class));
        assertThat(supervisor.activeLoops()).containsExactly("m1");
        assertThat(alerts.isActive(BACKOFF_KEY)).isFalse();
    }

    @Test
    void consecutive_failures_back_off_and_raise_an_alert() {
        meter.healthy = false;
        supervisor.start();
        supervisor.add(device("m1", 10));

        await(() -> supervisor.stateOf("m1").orElse(null) == LoopState.BACKOFF);
        assertThat(alerts.isActive(BACKOFF_KEY)).isTrue();
        int calls = meter.calls.get();
        assertThat(calls).isEqualTo(3);

        sleep(200);
        assertThat(meter.calls.get()).isEqualTo(calls);
        verifyNoInteractions(ingest);

        supervisor.remove("m1");
        assertThat(alerts.isActive(BACKOFF_KEY)).isFalse();
    }

    @Test
    void a_fetch_that_throws_counts_as_a_failed_poll() {
        meter.thrown = new IllegalArgumentException("Illegal character in authority at index 7");
        supervisor.start();
        supervisor.add(device("m1", 10));

        await(() -> supervisor.stateOf("m1").orElse(null) == LoopState.BACKOFF);
        assertThat(alerts.isActive(BACKOFF_KEY)).isTrue();
        assertThat(meter.calls.get()).isEqualTo(3);

        sleep(200);
        assertThat(meter.calls.get()).isEqualTo(3);
        verifyNoInteractions(ingest);
    }

    @Test
    void a_failing_hand_off_counts_as_a_failed_poll() {
        doThrow(new IllegalStateException("ingest down")).when(ingest).submitReading(any(), any());
        supervisor.start();
        supervisor.add(device("m1", 10));

        await(() -> supervisor.stateOf("m1").orElse(null) == LoopState.BACKOFF);
        assertThat(alerts.isActive(BACKOFF_KEY)).isTrue();
    }

    @Test
    void forget_drops_bookkeeping_only_for_devices_without_a_loop() {
        supervisor.start();
        supervisor.add(device("m1", 50));
        supervisor.add(device("m2", 50));
        supervisor.remove("m1");

        supervisor.forget("m1");
        supervisor.forget("m2");
        supervisor.forget("ghost");

        assertThat(supervisor.trackedDevices()).containsExactly("m2");
        assertThat(supervisor.activeLoops()).containsExactly("m2");
    }

    @Test
    void success_after_backoff_clears_the_alert() {
        supervisor = supervisor(2, 150);
        meter.healthy = false;
        supervisor.start();
        supervisor.add(device("m1", 10));

        await(() -> alerts.isActive(BACKOFF_KEY));
        meter.healthy = true;

        await(() -> !alerts.isActive(BACKOFF_KEY));
        verify(ingest, timeout(3_000).atLeastOnce()).submitReading(eq("m1"), any(Reading.class));
    }

    @Test
    void remove_interrupts_an_in_flight_poll_and_waits_for_it() throws Exception {
        meter.block = new CountDownLatch(1);
        supervisor.start();
        supervisor.add(device("m1", 10));
        assertThat(meter.entered.await(3, TimeUnit.SECONDS)).isTrue();

        long started = System.nanoTime();
        supervisor.remove("m1");
        long tookMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        assertThat(meter.interrupted.get()).isTrue();
        assertThat(meter.inFlight.get()).isZero();
        assertThat(tookMs).isLessThan(5_000);
        assertThat(supervisor.activeLoops()).isEmpty();
        assertThat(supervisor.stateOf("m1")).isEmpty();

        sleep(100);
        assertThat(meter.calls.get()).isEqualTo(1);
        verifyNoInteractions(ingest);
    }

    @Test
    void remove_of_an_unknown_or_removed_device_is_a_no_op() {
        supervisor.start();
        supervisor.remove("ghost");

        supervisor.add(device("m1", 50));
        supervisor.remove("m1");
        supervisor.remove("m1");

        assertThat(supervisor.activeLoops()).isEmpty();
    }

    @Test
    void update_never_overlaps_two_loops_of_one_device() {
        meter.fetchDelayMs = 20;
        supervisor.start();
        Device d = device("m1", 1);
        supervisor.add(d);

        for (int i = 0; i < 15; i++) {
            supervisor.update(d.toBuilder().pollInterval(Duration.ofMillis(1 + i % 3)).build());
            sleep(5);
        }
        sleep(50);

        assertThat(meter.maxInFlight.get()).isEqualTo(1);
        assertThat(supervisor.activeLoops()).containsExactly("m1");
    }

    @Test
    void disabled_devices_and_duplicate_adds_are_ignored() {
        supervisor.start();
        supervisor.add(device("m1", 50).toBuilder().enabled(false).build());
        assertThat(supervisor.activeLoops()).isEmpty();

        supervisor.add(device("m2", 50));
        supervisor.add(device("m2", 10));
        assertThat(supervisor.activeLoops()).containsExactly("m2");
    }

    @Test
    void start_polls_every_enabled_device_and_stop_cancels_all() {
        when(store.listDevices()).thenReturn(List.of(
                device("m1", 50),
                device("m2", 50).toBuilder().enabled(false).build(),
                device("m3", 50)));

        supervisor.add(device("early", 50));
        assertThat(supervisor.activeLoops()).isEmpty();

        supervisor.start();
        assertThat(supervisor.isRunning()).isTrue();
        assertThat(supervisor.activeLoops()).containsExactlyInAnyOrder("m1", "m3");

        supervisor.stop();
        assertThat(supervisor.isRunning()).isFalse();
        assertThat(supervisor.activeLoops()).isEmpty();

        supervisor.add(device("late", 50));
        assertThat(supervisor.activeLoops()).isEmpty();
    }

    private static void sleep(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /** Scriptable meter that counts calls and overlapping fetches. */
    static final class FakeMeter implements MeterClient {
        volatile boolean healthy = true;
        volatile CountDownLatch block;
        volatile long fetchDelayMs;
        volatile RuntimeException thrown;
        final CountDownLatch entered = new CountDownLatch(1);
        final AtomicInteger calls = new AtomicInteger();
        final AtomicInteger inFlight = new AtomicInteger();
        final AtomicInteger maxInFlight = new AtomicInteger();
        final AtomicBoolean interrupted = new AtomicBoolean();

        @Override
        public Optional<Reading> readInstant(Device device) {
            calls.incrementAndGet();
            maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
            try {
                entered.countDown();
                CountDownLatch b = block;
                if (b != null) b.await();
                if (fetchDelayMs > 0) Thread.sleep(fetchDelayMs);
                if (thrown != null) throw thrown;
                return healthy ? Optional.of(reading(device.getDeviceId(), Instant.now(), 100)) : Optional.empty();
            } catch (InterruptedException e) {
                interrupted.set(true);
                Thread.currentThread().interrupt();
                return Optional.empty();
            } finally {
                inFlight.decrementAndGet();
            }
        }

        @Override
        public Optional<List<EnergyReading>> readEnergy(Device device) {
            return Optional.empty();
        }
    }
}
