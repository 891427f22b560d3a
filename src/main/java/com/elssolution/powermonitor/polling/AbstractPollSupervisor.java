package com.elssolution.powermonitor.polling;

import com.elssolution.powermonitor.alerts.AlertService;
import com.elssolution.powermonitor.domain.Device;
import com.elssolution.powermonitor.store.TimeSeriesStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.*;

/**
 * Owns one poll loop per device for a single {@link PollKind}.
 *
 * A loop is a chain of one-shot tasks: the shared scheduler only times the
 * next poll and hands it to the worker pool, so a meter stuck on a socket
 * ties up one worker and nothing else. The loop map is changed only by
 * {@link #add}, {@link #update}, {@link #remove} and {@link #stop}; loops
 * never touch it themselves. Operations on the same device are serialized,
 * operations on different devices are not.
 *
 * @param <T> what one successful fetch yields
 */
@Slf4j
public abstract class AbstractPollSupervisor<T> {

    public enum LoopState { IDLE, POLLING, SLEEPING, BACKOFF, STOPPED }

    private final PollKind kind;
    private final TimeSeriesStore store;
    private final AlertService alerts;
    private final ScheduledExecutorService scheduler;
    private final ExecutorService workers;
    private final int failureThreshold;
    private final Duration backoff;
    private final Duration cancelTimeout;

    private final Map<String, PollLoop> loops = new ConcurrentHashMap<>();
    private final Map<String, Object> deviceLocks = new ConcurrentHashMap<>();
    private volatile boolean running;

    protected AbstractPollSupervisor(PollKind kind, TimeSeriesStore store, AlertService alerts,
                                     ScheduledExecutorService scheduler, ExecutorService workers,
                                     int failureThreshold, Duration backoff, Duration cancelTimeout) {
        this.kind = kind;
        this.store = store;
        this.alerts = alerts;
        this.scheduler = scheduler;
        this.workers = workers;
        this.failureThreshold = Math.max(1, failureThreshold);
        this.backoff = backoff;
        this.cancelTimeout = cancelTimeout;
    }

    /** One fetch; empty means the poll failed. Must not throw for I/O trouble. */
    protected abstract Optional<T> fetch(Device device);

    /** Hands a successful sample to the write path. */
    protected abstract void handOff(Device device, T sample);

    protected abstract Duration intervalOf(Device device);

    // ==================== lifecycle ====================

    /** Starts a loop for every enabled device in the store. */
    public void start() {
        running = true;
        List<Device> devices = store.listDevices();
        devices.stream().filter(Device::isEnabled).forEach(this::add);
        log.info("poll_supervisor_started kind={} loops={}", kind, loops.size());
    }

    /** Cancels every loop and waits for each to finish. */
    public void stop() {
        running = false;
        for (String id : new ArrayList<>(loops.keySet())) remove(id);
        log.info("poll_supervisor_stopped kind={}", kind);
    }

    public boolean isRunning() {
        return running;
    }

    // ==================== control path ====================

    /** Starts polling {@code device} unless it is disabled or already polled. */
    public void add(Device device) {
        if (!running) {
            log.debug("poll_add_ignored kind={} device={} reason=supervisor stopped", kind, device.getDeviceId());
            return;
        }
        if (!device.isEnabled()) {
            log.debug("poll_add_ignored kind={} device={} reason=disabled", kind, device.getDeviceId());
            return;
        }
        synchronized (lockFor(device.getDeviceId())) {
            PollLoop loop = new PollLoop(device);
            if (loops.putIfAbsent(device.getDeviceId(), loop) != null) return;
            loop.begin();
            log.info("poll_loop_started kind={} device={} address={} interval={}ms",
                    kind, device.getDeviceId(), device.getAddress(), intervalOf(device).toMillis());
        }
    }

    /** Replaces the loop of {@code device}; the old loop has finished before the new one starts. */
    public void update(Device device) {
        synchronized (lockFor(device.getDeviceId())) {
            remove(device.getDeviceId());
            add(device);
        }
    }

    /** Cancels and awaits the loop of {@code deviceId}. No-op when there is none. */
    public void remove(String deviceId) {
        synchronized (lockFor(deviceId)) {
            PollLoop loop = loops.remove(deviceId);
            if (loop == null) return;
            awaitQuietly(loop.cancel(), deviceId);
            alerts.resolve(AlertService.meterBackoffKey(kind.name(), deviceId));
            log.info("poll_loop_stopped kind={} device={}", kind, deviceId);
        }
    }

    /** Drops the bookkeeping of a device that no longer exists. Keeps it while a loop is running. */
    public void forget(String deviceId) {
        Object lock = deviceLocks.get(deviceId);
        if (lock == null) return;
        synchronized (lock) {
            if (!loops.containsKey(deviceId)) deviceLocks.remove(deviceId, lock);
        }
    }

    /** Devices with per-device bookkeeping, running or not. */
    Set<String> trackedDevices() {
        return Set.copyOf(deviceLocks.keySet());
    }

    /** Device ids that currently own a loop. */
    public Set<String> activeLoops() {
        return Set.copyOf(loops.keySet());
    }

    public Optional<LoopState> stateOf(String deviceId) {
        PollLoop loop = loops.get(deviceId);
        return loop == null ? Optional.empty() : Optional.of(loop.state);
    }

    public PollKind kind() {
        return kind;
    }

    private Object lockFor(String deviceId) {
        return deviceLocks.computeIfAbsent(deviceId, k -> new Object());
    }

    private void awaitQuietly(CompletableFuture<Void> done, String deviceId) {
        try {
            done.get(cancelTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            // the loop is already flagged and will not reschedule or hand off again
            log.warn("poll_cancel_timeout kind={} device={} waited={}ms", kind, deviceId, cancelTimeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException e) {
            log.warn("poll_cancel_failed kind={} device={} err={}", kind, deviceId, e.getCause().toString());
        }
    }

    // ==================== loop ====================

    private final class PollLoop implements Runnable {
        final Device device;
        final String key;
        final CompletableFuture<Void> done = new CompletableFuture<>();
        private final Object lock = new Object();

        // guarded by lock
        private boolean cancelled;
        private Thread worker;
        private Future<?> next;

        volatile LoopState state = LoopState.IDLE;
        private int failures; // touched by one cycle at a time

        PollLoop(Device device) {
            this.device = device;
            this.key = AlertService.meterBackoffKey(kind.name(), device.getDeviceId());
        }

        void begin() {
            synchronized (lock) {
                scheduleNext(0);
            }
        }

        /** Flags the loop, interrupts an in-flight poll or drops the pending one. */
        CompletableFuture<Void> cancel() {
            synchronized (lock) {
                cancelled = true;
                if (worker != null) {
                    worker.interrupt(); // run() completes done on its way out
                } else {
                    if (next != null) next.cancel(false);
                    finish();
                }
            }
            return done;
        }

        @Override
        public void run() {
            synchronized (lock) {
                if (cancelled) {
                    finish();
                    return;
                }
                worker = Thread.currentThread();
            }
            long delayMs = intervalOf(device).toMillis();
            try {
                delayMs = pollOnce();
            } catch (RuntimeException e) {
                log.warn("poll_cycle_error kind={} device={} err={}", kind, device.getDeviceId(), e.toString());
                delayMs = failed();
            } finally {
                synchronized (lock) {
                    worker = null;
                    Thread.interrupted(); // a cancel interrupt must not leak into the next pooled task
                    if (cancelled) {
                        finish();
                    } else {
                        scheduleNext(delayMs);
                    }
                }
            }
        }

        /** One fetch; returns how long to sleep before the next one. */
        private long pollOnce() {
            state = LoopState.POLLING;
            Optional<T> sample;
            try {
                sample = fetch(device);
            } catch (RuntimeException e) {
                log.warn("poll_fetch_error kind={} device={} err={}", kind, device.getDeviceId(), e.toString());
                sample = Optional.empty();
            }
            if (sample.isPresent()) {
                if (isCancelled()) return 0;
                handOff(device, sample.get());
                failures = 0;
                alerts.resolve(key);
                log.debug("poll_ok kind={} device={}", kind, device.getDeviceId());
                state = LoopState.SLEEPING;
                return intervalOf(device).toMillis();
            }
            return failed();
        }

        /** Counts a failed poll; returns the sleep before the next one, the backoff once the threshold is hit. */
        private long failed() {
            failures++;
            if (failures >= failureThreshold) {
                log.error("poll_backoff kind={} device={} failures={} sleep={}ms",
                        kind, device.getDeviceId(), failures, backoff.toMillis());
                alerts.raise(key, failures + " consecutive failed polls of " + device.getAddress(),
                        AlertService.Severity.WARN);
                failures = 0;
                state = LoopState.BACKOFF;
                return backoff.toMillis();
            }
            log.warn("poll_failed kind={} device={} failures={}/{}", kind, device.getDeviceId(), failures, failureThreshold);
            state = LoopState.SLEEPING;
            return intervalOf(device).toMillis();
        }

        private boolean isCancelled() {
            synchronized (lock) {
                return cancelled;
            }
        }

        // caller holds lock
        private void scheduleNext(long delayMs) {
            try {
                next = scheduler.schedule(() -> workers.execute(this), Math.max(0, delayMs), TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                log.warn("poll_schedule_rejected kind={} device={} (shutting down)", kind, device.getDeviceId());
                finish();
            }
        }

        // caller holds lock
        private void finish() {
            state = LoopState.STOPPED;
            done.complete(null);
        }
    }
}
