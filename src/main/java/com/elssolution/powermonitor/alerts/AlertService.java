package com.elssolution.powermonitor.alerts;

import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory alert registry for the monitor: meters in backoff, disk pressure,
 * failed maintenance steps and crashed threads.
 *
 * An alert is keyed by a string. Raising an inactive key opens an episode,
 * raising it again only refreshes it, resolving closes it. Nothing here is
 * persisted; a restart starts clean.
 */
@Slf4j
@Service
public class AlertService {

    public enum Severity { INFO, WARN, ERROR, CRITICAL }

    public enum Transition { RAISED, RESOLVED }

    public static final String LOW_DISK = "LOW_DISK";
    public static final String MAINTENANCE_FAILED = "MAINTENANCE_FAILED";
    public static final String UNCAUGHT = "UNCAUGHT";

    private static final String METER_BACKOFF_PREFIX = "METER_BACKOFF:";
    private static final int HISTORY_SIZE = 50;

    /** Key for a meter stuck in backoff, e.g. {@code METER_BACKOFF:READING:m1}. */
    public static String meterBackoffKey(String kind, String deviceId) {
        return METER_BACKOFF_PREFIX + kind + ":" + deviceId;
    }

    @Value @Builder
    public static class AlertView {
        String key;
        String message;
        Severity severity;
        Instant since;     // start of the current episode
        Instant lastSeen;
        int raises;        // raise() calls in this episode
    }

    @Value @Builder
    public static class EventView {
        String key;
        String message;
        Severity severity;
        Instant at;
        Transition transition;
    }

    @Value @Builder
    public static class AlertsSnapshot {
        List<AlertView> active;
        List<EventView> recent;
        int metersInBackoff;
    }

    /** One open episode; replaced wholesale on every change. */
    private record Episode(String message, Severity severity, Instant since, Instant lastSeen, int raises) {
        Episode refresh(String msg, Severity sev, Instant now) {
            return new Episode(msg, sev, since, now, raises + 1);
        }
    }

    private final Clock clock;
    private final Map<String, Episode> open = new ConcurrentHashMap<>();
    private final Deque<EventView> history = new ArrayDeque<>();

    public AlertService(Clock clock) {
        this.clock = clock;
    }

    /** Opens an episode for {@code key}, or refreshes the one already open. */
    public void raise(String key, String message, Severity sev) {
        Instant now = clock.instant();
        boolean[] opened = new boolean[1];
        open.compute(key, (k, current) -> {
            if (current == null) {
                opened[0] = true;
                return new Episode(message, sev, now, now, 1);
            }
            return current.refresh(message, sev, now);
        });

        if (opened[0]) {
            log.warn("alert_raised key={} sev={} msg={}", key, sev, message);
            remember(key, message, sev, now, Transition.RAISED);
        } else {
            log.debug("alert_refreshed key={} msg={}", key, message);
        }
    }

    /** Closes the episode of {@code key}. No-op when none is open. */
    public void resolve(String key) {
        Episode closed = open.remove(key);
        if (closed == null) return;
        log.info("alert_resolved key={} open_for={}s", key,
                Duration.between(closed.since(), clock.instant()).toSeconds());
        remember(key, "recovered", closed.severity(), clock.instant(), Transition.RESOLVED);
    }

    public boolean isActive(String key) {
        return open.containsKey(key);
    }

    /** Open alerts, most recently seen first, and the latest transitions, newest first. */
    public AlertsSnapshot snapshot() {
        List<AlertView> active = new ArrayList<>();
        open.forEach((key, e) -> active.add(AlertView.builder()
                .key(key).message(e.message()).severity(e.severity())
                .since(e.since()).lastSeen(e.lastSeen()).raises(e.raises())
                .build()));
        active.sort(Comparator.comparing(AlertView::getLastSeen).reversed());

        List<EventView> recent;
        synchronized (history) {
            recent = new ArrayList<>(history);
        }
        Collections.reverse(recent);

        int backoff = (int) active.stream().filter(a -> a.getKey().startsWith(METER_BACKOFF_PREFIX)).count();
        return AlertsSnapshot.builder().active(active).recent(recent).metersInBackoff(backoff).build();
    }

    private void remember(String key, String message, Severity sev, Instant at, Transition transition) {
        EventView ev = EventView.builder()
                .key(key).message(message).severity(sev).at(at).transition(transition)
                .build();
        synchronized (history) {
            history.addLast(ev);
            if (history.size() > HISTORY_SIZE) history.removeFirst();
        }
    }
}
