package com.elssolution.powermonitor.aggregation;

import com.elssolution.powermonitor.domain.Reading;
import com.elssolution.powermonitor.store.TimeSeriesStore;
import com.elssolution.powermonitor.store.TimeSeriesStore.ScanOrder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Downsamples instantaneous readings into time buckets.
 *
 * Rows are streamed oldest first and folded into one running bucket at a
 * time, so memory grows with the number of buckets returned, not with the
 * number of rows in range.
 */
@Slf4j
@Component
public class AggregationEngine {

    private final TimeSeriesStore store;
    private final ZoneId zone;

    public AggregationEngine(TimeSeriesStore store, Clock clock) {
        this.store = store;
        this.zone = clock.getZone();
    }

    public HistoricalReadings historicalReadings(String deviceId, Instant from, Instant to,
                                                 Integer limit, String resolution) {
        return historicalReadings(deviceId, from, to, limit, Resolution.parse(resolution));
    }

    public HistoricalReadings historicalReadings(String deviceId, Instant from, Instant to,
                                                 Integer limit, Resolution requested) {
        long started = System.nanoTime();
        checkQuery(deviceId, from, to, limit);

        Resolution applied = requested;
        Long preCount = null;
        if (requested.isAuto()) {
            preCount = store.countReadings(deviceId, from, to);
            applied = ResolutionPolicy.choose(preCount, from, to);
            log.debug("auto_resolution device={} rows={} chosen={}", deviceId, preCount, applied);
        }

        List<Reading> rows = applied.isRaw()
                ? store.scanReadings(deviceId, from, to, limit, ScanOrder.DESC)
                : bucketed(deviceId, from, to, limit, applied);

        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
        log.debug("readings_query device={} resolution={} points={} took={}ms",
                deviceId, applied, rows.size(), elapsed.toMillis());
        return HistoricalReadings.builder()
                .deviceId(deviceId)
                .from(from)
                .to(to)
                .rows(rows)
                .resolutionApplied(applied)
                .preAggregationCount(preCount)
                .elapsed(elapsed)
                .build();
    }

    private List<Reading> bucketed(String deviceId, Instant from, Instant to, Integer limit, Resolution res) {
        List<Reading> out = new ArrayList<>();
        Bucket[] current = new Bucket[1];

        store.streamReadings(deviceId, from, to, null, ScanOrder.ASC, r -> {
            Bucket b = current[0];
            if (b == null || !r.timestamp().isBefore(b.end)) {
                if (b != null) out.add(b.mean(deviceId, from));
                Instant start = res.bucketStart(r.timestamp(), zone);
                current[0] = b = new Bucket(start, res.next(start, zone));
            }
            b.add(r);
        });
        if (current[0] != null) out.add(current[0].mean(deviceId, from));

        Collections.reverse(out);
        return limit != null && out.size() > limit ? new ArrayList<>(out.subList(0, limit)) : out;
    }

    void checkQuery(String deviceId, Instant from, Instant to, Integer limit) {
        if (from == null || to == null || !from.isBefore(to)) {
            throw new QueryException(QueryException.Reason.BAD_RANGE,
                    "Range start must be before its end: [" + from + ", " + to + ")");
        }
        if (limit != null && limit <= 0) {
            throw new QueryException(QueryException.Reason.BAD_LIMIT, "Limit must be positive: " + limit);
        }
        if (deviceId == null || !store.deviceExists(deviceId)) {
            throw new QueryException(QueryException.Reason.UNKNOWN_DEVICE, "Unknown device " + deviceId);
        }
    }

    /** Running sums of one bucket. */
    private static final class Bucket {
        final Instant start;
        final Instant end;
        long n;
        double voltage, current, active, reactive, apparent, pf, freq;

        Bucket(Instant start, Instant end) {
            this.start = start;
            this.end = end;
        }

        void add(Reading r) {
            n++;
            voltage += r.voltage();
            current += r.current();
            active += r.activePower();
            reactive += r.reactivePower();
            apparent += r.apparentPower();
            pf += r.powerFactor();
            freq += r.frequency();
        }

        // stamped at the bucket start, clipped so it never precedes the query range
        Reading mean(String deviceId, Instant from) {
            Instant ts = start.isBefore(from) ? from : start;
            return new Reading(ts, deviceId,
                    voltage / n, current / n, active / n, reactive / n, apparent / n, pf / n, freq / n);
        }
    }
}
