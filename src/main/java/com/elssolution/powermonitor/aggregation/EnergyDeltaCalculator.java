package com.elssolution.powermonitor.aggregation;

import com.elssolution.powermonitor.domain.EnergyReading;
import com.elssolution.powermonitor.store.TimeSeriesStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.*;

/**
 * Turns cumulative per-phase energy counters into consumption per bucket.
 *
 * Buckets narrower than an hour interpolate the counter at both boundaries;
 * wider buckets subtract the first sample inside the bucket from the last one.
 * A negative delta means the counter restarted: that bucket is dropped.
 */
@Slf4j
@Component
public class EnergyDeltaCalculator {

    static final long INTERPOLATION_MAX_WIDTH_MINUTES = 60;

    private final TimeSeriesStore store;
    private final ZoneId zone;

    public EnergyDeltaCalculator(TimeSeriesStore store, Clock clock) {
        this.store = store;
        this.zone = clock.getZone();
    }

    public EnergyHistory historicalEnergy(String deviceId, Instant from, Instant to, String phase, String resolution) {
        return historicalEnergy(deviceId, from, to, phase, Resolution.parse(resolution));
    }

    public EnergyHistory historicalEnergy(String deviceId, Instant from, Instant to, String phase,
                                          Resolution requested) {
        long started = System.nanoTime();
        if (from == null || to == null || !from.isBefore(to)) {
            throw new QueryException(QueryException.Reason.BAD_RANGE,
                    "Range start must be before its end: [" + from + ", " + to + "]");
        }
        if (deviceId == null || !store.deviceExists(deviceId)) {
            throw new QueryException(QueryException.Reason.UNKNOWN_DEVICE, "Unknown device " + deviceId);
        }
        String phaseKey = phase == null || phase.isBlank() ? EnergyReading.ALL_PHASES : phase;

        List<EnergyReading> samples = store.scanEnergy(deviceId, phaseKey, from, to);
        Map<String, Series> byPhase = splitByPhase(samples);

        Resolution applied = requested;
        Long preCount = null;
        if (requested.isAuto()) {
            preCount = (long) samples.size();
            applied = ResolutionPolicy.choose(preCount, from, to);
        }

        double rawTotal = 0;
        for (Series s : byPhase.values()) rawTotal += s.rawTotal();

        List<EnergyBucket> buckets = List.of();
        if (!applied.isRaw()) {
            List<Instant> starts = bucketStarts(from, to, applied);
            boolean interpolate = applied.widthMinutes() < INTERPOLATION_MAX_WIDTH_MINUTES;
            // one slot per bucket start; null marks "no value" for every phase so far
            Double[] sums = new Double[starts.size()];
            for (Map.Entry<String, Series> e : byPhase.entrySet()) {
                double[] deltas = interpolate
                        ? interpolated(e.getValue(), starts, applied)
                        : firstLast(e.getValue(), starts, applied);
                for (int i = 0; i < deltas.length; i++) {
                    if (Double.isNaN(deltas[i])) continue;
                    if (deltas[i] < 0) {
                        log.warn("energy_counter_reset device={} phase={} bucket={} delta={}kWh (dropped)",
                                deviceId, e.getKey(), starts.get(i), deltas[i]);
                        continue;
                    }
                    sums[i] = (sums[i] == null ? 0.0 : sums[i]) + deltas[i];
                }
            }
            buckets = new ArrayList<>();
            for (int i = starts.size() - 1; i >= 0; i--) {
                if (sums[i] == null) continue;
                Instant start = starts.get(i);
                buckets.add(new EnergyBucket(start.isBefore(from) ? from : start, applied.next(start, zone), sums[i]));
            }
        }

        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
        log.debug("energy_query device={} phase={} resolution={} samples={} buckets={} took={}ms",
                deviceId, phaseKey, applied, samples.size(), buckets.size(), elapsed.toMillis());
        return EnergyHistory.builder()
                .deviceId(deviceId)
                .phase(phaseKey)
                .from(from)
                .to(to)
                .buckets(buckets)
                .rawTotalKwh(rawTotal)
                .rawCount(samples.size())
                .resolutionApplied(applied)
                .preAggregationCount(preCount)
                .elapsed(elapsed)
                .build();
    }

    // ==================== strategies ====================

    /**
     * Delta per bucket from counter values interpolated at both boundaries.
     * Buckets outside the sampled span get NaN. O(log n) per boundary.
     */
    double[] interpolated(Series s, List<Instant> starts, Resolution res) {
        double[] out = new double[starts.size()];
        Arrays.fill(out, Double.NaN);
        if (s.size() < 2) return out;

        long first = s.ts[0];
        long last = s.ts[s.size() - 1];
        for (int i = 0; i < starts.size(); i++) {
            long start = starts.get(i).toEpochMilli();
            long end = res.next(starts.get(i), zone).toEpochMilli();
            if (end <= first || start >= last) continue;
            out[i] = s.valueAt(end) - s.valueAt(start);
        }
        return out;
    }

    /**
     * Delta per bucket as last minus first sample inside it, in one sweep over
     * the sorted samples. Buckets with fewer than two samples get NaN.
     */
    double[] firstLast(Series s, List<Instant> starts, Resolution res) {
        double[] out = new double[starts.size()];
        Arrays.fill(out, Double.NaN);
        int p = 0;
        for (int i = 0; i < starts.size() && p < s.size(); i++) {
            long start = starts.get(i).toEpochMilli();
            long end = res.next(starts.get(i), zone).toEpochMilli();
            while (p < s.size() && s.ts[p] < start) p++;
            int firstIdx = p;
            while (p < s.size() && s.ts[p] < end) p++;
            if (p - firstIdx >= 2) {
                out[i] = s.kwh[p - 1] - s.kwh[firstIdx];
            }
        }
        return out;
    }

    // ==================== helpers ====================

    List<Instant> bucketStarts(Instant from, Instant to, Resolution res) {
        List<Instant> starts = new ArrayList<>();
        for (Instant b = res.bucketStart(from, zone); b.isBefore(to); b = res.next(b, zone)) {
            starts.add(b);
        }
        return starts;
    }

    private static Map<String, Series> splitByPhase(List<EnergyReading> samples) {
        Map<String, List<EnergyReading>> grouped = new TreeMap<>();
        for (EnergyReading r : samples) {
            grouped.computeIfAbsent(r.phase(), k -> new ArrayList<>()).add(r);
        }
        Map<String, Series> out = new TreeMap<>();
        grouped.forEach((phase, list) -> out.put(phase, Series.of(list)));
        return out;
    }

    /** Time-sorted samples of one phase as parallel arrays. */
    static final class Series {
        final long[] ts;
        final double[] kwh;

        private Series(long[] ts, double[] kwh) {
            this.ts = ts;
            this.kwh = kwh;
        }

        static Series of(List<EnergyReading> readings) {
            List<EnergyReading> sorted = new ArrayList<>(readings);
            sorted.sort(Comparator.comparing(EnergyReading::timestamp));
            long[] ts = new long[sorted.size()];
            double[] kwh = new double[sorted.size()];
            for (int i = 0; i < sorted.size(); i++) {
                ts[i] = sorted.get(i).timestamp().toEpochMilli();
                kwh[i] = sorted.get(i).totalKwh();
            }
            return new Series(ts, kwh);
        }

        int size() {
            return ts.length;
        }

        double rawTotal() {
            return size() < 2 ? 0.0 : kwh[size() - 1] - kwh[0];
        }

        /** Counter value at {@code t}, clamped to the first/last sample outside the sampled span. */
        double valueAt(long t) {
            int idx = Arrays.binarySearch(ts, t);
            if (idx >= 0) return kwh[idx];
            int ins = -idx - 1;
            if (ins == 0) return kwh[0];
            if (ins >= ts.length) return kwh[ts.length - 1];
            long t0 = ts[ins - 1];
            long t1 = ts[ins];
            double ratio = (double) (t - t0) / (t1 - t0);
            return kwh[ins - 1] + (kwh[ins] - kwh[ins - 1]) * ratio;
        }
    }
}
