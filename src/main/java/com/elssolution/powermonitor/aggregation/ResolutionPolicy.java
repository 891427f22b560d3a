package com.elssolution.powermonitor.aggregation;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/** Picks a bucket width for {@code auto} queries from a fixed ladder. */
public final class ResolutionPolicy {

    public static final int TARGET_POINTS = 10_000;

    static final List<Resolution> LADDER = List.of(
            Resolution.minutes(1), Resolution.minutes(2), Resolution.minutes(3), Resolution.minutes(5),
            Resolution.minutes(10), Resolution.minutes(15), Resolution.minutes(20), Resolution.minutes(30),
            Resolution.hours(1), Resolution.hours(2), Resolution.hours(3), Resolution.hours(6), Resolution.hours(12),
            Resolution.days(1), Resolution.week(), Resolution.month());

    private ResolutionPolicy() {}

    public static Resolution choose(long rowCount, Instant from, Instant to) {
        return choose(rowCount, from, to, TARGET_POINTS);
    }

    /**
     * {@code none} when the rows already fit, otherwise the finest rung at least
     * as wide as span / target. A rung whose buckets over the span (counting a
     * partial one at each end) would still exceed the target is passed over.
     */
    public static Resolution choose(long rowCount, Instant from, Instant to, int targetPoints) {
        if (rowCount <= targetPoints) return Resolution.NONE;

        double spanMinutes = Duration.between(from, to).toMillis() / 60_000.0;
        double idealMinutes = spanMinutes / targetPoints;
        for (Resolution r : LADDER) {
            long width = r.widthMinutes();
            if (width < idealMinutes) continue;
            long buckets = (long) Math.ceil(spanMinutes / width) + 1;
            if (buckets <= targetPoints) return r;
        }
        return Resolution.month();
    }
}
