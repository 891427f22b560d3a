package com.elssolution.powermonitor.aggregation;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/** Per-bucket consumption for an energy query, newest bucket first. */
@Value
@Builder
public class EnergyHistory {
    String deviceId;
    String phase;
    Instant from;
    Instant to;
    List<EnergyBucket> buckets;

    /**
     * Last sample minus first sample over the whole range (summed over phases
     * for {@code ALL}). Not reset filtered: negative when a counter restarted
     * inside the range.
     */
    double rawTotalKwh;

    long rawCount;
    Resolution resolutionApplied;
    Long preAggregationCount;
    Duration elapsed;
}
