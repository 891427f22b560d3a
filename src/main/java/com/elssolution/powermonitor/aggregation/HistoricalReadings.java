package com.elssolution.powermonitor.aggregation;

import com.elssolution.powermonitor.domain.Reading;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/** Result of a readings query, newest row first. */
@Value
@Builder
public class HistoricalReadings {
    String deviceId;
    Instant from;
    Instant to;
    List<Reading> rows;
    Resolution resolutionApplied;
    /** Rows in range before bucketing; only set when {@code auto} was requested. */
    Long preAggregationCount;
    Duration elapsed;

    public int pointCount() {
        return rows.size();
    }
}
