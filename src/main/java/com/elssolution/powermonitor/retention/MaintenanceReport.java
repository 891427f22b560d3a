package com.elssolution.powermonitor.retention;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.List;

/** What one maintenance cycle did. */
@Value
@Builder
public class MaintenanceReport {
    long freeBytesBefore;
    long freeBytesAfter;
    boolean vacuumed;
    long expiredRows;        // removed by the age limit
    long compactedInserted;
    long compactedDeleted;
    long evictedRows;        // removed oldest-first under disk pressure
    int evictionBatches;
    @Singular List<String> failedSteps;
    Duration elapsed;

    public boolean ok() {
        return failedSteps.isEmpty();
    }
}
