package com.elssolution.powermonitor.store;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/** Footprint of the store and of the volume under it. */
@Value
@Builder
public class StoreStats {
    long sizeBytes;         // main database file
    long logSizeBytes;      // write-ahead log
    long readingCount;
    long energyCount;
    Instant oldest;         // null when empty
    Instant newest;
    long diskFreeBytes;
    long diskTotalBytes;
    double diskUsedPct;

    public long totalSizeBytes() {
        return sizeBytes + logSizeBytes;
    }
}
