package com.elssolution.powermonitor.store;

import java.time.Instant;

/**
 * Summary of the raw readings in a window. {@code energyKwh} is estimated from
 * active power assuming one sample per second.
 */
public record ReadingStatistics(
        String deviceId,
        Instant from,
        Instant to,
        long sampleCount,
        double avgVoltage,
        double minVoltage,
        double maxVoltage,
        double avgCurrent,
        double maxCurrent,
        double avgActivePower,
        double maxActivePower,
        double energyKwh
) {}
