package com.elssolution.powermonitor.domain;

import java.time.Instant;

/**
 * One sample of a per-phase cumulative energy counter. The counter is meant to
 * be monotonic but may restart from zero after a meter reboot.
 */
public record EnergyReading(Instant timestamp, String deviceId, String phase, double totalKwh) {

    /** Phase filter meaning "every phase the meter reports". */
    public static final String ALL_PHASES = "ALL";
}
