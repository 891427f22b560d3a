package com.elssolution.powermonitor.domain;

import java.time.Instant;

/** One instantaneous electrical snapshot, phase A of the meter. */
public record Reading(
        Instant timestamp,
        String deviceId,
        double voltage,        // V rms
        double current,        // A rms
        double activePower,    // W
        double reactivePower,  // VAR
        double apparentPower,  // VA
        double powerFactor,
        double frequency       // Hz
) {}
