package com.elssolution.powermonitor.aggregation;

import java.time.Instant;

/** Consumption inside [timestamp, end). Always non-negative. */
public record EnergyBucket(Instant timestamp, Instant end, double deltaKwh) {}
