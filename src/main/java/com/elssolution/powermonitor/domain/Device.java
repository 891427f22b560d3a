package com.elssolution.powermonitor.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * A registered meter. Identity is {@code deviceId}; {@code address} is the
 * host (optionally host:port) its HTTP API listens on.
 */
@Value
@Builder(toBuilder = true)
public class Device {
    String deviceId;
    String address;
    String name;
    String location;

    @Builder.Default boolean enabled = true;

    /** Instantaneous reading interval. */
    @Builder.Default Duration pollInterval = Duration.ofSeconds(1);

    /** Cumulative energy interval. */
    @Builder.Default Duration energyPollInterval = Duration.ofSeconds(30);
}
