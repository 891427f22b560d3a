package com.elssolution.powermonitor.polling;

import com.elssolution.powermonitor.domain.Device;
import com.elssolution.powermonitor.domain.EnergyReading;
import com.elssolution.powermonitor.domain.Reading;

import java.util.List;
import java.util.Optional;

/**
 * Fetches samples from a meter. Implementations never throw for network or
 * protocol trouble: any failed or malformed fetch is {@link Optional#empty()}.
 * Retrying is the caller's business.
 */
public interface MeterClient {

    Optional<Reading> readInstant(Device device);

    /** One sample per phase the meter reports. */
    Optional<List<EnergyReading>> readEnergy(Device device);
}
