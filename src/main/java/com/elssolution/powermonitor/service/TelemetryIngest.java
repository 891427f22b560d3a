package com.elssolution.powermonitor.service;

import com.elssolution.powermonitor.domain.EnergyReading;
import com.elssolution.powermonitor.domain.Reading;
import com.elssolution.powermonitor.store.StoreException;
import com.elssolution.powermonitor.store.TimeSeriesStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Write path from the pollers into the store. Fire-and-forget: a failed write
 * is logged and counted, never thrown back at the poll loop.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TelemetryIngest {

    private final TimeSeriesStore store;

    private final Map<String, Instant> lastWrite = new ConcurrentHashMap<>();
    private final AtomicLong written = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    public void submitReading(String deviceId, Reading reading) {
        if (!deviceId.equals(reading.deviceId())) {
            log.warn("ingest_device_mismatch device={} reading.device={} (dropped)", deviceId, reading.deviceId());
            failed.incrementAndGet();
            return;
        }
        try {
            store.append(reading);
            written.incrementAndGet();
            lastWrite.put(deviceId, reading.timestamp());
        } catch (StoreException e) {
            failed.incrementAndGet();
            log.error("ingest_reading_failed device={} err={}", deviceId, e.getMessage());
        }
    }

    public void submitEnergyReading(String deviceId, EnergyReading reading) {
        submitEnergyReadings(deviceId, List.of(reading));
    }

    /** All phases of one energy poll, stored together. */
    public void submitEnergyReadings(String deviceId, List<EnergyReading> readings) {
        if (readings.stream().anyMatch(r -> !deviceId.equals(r.deviceId()))) {
            log.warn("ingest_device_mismatch device={} (energy batch dropped)", deviceId);
            failed.incrementAndGet();
            return;
        }
        try {
            store.appendEnergyReadings(readings);
            written.addAndGet(readings.size());
        } catch (StoreException e) {
            failed.incrementAndGet();
            log.error("ingest_energy_failed device={} err={}", deviceId, e.getMessage());
        }
    }

    /** Forgets the freshness of a removed device. */
    public void forget(String deviceId) {
        lastWrite.remove(deviceId);
    }

    /** Timestamp of the last instantaneous reading stored for {@code deviceId}. */
    public Optional<Instant> lastReadingAt(String deviceId) {
        return Optional.ofNullable(lastWrite.get(deviceId));
    }

    public Map<String, Instant> lastReadingTimes() {
        return Map.copyOf(lastWrite);
    }

    public long writtenCount() {
        return written.get();
    }

    public long failedCount() {
        return failed.get();
    }
}
