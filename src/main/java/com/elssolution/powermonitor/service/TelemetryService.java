package com.elssolution.powermonitor.service;

import com.elssolution.powermonitor.aggregation.AggregationEngine;
import com.elssolution.powermonitor.aggregation.EnergyDeltaCalculator;
import com.elssolution.powermonitor.aggregation.EnergyHistory;
import com.elssolution.powermonitor.aggregation.HistoricalReadings;
import com.elssolution.powermonitor.aggregation.QueryException;
import com.elssolution.powermonitor.domain.Device;
import com.elssolution.powermonitor.domain.EnergyReading;
import com.elssolution.powermonitor.domain.Reading;
import com.elssolution.powermonitor.polling.EnergyPollSupervisor;
import com.elssolution.powermonitor.polling.HttpMeterClient;
import com.elssolution.powermonitor.polling.ReadingPollSupervisor;
import com.elssolution.powermonitor.retention.MaintenanceReport;
import com.elssolution.powermonitor.retention.RetentionManager;
import com.elssolution.powermonitor.store.ReadingStatistics;
import com.elssolution.powermonitor.store.StoreStats;
import com.elssolution.powermonitor.store.TimeSeriesStore;
import com.elssolution.powermonitor.store.TimeSeriesStore.ScanOrder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Everything the routing layer may ask of the core: ingest, queries, device
 * registration and on-demand maintenance.
 *
 * Queries about a device that is not registered fail with
 * {@link QueryException.Reason#UNKNOWN_DEVICE}; registration calls are
 * idempotent.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TelemetryService {

    private final TimeSeriesStore store;
    private final TelemetryIngest ingest;
    private final AggregationEngine aggregation;
    private final EnergyDeltaCalculator energy;
    private final ReadingPollSupervisor readingPoller;
    private final EnergyPollSupervisor energyPoller;
    private final RetentionManager retention;

    // ==================== ingest ====================

    public void submitReading(String deviceId, Reading reading) {
        ingest.submitReading(deviceId, reading);
    }

    public void submitEnergyReading(String deviceId, EnergyReading reading) {
        ingest.submitEnergyReading(deviceId, reading);
    }

    // ==================== queries ====================

    public Optional<Reading> latestReading(String deviceId) {
        requireDevice(deviceId);
        return store.latestReading(deviceId);
    }

    /** Latest sample of {@code phase}, or of whichever phase reported last for {@code ALL}. */
    public Optional<EnergyReading> latestEnergy(String deviceId, String phase) {
        requireDevice(deviceId);
        return store.latestEnergy(deviceId, phase);
    }

    public HistoricalReadings historicalReadings(String deviceId, Instant from, Instant to,
                                                 Integer limit, String resolution) {
        return aggregation.historicalReadings(deviceId, from, to, limit, resolution);
    }

    public EnergyHistory historicalEnergy(String deviceId, Instant from, Instant to,
                                          String phase, String resolution) {
        return energy.historicalEnergy(deviceId, from, to, phase, resolution);
    }

    public long readingCount(String deviceId, Instant from, Instant to) {
        requireRange(from, to);
        requireDevice(deviceId);
        return store.countReadings(deviceId, from, to);
    }

    public ReadingStatistics statistics(String deviceId, Instant from, Instant to) {
        requireRange(from, to);
        requireDevice(deviceId);
        return store.statistics(deviceId, from, to);
    }

    /** Raw rows, oldest first, for an external renderer. */
    public List<Reading> exportReadings(String deviceId, Instant from, Instant to) {
        requireRange(from, to);
        requireDevice(deviceId);
        return store.scanReadings(deviceId, from, to, null, ScanOrder.ASC);
    }

    public StoreStats storeStats() {
        return store.stats();
    }

    // ==================== devices ====================

    public List<Device> listDevices() {
        return store.listDevices();
    }

    /** Stores the device and starts its loops; re-registering behaves like an update. */
    public void registerDevice(Device device) {
        validate(device);
        boolean known = store.deviceExists(device.getDeviceId());
        store.saveDevice(device);
        if (known) {
            restartLoops(device);
        } else {
            readingPoller.add(device);
            energyPoller.add(device);
        }
        log.info("device_registered id={} address={} enabled={} existing={}",
                device.getDeviceId(), device.getAddress(), device.isEnabled(), known);
    }

    /** Saves the new settings and restarts both loops with them. */
    public void updateDevice(Device device) {
        validate(device);
        requireDevice(device.getDeviceId());
        store.saveDevice(device);
        restartLoops(device);
        log.info("device_updated id={} address={} enabled={}",
                device.getDeviceId(), device.getAddress(), device.isEnabled());
    }

    /** Stops both loops, waits for them, then deletes the device and its data. No-op when unknown. */
    public void removeDevice(String deviceId) {
        readingPoller.remove(deviceId);
        energyPoller.remove(deviceId);
        boolean deleted = store.deleteDevice(deviceId);
        readingPoller.forget(deviceId);
        energyPoller.forget(deviceId);
        ingest.forget(deviceId);
        if (deleted) {
            log.info("device_removed id={}", deviceId);
        }
    }

    // ==================== maintenance ====================

    public MaintenanceReport runMaintenance() {
        return retention.runCycle();
    }

    // ==================== helpers ====================

    private void restartLoops(Device device) {
        readingPoller.update(device);
        energyPoller.update(device);
    }

    private void requireDevice(String deviceId) {
        if (deviceId == null || !store.deviceExists(deviceId)) {
            throw new QueryException(QueryException.Reason.UNKNOWN_DEVICE, "Unknown device " + deviceId);
        }
    }

    private static void requireRange(Instant from, Instant to) {
        if (from == null || to == null || !from.isBefore(to)) {
            throw new QueryException(QueryException.Reason.BAD_RANGE,
                    "Range start must be before its end: [" + from + ", " + to + ")");
        }
    }

    private static void validate(Device device) {
        if (device.getDeviceId() == null || device.getDeviceId().isBlank()) {
            throw new IllegalArgumentException("Device id is required");
        }
        if (!HttpMeterClient.isValidAddress(device.getAddress())) {
            throw new IllegalArgumentException("Device " + device.getDeviceId()
                    + " needs a host, host:port or URL address, got '" + device.getAddress() + "'");
        }
        if (device.getPollInterval().isNegative() || device.getPollInterval().isZero()
                || device.getEnergyPollInterval().isNegative() || device.getEnergyPollInterval().isZero()) {
            throw new IllegalArgumentException("Poll intervals must be positive for " + device.getDeviceId());
        }
    }
}
