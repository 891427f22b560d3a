package com.elssolution.powermonitor.polling;

import com.elssolution.powermonitor.alerts.AlertService;
import com.elssolution.powermonitor.domain.Device;
import com.elssolution.powermonitor.domain.EnergyReading;
import com.elssolution.powermonitor.service.TelemetryIngest;
import com.elssolution.powermonitor.store.TimeSeriesStore;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;

/** Cumulative energy counters, one loop per enabled device, slower cadence. */
@Service
public class EnergyPollSupervisor extends AbstractPollSupervisor<List<EnergyReading>> {

    private final MeterClient client;
    private final TelemetryIngest ingest;
    private final boolean autostart;

    public EnergyPollSupervisor(@Qualifier("energyMeterClient") MeterClient client,
                                TelemetryIngest ingest,
                                TimeSeriesStore store,
                                AlertService alerts,
                                ScheduledExecutorService scheduler,
                                @Qualifier("pollWorkers") ExecutorService workers,
                                @Value("${poller.energy.failureThreshold:5}") int failureThreshold,
                                @Value("${poller.energy.backoffMs:60000}") long backoffMs,
                                @Value("${poller.energy.cancelTimeoutMs:15000}") long cancelTimeoutMs,
                                @Value("${poller.autostart:true}") boolean autostart) {
        super(PollKind.ENERGY, store, alerts, scheduler, workers, failureThreshold,
                Duration.ofMillis(backoffMs), Duration.ofMillis(cancelTimeoutMs));
        this.client = client;
        this.ingest = ingest;
        this.autostart = autostart;
    }

    @PostConstruct
    void init() {
        if (autostart) start();
    }

    @PreDestroy
    void shutdown() {
        stop();
    }

    @Override
    protected Optional<List<EnergyReading>> fetch(Device device) {
        return client.readEnergy(device);
    }

    @Override
    protected void handOff(Device device, List<EnergyReading> sample) {
        ingest.submitEnergyReadings(device.getDeviceId(), sample);
    }

    @Override
    protected Duration intervalOf(Device device) {
        return device.getEnergyPollInterval();
    }
}
