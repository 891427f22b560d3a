package com.elssolution.powermonitor.polling;

import com.elssolution.powermonitor.alerts.AlertService;
import com.elssolution.powermonitor.domain.Device;
import com.elssolution.powermonitor.domain.Reading;
import com.elssolution.powermonitor.service.TelemetryIngest;
import com.elssolution.powermonitor.store.TimeSeriesStore;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;

/** Instantaneous readings, one loop per enabled device. */
@Service
public class ReadingPollSupervisor extends AbstractPollSupervisor<Reading> {

    private final MeterClient client;
    private final TelemetryIngest ingest;
    private final boolean autostart;

    public ReadingPollSupervisor(@Qualifier("readingMeterClient") MeterClient client,
                                 TelemetryIngest ingest,
                                 TimeSeriesStore store,
                                 AlertService alerts,
                                 ScheduledExecutorService scheduler,
                                 @Qualifier("pollWorkers") ExecutorService workers,
                                 @Value("${poller.reading.failureThreshold:5}") int failureThreshold,
                                 @Value("${poller.reading.backoffMs:30000}") long backoffMs,
                                 @Value("${poller.reading.cancelTimeoutMs:10000}") long cancelTimeoutMs,
                                 @Value("${poller.autostart:true}") boolean autostart) {
        super(PollKind.READING, store, alerts, scheduler, workers, failureThreshold,
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
    protected Optional<Reading> fetch(Device device) {
        return client.readInstant(device);
    }

    @Override
    protected void handOff(Device device, Reading sample) {
        ingest.submitReading(device.getDeviceId(), sample);
    }

    @Override
    protected Duration intervalOf(Device device) {
        return device.getPollInterval();
    }
}
