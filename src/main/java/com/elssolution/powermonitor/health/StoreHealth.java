package com.elssolution.powermonitor.health;

import com.elssolution.powermonitor.alerts.AlertService;
import com.elssolution.powermonitor.store.StoreStats;
import com.elssolution.powermonitor.store.TimeSeriesStore;
import org.springframework.boot.actuate.health.*;
import org.springframework.stereotype.Component;

/** Down when the store cannot be read; low disk is reported but keeps it up. */
@Component
public class StoreHealth implements HealthIndicator {
    private final TimeSeriesStore store;
    private final AlertService alerts;

    public StoreHealth(TimeSeriesStore store, AlertService alerts) {
        this.store = store;
        this.alerts = alerts;
    }

    @Override public Health health() {
        try {
            StoreStats s = store.stats();
            return Health.up()
                    .withDetail("sizeBytes", s.getSizeBytes())
                    .withDetail("logSizeBytes", s.getLogSizeBytes())
                    .withDetail("diskFreeBytes", s.getDiskFreeBytes())
                    .withDetail("lowDisk", alerts.isActive(AlertService.LOW_DISK))
                    .withDetail("maintenanceFailed", alerts.isActive(AlertService.MAINTENANCE_FAILED))
                    .build();
        } catch (RuntimeException e) {
            return Health.down(e).build();
        }
    }
}
