package com.elssolution.powermonitor.config;

import com.elssolution.powermonitor.store.DiskSpaceProbe;
import com.elssolution.powermonitor.store.StoreDataSource;
import com.elssolution.powermonitor.store.TimeSeriesStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneId;

/**
 * Store wiring. A failure in any of these beans (unwritable path, corrupt
 * database) aborts application startup.
 */
@Configuration
public class StoreConfig {

    @Value("${store.path:data/power_monitor.db}") private String path;
    @Value("${store.poolSize:4}")                 private int poolSize;
    @Value("${store.busyTimeoutMs:5000}")         private long busyTimeoutMs;
    @Value("${store.synchronous:FULL}")           private String synchronous;

    /** Blank means the JVM default zone. */
    @Value("${monitor.zone:}")                    private String zone;

    @Bean(destroyMethod = "close")
    public StoreDataSource storeDataSource() {
        return new StoreDataSource(Path.of(path), poolSize, busyTimeoutMs, synchronous);
    }

    @Bean
    public DiskSpaceProbe diskSpaceProbe(StoreDataSource db) {
        return DiskSpaceProbe.forPath(db.path());
    }

    @Bean
    public TimeSeriesStore timeSeriesStore(StoreDataSource db, DiskSpaceProbe disk) {
        return new TimeSeriesStore(db, disk);
    }

    @Bean
    public Clock clock() {
        return zone == null || zone.isBlank() ? Clock.systemDefaultZone() : Clock.system(ZoneId.of(zone));
    }
}
