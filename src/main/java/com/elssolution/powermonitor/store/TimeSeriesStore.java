package com.elssolution.powermonitor.store;

import com.elssolution.powermonitor.domain.Device;
import com.elssolution.powermonitor.domain.EnergyReading;
import com.elssolution.powermonitor.domain.Reading;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Append-only storage of instantaneous readings and cumulative energy samples.
 *
 * Timestamps are epoch milliseconds. Reading ranges are half-open [from, to);
 * energy ranges are closed [from, to] so a counter sample taken exactly at the
 * end of a window still closes it.
 *
 * Rows are only ever rewritten by the compaction methods, each of which runs in
 * a single transaction so concurrent readers see either the raw or the
 * compacted window.
 */
@Slf4j
public class TimeSeriesStore {

    public enum ScanOrder { ASC, DESC }

    /** Rows added and removed by one compaction pass. */
    public record CompactionResult(long inserted, long deleted) {
        public static final CompactionResult NONE = new CompactionResult(0, 0);
    }

    private static final long HOUR_MS = 3_600_000L;
    private static final int STREAM_FETCH_SIZE = 2_000;

    private static final String READING_COLUMNS =
            "ts, device_id, voltage_rms, current_rms, active_power, reactive_power, "
                    + "apparent_power, power_factor, frequency";
    private static final String ENERGY_COLUMNS = "ts, device_id, phase, total_kwh";
    private static final String DEVICE_COLUMNS =
            "device_id, address, name, location, enabled, poll_interval_ms, energy_poll_interval_ms";

    private final StoreDataSource db;
    private final DiskSpaceProbe disk;

    public TimeSeriesStore(StoreDataSource db, DiskSpaceProbe disk) {
        this.db = db;
        this.disk = disk;
        initSchema();
    }

    // ==================== schema ====================

    private void initSchema() {
        String[] ddl = {
                """
                CREATE TABLE IF NOT EXISTS devices (
                    device_id TEXT PRIMARY KEY,
                    address TEXT NOT NULL,
                    name TEXT,
                    location TEXT,
                    enabled INTEGER NOT NULL DEFAULT 1,
                    poll_interval_ms INTEGER NOT NULL DEFAULT 1000,
                    energy_poll_interval_ms INTEGER NOT NULL DEFAULT 30000,
                    created_at INTEGER NOT NULL
                )""",
                """
                CREATE TABLE IF NOT EXISTS readings (
                    id INTEGER PRIMARY KEY AUTOINCREMENT,
                    ts INTEGER NOT NULL,
                    device_id TEXT NOT NULL REFERENCES devices(device_id) ON DELETE CASCADE,
                    voltage_rms REAL NOT NULL,
                    current_rms REAL NOT NULL,
                    active_power REAL NOT NULL,
                    reactive_power REAL NOT NULL,
                    apparent_power REAL NOT NULL,
                    power_factor REAL NOT NULL,
                    frequency REAL NOT NULL
                )""",
                """
                CREATE TABLE IF NOT EXISTS energy_readings (
                    id INTEGER PRIMARY KEY AUTOINCREMENT,
                    ts INTEGER NOT NULL,
                    device_id TEXT NOT NULL REFERENCES devices(device_id) ON DELETE CASCADE,
                    phase TEXT NOT NULL,
                    total_kwh REAL NOT NULL
                )""",
                "CREATE INDEX IF NOT EXISTS idx_readings_device_ts ON readings(device_id, ts DESC)",
                "CREATE INDEX IF NOT EXISTS idx_readings_ts ON readings(ts)",
                "CREATE INDEX IF NOT EXISTS idx_energy_device_phase_ts ON energy_readings(device_id, phase, ts DESC)",
                "CREATE INDEX IF NOT EXISTS idx_energy_ts ON energy_readings(ts)"
        };
        try (Connection c = db.getConnection(); Statement st = c.createStatement()) {
            for (String sql : ddl) {
                st.execute(sql);
            }
        } catch (SQLException e) {
            throw new StoreException("Cannot initialize store schema at " + db.path(), e);
        }
        log.info("store_schema_ready path={}", db.path());
    }

    // ==================== devices ====================

    /** Insert or replace the stored configuration of a device. */
    public void saveDevice(Device device) {
        String sql = "INSERT INTO devices (" + DEVICE_COLUMNS + ", created_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?) "
                + "ON CONFLICT(device_id) DO UPDATE SET address=excluded.address, name=excluded.name, "
                + "location=excluded.location, enabled=excluded.enabled, poll_interval_ms=excluded.poll_interval_ms, "
                + "energy_poll_interval_ms=excluded.energy_poll_interval_ms";
        try (Connection c = db.getConnection(); PreparedStatement st = c.prepareStatement(sql)) {
            st.setString(1, device.getDeviceId());
            st.setString(2, device.getAddress());
            st.setString(3, device.getName());
            st.setString(4, device.getLocation());
            st.setInt(5, device.isEnabled() ? 1 : 0);
            st.setLong(6, device.getPollInterval().toMillis());
            st.setLong(7, device.getEnergyPollInterval().toMillis());
            st.setLong(8, System.currentTimeMillis());
            st.executeUpdate();
        } catch (SQLException e) {
            throw fail("saveDevice", e);
        }
    }

    public Optional<Device> findDevice(String deviceId) {
        String sql = "SELECT " + DEVICE_COLUMNS + " FROM devices WHERE device_id = ?";
        try (Connection c = db.getConnection(); PreparedStatement st = c.prepareStatement(sql)) {
            st.setString(1, deviceId);
            try (ResultSet rs = st.executeQuery()) {
                return rs.next() ? Optional.of(mapDevice(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw fail("findDevice", e);
        }
    }

    public boolean deviceExists(String deviceId) {
        try (Connection c = db.getConnection();
             PreparedStatement st = c.prepareStatement("SELECT 1 FROM devices WHERE device_id = ?")) {
            st.setString(1, deviceId);
            try (ResultSet rs = st.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            throw fail("deviceExists", e);
        }
    }

    public List<Device> listDevices() {
        String sql = "SELECT " + DEVICE_COLUMNS + " FROM devices ORDER BY name, device_id";
        try (Connection c = db.getConnection();
             PreparedStatement st = c.prepareStatement(sql);
             ResultSet rs = st.executeQuery()) {
            List<Device> out = new ArrayList<>();
            while (rs.next()) out.add(mapDevice(rs));
            return out;
        } catch (SQLException e) {
            throw fail("listDevices", e);
        }
    }

    /** Deletes the device and, through the foreign keys, all of its samples. */
    public boolean deleteDevice(String deviceId) {
        try (Connection c = db.getConnection();
             PreparedStatement st = c.prepareStatement("DELETE FROM devices WHERE device_id = ?")) {
            st.setString(1, deviceId);
            return st.executeUpdate() > 0;
        } catch (SQLException e) {
            throw fail("deleteDevice", e);
        }
    }

    // ==================== write path ====================

    public void append(Reading r) {
        appendReadings(List.of(r));
    }

    public void append(EnergyReading r) {
        appendEnergyReadings(List.of(r));
    }

    /** Appends all rows in one transaction. */
    public void appendReadings(Collection<Reading> readings) {
        if (readings.isEmpty()) return;
        String sql = "INSERT INTO readings (" + READING_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)";
        inTransaction("appendReadings", c -> {
            try (PreparedStatement st = c.prepareStatement(sql)) {
                for (Reading r : readings) {
                    st.setLong(1, r.timestamp().toEpochMilli());
                    st.setString(2, r.deviceId());
                    st.setDouble(3, r.voltage());
                    st.setDouble(4, r.current());
                    st.setDouble(5, r.activePower());
                    st.setDouble(6, r.reactivePower());
                    st.setDouble(7, r.apparentPower());
                    st.setDouble(8, r.powerFactor());
                    st.setDouble(9, r.frequency());
                    st.addBatch();
                }
                st.executeBatch();
            }
            return null;
        });
    }

    /** Appends all rows in one transaction. */
    public void appendEnergyReadings(Collection<EnergyReading> readings) {
        if (readings.isEmpty()) return;
        String sql = "INSERT INTO energy_readings (" + ENERGY_COLUMNS + ") VALUES (?, ?, ?, ?)";
        inTransaction("appendEnergyReadings", c -> {
            try (PreparedStatement st = c.prepareStatement(sql)) {
                for (EnergyReading r : readings) {
                    st.setLong(1, r.timestamp().toEpochMilli());
                    st.setString(2, r.deviceId());
                    st.setString(3, r.phase());
                    st.setDouble(4, r.totalKwh());
                    st.addBatch();
                }
                st.executeBatch();
            }
            return null;
        });
    }

    // ==================== read path ====================

    public Optional<Reading> latestReading(String deviceId) {
        String sql = "SELECT " + READING_COLUMNS + " FROM readings WHERE device_id = ? ORDER BY ts DESC LIMIT 1";
        try (Connection c = db.getConnection(); PreparedStatement st = c.prepareStatement(sql)) {
            st.setString(1, deviceId);
            try (ResultSet rs = st.executeQuery()) {
                return rs.next() ? Optional.of(mapReading(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw fail("latestReading", e);
        }
    }

    /** Most recent sample of one phase, or of any phase when {@code phase} is null or ALL. */
    public Optional<EnergyReading> latestEnergy(String deviceId, String phase) {
        boolean anyPhase = isAllPhases(phase);
        String sql = "SELECT " + ENERGY_COLUMNS + " FROM energy_readings WHERE device_id = ?"
                + (anyPhase ? "" : " AND phase = ?")
                + " ORDER BY ts DESC LIMIT 1";
        try (Connection c = db.getConnection(); PreparedStatement st = c.prepareStatement(sql)) {
            st.setString(1, deviceId);
            if (!anyPhase) st.setString(2, phase);
            try (ResultSet rs = st.executeQuery()) {
                return rs.next() ? Optional.of(mapEnergy(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw fail("latestEnergy", e);
        }
    }

    public long countReadings(String deviceId, Instant from, Instant to) {
        String sql = "SELECT COUNT(*) FROM readings WHERE device_id = ? AND ts >= ? AND ts < ?";
        try (Connection c = db.getConnection(); PreparedStatement st = c.prepareStatement(sql)) {
            st.setString(1, deviceId);
            st.setLong(2, from.toEpochMilli());
            st.setLong(3, to.toEpochMilli());
            try (ResultSet rs = st.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        } catch (SQLException e) {
            throw fail("countReadings", e);
        }
    }

    public long countEnergy(String deviceId, String phase, Instant from, Instant to) {
        boolean anyPhase = isAllPhases(phase);
        String sql = "SELECT COUNT(*) FROM energy_readings WHERE device_id = ?"
                + (anyPhase ? "" : " AND phase = ?")
                + " AND ts >= ? AND ts <= ?";
        try (Connection c = db.getConnection(); PreparedStatement st = c.prepareStatement(sql)) {
            int i = 1;
            st.setString(i++, deviceId);
            if (!anyPhase) st.setString(i++, phase);
            st.setLong(i++, from.toEpochMilli());
            st.setLong(i, to.toEpochMilli());
            try (ResultSet rs = st.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        } catch (SQLException e) {
            throw fail("countEnergy", e);
        }
    }

    /** Raw readings in [from, to); {@code limit} null means unbounded. */
    public List<Reading> scanReadings(String deviceId, Instant from, Instant to, Integer limit, ScanOrder order) {
        List<Reading> out = new ArrayList<>();
        streamReadings(deviceId, from, to, limit, order, out::add);
        return out;
    }

    /**
     * Hands every raw reading in [from, to) to {@code sink} without building a
     * list, so callers that fold rows into buckets stay O(buckets) in memory.
     */
    public void streamReadings(String deviceId, Instant from, Instant to, Integer limit,
                               ScanOrder order, Consumer<Reading> sink) {
        String sql = "SELECT " + READING_COLUMNS + " FROM readings WHERE device_id = ? AND ts >= ? AND ts < ?"
                + " ORDER BY ts " + order.name()
                + (limit != null ? " LIMIT ?" : "");
        try (Connection c = db.getConnection(); PreparedStatement st = c.prepareStatement(sql)) {
            st.setFetchSize(STREAM_FETCH_SIZE);
            st.setString(1, deviceId);
            st.setLong(2, from.toEpochMilli());
            st.setLong(3, to.toEpochMilli());
            if (limit != null) st.setInt(4, limit);
            try (ResultSet rs = st.executeQuery()) {
                while (rs.next()) sink.accept(mapReading(rs));
            }
        } catch (SQLException e) {
            throw fail("streamReadings", e);
        }
    }

    /** Energy samples in [from, to], oldest first. */
    public List<EnergyReading> scanEnergy(String deviceId, String phase, Instant from, Instant to) {
        boolean anyPhase = isAllPhases(phase);
        String sql = "SELECT " + ENERGY_COLUMNS + " FROM energy_readings WHERE device_id = ?"
                + (anyPhase ? "" : " AND phase = ?")
                + " AND ts >= ? AND ts <= ? ORDER BY ts ASC, id ASC";
        try (Connection c = db.getConnection(); PreparedStatement st = c.prepareStatement(sql)) {
            st.setFetchSize(STREAM_FETCH_SIZE);
            int i = 1;
            st.setString(i++, deviceId);
            if (!anyPhase) st.setString(i++, phase);
            st.setLong(i++, from.toEpochMilli());
            st.setLong(i, to.toEpochMilli());
            try (ResultSet rs = st.executeQuery()) {
                List<EnergyReading> out = new ArrayList<>();
                while (rs.next()) out.add(mapEnergy(rs));
                return out;
            }
        } catch (SQLException e) {
            throw fail("scanEnergy", e);
        }
    }

    public ReadingStatistics statistics(String deviceId, Instant from, Instant to) {
        String sql = """
                SELECT COUNT(*), AVG(voltage_rms), MIN(voltage_rms), MAX(voltage_rms),
                       AVG(current_rms), MAX(current_rms), AVG(active_power), MAX(active_power),
                       SUM(active_power) / 3600000.0
                FROM readings WHERE device_id = ? AND ts >= ? AND ts < ?""";
        try (Connection c = db.getConnection(); PreparedStatement st = c.prepareStatement(sql)) {
            st.setString(1, deviceId);
            st.setLong(2, from.toEpochMilli());
            st.setLong(3, to.toEpochMilli());
            try (ResultSet rs = st.executeQuery()) {
                rs.next();
                // aggregates over zero rows come back as NULL, which getDouble maps to 0.0
                return new ReadingStatistics(deviceId, from, to,
                        rs.getLong(1), rs.getDouble(2), rs.getDouble(3), rs.getDouble(4),
                        rs.getDouble(5), rs.getDouble(6), rs.getDouble(7), rs.getDouble(8),
                        rs.getDouble(9));
            }
        } catch (SQLException e) {
            throw fail("statistics", e);
        }
    }

    // ==================== maintenance ====================

    /** Truncating checkpoint: folds the write-ahead log back into the database file. */
    public void checkpoint() {
        try (Connection c = db.getConnection(); Statement st = c.createStatement()) {
            st.execute("PRAGMA wal_checkpoint(TRUNCATE)");
            log.debug("wal_checkpoint done");
        } catch (SQLException e) {
            throw fail("checkpoint", e);
        }
    }

    /** Rebuilds the database file so pages freed by deletes go back to the volume. */
    public void vacuum() {
        try (Connection c = db.getConnection(); Statement st = c.createStatement()) {
            st.execute("VACUUM");
            log.info("store_vacuum done size={}B", fileSize(db.path()));
        } catch (SQLException e) {
            throw fail("vacuum", e);
        }
    }

    public StoreStats stats() {
        long free = disk.freeBytes();
        long total = disk.totalBytes();
        try (Connection c = db.getConnection(); Statement st = c.createStatement()) {
            long readings;
            long energy;
            Instant oldest = null;
            Instant newest = null;
            try (ResultSet rs = st.executeQuery("SELECT COUNT(*), MIN(ts), MAX(ts) FROM readings")) {
                rs.next();
                readings = rs.getLong(1);
                long min = rs.getLong(2);
                if (!rs.wasNull()) oldest = Instant.ofEpochMilli(min);
                long max = rs.getLong(3);
                if (!rs.wasNull()) newest = Instant.ofEpochMilli(max);
            }
            try (ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM energy_readings")) {
                rs.next();
                energy = rs.getLong(1);
            }
            return StoreStats.builder()
                    .sizeBytes(fileSize(db.path()))
                    .logSizeBytes(fileSize(db.logPath()))
                    .readingCount(readings)
                    .energyCount(energy)
                    .oldest(oldest)
                    .newest(newest)
                    .diskFreeBytes(free)
                    .diskTotalBytes(total)
                    .diskUsedPct(total <= 0 ? 0.0 : 100.0 * (total - free) / total)
                    .build();
        } catch (SQLException e) {
            throw fail("stats", e);
        }
    }

    public long logSizeBytes() {
        return fileSize(db.logPath());
    }

    /** Oldest timestamp across both tables. */
    public Optional<Instant> oldestTimestamp() {
        String sql = "SELECT MIN(m) FROM (SELECT MIN(ts) AS m FROM readings UNION ALL SELECT MIN(ts) FROM energy_readings)";
        try (Connection c = db.getConnection();
             PreparedStatement st = c.prepareStatement(sql);
             ResultSet rs = st.executeQuery()) {
            rs.next();
            long v = rs.getLong(1);
            return rs.wasNull() ? Optional.empty() : Optional.of(Instant.ofEpochMilli(v));
        } catch (SQLException e) {
            throw fail("oldestTimestamp", e);
        }
    }

    /** Deletes every reading and energy sample strictly older than {@code cutoff}. */
    public long deleteOlderThan(Instant cutoff) {
        long deleted = inTransaction("deleteOlderThan", c -> {
            long n = 0;
            for (String table : new String[]{"readings", "energy_readings"}) {
                try (PreparedStatement st = c.prepareStatement("DELETE FROM " + table + " WHERE ts < ?")) {
                    st.setLong(1, cutoff.toEpochMilli());
                    n += st.executeUpdate();
                }
            }
            return n;
        });
        log.info("store_delete_older_than cutoff={} deleted={}", cutoff, deleted);
        return deleted;
    }

    /**
     * Replaces every (device, hour) group older than {@code cutoff} that holds
     * more than one reading with a single row of hourly means stamped at the
     * start of the hour. The cutoff is floored to the hour so no group is split.
     * Inserting the means and deleting the raw rows happen in one transaction.
     */
    public CompactionResult compactReadingsOlderThan(Instant cutoff) {
        long cut = Math.floorDiv(cutoff.toEpochMilli(), HOUR_MS) * HOUR_MS;
        CompactionResult result = inTransaction("compactReadings", c -> {
            long maxId;
            try (PreparedStatement st = c.prepareStatement("SELECT COALESCE(MAX(id), 0) FROM readings");
                 ResultSet rs = st.executeQuery()) {
                rs.next();
                maxId = rs.getLong(1);
            }

            long inserted;
            String insert = "INSERT INTO readings (" + READING_COLUMNS + ") "
                    + "SELECT (ts / " + HOUR_MS + ") * " + HOUR_MS + ", device_id, AVG(voltage_rms), AVG(current_rms), "
                    + "AVG(active_power), AVG(reactive_power), AVG(apparent_power), AVG(power_factor), AVG(frequency) "
                    + "FROM readings WHERE ts < ? AND id <= ? "
                    + "GROUP BY device_id, ts / " + HOUR_MS + " HAVING COUNT(*) > 1";
            try (PreparedStatement st = c.prepareStatement(insert)) {
                st.setLong(1, cut);
                st.setLong(2, maxId);
                inserted = st.executeUpdate();
            }
            if (inserted == 0) return CompactionResult.NONE;

            long deleted;
            String delete = "DELETE FROM readings WHERE id <= ? AND ts < ? AND EXISTS ("
                    + "SELECT 1 FROM readings agg WHERE agg.id > ? AND agg.device_id = readings.device_id "
                    + "AND agg.ts = (readings.ts / " + HOUR_MS + ") * " + HOUR_MS + ")";
            try (PreparedStatement st = c.prepareStatement(delete)) {
                st.setLong(1, maxId);
                st.setLong(2, cut);
                st.setLong(3, maxId);
                deleted = st.executeUpdate();
            }
            return new CompactionResult(inserted, deleted);
        });
        log.info("store_compact_readings cutoff={} inserted={} deleted={}",
                Instant.ofEpochMilli(cut), result.inserted(), result.deleted());
        return result;
    }

    /**
     * Thins energy samples older than {@code cutoff} to the first and last sample
     * of each (device, phase, hour). Averaging a counter would be meaningless;
     * keeping both ends preserves every hourly delta.
     */
    public CompactionResult compactEnergyOlderThan(Instant cutoff) {
        long cut = Math.floorDiv(cutoff.toEpochMilli(), HOUR_MS) * HOUR_MS;
        String sql = "DELETE FROM energy_readings WHERE ts < ? AND id NOT IN ("
                + "SELECT id FROM (SELECT id, "
                + "ROW_NUMBER() OVER (PARTITION BY device_id, phase, ts / " + HOUR_MS + " ORDER BY ts, id) AS rn_first, "
                + "ROW_NUMBER() OVER (PARTITION BY device_id, phase, ts / " + HOUR_MS + " ORDER BY ts DESC, id DESC) AS rn_last "
                + "FROM energy_readings WHERE ts < ?) WHERE rn_first = 1 OR rn_last = 1)";
        long deleted = inTransaction("compactEnergy", c -> {
            try (PreparedStatement st = c.prepareStatement(sql)) {
                st.setLong(1, cut);
                st.setLong(2, cut);
                return (long) st.executeUpdate();
            }
        });
        log.info("store_compact_energy cutoff={} deleted={}", Instant.ofEpochMilli(cut), deleted);
        return new CompactionResult(0, deleted);
    }

    // ==================== helpers ====================

    @FunctionalInterface
    private interface TxWork<T> {
        T apply(Connection c) throws SQLException;
    }

    private <T> T inTransaction(String op, TxWork<T> work) {
        try (Connection c = db.getConnection()) {
            c.setAutoCommit(false);
            try {
                T result = work.apply(c);
                c.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                rollback(c, op);
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw fail(op, e);
        }
    }

    private void rollback(Connection c, String op) {
        try {
            c.rollback();
        } catch (SQLException e) {
            log.warn("store_rollback_failed op={} err={}", op, e.getMessage());
        }
    }

    private static boolean isAllPhases(String phase) {
        return phase == null || phase.isBlank() || EnergyReading.ALL_PHASES.equalsIgnoreCase(phase);
    }

    private static long fileSize(Path p) {
        try {
            return Files.exists(p) ? Files.size(p) : 0L;
        } catch (IOException e) {
            throw new StoreException("Cannot stat " + p, e);
        }
    }

    private static Reading mapReading(ResultSet rs) throws SQLException {
        return new Reading(
                Instant.ofEpochMilli(rs.getLong("ts")),
                rs.getString("device_id"),
                rs.getDouble("voltage_rms"),
                rs.getDouble("current_rms"),
                rs.getDouble("active_power"),
                rs.getDouble("reactive_power"),
                rs.getDouble("apparent_power"),
                rs.getDouble("power_factor"),
                rs.getDouble("frequency"));
    }

    private static EnergyReading mapEnergy(ResultSet rs) throws SQLException {
        return new EnergyReading(
                Instant.ofEpochMilli(rs.getLong("ts")),
                rs.getString("device_id"),
                rs.getString("phase"),
                rs.getDouble("total_kwh"));
    }

    private static Device mapDevice(ResultSet rs) throws SQLException {
        return Device.builder()
                .deviceId(rs.getString("device_id"))
                .address(rs.getString("address"))
                .name(rs.getString("name"))
                .location(rs.getString("location"))
                .enabled(rs.getInt("enabled") != 0)
                .pollInterval(Duration.ofMillis(rs.getLong("poll_interval_ms")))
                .energyPollInterval(Duration.ofMillis(rs.getLong("energy_poll_interval_ms")))
                .build();
    }

    private static StoreException fail(String op, SQLException e) {
        return new StoreException("Store operation failed: " + op + " (" + e.getMessage() + ")", e);
    }
}
