package com.elssolution.powermonitor.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Pooled connections to the SQLite file behind the time-series store.
 *
 * Every connection is opened in WAL mode with foreign keys on and a bounded
 * busy timeout, so a writer contending with a checkpoint waits instead of
 * failing immediately. Explicit transactions start IMMEDIATE (write lock taken
 * up front) which keeps read-then-write transactions from hitting a stale
 * snapshot.
 */
@Slf4j
public final class StoreDataSource implements AutoCloseable {

    private final Path path;
    private final HikariDataSource dataSource;

    public StoreDataSource(Path path, int poolSize, long busyTimeoutMs, String synchronous) {
        this.path = path.toAbsolutePath();
        try {
            Path parent = this.path.getParent();
            if (parent != null) Files.createDirectories(parent);
        } catch (IOException e) {
            throw new StoreException("Cannot create store directory for " + this.path, e);
        }

        var cfg = new HikariConfig();
        cfg.setJdbcUrl("jdbc:sqlite:" + this.path);
        cfg.setPoolName("power-store");
        cfg.setMaximumPoolSize(Math.max(1, poolSize));
        cfg.setAutoCommit(true);
        cfg.addDataSourceProperty("journal_mode", "WAL");
        cfg.addDataSourceProperty("synchronous", synchronous);
        cfg.addDataSourceProperty("busy_timeout", String.valueOf(busyTimeoutMs));
        cfg.addDataSourceProperty("foreign_keys", "true");
        cfg.addDataSourceProperty("transaction_mode", "IMMEDIATE");
        this.dataSource = new HikariDataSource(cfg);
        log.info("store_opened path={} pool={} synchronous={}", this.path, poolSize, synchronous);
    }

    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    /** The main database file. */
    public Path path() {
        return path;
    }

    /** The write-ahead log next to the database file. */
    public Path logPath() {
        return path.resolveSibling(path.getFileName() + "-wal");
    }

    @Override
    public void close() {
        dataSource.close();
        log.info("store_closed path={}", path);
    }
}
