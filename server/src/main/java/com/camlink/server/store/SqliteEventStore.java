/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.server.store;

import com.camlink.common.exception.EventStoreException;
import com.camlink.common.model.DeviceEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * {@link EventStore} on a single SQLite JDBC connection.
 *
 * <p>Only the batch writer uses the store while the pipeline runs; the owning
 * thread uses it for the initial load and for {@link #close()}. Methods are
 * synchronized so that hand-over between those threads is safe.</p>
 */
public class SqliteEventStore implements EventStore {

    private static final Logger log = LoggerFactory.getLogger(SqliteEventStore.class);

    private static final String INSERT_SQL =
            "INSERT INTO events (device_id, timestamp, video_path, viewed, created_at) VALUES (?, ?, ?, ?, ?)";
    private static final String SELECT_ALL_SQL =
            "SELECT device_id, timestamp, video_path, viewed FROM events ORDER BY timestamp DESC, id DESC";
    private static final String MARK_VIEWED_SQL =
            "UPDATE events SET viewed = 1 WHERE device_id = ? AND timestamp = ? AND video_path = ?";

    private final String jdbcUrl;
    private Connection connection;

    private SqliteEventStore(String jdbcUrl, Connection connection) {
        this.jdbcUrl = jdbcUrl;
        this.connection = connection;
    }

    /**
     * Open (creating if needed) the database file and its schema.
     *
     * @throws EventStoreException when the file or schema cannot be set up
     */
    public static SqliteEventStore open(Path dbFile) {
        try {
            Path parent = dbFile.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
        } catch (IOException e) {
            throw new EventStoreException("Cannot create directory for " + dbFile, e);
        }
        return openUrl("jdbc:sqlite:" + dbFile.toAbsolutePath());
    }

    /** In-memory database; contents vanish on close. */
    public static SqliteEventStore inMemory() {
        return openUrl("jdbc:sqlite::memory:");
    }

    private static SqliteEventStore openUrl(String jdbcUrl) {
        try {
            Connection conn = DriverManager.getConnection(jdbcUrl);
            try {
                EventStoreSchema.initialize(conn);
            } catch (SQLException e) {
                conn.close();
                throw e;
            }
            log.info("Event store opened at {}", jdbcUrl);
            return new SqliteEventStore(jdbcUrl, conn);
        } catch (SQLException e) {
            throw new EventStoreException("Cannot open event store " + jdbcUrl, e);
        }
    }

    @Override
    public synchronized boolean append(DeviceEvent event) {
        if (connection == null) {
            log.error("append on closed store: {}", event);
            return false;
        }
        try (PreparedStatement ps = connection.prepareStatement(INSERT_SQL)) {
            ps.setString(1, event.getDeviceId());
            ps.setString(2, event.getTimestamp());
            ps.setString(3, event.getArtifactReference());
            ps.setInt(4, event.isViewed() ? 1 : 0);
            ps.setLong(5, System.currentTimeMillis());
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            log.error("Failed to insert {}: {}", event, e.getMessage());
            return false;
        }
    }

    @Override
    public synchronized List<DeviceEvent> findAllNewestFirst() {
        if (connection == null) return Collections.emptyList();
        List<DeviceEvent> events = new ArrayList<>();
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery(SELECT_ALL_SQL)) {
            while (rs.next()) {
                events.add(new DeviceEvent(
                        rs.getString("device_id"),
                        rs.getString("timestamp"),
                        rs.getString("video_path"),
                        rs.getInt("viewed") != 0));
            }
        } catch (SQLException e) {
            log.error("Failed to load events: {}", e.getMessage());
        }
        return events;
    }

    @Override
    public synchronized boolean markViewed(String deviceId, String timestamp, String artifactReference) {
        if (connection == null) return false;
        try (PreparedStatement ps = connection.prepareStatement(MARK_VIEWED_SQL)) {
            ps.setString(1, deviceId);
            ps.setString(2, timestamp);
            ps.setString(3, artifactReference);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            log.error("Failed to mark viewed {} @ {}: {}", deviceId, timestamp, e.getMessage());
            return false;
        }
    }

    @Override
    public synchronized long count() {
        if (connection == null) return 0;
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM events")) {
            return rs.next() ? rs.getLong(1) : 0;
        } catch (SQLException e) {
            log.error("Failed to count events: {}", e.getMessage());
            return 0;
        }
    }

    @Override
    public synchronized void close() {
        if (connection == null) return;
        try {
            connection.close();
            log.info("Event store closed ({})", jdbcUrl);
        } catch (SQLException e) {
            log.warn("Error closing event store", e);
        } finally {
            connection = null;
        }
    }

    public synchronized boolean isOpen() { return connection != null; }
}
