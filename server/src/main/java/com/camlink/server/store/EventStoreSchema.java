/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.server.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * SQLite schema for the event store. Idempotent; safe to run on every open.
 */
public final class EventStoreSchema {

    private static final Logger log = LoggerFactory.getLogger(EventStoreSchema.class);

    private EventStoreSchema() {}

    public static void initialize(Connection conn) throws SQLException {
        log.debug("Initializing event store schema...");

        try (Statement stmt = conn.createStatement()) {
            stmt.execute("""
                CREATE TABLE IF NOT EXISTS events (
                    id INTEGER PRIMARY KEY AUTOINCREMENT,
                    device_id TEXT NOT NULL,
                    timestamp TEXT NOT NULL,
                    video_path TEXT NOT NULL,
                    viewed INTEGER NOT NULL DEFAULT 0,
                    created_at INTEGER NOT NULL
                )
                """);

            stmt.execute("CREATE INDEX IF NOT EXISTS idx_events_device ON events(device_id)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_events_timestamp ON events(timestamp)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_events_viewed ON events(viewed)");
        }
        log.debug("Event store schema initialized");
    }
}
