package com.groupdispatch.core.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.sqlite.SQLiteDataSource;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class JdbcDispatchStoreTest extends DispatchStoreContract {

    @TempDir
    Path dataDir;

    private SQLiteDataSource dataSource;

    @Override
    protected DispatchStore createStore() {
        dataSource = new SQLiteDataSource();
        dataSource.setUrl("jdbc:sqlite:" + dataDir.resolve("groupdispatch.db"));
        var jdbc = new JdbcDispatchStore(dataSource, new ObjectMapper());
        jdbc.createTables();
        return jdbc;
    }

    @Test
    @DisplayName("table creation is repeatable and data survives a new store instance")
    void durable() {
        store.setRouterState("last_timestamp", "2026-01-01T00:00:01.000Z");

        var reopened = new JdbcDispatchStore(dataSource, new ObjectMapper());
        reopened.createTables();

        assertEquals("2026-01-01T00:00:01.000Z", reopened.getRouterState("last_timestamp").orElseThrow());
    }

    @Test
    @DisplayName("I/O failures surface as StoreException")
    void failuresAreWrapped() {
        var broken = new SQLiteDataSource();
        broken.setUrl("jdbc:sqlite:" + dataDir.resolve("missing").resolve("nested").resolve("x.db"));
        var jdbc = new JdbcDispatchStore(broken, new ObjectMapper());

        assertThrows(StoreException.class, () -> jdbc.getRouterState("last_timestamp"));
    }
}
