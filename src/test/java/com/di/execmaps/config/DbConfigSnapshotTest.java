package com.di.execmaps.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.DisplayName;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for DbConfigSnapshot record.
 */
@DisplayName("DbConfigSnapshot Tests")
class DbConfigSnapshotTest {

    private static DbConfigSnapshot shard0() {
        return new DbConfigSnapshot(
            "jdbc:postgresql://db0:5432/execmaps",
            "execmaps",
            "s3cret",
            "org.postgresql.Driver",
            10,
            2,
            600000L,
            30000L,
            1800000L
        );
    }

    @Test
    @DisplayName("Should create DbConfigSnapshot with all fields")
    void testCreateDbConfigSnapshot_AllFields() {
        DbConfigSnapshot config = shard0();

        assertEquals("jdbc:postgresql://db0:5432/execmaps", config.jdbcUrl());
        assertEquals("execmaps", config.username());
        assertEquals("s3cret", config.password());
        assertEquals("org.postgresql.Driver", config.driverClassName());
        assertEquals(10, config.maximumPoolSize());
        assertEquals(2, config.minimumIdle());
        assertEquals(600000L, config.idleTimeoutMs());
        assertEquals(30000L, config.connectionTimeoutMs());
        assertEquals(1800000L, config.maxLifetimeMs());
    }

    @Test
    @DisplayName("Should be serializable")
    void testSerializable() {
        assertTrue(shard0() instanceof java.io.Serializable);
    }

    @Test
    @DisplayName("Should mask the password in toString")
    void testToStringMasksPassword() {
        String text = shard0().toString();
        assertFalse(text.contains("s3cret"));
        assertTrue(text.contains("password=***"));
        assertTrue(text.contains("jdbc:postgresql://db0:5432/execmaps"));
    }

    @Test
    @DisplayName("Should implement equals and hashCode on all fields")
    void testEquality() {
        assertEquals(shard0(), shard0());
        assertEquals(shard0().hashCode(), shard0().hashCode());
    }
}
