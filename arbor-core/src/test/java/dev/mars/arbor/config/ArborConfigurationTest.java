/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.arbor.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Validates defaults, type conversion with fallback, and the system property layer.
 */
class ArborConfigurationTest {

    @AfterEach
    void tearDown() {
        System.clearProperty(ArborConfiguration.BLOCK_SIZE);
        System.clearProperty(ArborConfiguration.RECONNECT_ENABLED);
    }

    // ========== Defaults ==========

    @Test
    void testDefaults() {
        ArborConfiguration config = ArborConfiguration.defaults();

        assertEquals(16384, config.getBlockSize());
        assertEquals("SHA-256", config.getChecksumAlgorithm());
        assertEquals(30000, config.getConnectionTimeoutMs());
        assertEquals(60000, config.getReadTimeoutMs());
        assertTrue(config.isSftpStrictHostKeyChecking());
        assertTrue(config.getSftpKnownHosts().endsWith("/.ssh/known_hosts"));
        assertTrue(config.isFtpPassiveMode());
        assertTrue(config.isReconnectEnabled());
        assertEquals("/proc/self/mounts", config.getLocalMountTable());
    }

    // ========== Explicit properties ==========

    @Test
    void testPropertiesOverrideDefaults() {
        Properties properties = new Properties();
        properties.setProperty(ArborConfiguration.BLOCK_SIZE, "4096");
        properties.setProperty(ArborConfiguration.FTP_PASSIVE_MODE, "false");

        ArborConfiguration config = new ArborConfiguration(properties);

        assertEquals(4096, config.getBlockSize());
        assertFalse(config.isFtpPassiveMode());
        assertEquals("SHA-256", config.getChecksumAlgorithm());
    }

    @Test
    void testMalformedValuesFallBackToDefaults() {
        ArborConfiguration config = ArborConfiguration.defaults();
        config.setProperty(ArborConfiguration.BLOCK_SIZE, "lots");
        config.setProperty(ArborConfiguration.RECONNECT_ENABLED, "maybe");
        config.setProperty(ArborConfiguration.READ_TIMEOUT_MS, " 1500 ");

        assertEquals(16384, config.getBlockSize());
        assertTrue(config.isReconnectEnabled());
        assertEquals(1500, config.getReadTimeoutMs());
    }

    @Test
    void testNonPositiveBlockSizeFallsBack() {
        ArborConfiguration config = ArborConfiguration.defaults();
        config.setProperty(ArborConfiguration.BLOCK_SIZE, "0");

        assertEquals(16384, config.getBlockSize());
    }

    // ========== Generic access ==========

    @Test
    void testGenericPropertyAccess() {
        ArborConfiguration config = ArborConfiguration.defaults();

        assertNull(config.getProperty("arbor.custom"));
        assertEquals("fallback", config.getProperty("arbor.custom", "fallback"));
        config.setProperty("arbor.custom", "set");
        assertEquals("set", config.getProperty("arbor.custom"));
    }

    // ========== System properties ==========

    @Test
    void testSystemPropertiesOverrideEverything() {
        System.setProperty(ArborConfiguration.BLOCK_SIZE, "2048");
        System.setProperty(ArborConfiguration.RECONNECT_ENABLED, "false");

        ArborConfiguration config = new ArborConfiguration();

        assertEquals(2048, config.getBlockSize());
        assertFalse(config.isReconnectEnabled());
    }

    @Test
    void testDefaultsIgnoreSystemProperties() {
        System.setProperty(ArborConfiguration.BLOCK_SIZE, "2048");

        assertEquals(16384, ArborConfiguration.defaults().getBlockSize());
    }
}
