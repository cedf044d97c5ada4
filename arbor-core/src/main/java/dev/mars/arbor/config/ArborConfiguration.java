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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Configuration shared by filesystems, nodes and the reconnecting proxy.
 *
 * <p>Layered: built-in defaults, then the first {@code arbor.properties} found on disk,
 * then one on the classpath, then {@code arbor.*} system properties.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class ArborConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(ArborConfiguration.class);

    public static final String BLOCK_SIZE = "arbor.io.block.size";
    public static final String CHECKSUM_ALGORITHM = "arbor.io.checksum.algorithm";
    public static final String CONNECTION_TIMEOUT_MS = "arbor.network.connection.timeout.ms";
    public static final String READ_TIMEOUT_MS = "arbor.network.read.timeout.ms";
    public static final String SFTP_STRICT_HOST_KEY_CHECKING = "arbor.sftp.strict.host.key.checking";
    public static final String SFTP_KNOWN_HOSTS = "arbor.sftp.known.hosts";
    public static final String FTP_PASSIVE_MODE = "arbor.ftp.passive.mode";
    public static final String RECONNECT_ENABLED = "arbor.reconnect.enabled";
    public static final String LOCAL_MOUNT_TABLE = "arbor.local.mount.table";

    // Default configuration values
    private static final int DEFAULT_BLOCK_SIZE = 16384;
    private static final String DEFAULT_CHECKSUM_ALGORITHM = "SHA-256";
    private static final int DEFAULT_CONNECTION_TIMEOUT_MS = 30000;
    private static final int DEFAULT_READ_TIMEOUT_MS = 60000;
    private static final String DEFAULT_KNOWN_HOSTS = System.getProperty("user.home") + "/.ssh/known_hosts";
    private static final String DEFAULT_MOUNT_TABLE = "/proc/self/mounts";

    private static final String PREFIX = "arbor.";
    private static final String FILE_NAME = "arbor.properties";

    private final Properties properties;

    public ArborConfiguration() {
        this.properties = new Properties();
        loadDefaultConfiguration();
        loadConfigurationFromFile();
        loadConfigurationFromSystemProperties();
    }

    public ArborConfiguration(Properties properties) {
        this.properties = new Properties();
        loadDefaultConfiguration();
        if (properties != null) {
            this.properties.putAll(properties);
        }
    }

    /**
     * Built-in defaults only; ignores files and system properties.
     */
    public static ArborConfiguration defaults() {
        return new ArborConfiguration(null);
    }

    // I/O
    public int getBlockSize() {
        int blockSize = getIntProperty(BLOCK_SIZE, DEFAULT_BLOCK_SIZE);
        if (blockSize <= 0) {
            logger.warn("Block size must be positive, got {}. Using default: {}", blockSize, DEFAULT_BLOCK_SIZE);
            return DEFAULT_BLOCK_SIZE;
        }
        return blockSize;
    }

    public String getChecksumAlgorithm() {
        return getStringProperty(CHECKSUM_ALGORITHM, DEFAULT_CHECKSUM_ALGORITHM);
    }

    // Network
    public int getConnectionTimeoutMs() {
        return getIntProperty(CONNECTION_TIMEOUT_MS, DEFAULT_CONNECTION_TIMEOUT_MS);
    }

    public int getReadTimeoutMs() {
        return getIntProperty(READ_TIMEOUT_MS, DEFAULT_READ_TIMEOUT_MS);
    }

    // Protocols
    public boolean isSftpStrictHostKeyChecking() {
        return getBooleanProperty(SFTP_STRICT_HOST_KEY_CHECKING, true);
    }

    public String getSftpKnownHosts() {
        return getStringProperty(SFTP_KNOWN_HOSTS, DEFAULT_KNOWN_HOSTS);
    }

    public boolean isFtpPassiveMode() {
        return getBooleanProperty(FTP_PASSIVE_MODE, true);
    }

    public boolean isReconnectEnabled() {
        return getBooleanProperty(RECONNECT_ENABLED, true);
    }

    public String getLocalMountTable() {
        return getStringProperty(LOCAL_MOUNT_TABLE, DEFAULT_MOUNT_TABLE);
    }

    // Generic property access
    public String getProperty(String key) {
        return properties.getProperty(key);
    }

    public String getProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    public void setProperty(String key, String value) {
        properties.setProperty(key, value);
    }

    private String getStringProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    private int getIntProperty(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid integer value for property {}: {}. Using default: {}", key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    private boolean getBooleanProperty(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            String trimmed = value.trim();
            if ("true".equalsIgnoreCase(trimmed) || "false".equalsIgnoreCase(trimmed)) {
                return Boolean.parseBoolean(trimmed);
            }
            logger.warn("Invalid boolean value for property {}: {}. Using default: {}", key, value, defaultValue);
        }
        return defaultValue;
    }

    private void loadDefaultConfiguration() {
        properties.setProperty(BLOCK_SIZE, String.valueOf(DEFAULT_BLOCK_SIZE));
        properties.setProperty(CHECKSUM_ALGORITHM, DEFAULT_CHECKSUM_ALGORITHM);
        properties.setProperty(CONNECTION_TIMEOUT_MS, String.valueOf(DEFAULT_CONNECTION_TIMEOUT_MS));
        properties.setProperty(READ_TIMEOUT_MS, String.valueOf(DEFAULT_READ_TIMEOUT_MS));
        properties.setProperty(SFTP_STRICT_HOST_KEY_CHECKING, "true");
        properties.setProperty(SFTP_KNOWN_HOSTS, DEFAULT_KNOWN_HOSTS);
        properties.setProperty(FTP_PASSIVE_MODE, "true");
        properties.setProperty(RECONNECT_ENABLED, "true");
        properties.setProperty(LOCAL_MOUNT_TABLE, DEFAULT_MOUNT_TABLE);
    }

    private void loadConfigurationFromFile() {
        String[] configFiles = {
                FILE_NAME,
                "config/" + FILE_NAME,
                System.getProperty("user.home") + "/.arbor/" + FILE_NAME,
                "/etc/arbor/" + FILE_NAME
        };

        for (String configFile : configFiles) {
            Path configPath = Paths.get(configFile);
            if (Files.exists(configPath) && Files.isReadable(configPath)) {
                try (InputStream input = Files.newInputStream(configPath)) {
                    properties.load(input);
                    logger.info("Loaded configuration from: {}", configPath);
                    break;
                } catch (IOException e) {
                    logger.warn("Failed to load configuration from {}: {}", configPath, e.getMessage());
                }
            }
        }

        try (InputStream input = getClass().getClassLoader().getResourceAsStream(FILE_NAME)) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from classpath");
            }
        } catch (IOException e) {
            logger.warn("Failed to load configuration from classpath: {}", e.getMessage());
        }
    }

    private void loadConfigurationFromSystemProperties() {
        System.getProperties().stringPropertyNames().stream()
                .filter(key -> key.startsWith(PREFIX))
                .forEach(key -> {
                    properties.setProperty(key, System.getProperty(key));
                    logger.debug("Override from system property: {}={}", key, System.getProperty(key));
                });
    }

    @Override
    public String toString() {
        return "ArborConfiguration{" +
                "blockSize=" + getBlockSize() +
                ", checksumAlgorithm='" + getChecksumAlgorithm() + '\'' +
                ", connectionTimeoutMs=" + getConnectionTimeoutMs() +
                ", reconnectEnabled=" + isReconnectEnabled() +
                '}';
    }
}
