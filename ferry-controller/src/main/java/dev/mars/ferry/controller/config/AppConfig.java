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

package dev.mars.ferry.controller.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Centralized configuration for the Ferry controller.
 *
 * <p>Loads configuration from ferry-controller.properties with environment variable override support.
 * Environment variables take precedence and use uppercase with underscores
 * (e.g., ferry.http.port -> FERRY_HTTP_PORT).
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public final class AppConfig {

    private static final Logger logger = LoggerFactory.getLogger(AppConfig.class);
    private static final String CONFIG_FILE = "ferry-controller.properties";
    private static volatile AppConfig instance;

    private final Properties properties;

    private AppConfig() {
        this(loadProperties());
    }

    /**
     * Creates a configuration over explicit properties. Environment variables and
     * system properties still take precedence.
     */
    public AppConfig(Properties properties) {
        this.properties = properties;
    }

    /**
     * Gets the singleton configuration instance.
     */
    public static AppConfig get() {
        if (instance == null) {
            synchronized (AppConfig.class) {
                if (instance == null) {
                    instance = new AppConfig();
                }
            }
        }
        return instance;
    }

    // ==================== HTTP ====================

    public int getHttpPort() {
        return getInt("ferry.http.port", 8080);
    }

    public String getHttpHost() {
        return getString("ferry.http.host", "0.0.0.0");
    }

    // ==================== Credentials ====================

    public long getWriteTtlSeconds() {
        return getLong("ferry.credentials.write-ttl-seconds", 900);
    }

    public long getReadTtlSeconds() {
        return getLong("ferry.credentials.read-ttl-seconds", 3600);
    }

    // ==================== Object Storage ====================

    public String getStorageEndpoint() {
        return getString("ferry.storage.endpoint", "http://localhost:9000");
    }

    /**
     * Endpoint used for read URLs handed to clients. Defaults to the internal endpoint.
     */
    public String getStorageExternalEndpoint() {
        return getString("ferry.storage.external-endpoint", getStorageEndpoint());
    }

    public String getStorageAccessKey() {
        return getString("ferry.storage.access-key", "minioadmin");
    }

    public String getStorageSecretKey() {
        return getString("ferry.storage.secret-key", "minioadmin");
    }

    public String getStorageBucket() {
        return getString("ferry.storage.bucket", "ferry-uploads");
    }

    public String getStorageRegion() {
        return getString("ferry.storage.region", "us-east-1");
    }

    // ==================== Record Store ====================

    /**
     * Either {@code memory} or {@code jdbc}.
     */
    public String getStoreType() {
        return getString("ferry.store.type", "jdbc");
    }

    public String getJdbcUrl() {
        return getString("ferry.store.jdbc.url", "jdbc:h2:./data/ferry");
    }

    public String getJdbcUser() {
        return getString("ferry.store.jdbc.user", "");
    }

    public String getJdbcPassword() {
        return getString("ferry.store.jdbc.password", "");
    }

    public int getJdbcPoolSize() {
        return getInt("ferry.store.jdbc.pool-size", 10);
    }

    // ==================== Commands and Monitoring ====================

    public long getCommandLeaseMs() {
        return getLong("ferry.commands.lease-ms", 30000);
    }

    public long getStalledCheckIntervalMs() {
        return getLong("ferry.monitor.stalled.interval-ms", 60000);
    }

    public long getStalledThresholdSeconds() {
        return getLong("ferry.monitor.stalled.threshold-seconds", getWriteTtlSeconds());
    }

    // ==================== Core Property Accessors ====================

    /**
     * Gets a string property with environment variable and system property override.
     *
     * <p>Resolution order (highest to lowest priority):
     * <ol>
     *   <li>Environment variable (e.g., FERRY_HTTP_PORT)</li>
     *   <li>System property (e.g., -Dferry.http.port=8080)</li>
     *   <li>Properties file (ferry-controller.properties)</li>
     *   <li>Default value</li>
     * </ol>
     *
     * @param key the property key (e.g., "ferry.http.port")
     * @param defaultValue the default value if not found
     * @return the resolved property value
     */
    public String getString(String key, String defaultValue) {
        String envKey = key.toUpperCase().replace('.', '_').replace('-', '_');
        String envValue = System.getenv(envKey);
        if (envValue != null && !envValue.isEmpty()) {
            return envValue;
        }

        String sysValue = System.getProperty(key);
        if (sysValue != null && !sysValue.isEmpty()) {
            return sysValue;
        }

        return properties.getProperty(key, defaultValue);
    }

    public int getInt(String key, int defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid integer value for {}: '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public long getLong(String key, long defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid long value for {}: '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    /**
     * Fails fast on values the controller cannot run with.
     *
     * @throws IllegalStateException if a value is out of range
     */
    public void validate() {
        int port = getHttpPort();
        if (port < 0 || port > 65535) {
            throw new IllegalStateException("HTTP port must be in [0, 65535], got: " + port);
        }
        if (getWriteTtlSeconds() <= 0 || getReadTtlSeconds() <= 0) {
            throw new IllegalStateException("Credential TTLs must be positive, got write="
                    + getWriteTtlSeconds() + "s read=" + getReadTtlSeconds() + "s");
        }
        String storeType = getStoreType();
        if (!"memory".equals(storeType) && !"jdbc".equals(storeType)) {
            throw new IllegalStateException("ferry.store.type must be 'memory' or 'jdbc', got: " + storeType);
        }
        if (getJdbcPoolSize() <= 0) {
            throw new IllegalStateException("ferry.store.jdbc.pool-size must be positive, got: " + getJdbcPoolSize());
        }
        if (getCommandLeaseMs() <= 0 || getStalledCheckIntervalMs() <= 0) {
            throw new IllegalStateException("Lease and monitor intervals must be positive");
        }
        logger.info("Controller configuration validated successfully");
    }

    public void logConfiguration() {
        logger.info("=== Ferry Controller Configuration ===");
        logger.info("  HTTP Host:            {}", getHttpHost());
        logger.info("  HTTP Port:            {}", getHttpPort());
        logger.info("  --- Credentials ---");
        logger.info("  Write TTL:            {}s", getWriteTtlSeconds());
        logger.info("  Read TTL:             {}s", getReadTtlSeconds());
        logger.info("  --- Object Storage ---");
        logger.info("  Endpoint:             {}", getStorageEndpoint());
        logger.info("  External Endpoint:    {}", getStorageExternalEndpoint());
        logger.info("  Bucket:               {}", getStorageBucket());
        logger.info("  Region:               {}", getStorageRegion());
        logger.info("  --- Record Store ---");
        logger.info("  Type:                 {}", getStoreType());
        logger.info("  JDBC URL:             {}", getJdbcUrl());
        logger.info("  JDBC Pool Size:       {}", getJdbcPoolSize());
        logger.info("  --- Commands ---");
        logger.info("  Lease:                {}ms", getCommandLeaseMs());
        logger.info("  Stalled Check:        {}ms", getStalledCheckIntervalMs());
        logger.info("  Stalled Threshold:    {}s", getStalledThresholdSeconds());
        logger.info("======================================");
    }

    // ==================== Private Helpers ====================

    private static Properties loadProperties() {
        Properties properties = new Properties();
        try (InputStream input = AppConfig.class.getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from {}", CONFIG_FILE);
            } else {
                logger.warn("Configuration file {} not found, using defaults", CONFIG_FILE);
            }
        } catch (IOException e) {
            logger.error("Error loading configuration file: {}", e.getMessage());
            logger.trace("Stack trace for configuration load error", e);
        }
        return properties;
    }
}
