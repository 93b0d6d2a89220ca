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

package dev.mars.ferry.agent.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;
import java.util.regex.Pattern;

/**
 * Centralized configuration loader for the Ferry agent.
 *
 * <p>Loads configuration from ferry-agent.properties with environment variable and
 * system property override support.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public final class AgentConfig {

    private static final Logger logger = LoggerFactory.getLogger(AgentConfig.class);
    private static final String CONFIG_FILE = "ferry-agent.properties";
    private static final Pattern AGENT_ID_PATTERN = Pattern.compile("^[a-zA-Z0-9_-]+$");
    private static volatile AgentConfig instance;

    private final Properties properties;

    private AgentConfig() {
        this(loadProperties());
    }

    /**
     * Creates a configuration over explicit properties. Environment variables and
     * system properties still take precedence.
     */
    public AgentConfig(Properties properties) {
        this.properties = properties;
    }

    /**
     * Gets the process-wide configuration, loading it on first use.
     */
    public static AgentConfig get() {
        if (instance == null) {
            synchronized (AgentConfig.class) {
                if (instance == null) {
                    instance = new AgentConfig();
                }
            }
        }
        return instance;
    }

    // ==================== Agent Identity ====================

    /**
     * Gets the agent ID, deriving one from the hostname when none is configured.
     */
    public String getAgentId() {
        String agentId = getString("ferry.agent.id", "");
        if (agentId.isEmpty()) {
            agentId = deriveAgentIdFromHostname();
            logger.info("Agent ID not configured, derived from hostname: {}", agentId);
        }
        return agentId;
    }

    // ==================== Controller Connection ====================

    public String getControllerUrl() {
        return getString("ferry.agent.controller.url", "http://localhost:8080/api/v1");
    }

    public long getCommandPollIntervalMs() {
        return getLong("ferry.agent.commands.poll-interval-ms", 2000);
    }

    // ==================== Transfer Configuration ====================

    /**
     * The file this agent uploads. A leading {@code ~} is expanded to the user's home.
     */
    public Path getSourcePath() {
        String configured = getString("ferry.agent.source.path", "~/file_to_download.txt");
        if (configured.equals("~") || configured.startsWith("~/")) {
            return Paths.get(System.getProperty("user.home"), configured.substring(1).replaceFirst("^/", ""));
        }
        return Paths.get(configured);
    }

    public int getMaxConcurrentTransfers() {
        return getInt("ferry.agent.transfers.max-concurrent", 4);
    }

    public int getRetryMaxAttempts() {
        return getInt("ferry.agent.retry.max-attempts", 5);
    }

    public long getRetryBaseDelayMs() {
        return getLong("ferry.agent.retry.base-delay-ms", 1000);
    }

    public int getHttpConnectTimeoutMs() {
        return getInt("ferry.agent.http.connect-timeout-ms", 10000);
    }

    public int getHttpReadTimeoutMs() {
        return getInt("ferry.agent.http.read-timeout-ms", 300000);
    }

    // ==================== Core Property Accessors ====================

    /**
     * Gets a string property with layered resolution.
     *
     * <p>Resolution order (highest to lowest priority):
     * <ol>
     *   <li>Environment variable (e.g., FERRY_AGENT_CONTROLLER_URL)</li>
     *   <li>System property (e.g., -Dferry.agent.controller.url=...)</li>
     *   <li>Properties file (ferry-agent.properties)</li>
     *   <li>Default value</li>
     * </ol>
     */
    public String getString(String key, String defaultValue) {
        String envKey = key.toUpperCase().replace('.', '_').replace('-', '_');
        String envValue = System.getenv(envKey);
        if (envValue != null && !envValue.isEmpty()) {
            return envValue;
        }

        String sysProp = System.getProperty(key);
        if (sysProp != null && !sysProp.isEmpty()) {
            return sysProp;
        }

        return properties.getProperty(key, defaultValue);
    }

    /**
     * Validates that required configuration is present and values are sensible.
     * Called during startup to fail fast on misconfiguration.
     *
     * @throws IllegalStateException if required configuration is invalid
     */
    public void validate() {
        String agentId = getAgentId();
        if (!AGENT_ID_PATTERN.matcher(agentId).matches()) {
            throw new IllegalStateException(
                    "Agent ID must match " + AGENT_ID_PATTERN.pattern() + ", got: " + agentId);
        }

        String controllerUrl = getControllerUrl();
        if (!controllerUrl.startsWith("http://") && !controllerUrl.startsWith("https://")) {
            throw new IllegalStateException(
                    "Controller URL must start with http:// or https://, got: " + controllerUrl);
        }

        if (getCommandPollIntervalMs() <= 0) {
            throw new IllegalStateException(
                    "Command poll interval must be positive, got: " + getCommandPollIntervalMs());
        }
        if (getMaxConcurrentTransfers() <= 0) {
            throw new IllegalStateException(
                    "Max concurrent transfers must be positive, got: " + getMaxConcurrentTransfers());
        }
        if (getRetryMaxAttempts() <= 0) {
            throw new IllegalStateException(
                    "Retry max attempts must be positive, got: " + getRetryMaxAttempts());
        }
        if (getRetryBaseDelayMs() < 0) {
            throw new IllegalStateException(
                    "Retry base delay cannot be negative, got: " + getRetryBaseDelayMs());
        }

        logger.info("Agent configuration validated successfully");
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

    // ==================== Private Helpers ====================

    private static Properties loadProperties() {
        Properties properties = new Properties();
        try (InputStream input = AgentConfig.class.getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from {}", CONFIG_FILE);
            } else {
                logger.warn("Configuration file {} not found, using defaults and environment variables", CONFIG_FILE);
            }
        } catch (IOException e) {
            logger.error("Error loading configuration file: {}", e.getMessage());
            logger.debug("Stack trace", e);
        }
        return properties;
    }

    /**
     * Hostnames may contain dots and other characters the agent ID pattern rejects;
     * those are replaced with '-'.
     */
    static String deriveAgentIdFromHostname() {
        String host;
        try {
            host = InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            logger.warn("Could not determine hostname, using fallback agent ID");
            host = String.valueOf(ProcessHandle.current().pid());
        }
        return "agent-" + host.replaceAll("[^a-zA-Z0-9_-]", "-");
    }

    public void logConfiguration() {
        logger.info("=== Ferry Agent Configuration ===");
        logger.info("  Agent ID:             {}", getAgentId());
        logger.info("  Controller URL:       {}", getControllerUrl());
        logger.info("  Source Path:          {}", getSourcePath());
        logger.info("  --- Commands ---");
        logger.info("  Poll Interval:        {}ms", getCommandPollIntervalMs());
        logger.info("  --- Transfer ---");
        logger.info("  Max Concurrent:       {}", getMaxConcurrentTransfers());
        logger.info("  Retry Attempts:       {}", getRetryMaxAttempts());
        logger.info("  Retry Base Delay:     {}ms", getRetryBaseDelayMs());
        logger.info("  Connect Timeout:      {}ms", getHttpConnectTimeoutMs());
        logger.info("  Read Timeout:         {}ms", getHttpReadTimeoutMs());
        logger.info("=================================");
    }
}
