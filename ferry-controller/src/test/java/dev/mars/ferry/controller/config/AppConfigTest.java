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

import dev.mars.ferry.controller.service.OrchestratorSettings;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class AppConfigTest {

    @AfterEach
    void clearSystemProperties() {
        System.clearProperty("ferry.http.port");
        System.clearProperty("ferry.credentials.read-ttl-seconds");
    }

    private static AppConfig config(String... keyValues) {
        Properties properties = new Properties();
        for (int i = 0; i < keyValues.length; i += 2) {
            properties.setProperty(keyValues[i], keyValues[i + 1]);
        }
        return new AppConfig(properties);
    }

    @Test
    void singletonLoadsBundledProperties() {
        AppConfig config = AppConfig.get();

        assertSame(config, AppConfig.get());
        assertEquals(900, config.getWriteTtlSeconds());
        assertEquals("ferry-uploads", config.getStorageBucket());
    }

    @Test
    void defaultsApplyWithoutProperties() {
        AppConfig config = config();

        assertEquals(8080, config.getHttpPort());
        assertEquals("0.0.0.0", config.getHttpHost());
        assertEquals(900, config.getWriteTtlSeconds());
        assertEquals(3600, config.getReadTtlSeconds());
        assertEquals("http://localhost:9000", config.getStorageEndpoint());
        assertEquals("jdbc", config.getStoreType());
        assertEquals(30000, config.getCommandLeaseMs());
        assertEquals(config.getWriteTtlSeconds(), config.getStalledThresholdSeconds());
    }

    @Test
    void externalEndpointDefaultsToEndpoint() {
        assertEquals("http://minio:9000",
                config("ferry.storage.endpoint", "http://minio:9000").getStorageExternalEndpoint());
        assertEquals("https://dl.example.com", config("ferry.storage.endpoint", "http://minio:9000",
                "ferry.storage.external-endpoint", "https://dl.example.com").getStorageExternalEndpoint());
    }

    @Test
    void invalidNumberFallsBackToDefault() {
        assertEquals(8080, config("ferry.http.port", "eighty").getHttpPort());
        assertEquals(900, config("ferry.credentials.write-ttl-seconds", "15m").getWriteTtlSeconds());
    }

    @Test
    void systemPropertyOverridesPropertiesFile() {
        System.setProperty("ferry.http.port", "9191");

        assertEquals(9191, config("ferry.http.port", "8181").getHttpPort());
    }

    @Test
    void settingsFollowConfiguredTtls() {
        System.setProperty("ferry.credentials.read-ttl-seconds", "60");

        OrchestratorSettings settings = OrchestratorSettings.from(config("ferry.credentials.write-ttl-seconds", "120"));

        assertEquals(Duration.ofSeconds(120), settings.writeTtl());
        assertEquals(Duration.ofSeconds(60), settings.readTtl());
    }

    @Test
    void validateAcceptsDefaults() {
        assertDoesNotThrow(() -> config().validate());
        assertDoesNotThrow(() -> config("ferry.store.type", "memory", "ferry.http.port", "0").validate());
    }

    @Test
    void validateRejectsBadValues() {
        assertThrows(IllegalStateException.class, () -> config("ferry.http.port", "70000").validate());
        assertThrows(IllegalStateException.class, () -> config("ferry.credentials.write-ttl-seconds", "0").validate());
        assertThrows(IllegalStateException.class, () -> config("ferry.store.type", "redis").validate());
        assertThrows(IllegalStateException.class, () -> config("ferry.commands.lease-ms", "-1").validate());
    }
}
