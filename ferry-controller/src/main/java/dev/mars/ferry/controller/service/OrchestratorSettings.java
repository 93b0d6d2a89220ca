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

package dev.mars.ferry.controller.service;

import dev.mars.ferry.controller.config.AppConfig;

import java.time.Duration;
import java.util.Objects;

/**
 * Credential lifetimes used by the {@link Orchestrator}.
 *
 * @param writeTtl lifetime of the write credential sent to the agent
 * @param readTtl  lifetime of each read credential handed out for a verified artifact
 */
public record OrchestratorSettings(Duration writeTtl, Duration readTtl) {

    public static final Duration DEFAULT_WRITE_TTL = Duration.ofSeconds(900);
    public static final Duration DEFAULT_READ_TTL = Duration.ofSeconds(3600);

    public OrchestratorSettings {
        Objects.requireNonNull(writeTtl, "writeTtl cannot be null");
        Objects.requireNonNull(readTtl, "readTtl cannot be null");
        if (writeTtl.isZero() || writeTtl.isNegative() || readTtl.isZero() || readTtl.isNegative()) {
            throw new IllegalArgumentException("Credential TTLs must be positive");
        }
    }

    public static OrchestratorSettings defaults() {
        return new OrchestratorSettings(DEFAULT_WRITE_TTL, DEFAULT_READ_TTL);
    }

    public static OrchestratorSettings from(AppConfig config) {
        return new OrchestratorSettings(Duration.ofSeconds(config.getWriteTtlSeconds()),
                Duration.ofSeconds(config.getReadTtlSeconds()));
    }
}
