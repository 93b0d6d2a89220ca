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

package dev.mars.ferry.controller.observability;

import dev.mars.ferry.core.FailureCategory;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * OpenTelemetry metrics for the orchestrator.
 *
 * <p>Provides the following metrics:
 * <ul>
 *   <li>ferry.transfers.triggered (counter) - Transfers created and dispatched</li>
 *   <li>ferry.transfers.verified (counter) - Transfers that passed verification</li>
 *   <li>ferry.transfers.failed (counter) - Transfers marked FAILED, by category</li>
 *   <li>ferry.commands.dispatch_failures (counter) - Commands the channel rejected</li>
 *   <li>ferry.events.discarded (counter) - Events for unknown or finished transfers</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public class OrchestratorMetrics {

    private static final Logger logger = LoggerFactory.getLogger(OrchestratorMetrics.class);
    private static final String METER_NAME = "ferry-controller";

    private static final AttributeKey<String> CATEGORY_KEY = AttributeKey.stringKey("category");
    private static final AttributeKey<String> AGENT_ID_KEY = AttributeKey.stringKey("agent.id");
    private static final AttributeKey<String> REASON_KEY = AttributeKey.stringKey("reason");

    private final LongCounter triggered;
    private final LongCounter verified;
    private final LongCounter failed;
    private final LongCounter dispatchFailures;
    private final LongCounter eventsDiscarded;

    public OrchestratorMetrics() {
        Meter meter = GlobalOpenTelemetry.getMeter(METER_NAME);

        triggered = meter.counterBuilder("ferry.transfers.triggered")
                .setDescription("Transfers created and dispatched")
                .setUnit("1")
                .build();

        verified = meter.counterBuilder("ferry.transfers.verified")
                .setDescription("Transfers that passed verification")
                .setUnit("1")
                .build();

        failed = meter.counterBuilder("ferry.transfers.failed")
                .setDescription("Transfers marked failed")
                .setUnit("1")
                .build();

        dispatchFailures = meter.counterBuilder("ferry.commands.dispatch_failures")
                .setDescription("Commands the channel could not deliver")
                .setUnit("1")
                .build();

        eventsDiscarded = meter.counterBuilder("ferry.events.discarded")
                .setDescription("Events ignored for unknown or finished transfers")
                .setUnit("1")
                .build();

        logger.info("OrchestratorMetrics initialized");
    }

    public void recordTriggered(String agentId) {
        triggered.add(1, Attributes.of(AGENT_ID_KEY, agentId));
    }

    public void recordVerified() {
        verified.add(1);
    }

    public void recordFailed(FailureCategory category) {
        failed.add(1, Attributes.of(CATEGORY_KEY, category.name()));
    }

    public void recordDispatchFailure(String agentId) {
        dispatchFailures.add(1, Attributes.of(AGENT_ID_KEY, agentId));
    }

    /**
     * @param reason "unknown" or "terminal"
     */
    public void recordEventDiscarded(String reason) {
        eventsDiscarded.add(1, Attributes.of(REASON_KEY, reason));
    }
}
