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

package dev.mars.ferry.agent.observability;

import dev.mars.ferry.core.FailureCategory;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * OpenTelemetry metrics for the Ferry agent.
 *
 * Provides these agent-specific metrics:
 * - ferry.agent.uploads.attempts (counter) - Upload attempts, including retries
 * - ferry.agent.uploads.completed (counter) - Transfers that uploaded successfully
 * - ferry.agent.uploads.failed (counter) - Transfers reported as failed, by category
 * - ferry.agent.uploads.bytes.total (counter) - Bytes uploaded by completed transfers
 * - ferry.agent.commands.discarded (counter) - Commands dropped by a guard, by reason
 * - ferry.agent.transfers.active (gauge) - Transfers currently in flight
 *
 * The meters are no-ops until an OpenTelemetry SDK is registered globally.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public class AgentMetrics {

    private static final Logger logger = LoggerFactory.getLogger(AgentMetrics.class);
    private static final String METER_NAME = "ferry-agent";

    private static final AttributeKey<String> AGENT_ID_KEY = AttributeKey.stringKey("agent.id");
    private static final AttributeKey<String> CATEGORY_KEY = AttributeKey.stringKey("category");
    private static final AttributeKey<String> REASON_KEY = AttributeKey.stringKey("reason");

    private final LongCounter uploadAttempts;
    private final LongCounter uploadsCompleted;
    private final LongCounter uploadsFailed;
    private final LongCounter bytesUploaded;
    private final LongCounter commandsDiscarded;

    private final AtomicLong activeTransfers = new AtomicLong(0);
    private final String agentId;
    private final Attributes agentAttributes;

    public AgentMetrics(String agentId) {
        this.agentId = agentId;
        this.agentAttributes = Attributes.of(AGENT_ID_KEY, agentId);

        Meter meter = GlobalOpenTelemetry.getMeter(METER_NAME);

        uploadAttempts = meter.counterBuilder("ferry.agent.uploads.attempts")
                .setDescription("Upload attempts, including retries")
                .setUnit("1")
                .build();

        uploadsCompleted = meter.counterBuilder("ferry.agent.uploads.completed")
                .setDescription("Transfers uploaded successfully")
                .setUnit("1")
                .build();

        uploadsFailed = meter.counterBuilder("ferry.agent.uploads.failed")
                .setDescription("Transfers reported as failed")
                .setUnit("1")
                .build();

        bytesUploaded = meter.counterBuilder("ferry.agent.uploads.bytes.total")
                .setDescription("Bytes uploaded by completed transfers")
                .setUnit("By")
                .build();

        commandsDiscarded = meter.counterBuilder("ferry.agent.commands.discarded")
                .setDescription("Commands dropped by a guard")
                .setUnit("1")
                .build();

        meter.gaugeBuilder("ferry.agent.transfers.active")
                .setDescription("Transfers currently in flight")
                .ofLongs()
                .buildWithCallback(measurement ->
                        measurement.record(activeTransfers.get(), agentAttributes));

        logger.info("AgentMetrics initialized for agent: {}", agentId);
    }

    public void recordTransferStarted() {
        activeTransfers.incrementAndGet();
    }

    public void recordTransferFinished() {
        activeTransfers.decrementAndGet();
    }

    public void recordAttempt() {
        uploadAttempts.add(1, agentAttributes);
    }

    public void recordCompleted(long bytes) {
        uploadsCompleted.add(1, agentAttributes);
        bytesUploaded.add(bytes, agentAttributes);
    }

    public void recordFailed(FailureCategory category) {
        uploadsFailed.add(1, Attributes.builder()
                .put(AGENT_ID_KEY, agentId)
                .put(CATEGORY_KEY, category.name())
                .build());
    }

    /**
     * @param reason short tag for the guard that dropped the command, e.g. "invalid", "duplicate"
     */
    public void recordDiscarded(String reason) {
        commandsDiscarded.add(1, Attributes.builder()
                .put(AGENT_ID_KEY, agentId)
                .put(REASON_KEY, reason)
                .build());
    }

    public long getActiveTransfers() {
        return activeTransfers.get();
    }
}
