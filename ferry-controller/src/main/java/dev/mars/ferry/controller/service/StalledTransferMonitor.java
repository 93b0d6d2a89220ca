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

import dev.mars.ferry.core.TransferRecord;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;

/**
 * Periodically logs transfers stuck in {@code PENDING}. Nothing is resent; the log lines are
 * the operator's cue to re-trigger.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public class StalledTransferMonitor {

    private static final Logger logger = LoggerFactory.getLogger(StalledTransferMonitor.class);

    private final Vertx vertx;
    private final Orchestrator orchestrator;
    private final long intervalMs;
    private final Duration threshold;

    private long timerId = -1;

    public StalledTransferMonitor(Vertx vertx, Orchestrator orchestrator, long intervalMs, Duration threshold) {
        this.vertx = vertx;
        this.orchestrator = orchestrator;
        this.intervalMs = intervalMs;
        this.threshold = threshold;
    }

    public void start() {
        if (timerId != -1) {
            return;
        }
        timerId = vertx.setPeriodic(intervalMs, id -> check()
                .onFailure(err -> logger.error("Stalled transfer check failed: {}", err.getMessage(), err)));
        logger.info("Stalled transfer monitor started (interval={}ms, threshold={}s)",
                intervalMs, threshold.toSeconds());
    }

    public void stop() {
        if (timerId != -1) {
            vertx.cancelTimer(timerId);
            timerId = -1;
            logger.info("Stalled transfer monitor stopped");
        }
    }

    /**
     * Runs one check and returns the stalled transfers it logged.
     */
    Future<List<TransferRecord>> check() {
        return orchestrator.findStalled(threshold).onSuccess(this::report);
    }

    private void report(List<TransferRecord> stalled) {
        for (TransferRecord record : stalled) {
            logger.warn("Transfer {} for agent {} has been PENDING since {} (credential expires {})",
                    record.getId(), record.getAgentId(), record.getUpdatedAt(),
                    record.getCredentialExpiry().map(Object::toString).orElse("unknown"));
        }
        if (!stalled.isEmpty()) {
            logger.warn("{} stalled transfer(s) older than {}s", stalled.size(), threshold.toSeconds());
        }
    }
}
