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

package dev.mars.ferry.agent.service;

import dev.mars.ferry.agent.observability.AgentMetrics;
import dev.mars.ferry.channel.AgentChannel;
import dev.mars.ferry.core.FailureCategory;
import dev.mars.ferry.core.exceptions.TransferException;
import dev.mars.ferry.core.message.TransferCommand;
import dev.mars.ferry.core.message.TransferEvent;
import dev.mars.ferry.core.message.UploadCompleteEvent;
import dev.mars.ferry.core.message.UploadFailedEvent;
import io.vertx.core.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Agent side of the protocol: turns one upload command into at most one outcome event.
 *
 * <p>Guards, in order, each ending the command with only a log line (or, for expiry, one
 * failed event):</p>
 * <ol>
 *   <li>the command names a transfer id, object key and write credential</li>
 *   <li>no transfer with the same id is already in flight on this runner</li>
 *   <li>the write credential has not expired</li>
 * </ol>
 *
 * <p>After the guards the file is uploaded with the {@link RetryPolicy}. Retry waits are
 * scheduled with the {@link DelayScheduler}, so transfers for different ids proceed
 * independently. Publishing the outcome event is best effort.</p>
 *
 * <p>The in-flight set is local to this runner instance. Two agent processes sharing an
 * agent id can still upload the same transfer concurrently.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public class TransferRunner {

    private static final Logger logger = LoggerFactory.getLogger(TransferRunner.class);

    static final String EXPIRED_REASON = "credential expired";

    private final AgentChannel channel;
    private final TransferUploader uploader;
    private final RetryPolicy retryPolicy;
    private final DelayScheduler scheduler;
    private final Clock clock;
    private final AgentMetrics metrics;

    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    public TransferRunner(AgentChannel channel, TransferUploader uploader, RetryPolicy retryPolicy,
                          DelayScheduler scheduler, Clock clock, AgentMetrics metrics) {
        this.channel = Objects.requireNonNull(channel, "channel cannot be null");
        this.uploader = Objects.requireNonNull(uploader, "uploader cannot be null");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy cannot be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics cannot be null");
    }

    /**
     * Handles one delivered command. The returned future completes once the outcome event
     * (if any) has been handed to the channel; it does not fail for upload failures.
     *
     * @param command    the delivered command
     * @param sourcePath the local file to upload
     */
    public Future<Void> onCommand(TransferCommand command, Path sourcePath) {
        if (command == null || !command.isStructurallyValid()) {
            logger.error("Invalid command received, missing required fields: {}", command);
            metrics.recordDiscarded("invalid");
            return Future.succeededFuture();
        }

        String transferId = command.transferId();
        if (!inFlight.add(transferId)) {
            logger.warn("Transfer {} is already being processed, ignoring duplicate command", transferId);
            metrics.recordDiscarded("duplicate");
            return Future.succeededFuture();
        }
        metrics.recordTransferStarted();

        Future<Void> work;
        try {
            work = process(command, sourcePath);
        } catch (RuntimeException e) {
            work = Future.failedFuture(e);
        }
        return work.andThen(ar -> {
            inFlight.remove(transferId);
            metrics.recordTransferFinished();
            if (ar.failed()) {
                logger.error("Unexpected error while handling transfer {}", transferId, ar.cause());
            }
        });
    }

    /**
     * Whether a transfer with this id is currently being handled.
     */
    public boolean isInFlight(String transferId) {
        return inFlight.contains(transferId);
    }

    private Future<Void> process(TransferCommand command, Path sourcePath) {
        String transferId = command.transferId();

        if (command.isExpiredAt(clock.instant())) {
            logger.error("Write credential expired for transfer {} at {}, not uploading",
                    transferId, command.credentialExpiry());
            metrics.recordFailed(FailureCategory.CREDENTIAL_EXPIRED);
            return publish(new UploadFailedEvent(transferId, command.objectKey(), EXPIRED_REASON,
                    FailureCategory.CREDENTIAL_EXPIRED, clock.instant()));
        }

        logger.info("Starting upload for transfer {} to {}", transferId, command.objectKey());
        return attempt(command, sourcePath, 1).transform(ar -> {
            if (ar.succeeded()) {
                UploadResult result = ar.result();
                logger.info("Upload successful for transfer {}: size={}, sha256={}",
                        transferId, result.bytesSent(), result.digest());
                metrics.recordCompleted(result.bytesSent());
                return publish(new UploadCompleteEvent(transferId, command.objectKey(),
                        result.bytesSent(), result.digest(), clock.instant()));
            }
            String reason = detailOf(ar.cause());
            logger.error("Upload failed for transfer {}: {}", transferId, reason);
            metrics.recordFailed(FailureCategory.TRANSFER_FAILED);
            return publish(new UploadFailedEvent(transferId, command.objectKey(), reason,
                    FailureCategory.TRANSFER_FAILED, clock.instant()));
        });
    }

    private Future<UploadResult> attempt(TransferCommand command, Path sourcePath, int attempt) {
        String transferId = command.transferId();
        logger.debug("Upload attempt {}/{} for transfer {}", attempt, retryPolicy.getMaxAttempts(), transferId);
        metrics.recordAttempt();

        Future<UploadResult> upload;
        try {
            upload = uploader.upload(transferId, sourcePath, command.writeCredential());
        } catch (RuntimeException e) {
            upload = Future.failedFuture(e);
        }

        return upload.recover(err -> {
            logger.warn("Upload attempt {} failed for transfer {}: {}", attempt, transferId, detailOf(err));
            if (!retryPolicy.hasAttemptAfter(attempt)) {
                return Future.failedFuture(new TransferException(transferId,
                        "Upload failed after " + attempt + " attempts: " + detailOf(err), err));
            }
            Duration delay = retryPolicy.delayBeforeAttempt(attempt + 1);
            logger.info("Retrying transfer {} in {}ms", transferId, delay.toMillis());
            return scheduler.delay(delay).compose(v -> attempt(command, sourcePath, attempt + 1));
        });
    }

    private Future<Void> publish(TransferEvent event) {
        Future<Void> sent;
        try {
            sent = channel.broadcastEvent(event);
        } catch (RuntimeException e) {
            sent = Future.failedFuture(e);
        }
        return sent.recover(err -> {
            logger.error("Error publishing {} event for transfer {}: {}",
                    event.getClass().getSimpleName(), event.transferId(), err.getMessage());
            return Future.succeededFuture();
        });
    }

    private static String detailOf(Throwable err) {
        if (err instanceof TransferException) {
            return ((TransferException) err).getDetail();
        }
        return err.getMessage() != null ? err.getMessage() : err.getClass().getSimpleName();
    }
}
