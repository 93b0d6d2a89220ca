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

import dev.mars.ferry.channel.InitiatorChannel;
import dev.mars.ferry.channel.Subscription;
import dev.mars.ferry.controller.observability.OrchestratorMetrics;
import dev.mars.ferry.core.FailureCategory;
import dev.mars.ferry.core.FailureReason;
import dev.mars.ferry.core.FilenameSanitizer;
import dev.mars.ferry.core.TransferRecord;
import dev.mars.ferry.core.TransferState;
import dev.mars.ferry.core.exceptions.CommandDispatchException;
import dev.mars.ferry.core.exceptions.GatewayException;
import dev.mars.ferry.core.exceptions.InvalidTransitionException;
import dev.mars.ferry.core.message.TransferCommand;
import dev.mars.ferry.core.message.TransferEvent;
import dev.mars.ferry.core.message.UploadCompleteEvent;
import dev.mars.ferry.core.message.UploadFailedEvent;
import dev.mars.ferry.gateway.Credential;
import dev.mars.ferry.gateway.ObjectStoreGateway;
import dev.mars.ferry.store.TransferRecordStore;
import io.vertx.core.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Initiator side of the protocol: creates transfers, dispatches upload commands to agents,
 * verifies reported uploads against the object store and hands out read credentials for
 * verified artifacts.
 *
 * <p>Event handling is idempotent. An event for an unknown transfer, for a transfer that
 * already reached a terminal state, or one whose transition the store rejects is logged
 * and dropped. Verification always ends in {@code VERIFIED} or {@code FAILED}.</p>
 *
 * <p>Commands are never resent. A transfer whose command could not be delivered stays
 * {@code PENDING} and shows up in {@link #findStalled(Duration)}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public class Orchestrator {

    private static final Logger logger = LoggerFactory.getLogger(Orchestrator.class);

    public static final Pattern AGENT_ID_PATTERN = Pattern.compile("^[a-zA-Z0-9_-]+$");

    private final TransferRecordStore store;
    private final StoreExecutor storeExecutor;
    private final ObjectStoreGateway gateway;
    private final InitiatorChannel channel;
    private final OrchestratorSettings settings;
    private final Clock clock;
    private final OrchestratorMetrics metrics;

    public Orchestrator(TransferRecordStore store, StoreExecutor storeExecutor, ObjectStoreGateway gateway,
                        InitiatorChannel channel, OrchestratorSettings settings, Clock clock,
                        OrchestratorMetrics metrics) {
        this.store = Objects.requireNonNull(store, "store cannot be null");
        this.storeExecutor = Objects.requireNonNull(storeExecutor, "storeExecutor cannot be null");
        this.gateway = Objects.requireNonNull(gateway, "gateway cannot be null");
        this.channel = Objects.requireNonNull(channel, "channel cannot be null");
        this.settings = Objects.requireNonNull(settings, "settings cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics cannot be null");
    }

    /**
     * Subscribes {@link #onEvent(TransferEvent)} to the channel's event stream.
     */
    public Subscription start() {
        Subscription subscription = channel.subscribeEvents(this::onEvent);
        logger.info("Orchestrator subscribed to transfer events");
        return subscription;
    }

    // ==================== Trigger ====================

    /**
     * Creates a transfer for {@code agentId} and sends it the upload command.
     *
     * <p>Fails with {@link IllegalArgumentException} for a malformed agent id, with
     * {@link GatewayException} when no write credential could be issued (nothing is stored),
     * and with {@link CommandDispatchException} when the command could not be delivered (the
     * record stays {@code PENDING}).</p>
     *
     * @param agentId     target agent
     * @param displayName name the uploaded file should carry, may be null
     * @param requestMeta opaque request details passed through to the record and the command
     */
    public Future<TransferRecord> trigger(String agentId, String displayName, Map<String, Object> requestMeta) {
        if (agentId == null || !AGENT_ID_PATTERN.matcher(agentId).matches()) {
            return Future.failedFuture(new IllegalArgumentException(
                    "agentId must match " + AGENT_ID_PATTERN.pattern() + ", got: " + agentId));
        }

        String transferId = UUID.randomUUID().toString();
        String sanitizedName = FilenameSanitizer.sanitize(displayName);
        String objectKey = agentId + "/" + transferId + "-" + sanitizedName;
        String recordName = displayName != null && !displayName.isBlank() ? displayName : sanitizedName;

        return issueWriteCredential(objectKey)
                .compose(credential -> storeExecutor.execute(() -> persistPending(transferId, agentId, objectKey,
                                recordName, credential, requestMeta))
                        .compose(record -> {
                            TransferCommand command = new TransferCommand(transferId, objectKey, credential.url(),
                                    credential.expiresAt(), requestMeta);
                            return dispatch(agentId, command).map(v -> record);
                        }))
                .onSuccess(record -> {
                    metrics.recordTriggered(agentId);
                    logger.info("Triggered transfer {} for agent {} (objectKey={}, credential expires {})",
                            transferId, agentId, objectKey, record.getCredentialExpiry().orElse(null));
                });
    }

    private Future<Credential> issueWriteCredential(String objectKey) {
        Future<Credential> issued;
        try {
            issued = gateway.issueWriteCredential(objectKey, settings.writeTtl());
        } catch (RuntimeException e) {
            issued = Future.failedFuture(e);
        }
        return issued.recover(err -> {
            logger.error("Could not issue write credential for {}: {}", objectKey, err.getMessage());
            return Future.failedFuture(err instanceof GatewayException
                    ? err
                    : new GatewayException(objectKey, "Write credential issuance failed", err));
        });
    }

    private TransferRecord persistPending(String transferId, String agentId, String objectKey, String displayName,
                                          Credential credential, Map<String, Object> requestMeta) {
        Instant now = clock.instant();
        TransferRecord record = TransferRecord.builder()
                .id(transferId)
                .agentId(agentId)
                .objectKey(objectKey)
                .displayName(displayName)
                .status(TransferState.PENDING)
                .credentialExpiry(credential.expiresAt())
                .meta(requestMeta)
                .createdAt(now)
                .updatedAt(now)
                .build();
        store.create(record);
        return record;
    }

    private Future<Void> dispatch(String agentId, TransferCommand command) {
        Future<Void> sent;
        try {
            sent = channel.send(agentId, command);
        } catch (RuntimeException e) {
            sent = Future.failedFuture(e);
        }
        return sent.recover(err -> {
            logger.error("Failed to dispatch command for transfer {} to agent {}; record stays PENDING: {}",
                    command.transferId(), agentId, err.getMessage());
            metrics.recordDispatchFailure(agentId);
            return Future.failedFuture(new CommandDispatchException(command.transferId(), agentId, err));
        });
    }

    // ==================== Events ====================

    /**
     * Applies one agent event. The returned future always succeeds.
     */
    public Future<Void> onEvent(TransferEvent event) {
        Future<Void> handled;
        try {
            if (event instanceof UploadCompleteEvent complete) {
                handled = onComplete(complete);
            } else if (event instanceof UploadFailedEvent failed) {
                handled = onFailed(failed);
            } else {
                logger.warn("Ignoring unsupported event type: {}", event == null ? null : event.getClass().getName());
                handled = Future.succeededFuture();
            }
        } catch (RuntimeException e) {
            handled = Future.failedFuture(e);
        }
        return handled.recover(err -> {
            logger.error("Error handling event for transfer {}: {}",
                    event == null ? null : event.transferId(), err.getMessage(), err);
            return Future.succeededFuture();
        });
    }

    private Future<Void> onComplete(UploadCompleteEvent event) {
        String transferId = event.transferId();
        return activeRecord(transferId, "complete")
                .compose(current -> {
                    if (current.isEmpty()) {
                        return Future.succeededFuture(Optional.<TransferRecord>empty());
                    }
                    return transition(transferId, TransferState.UPLOADED,
                            builder -> builder.size(event.size()).digest(event.digest()));
                })
                .compose(uploaded -> {
                    if (uploaded.isEmpty()) {
                        return Future.<Void>succeededFuture();
                    }
                    logger.info("Upload reported complete for transfer {}: size={}, sha256={}",
                            transferId, event.size(), event.digest());
                    return settleUpload(uploaded.get(), event.size());
                });
    }

    /**
     * Moves an {@code UPLOADED} record to {@code VERIFIED} or {@code FAILED}. Anything that goes
     * wrong on the way, including an error while recording the verified state, ends the record as
     * {@code FAILED/VERIFICATION_ERROR}.
     */
    private Future<Void> settleUpload(TransferRecord record, long reportedSize) {
        String transferId = record.getId();
        Future<Optional<FailureReason>> verdict;
        try {
            verdict = verify(record.getObjectKey(), reportedSize);
        } catch (RuntimeException e) {
            verdict = Future.failedFuture(e);
        }
        return verdict
                .compose(failure -> failure.isPresent()
                        ? markFailed(transferId, failure.get())
                        : markVerified(record, reportedSize))
                .recover(err -> {
                    logger.error("Verification error for transfer {}: {}", transferId, err.getMessage());
                    return markFailed(transferId, FailureReason.of(FailureCategory.VERIFICATION_ERROR,
                            "verification error: " + describe(err)));
                });
    }

    /**
     * Reconciles the reported upload with the store. Empty means the upload checks out.
     */
    private Future<Optional<FailureReason>> verify(String objectKey, long reportedSize) {
        return gateway.exists(objectKey).compose(exists -> {
            if (!Boolean.TRUE.equals(exists)) {
                return Future.succeededFuture(Optional.of(FailureReason.of(FailureCategory.OBJECT_MISSING)));
            }
            return gateway.statMetadata(objectKey).map(metadata -> {
                if (metadata.isEmpty()) {
                    return Optional.of(FailureReason.of(FailureCategory.METADATA_UNAVAILABLE));
                }
                long storedSize = metadata.get().size();
                if (storedSize != reportedSize) {
                    return Optional.of(FailureReason.sizeMismatch(reportedSize, storedSize));
                }
                return Optional.<FailureReason>empty();
            });
        });
    }

    private Future<Void> onFailed(UploadFailedEvent event) {
        String transferId = event.transferId();
        return activeRecord(transferId, "failed").compose(current -> current.isEmpty()
                ? Future.<Void>succeededFuture()
                : markFailed(transferId, event.toFailureReason()));
    }

    private Future<Void> markVerified(TransferRecord record, long size) {
        return transition(record.getId(), TransferState.VERIFIED, null).map(verified -> {
            if (verified.isPresent()) {
                metrics.recordVerified();
                logger.info("Transfer {} verified ({} bytes at {})", record.getId(), size, record.getObjectKey());
            }
            return null;
        });
    }

    private Future<Void> markFailed(String transferId, FailureReason reason) {
        return transition(transferId, TransferState.FAILED, builder -> builder.failureReason(reason))
                .map(failed -> {
                    if (failed.isPresent()) {
                        metrics.recordFailed(reason.category());
                        logger.error("Transfer {} failed: {}", transferId, reason);
                    }
                    return null;
                });
    }

    private Future<Optional<TransferRecord>> activeRecord(String transferId, String kind) {
        return storeExecutor.execute(() -> store.get(transferId)).map(record -> {
            if (record.isEmpty()) {
                logger.warn("Received {} event for unknown transfer {}, discarding", kind, transferId);
                metrics.recordEventDiscarded("unknown");
                return Optional.empty();
            }
            if (record.get().isTerminal()) {
                logger.info("Received {} event for transfer {} already {}, discarding",
                        kind, transferId, record.get().getStatus().name());
                metrics.recordEventDiscarded("terminal");
                return Optional.empty();
            }
            return record;
        });
    }

    private Future<Optional<TransferRecord>> transition(String transferId, TransferState target,
                                                        Consumer<TransferRecord.Builder> changes) {
        return storeExecutor.execute(() -> {
            try {
                return store.update(transferId, target, changes);
            } catch (InvalidTransitionException e) {
                logger.debug("Discarding transition for transfer {}: {}", transferId, e.getMessage());
                return Optional.empty();
            }
        });
    }

    private static String describe(Throwable err) {
        return err.getMessage() != null ? err.getMessage() : err.getClass().getSimpleName();
    }

    // ==================== Queries ====================

    public Future<Optional<TransferRecord>> getStatus(String transferId) {
        return storeExecutor.execute(() -> store.get(transferId));
    }

    /**
     * Mints a fresh read credential for a verified transfer. Empty for unknown transfers and
     * for any status other than {@code VERIFIED}.
     */
    public Future<Optional<Credential>> getArtifactUrl(String transferId) {
        return getStatus(transferId).compose(record -> {
            if (record.isEmpty() || record.get().getStatus() != TransferState.VERIFIED) {
                return Future.succeededFuture(Optional.empty());
            }
            TransferRecord verified = record.get();
            return gateway.issueReadCredential(verified.getObjectKey(), settings.readTtl(),
                            verified.getDisplayName().orElse(null))
                    .map(Optional::of);
        });
    }

    public Future<List<TransferRecord>> listTransfers(String agentId) {
        return storeExecutor.execute(() -> store.listByAgent(agentId));
    }

    /**
     * {@code PENDING} transfers not updated for longer than {@code olderThan}, oldest first.
     */
    public Future<List<TransferRecord>> findStalled(Duration olderThan) {
        Instant cutoff = clock.instant().minus(olderThan);
        return storeExecutor.execute(() -> store.listByStatus(TransferState.PENDING).stream()
                .filter(record -> record.getUpdatedAt().isBefore(cutoff))
                .sorted(Comparator.comparing(TransferRecord::getUpdatedAt))
                .collect(Collectors.toList()));
    }

    public OrchestratorSettings getSettings() {
        return settings;
    }
}
