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

package dev.mars.ferry.core;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable orchestration state of one unit of work, from trigger to terminal outcome.
 *
 * <p>A record is created by the orchestrator when a transfer is triggered and is only
 * ever replaced by a new instance through {@link #toBuilder()}; the record store owns
 * the current version. {@code id}, {@code agentId}, {@code objectKey} and
 * {@code createdAt} never change after creation.</p>
 *
 * <h3>Credentials:</h3>
 * <p>The write credential handed to the agent is deliberately not part of this type.
 * Only its expiry instant is kept, so anything that reads a record (status queries,
 * listings, persistence) cannot re-expose the credential.</p>
 *
 * <h3>Usage Example:</h3>
 * <pre>{@code
 * TransferRecord record = TransferRecord.builder()
 *     .id(UUID.randomUUID().toString())
 *     .agentId("agent-1")
 *     .objectKey("agent-1/" + id + "-report.csv")
 *     .displayName("report.csv")
 *     .status(TransferState.PENDING)
 *     .credentialExpiry(now.plusSeconds(900))
 *     .createdAt(now)
 *     .updatedAt(now)
 *     .build();
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @see TransferState
 */
public final class TransferRecord {

    private final String id;
    private final String agentId;
    private final String objectKey;
    private final String displayName;
    private final TransferState status;

    /** Reported upload size, set on the transition into UPLOADED. */
    private final Long size;

    /** Hex SHA-256 reported by the agent, set on the transition into UPLOADED. */
    private final String digest;

    private final Instant credentialExpiry;

    /** Set on the transition into FAILED. */
    private final FailureReason failureReason;

    private final Instant createdAt;
    private final Instant updatedAt;
    private final Map<String, Object> meta;

    private TransferRecord(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Transfer ID cannot be null");
        this.agentId = Objects.requireNonNull(builder.agentId, "Agent ID cannot be null");
        this.objectKey = Objects.requireNonNull(builder.objectKey, "Object key cannot be null");
        this.status = Objects.requireNonNull(builder.status, "Status cannot be null");
        this.createdAt = Objects.requireNonNull(builder.createdAt, "Created time cannot be null");
        this.updatedAt = builder.updatedAt != null ? builder.updatedAt : builder.createdAt;
        if (updatedAt.isBefore(createdAt)) {
            throw new IllegalArgumentException("updatedAt cannot be before createdAt for transfer " + id);
        }
        this.displayName = builder.displayName;
        this.size = builder.size;
        this.digest = builder.digest;
        this.credentialExpiry = builder.credentialExpiry;
        this.failureReason = builder.failureReason;
        this.meta = builder.meta == null || builder.meta.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(builder.meta));
    }

    public String getId() { return id; }

    public String getAgentId() { return agentId; }

    public String getObjectKey() { return objectKey; }

    public Optional<String> getDisplayName() { return Optional.ofNullable(displayName); }

    public TransferState getStatus() { return status; }

    public Optional<Long> getSize() { return Optional.ofNullable(size); }

    public Optional<String> getDigest() { return Optional.ofNullable(digest); }

    public Optional<Instant> getCredentialExpiry() { return Optional.ofNullable(credentialExpiry); }

    public Optional<FailureReason> getFailureReason() { return Optional.ofNullable(failureReason); }

    public Instant getCreatedAt() { return createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }

    /**
     * Opaque request metadata passed through from the trigger call.
     *
     * @return an unmodifiable map, never null
     */
    public Map<String, Object> getMeta() { return meta; }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a builder pre-populated with this record's values.
     */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .agentId(agentId)
                .objectKey(objectKey)
                .displayName(displayName)
                .status(status)
                .size(size)
                .digest(digest)
                .credentialExpiry(credentialExpiry)
                .failureReason(failureReason)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .meta(meta);
    }

    public static class Builder {
        private String id;
        private String agentId;
        private String objectKey;
        private String displayName;
        private TransferState status;
        private Long size;
        private String digest;
        private Instant credentialExpiry;
        private FailureReason failureReason;
        private Instant createdAt;
        private Instant updatedAt;
        private Map<String, Object> meta;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder agentId(String agentId) {
            this.agentId = agentId;
            return this;
        }

        public Builder objectKey(String objectKey) {
            this.objectKey = objectKey;
            return this;
        }

        public Builder displayName(String displayName) {
            this.displayName = displayName;
            return this;
        }

        public Builder status(TransferState status) {
            this.status = status;
            return this;
        }

        public Builder size(Long size) {
            this.size = size;
            return this;
        }

        public Builder digest(String digest) {
            this.digest = digest;
            return this;
        }

        public Builder credentialExpiry(Instant credentialExpiry) {
            this.credentialExpiry = credentialExpiry;
            return this;
        }

        public Builder failureReason(FailureReason failureReason) {
            this.failureReason = failureReason;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder meta(Map<String, Object> meta) {
            this.meta = meta;
            return this;
        }

        public TransferRecord build() {
            return new TransferRecord(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TransferRecord that = (TransferRecord) o;
        return id.equals(that.id)
                && status == that.status
                && updatedAt.equals(that.updatedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, status, updatedAt);
    }

    @Override
    public String toString() {
        return "TransferRecord{" +
                "id='" + id + '\'' +
                ", agentId='" + agentId + '\'' +
                ", objectKey='" + objectKey + '\'' +
                ", status=" + status.name() +
                (failureReason != null ? ", failureReason=" + failureReason : "") +
                '}';
    }
}
