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

package dev.mars.ferry.store;

import dev.mars.ferry.core.TransferRecord;
import dev.mars.ferry.core.TransferState;
import dev.mars.ferry.core.exceptions.InvalidTransitionException;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Keyed store of transfer records, one per unit of work.
 *
 * <p>Every read-modify-write is atomic per record id: two concurrent updates of the same
 * record are applied one after the other, and the second sees the first's result.
 * Implementations never change {@code id}, {@code agentId}, {@code objectKey} or
 * {@code createdAt} once a record exists.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @see InMemoryTransferRecordStore
 */
public interface TransferRecordStore {

    /**
     * Stores a new record.
     *
     * @throws IllegalStateException if a record with the same id already exists
     */
    void create(TransferRecord record);

    Optional<TransferRecord> get(String id);

    /**
     * Moves a record to {@code target}, applying {@code changes} to the fields that come with
     * the transition. {@code updatedAt} is bumped by the store.
     *
     * @param id      transfer id
     * @param target  the state to move to
     * @param changes mutations of the transition's own fields (size, digest, failure reason)
     * @return the stored record after the update, or empty when no record has this id
     * @throws InvalidTransitionException if the record's current state cannot reach {@code target}
     */
    Optional<TransferRecord> update(String id, TransferState target, Consumer<TransferRecord.Builder> changes)
            throws InvalidTransitionException;

    /**
     * All records of one agent, newest {@code createdAt} first, ties ordered by id.
     */
    List<TransferRecord> listByAgent(String agentId);

    /**
     * All records currently in {@code status}, newest {@code createdAt} first, ties ordered by id.
     * Every implementation returns the same order.
     */
    List<TransferRecord> listByStatus(TransferState status);

    /**
     * Applies a transition to a record, restoring the identity fields after {@code changes}
     * ran and keeping {@code updatedAt} from moving backwards.
     */
    static TransferRecord applyTransition(TransferRecord current, TransferState target,
                                          Consumer<TransferRecord.Builder> changes, Instant now) {
        TransferRecord.Builder builder = current.toBuilder();
        if (changes != null) {
            changes.accept(builder);
        }
        Instant updatedAt = now.isAfter(current.getUpdatedAt()) ? now : current.getUpdatedAt();
        return builder
                .id(current.getId())
                .agentId(current.getAgentId())
                .objectKey(current.getObjectKey())
                .createdAt(current.getCreatedAt())
                .status(target)
                .updatedAt(updatedAt)
                .build();
    }
}
