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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Process-local {@link TransferRecordStore}. Per-id atomicity comes from
 * {@link ConcurrentHashMap#compute}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public class InMemoryTransferRecordStore implements TransferRecordStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryTransferRecordStore.class);

    static final Comparator<TransferRecord> NEWEST_FIRST =
            Comparator.comparing(TransferRecord::getCreatedAt).reversed()
                    .thenComparing(TransferRecord::getId);

    private final ConcurrentMap<String, TransferRecord> records = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryTransferRecordStore() {
        this(Clock.systemUTC());
    }

    public InMemoryTransferRecordStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void create(TransferRecord record) {
        TransferRecord existing = records.putIfAbsent(record.getId(), record);
        if (existing != null) {
            throw new IllegalStateException("Transfer record already exists: " + record.getId());
        }
        logger.debug("Created transfer record: id={}, agentId={}, status={}",
                record.getId(), record.getAgentId(), record.getStatus().name());
    }

    @Override
    public Optional<TransferRecord> get(String id) {
        return Optional.ofNullable(records.get(id));
    }

    @Override
    public Optional<TransferRecord> update(String id, TransferState target, Consumer<TransferRecord.Builder> changes)
            throws InvalidTransitionException {
        // compute() cannot throw checked exceptions, so the rejection is carried out of the lambda
        InvalidTransitionException[] rejected = new InvalidTransitionException[1];
        TransferRecord updated = records.computeIfPresent(id, (key, current) -> {
            if (!current.getStatus().canTransitionTo(target)) {
                rejected[0] = new InvalidTransitionException(key, current.getStatus(), target);
                return current;
            }
            return TransferRecordStore.applyTransition(current, target, changes, clock.instant());
        });
        if (rejected[0] != null) {
            throw rejected[0];
        }
        return Optional.ofNullable(updated);
    }

    @Override
    public List<TransferRecord> listByAgent(String agentId) {
        return records.values().stream()
                .filter(r -> r.getAgentId().equals(agentId))
                .sorted(NEWEST_FIRST)
                .collect(Collectors.toList());
    }

    @Override
    public List<TransferRecord> listByStatus(TransferState status) {
        return records.values().stream()
                .filter(r -> r.getStatus() == status)
                .sorted(NEWEST_FIRST)
                .collect(Collectors.toList());
    }
}
