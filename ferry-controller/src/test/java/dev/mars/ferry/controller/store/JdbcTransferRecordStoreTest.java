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

package dev.mars.ferry.controller.store;

import dev.mars.ferry.controller.service.MutableClock;
import dev.mars.ferry.core.FailureCategory;
import dev.mars.ferry.core.FailureReason;
import dev.mars.ferry.core.TransferRecord;
import dev.mars.ferry.core.TransferState;
import dev.mars.ferry.core.exceptions.InvalidTransitionException;
import dev.mars.ferry.core.exceptions.RecordStoreException;
import com.zaxxer.hikari.HikariDataSource;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("JdbcTransferRecordStore")
class JdbcTransferRecordStoreTest {

    private static final Instant T0 = Instant.parse("2026-03-02T10:00:00.123456789Z");

    private MutableClock clock;
    private HikariDataSource dataSource;
    private JdbcTransferRecordStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        String url = "jdbc:h2:mem:ferry-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1";
        dataSource = JdbcTransferRecordStore.createDataSource(url, "sa", "", 4);
        store = new JdbcTransferRecordStore(dataSource, clock);
        store.initializeSchema();
    }

    @AfterEach
    void tearDown() {
        dataSource.close();
    }

    private static TransferRecord pending(String id, String agentId, Instant createdAt) {
        return TransferRecord.builder()
                .id(id)
                .agentId(agentId)
                .objectKey(agentId + "/" + id + "-report.pdf")
                .displayName("Report.pdf")
                .status(TransferState.PENDING)
                .credentialExpiry(createdAt.plusSeconds(900))
                .meta(Map.of("requestedBy", "ops"))
                .createdAt(createdAt)
                .updatedAt(createdAt)
                .build();
    }

    @Nested
    @DisplayName("create and get")
    class CreateAndGet {

        @Test
        void recordSurvivesRoundTripThroughDatabase() {
            TransferRecord record = pending("t-1", "agent-1", T0);
            store.create(record);

            assertThat(store.get("t-1")).contains(record);
            assertThat(store.get("missing")).isEmpty();
        }

        @Test
        void duplicateIdIsRejected() {
            store.create(pending("t-1", "agent-1", T0));

            assertThatThrownBy(() -> store.create(pending("t-1", "agent-2", T0)))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("t-1");
        }

        @Test
        void schemaInitializationIsRepeatable() {
            store.create(pending("t-1", "agent-1", T0));

            store.initializeSchema();

            assertThat(store.get("t-1")).isPresent();
        }

        @Test
        void unreachableDatabaseRaisesRecordStoreException() {
            JdbcDataSource unreachable = new JdbcDataSource();
            unreachable.setURL("jdbc:h2:tcp://localhost:1/nothing");
            JdbcTransferRecordStore broken = new JdbcTransferRecordStore(unreachable, clock);

            assertThatThrownBy(() -> broken.get("t-1")).isInstanceOf(RecordStoreException.class);
        }
    }

    @Nested
    @DisplayName("update")
    class Update {

        @Test
        void appliesTransitionFieldsAndBumpsUpdatedAt() throws Exception {
            store.create(pending("t-1", "agent-1", T0));
            clock.advance(Duration.ofSeconds(42));

            TransferRecord uploaded = store.update("t-1", TransferState.UPLOADED,
                    b -> b.size(104857600L).digest("ab".repeat(32))).orElseThrow();

            assertThat(uploaded.getStatus()).isEqualTo(TransferState.UPLOADED);
            assertThat(uploaded.getSize()).contains(104857600L);
            assertThat(uploaded.getUpdatedAt()).isEqualTo(T0.plusSeconds(42));
            assertThat(uploaded.getCreatedAt()).isEqualTo(T0);
            assertThat(store.get("t-1")).contains(uploaded);
        }

        @Test
        void failureReasonIsPersisted() throws Exception {
            store.create(pending("t-1", "agent-1", T0));

            store.update("t-1", TransferState.FAILED,
                    b -> b.failureReason(FailureReason.sizeMismatch(10, 11)));

            assertThat(store.get("t-1").flatMap(TransferRecord::getFailureReason))
                    .contains(FailureReason.of(FailureCategory.SIZE_MISMATCH,
                            "size mismatch: expected 10 bytes, store has 11 bytes"));
        }

        @Test
        void identityFieldsCannotBeChanged() throws Exception {
            store.create(pending("t-1", "agent-1", T0));

            TransferRecord updated = store.update("t-1", TransferState.UPLOADED,
                    b -> b.id("other").agentId("agent-2").objectKey("x")).orElseThrow();

            assertThat(updated.getId()).isEqualTo("t-1");
            assertThat(updated.getAgentId()).isEqualTo("agent-1");
            assertThat(updated.getObjectKey()).isEqualTo("agent-1/t-1-report.pdf");
        }

        @Test
        void illegalTransitionLeavesRecordUntouched() throws Exception {
            store.create(pending("t-1", "agent-1", T0));
            store.update("t-1", TransferState.FAILED, b -> b.failureReason(FailureReason.of(FailureCategory.CREDENTIAL_EXPIRED)));
            TransferRecord failed = store.get("t-1").orElseThrow();

            assertThatThrownBy(() -> store.update("t-1", TransferState.VERIFIED, null))
                    .isInstanceOf(InvalidTransitionException.class);
            assertThat(store.get("t-1")).contains(failed);
        }

        @Test
        void unknownIdYieldsEmpty() throws Exception {
            assertThat(store.update("missing", TransferState.UPLOADED, null)).isEmpty();
        }

        @Test
        void concurrentTransitionsFromPendingHaveOneWinner() throws Exception {
            store.create(pending("t-1", "agent-1", T0));
            AtomicInteger winners = new AtomicInteger();
            AtomicInteger rejected = new AtomicInteger();

            ExecutorService pool = Executors.newFixedThreadPool(4);
            try {
                List<Future<?>> futures = new java.util.ArrayList<>();
                for (TransferState target : List.of(TransferState.UPLOADED, TransferState.FAILED,
                        TransferState.UPLOADED, TransferState.FAILED)) {
                    futures.add(pool.submit(() -> {
                        try {
                            store.update("t-1", target, b -> b.failureReason(
                                    target == TransferState.FAILED ? FailureReason.of(FailureCategory.AGENT_REPORTED) : null));
                            winners.incrementAndGet();
                        } catch (InvalidTransitionException e) {
                            rejected.incrementAndGet();
                        }
                        return null;
                    }));
                }
                for (Future<?> future : futures) {
                    future.get(10, TimeUnit.SECONDS);
                }
            } finally {
                pool.shutdownNow();
            }

            TransferState finalState = store.get("t-1").orElseThrow().getStatus();
            assertThat(finalState).isIn(TransferState.UPLOADED, TransferState.FAILED);
            assertThat(winners.get() + rejected.get()).isEqualTo(4);
            assertThat(winners.get()).isBetween(1, 2);
        }
    }

    @Nested
    @DisplayName("queries")
    class Queries {

        @Test
        void listByAgentIsNewestFirst() {
            store.create(pending("t-1", "agent-1", T0));
            store.create(pending("t-2", "agent-1", T0.plusSeconds(10)));
            store.create(pending("t-3", "agent-2", T0.plusSeconds(20)));

            assertThat(store.listByAgent("agent-1")).extracting(TransferRecord::getId).containsExactly("t-2", "t-1");
            assertThat(store.listByAgent("agent-9")).isEmpty();
        }

        @Test
        void listByStatusFiltersOnStatus() throws Exception {
            store.create(pending("t-1", "agent-1", T0));
            store.create(pending("t-2", "agent-1", T0.plusSeconds(10)));
            store.update("t-2", TransferState.UPLOADED, null);

            assertThat(store.listByStatus(TransferState.PENDING)).extracting(TransferRecord::getId).containsExactly("t-1");
            assertThat(store.listByStatus(TransferState.UPLOADED)).extracting(TransferRecord::getId).containsExactly("t-2");
            assertThat(store.listByStatus(TransferState.VERIFIED)).isEmpty();
        }

        @Test
        void listByStatusIsNewestFirst() {
            store.create(pending("t-1", "agent-1", T0));
            store.create(pending("t-2", "agent-2", T0.plusSeconds(10)));
            store.create(pending("t-0", "agent-3", T0));

            assertThat(store.listByStatus(TransferState.PENDING)).extracting(TransferRecord::getId)
                    .containsExactly("t-2", "t-0", "t-1");
        }
    }
}
