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
import dev.mars.ferry.channel.Subscription;
import dev.mars.ferry.core.FailureCategory;
import dev.mars.ferry.core.exceptions.TransferException;
import dev.mars.ferry.core.message.TransferCommand;
import dev.mars.ferry.core.message.TransferEvent;
import dev.mars.ferry.core.message.UploadCompleteEvent;
import dev.mars.ferry.core.message.UploadFailedEvent;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for TransferRunner: guards, retry schedule and the single outcome event.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
@ExtendWith(MockitoExtension.class)
class TransferRunnerTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");
    private static final Path SOURCE = Paths.get("/data/file_to_download.txt");

    @Mock
    private TransferUploader uploader;

    private RecordingChannel channel;
    private RecordingScheduler scheduler;
    private AgentMetrics metrics;
    private TransferRunner runner;

    @BeforeEach
    void setUp() {
        channel = new RecordingChannel();
        scheduler = new RecordingScheduler();
        metrics = new AgentMetrics("test-agent");
        runner = new TransferRunner(channel, uploader, RetryPolicy.defaults(), scheduler,
                Clock.fixed(NOW, ZoneOffset.UTC), metrics);
    }

    private static TransferCommand command(String transferId, Instant expiry) {
        return new TransferCommand(transferId, "uploads/" + transferId + "/report.csv",
                "https://store.example/put?sig=abc", expiry, Map.of());
    }

    private static Future<UploadResult> failure(String transferId, String detail) {
        return Future.failedFuture(new TransferException(transferId, detail));
    }

    @Nested
    @DisplayName("Successful uploads")
    class Success {

        @Test
        @DisplayName("First-attempt success emits one complete event with size and digest")
        void emitsCompleteEvent() {
            when(uploader.upload(eq("t-1"), eq(SOURCE), anyString()))
                    .thenReturn(Future.succeededFuture(new UploadResult(104857600L, "abc123")));

            Future<Void> done = runner.onCommand(command("t-1", NOW.plusSeconds(900)), SOURCE);

            assertThat(done.succeeded()).isTrue();
            assertThat(channel.events).hasSize(1);
            UploadCompleteEvent event = (UploadCompleteEvent) channel.events.get(0);
            assertThat(event.transferId()).isEqualTo("t-1");
            assertThat(event.objectKey()).isEqualTo("uploads/t-1/report.csv");
            assertThat(event.size()).isEqualTo(104857600L);
            assertThat(event.digest()).isEqualTo("abc123");
            assertThat(event.timestamp()).isEqualTo(NOW);
            assertThat(scheduler.delays).isEmpty();
            assertThat(runner.isInFlight("t-1")).isFalse();
        }

        @Test
        @DisplayName("Success on the third attempt waits 1s then 2s")
        void retriesThenSucceeds() {
            when(uploader.upload(anyString(), any(), anyString()))
                    .thenReturn(failure("t-2", "HTTP 503 from object store: busy"))
                    .thenReturn(failure("t-2", "HTTP 503 from object store: busy"))
                    .thenReturn(Future.succeededFuture(new UploadResult(10L, "d")));

            runner.onCommand(command("t-2", null), SOURCE);

            verify(uploader, times(3)).upload(anyString(), any(), anyString());
            assertThat(scheduler.delays).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2));
            assertThat(channel.events).singleElement().isInstanceOf(UploadCompleteEvent.class);
        }

        @Test
        @DisplayName("Success on the last allowed attempt waits 1s, 2s, 4s, 8s and emits only the complete event")
        void succeedsOnFinalAttempt() {
            when(uploader.upload(anyString(), any(), anyString()))
                    .thenReturn(failure("t-11", "HTTP 500 from object store: internal"))
                    .thenReturn(failure("t-11", "Upload I/O error: connection reset"))
                    .thenReturn(failure("t-11", "HTTP 503 from object store: busy"))
                    .thenReturn(failure("t-11", "Upload I/O error: broken pipe"))
                    .thenReturn(Future.succeededFuture(new UploadResult(2048L, "cd".repeat(32))));

            Future<Void> done = runner.onCommand(command("t-11", NOW.plusSeconds(900)), SOURCE);

            assertThat(done.succeeded()).isTrue();
            verify(uploader, times(5)).upload(anyString(), any(), anyString());
            assertThat(scheduler.delays).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2),
                    Duration.ofSeconds(4), Duration.ofSeconds(8));
            assertThat(channel.events).hasSize(1);
            UploadCompleteEvent event = (UploadCompleteEvent) channel.events.get(0);
            assertThat(event.transferId()).isEqualTo("t-11");
            assertThat(event.size()).isEqualTo(2048L);
            assertThat(channel.events).noneMatch(e -> e instanceof UploadFailedEvent);
            assertThat(runner.isInFlight("t-11")).isFalse();
        }
    }

    @Nested
    @DisplayName("Failed uploads")
    class Failure {

        @Test
        @DisplayName("Five failed attempts wait 1s, 2s, 4s, 8s and emit one failed event")
        void exhaustsRetries() {
            when(uploader.upload(anyString(), any(), anyString()))
                    .thenReturn(failure("t-3", "Upload I/O error: connection reset"));

            runner.onCommand(command("t-3", NOW.plusSeconds(900)), SOURCE);

            verify(uploader, times(5)).upload(anyString(), any(), anyString());
            assertThat(scheduler.delays).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2),
                    Duration.ofSeconds(4), Duration.ofSeconds(8));
            assertThat(channel.events).hasSize(1);
            UploadFailedEvent event = (UploadFailedEvent) channel.events.get(0);
            assertThat(event.category()).isEqualTo(FailureCategory.TRANSFER_FAILED);
            assertThat(event.reason())
                    .startsWith("Upload failed after 5 attempts")
                    .contains("connection reset");
        }

        @Test
        @DisplayName("An uploader that throws is treated as a failed attempt")
        void uploaderThrows() {
            when(uploader.upload(anyString(), any(), anyString()))
                    .thenThrow(new IllegalStateException("pool closed"));

            Future<Void> done = runner.onCommand(command("t-4", null), SOURCE);

            assertThat(done.succeeded()).isTrue();
            verify(uploader, times(5)).upload(anyString(), any(), anyString());
            assertThat(((UploadFailedEvent) channel.events.get(0)).reason()).contains("pool closed");
        }

        @Test
        @DisplayName("A channel failure while publishing does not fail the command")
        void publishFailureIsLogged() {
            channel.failPublish = true;
            when(uploader.upload(anyString(), any(), anyString()))
                    .thenReturn(Future.succeededFuture(new UploadResult(1L, "d")));

            Future<Void> done = runner.onCommand(command("t-5", null), SOURCE);

            assertThat(done.succeeded()).isTrue();
            assertThat(runner.isInFlight("t-5")).isFalse();
        }
    }

    @Nested
    @DisplayName("Guards")
    class Guards {

        @Test
        @DisplayName("Expired credential emits CREDENTIAL_EXPIRED with zero upload attempts")
        void expiredCredential() {
            runner.onCommand(command("t-6", NOW.minusSeconds(1)), SOURCE);

            verify(uploader, never()).upload(anyString(), any(), anyString());
            assertThat(channel.events).hasSize(1);
            UploadFailedEvent event = (UploadFailedEvent) channel.events.get(0);
            assertThat(event.category()).isEqualTo(FailureCategory.CREDENTIAL_EXPIRED);
            assertThat(event.reason()).isEqualTo(TransferRunner.EXPIRED_REASON);
        }

        @Test
        @DisplayName("Credential expiring exactly now is still usable")
        void expiryBoundary() {
            when(uploader.upload(anyString(), any(), anyString()))
                    .thenReturn(Future.succeededFuture(new UploadResult(1L, "d")));

            runner.onCommand(command("t-7", NOW), SOURCE);

            assertThat(channel.events).singleElement().isInstanceOf(UploadCompleteEvent.class);
        }

        @Test
        @DisplayName("Command missing its write credential is dropped without an event")
        void invalidCommand() {
            TransferCommand invalid = new TransferCommand("t-8", "uploads/t-8/x", " ", null, null);

            Future<Void> done = runner.onCommand(invalid, SOURCE);

            assertThat(done.succeeded()).isTrue();
            assertThat(channel.events).isEmpty();
            verify(uploader, never()).upload(anyString(), any(), anyString());
        }

        @Test
        @DisplayName("Duplicate command for an in-flight transfer is ignored")
        void duplicateWhileInFlight() {
            Promise<UploadResult> pending = Promise.promise();
            when(uploader.upload(anyString(), any(), anyString())).thenReturn(pending.future());

            runner.onCommand(command("t-9", null), SOURCE);
            assertThat(runner.isInFlight("t-9")).isTrue();
            assertThat(metrics.getActiveTransfers()).isEqualTo(1);

            Future<Void> duplicate = runner.onCommand(command("t-9", null), SOURCE);
            assertThat(duplicate.succeeded()).isTrue();
            verify(uploader, times(1)).upload(anyString(), any(), anyString());

            pending.complete(new UploadResult(3L, "d"));

            assertThat(runner.isInFlight("t-9")).isFalse();
            assertThat(metrics.getActiveTransfers()).isZero();
            assertThat(channel.events).hasSize(1);
        }

        @Test
        @DisplayName("The same transfer id may run again once the first run finished")
        void rerunAfterCompletion() {
            when(uploader.upload(anyString(), any(), anyString()))
                    .thenReturn(Future.succeededFuture(new UploadResult(1L, "d")));

            runner.onCommand(command("t-10", null), SOURCE);
            runner.onCommand(command("t-10", null), SOURCE);

            verify(uploader, times(2)).upload(anyString(), any(), anyString());
            assertThat(channel.events).hasSize(2);
        }
    }

    private static final class RecordingChannel implements AgentChannel {
        final List<TransferEvent> events = new CopyOnWriteArrayList<>();
        volatile boolean failPublish;

        @Override
        public Subscription subscribe(String agentId, Consumer<TransferCommand> handler) {
            throw new UnsupportedOperationException();
        }

        @Override
        public Future<Void> broadcastEvent(TransferEvent event) {
            if (failPublish) {
                return Future.failedFuture("controller unreachable");
            }
            events.add(event);
            return Future.succeededFuture();
        }
    }

    private static final class RecordingScheduler implements DelayScheduler {
        final List<Duration> delays = new CopyOnWriteArrayList<>();

        @Override
        public Future<Void> delay(Duration delay) {
            delays.add(delay);
            return Future.succeededFuture();
        }
    }
}
