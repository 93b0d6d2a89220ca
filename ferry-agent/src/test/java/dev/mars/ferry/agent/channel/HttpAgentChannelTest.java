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

package dev.mars.ferry.agent.channel;

import dev.mars.ferry.channel.Subscription;
import dev.mars.ferry.core.FailureCategory;
import dev.mars.ferry.core.exceptions.ChannelException;
import dev.mars.ferry.core.message.MessageCodec;
import dev.mars.ferry.core.message.TransferCommand;
import dev.mars.ferry.core.message.TransferEvent;
import dev.mars.ferry.core.message.UploadCompleteEvent;
import dev.mars.ferry.core.message.UploadFailedEvent;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.handler.BodyHandler;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

/**
 * Tests for HttpAgentChannel against a local server playing the controller's mailbox API.
 */
@ExtendWith(VertxExtension.class)
class HttpAgentChannelTest {

    private static final Instant EXPIRY = Instant.parse("2030-01-01T00:00:00Z");

    private final Map<String, String> mailbox = new ConcurrentHashMap<>();
    private final List<String> acked = new CopyOnWriteArrayList<>();
    private final List<TransferEvent> events = new CopyOnWriteArrayList<>();
    private final AtomicInteger polls = new AtomicInteger();
    private volatile int eventStatus = 202;

    private HttpAgentChannel channel;

    @BeforeEach
    void setUp(Vertx vertx, VertxTestContext testContext) {
        Router router = Router.router(vertx);
        router.route().handler(BodyHandler.create());
        router.get("/api/v1/agents/:agentId/commands").handler(ctx -> {
            polls.incrementAndGet();
            JsonArray commands = new JsonArray();
            mailbox.values().forEach(json -> commands.add(new JsonObject(json)));
            ctx.json(new JsonObject().put("commands", commands));
        });
        router.post("/api/v1/agents/:agentId/commands/:transferId/ack").handler(ctx -> {
            String transferId = ctx.pathParam("transferId");
            acked.add(transferId);
            mailbox.remove(transferId);
            ctx.response().setStatusCode(204).end();
        });
        router.post("/api/v1/events").handler(ctx -> {
            events.add(MessageCodec.decodeEvent(ctx.body().asString()));
            ctx.response().setStatusCode(eventStatus).end();
        });

        vertx.createHttpServer()
                .requestHandler(router)
                .listen(0)
                .onComplete(testContext.succeeding(server -> {
                    channel = new HttpAgentChannel(vertx,
                            "http://localhost:" + server.actualPort() + "/api/v1/", 100, 2000);
                    testContext.completeNow();
                }));
    }

    private void enqueue(String transferId) {
        mailbox.put(transferId, MessageCodec.encodeCommand(new TransferCommand(transferId,
                "agent-1/" + transferId + "-file", "https://store/put/" + transferId, EXPIRY, null)));
    }

    @Test
    @DisplayName("Polled commands reach the handler and are acknowledged")
    void deliversAndAcknowledges() {
        enqueue("t-1");
        enqueue("t-2");
        List<TransferCommand> received = new CopyOnWriteArrayList<>();

        Subscription subscription = channel.subscribe("agent-1", received::add);

        await().atMost(Duration.ofSeconds(5)).until(() -> acked.size() == 2);
        assertThat(received).extracting(TransferCommand::transferId).containsExactlyInAnyOrder("t-1", "t-2");
        assertThat(acked).containsExactlyInAnyOrder("t-1", "t-2");
        assertThat(subscription.isActive()).isTrue();
        subscription.cancel();
    }

    @Test
    @DisplayName("A command whose handler throws is left unacknowledged")
    void handlerFailureIsNotAcknowledged() {
        enqueue("t-3");
        AtomicInteger attempts = new AtomicInteger();

        Subscription subscription = channel.subscribe("agent-1", command -> {
            attempts.incrementAndGet();
            throw new IllegalStateException("boom");
        });

        await().atMost(Duration.ofSeconds(5)).until(() -> attempts.get() >= 2);
        assertThat(acked).isEmpty();
        assertThat(mailbox).containsKey("t-3");
        subscription.cancel();
    }

    @Test
    @DisplayName("Malformed mailbox entries are skipped")
    void skipsMalformedEntries() {
        mailbox.put("bad", "{\"kind\":\"download\",\"transferId\":\"bad\"}");
        enqueue("t-4");

        Subscription subscription = channel.subscribe("agent-1", command -> { });

        await().atMost(Duration.ofSeconds(5)).until(() -> acked.contains("t-4"));
        assertThat(acked).doesNotContain("bad");
        subscription.cancel();
    }

    @Test
    @DisplayName("Cancelling stops polling")
    void cancelStopsPolling() throws InterruptedException {
        Subscription subscription = channel.subscribe("agent-1", command -> { });
        await().atMost(Duration.ofSeconds(5)).until(() -> polls.get() >= 1);

        subscription.cancel();
        assertThat(subscription.isActive()).isFalse();
        Thread.sleep(150);
        int afterCancel = polls.get();
        Thread.sleep(400);

        assertThat(polls.get()).isEqualTo(afterCancel);
    }

    @Test
    @DisplayName("Events are posted to the controller")
    void postsEvents(VertxTestContext testContext) {
        UploadCompleteEvent event = new UploadCompleteEvent("t-5", "agent-1/t-5-file", 42L, "abc",
                Instant.parse("2026-03-02T10:00:00Z"));

        channel.broadcastEvent(event).onComplete(testContext.succeeding(v -> testContext.verify(() -> {
            assertThat(events).containsExactly(event);
            testContext.completeNow();
        })));
    }

    @Test
    @DisplayName("A rejected event fails with ChannelException")
    void rejectedEvent(VertxTestContext testContext) {
        eventStatus = 400;
        UploadFailedEvent event = new UploadFailedEvent("t-6", "agent-1/t-6-file", "disk full",
                FailureCategory.TRANSFER_FAILED, Instant.parse("2026-03-02T10:00:00Z"));

        channel.broadcastEvent(event).onComplete(testContext.failing(err -> testContext.verify(() -> {
            assertThat(err).isInstanceOf(ChannelException.class).hasMessageContaining("HTTP 400");
            testContext.completeNow();
        })));
    }
}
