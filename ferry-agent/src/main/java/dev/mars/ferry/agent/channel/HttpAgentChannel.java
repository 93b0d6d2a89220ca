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

import dev.mars.ferry.channel.AgentChannel;
import dev.mars.ferry.channel.Subscription;
import dev.mars.ferry.core.exceptions.ChannelException;
import dev.mars.ferry.core.message.MessageCodec;
import dev.mars.ferry.core.message.TransferCommand;
import dev.mars.ferry.core.message.TransferEvent;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.HttpResponse;
import io.vertx.ext.web.client.WebClient;
import io.vertx.ext.web.client.WebClientOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Agent side of the controller's command mailbox, for agents that cannot accept inbound
 * connections.
 *
 * <p>A periodic timer polls {@code GET {controller}/agents/{agentId}/commands}. Each
 * returned command is handed to the handler and then acknowledged with
 * {@code POST .../commands/{transferId}/ack}; a command whose handler threw is left
 * unacknowledged so the controller redelivers it when its lease runs out. Events are
 * posted to {@code POST {controller}/events}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public class HttpAgentChannel implements AgentChannel {

    private static final Logger logger = LoggerFactory.getLogger(HttpAgentChannel.class);

    private final Vertx vertx;
    private final WebClient webClient;
    private final String controllerUrl;
    private final long pollIntervalMs;

    public HttpAgentChannel(Vertx vertx, String controllerUrl, long pollIntervalMs, int connectTimeoutMs) {
        this.vertx = vertx;
        this.controllerUrl = controllerUrl.endsWith("/")
                ? controllerUrl.substring(0, controllerUrl.length() - 1)
                : controllerUrl;
        this.pollIntervalMs = pollIntervalMs;
        this.webClient = WebClient.create(vertx, new WebClientOptions()
                .setConnectTimeout(connectTimeoutMs)
                .setUserAgent("Ferry-Agent/1.0"));
        logger.debug("HttpAgentChannel initialized (controller={}, pollInterval={}ms)", this.controllerUrl, pollIntervalMs);
    }

    @Override
    public Subscription subscribe(String agentId, Consumer<TransferCommand> handler) {
        PollingSubscription subscription = new PollingSubscription(agentId, handler);
        subscription.timerId = vertx.setPeriodic(pollIntervalMs, id -> subscription.poll());
        vertx.runOnContext(v -> subscription.poll());
        logger.info("Polling {} for commands every {}ms", commandsUrl(agentId), pollIntervalMs);
        return subscription;
    }

    @Override
    public Future<Void> broadcastEvent(TransferEvent event) {
        String body;
        try {
            body = MessageCodec.encodeEvent(event);
        } catch (IllegalArgumentException e) {
            return Future.failedFuture(new ChannelException("Cannot encode event " + event.transferId(), e));
        }
        return webClient.postAbs(controllerUrl + "/events")
                .putHeader("Content-Type", "application/json")
                .sendBuffer(Buffer.buffer(body))
                .compose(response -> expectSuccess(response, "event " + event.transferId()))
                .onSuccess(v -> logger.debug("Event posted: transferId={}", event.transferId()));
    }

    /**
     * Fetches the currently leased commands once. Malformed entries are skipped.
     */
    Future<List<TransferCommand>> fetchCommands(String agentId) {
        return webClient.getAbs(commandsUrl(agentId))
                .putHeader("Accept", "application/json")
                .send()
                .compose(response -> {
                    if (response.statusCode() != 200) {
                        return Future.failedFuture(new ChannelException(
                                "Command poll returned HTTP " + response.statusCode()));
                    }
                    List<TransferCommand> commands = new ArrayList<>();
                    JsonArray array = response.bodyAsJsonObject().getJsonArray("commands", new JsonArray());
                    for (int i = 0; i < array.size(); i++) {
                        Object entry = array.getValue(i);
                        try {
                            String json = entry instanceof JsonObject ? ((JsonObject) entry).encode() : String.valueOf(entry);
                            commands.add(MessageCodec.decodeCommand(json));
                        } catch (IllegalArgumentException e) {
                            logger.warn("Skipping malformed command from controller: {}", e.getMessage());
                        }
                    }
                    return Future.succeededFuture(commands);
                });
    }

    Future<Void> acknowledge(String agentId, String transferId) {
        return webClient.postAbs(commandsUrl(agentId) + "/" + transferId + "/ack")
                .send()
                .compose(response -> expectSuccess(response, "ack of " + transferId));
    }

    public Future<Void> close() {
        webClient.close();
        return Future.succeededFuture();
    }

    private String commandsUrl(String agentId) {
        return controllerUrl + "/agents/" + agentId + "/commands";
    }

    private static Future<Void> expectSuccess(HttpResponse<Buffer> response, String what) {
        int status = response.statusCode();
        if (status >= 200 && status < 300) {
            return Future.succeededFuture();
        }
        return Future.failedFuture(new ChannelException("Controller rejected " + what + ": HTTP " + status));
    }

    private final class PollingSubscription implements Subscription {
        private final String agentId;
        private final Consumer<TransferCommand> handler;
        private final AtomicBoolean active = new AtomicBoolean(true);
        private final AtomicBoolean polling = new AtomicBoolean(false);
        private volatile long timerId;

        private PollingSubscription(String agentId, Consumer<TransferCommand> handler) {
            this.agentId = agentId;
            this.handler = handler;
        }

        private void poll() {
            if (!active.get() || !polling.compareAndSet(false, true)) {
                return;
            }
            fetchCommands(agentId)
                    .compose(this::deliverAll)
                    .onFailure(err -> logger.warn("Error polling for commands: {}", err.getMessage()))
                    .onComplete(ar -> polling.set(false));
        }

        private Future<Void> deliverAll(List<TransferCommand> commands) {
            if (!commands.isEmpty()) {
                logger.debug("Polled {} command(s) for agent {}", commands.size(), agentId);
            }
            Future<Void> chain = Future.succeededFuture();
            for (TransferCommand command : commands) {
                chain = chain.compose(v -> deliver(command));
            }
            return chain;
        }

        private Future<Void> deliver(TransferCommand command) {
            if (!active.get()) {
                return Future.succeededFuture();
            }
            return vertx.<Void>executeBlocking(() -> {
                        handler.accept(command);
                        return null;
                    }, true)
                    .compose(v -> acknowledge(agentId, command.transferId()))
                    .recover(err -> {
                        logger.error("Command {} not acknowledged: {}", command.transferId(), err.getMessage());
                        return Future.succeededFuture();
                    });
        }

        @Override
        public Future<Void> cancel() {
            if (active.compareAndSet(true, false)) {
                vertx.cancelTimer(timerId);
                logger.info("Stopped polling for commands for agent {}", agentId);
            }
            return Future.succeededFuture();
        }

        @Override
        public boolean isActive() {
            return active.get();
        }
    }
}
