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

package dev.mars.ferry.channel;

import dev.mars.ferry.core.exceptions.ChannelException;
import dev.mars.ferry.core.message.MessageCodec;
import dev.mars.ferry.core.message.TransferCommand;
import dev.mars.ferry.core.message.TransferEvent;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.eventbus.DeliveryOptions;
import io.vertx.core.eventbus.EventBus;
import io.vertx.core.eventbus.Message;
import io.vertx.core.eventbus.MessageConsumer;
import io.vertx.core.eventbus.ReplyException;
import io.vertx.core.eventbus.ReplyFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Consumer;

/**
 * {@link CommandChannel} over the Vert.x event bus.
 *
 * <p>Commands are sent by request/reply to {@code ferry.commands.<agentId>}. The receiving
 * side replies as soon as it has decoded the command and queued it for its handler, so a
 * successful send means "accepted by an agent", not "uploaded". With no consumer
 * registered for the agent the send fails. Events are published to {@code ferry.events}
 * and reach every subscriber.</p>
 *
 * <p>Payloads travel as JSON strings produced by {@link MessageCodec}. Handlers run
 * through {@code executeBlocking(..., ordered = true)} on the consumer's context, so each
 * subscription sees its messages one at a time in arrival order.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public class EventBusCommandChannel implements CommandChannel {

    private static final Logger logger = LoggerFactory.getLogger(EventBusCommandChannel.class);

    public static final String COMMAND_ADDRESS_PREFIX = "ferry.commands.";
    public static final String EVENT_ADDRESS = "ferry.events";
    static final String ACK = "ack";

    private final Vertx vertx;
    private final EventBus eventBus;
    private final DeliveryOptions sendOptions;

    public EventBusCommandChannel(Vertx vertx) {
        this(vertx, Duration.ofSeconds(30));
    }

    public EventBusCommandChannel(Vertx vertx, Duration sendTimeout) {
        this.vertx = vertx;
        this.eventBus = vertx.eventBus();
        this.sendOptions = new DeliveryOptions().setSendTimeout(sendTimeout.toMillis());
    }

    public static String commandAddress(String agentId) {
        return COMMAND_ADDRESS_PREFIX + agentId;
    }

    @Override
    public Future<Void> send(String agentId, TransferCommand command) {
        String payload;
        try {
            payload = MessageCodec.encodeCommand(command);
        } catch (IllegalArgumentException e) {
            return Future.failedFuture(new ChannelException("Cannot encode command " + command.transferId(), e));
        }

        return eventBus.request(commandAddress(agentId), payload, sendOptions)
                .<Void>mapEmpty()
                .recover(err -> Future.failedFuture(new ChannelException(describeSendFailure(agentId, err), err)))
                .onSuccess(v -> logger.debug("Command delivered: transferId={}, agentId={}",
                        command.transferId(), agentId));
    }

    @Override
    public Subscription subscribeEvents(Consumer<TransferEvent> handler) {
        MessageConsumer<String> consumer = eventBus.consumer(EVENT_ADDRESS, message -> {
            TransferEvent event;
            try {
                event = MessageCodec.decodeEvent(message.body());
            } catch (IllegalArgumentException e) {
                logger.warn("Discarding malformed event: {}", e.getMessage());
                return;
            }
            dispatch(() -> handler.accept(event), "event " + event.transferId());
        });
        logger.info("Subscribed to events on {}", EVENT_ADDRESS);
        return new ConsumerSubscription(consumer);
    }

    @Override
    public Subscription subscribe(String agentId, Consumer<TransferCommand> handler) {
        String address = commandAddress(agentId);
        MessageConsumer<String> consumer = eventBus.consumer(address, message -> onCommandMessage(message, handler));
        logger.info("Subscribed to commands on {}", address);
        return new ConsumerSubscription(consumer);
    }

    @Override
    public Future<Void> broadcastEvent(TransferEvent event) {
        try {
            eventBus.publish(EVENT_ADDRESS, MessageCodec.encodeEvent(event));
            return Future.succeededFuture();
        } catch (IllegalArgumentException e) {
            return Future.failedFuture(new ChannelException("Cannot encode event " + event.transferId(), e));
        }
    }

    private void onCommandMessage(Message<String> message, Consumer<TransferCommand> handler) {
        TransferCommand command;
        try {
            command = MessageCodec.decodeCommand(message.body());
        } catch (IllegalArgumentException e) {
            logger.error("Rejecting malformed command on {}: {}", message.address(), e.getMessage());
            message.fail(400, e.getMessage());
            return;
        }
        message.reply(ACK);
        dispatch(() -> handler.accept(command), "command " + command.transferId());
    }

    private void dispatch(Runnable work, String description) {
        vertx.executeBlocking(() -> {
            work.run();
            return null;
        }, true).onFailure(err -> logger.error("Handler failed for {}", description, err));
    }

    private static String describeSendFailure(String agentId, Throwable err) {
        if (err instanceof ReplyException) {
            ReplyFailure type = ((ReplyException) err).failureType();
            if (type == ReplyFailure.NO_HANDLERS) {
                return "No agent subscribed for '" + agentId + "'";
            }
            if (type == ReplyFailure.TIMEOUT) {
                return "Agent '" + agentId + "' did not acknowledge the command in time";
            }
        }
        return "Command send to '" + agentId + "' failed: " + err.getMessage();
    }

    private static final class ConsumerSubscription implements Subscription {
        private final MessageConsumer<String> consumer;

        private ConsumerSubscription(MessageConsumer<String> consumer) {
            this.consumer = consumer;
        }

        @Override
        public Future<Void> cancel() {
            if (!consumer.isRegistered()) {
                return Future.succeededFuture();
            }
            return consumer.unregister()
                    .onSuccess(v -> logger.info("Unsubscribed from {}", consumer.address()));
        }

        @Override
        public boolean isActive() {
            return consumer.isRegistered();
        }
    }
}
