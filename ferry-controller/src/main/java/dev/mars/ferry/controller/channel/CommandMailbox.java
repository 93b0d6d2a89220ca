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

package dev.mars.ferry.controller.channel;

import dev.mars.ferry.channel.InitiatorChannel;
import dev.mars.ferry.channel.Subscription;
import dev.mars.ferry.core.exceptions.ChannelException;
import dev.mars.ferry.core.message.TransferCommand;
import dev.mars.ferry.core.message.TransferEvent;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.WorkerExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Initiator channel for agents that poll over HTTP instead of holding a connection.
 *
 * <p>{@link #send} queues a command in the agent's mailbox. {@link #poll} hands out every
 * command that is not currently leased and leases it for the lease period; a command that
 * is not {@link #acknowledge acknowledged} before its lease runs out is handed out again.
 * Commands whose credential expired are dropped, and an agent's mailbox disappears once
 * it holds nothing.
 * Events posted by agents are passed to {@link #deliverEvent}, which runs the subscribed
 * handlers one event at a time on the {@code ferry-events} worker.</p>
 *
 * <p>Mailboxes live in memory. Commands queued when the controller stops are lost and the
 * affected transfers stay {@code PENDING}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public class CommandMailbox implements InitiatorChannel {

    private static final Logger logger = LoggerFactory.getLogger(CommandMailbox.class);

    public static final String EVENT_WORKER_NAME = "ferry-events";

    private static final long MIN_SWEEP_INTERVAL_MS = 1000;

    private final Vertx vertx;
    private final long sweepTimerId;
    private final Duration lease;
    private final Clock clock;
    private final WorkerExecutor eventWorker;
    private final Map<String, Map<String, Entry>> mailboxes = new ConcurrentHashMap<>();
    private final List<EventSubscription> subscriptions = new CopyOnWriteArrayList<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public CommandMailbox(Vertx vertx, Duration lease, Clock clock) {
        this.lease = lease;
        this.clock = clock;
        this.eventWorker = vertx.createSharedWorkerExecutor(EVENT_WORKER_NAME, 1);
        this.vertx = vertx;
        this.sweepTimerId = vertx.setPeriodic(Math.max(MIN_SWEEP_INTERVAL_MS, lease.toMillis()), id -> evictExpired());
        logger.info("CommandMailbox initialized (lease={}ms)", lease.toMillis());
    }

    @Override
    public Future<Void> send(String agentId, TransferCommand command) {
        if (closed.get()) {
            return Future.failedFuture(new ChannelException(
                    "Command mailbox is closed, cannot queue transfer " + command.transferId()));
        }
        mailboxes.compute(agentId, (id, mailbox) -> {
            Map<String, Entry> target = mailbox == null ? new LinkedHashMap<>() : mailbox;
            synchronized (target) {
                target.put(command.transferId(), new Entry(command));
            }
            return target;
        });
        logger.debug("Queued command {} for agent {}", command.transferId(), agentId);
        return Future.succeededFuture();
    }

    /**
     * Leases and returns the agent's commands that are not currently leased, oldest first.
     * Commands whose credential has expired are dropped instead of handed out.
     */
    public List<TransferCommand> poll(String agentId) {
        Instant now = clock.instant();
        List<TransferCommand> leased = new ArrayList<>();
        mailboxes.computeIfPresent(agentId, (id, mailbox) -> {
            synchronized (mailbox) {
                evictExpired(id, mailbox, now);
                for (Entry entry : mailbox.values()) {
                    if (entry.leasedUntil == null || !entry.leasedUntil.isAfter(now)) {
                        if (entry.leasedUntil != null) {
                            logger.warn("Lease expired for command {} (agent {}), redelivering",
                                    entry.command.transferId(), id);
                        }
                        entry.leasedUntil = now.plus(lease);
                        leased.add(entry.command);
                    }
                }
                return mailbox.isEmpty() ? null : mailbox;
            }
        });
        return leased;
    }

    /**
     * Removes an acknowledged command.
     *
     * @return false when the agent had no such command queued
     */
    public boolean acknowledge(String agentId, String transferId) {
        AtomicBoolean removed = new AtomicBoolean(false);
        mailboxes.computeIfPresent(agentId, (id, mailbox) -> {
            synchronized (mailbox) {
                removed.set(mailbox.remove(transferId) != null);
                return mailbox.isEmpty() ? null : mailbox;
            }
        });
        if (removed.get()) {
            logger.debug("Command {} acknowledged by agent {}", transferId, agentId);
        }
        return removed.get();
    }

    /**
     * Commands still queued for the agent, not counting those whose credential has expired.
     */
    public int pendingCount(String agentId) {
        Instant now = clock.instant();
        AtomicInteger count = new AtomicInteger();
        mailboxes.computeIfPresent(agentId, (id, mailbox) -> {
            synchronized (mailbox) {
                evictExpired(id, mailbox, now);
                count.set(mailbox.size());
                return mailbox.isEmpty() ? null : mailbox;
            }
        });
        return count.get();
    }

    /**
     * Number of agents with at least one queued command.
     */
    public int mailboxCount() {
        return mailboxes.size();
    }

    /**
     * Drops every command whose credential has expired and forgets agents left with an
     * empty mailbox. Runs periodically; agents that stop polling do not pin memory.
     *
     * @return number of commands dropped
     */
    public int evictExpired() {
        Instant now = clock.instant();
        AtomicInteger evicted = new AtomicInteger();
        for (String agentId : List.copyOf(mailboxes.keySet())) {
            mailboxes.computeIfPresent(agentId, (id, mailbox) -> {
                synchronized (mailbox) {
                    evicted.addAndGet(evictExpired(id, mailbox, now));
                    return mailbox.isEmpty() ? null : mailbox;
                }
            });
        }
        return evicted.get();
    }

    private static int evictExpired(String agentId, Map<String, Entry> mailbox, Instant now) {
        int evicted = 0;
        Iterator<Entry> entries = mailbox.values().iterator();
        while (entries.hasNext()) {
            TransferCommand command = entries.next().command;
            if (command.isExpiredAt(now)) {
                entries.remove();
                evicted++;
                logger.warn("Dropping command {} for agent {}: credential expired at {}",
                        command.transferId(), agentId, command.credentialExpiry());
            }
        }
        return evicted;
    }

    @Override
    public Subscription subscribeEvents(Consumer<TransferEvent> handler) {
        EventSubscription subscription = new EventSubscription(handler);
        subscriptions.add(subscription);
        return subscription;
    }

    /**
     * Passes an agent event to every active subscriber. Completes once the handlers ran.
     */
    public Future<Void> deliverEvent(TransferEvent event) {
        if (closed.get()) {
            return Future.failedFuture(new ChannelException("Command mailbox is closed"));
        }
        return eventWorker.executeBlocking(() -> {
            for (EventSubscription subscription : subscriptions) {
                subscription.deliver(event);
            }
            return null;
        }, true);
    }

    public Future<Void> close() {
        if (!closed.compareAndSet(false, true)) {
            return Future.succeededFuture();
        }
        vertx.cancelTimer(sweepTimerId);
        subscriptions.forEach(EventSubscription::cancel);
        logger.info("CommandMailbox closed");
        return eventWorker.close();
    }

    private static final class Entry {
        private final TransferCommand command;
        private Instant leasedUntil;

        private Entry(TransferCommand command) {
            this.command = command;
        }
    }

    private final class EventSubscription implements Subscription {
        private final Consumer<TransferEvent> handler;
        private final AtomicBoolean active = new AtomicBoolean(true);

        private EventSubscription(Consumer<TransferEvent> handler) {
            this.handler = handler;
        }

        private void deliver(TransferEvent event) {
            if (!active.get()) {
                return;
            }
            try {
                handler.accept(event);
            } catch (RuntimeException e) {
                logger.error("Event handler failed for transfer {}: {}", event.transferId(), e.getMessage(), e);
            }
        }

        @Override
        public Future<Void> cancel() {
            if (active.compareAndSet(true, false)) {
                subscriptions.remove(this);
            }
            return Future.succeededFuture();
        }

        @Override
        public boolean isActive() {
            return active.get();
        }
    }
}
