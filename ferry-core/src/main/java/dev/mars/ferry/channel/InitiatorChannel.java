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

import dev.mars.ferry.core.message.TransferCommand;
import dev.mars.ferry.core.message.TransferEvent;
import io.vertx.core.Future;

import java.util.function.Consumer;

/**
 * The initiator's side of the command/event channel.
 *
 * <p>Delivery is at-least-once in both directions. Event handlers are called once per
 * delivered event, in delivery order, off the event loop.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public interface InitiatorChannel {

    /**
     * Addresses a command to one agent.
     *
     * @return succeeds once the channel has accepted the command, fails with a
     *         {@link dev.mars.ferry.core.exceptions.ChannelException} otherwise
     */
    Future<Void> send(String agentId, TransferCommand command);

    Subscription subscribeEvents(Consumer<TransferEvent> handler);
}
