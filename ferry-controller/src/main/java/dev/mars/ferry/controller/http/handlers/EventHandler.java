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

package dev.mars.ferry.controller.http.handlers;

import dev.mars.ferry.controller.channel.CommandMailbox;
import dev.mars.ferry.controller.http.ErrorCode;
import dev.mars.ferry.controller.http.FerryApiException;
import dev.mars.ferry.core.message.MessageCodec;
import dev.mars.ferry.core.message.TransferEvent;
import io.vertx.core.Handler;
import io.vertx.ext.web.RoutingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code POST /api/v1/events}: accepts one agent event and hands it to the orchestrator.
 * Responds 202 once the event was applied.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public class EventHandler implements Handler<RoutingContext> {

    private static final Logger logger = LoggerFactory.getLogger(EventHandler.class);

    private final CommandMailbox mailbox;

    public EventHandler(CommandMailbox mailbox) {
        this.mailbox = mailbox;
    }

    @Override
    public void handle(RoutingContext ctx) {
        TransferEvent event;
        try {
            event = MessageCodec.decodeEvent(ctx.body().asString());
        } catch (IllegalArgumentException e) {
            ctx.fail(new FerryApiException(ErrorCode.EVENT_INVALID, ErrorCode.EVENT_INVALID.formatMessage(e.getMessage()), e));
            return;
        }

        logger.debug("Received {} for transfer {}", event.getClass().getSimpleName(), event.transferId());
        mailbox.deliverEvent(event)
                .onSuccess(v -> ctx.response().setStatusCode(202).end())
                .onFailure(ctx::fail);
    }
}
