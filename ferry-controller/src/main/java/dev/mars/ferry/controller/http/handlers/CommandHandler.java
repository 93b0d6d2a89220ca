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
import dev.mars.ferry.controller.service.Orchestrator;
import dev.mars.ferry.core.message.MessageCodec;
import dev.mars.ferry.core.message.TransferCommand;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Agent-facing command endpoints.
 *
 * <ul>
 *   <li>{@code GET /api/v1/agents/:agentId/commands} - lease the agent's queued commands</li>
 *   <li>{@code POST /api/v1/agents/:agentId/commands/:transferId/ack} - drop an accepted command</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public class CommandHandler {

    private static final Logger logger = LoggerFactory.getLogger(CommandHandler.class);

    private final CommandMailbox mailbox;

    public CommandHandler(CommandMailbox mailbox) {
        this.mailbox = mailbox;
    }

    public void poll(RoutingContext ctx) {
        String agentId = ctx.pathParam(TransferHandler.PARAM_AGENT_ID);
        if (!Orchestrator.AGENT_ID_PATTERN.matcher(agentId).matches()) {
            ctx.fail(FerryApiException.badRequest(ErrorCode.VALIDATION_ERROR,
                    "agentId must match " + Orchestrator.AGENT_ID_PATTERN.pattern()));
            return;
        }
        List<TransferCommand> commands = mailbox.poll(agentId);
        JsonArray array = new JsonArray();
        for (TransferCommand command : commands) {
            array.add(new JsonObject(MessageCodec.encodeCommand(command)));
        }
        if (!commands.isEmpty()) {
            logger.info("Leased {} command(s) to agent {}", commands.size(), agentId);
        }
        ctx.json(new JsonObject().put("commands", array));
    }

    /**
     * Always 204: a repeated ack of a redelivered command is harmless.
     */
    public void acknowledge(RoutingContext ctx) {
        String agentId = ctx.pathParam(TransferHandler.PARAM_AGENT_ID);
        String transferId = ctx.pathParam(TransferHandler.PARAM_TRANSFER_ID);
        if (!mailbox.acknowledge(agentId, transferId)) {
            logger.debug("Ack for unknown command {} from agent {}", transferId, agentId);
        }
        ctx.response().setStatusCode(204).end();
    }
}
