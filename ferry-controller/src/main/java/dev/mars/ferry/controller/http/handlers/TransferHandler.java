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

import dev.mars.ferry.controller.http.ErrorCode;
import dev.mars.ferry.controller.http.FerryApiException;
import dev.mars.ferry.controller.service.Orchestrator;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Transfer endpoints used by the initiator side.
 *
 * <ul>
 *   <li>{@code POST /api/v1/agents/:agentId/transfers} - trigger a transfer</li>
 *   <li>{@code GET /api/v1/agents/:agentId/transfers} - list an agent's transfers, newest first</li>
 *   <li>{@code GET /api/v1/transfers/stalled} - PENDING transfers with no progress</li>
 *   <li>{@code GET /api/v1/transfers/:transferId} - one transfer record</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public class TransferHandler {

    private static final Logger logger = LoggerFactory.getLogger(TransferHandler.class);

    static final String PARAM_AGENT_ID = "agentId";
    static final String PARAM_TRANSFER_ID = "transferId";
    static final String PARAM_OLDER_THAN = "olderThanSeconds";

    private final Orchestrator orchestrator;
    private final Duration defaultStalledThreshold;

    public TransferHandler(Orchestrator orchestrator, Duration defaultStalledThreshold) {
        this.orchestrator = orchestrator;
        this.defaultStalledThreshold = defaultStalledThreshold;
    }

    /**
     * Body (optional): {@code {"originalFilename", "requestedBy", "reason"}}.
     */
    public void trigger(RoutingContext ctx) {
        String agentId = ctx.pathParam(PARAM_AGENT_ID);
        JsonObject body = ctx.body().isEmpty() ? new JsonObject() : ctx.body().asJsonObject();
        if (body == null) {
            body = new JsonObject();
        }

        String originalFilename = body.getString("originalFilename");
        Map<String, Object> meta = new LinkedHashMap<>();
        putIfPresent(meta, "requestedBy", body.getString("requestedBy"));
        putIfPresent(meta, "reason", body.getString("reason"));

        logger.debug("Trigger requested for agent {} (originalFilename={})", agentId, originalFilename);
        orchestrator.trigger(agentId, originalFilename, meta)
                .onSuccess(record -> {
                    JsonObject response = new JsonObject()
                            .put("transferId", record.getId())
                            .put("objectKey", record.getObjectKey())
                            .put("status", record.getStatus().name());
                    record.getCredentialExpiry().ifPresent(expiry -> response.put("credentialExpiry", expiry.toString()));
                    ctx.response().setStatusCode(201);
                    ctx.json(response);
                })
                .onFailure(ctx::fail);
    }

    public void listByAgent(RoutingContext ctx) {
        String agentId = ctx.pathParam(PARAM_AGENT_ID);
        if (!Orchestrator.AGENT_ID_PATTERN.matcher(agentId).matches()) {
            ctx.fail(FerryApiException.badRequest(ErrorCode.VALIDATION_ERROR,
                    "agentId must match " + Orchestrator.AGENT_ID_PATTERN.pattern()));
            return;
        }
        orchestrator.listTransfers(agentId)
                .onSuccess(records -> ctx.json(new JsonObject()
                        .put("agentId", agentId)
                        .put("transfers", TransferJson.toJson(records))))
                .onFailure(ctx::fail);
    }

    public void stalled(RoutingContext ctx) {
        Duration olderThan = defaultStalledThreshold;
        String raw = ctx.queryParams().get(PARAM_OLDER_THAN);
        if (raw != null && !raw.isBlank()) {
            long seconds;
            try {
                seconds = Long.parseLong(raw.trim());
            } catch (NumberFormatException e) {
                ctx.fail(FerryApiException.badRequest(ErrorCode.VALIDATION_ERROR,
                        PARAM_OLDER_THAN + " must be a number, got: " + raw));
                return;
            }
            if (seconds < 0) {
                ctx.fail(FerryApiException.badRequest(ErrorCode.VALIDATION_ERROR,
                        PARAM_OLDER_THAN + " must not be negative"));
                return;
            }
            olderThan = Duration.ofSeconds(seconds);
        }
        long olderThanSeconds = olderThan.getSeconds();
        orchestrator.findStalled(olderThan)
                .onSuccess(stalled -> ctx.json(new JsonObject()
                        .put("olderThanSeconds", olderThanSeconds)
                        .put("transfers", TransferJson.toJson(stalled))))
                .onFailure(ctx::fail);
    }

    public void get(RoutingContext ctx) {
        String transferId = ctx.pathParam(PARAM_TRANSFER_ID);
        if (!isUuid(transferId)) {
            ctx.fail(FerryApiException.badRequest(ErrorCode.TRANSFER_ID_INVALID, transferId));
            return;
        }
        orchestrator.getStatus(transferId)
                .onSuccess(record -> record.ifPresentOrElse(
                        found -> ctx.json(TransferJson.toJson(found)),
                        () -> ctx.fail(FerryApiException.notFound(ErrorCode.TRANSFER_NOT_FOUND, transferId))))
                .onFailure(ctx::fail);
    }

    static boolean isUuid(String value) {
        if (value == null) {
            return false;
        }
        try {
            return UUID.fromString(value).toString().equalsIgnoreCase(value);
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private static void putIfPresent(Map<String, Object> meta, String key, String value) {
        if (value != null && !value.isBlank()) {
            meta.put(key, value);
        }
    }
}
