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
import io.vertx.core.Handler;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;

import java.time.Clock;
import java.time.Duration;

/**
 * {@code GET /api/v1/transfers/:transferId/artifact}: a fresh download URL for a verified
 * transfer. Every call mints a new URL.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public class ArtifactHandler implements Handler<RoutingContext> {

    private final Orchestrator orchestrator;
    private final Clock clock;

    public ArtifactHandler(Orchestrator orchestrator, Clock clock) {
        this.orchestrator = orchestrator;
        this.clock = clock;
    }

    @Override
    public void handle(RoutingContext ctx) {
        String transferId = ctx.pathParam(TransferHandler.PARAM_TRANSFER_ID);
        if (!TransferHandler.isUuid(transferId)) {
            ctx.fail(FerryApiException.badRequest(ErrorCode.TRANSFER_ID_INVALID, transferId));
            return;
        }

        orchestrator.getArtifactUrl(transferId)
                .onSuccess(credential -> {
                    if (credential.isEmpty()) {
                        ctx.fail(FerryApiException.notFound(ErrorCode.ARTIFACT_NOT_AVAILABLE, transferId));
                        return;
                    }
                    long expiresIn = Math.max(0, Duration.between(clock.instant(), credential.get().expiresAt()).getSeconds());
                    ctx.json(new JsonObject()
                            .put("transferId", transferId)
                            .put("artifactUrl", credential.get().url())
                            .put("expiresIn", expiresIn)
                            .put("expiresAt", credential.get().expiresAt().toString()));
                })
                .onFailure(ctx::fail);
    }
}
