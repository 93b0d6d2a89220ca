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

package dev.mars.ferry.controller.http;

import dev.mars.ferry.controller.channel.CommandMailbox;
import dev.mars.ferry.controller.http.handlers.ArtifactHandler;
import dev.mars.ferry.controller.http.handlers.CommandHandler;
import dev.mars.ferry.controller.http.handlers.EventHandler;
import dev.mars.ferry.controller.http.handlers.HealthHandler;
import dev.mars.ferry.controller.http.handlers.TransferHandler;
import dev.mars.ferry.controller.service.Orchestrator;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpServer;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.handler.BodyHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;

/**
 * Vert.x Web server for the controller's HTTP API.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public class HttpApiServer {

    private static final Logger logger = LoggerFactory.getLogger(HttpApiServer.class);

    static final long MAX_BODY_BYTES = 64 * 1024;

    private final Vertx vertx;
    private final String host;
    private final int port;
    private final Orchestrator orchestrator;
    private final CommandMailbox mailbox;
    private final Duration stalledThreshold;
    private final Clock clock;
    private HttpServer httpServer;

    public HttpApiServer(Vertx vertx, String host, int port, Orchestrator orchestrator, CommandMailbox mailbox,
                         Duration stalledThreshold, Clock clock) {
        this.vertx = vertx;
        this.host = host;
        this.port = port;
        this.orchestrator = orchestrator;
        this.mailbox = mailbox;
        this.stalledThreshold = stalledThreshold;
        this.clock = clock;
    }

    public Future<Void> start() {
        Router router = createRouter();

        httpServer = vertx.createHttpServer()
                .requestHandler(router);

        return httpServer.listen(port, host)
                .onSuccess(server -> logger.info("HTTP API Server listening on {}:{}", host, server.actualPort()))
                .onFailure(err -> logger.error("Failed to start HTTP API Server", err))
                .mapEmpty();
    }

    Router createRouter() {
        Router router = Router.router(vertx);

        router.route().handler(new CorrelationIdHandler());
        router.route().handler(BodyHandler.create().setBodyLimit(MAX_BODY_BYTES));

        TransferHandler transfers = new TransferHandler(orchestrator, stalledThreshold);
        CommandHandler commands = new CommandHandler(mailbox);

        router.get("/health").handler(new HealthHandler(clock));

        router.post("/api/v1/agents/:agentId/transfers").handler(transfers::trigger);
        router.get("/api/v1/agents/:agentId/transfers").handler(transfers::listByAgent);
        router.get("/api/v1/agents/:agentId/commands").handler(commands::poll);
        router.post("/api/v1/agents/:agentId/commands/:transferId/ack").handler(commands::acknowledge);

        // registered before :transferId so "stalled" is not read as an id
        router.get("/api/v1/transfers/stalled").handler(transfers::stalled);
        router.get("/api/v1/transfers/:transferId").handler(transfers::get);
        router.get("/api/v1/transfers/:transferId/artifact").handler(new ArtifactHandler(orchestrator, clock));

        router.post("/api/v1/events").handler(new EventHandler(mailbox));

        GlobalErrorHandler errorHandler = new GlobalErrorHandler();
        router.route().failureHandler(errorHandler);
        router.errorHandler(404, errorHandler);
        router.errorHandler(405, errorHandler);
        return router;
    }

    /**
     * The bound port, which differs from the configured one when that was 0.
     */
    public int actualPort() {
        return httpServer != null ? httpServer.actualPort() : port;
    }

    public Future<Void> stop() {
        if (httpServer != null) {
            return httpServer.close()
                    .onSuccess(v -> logger.info("HTTP API Server stopped"));
        }
        return Future.succeededFuture();
    }
}
