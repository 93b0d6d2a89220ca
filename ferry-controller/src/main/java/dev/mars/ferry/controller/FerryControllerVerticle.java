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

package dev.mars.ferry.controller;

import com.zaxxer.hikari.HikariDataSource;
import dev.mars.ferry.channel.Subscription;
import dev.mars.ferry.controller.channel.CommandMailbox;
import dev.mars.ferry.controller.config.AppConfig;
import dev.mars.ferry.controller.gateway.MinioObjectStoreGateway;
import dev.mars.ferry.controller.http.HttpApiServer;
import dev.mars.ferry.controller.observability.OrchestratorMetrics;
import dev.mars.ferry.controller.service.Orchestrator;
import dev.mars.ferry.controller.service.OrchestratorSettings;
import dev.mars.ferry.controller.service.StalledTransferMonitor;
import dev.mars.ferry.controller.service.VertxStoreExecutor;
import dev.mars.ferry.controller.store.JdbcTransferRecordStore;
import dev.mars.ferry.gateway.ObjectStoreGateway;
import dev.mars.ferry.store.InMemoryTransferRecordStore;
import dev.mars.ferry.store.TransferRecordStore;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;

/**
 * Main Verticle for the Ferry controller.
 *
 * <p>Startup order: record store, object store gateway (the bucket is created when missing),
 * command mailbox, orchestrator, stalled-transfer monitor, HTTP API. Shutdown runs in reverse.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public class FerryControllerVerticle extends AbstractVerticle {

    private static final Logger logger = LoggerFactory.getLogger(FerryControllerVerticle.class);

    private final AppConfig config;
    private final ObjectStoreGateway gatewayOverride;
    private final Clock clock = Clock.systemUTC();

    private CommandMailbox mailbox;
    private Orchestrator orchestrator;
    private Subscription eventSubscription;
    private StalledTransferMonitor stalledMonitor;
    private HttpApiServer apiServer;
    private HikariDataSource dataSource;

    public FerryControllerVerticle() {
        this(AppConfig.get(), null);
    }

    /**
     * @param gatewayOverride gateway to use instead of the configured MinIO one, or null
     */
    public FerryControllerVerticle(AppConfig config, ObjectStoreGateway gatewayOverride) {
        this.config = config;
        this.gatewayOverride = gatewayOverride;
    }

    @Override
    public void start(Promise<Void> startPromise) {
        logger.info("Starting FerryControllerVerticle...");

        try {
            config.validate();
        } catch (IllegalStateException e) {
            startPromise.fail(e);
            return;
        }

        createStore()
                .compose(store -> createGateway().map(gateway -> {
                    this.mailbox = new CommandMailbox(vertx, Duration.ofMillis(config.getCommandLeaseMs()), clock);
                    this.orchestrator = new Orchestrator(store, new VertxStoreExecutor(vertx), gateway, mailbox,
                            OrchestratorSettings.from(config), clock, new OrchestratorMetrics());
                    this.eventSubscription = orchestrator.start();
                    return orchestrator;
                }))
                .compose(orch -> {
                    Duration threshold = Duration.ofSeconds(config.getStalledThresholdSeconds());
                    this.stalledMonitor = new StalledTransferMonitor(vertx, orch,
                            config.getStalledCheckIntervalMs(), threshold);
                    stalledMonitor.start();

                    this.apiServer = new HttpApiServer(vertx, config.getHttpHost(), config.getHttpPort(),
                            orch, mailbox, threshold, clock);
                    return apiServer.start();
                })
                .onSuccess(v -> {
                    logger.info("FerryControllerVerticle started successfully");
                    startPromise.complete();
                })
                .onFailure(err -> {
                    logger.error("FerryControllerVerticle failed to start", err);
                    closeDataSource().onComplete(closed -> startPromise.fail(err));
                });
    }

    private Future<TransferRecordStore> createStore() {
        String type = config.getStoreType();
        if ("memory".equalsIgnoreCase(type)) {
            logger.info("Using in-memory transfer record store");
            return Future.succeededFuture(new InMemoryTransferRecordStore(clock));
        }
        logger.info("Using JDBC transfer record store at {}", config.getJdbcUrl());
        return vertx.executeBlocking(() -> {
            this.dataSource = JdbcTransferRecordStore.createDataSource(config.getJdbcUrl(),
                    config.getJdbcUser(), config.getJdbcPassword(), config.getJdbcPoolSize());
            JdbcTransferRecordStore store = new JdbcTransferRecordStore(dataSource, clock);
            store.initializeSchema();
            return store;
        }, false);
    }

    private Future<ObjectStoreGateway> createGateway() {
        if (gatewayOverride != null) {
            return Future.succeededFuture(gatewayOverride);
        }
        MinioObjectStoreGateway gateway = MinioObjectStoreGateway.create(vertx, config);
        return gateway.ensureBucket().map(v -> gateway);
    }

    /**
     * The HTTP port actually bound, for callers that configured port 0.
     */
    public int actualHttpPort() {
        return apiServer != null ? apiServer.actualPort() : config.getHttpPort();
    }

    private Future<Void> closeDataSource() {
        if (dataSource == null) {
            return Future.succeededFuture();
        }
        HikariDataSource pool = dataSource;
        dataSource = null;
        return vertx.executeBlocking(() -> {
            pool.close();
            logger.info("Transfer record store pool closed");
            return null;
        }, false);
    }

    @Override
    public void stop(Promise<Void> stopPromise) {
        logger.info("Stopping FerryControllerVerticle...");

        if (stalledMonitor != null) {
            stalledMonitor.stop();
        }
        Future<Void> httpStopped = apiServer != null ? apiServer.stop() : Future.succeededFuture();
        httpStopped
                .compose(v -> {
                    if (eventSubscription != null) {
                        eventSubscription.cancel();
                    }
                    return mailbox != null ? mailbox.close() : Future.<Void>succeededFuture();
                })
                .compose(v -> closeDataSource())
                .onSuccess(v -> {
                    logger.info("FerryControllerVerticle stopped successfully");
                    stopPromise.complete();
                })
                .onFailure(err -> {
                    logger.warn("Error during shutdown", err);
                    stopPromise.complete();
                });
    }
}
