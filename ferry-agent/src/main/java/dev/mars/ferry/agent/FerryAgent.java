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

package dev.mars.ferry.agent;

import dev.mars.ferry.agent.channel.HttpAgentChannel;
import dev.mars.ferry.agent.config.AgentConfig;
import dev.mars.ferry.agent.observability.AgentMetrics;
import dev.mars.ferry.agent.service.HttpStreamingUploader;
import dev.mars.ferry.agent.service.RetryPolicy;
import dev.mars.ferry.agent.service.TransferRunner;
import dev.mars.ferry.agent.service.VertxDelayScheduler;
import dev.mars.ferry.channel.Subscription;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Main class for the Ferry agent.
 * The agent polls the controller for upload commands addressed to its agent id, uploads
 * its configured source file to the presigned URL in each command and reports the outcome.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public class FerryAgent {

    private static final Logger logger = LoggerFactory.getLogger(FerryAgent.class);

    private final Vertx vertx;
    private final AgentConfig config;
    private final String agentId;
    private final Path sourcePath;
    private final HttpAgentChannel channel;
    private final HttpStreamingUploader uploader;
    private final TransferRunner runner;

    private Subscription subscription;

    // Shutdown coordination
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile boolean running = false;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    /**
     * Creates a FerryAgent on a shared Vert.x instance.
     *
     * @param vertx the Vert.x instance (must not be null)
     * @param config the agent configuration (must not be null)
     * @throws NullPointerException if vertx or config is null
     */
    public FerryAgent(Vertx vertx, AgentConfig config) {
        this.vertx = Objects.requireNonNull(vertx, "Vertx instance cannot be null");
        this.config = Objects.requireNonNull(config, "AgentConfig cannot be null");
        this.agentId = config.getAgentId();
        this.sourcePath = config.getSourcePath();

        this.channel = new HttpAgentChannel(vertx, config.getControllerUrl(),
                config.getCommandPollIntervalMs(), config.getHttpConnectTimeoutMs());
        this.uploader = new HttpStreamingUploader(vertx, config.getMaxConcurrentTransfers(),
                config.getHttpConnectTimeoutMs(), config.getHttpReadTimeoutMs());
        RetryPolicy retryPolicy = new RetryPolicy(config.getRetryMaxAttempts(),
                Duration.ofMillis(config.getRetryBaseDelayMs()));
        this.runner = new TransferRunner(channel, uploader, retryPolicy, new VertxDelayScheduler(vertx),
                Clock.systemUTC(), new AgentMetrics(agentId));

        logger.info("Ferry Agent initialized: {}", agentId);
    }

    public static void main(String[] args) {
        logger.info("Starting Ferry Agent...");

        Vertx vertx = Vertx.vertx();

        try {
            AgentConfig config = AgentConfig.get();
            config.validate();
            config.logConfiguration();

            FerryAgent agent = new FerryAgent(vertx, config);

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                logger.info("Shutdown signal received");
                agent.shutdown();

                vertx.close().onComplete(ar -> {
                    if (ar.succeeded()) {
                        logger.info("Vert.x instance closed successfully");
                    } else {
                        logger.error("Error closing Vert.x instance", ar.cause());
                    }
                });
            }));

            agent.start();
            agent.awaitShutdown();

        } catch (Exception e) {
            logger.error("Failed to start Ferry Agent", e);
            vertx.close();
            System.exit(1);
        }

        logger.info("Ferry Agent stopped");
    }

    public void start() {
        if (closed.get()) {
            throw new IllegalStateException("Agent is closed, cannot start");
        }

        running = true;
        subscription = channel.subscribe(agentId, command -> runner.onCommand(command, sourcePath));
        logger.info("Ferry Agent started: agentId={}, source={}", agentId, sourcePath);
    }

    public void shutdown() {
        if (closed.getAndSet(true)) {
            logger.info("Agent already closed, skipping shutdown");
            return;
        }

        if (!running) {
            logger.info("Agent not running, performing cleanup only");
            shutdownLatch.countDown();
            return;
        }

        logger.info("Shutting down Ferry Agent...");
        running = false;

        try {
            if (subscription != null) {
                subscription.cancel();
            }
            uploader.close();
            channel.close();
            logger.info("Ferry Agent shutdown complete");
        } catch (Exception e) {
            logger.error("Error during shutdown", e);
        } finally {
            shutdownLatch.countDown();
        }
    }

    public void awaitShutdown() throws InterruptedException {
        shutdownLatch.await();
    }

    public boolean isRunning() {
        return running;
    }

    public AgentConfig getConfiguration() {
        return config;
    }
}
