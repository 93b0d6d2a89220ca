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

import dev.mars.ferry.controller.config.AppConfig;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the Ferry controller: deploys {@link FerryControllerVerticle} on a fresh
 * Vert.x instance and closes it on JVM shutdown.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public class FerryControllerApplication {

    private static final Logger logger = LoggerFactory.getLogger(FerryControllerApplication.class);

    public static void main(String[] args) {
        logger.info("Starting Ferry Controller...");

        AppConfig config = AppConfig.get();
        config.logConfiguration();

        Vertx vertx = Vertx.vertx();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutdown signal received, stopping Ferry Controller...");
            vertx.close().onComplete(ar -> {
                if (ar.succeeded()) {
                    logger.info("Vert.x instance closed successfully");
                } else {
                    logger.error("Error closing Vert.x instance", ar.cause());
                }
            });
        }));

        vertx.deployVerticle(new FerryControllerVerticle(config, null))
                .onSuccess(id -> logger.info("Ferry Controller deployed ({})", id))
                .onFailure(err -> {
                    logger.error("Failed to start Ferry Controller", err);
                    vertx.close();
                    System.exit(1);
                });
    }
}
