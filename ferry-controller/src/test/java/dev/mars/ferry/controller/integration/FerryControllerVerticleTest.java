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

package dev.mars.ferry.controller.integration;

import dev.mars.ferry.controller.FerryControllerVerticle;
import dev.mars.ferry.controller.config.AppConfig;
import dev.mars.ferry.controller.service.FakeObjectStoreGateway;
import dev.mars.ferry.core.FailureCategory;
import dev.mars.ferry.core.message.MessageCodec;
import dev.mars.ferry.core.message.UploadFailedEvent;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.WebClient;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.time.Clock;
import java.time.Instant;
import java.util.Properties;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Deploys the whole controller and drives a transfer to FAILED over HTTP.
 */
@ExtendWith(VertxExtension.class)
@DisplayName("FerryControllerVerticle")
class FerryControllerVerticleTest {

    private static AppConfig config(String storeType) {
        Properties properties = new Properties();
        properties.setProperty("ferry.http.port", "0");
        properties.setProperty("ferry.http.host", "localhost");
        properties.setProperty("ferry.store.type", storeType);
        properties.setProperty("ferry.store.jdbc.url", "jdbc:h2:mem:ferry-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        properties.setProperty("ferry.store.jdbc.user", "sa");
        return new AppConfig(properties);
    }

    @Test
    @DisplayName("Agent failure report is visible through the API (in-memory store)")
    void failedTransferWithMemoryStore(Vertx vertx, VertxTestContext testContext) {
        failedTransferOverHttp("memory", vertx, testContext);
    }

    @Test
    @DisplayName("Agent failure report is visible through the API (H2 store)")
    void failedTransferWithJdbcStore(Vertx vertx, VertxTestContext testContext) {
        failedTransferOverHttp("jdbc", vertx, testContext);
    }

    private void failedTransferOverHttp(String storeType, Vertx vertx, VertxTestContext testContext) {
        FerryControllerVerticle verticle = new FerryControllerVerticle(config(storeType),
                new FakeObjectStoreGateway(Clock.systemUTC()));
        WebClient client = WebClient.create(vertx);
        String[] transferId = new String[1];

        vertx.deployVerticle(verticle)
                .compose(id -> client.post(verticle.actualHttpPort(), "localhost", "/api/v1/agents/agent-9/transfers")
                        .sendJsonObject(new JsonObject().put("originalFilename", "dump.sql")))
                .compose(created -> {
                    testContext.verify(() -> assertEquals(201, created.statusCode()));
                    transferId[0] = created.bodyAsJsonObject().getString("transferId");
                    String event = MessageCodec.encodeEvent(new UploadFailedEvent(transferId[0],
                            created.bodyAsJsonObject().getString("objectKey"), "credential expired",
                            FailureCategory.CREDENTIAL_EXPIRED, Instant.now()));
                    return client.post(verticle.actualHttpPort(), "localhost", "/api/v1/events")
                            .putHeader("Content-Type", "application/json")
                            .sendBuffer(Buffer.buffer(event));
                })
                .compose(accepted -> {
                    testContext.verify(() -> assertEquals(202, accepted.statusCode()));
                    return awaitStatus(vertx, client, verticle.actualHttpPort(), transferId[0], "FAILED", 50);
                })
                .onComplete(testContext.succeeding(record -> testContext.verify(() -> {
                    assertEquals("FAILED", record.getString("status"));
                    assertEquals("CREDENTIAL_EXPIRED", record.getJsonObject("failureReason").getString("category"));
                    client.close();
                    testContext.completeNow();
                })));
    }

    // Events are applied on the store worker after the 202, so the status is polled.
    private static Future<JsonObject> awaitStatus(Vertx vertx, WebClient client, int port, String transferId,
                                                  String status, int attemptsLeft) {
        return client.get(port, "localhost", "/api/v1/transfers/" + transferId).send()
                .compose(response -> {
                    if (response.statusCode() == 200 && status.equals(response.bodyAsJsonObject().getString("status"))) {
                        return Future.succeededFuture(response.bodyAsJsonObject());
                    }
                    if (attemptsLeft <= 1) {
                        return Future.failedFuture("transfer " + transferId + " never reached " + status
                                + ", last response: " + response.bodyAsString());
                    }
                    return vertx.timer(20).compose(t -> awaitStatus(vertx, client, port, transferId, status, attemptsLeft - 1));
                });
    }

    @Test
    @DisplayName("Invalid configuration fails deployment")
    void invalidConfigurationFailsDeployment(Vertx vertx, VertxTestContext testContext) {
        FerryControllerVerticle verticle = new FerryControllerVerticle(config("redis"),
                new FakeObjectStoreGateway(Clock.systemUTC()));

        vertx.deployVerticle(verticle).onComplete(testContext.failing(err -> testContext.verify(() -> {
            assertInstanceOf(IllegalStateException.class, err);
            testContext.completeNow();
        })));
    }
}
