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

package dev.mars.ferry.controller.service;

import io.vertx.core.Future;
import io.vertx.core.Vertx;

import java.util.concurrent.Callable;

/**
 * {@link StoreExecutor} on the Vert.x worker pool. Calls are unordered; the store serializes
 * updates of one transfer itself.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public class VertxStoreExecutor implements StoreExecutor {

    private final Vertx vertx;

    public VertxStoreExecutor(Vertx vertx) {
        this.vertx = vertx;
    }

    @Override
    public <T> Future<T> execute(Callable<T> work) {
        return vertx.executeBlocking(work, false);
    }
}
