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

package dev.mars.ferry.agent.service;

import io.vertx.core.Future;

import java.nio.file.Path;

/**
 * Performs one upload attempt of a local file to a write credential.
 *
 * <p>The returned future fails with a {@link dev.mars.ferry.core.exceptions.TransferException}
 * when the attempt fails; retrying is the caller's business.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public interface TransferUploader {

    Future<UploadResult> upload(String transferId, Path source, String writeCredential);
}
