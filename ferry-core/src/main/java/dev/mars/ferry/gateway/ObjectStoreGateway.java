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

package dev.mars.ferry.gateway;

import io.vertx.core.Future;

import java.time.Duration;
import java.util.Optional;

/**
 * Issues scoped, time-boxed credentials for single objects and reports what the store holds.
 *
 * <p>Implementations map "object not found" to {@code false} or an empty result. Every
 * other store failure fails the returned future with a
 * {@link dev.mars.ferry.core.exceptions.GatewayException}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public interface ObjectStoreGateway {

    /**
     * Issues a credential that allows one PUT of {@code objectKey}.
     *
     * @param objectKey key the agent will write
     * @param ttl       how long the credential stays valid
     */
    Future<Credential> issueWriteCredential(String objectKey, Duration ttl);

    /**
     * Issues a credential that allows GETs of {@code objectKey}.
     *
     * @param dispositionName file name suggested to the downloader, or null for none
     */
    Future<Credential> issueReadCredential(String objectKey, Duration ttl, String dispositionName);

    Future<Boolean> exists(String objectKey);

    Future<Optional<ObjectMetadata>> statMetadata(String objectKey);
}
