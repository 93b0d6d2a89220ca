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

import java.time.Instant;
import java.util.Objects;

/**
 * Time-boxed authorization to put or get exactly one object, usually a presigned URL.
 *
 * @param url       the URL the holder uses for the single operation it authorizes
 * @param expiresAt instant after which the store rejects the URL
 */
public record Credential(String url, Instant expiresAt) {

    public Credential {
        Objects.requireNonNull(url, "url cannot be null");
        Objects.requireNonNull(expiresAt, "expiresAt cannot be null");
    }

    @Override
    public String toString() {
        // the URL is a bearer secret
        return "Credential{expiresAt=" + expiresAt + '}';
    }
}
