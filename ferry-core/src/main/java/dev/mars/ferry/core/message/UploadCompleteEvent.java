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

package dev.mars.ferry.core.message;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Upload finished on the agent. {@code size} and {@code digest} describe exactly the
 * bytes that were transmitted.
 *
 * @param transferId transfer the upload belongs to
 * @param objectKey  key the object was written to
 * @param size       number of bytes sent, never negative
 * @param digest     lower-case hex SHA-256 of the bytes sent
 * @param timestamp  when the agent finished the upload
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UploadCompleteEvent(
        String transferId,
        String objectKey,
        @JsonProperty(required = true) long size,
        String digest,
        Instant timestamp) implements TransferEvent {

    public static final String KIND = "complete";
}
