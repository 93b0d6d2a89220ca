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
import com.fasterxml.jackson.annotation.JsonInclude;
import dev.mars.ferry.core.FailureCategory;
import dev.mars.ferry.core.FailureReason;

import java.time.Instant;

/**
 * Upload could not be performed on the agent.
 *
 * <p>{@code category} is optional on the wire. An absent or unrecognised category is
 * read back as {@code null} and treated as {@link FailureCategory#AGENT_REPORTED}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record UploadFailedEvent(
        String transferId,
        String objectKey,
        String reason,
        FailureCategory category,
        Instant timestamp) implements TransferEvent {

    public static final String KIND = "failed";

    /**
     * The failure as it should be recorded on the transfer.
     */
    public FailureReason toFailureReason() {
        FailureCategory effective = category != null ? category : FailureCategory.AGENT_REPORTED;
        return FailureReason.of(effective, reason);
    }
}
