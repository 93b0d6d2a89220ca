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

package dev.mars.ferry.core;

import java.util.Arrays;
import java.util.Optional;

/**
 * Closed set of reasons a transfer can end in {@link TransferState#FAILED}.
 *
 * <p>Categories raised on the agent travel inside the failed event; the
 * verification categories are only ever assigned by the orchestrator.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public enum FailureCategory {

    /** Write credential had expired before the agent started the upload */
    CREDENTIAL_EXPIRED("credential expired", true),

    /** Every upload attempt failed */
    TRANSFER_FAILED("upload failed", true),

    /** Agent reported a failure without a recognised category */
    AGENT_REPORTED("agent reported failure", true),

    /** Object not found in the store after a reported upload */
    OBJECT_MISSING("object missing after upload", false),

    /** Object exists but its metadata could not be read */
    METADATA_UNAVAILABLE("metadata unavailable", false),

    /** Stored object size differs from the reported size */
    SIZE_MISMATCH("size mismatch", false),

    /** Verification raised an unexpected error */
    VERIFICATION_ERROR("verification error", false);

    private final String defaultDetail;
    private final boolean agentSide;

    FailureCategory(String defaultDetail, boolean agentSide) {
        this.defaultDetail = defaultDetail;
        this.agentSide = agentSide;
    }

    public String defaultDetail() {
        return defaultDetail;
    }

    /**
     * Whether this category is raised by the agent rather than by verification.
     */
    public boolean isAgentSide() {
        return agentSide;
    }

    /**
     * Looks up a category by name, ignoring case. Blank or unknown names yield empty.
     */
    public static Optional<FailureCategory> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        return Arrays.stream(values())
            .filter(c -> c.name().equalsIgnoreCase(name.trim()))
            .findFirst();
    }
}
