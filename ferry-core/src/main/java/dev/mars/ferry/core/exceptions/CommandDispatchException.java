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

package dev.mars.ferry.core.exceptions;

/**
 * The upload command for a freshly created transfer could not be delivered to its agent.
 * The transfer record stays {@code PENDING}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public class CommandDispatchException extends TransferException {

    private final String agentId;

    public CommandDispatchException(String transferId, String agentId, Throwable cause) {
        super(transferId, "command dispatch to agent '" + agentId + "' failed: "
                + (cause != null ? cause.getMessage() : "unknown"), cause);
        this.agentId = agentId;
    }

    public String getAgentId() {
        return agentId;
    }
}
