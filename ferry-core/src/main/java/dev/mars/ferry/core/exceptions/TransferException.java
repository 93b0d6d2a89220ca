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
 * Exception thrown when work on a single transfer fails.
 * Covers upload attempts on the agent and the dispatch of a command by the orchestrator.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class TransferException extends FerryException {

    private final String transferId;

    public TransferException(String transferId, String message) {
        super(message);
        this.transferId = transferId;
    }

    public TransferException(String transferId, String message, Throwable cause) {
        super(message, cause);
        this.transferId = transferId;
    }

    public String getTransferId() {
        return transferId;
    }

    /**
     * The failure detail without the transfer prefix.
     */
    public String getDetail() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        return String.format("Transfer %s failed: %s", transferId, super.getMessage());
    }
}
