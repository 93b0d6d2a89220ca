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

/**
 * Lifecycle status of a transfer record.
 *
 * The typical flow is:
 * PENDING -> UPLOADED -> VERIFIED
 *
 * Alternative flows:
 * PENDING -> FAILED (agent reported failure, credential expired)
 * UPLOADED -> FAILED (verification rejected the upload)
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public enum TransferState {

    /**
     * Record created and write credential issued.
     * The upload command has been (or is being) dispatched to the agent.
     */
    PENDING("Waiting for agent upload", false, false),

    /**
     * The agent reported a completed upload with size and digest.
     * Verification against the object store is in progress.
     */
    UPLOADED("Upload reported, verifying", false, false),

    /**
     * The object store confirmed the upload.
     * This is a terminal state.
     */
    VERIFIED("Upload verified", true, true),

    /**
     * The transfer failed. The record carries a categorised reason.
     * This is a terminal state.
     */
    FAILED("Transfer failed", true, false);

    private final String description;
    private final boolean terminal;
    private final boolean successful;

    TransferState(String description, boolean terminal, boolean successful) {
        this.description = description;
        this.terminal = terminal;
        this.successful = successful;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Terminal states cannot transition to other states.
     */
    public boolean isTerminal() {
        return terminal;
    }

    public boolean isSuccessful() {
        return successful;
    }

    /**
     * Check if transition from this state to the target state is valid.
     *
     * @param target the target state to transition to
     * @return true if the transition is valid
     */
    public boolean canTransitionTo(TransferState target) {
        if (this.isTerminal()) {
            return false;
        }

        switch (this) {
            case PENDING:
                return target == UPLOADED || target == FAILED;

            case UPLOADED:
                return target == VERIFIED || target == FAILED;

            default:
                return false;
        }
    }

    /**
     * Get all valid transition targets from this state.
     *
     * @return array of valid target states
     */
    public TransferState[] getValidTransitions() {
        switch (this) {
            case PENDING:
                return new TransferState[]{UPLOADED, FAILED};
            case UPLOADED:
                return new TransferState[]{VERIFIED, FAILED};
            default:
                return new TransferState[0];
        }
    }

    @Override
    public String toString() {
        return name() + " (" + description + ")";
    }
}
