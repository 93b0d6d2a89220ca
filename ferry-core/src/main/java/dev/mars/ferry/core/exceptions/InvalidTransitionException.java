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

import dev.mars.ferry.core.TransferState;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Thrown when a transfer record is asked to move to a state its current state cannot reach.
 *
 * <p>Under at-least-once delivery this is the normal outcome of a duplicate or late event,
 * so callers usually log and discard it.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class InvalidTransitionException extends FerryException {

    private final String entityId;
    private final TransferState currentState;
    private final TransferState requestedState;
    private final TransferState[] validTransitions;

    /**
     * @param entityId       the transfer whose transition was rejected
     * @param currentState   the state the record is in
     * @param requestedState the state that was requested
     */
    public InvalidTransitionException(String entityId, TransferState currentState, TransferState requestedState) {
        super(String.format("Invalid transition for '%s': %s -> %s. Valid targets: %s",
                entityId, currentState.name(), requestedState.name(),
                formatTransitions(currentState.getValidTransitions())));
        this.entityId = entityId;
        this.currentState = currentState;
        this.requestedState = requestedState;
        this.validTransitions = currentState.getValidTransitions();
    }

    public String getEntityId() {
        return entityId;
    }

    public TransferState getCurrentState() {
        return currentState;
    }

    public TransferState getRequestedState() {
        return requestedState;
    }

    public TransferState[] getValidTransitions() {
        return validTransitions.clone();
    }

    private static String formatTransitions(TransferState[] transitions) {
        return Arrays.stream(transitions)
                .map(Enum::name)
                .collect(Collectors.joining(", ", "[", "]"));
    }
}
