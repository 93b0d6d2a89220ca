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

package dev.mars.ferry.controller.http;

import java.util.Arrays;
import java.util.Optional;

/**
 * Standardized error codes for the Ferry controller HTTP API.
 *
 * <p>Each error code carries a unique string code, the HTTP status it maps to, a message
 * template and a short code ({@code F-nnnn}) for support tickets and log searches.</p>
 *
 * <p>Short code ranges:</p>
 * <ul>
 *   <li>{@code F-1xxx} - general request errors</li>
 *   <li>{@code F-2xxx} - transfer errors</li>
 *   <li>{@code F-3xxx} - agent and command errors</li>
 *   <li>{@code F-5xxx} - object store errors</li>
 *   <li>{@code F-9xxx} - server errors</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public enum ErrorCode {

    // ==================== General Errors ====================

    /** Request body is missing or malformed */
    BAD_REQUEST("BAD_REQUEST", 400, "Invalid request: %s", "F-1001"),

    /** Request validation failed */
    VALIDATION_ERROR("VALIDATION_ERROR", 400, "Validation failed: %s", "F-1002"),

    /** Generic resource not found */
    NOT_FOUND("NOT_FOUND", 404, "Resource not found: %s", "F-1004"),

    /** HTTP method not supported for this endpoint */
    METHOD_NOT_ALLOWED("METHOD_NOT_ALLOWED", 405, "Method %s not allowed", "F-1005"),

    /** Resource state conflict */
    CONFLICT("CONFLICT", 409, "Conflict: %s", "F-1009"),

    // ==================== Transfer Errors ====================

    /** No transfer record with this id */
    TRANSFER_NOT_FOUND("TRANSFER_NOT_FOUND", 404, "Transfer '%s' not found", "F-2001"),

    /** Transfer id is not a UUID */
    TRANSFER_ID_INVALID("TRANSFER_ID_INVALID", 400, "Invalid transfer id '%s'", "F-2002"),

    /** Transfer exists but has no verified artifact */
    ARTIFACT_NOT_AVAILABLE("ARTIFACT_NOT_AVAILABLE", 404, "No verified artifact for transfer '%s'", "F-2003"),

    // ==================== Agent / Command Errors ====================

    /** The command could not be handed to the channel */
    COMMAND_DISPATCH_FAILED("COMMAND_DISPATCH_FAILED", 503, "Command for transfer '%s' could not be dispatched", "F-3001"),

    /** Agent event payload could not be decoded */
    EVENT_INVALID("EVENT_INVALID", 400, "Invalid event: %s", "F-3002"),

    // ==================== Object Store Errors ====================

    /** Object store rejected or could not serve a request */
    STORAGE_UNAVAILABLE("STORAGE_UNAVAILABLE", 503, "Object store unavailable: %s", "F-5001"),

    // ==================== Server Errors ====================

    /** Unexpected internal error */
    INTERNAL_ERROR("INTERNAL_ERROR", 500, "Internal server error: %s", "F-9001"),

    /** Service temporarily unavailable */
    SERVICE_UNAVAILABLE("SERVICE_UNAVAILABLE", 503, "Service temporarily unavailable: %s", "F-9003"),

    /** Request timeout */
    TIMEOUT("TIMEOUT", 504, "Request timed out: %s", "F-9004");

    private final String code;
    private final int httpStatus;
    private final String messageTemplate;
    private final String shortCode;

    ErrorCode(String code, int httpStatus, String messageTemplate, String shortCode) {
        this.code = code;
        this.httpStatus = httpStatus;
        this.messageTemplate = messageTemplate;
        this.shortCode = shortCode;
    }

    public String code() {
        return code;
    }

    public int httpStatus() {
        return httpStatus;
    }

    /**
     * Returns the message template (may contain %s placeholders).
     */
    public String messageTemplate() {
        return messageTemplate;
    }

    public String shortCode() {
        return shortCode;
    }

    public String formatMessage(Object... args) {
        return String.format(messageTemplate, args);
    }

    /**
     * Looks up an ErrorCode by its string code.
     */
    public static Optional<ErrorCode> fromCode(String code) {
        return Arrays.stream(values())
            .filter(e -> e.code.equals(code))
            .findFirst();
    }

    public static Optional<ErrorCode> fromShortCode(String shortCode) {
        return Arrays.stream(values())
            .filter(e -> e.shortCode.equals(shortCode))
            .findFirst();
    }
}
