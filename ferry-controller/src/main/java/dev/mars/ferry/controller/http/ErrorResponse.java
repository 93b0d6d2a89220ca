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

import io.vertx.core.json.JsonObject;

import java.time.Instant;

/**
 * JSON error body returned by every API endpoint.
 *
 * <pre>{@code
 * {
 *   "error": {
 *     "shortCode": "F-3001",
 *     "code": "COMMAND_DISPATCH_FAILED",
 *     "message": "Command for transfer '3f2a...' could not be dispatched",
 *     "timestamp": "2026-03-02T10:00:00Z",
 *     "path": "/api/v1/agents/agent-7/transfers",
 *     "requestId": "req-1a2b3c4d",
 *     "transferId": "3f2a..."
 *   }
 * }
 * }</pre>
 *
 * <p>{@code transferId} is present only when the failure concerns a record that already exists,
 * so a caller can poll it after a failed dispatch.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public record ErrorResponse(
    ErrorCode errorCode,
    String message,
    Instant timestamp,
    String path,
    String requestId,
    String transferId
) {

    /**
     * A null request id is replaced by a generated one.
     */
    public static ErrorResponse withMessage(ErrorCode errorCode, String path, String message, String requestId) {
        String id = requestId != null ? requestId : CorrelationIdHandler.newRequestId();
        return new ErrorResponse(errorCode, message, Instant.now(), path, id, null);
    }

    public static ErrorResponse fromException(ErrorCode errorCode, Throwable cause, String path, String requestId) {
        String message = cause.getMessage() != null ? cause.getMessage() : errorCode.messageTemplate();
        return withMessage(errorCode, path, message, requestId);
    }

    public ErrorResponse forTransfer(String id) {
        return new ErrorResponse(errorCode, message, timestamp, path, requestId, id);
    }

    public String shortCode() {
        return errorCode.shortCode();
    }

    public String code() {
        return errorCode.code();
    }

    public int httpStatus() {
        return errorCode.httpStatus();
    }

    public JsonObject toJson() {
        JsonObject error = new JsonObject()
            .put("shortCode", shortCode())
            .put("code", code())
            .put("message", message)
            .put("timestamp", timestamp.toString())
            .put("path", path)
            .put("requestId", requestId);
        if (transferId != null) {
            error.put("transferId", transferId);
        }
        return new JsonObject().put("error", error);
    }
}
