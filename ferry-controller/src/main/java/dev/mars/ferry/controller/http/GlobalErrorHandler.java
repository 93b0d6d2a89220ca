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

import dev.mars.ferry.core.exceptions.ChannelException;
import dev.mars.ferry.core.exceptions.CommandDispatchException;
import dev.mars.ferry.core.exceptions.GatewayException;
import dev.mars.ferry.core.exceptions.RecordStoreException;
import io.vertx.core.Handler;
import io.vertx.core.json.DecodeException;
import io.vertx.ext.web.RoutingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Global error handler for the HTTP API.
 *
 * <p>Converts every failed routing context into a standardized {@link ErrorResponse}.</p>
 *
 * <p>Exception mapping:</p>
 * <ul>
 *   <li>{@link FerryApiException} → the exception's error code</li>
 *   <li>{@link IllegalArgumentException} → 400 VALIDATION_ERROR</li>
 *   <li>{@link DecodeException} → 400 BAD_REQUEST (JSON parsing)</li>
 *   <li>{@link GatewayException} → 503 STORAGE_UNAVAILABLE</li>
 *   <li>{@link CommandDispatchException} → 503 COMMAND_DISPATCH_FAILED</li>
 *   <li>{@link RecordStoreException}, {@link ChannelException} → 503 SERVICE_UNAVAILABLE</li>
 *   <li>All others → 500 INTERNAL_ERROR</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public class GlobalErrorHandler implements Handler<RoutingContext> {

    private static final Logger logger = LoggerFactory.getLogger(GlobalErrorHandler.class);

    @Override
    public void handle(RoutingContext ctx) {
        Throwable failure = ctx.failure();
        String path = ctx.request().path();
        int statusCode = ctx.statusCode();
        String requestId = CorrelationIdHandler.getRequestId(ctx);

        ErrorResponse errorResponse;

        if (failure == null) {
            // No exception, just a status code (e.g. 404 from router)
            errorResponse = mapStatusCodeToError(statusCode, path, requestId);
        } else if (failure instanceof FerryApiException apiEx) {
            errorResponse = ErrorResponse.withMessage(apiEx.getErrorCode(), path, apiEx.getMessage(), requestId);
            logError(apiEx.getErrorCode(), failure, path);
        } else if (failure instanceof IllegalArgumentException) {
            errorResponse = ErrorResponse.fromException(ErrorCode.VALIDATION_ERROR, failure, path, requestId);
            logError(ErrorCode.VALIDATION_ERROR, failure, path);
        } else if (failure instanceof DecodeException) {
            errorResponse = ErrorResponse.withMessage(ErrorCode.BAD_REQUEST, path, "Invalid JSON: " + failure.getMessage(), requestId);
            logError(ErrorCode.BAD_REQUEST, failure, path);
        } else if (failure instanceof GatewayException gatewayEx) {
            errorResponse = ErrorResponse.withMessage(ErrorCode.STORAGE_UNAVAILABLE, path,
                    ErrorCode.STORAGE_UNAVAILABLE.formatMessage(gatewayEx.getMessage()), requestId);
            logError(ErrorCode.STORAGE_UNAVAILABLE, failure, path);
        } else if (failure instanceof CommandDispatchException dispatchEx) {
            errorResponse = ErrorResponse.withMessage(ErrorCode.COMMAND_DISPATCH_FAILED, path,
                    ErrorCode.COMMAND_DISPATCH_FAILED.formatMessage(dispatchEx.getTransferId()), requestId)
                    .forTransfer(dispatchEx.getTransferId());
            logError(ErrorCode.COMMAND_DISPATCH_FAILED, failure, path);
        } else if (failure instanceof RecordStoreException) {
            errorResponse = ErrorResponse.withMessage(ErrorCode.SERVICE_UNAVAILABLE, path,
                    ErrorCode.SERVICE_UNAVAILABLE.formatMessage("transfer record store"), requestId);
            logError(ErrorCode.SERVICE_UNAVAILABLE, failure, path);
        } else if (failure instanceof ChannelException) {
            errorResponse = ErrorResponse.withMessage(ErrorCode.SERVICE_UNAVAILABLE, path,
                    ErrorCode.SERVICE_UNAVAILABLE.formatMessage(failure.getMessage()), requestId);
            logError(ErrorCode.SERVICE_UNAVAILABLE, failure, path);
        } else if (failure instanceof NullPointerException) {
            // don't expose details to client
            errorResponse = ErrorResponse.withMessage(ErrorCode.INTERNAL_ERROR, path, "Unexpected error occurred", requestId);
            logger.error("NullPointerException at path {}", path, failure);
        } else {
            errorResponse = ErrorResponse.withMessage(ErrorCode.INTERNAL_ERROR, path, "An unexpected error occurred", requestId);
            logger.error("Unhandled exception at path {}: {}", path, failure.getMessage(), failure);
        }

        sendErrorResponse(ctx, errorResponse);
    }

    private ErrorResponse mapStatusCodeToError(int statusCode, String path, String requestId) {
        return switch (statusCode) {
            case 400 -> ErrorResponse.withMessage(ErrorCode.BAD_REQUEST, path, "Bad request", requestId);
            case 404 -> ErrorResponse.withMessage(ErrorCode.NOT_FOUND, path, ErrorCode.NOT_FOUND.formatMessage(path), requestId);
            case 405 -> ErrorResponse.withMessage(ErrorCode.METHOD_NOT_ALLOWED, path, ErrorCode.METHOD_NOT_ALLOWED.formatMessage("unknown"), requestId);
            case 409 -> ErrorResponse.withMessage(ErrorCode.CONFLICT, path, "Resource conflict", requestId);
            case 503 -> ErrorResponse.withMessage(ErrorCode.SERVICE_UNAVAILABLE, path, "Service unavailable", requestId);
            case 504 -> ErrorResponse.withMessage(ErrorCode.TIMEOUT, path, "Request timeout", requestId);
            case 500 -> ErrorResponse.withMessage(ErrorCode.INTERNAL_ERROR, path, "Internal server error", requestId);
            default -> ErrorResponse.withMessage(ErrorCode.INTERNAL_ERROR, path, "Error " + statusCode, requestId);
        };
    }

    private void sendErrorResponse(RoutingContext ctx, ErrorResponse errorResponse) {
        if (ctx.response().ended()) {
            logger.warn("Response already sent for {}, dropping error {}", errorResponse.path(), errorResponse.code());
            return;
        }
        ctx.response()
            .setStatusCode(errorResponse.httpStatus())
            .putHeader("Content-Type", "application/json")
            .end(errorResponse.toJson().encode());
    }

    /**
     * Logs the error with a level based on its status. The correlation id comes from MDC.
     */
    private void logError(ErrorCode code, Throwable failure, String path) {
        if (code.httpStatus() >= 500) {
            logger.error("Server error [{}] at {}: {}", code.code(), path, failure.getMessage(), failure);
        } else {
            logger.warn("Client error [{}] at {}: {}", code.code(), path, failure.getMessage());
        }
    }
}
