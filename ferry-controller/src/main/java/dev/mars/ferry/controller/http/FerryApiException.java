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

/**
 * Exception thrown by API handlers to indicate a known error condition.
 *
 * <p>The {@link GlobalErrorHandler} turns it into an {@link ErrorResponse} with the
 * status of its {@link ErrorCode}.</p>
 *
 * <pre>{@code
 * ctx.fail(FerryApiException.notFound(ErrorCode.TRANSFER_NOT_FOUND, transferId));
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public class FerryApiException extends RuntimeException {

    private final ErrorCode errorCode;

    public FerryApiException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public FerryApiException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public int getHttpStatus() {
        return errorCode.httpStatus();
    }

    // ==================== Factory Methods ====================

    public static FerryApiException notFound(ErrorCode code, Object... args) {
        return new FerryApiException(code, code.formatMessage(args));
    }

    public static FerryApiException badRequest(ErrorCode code, Object... args) {
        return new FerryApiException(code, code.formatMessage(args));
    }

    /**
     * Creates an "unavailable" exception (503).
     */
    public static FerryApiException unavailable(ErrorCode code, Throwable cause, Object... args) {
        return new FerryApiException(code, code.formatMessage(args), cause);
    }

    public static FerryApiException internal(ErrorCode code, Throwable cause, Object... args) {
        return new FerryApiException(code, code.formatMessage(args), cause);
    }
}
