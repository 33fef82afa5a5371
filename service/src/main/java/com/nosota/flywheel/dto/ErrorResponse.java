package com.nosota.flywheel.dto;

import java.time.LocalDateTime;

/**
 * Error body returned by every failing API call.
 *
 * @param code Machine-readable error code, {@code null} for errors raised outside the ledger
 */
public record ErrorResponse(
        LocalDateTime timestamp,
        int status,
        String error,
        String code,
        String message,
        String path
) {
    public static ErrorResponse of(int status, String error, String code, String message, String path) {
        return new ErrorResponse(LocalDateTime.now(), status, error, code, message, path);
    }

    public static ErrorResponse of(int status, String error, String message, String path) {
        return of(status, error, null, message, path);
    }
}
