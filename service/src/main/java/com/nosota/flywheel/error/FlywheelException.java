package com.nosota.flywheel.error;

/**
 * Base class of every error raised by the registry, the vaults and the hooks.
 *
 * <p>Any of these aborts the whole call: the surrounding transaction is rolled back
 * and no ledger change or event survives.
 */
public abstract class FlywheelException extends Exception {

    private final ErrorCode errorCode;

    protected FlywheelException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected FlywheelException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
