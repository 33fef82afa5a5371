package com.nosota.flywheel.error;

public class InvalidHookDataException extends FlywheelException {
    public InvalidHookDataException(String message) {
        super(ErrorCode.INVALID_HOOK_DATA, message);
    }

    public InvalidHookDataException(String message, Throwable cause) {
        super(ErrorCode.INVALID_HOOK_DATA, message, cause);
    }
}
