package com.nosota.flywheel.error;

public class UnsupportedHookOperationException extends FlywheelException {
    public UnsupportedHookOperationException(String message) {
        super(ErrorCode.UNSUPPORTED_OPERATION, message);
    }
}
