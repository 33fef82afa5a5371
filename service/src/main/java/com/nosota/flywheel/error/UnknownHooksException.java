package com.nosota.flywheel.error;

public class UnknownHooksException extends FlywheelException {
    public UnknownHooksException(String message) {
        super(ErrorCode.UNKNOWN_HOOKS, message);
    }
}
