package com.nosota.flywheel.error;

public class UnauthorizedException extends FlywheelException {
    public UnauthorizedException(String message) {
        super(ErrorCode.UNAUTHORIZED, message);
    }
}
