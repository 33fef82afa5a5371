package com.nosota.flywheel.error;

public class InvalidAddressException extends FlywheelException {
    public InvalidAddressException(String message) {
        super(ErrorCode.INVALID_ADDRESS, message);
    }

    public InvalidAddressException(String message, Throwable cause) {
        super(ErrorCode.INVALID_ADDRESS, message, cause);
    }
}
