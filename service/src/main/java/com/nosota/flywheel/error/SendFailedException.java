package com.nosota.flywheel.error;

public class SendFailedException extends FlywheelException {
    public SendFailedException(String message) {
        super(ErrorCode.SEND_FAILED, message);
    }
}
