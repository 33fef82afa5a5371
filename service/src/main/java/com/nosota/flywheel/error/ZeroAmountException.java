package com.nosota.flywheel.error;

public class ZeroAmountException extends FlywheelException {
    public ZeroAmountException(String message) {
        super(ErrorCode.ZERO_AMOUNT, message);
    }
}
