package com.nosota.flywheel.error;

public class AllocationUnderflowException extends FlywheelException {
    public AllocationUnderflowException(String message) {
        super(ErrorCode.ALLOCATION_UNDERFLOW, message);
    }
}
