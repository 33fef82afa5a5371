package com.nosota.flywheel.error;

public class InvalidCampaignStatusException extends FlywheelException {
    public InvalidCampaignStatusException(String message) {
        super(ErrorCode.INVALID_CAMPAIGN_STATUS, message);
    }
}
