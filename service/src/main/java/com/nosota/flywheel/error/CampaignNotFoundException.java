package com.nosota.flywheel.error;

public class CampaignNotFoundException extends FlywheelException {
    public CampaignNotFoundException(String message) {
        super(ErrorCode.CAMPAIGN_DOES_NOT_EXIST, message);
    }
}
