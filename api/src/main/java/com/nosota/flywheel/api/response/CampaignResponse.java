package com.nosota.flywheel.api.response;

import com.nosota.flywheel.api.model.CampaignStatus;

/**
 * Response describing a campaign's identity and status.
 */
public record CampaignResponse(
        String campaign,
        String hooks,
        CampaignStatus status
) {}
