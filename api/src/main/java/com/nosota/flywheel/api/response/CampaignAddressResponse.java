package com.nosota.flywheel.api.response;

/**
 * Response for campaign address prediction.
 */
public record CampaignAddressResponse(
        String campaign,
        boolean exists
) {}
