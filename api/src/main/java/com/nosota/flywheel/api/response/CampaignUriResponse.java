package com.nosota.flywheel.api.response;

/**
 * Response carrying the content URI reported by a campaign's hooks.
 */
public record CampaignUriResponse(
        String campaign,
        String uri
) {}
