package com.nosota.flywheel.api.request;

import com.nosota.flywheel.api.model.CampaignStatus;
import jakarta.validation.constraints.NotNull;

/**
 * Request for moving a campaign to a new status.
 *
 * @param status   Target status
 * @param hookData Hex encoded payload passed to the hooks' status callback
 */
public record UpdateStatusRequest(
        @NotNull(message = "Target status is required")
        CampaignStatus status,

        String hookData
) {
}
