package com.nosota.flywheel.api.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigInteger;

/**
 * Request for creating (or looking up) a campaign.
 *
 * <p>The campaign address is derived from all three fields, so repeating the same
 * request returns the existing campaign.
 *
 * @param hooks    Address of the hook policy module governing the campaign
 * @param nonce    Caller-chosen nonce (unsigned 256-bit)
 * @param hookData Hex encoded ({@code 0x...}) creation payload passed to the hooks
 */
public record CreateCampaignRequest(
        @NotBlank(message = "Hooks address is required")
        String hooks,

        @NotNull(message = "Nonce is required")
        @PositiveOrZero(message = "Nonce must not be negative")
        BigInteger nonce,

        String hookData
) {
}
