package com.nosota.flywheel.api.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.math.BigInteger;

/**
 * Request for depositing funds onto the asset network from an external source.
 *
 * <p>Funding a campaign is a deposit whose holder is the campaign address.
 *
 * @param holder Address receiving the funds
 * @param asset  Asset address, or the native currency sentinel
 * @param amount Amount to deposit (in the asset's smallest unit)
 */
public record DepositRequest(
        @NotBlank(message = "Holder address is required")
        String holder,

        @NotBlank(message = "Asset address is required")
        String asset,

        @NotNull(message = "Amount is required")
        @Positive(message = "Amount must be positive")
        BigInteger amount
) {
}
