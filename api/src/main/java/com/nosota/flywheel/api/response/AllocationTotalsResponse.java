package com.nosota.flywheel.api.response;

import java.math.BigInteger;

/**
 * Aggregate allocation counters of a campaign for one asset.
 */
public record AllocationTotalsResponse(
        String campaign,
        String asset,
        BigInteger totalAllocatedPayouts,
        BigInteger totalAllocatedFees
) {}
