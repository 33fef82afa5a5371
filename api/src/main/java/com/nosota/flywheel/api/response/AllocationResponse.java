package com.nosota.flywheel.api.response;

import java.math.BigInteger;

/**
 * Amount allocated to a single recipient or fee key.
 */
public record AllocationResponse(
        String campaign,
        String asset,
        String key,
        BigInteger amount
) {}
