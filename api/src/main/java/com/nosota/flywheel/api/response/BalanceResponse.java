package com.nosota.flywheel.api.response;

import java.math.BigInteger;

/**
 * Balance of a holder (campaign vault or any other address) for one asset.
 */
public record BalanceResponse(
        String holder,
        String asset,
        BigInteger balance
) {}
