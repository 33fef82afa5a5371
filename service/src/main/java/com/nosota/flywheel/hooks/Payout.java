package com.nosota.flywheel.hooks;

import java.math.BigInteger;

/**
 * Immediate transfer to an address (send and withdraw).
 */
public record Payout(
        String recipient,
        BigInteger amount,
        String extraData
) {}
