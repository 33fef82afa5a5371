package com.nosota.flywheel.hooks;

import java.math.BigInteger;

/**
 * Transfer of an amount recorded under a key to an address.
 *
 * <p>Used for payout distributions and for fees; the key selects the ledger entry,
 * the recipient receives the funds.
 */
public record Distribution(
        String recipient,
        String key,
        BigInteger amount,
        String extraData
) {}
