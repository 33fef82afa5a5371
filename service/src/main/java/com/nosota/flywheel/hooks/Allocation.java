package com.nosota.flywheel.hooks;

import java.math.BigInteger;

/**
 * Ledger promise to a recipient key (allocate and deallocate).
 *
 * @param key       32-byte recipient key; its resolution to an address is up to the hooks
 * @param amount    Amount
 * @param extraData Opaque data echoed into the event log
 */
public record Allocation(
        String key,
        BigInteger amount,
        String extraData
) {}
