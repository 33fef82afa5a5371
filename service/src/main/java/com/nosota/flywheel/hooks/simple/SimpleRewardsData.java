package com.nosota.flywheel.hooks.simple;

import java.math.BigInteger;
import java.util.List;

/**
 * JSON payloads understood by {@link SimpleRewardsHooks}.
 */
public final class SimpleRewardsData {

    private SimpleRewardsData() {
    }

    /**
     * Creation payload.
     */
    public record CreateData(String owner, String manager, String uri) {}

    /**
     * Payload of allocate, deallocate, distribute and send.
     */
    public record PayoutsData(List<PayoutData> payouts) {}

    /**
     * One payout; also the payload of a withdrawal.
     */
    public record PayoutData(String recipient, BigInteger amount, String extraData) {}

    /**
     * Metadata update payload; a {@code null} uri leaves the stored one unchanged.
     */
    public record MetadataData(String uri) {}
}
