package com.nosota.flywheel.hooks;

import java.util.List;

/**
 * Payouts computed by the hooks for send or distribute, together with the fees
 * charged on them.
 *
 * @param payouts     Payouts to execute now
 * @param fees        Fees to charge
 * @param sendFeesNow {@code true} to transfer fees immediately, {@code false} to reserve them
 */
public record PayoutInstructions<T>(
        List<T> payouts,
        List<Distribution> fees,
        boolean sendFeesNow
) {
    public PayoutInstructions {
        payouts = payouts == null ? List.of() : payouts;
        fees = fees == null ? List.of() : fees;
    }

    public static <T> PayoutInstructions<T> withoutFees(List<T> payouts) {
        return new PayoutInstructions<>(payouts, List.of(), false);
    }
}
