package com.nosota.flywheel.api.model;

/**
 * Lifecycle status of a campaign.
 *
 * <p>State diagram:
 * <pre>
 * INACTIVE &lt;--&gt; ACTIVE
 *     |            |
 *     +--&gt; FINALIZING --&gt; FINALIZED
 * </pre>
 *
 * <p>INACTIVE is the creation default. FINALIZING may only move to FINALIZED,
 * and FINALIZED is terminal. Hooks may forbid further transitions.
 */
public enum CampaignStatus {
    /** Created, not accepting payouts. */
    INACTIVE,
    /** Accepting payouts. */
    ACTIVE,
    /** Winding down, still accepting payouts (e.g. during an attribution window). */
    FINALIZING,
    /** Terminal. Unallocated payout capacity becomes withdrawable. */
    FINALIZED
}
