package com.nosota.flywheel.api.model;

/**
 * Types of entries in the append-only campaign event log.
 */
public enum FlywheelEventType {
    CAMPAIGN_CREATED,
    CAMPAIGN_STATUS_UPDATED,
    CAMPAIGN_METADATA_UPDATED,
    CONTENT_URI_UPDATED,
    PAYOUT_ALLOCATED,
    PAYOUTS_DEALLOCATED,
    PAYOUT_SENT,
    PAYOUTS_DISTRIBUTED,
    FEE_SENT,
    FEE_ALLOCATED,
    FEE_TRANSFER_FAILED,
    FEES_DISTRIBUTED,
    FUNDS_WITHDRAWN
}
