package com.nosota.flywheel.model;

public enum LedgerEntryKind {
    PAYOUT,
    FEE
}
