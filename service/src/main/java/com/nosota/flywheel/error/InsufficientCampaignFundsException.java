package com.nosota.flywheel.error;

import java.math.BigInteger;

/**
 * Raised when a campaign's vault balance no longer covers what the ledger owes.
 */
public class InsufficientCampaignFundsException extends FlywheelException {

    private final BigInteger balance;
    private final BigInteger required;

    public InsufficientCampaignFundsException(String campaign, String asset, BigInteger balance, BigInteger required) {
        super(ErrorCode.INSUFFICIENT_CAMPAIGN_FUNDS,
                String.format("Insufficient funds in campaign %s for asset %s: balance=%s, required=%s",
                        campaign, asset, balance, required));
        this.balance = balance;
        this.required = required;
    }

    public BigInteger getBalance() {
        return balance;
    }

    public BigInteger getRequired() {
        return required;
    }
}
