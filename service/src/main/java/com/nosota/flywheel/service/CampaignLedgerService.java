package com.nosota.flywheel.service;

import com.nosota.flywheel.api.model.CampaignStatus;
import com.nosota.flywheel.error.AllocationUnderflowException;
import com.nosota.flywheel.error.InsufficientCampaignFundsException;
import com.nosota.flywheel.model.LedgerEntry;
import com.nosota.flywheel.model.LedgerEntryKind;
import com.nosota.flywheel.model.LedgerTotals;
import com.nosota.flywheel.repository.LedgerEntryRepository;
import com.nosota.flywheel.repository.LedgerTotalsRepository;
import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.time.LocalDateTime;

/**
 * Allocation bookkeeping and the solvency rule.
 *
 * <p>Maintains per-key payout and fee allocations and the per-(campaign, asset)
 * totals. Mutations run inside the registry's transaction and are never called by
 * hooks or vaults.
 *
 * <p>Solvency: {@code vaultBalance >= totalAllocatedFees + totalAllocatedPayouts}; once a
 * campaign is FINALIZED only the fees must stay covered.
 */
@Service
@AllArgsConstructor
@Slf4j
public class CampaignLedgerService {

    private final LedgerEntryRepository ledgerEntryRepository;
    private final LedgerTotalsRepository ledgerTotalsRepository;

    @Transactional(propagation = Propagation.MANDATORY)
    public void allocatePayout(String campaign, String asset, String key, BigInteger amount) {
        increase(campaign, asset, LedgerEntryKind.PAYOUT, key, amount);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void deallocatePayout(String campaign, String asset, String key, BigInteger amount)
            throws AllocationUnderflowException {
        decrease(campaign, asset, LedgerEntryKind.PAYOUT, key, amount);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void allocateFee(String campaign, String asset, String key, BigInteger amount) {
        increase(campaign, asset, LedgerEntryKind.FEE, key, amount);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void deallocateFee(String campaign, String asset, String key, BigInteger amount)
            throws AllocationUnderflowException {
        decrease(campaign, asset, LedgerEntryKind.FEE, key, amount);
    }

    /**
     * Checks that a fee entry holds at least {@code amount}, without changing it.
     *
     * @throws AllocationUnderflowException if less is allocated
     */
    public void requireFeeAllocation(String campaign, String asset, String key, BigInteger amount)
            throws AllocationUnderflowException {
        BigInteger allocated = getAllocatedFee(campaign, asset, key);
        if (allocated.compareTo(amount) < 0) {
            throw underflow(campaign, asset, LedgerEntryKind.FEE, key, allocated, amount);
        }
    }

    /**
     * Asserts the solvency rule for one campaign and asset.
     *
     * @param campaign     Campaign address
     * @param status       Campaign status the rule is evaluated for
     * @param asset        Asset address
     * @param vaultBalance Current vault balance of the asset
     * @throws InsufficientCampaignFundsException if the balance does not cover the requirement
     */
    public void assertSolvency(String campaign, CampaignStatus status, String asset, BigInteger vaultBalance)
            throws InsufficientCampaignFundsException {
        BigInteger required = requiredBalance(campaign, status, asset);
        if (vaultBalance.compareTo(required) < 0) {
            log.warn("Solvency check failed: campaign={}, asset={}, status={}, balance={}, required={}",
                    campaign, asset, status, vaultBalance, required);
            throw new InsufficientCampaignFundsException(campaign, asset, vaultBalance, required);
        }
    }

    /**
     * @return Balance the vault must hold: allocated fees, plus allocated payouts unless FINALIZED
     */
    public BigInteger requiredBalance(String campaign, CampaignStatus status, String asset) {
        LedgerTotals totals = getTotals(campaign, asset);
        BigInteger required = totals.getTotalAllocatedFees();
        if (status != CampaignStatus.FINALIZED) {
            required = required.add(totals.getTotalAllocatedPayouts());
        }
        return required;
    }

    /**
     * @return Totals for the campaign and asset; zero totals (not persisted) if none were recorded
     */
    public LedgerTotals getTotals(String campaign, String asset) {
        return ledgerTotalsRepository.findByCampaignAndAsset(campaign, asset)
                .orElseGet(() -> newTotals(campaign, asset));
    }

    public BigInteger getAllocatedPayout(String campaign, String asset, String key) {
        return amountOf(campaign, asset, LedgerEntryKind.PAYOUT, key);
    }

    public BigInteger getAllocatedFee(String campaign, String asset, String key) {
        return amountOf(campaign, asset, LedgerEntryKind.FEE, key);
    }

    private BigInteger amountOf(String campaign, String asset, LedgerEntryKind kind, String key) {
        return ledgerEntryRepository.findByCampaignAndAssetAndKindAndRecipientKey(campaign, asset, kind, key)
                .map(LedgerEntry::getAmount)
                .orElse(BigInteger.ZERO);
    }

    private void increase(String campaign, String asset, LedgerEntryKind kind, String key, BigInteger amount) {
        LedgerEntry entry = ledgerEntryRepository
                .findByCampaignAndAssetAndKindAndRecipientKey(campaign, asset, kind, key)
                .orElseGet(() -> newEntry(campaign, asset, kind, key));
        entry.setAmount(entry.getAmount().add(amount));
        entry.setUpdatedAt(LocalDateTime.now());
        ledgerEntryRepository.save(entry);

        LedgerTotals totals = getTotals(campaign, asset);
        if (kind == LedgerEntryKind.PAYOUT) {
            totals.setTotalAllocatedPayouts(totals.getTotalAllocatedPayouts().add(amount));
        } else {
            totals.setTotalAllocatedFees(totals.getTotalAllocatedFees().add(amount));
        }
        ledgerTotalsRepository.save(totals);

        log.debug("Ledger increased: campaign={}, asset={}, kind={}, key={}, amount={}, entry={}",
                campaign, asset, kind, key, amount, entry.getAmount());
    }

    private void decrease(String campaign, String asset, LedgerEntryKind kind, String key, BigInteger amount)
            throws AllocationUnderflowException {
        LedgerEntry entry = ledgerEntryRepository
                .findByCampaignAndAssetAndKindAndRecipientKey(campaign, asset, kind, key)
                .orElse(null);
        BigInteger allocated = entry == null ? BigInteger.ZERO : entry.getAmount();
        if (entry == null || allocated.compareTo(amount) < 0) {
            throw underflow(campaign, asset, kind, key, allocated, amount);
        }
        entry.setAmount(allocated.subtract(amount));
        entry.setUpdatedAt(LocalDateTime.now());
        ledgerEntryRepository.save(entry);

        LedgerTotals totals = getTotals(campaign, asset);
        if (kind == LedgerEntryKind.PAYOUT) {
            totals.setTotalAllocatedPayouts(totals.getTotalAllocatedPayouts().subtract(amount));
        } else {
            totals.setTotalAllocatedFees(totals.getTotalAllocatedFees().subtract(amount));
        }
        ledgerTotalsRepository.save(totals);

        log.debug("Ledger decreased: campaign={}, asset={}, kind={}, key={}, amount={}, entry={}",
                campaign, asset, kind, key, amount, entry.getAmount());
    }

    private static AllocationUnderflowException underflow(String campaign, String asset, LedgerEntryKind kind,
                                                          String key, BigInteger allocated, BigInteger requested) {
        return new AllocationUnderflowException(
                String.format("Insufficient %s allocation in campaign %s for asset %s, key %s: allocated=%s, requested=%s",
                        kind, campaign, asset, key, allocated, requested));
    }

    private static LedgerEntry newEntry(String campaign, String asset, LedgerEntryKind kind, String key) {
        LedgerEntry entry = new LedgerEntry();
        entry.setCampaign(campaign);
        entry.setAsset(asset);
        entry.setKind(kind);
        entry.setRecipientKey(key);
        entry.setAmount(BigInteger.ZERO);
        return entry;
    }

    private static LedgerTotals newTotals(String campaign, String asset) {
        LedgerTotals totals = new LedgerTotals();
        totals.setCampaign(campaign);
        totals.setAsset(asset);
        return totals;
    }
}
