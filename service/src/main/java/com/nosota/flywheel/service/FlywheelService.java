package com.nosota.flywheel.service;

import com.nosota.flywheel.api.model.CampaignStatus;
import com.nosota.flywheel.api.model.FlywheelEventType;
import com.nosota.flywheel.config.FlywheelProperties;
import com.nosota.flywheel.error.*;
import com.nosota.flywheel.hooks.*;
import com.nosota.flywheel.model.Campaign;
import com.nosota.flywheel.model.FlywheelEvent;
import com.nosota.flywheel.model.LedgerTotals;
import com.nosota.flywheel.network.Addresses;
import com.nosota.flywheel.repository.CampaignRepository;
import com.nosota.flywheel.vault.Vault;
import com.nosota.flywheel.vault.VaultFactory;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

import java.math.BigInteger;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * The flywheel registry.
 *
 * <p>Single entry point for every state change of every campaign. It owns the
 * allocation ledger, asks each campaign's hooks what should happen, executes the
 * resulting transfers through the campaign's vault and records an event per change.
 *
 * <p>Each operation runs in one transaction on a campaign row locked for update.
 * Any {@link FlywheelException}, whether raised here, by the hooks or by the vault,
 * rolls back the ledger, the transfers and the events of the whole call.
 *
 * <p>Solvency: after every payout operation the vault must hold at least the
 * allocated fees plus, unless the campaign is FINALIZED, the allocated payouts.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class FlywheelService {

    private final CampaignRepository campaignRepository;
    private final CampaignLedgerService ledgerService;
    private final EventLogService eventLogService;
    private final HooksRegistry hooksRegistry;
    private final VaultFactory vaultFactory;
    private final CampaignAddressDerivation addressDerivation;
    private final CampaignStatusStateMachine stateMachine;
    private final FlywheelProperties properties;

    /**
     * Creates a campaign, or returns the existing one.
     *
     * <p>The address is derived from (hooks, nonce, hookData). If a campaign already lives
     * there it is returned as is and the hooks are not called again.
     *
     * @param sender   Address creating the campaign
     * @param hooks    Hook policy address
     * @param nonce    Unsigned 256-bit nonce
     * @param hookData Creation payload passed to the hooks
     * @return The new or existing campaign
     * @throws UnknownHooksException if no hooks are registered at {@code hooks}
     */
    @Transactional(rollbackFor = Exception.class)
    public Campaign createCampaign(@NotNull String sender, @NotNull String hooks, @NotNull BigInteger nonce,
                                   byte[] hookData) throws FlywheelException {
        String hooksAddress = Addresses.normalize(hooks);
        byte[] payload = hookData == null ? new byte[0] : hookData;
        String address = addressDerivation.predictCampaignAddress(hooksAddress, nonce, payload);

        Campaign existing = campaignRepository.findById(address).orElse(null);
        if (existing != null) {
            log.info("Campaign already exists: campaign={}, hooks={}", address, existing.getHooks());
            return existing;
        }

        CampaignHooks campaignHooks = hooksRegistry.resolve(hooksAddress);

        if (campaignRepository.insertIfAbsent(address, hooksAddress, LocalDateTime.now()) == 0) {
            log.info("Campaign created concurrently, returning it: campaign={}", address);
            return getCampaign(address);
        }
        Campaign campaign = getCampaign(address);
        eventLogService.recordCampaignCreated(address, hooksAddress, sender);

        campaignHooks.onCreateCampaign(properties.address(), new HookCall(sender, address, null, payload), nonce);

        log.info("Campaign created: campaign={}, hooks={}, sender={}", address, hooksAddress, sender);
        return campaign;
    }

    /**
     * Moves a campaign to a new status, subject to the transition rules and the hooks' approval.
     *
     * @throws InvalidCampaignStatusException if the campaign is FINALIZED, the status is unchanged,
     *                                        or FINALIZING would move anywhere but FINALIZED
     */
    @Transactional(rollbackFor = Exception.class)
    public Campaign updateStatus(@NotNull String sender, @NotNull String campaignAddress,
                                 @NotNull CampaignStatus newStatus, byte[] hookData) throws FlywheelException {
        Campaign campaign = lockCampaign(campaignAddress);
        CampaignStatus oldStatus = campaign.getStatus();

        stateMachine.validateTransition(campaign.getAddress(), oldStatus, newStatus);
        hooksOf(campaign).onUpdateStatus(properties.address(), call(sender, campaign, null, hookData),
                oldStatus, newStatus);

        campaign.setStatus(newStatus);
        campaign.setUpdatedAt(LocalDateTime.now());
        campaignRepository.save(campaign);
        eventLogService.recordStatusUpdated(campaign.getAddress(), sender, oldStatus, newStatus);

        log.info("Campaign status updated: campaign={}, {} -> {}, sender={}",
                campaign.getAddress(), oldStatus, newStatus, sender);
        return campaign;
    }

    /**
     * Lets the hooks update campaign metadata and announces the current content URI.
     *
     * @return Campaign URI after the update
     */
    @Transactional(rollbackFor = Exception.class)
    public String updateMetadata(@NotNull String sender, @NotNull String campaignAddress, byte[] hookData)
            throws FlywheelException {
        Campaign campaign = lockCampaign(campaignAddress);
        if (stateMachine.isFinalState(campaign.getStatus())) {
            throw new InvalidCampaignStatusException(
                    String.format("Campaign %s is %s, metadata can no longer change",
                            campaign.getAddress(), campaign.getStatus()));
        }

        CampaignHooks hooks = hooksOf(campaign);
        hooks.onUpdateMetadata(properties.address(), call(sender, campaign, null, hookData));

        String uri = hooks.campaignURI(campaign.getAddress());
        eventLogService.recordMetadataUpdated(campaign.getAddress(), sender);
        eventLogService.recordContentUriUpdated(campaign.getAddress(), uri);

        log.info("Campaign metadata updated: campaign={}, uri={}, sender={}", campaign.getAddress(), uri, sender);
        return uri;
    }

    /**
     * Reserves payouts for later distribution.
     *
     * @return Events emitted, one {@code PAYOUT_ALLOCATED} per non-zero allocation
     * @throws InsufficientCampaignFundsException if the vault no longer covers the allocations
     */
    @Transactional(rollbackFor = Exception.class)
    public List<FlywheelEvent> allocate(@NotNull String sender, @NotNull String campaignAddress,
                                        @NotNull String asset, byte[] hookData) throws FlywheelException {
        Campaign campaign = lockCampaign(campaignAddress);
        String assetAddress = Addresses.normalize(asset);
        requireAcceptingPayouts(campaign);

        List<Allocation> allocations = hooksOf(campaign)
                .onAllocate(properties.address(), call(sender, campaign, assetAddress, hookData));

        List<FlywheelEvent> events = new ArrayList<>();
        for (Allocation allocation : checkInstructions(allocations)) {
            BigInteger amount = checkAmount(allocation.amount());
            if (amount.signum() == 0) {
                continue;
            }
            String key = Addresses.normalizeKey(allocation.key());
            ledgerService.allocatePayout(campaign.getAddress(), assetAddress, key, amount);
            events.add(eventLogService.recordKeyed(FlywheelEventType.PAYOUT_ALLOCATED,
                    campaign.getAddress(), assetAddress, key, amount, allocation.extraData()));
        }

        assertSolvency(campaign, assetAddress);

        log.info("Payouts allocated: campaign={}, asset={}, entries={}", campaign.getAddress(), assetAddress, events.size());
        return events;
    }

    /**
     * Releases previously reserved payouts.
     *
     * @return Events emitted, one {@code PAYOUTS_DEALLOCATED} per non-zero deallocation
     * @throws AllocationUnderflowException if more is released than a key holds
     */
    @Transactional(rollbackFor = Exception.class)
    public List<FlywheelEvent> deallocate(@NotNull String sender, @NotNull String campaignAddress,
                                          @NotNull String asset, byte[] hookData) throws FlywheelException {
        Campaign campaign = lockCampaign(campaignAddress);
        String assetAddress = Addresses.normalize(asset);
        requireAcceptingPayouts(campaign);

        List<Allocation> allocations = hooksOf(campaign)
                .onDeallocate(properties.address(), call(sender, campaign, assetAddress, hookData));

        List<FlywheelEvent> events = new ArrayList<>();
        for (Allocation allocation : checkInstructions(allocations)) {
            BigInteger amount = checkAmount(allocation.amount());
            if (amount.signum() == 0) {
                continue;
            }
            String key = Addresses.normalizeKey(allocation.key());
            ledgerService.deallocatePayout(campaign.getAddress(), assetAddress, key, amount);
            events.add(eventLogService.recordKeyed(FlywheelEventType.PAYOUTS_DEALLOCATED,
                    campaign.getAddress(), assetAddress, key, amount, allocation.extraData()));
        }

        log.info("Payouts deallocated: campaign={}, asset={}, entries={}", campaign.getAddress(), assetAddress, events.size());
        return events;
    }

    /**
     * Pays out previously allocated amounts, then handles the fees the hooks charged.
     *
     * @return Events emitted: {@code PAYOUTS_DISTRIBUTED} per payout, then one fee event per fee
     * @throws SendFailedException if a payout transfer fails
     */
    @Transactional(rollbackFor = Exception.class)
    public List<FlywheelEvent> distribute(@NotNull String sender, @NotNull String campaignAddress,
                                          @NotNull String asset, byte[] hookData) throws FlywheelException {
        Campaign campaign = lockCampaign(campaignAddress);
        String assetAddress = Addresses.normalize(asset);
        requireAcceptingPayouts(campaign);

        PayoutInstructions<Distribution> instructions = nullSafe(hooksOf(campaign)
                .onDistribute(properties.address(), call(sender, campaign, assetAddress, hookData)));
        Vault vault = vaultFactory.vaultFor(campaign.getAddress());

        List<FlywheelEvent> events = new ArrayList<>();
        for (Distribution distribution : checkInstructions(instructions.payouts())) {
            BigInteger amount = checkAmount(distribution.amount());
            if (amount.signum() == 0) {
                continue;
            }
            String key = Addresses.normalizeKey(distribution.key());
            String recipient = Addresses.normalize(distribution.recipient());

            ledgerService.deallocatePayout(campaign.getAddress(), assetAddress, key, amount);
            transferOrFail(vault, assetAddress, recipient, amount);
            events.add(eventLogService.recordTransfer(FlywheelEventType.PAYOUTS_DISTRIBUTED,
                    campaign.getAddress(), assetAddress, recipient, key, amount, distribution.extraData()));
        }

        events.addAll(processFees(campaign, vault, assetAddress, instructions.fees(), instructions.sendFeesNow()));
        assertSolvency(campaign, assetAddress);

        log.info("Payouts distributed: campaign={}, asset={}, events={}", campaign.getAddress(), assetAddress, events.size());
        return events;
    }

    /**
     * Pays out immediately, without prior allocation, then handles the fees the hooks charged.
     *
     * <p>Before any transfer the vault must cover its obligations plus the payouts; after
     * the transfers the usual solvency rule applies.
     *
     * @return Events emitted: {@code PAYOUT_SENT} per payout, then one fee event per fee
     * @throws SendFailedException if a payout transfer fails
     */
    @Transactional(rollbackFor = Exception.class)
    public List<FlywheelEvent> send(@NotNull String sender, @NotNull String campaignAddress,
                                    @NotNull String asset, byte[] hookData) throws FlywheelException {
        Campaign campaign = lockCampaign(campaignAddress);
        String assetAddress = Addresses.normalize(asset);
        requireAcceptingPayouts(campaign);

        PayoutInstructions<Payout> instructions = nullSafe(hooksOf(campaign)
                .onSend(properties.address(), call(sender, campaign, assetAddress, hookData)));
        Vault vault = vaultFactory.vaultFor(campaign.getAddress());

        List<Payout> payouts = checkInstructions(instructions.payouts());
        BigInteger outgoing = BigInteger.ZERO;
        for (Payout payout : payouts) {
            outgoing = outgoing.add(checkAmount(payout.amount()));
        }
        ledgerService.assertSolvency(campaign.getAddress(), campaign.getStatus(), assetAddress,
                vault.balanceOf(assetAddress).subtract(outgoing));

        List<FlywheelEvent> events = new ArrayList<>();
        for (Payout payout : payouts) {
            if (payout.amount().signum() == 0) {
                continue;
            }
            String recipient = Addresses.normalize(payout.recipient());
            transferOrFail(vault, assetAddress, recipient, payout.amount());
            events.add(eventLogService.recordTransfer(FlywheelEventType.PAYOUT_SENT,
                    campaign.getAddress(), assetAddress, recipient, null, payout.amount(), payout.extraData()));
        }

        events.addAll(processFees(campaign, vault, assetAddress, instructions.fees(), instructions.sendFeesNow()));
        assertSolvency(campaign, assetAddress);

        log.info("Payouts sent: campaign={}, asset={}, events={}", campaign.getAddress(), assetAddress, events.size());
        return events;
    }

    /**
     * Pays out previously allocated fees.
     *
     * <p>A fee whose transfer fails keeps its allocation and is reported with
     * {@code FEE_TRANSFER_FAILED}; the remaining fees are still processed.
     * Accepted in any status.
     *
     * @return Events emitted, one per non-zero fee
     * @throws AllocationUnderflowException if a fee exceeds what its key holds
     */
    @Transactional(rollbackFor = Exception.class)
    public List<FlywheelEvent> distributeFees(@NotNull String sender, @NotNull String campaignAddress,
                                              @NotNull String asset, byte[] hookData) throws FlywheelException {
        Campaign campaign = lockCampaign(campaignAddress);
        String assetAddress = Addresses.normalize(asset);

        List<Distribution> fees = hooksOf(campaign)
                .onDistributeFees(properties.address(), call(sender, campaign, assetAddress, hookData));
        Vault vault = vaultFactory.vaultFor(campaign.getAddress());

        List<FlywheelEvent> events = new ArrayList<>();
        for (Distribution fee : checkInstructions(fees)) {
            BigInteger amount = checkAmount(fee.amount());
            if (amount.signum() == 0) {
                continue;
            }
            String key = Addresses.normalizeKey(fee.key());
            String recipient = Addresses.normalize(fee.recipient());

            ledgerService.requireFeeAllocation(campaign.getAddress(), assetAddress, key, amount);
            if (vault.sendTokens(properties.address(), assetAddress, recipient, amount)) {
                ledgerService.deallocateFee(campaign.getAddress(), assetAddress, key, amount);
                events.add(eventLogService.recordTransfer(FlywheelEventType.FEES_DISTRIBUTED,
                        campaign.getAddress(), assetAddress, recipient, key, amount, fee.extraData()));
            } else {
                log.warn("Fee distribution failed, allocation kept: campaign={}, asset={}, recipient={}, key={}, amount={}",
                        campaign.getAddress(), assetAddress, recipient, key, amount);
                events.add(eventLogService.recordTransfer(FlywheelEventType.FEE_TRANSFER_FAILED,
                        campaign.getAddress(), assetAddress, recipient, key, amount, fee.extraData()));
            }
        }

        assertSolvency(campaign, assetAddress);

        log.info("Fees distributed: campaign={}, asset={}, events={}", campaign.getAddress(), assetAddress, events.size());
        return events;
    }

    /**
     * Withdraws funds not owed to anyone. Accepted in any status.
     *
     * <p>The vault must stay solvent after the withdrawal: while not FINALIZED it has to
     * keep covering allocated payouts and fees, once FINALIZED only the fees.
     *
     * @return The single {@code FUNDS_WITHDRAWN} event
     * @throws ZeroAmountException if the hooks ask to withdraw nothing
     */
    @Transactional(rollbackFor = Exception.class)
    public List<FlywheelEvent> withdrawFunds(@NotNull String sender, @NotNull String campaignAddress,
                                             @NotNull String asset, byte[] hookData) throws FlywheelException {
        Campaign campaign = lockCampaign(campaignAddress);
        String assetAddress = Addresses.normalize(asset);

        Payout payout = hooksOf(campaign)
                .onWithdrawFunds(properties.address(), call(sender, campaign, assetAddress, hookData));
        BigInteger amount = checkAmount(payout == null ? null : payout.amount());
        if (amount.signum() == 0) {
            throw new ZeroAmountException("Withdrawal amount must be greater than zero for campaign " + campaign.getAddress());
        }
        String recipient = Addresses.normalize(payout.recipient());
        Vault vault = vaultFactory.vaultFor(campaign.getAddress());

        ledgerService.assertSolvency(campaign.getAddress(), campaign.getStatus(), assetAddress,
                vault.balanceOf(assetAddress).subtract(amount));
        transferOrFail(vault, assetAddress, recipient, amount);
        assertSolvency(campaign, assetAddress);

        FlywheelEvent event = eventLogService.recordTransfer(FlywheelEventType.FUNDS_WITHDRAWN,
                campaign.getAddress(), assetAddress, recipient, null, amount, payout.extraData());

        log.info("Funds withdrawn: campaign={}, asset={}, recipient={}, amount={}",
                campaign.getAddress(), assetAddress, recipient, amount);
        return List.of(event);
    }

    // Read accessors

    public String predictCampaignAddress(@NotNull String hooks, @NotNull BigInteger nonce, byte[] hookData)
            throws FlywheelException {
        return addressDerivation.predictCampaignAddress(hooks, nonce, hookData == null ? new byte[0] : hookData);
    }

    @Transactional(readOnly = true)
    public boolean campaignExists(@NotNull String campaignAddress) throws FlywheelException {
        return campaignRepository.existsById(Addresses.normalize(campaignAddress));
    }

    @Transactional(readOnly = true)
    public Campaign getCampaign(@NotNull String campaignAddress) throws FlywheelException {
        String address = Addresses.normalize(campaignAddress);
        return campaignRepository.findById(address)
                .orElseThrow(() -> new CampaignNotFoundException("Campaign " + address + " does not exist"));
    }

    @Transactional(readOnly = true)
    public String campaignURI(@NotNull String campaignAddress) throws FlywheelException {
        Campaign campaign = getCampaign(campaignAddress);
        return hooksOf(campaign).campaignURI(campaign.getAddress());
    }

    @Transactional(readOnly = true)
    public LedgerTotals getTotals(@NotNull String campaignAddress, @NotNull String asset) throws FlywheelException {
        Campaign campaign = getCampaign(campaignAddress);
        return ledgerService.getTotals(campaign.getAddress(), Addresses.normalize(asset));
    }

    @Transactional(readOnly = true)
    public BigInteger getAllocatedPayout(@NotNull String campaignAddress, @NotNull String asset, @NotNull String key)
            throws FlywheelException {
        Campaign campaign = getCampaign(campaignAddress);
        return ledgerService.getAllocatedPayout(campaign.getAddress(), Addresses.normalize(asset),
                Addresses.normalizeKey(key));
    }

    @Transactional(readOnly = true)
    public BigInteger getAllocatedFee(@NotNull String campaignAddress, @NotNull String asset, @NotNull String key)
            throws FlywheelException {
        Campaign campaign = getCampaign(campaignAddress);
        return ledgerService.getAllocatedFee(campaign.getAddress(), Addresses.normalize(asset),
                Addresses.normalizeKey(key));
    }

    @Transactional(readOnly = true)
    public BigInteger getVaultBalance(@NotNull String campaignAddress, @NotNull String asset) throws FlywheelException {
        Campaign campaign = getCampaign(campaignAddress);
        return vaultFactory.vaultFor(campaign.getAddress()).balanceOf(Addresses.normalize(asset));
    }

    @Transactional(readOnly = true)
    public Page<FlywheelEvent> getEvents(@NotNull String campaignAddress, int page, int size) throws FlywheelException {
        Campaign campaign = getCampaign(campaignAddress);
        return eventLogService.getEvents(campaign.getAddress(), page, size);
    }

    /**
     * Fee handling shared by send and distribute.
     *
     * <p>With {@code sendNow} a fee is transferred at once ({@code FEE_SENT}); if the
     * transfer fails the fee is reserved instead ({@code FEE_TRANSFER_FAILED}). Without
     * it the fee is only reserved ({@code FEE_ALLOCATED}).
     */
    private List<FlywheelEvent> processFees(Campaign campaign, Vault vault, String asset,
                                            List<Distribution> fees, boolean sendNow) throws FlywheelException {
        List<FlywheelEvent> events = new ArrayList<>();
        for (Distribution fee : checkInstructions(fees)) {
            BigInteger amount = checkAmount(fee.amount());
            if (amount.signum() == 0) {
                continue;
            }
            String key = Addresses.normalizeKey(fee.key());
            String recipient = Addresses.normalize(fee.recipient());

            if (sendNow && vault.sendTokens(properties.address(), asset, recipient, amount)) {
                events.add(eventLogService.recordTransfer(FlywheelEventType.FEE_SENT,
                        campaign.getAddress(), asset, recipient, key, amount, fee.extraData()));
                continue;
            }

            ledgerService.allocateFee(campaign.getAddress(), asset, key, amount);
            if (sendNow) {
                log.warn("Fee transfer failed, fee reserved: campaign={}, asset={}, recipient={}, key={}, amount={}",
                        campaign.getAddress(), asset, recipient, key, amount);
                events.add(eventLogService.recordTransfer(FlywheelEventType.FEE_TRANSFER_FAILED,
                        campaign.getAddress(), asset, recipient, key, amount, fee.extraData()));
            } else {
                events.add(eventLogService.recordKeyed(FlywheelEventType.FEE_ALLOCATED,
                        campaign.getAddress(), asset, key, amount, fee.extraData()));
            }
        }
        return events;
    }

    private void transferOrFail(Vault vault, String asset, String recipient, BigInteger amount)
            throws FlywheelException {
        if (!vault.sendTokens(properties.address(), asset, recipient, amount)) {
            throw new SendFailedException(String.format("Transfer of %s %s from campaign %s to %s failed",
                    amount, asset, vault.getAddress(), recipient));
        }
    }

    private void assertSolvency(Campaign campaign, String asset) throws InsufficientCampaignFundsException {
        BigInteger balance = vaultFactory.vaultFor(campaign.getAddress()).balanceOf(asset);
        ledgerService.assertSolvency(campaign.getAddress(), campaign.getStatus(), asset, balance);
    }

    private void requireAcceptingPayouts(Campaign campaign) throws InvalidCampaignStatusException {
        if (!stateMachine.isAcceptingPayouts(campaign.getStatus())) {
            throw new InvalidCampaignStatusException(
                    String.format("Campaign %s is %s, payouts require ACTIVE or FINALIZING",
                            campaign.getAddress(), campaign.getStatus()));
        }
    }

    private Campaign lockCampaign(String campaignAddress) throws FlywheelException {
        String address = Addresses.normalize(campaignAddress);
        return campaignRepository.findByAddressForUpdate(address)
                .orElseThrow(() -> new CampaignNotFoundException("Campaign " + address + " does not exist"));
    }

    private CampaignHooks hooksOf(Campaign campaign) throws UnknownHooksException {
        return hooksRegistry.resolve(campaign.getHooks());
    }

    private static HookCall call(String sender, Campaign campaign, String asset, byte[] hookData) {
        return new HookCall(sender, campaign.getAddress(), asset, hookData == null ? new byte[0] : hookData);
    }

    private static BigInteger checkAmount(BigInteger amount) throws InvalidHookDataException {
        if (amount == null || amount.signum() < 0) {
            throw new InvalidHookDataException("Hooks returned an invalid amount: " + amount);
        }
        return amount;
    }

    /**
     * @return The hooks' instructions, empty for a {@code null} list
     * @throws InvalidHookDataException if the list holds a {@code null} instruction
     */
    private static <T> List<T> checkInstructions(List<T> instructions) throws InvalidHookDataException {
        if (instructions == null) {
            return List.of();
        }
        for (T instruction : instructions) {
            if (instruction == null) {
                throw new InvalidHookDataException("Hooks returned a null instruction");
            }
        }
        return instructions;
    }

    private static <T> PayoutInstructions<T> nullSafe(PayoutInstructions<T> instructions) {
        return instructions == null ? PayoutInstructions.withoutFees(List.of()) : instructions;
    }
}
