package com.nosota.flywheel.hooks.simple;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nosota.flywheel.api.model.CampaignStatus;
import com.nosota.flywheel.config.FlywheelProperties;
import com.nosota.flywheel.error.FlywheelException;
import com.nosota.flywheel.error.InvalidHookDataException;
import com.nosota.flywheel.error.UnauthorizedException;
import com.nosota.flywheel.hooks.*;
import com.nosota.flywheel.network.Addresses;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Manager-directed rewards.
 *
 * <p>Each campaign has an owner and a manager, fixed at creation:
 * <ul>
 *   <li>the manager changes status and directs every payout (allocate, deallocate,
 *       distribute, send)</li>
 *   <li>the owner withdraws funds</li>
 *   <li>either of them may update the campaign URI</li>
 * </ul>
 *
 * <p>Recipient keys are recipient addresses left-padded to 32 bytes. No fees are charged.
 * Payloads are UTF-8 JSON, see {@link SimpleRewardsData}.
 */
@Component
@Slf4j
public class SimpleRewardsHooks extends CampaignHooks {

    private final String address;
    private final SimpleRewardsCampaignRepository campaignRepository;
    private final ObjectMapper objectMapper;

    public SimpleRewardsHooks(FlywheelProperties properties,
                              @Value("${flywheel.hooks.simple-rewards.address}") String address,
                              SimpleRewardsCampaignRepository campaignRepository,
                              ObjectMapper objectMapper) {
        super(properties.address());
        this.address = address.trim().toLowerCase(Locale.ROOT);
        this.campaignRepository = campaignRepository;
        this.objectMapper = objectMapper;
    }

    @Override
    public String getAddress() {
        return address;
    }

    @Override
    public String campaignURI(String campaign) {
        return campaignRepository.findById(campaign)
                .map(SimpleRewardsCampaign::getUri)
                .orElse("");
    }

    @Override
    protected void createCampaign(HookCall call, BigInteger nonce) throws FlywheelException {
        SimpleRewardsData.CreateData data = decode(call.hookData(), SimpleRewardsData.CreateData.class);

        SimpleRewardsCampaign campaign = new SimpleRewardsCampaign();
        campaign.setCampaign(call.campaign());
        campaign.setOwner(Addresses.normalize(data.owner()));
        campaign.setManager(Addresses.normalize(data.manager()));
        campaign.setUri(data.uri());
        campaignRepository.save(campaign);

        log.info("Simple rewards campaign configured: campaign={}, owner={}, manager={}",
                call.campaign(), campaign.getOwner(), campaign.getManager());
    }

    @Override
    protected void updateStatus(HookCall call, CampaignStatus oldStatus, CampaignStatus newStatus)
            throws FlywheelException {
        requireManager(call);
    }

    @Override
    protected void updateMetadata(HookCall call) throws FlywheelException {
        SimpleRewardsCampaign campaign = config(call.campaign());
        if (!call.sender().equals(campaign.getOwner()) && !call.sender().equals(campaign.getManager())) {
            throw new UnauthorizedException(
                    String.format("Sender %s is neither owner nor manager of campaign %s", call.sender(), call.campaign()));
        }
        if (call.hookData().length == 0) {
            return;
        }
        SimpleRewardsData.MetadataData data = decode(call.hookData(), SimpleRewardsData.MetadataData.class);
        if (data.uri() != null) {
            campaign.setUri(data.uri());
            campaignRepository.save(campaign);
        }
    }

    @Override
    protected List<Allocation> allocate(HookCall call) throws FlywheelException {
        requireManager(call);
        List<Allocation> allocations = new ArrayList<>();
        for (SimpleRewardsData.PayoutData payout : payouts(call)) {
            allocations.add(new Allocation(Addresses.keyOf(payout.recipient()), payout.amount(), payout.extraData()));
        }
        return allocations;
    }

    @Override
    protected List<Allocation> deallocate(HookCall call) throws FlywheelException {
        return allocate(call);
    }

    @Override
    protected PayoutInstructions<Distribution> distribute(HookCall call) throws FlywheelException {
        requireManager(call);
        List<Distribution> distributions = new ArrayList<>();
        for (SimpleRewardsData.PayoutData payout : payouts(call)) {
            distributions.add(new Distribution(Addresses.normalize(payout.recipient()),
                    Addresses.keyOf(payout.recipient()), payout.amount(), payout.extraData()));
        }
        return PayoutInstructions.withoutFees(distributions);
    }

    @Override
    protected PayoutInstructions<Payout> send(HookCall call) throws FlywheelException {
        requireManager(call);
        List<Payout> sends = new ArrayList<>();
        for (SimpleRewardsData.PayoutData payout : payouts(call)) {
            sends.add(new Payout(Addresses.normalize(payout.recipient()), payout.amount(), payout.extraData()));
        }
        return PayoutInstructions.withoutFees(sends);
    }

    @Override
    protected Payout withdrawFunds(HookCall call) throws FlywheelException {
        SimpleRewardsCampaign campaign = config(call.campaign());
        if (!call.sender().equals(campaign.getOwner())) {
            throw new UnauthorizedException(
                    String.format("Sender %s is not the owner of campaign %s", call.sender(), call.campaign()));
        }
        SimpleRewardsData.PayoutData data = decode(call.hookData(), SimpleRewardsData.PayoutData.class);
        return new Payout(Addresses.normalize(data.recipient()), amountOf(data), data.extraData());
    }

    private List<SimpleRewardsData.PayoutData> payouts(HookCall call) throws InvalidHookDataException {
        SimpleRewardsData.PayoutsData data = decode(call.hookData(), SimpleRewardsData.PayoutsData.class);
        if (data.payouts() == null) {
            return List.of();
        }
        for (SimpleRewardsData.PayoutData payout : data.payouts()) {
            amountOf(payout);
        }
        return data.payouts();
    }

    private BigInteger amountOf(SimpleRewardsData.PayoutData payout) throws InvalidHookDataException {
        if (payout.amount() == null || payout.amount().signum() < 0) {
            throw new InvalidHookDataException("Payout amount must be a non-negative integer: " + payout.amount());
        }
        return payout.amount();
    }

    private void requireManager(HookCall call) throws FlywheelException {
        SimpleRewardsCampaign campaign = config(call.campaign());
        if (!call.sender().equals(campaign.getManager())) {
            throw new UnauthorizedException(
                    String.format("Sender %s is not the manager of campaign %s", call.sender(), call.campaign()));
        }
    }

    private SimpleRewardsCampaign config(String campaign) throws InvalidHookDataException {
        return campaignRepository.findById(campaign)
                .orElseThrow(() -> new InvalidHookDataException("Campaign not configured for simple rewards: " + campaign));
    }

    private <T> T decode(byte[] hookData, Class<T> type) throws InvalidHookDataException {
        try {
            return objectMapper.readValue(hookData, type);
        } catch (IOException e) {
            throw new InvalidHookDataException("Cannot decode " + type.getSimpleName() + " payload", e);
        }
    }
}
