package com.nosota.flywheel.hooks;

import com.nosota.flywheel.api.model.CampaignStatus;
import com.nosota.flywheel.error.FlywheelException;
import com.nosota.flywheel.error.UnauthorizedException;
import com.nosota.flywheel.error.UnsupportedHookOperationException;

import java.math.BigInteger;
import java.util.List;

/**
 * Base class of every campaign policy module.
 *
 * <p>The registry calls the public {@code on*} methods; each one first checks that the
 * invoker is the registry and then delegates to the matching protected method that a
 * policy overrides. Hooks decide who may act and compute what should move; they never
 * touch the ledger, which stays entirely in the registry's hands.
 *
 * <p>Callbacks a policy does not override fail with {@link UnsupportedHookOperationException}.
 * Any exception a policy raises is propagated to the registry's caller unchanged.
 */
public abstract class CampaignHooks {

    private final String flywheel;

    protected CampaignHooks(String flywheel) {
        this.flywheel = flywheel;
    }

    /**
     * @return Address under which this policy module is registered
     */
    public abstract String getAddress();

    /**
     * Content URI of a campaign. Read-only, callable by anyone.
     */
    public abstract String campaignURI(String campaign);

    public final void onCreateCampaign(String invoker, HookCall call, BigInteger nonce) throws FlywheelException {
        requireFlywheel(invoker);
        createCampaign(call, nonce);
    }

    public final void onUpdateStatus(String invoker, HookCall call, CampaignStatus oldStatus, CampaignStatus newStatus)
            throws FlywheelException {
        requireFlywheel(invoker);
        updateStatus(call, oldStatus, newStatus);
    }

    public final void onUpdateMetadata(String invoker, HookCall call) throws FlywheelException {
        requireFlywheel(invoker);
        updateMetadata(call);
    }

    public final List<Allocation> onAllocate(String invoker, HookCall call) throws FlywheelException {
        requireFlywheel(invoker);
        return allocate(call);
    }

    public final List<Allocation> onDeallocate(String invoker, HookCall call) throws FlywheelException {
        requireFlywheel(invoker);
        return deallocate(call);
    }

    public final PayoutInstructions<Distribution> onDistribute(String invoker, HookCall call) throws FlywheelException {
        requireFlywheel(invoker);
        return distribute(call);
    }

    public final PayoutInstructions<Payout> onSend(String invoker, HookCall call) throws FlywheelException {
        requireFlywheel(invoker);
        return send(call);
    }

    public final List<Distribution> onDistributeFees(String invoker, HookCall call) throws FlywheelException {
        requireFlywheel(invoker);
        return distributeFees(call);
    }

    public final Payout onWithdrawFunds(String invoker, HookCall call) throws FlywheelException {
        requireFlywheel(invoker);
        return withdrawFunds(call);
    }

    protected abstract void createCampaign(HookCall call, BigInteger nonce) throws FlywheelException;

    protected void updateStatus(HookCall call, CampaignStatus oldStatus, CampaignStatus newStatus)
            throws FlywheelException {
        throw unsupported("updateStatus");
    }

    protected void updateMetadata(HookCall call) throws FlywheelException {
        throw unsupported("updateMetadata");
    }

    protected List<Allocation> allocate(HookCall call) throws FlywheelException {
        throw unsupported("allocate");
    }

    protected List<Allocation> deallocate(HookCall call) throws FlywheelException {
        throw unsupported("deallocate");
    }

    protected PayoutInstructions<Distribution> distribute(HookCall call) throws FlywheelException {
        throw unsupported("distribute");
    }

    protected PayoutInstructions<Payout> send(HookCall call) throws FlywheelException {
        throw unsupported("send");
    }

    protected List<Distribution> distributeFees(HookCall call) throws FlywheelException {
        throw unsupported("distributeFees");
    }

    protected Payout withdrawFunds(HookCall call) throws FlywheelException {
        throw unsupported("withdrawFunds");
    }

    private void requireFlywheel(String invoker) throws UnauthorizedException {
        if (!flywheel.equals(invoker)) {
            throw new UnauthorizedException(
                    String.format("Hooks %s accept calls only from the flywheel, got %s", getAddress(), invoker));
        }
    }

    private UnsupportedHookOperationException unsupported(String operation) {
        return new UnsupportedHookOperationException(
                String.format("Hooks %s do not support %s", getAddress(), operation));
    }
}
