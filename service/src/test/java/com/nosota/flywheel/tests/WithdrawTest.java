package com.nosota.flywheel.tests;

import com.nosota.flywheel.TestBase;
import com.nosota.flywheel.api.model.CampaignStatus;
import com.nosota.flywheel.api.model.FlywheelEventType;
import com.nosota.flywheel.error.InsufficientCampaignFundsException;
import com.nosota.flywheel.error.SendFailedException;
import com.nosota.flywheel.error.ZeroAmountException;
import com.nosota.flywheel.hooks.Allocation;
import com.nosota.flywheel.hooks.Payout;
import com.nosota.flywheel.model.FlywheelEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;

public class WithdrawTest extends TestBase {

    @Test
    @DisplayName("WDR-001: FINALIZED campaign without fees can withdraw its whole balance, not more")
    public void withdraw_WhenFinalized_ShouldAllowWholeBalanceOnly() throws Exception {
        String campaign = createActiveCampaign(NATIVE, 50);
        String owner = newAddress();
        flywheelService.updateStatus(newAddress(), campaign, CampaignStatus.FINALIZED, new byte[0]);

        scriptedHooks.scriptWithdrawal(new Payout(owner, amount(51), null));
        assertThatThrownBy(() -> flywheelService.withdrawFunds(newAddress(), campaign, NATIVE, new byte[0]))
                .isInstanceOf(InsufficientCampaignFundsException.class)
                .satisfies(e -> {
                    InsufficientCampaignFundsException error = (InsufficientCampaignFundsException) e;
                    assertThat(error.getBalance()).isEqualTo(amount(-1));
                    assertThat(error.getRequired()).isEqualTo(BigInteger.ZERO);
                });

        scriptedHooks.scriptWithdrawal(new Payout(owner, amount(50), "final"));
        List<FlywheelEvent> events = flywheelService.withdrawFunds(newAddress(), campaign, NATIVE, new byte[0]);

        assertThat(events).extracting(FlywheelEvent::getType).containsExactly(FlywheelEventType.FUNDS_WITHDRAWN);
        assertThat(events.get(0).getRecipient()).isEqualTo(owner);
        assertThat(balanceOf(owner, NATIVE)).isEqualTo(amount(50));
        assertThat(flywheelService.getVaultBalance(campaign, NATIVE)).isEqualTo(BigInteger.ZERO);
    }

    @Test
    @DisplayName("WDR-002: Allocated payouts cannot be withdrawn before FINALIZED")
    public void withdraw_WhenPayoutsAllocated_ShouldKeepThemCovered() throws Exception {
        String campaign = createActiveCampaign(TOKEN, 100);
        String owner = newAddress();
        scriptedHooks.scriptAllocations(new Allocation(keyOf(newAddress()), amount(70), null));
        flywheelService.allocate(newAddress(), campaign, TOKEN, new byte[0]);

        scriptedHooks.scriptWithdrawal(new Payout(owner, amount(31), null));
        assertThatThrownBy(() -> flywheelService.withdrawFunds(newAddress(), campaign, TOKEN, new byte[0]))
                .isInstanceOf(InsufficientCampaignFundsException.class);

        scriptedHooks.scriptWithdrawal(new Payout(owner, amount(30), null));
        flywheelService.withdrawFunds(newAddress(), campaign, TOKEN, new byte[0]);
        assertThat(balanceOf(owner, TOKEN)).isEqualTo(amount(30));
    }

    @Test
    @DisplayName("WDR-003: Once FINALIZED, unclaimed payout allocations no longer block withdrawal")
    public void withdraw_WhenFinalized_ShouldIgnorePayoutAllocations() throws Exception {
        String campaign = createActiveCampaign(TOKEN, 100);
        String owner = newAddress();
        scriptedHooks.scriptAllocations(new Allocation(keyOf(newAddress()), amount(70), null));
        flywheelService.allocate(newAddress(), campaign, TOKEN, new byte[0]);
        flywheelService.updateStatus(newAddress(), campaign, CampaignStatus.FINALIZED, new byte[0]);

        scriptedHooks.scriptWithdrawal(new Payout(owner, amount(100), null));
        flywheelService.withdrawFunds(newAddress(), campaign, TOKEN, new byte[0]);

        assertThat(balanceOf(owner, TOKEN)).isEqualTo(amount(100));
    }

    @Test
    @DisplayName("WDR-004: Zero withdrawal is rejected")
    public void withdraw_WhenZero_ShouldFail() throws Exception {
        String campaign = createActiveCampaign(TOKEN, 100);
        scriptedHooks.scriptWithdrawal(new Payout(newAddress(), BigInteger.ZERO, null));

        assertThatThrownBy(() -> flywheelService.withdrawFunds(newAddress(), campaign, TOKEN, new byte[0]))
                .isInstanceOf(ZeroAmountException.class);
    }

    @Test
    @DisplayName("WDR-005: A failed withdrawal transfer fails the call")
    public void withdraw_WhenRecipientRejects_ShouldFail() throws Exception {
        String campaign = createActiveCampaign(TOKEN, 100);
        String rejecting = newAddress();
        doReturn(false).when(assetNetwork).transfer(eq(TOKEN), anyString(), eq(rejecting), any());
        scriptedHooks.scriptWithdrawal(new Payout(rejecting, amount(10), null));

        assertThatThrownBy(() -> flywheelService.withdrawFunds(newAddress(), campaign, TOKEN, new byte[0]))
                .isInstanceOf(SendFailedException.class);
        assertThat(flywheelService.getVaultBalance(campaign, TOKEN)).isEqualTo(amount(100));
    }

    @Test
    @DisplayName("WDR-006: Withdrawal is accepted while INACTIVE")
    public void withdraw_WhenInactive_ShouldSucceed() throws Exception {
        String campaign = createScriptedCampaign().getAddress();
        String owner = newAddress();
        depositService.deposit(campaign, TOKEN, amount(25));
        scriptedHooks.scriptWithdrawal(new Payout(owner, amount(25), null));

        flywheelService.withdrawFunds(newAddress(), campaign, TOKEN, new byte[0]);

        assertThat(balanceOf(owner, TOKEN)).isEqualTo(amount(25));
    }
}
