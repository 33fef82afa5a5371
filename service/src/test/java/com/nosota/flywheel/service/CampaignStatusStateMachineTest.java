package com.nosota.flywheel.service;

import com.nosota.flywheel.api.model.CampaignStatus;
import com.nosota.flywheel.error.InvalidCampaignStatusException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class CampaignStatusStateMachineTest {

    private final CampaignStatusStateMachine stateMachine = new CampaignStatusStateMachine();

    @ParameterizedTest
    @EnumSource(CampaignStatus.class)
    public void finalized_ShouldBeTerminal(CampaignStatus target) {
        assertThat(stateMachine.isTransitionAllowed(CampaignStatus.FINALIZED, target)).isFalse();
    }

    @ParameterizedTest
    @EnumSource(CampaignStatus.class)
    public void sameStatus_ShouldNotBeAllowed(CampaignStatus status) {
        assertThat(stateMachine.isTransitionAllowed(status, status)).isFalse();
    }

    @Test
    public void finalizing_ShouldOnlyMoveToFinalized() {
        assertThat(stateMachine.getAllowedTransitions(CampaignStatus.FINALIZING))
                .containsExactly(CampaignStatus.FINALIZED);
    }

    @Test
    public void inactiveAndActive_ShouldMoveAnywhereElse() {
        assertThat(stateMachine.getAllowedTransitions(CampaignStatus.INACTIVE))
                .containsExactlyInAnyOrder(CampaignStatus.ACTIVE, CampaignStatus.FINALIZING, CampaignStatus.FINALIZED);
        assertThat(stateMachine.getAllowedTransitions(CampaignStatus.ACTIVE))
                .containsExactlyInAnyOrder(CampaignStatus.INACTIVE, CampaignStatus.FINALIZING, CampaignStatus.FINALIZED);
    }

    @Test
    public void validateTransition_ShouldThrowOnlyForForbiddenMoves() {
        String campaign = "0x1111111111111111111111111111111111111111";

        assertThatCode(() -> stateMachine.validateTransition(campaign, CampaignStatus.INACTIVE, CampaignStatus.ACTIVE))
                .doesNotThrowAnyException();
        assertThatThrownBy(() -> stateMachine.validateTransition(campaign, CampaignStatus.FINALIZING, CampaignStatus.ACTIVE))
                .isInstanceOf(InvalidCampaignStatusException.class)
                .hasMessageContaining(campaign);
    }

    @Test
    public void payouts_ShouldBeAcceptedOnlyWhileActiveOrFinalizing() {
        assertThat(stateMachine.isAcceptingPayouts(CampaignStatus.ACTIVE)).isTrue();
        assertThat(stateMachine.isAcceptingPayouts(CampaignStatus.FINALIZING)).isTrue();
        assertThat(stateMachine.isAcceptingPayouts(CampaignStatus.INACTIVE)).isFalse();
        assertThat(stateMachine.isAcceptingPayouts(CampaignStatus.FINALIZED)).isFalse();
    }
}
