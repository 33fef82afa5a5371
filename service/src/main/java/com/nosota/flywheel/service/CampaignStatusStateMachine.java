package com.nosota.flywheel.service;

import com.nosota.flywheel.api.model.CampaignStatus;
import com.nosota.flywheel.error.InvalidCampaignStatusException;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * State machine for validating CampaignStatus transitions.
 *
 * <p>Registry-level rules; hooks may forbid further transitions on top of these:
 * <ul>
 *   <li>INACTIVE and ACTIVE may move to any other status</li>
 *   <li>FINALIZING may only move to FINALIZED</li>
 *   <li>FINALIZED is terminal</li>
 *   <li>A transition to the current status is rejected</li>
 * </ul>
 *
 * <p>Payout operations (allocate, deallocate, distribute, send) are accepted only
 * while ACTIVE or FINALIZING.
 */
@Component
public class CampaignStatusStateMachine {

    private static final Map<CampaignStatus, Set<CampaignStatus>> ALLOWED_TRANSITIONS = Map.of(
            CampaignStatus.INACTIVE, EnumSet.of(
                    CampaignStatus.ACTIVE,
                    CampaignStatus.FINALIZING,
                    CampaignStatus.FINALIZED
            ),
            CampaignStatus.ACTIVE, EnumSet.of(
                    CampaignStatus.INACTIVE,
                    CampaignStatus.FINALIZING,
                    CampaignStatus.FINALIZED
            ),
            CampaignStatus.FINALIZING, EnumSet.of(
                    CampaignStatus.FINALIZED
            )
            // FINALIZED is terminal - no transitions allowed
    );

    private static final Set<CampaignStatus> ACCEPTING_PAYOUTS = EnumSet.of(
            CampaignStatus.ACTIVE,
            CampaignStatus.FINALIZING
    );

    public boolean isTransitionAllowed(CampaignStatus fromStatus, CampaignStatus toStatus) {
        if (fromStatus == null || toStatus == null) {
            return false;
        }
        Set<CampaignStatus> allowedTargets = ALLOWED_TRANSITIONS.get(fromStatus);
        return allowedTargets != null && allowedTargets.contains(toStatus);
    }

    /**
     * Validates a status transition, throwing if it is not allowed.
     *
     * @param campaign   Campaign address (for the error message)
     * @param fromStatus Current status
     * @param toStatus   Target status
     * @throws InvalidCampaignStatusException if the transition is a no-op, leaves a terminal
     *                                        status, or is otherwise not allowed
     */
    public void validateTransition(String campaign, CampaignStatus fromStatus, CampaignStatus toStatus)
            throws InvalidCampaignStatusException {
        if (!isTransitionAllowed(fromStatus, toStatus)) {
            throw new InvalidCampaignStatusException(
                    String.format("Invalid status transition for campaign %s: %s -> %s. Allowed transitions from %s: %s",
                            campaign, fromStatus, toStatus, fromStatus,
                            ALLOWED_TRANSITIONS.getOrDefault(fromStatus, Set.of())));
        }
    }

    public boolean isFinalState(CampaignStatus status) {
        return status == CampaignStatus.FINALIZED;
    }

    public boolean isAcceptingPayouts(CampaignStatus status) {
        return ACCEPTING_PAYOUTS.contains(status);
    }

    public Set<CampaignStatus> getAllowedTransitions(CampaignStatus fromStatus) {
        return ALLOWED_TRANSITIONS.getOrDefault(fromStatus, Set.of());
    }
}
