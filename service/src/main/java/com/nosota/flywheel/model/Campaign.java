package com.nosota.flywheel.model;

import com.nosota.flywheel.api.model.CampaignStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * A campaign registered with the flywheel.
 *
 * <p>The address is derived from (hooks, nonce, creation payload) and doubles as the
 * address under which the campaign's vault holds its funds. Campaigns are never
 * deleted; FINALIZED is their terminal state.
 */
@Entity
@Table(name = "campaign")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class Campaign {
    @Id
    @Column(name = "address", length = 42, updatable = false, nullable = false)
    private String address;

    /**
     * Address of the hook policy module. Fixed at creation.
     */
    @Column(name = "hooks", length = 42, updatable = false, nullable = false)
    private String hooks;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private CampaignStatus status;

    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
