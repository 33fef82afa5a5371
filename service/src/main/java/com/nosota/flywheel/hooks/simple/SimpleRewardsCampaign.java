package com.nosota.flywheel.hooks.simple;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Per-campaign configuration of the simple rewards policy.
 */
@Entity
@Table(name = "simple_rewards_campaign")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class SimpleRewardsCampaign {
    @Id
    @Column(name = "campaign", length = 42, updatable = false, nullable = false)
    private String campaign;

    /**
     * May withdraw funds and update metadata.
     */
    @Column(nullable = false, length = 42)
    private String owner;

    /**
     * Directs payouts, changes status and may update metadata.
     */
    @Column(nullable = false, length = 42)
    private String manager;

    @Column(length = 2048)
    private String uri;
}
