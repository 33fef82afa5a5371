package com.nosota.flywheel.model;

import com.nosota.flywheel.api.model.CampaignStatus;
import com.nosota.flywheel.api.model.FlywheelEventType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.time.LocalDateTime;

/**
 * Entry of the append-only campaign event log.
 *
 * <p>One row per state change, carrying enough fields to reconstruct ledger deltas.
 * Rows are built once and never updated, hence no setters.
 */
@Entity
@Table(name = "flywheel_event")
@Getter
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class FlywheelEvent {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 42, updatable = false)
    private String campaign;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, length = 32, updatable = false)
    private FlywheelEventType type;

    /**
     * Hook policy address (creation events only).
     */
    @Column(length = 42, updatable = false)
    private String hooks;

    @Column(length = 42, updatable = false)
    private String asset;

    @Column(length = 42, updatable = false)
    private String recipient;

    @Column(name = "recipient_key", length = 66, updatable = false)
    private String recipientKey;

    @Column(precision = 78, scale = 0, updatable = false)
    private BigInteger amount;

    @Column(name = "extra_data", updatable = false)
    private String extraData;

    /**
     * Address that triggered the state change (status and lifecycle events only).
     */
    @Column(length = 42, updatable = false)
    private String sender;

    @Enumerated(EnumType.STRING)
    @Column(name = "old_status", length = 16, updatable = false)
    private CampaignStatus oldStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "new_status", length = 16, updatable = false)
    private CampaignStatus newStatus;

    @Column(length = 2048, updatable = false)
    private String uri;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
