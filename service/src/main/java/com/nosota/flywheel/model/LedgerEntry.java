package com.nosota.flywheel.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigInteger;
import java.time.LocalDateTime;

/**
 * Amount the campaign owes to one recipient key, not yet transferred.
 *
 * <p>Keyed by (campaign, asset, kind, key). Payout entries are created by allocate and
 * consumed by deallocate / distribute; fee entries are created when a fee is reserved
 * or fails to transfer, and consumed by fee distribution. Only the registry writes here.
 */
@Entity
@Table(name = "ledger_entry",
        uniqueConstraints = @UniqueConstraint(columnNames = {"campaign", "asset", "kind", "recipient_key"}))
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class LedgerEntry {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 42)
    private String campaign;

    @Column(nullable = false, length = 42)
    private String asset;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 8)
    private LedgerEntryKind kind;

    @Column(name = "recipient_key", nullable = false, length = 66)
    private String recipientKey;

    @Column(nullable = false, precision = 78, scale = 0)
    private BigInteger amount = BigInteger.ZERO;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
