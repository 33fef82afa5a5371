package com.nosota.flywheel.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigInteger;

/**
 * Aggregate allocation counters of one campaign for one asset.
 *
 * <p>Always equal to the sums of the matching {@link LedgerEntry} rows; kept as
 * counters so the solvency check reads a single row.
 */
@Entity
@Table(name = "ledger_totals",
        uniqueConstraints = @UniqueConstraint(columnNames = {"campaign", "asset"}))
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class LedgerTotals {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 42)
    private String campaign;

    @Column(nullable = false, length = 42)
    private String asset;

    @Column(name = "total_allocated_payouts", nullable = false, precision = 78, scale = 0)
    private BigInteger totalAllocatedPayouts = BigInteger.ZERO;

    @Column(name = "total_allocated_fees", nullable = false, precision = 78, scale = 0)
    private BigInteger totalAllocatedFees = BigInteger.ZERO;
}
