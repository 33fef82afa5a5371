package com.nosota.flywheel.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigInteger;
import java.time.LocalDateTime;

/**
 * Balance of one holder for one asset on the asset network.
 *
 * <p>Campaign vaults hold their funds here under the campaign address.
 */
@Entity
@Table(name = "asset_holding",
        uniqueConstraints = @UniqueConstraint(columnNames = {"holder", "asset"}))
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class AssetHolding {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 42)
    private String holder;

    @Column(nullable = false, length = 42)
    private String asset;

    @Column(nullable = false, precision = 78, scale = 0)
    private BigInteger balance = BigInteger.ZERO;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
