package com.nosota.flywheel.vault;

import com.nosota.flywheel.config.FlywheelProperties;
import com.nosota.flywheel.network.AssetNetwork;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Hands out the vault of a campaign.
 *
 * <p>The vault address is the campaign address, so the same campaign always maps to
 * the same vault. Vaults are controlled by the flywheel's own address.
 */
@Component
@RequiredArgsConstructor
public class VaultFactory {

    private final FlywheelProperties properties;
    private final AssetNetwork network;

    public Vault vaultFor(String campaign) {
        return new Vault(campaign, properties.address(), network);
    }
}
