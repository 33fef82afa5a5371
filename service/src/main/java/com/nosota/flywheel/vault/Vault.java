package com.nosota.flywheel.vault;

import com.nosota.flywheel.error.UnauthorizedException;
import com.nosota.flywheel.network.Addresses;
import com.nosota.flywheel.network.AssetNetwork;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;

import java.math.BigInteger;

/**
 * Fund-holding side of one campaign.
 *
 * <p>Holds balances on the asset network under the campaign address and moves them
 * only when its controller (the flywheel registry) asks. Keeps no state besides those
 * balances and carries no business logic.
 */
@Slf4j
public class Vault {

    private final String address;
    private final String controller;
    private final AssetNetwork network;

    Vault(String address, String controller, AssetNetwork network) {
        this.address = address;
        this.controller = controller;
        this.network = network;
    }

    public String getAddress() {
        return address;
    }

    public BigInteger balanceOf(String asset) {
        return network.balanceOf(asset, address);
    }

    /**
     * Sends one asset from the vault to a recipient.
     *
     * <p>A native currency transfer that blows up on the recipient's side is reported
     * as {@code false} and never propagated. Data access failures are not a recipient
     * refusal and always propagate, since they leave the transaction unusable. A token
     * transfer returns whatever the network reports.
     *
     * @param caller    Address of the party asking for the transfer
     * @param asset     Asset address, or {@link Addresses#NATIVE_TOKEN}
     * @param recipient Recipient address
     * @param amount    Amount to send
     * @return {@code true} if the funds left the vault
     * @throws UnauthorizedException if {@code caller} is not the vault's controller
     */
    public boolean sendTokens(String caller, String asset, String recipient, BigInteger amount)
            throws UnauthorizedException {
        if (!controller.equals(caller)) {
            throw new UnauthorizedException(
                    String.format("Caller %s is not the controller of vault %s", caller, address));
        }

        if (Addresses.isNative(asset)) {
            try {
                return network.transfer(asset, address, recipient, amount);
            } catch (DataAccessException e) {
                throw e;
            } catch (RuntimeException e) {
                log.warn("Native transfer rejected by recipient: vault={}, recipient={}, amount={}, error={}",
                        address, recipient, amount, e.getMessage());
                return false;
            }
        }
        return network.transfer(asset, address, recipient, amount);
    }
}
