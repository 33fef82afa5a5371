package com.nosota.flywheel.service;

import com.nosota.flywheel.error.FlywheelException;
import com.nosota.flywheel.error.ZeroAmountException;
import com.nosota.flywheel.network.Addresses;
import com.nosota.flywheel.network.AssetNetwork;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

import java.math.BigInteger;

/**
 * Service for handling deposit operations.
 *
 * <p>Deposit represents funds entering the asset network from the outside world.
 * Funding a campaign is a deposit to the campaign address, which is also the address
 * of its vault.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class DepositService {

    private final AssetNetwork assetNetwork;

    /**
     * Deposits funds to a holder from an external source.
     *
     * @param holder Receiving address
     * @param asset  Asset address, or the native currency sentinel
     * @param amount Amount to deposit
     * @return Holder balance after the deposit
     * @throws ZeroAmountException if amount is not positive
     */
    @Transactional(rollbackFor = Exception.class)
    public BigInteger deposit(@NotNull String holder, @NotNull String asset, @NotNull BigInteger amount)
            throws FlywheelException {
        String holderAddress = Addresses.normalize(holder);
        String assetAddress = Addresses.normalize(asset);
        if (amount.signum() <= 0) {
            throw new ZeroAmountException("Deposit amount must be positive: " + amount);
        }

        log.info("Processing deposit: holder={}, asset={}, amount={}", holderAddress, assetAddress, amount);
        return assetNetwork.deposit(assetAddress, holderAddress, amount);
    }

    @Transactional(readOnly = true)
    public BigInteger getBalance(@NotNull String holder, @NotNull String asset) throws FlywheelException {
        return assetNetwork.balanceOf(Addresses.normalize(asset), Addresses.normalize(holder));
    }
}
