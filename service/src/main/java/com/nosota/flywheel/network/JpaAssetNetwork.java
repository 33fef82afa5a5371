package com.nosota.flywheel.network;

import com.nosota.flywheel.model.AssetHolding;
import com.nosota.flywheel.repository.AssetHoldingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Asset network backed by the {@code asset_holding} table.
 *
 * <p>Runs inside the caller's transaction, so a transfer made during an operation
 * that later fails is rolled back together with the ledger changes. Transfers never
 * throw on refusal: an unfunded sender yields {@code false}.
 *
 * <p>Balances change only on rows locked for update. A transfer locks both rows in
 * ascending holder order and checks the source before touching either row.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JpaAssetNetwork implements AssetNetwork {

    private final AssetHoldingRepository assetHoldingRepository;

    @Override
    public BigInteger balanceOf(String asset, String holder) {
        return assetHoldingRepository.findBalance(holder, asset).orElse(BigInteger.ZERO);
    }

    @Override
    public BigInteger deposit(String asset, String holder, BigInteger amount) {
        AssetHolding holding = lockHolding(asset, holder);
        holding.setBalance(holding.getBalance().add(amount));
        holding.setUpdatedAt(LocalDateTime.now());
        assetHoldingRepository.save(holding);

        log.info("Deposited: holder={}, asset={}, amount={}, balance={}",
                holder, asset, amount, holding.getBalance());
        return holding.getBalance();
    }

    @Override
    public boolean transfer(String asset, String from, String to, BigInteger amount) {
        if (amount.signum() <= 0) {
            return amount.signum() == 0;
        }

        AssetHolding source;
        AssetHolding target;
        if (from.compareTo(to) <= 0) {
            source = lockHolding(asset, from);
            target = from.equals(to) ? source : lockHolding(asset, to);
        } else {
            target = lockHolding(asset, to);
            source = lockHolding(asset, from);
        }

        if (source.getBalance().compareTo(amount) < 0) {
            log.warn("Transfer refused, insufficient balance: from={}, to={}, asset={}, amount={}, balance={}",
                    from, to, asset, amount, source.getBalance());
            return false;
        }
        if (source == target) {
            return true;
        }

        LocalDateTime now = LocalDateTime.now();
        source.setBalance(source.getBalance().subtract(amount));
        source.setUpdatedAt(now);
        target.setBalance(target.getBalance().add(amount));
        target.setUpdatedAt(now);
        assetHoldingRepository.save(source);
        assetHoldingRepository.save(target);

        log.debug("Transferred: from={}, to={}, asset={}, amount={}", from, to, asset, amount);
        return true;
    }

    private AssetHolding lockHolding(String asset, String holder) {
        Optional<AssetHolding> holding = assetHoldingRepository.findForUpdate(holder, asset);
        if (holding.isPresent()) {
            return holding.get();
        }
        assetHoldingRepository.insertIfAbsent(holder, asset);
        return assetHoldingRepository.findForUpdate(holder, asset)
                .orElseThrow(() -> new IllegalStateException(
                        "Holding missing after insert: holder=" + holder + ", asset=" + asset));
    }
}
