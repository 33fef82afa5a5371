package com.nosota.flywheel.network;

import java.math.BigInteger;

/**
 * The network on which assets (the native currency and fungible tokens) are held
 * and transferred between addresses.
 *
 * <p>Implementations must report an ordinary transfer failure through the return
 * value of {@link #transfer}; callers decide whether a failure aborts their operation.
 */
public interface AssetNetwork {

    /**
     * @return Balance of {@code holder} for {@code asset}, zero for unknown holders
     */
    BigInteger balanceOf(String asset, String holder);

    /**
     * Credits funds entering the network from outside.
     *
     * @return Holder balance after the credit
     */
    BigInteger deposit(String asset, String holder, BigInteger amount);

    /**
     * Moves {@code amount} of {@code asset} from one holder to another.
     *
     * @return {@code true} if the funds moved, {@code false} if the transfer was refused
     */
    boolean transfer(String asset, String from, String to, BigInteger amount);
}
