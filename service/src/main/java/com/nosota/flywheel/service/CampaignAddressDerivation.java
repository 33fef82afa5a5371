package com.nosota.flywheel.service;

import com.nosota.flywheel.error.FlywheelException;
import com.nosota.flywheel.error.InvalidHookDataException;
import com.nosota.flywheel.network.Addresses;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Deterministic campaign address derivation.
 *
 * <p>{@code address = last20(SHA-256(hooks[20] || nonce[32, big-endian] || SHA-256(hookData)))}
 *
 * <p>The same function serves campaign creation and address prediction, so callers can
 * learn a campaign's address before creating it.
 */
@Component
public class CampaignAddressDerivation {

    private static final int NONCE_LENGTH = 32;
    private static final int ADDRESS_LENGTH = 20;
    private static final BigInteger MAX_NONCE = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);

    /**
     * @param hooks    Hooks address
     * @param nonce    Unsigned 256-bit nonce
     * @param hookData Creation payload
     * @return Campaign address, lowercase {@code 0x}-prefixed hex
     */
    public String predictCampaignAddress(String hooks, BigInteger nonce, byte[] hookData) throws FlywheelException {
        String hooksAddress = Addresses.normalize(hooks);
        if (nonce == null || nonce.signum() < 0 || nonce.compareTo(MAX_NONCE) > 0) {
            throw new InvalidHookDataException("Nonce must be an unsigned 256-bit integer: " + nonce);
        }

        MessageDigest digest = sha256();
        digest.update(HexFormat.of().parseHex(hooksAddress.substring(2)));
        digest.update(toFixedWidth(nonce));
        digest.update(sha256().digest(hookData == null ? new byte[0] : hookData));
        byte[] hash = digest.digest();

        byte[] address = new byte[ADDRESS_LENGTH];
        System.arraycopy(hash, hash.length - ADDRESS_LENGTH, address, 0, ADDRESS_LENGTH);
        return "0x" + HexFormat.of().formatHex(address);
    }

    private static byte[] toFixedWidth(BigInteger nonce) {
        byte[] raw = nonce.toByteArray();
        byte[] fixed = new byte[NONCE_LENGTH];
        int length = Math.min(raw.length, NONCE_LENGTH);
        System.arraycopy(raw, raw.length - length, fixed, NONCE_LENGTH - length, length);
        return fixed;
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
