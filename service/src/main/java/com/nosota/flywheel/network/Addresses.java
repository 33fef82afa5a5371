package com.nosota.flywheel.network;

import com.nosota.flywheel.error.InvalidAddressException;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Address and recipient-key conventions of the asset network.
 *
 * <p>Addresses are 20 bytes, keys are 32 bytes; both are carried as lowercase
 * {@code 0x}-prefixed hex strings so they compare and index as plain strings.
 */
public final class Addresses {

    /** Reserved asset address denoting the network's native currency. */
    public static final String NATIVE_TOKEN = "0xeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeee";

    public static final String ZERO = "0x0000000000000000000000000000000000000000";

    private static final Pattern ADDRESS = Pattern.compile("0x[0-9a-f]{40}");
    private static final Pattern KEY = Pattern.compile("0x[0-9a-f]{64}");

    private Addresses() {
    }

    /**
     * Normalizes a 20-byte address to lowercase.
     *
     * @throws InvalidAddressException if the value is not a 20-byte hex address
     */
    public static String normalize(String address) throws InvalidAddressException {
        String normalized = address == null ? "" : address.trim().toLowerCase(Locale.ROOT);
        if (!ADDRESS.matcher(normalized).matches()) {
            throw new InvalidAddressException("Invalid address: " + address);
        }
        return normalized;
    }

    /**
     * Normalizes a 32-byte recipient key to lowercase.
     *
     * @throws InvalidAddressException if the value is not a 32-byte hex key
     */
    public static String normalizeKey(String key) throws InvalidAddressException {
        String normalized = key == null ? "" : key.trim().toLowerCase(Locale.ROOT);
        if (!KEY.matcher(normalized).matches()) {
            throw new InvalidAddressException("Invalid recipient key: " + key);
        }
        return normalized;
    }

    /**
     * Recipient key of a plain address: the address left-padded with zeros to 32 bytes.
     */
    public static String keyOf(String address) throws InvalidAddressException {
        return "0x" + "0".repeat(24) + normalize(address).substring(2);
    }

    public static boolean isNative(String asset) {
        return NATIVE_TOKEN.equalsIgnoreCase(asset);
    }
}
