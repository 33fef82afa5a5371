package com.nosota.flywheel.network;

import com.nosota.flywheel.error.InvalidHookDataException;

import java.util.HexFormat;

/**
 * Hex coding of opaque payloads ({@code 0x}-prefixed, lowercase).
 */
public final class Hex {

    public static final String EMPTY = "0x";

    private static final HexFormat HEX = HexFormat.of();

    private Hex() {
    }

    /**
     * Decodes a {@code 0x}-prefixed hex string. {@code null}, blank and {@code "0x"} decode to an empty array.
     *
     * @param hex Hex string
     * @return Decoded bytes
     * @throws InvalidHookDataException if the string is not valid hex
     */
    public static byte[] decode(String hex) throws InvalidHookDataException {
        if (hex == null || hex.isBlank()) {
            return new byte[0];
        }
        String digits = hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
        try {
            return HEX.parseHex(digits);
        } catch (IllegalArgumentException e) {
            throw new InvalidHookDataException("Malformed hex payload: " + hex, e);
        }
    }

    public static String encode(byte[] data) {
        if (data == null || data.length == 0) {
            return EMPTY;
        }
        return "0x" + HEX.formatHex(data);
    }
}
