// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sluice.primitives;

import java.util.Arrays;

/**
 * Hex encoding and decoding for identifier values, with optional {@code 0x} prefixes.
 *
 * @since 0.1.0
 */
public final class Hex {
    private static final char[] DIGITS = "0123456789abcdef".toCharArray();

    // ASCII code point to nibble value, -1 for non-hex characters
    private static final byte[] NIBBLES = new byte[128];

    static {
        Arrays.fill(NIBBLES, (byte) -1);
        for (int d = 0; d < 16; d++) {
            NIBBLES[DIGITS[d]] = (byte) d;
            NIBBLES[Character.toUpperCase(DIGITS[d])] = (byte) d;
        }
    }

    private Hex() {
    }

    /**
     * Decodes a hex string, with or without {@code 0x} prefix, into bytes.
     *
     * @param hexString the string to decode
     * @return the decoded bytes
     * @throws IllegalArgumentException if the input is null, has an odd number of
     *                                  characters, or contains invalid hex
     */
    public static byte[] decode(final String hexString) {
        if (hexString == null) {
            throw new IllegalArgumentException("hex string cannot be null");
        }
        final int offset = hasPrefix(hexString) ? 2 : 0;
        final int digits = hexString.length() - offset;
        if (digits % 2 != 0) {
            throw new IllegalArgumentException("hex string must have even length: " + hexString);
        }

        final byte[] out = new byte[digits / 2];
        int pos = offset;
        for (int i = 0; i < out.length; i++) {
            final int high = nibble(hexString, pos++);
            final int low = nibble(hexString, pos++);
            out[i] = (byte) (high << 4 | low);
        }
        return out;
    }

    /**
     * Encodes bytes as a lowercase hex string with a {@code 0x} prefix.
     *
     * @param bytes the bytes to encode
     * @return hex string with {@code 0x} prefix
     * @throws IllegalArgumentException if {@code bytes} is {@code null}
     */
    public static String encode(final byte[] bytes) {
        return "0x" + encodeNoPrefix(bytes);
    }

    /**
     * Encodes bytes as a lowercase hex string without a prefix.
     *
     * @param bytes the bytes to encode
     * @return hex string without {@code 0x} prefix
     * @throws IllegalArgumentException if {@code bytes} is {@code null}
     */
    public static String encodeNoPrefix(final byte[] bytes) {
        if (bytes == null) {
            throw new IllegalArgumentException("bytes cannot be null");
        }
        final StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            sb.append(DIGITS[(b >> 4) & 0xF]).append(DIGITS[b & 0xF]);
        }
        return sb.toString();
    }

    /**
     * Returns {@code true} if the string starts with {@code 0x} (case-insensitive).
     *
     * @param hexString the string to check
     * @return {@code true} when the prefix is present
     */
    public static boolean hasPrefix(final String hexString) {
        return hexString != null
                && hexString.length() >= 2
                && hexString.charAt(0) == '0'
                && (hexString.charAt(1) == 'x' || hexString.charAt(1) == 'X');
    }

    private static int nibble(final String hex, final int pos) {
        final char c = hex.charAt(pos);
        final int value = c < NIBBLES.length ? NIBBLES[c] : -1;
        if (value < 0) {
            throw new IllegalArgumentException("invalid hex character '" + c + "' at " + pos + " in: " + hex);
        }
        return value;
    }
}
