// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sluice.core.types;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

import sh.sluice.primitives.Hex;

/**
 * Hex-encoded 20-byte identifier of a pool, token, wrapper or registered component.
 * <p>
 * <strong>Validation:</strong>
 * <ul>
 * <li>Must start with "0x"</li>
 * <li>Must be exactly 40 hex characters long (20 bytes)</li>
 * </ul>
 * <p>
 * The value is stored in lowercase, so the natural ordering of two addresses is the
 * numeric ordering of their 20-byte values.
 *
 * @since 0.1.0
 */
public record Address(@com.fasterxml.jackson.annotation.JsonValue String value) implements Comparable<Address> {
    /** Length of an address in bytes. */
    public static final int BYTE_LENGTH = 20;
    private static final Pattern HEX = HexValidator.fixedLength(BYTE_LENGTH);

    /**
     * The null identifier ({@code 0x0000000000000000000000000000000000000000}).
     * <p>
     * Registries treat it as "absent" and reject it wherever an identifier is required.
     */
    public static final Address ZERO = new Address("0x0000000000000000000000000000000000000000");

    public Address {
        Objects.requireNonNull(value, "address");
        if (!HEX.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid address: " + value);
        }
        value = value.toLowerCase(Locale.ROOT);
    }

    /**
     * Returns {@code true} if this is the null identifier.
     */
    public boolean isZero() {
        return ZERO.value.equals(value);
    }

    /**
     * Returns {@code true} if {@code address} is {@code null} or {@link #ZERO}.
     *
     * @param address the address to test, may be null
     * @return whether the address is absent
     */
    public static boolean isNullOrZero(final Address address) {
        return address == null || address.isZero();
    }

    public byte[] toBytes() {
        return Hex.decode(value);
    }

    public static Address fromBytes(final byte[] bytes) {
        if (bytes == null || bytes.length != BYTE_LENGTH) {
            throw new IllegalArgumentException("Address must be exactly " + BYTE_LENGTH + " bytes");
        }
        return new Address(Hex.encode(bytes));
    }

    @Override
    public int compareTo(final Address other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
