// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sluice.core.types;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class AddressTest {

    @Test
    void acceptsValidAddressAndLowercases() {
        Address address = new Address("0x000000000000000000000000000000000000dEaD");
        assertEquals("0x000000000000000000000000000000000000dead", address.value());
        assertEquals(20, address.toBytes().length);
    }

    @Test
    void rejectsInvalidLength() {
        assertThrows(IllegalArgumentException.class, () -> new Address("0x1234"));
    }

    @Test
    void rejectsMissingPrefix() {
        assertThrows(IllegalArgumentException.class, () -> new Address("1234567890abcdef1234567890abcdef12345678"));
    }

    @Test
    void rejectsNull() {
        assertThrows(NullPointerException.class, () -> new Address(null));
    }

    @Test
    void zeroDetection() {
        assertTrue(Address.ZERO.isZero());
        assertTrue(Address.isNullOrZero(null));
        assertTrue(Address.isNullOrZero(new Address("0x" + "0".repeat(40))));
        assertFalse(Address.isNullOrZero(new Address("0x" + "0".repeat(39) + "1")));
    }

    @Test
    void ordersNumericallyRegardlessOfInputCase() {
        Address low = new Address("0x00000000000000000000000000000000000000AA");
        Address high = new Address("0x00000000000000000000000000000000000000ab");
        assertTrue(low.compareTo(high) < 0);
        assertTrue(high.compareTo(low) > 0);
        assertEquals(0, low.compareTo(new Address("0x00000000000000000000000000000000000000aa")));
    }

    @Test
    void fromBytesRejectsWrongLength() {
        assertThrows(IllegalArgumentException.class, () -> Address.fromBytes(new byte[19]));
        assertThrows(IllegalArgumentException.class, () -> Address.fromBytes(null));
    }

    @Test
    void fromBytesMatchesValue() {
        byte[] bytes = new byte[20];
        bytes[19] = 0x42;
        assertEquals("0x0000000000000000000000000000000000000042", Address.fromBytes(bytes).value());
    }
}
