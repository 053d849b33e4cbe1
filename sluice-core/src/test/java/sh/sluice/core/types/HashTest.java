// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sluice.core.types;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class HashTest {

    @Test
    void acceptsThirtyTwoBytes() {
        Hash hash = new Hash("0x" + "AB".repeat(32));
        assertEquals("0x" + "ab".repeat(32), hash.value());
        assertEquals(32, hash.toBytes().length);
    }

    @Test
    void rejectsAddressLengthValue() {
        assertThrows(IllegalArgumentException.class, () -> new Hash("0x" + "ab".repeat(20)));
    }

    @Test
    void fromBytesRequiresThirtyTwoBytes() {
        assertThrows(IllegalArgumentException.class, () -> Hash.fromBytes(new byte[20]));
        assertEquals(new Hash("0x" + "00".repeat(32)), Hash.fromBytes(new byte[32]));
    }
}
