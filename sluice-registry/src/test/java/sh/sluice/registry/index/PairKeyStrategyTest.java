// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sluice.registry.index;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import sh.sluice.core.types.Address;
import sh.sluice.core.types.Hash;
import sh.sluice.registry.Addresses;

class PairKeyStrategyTest {

    @ParameterizedTest
    @EnumSource(PairKeyStrategy.class)
    void orderIndependent(PairKeyStrategy strategy) {
        Address a = new Address("0x6b175474e89094c44da98b954eedeac495271d0f");
        Address b = new Address("0xa0b86991c6218b36c1d19d4a2e9eb0ce3606eb48");
        assertEquals(strategy.key(a, b), strategy.key(b, a));
    }

    @Test
    void xorMatchesLegacyKeys() {
        PairKey key = PairKeyStrategy.XOR.key(Addresses.of(0x0f), Addresses.of(0xf0));
        assertEquals(new Hash("0x" + "0".repeat(62) + "ff"), key.value());
    }

    @Test
    void xorCollidesWhereCanonicalDoesNot() {
        // 1 ^ 6 == 2 ^ 5 == 7
        Address a1 = Addresses.of(1);
        Address b1 = Addresses.of(6);
        Address a2 = Addresses.of(2);
        Address b2 = Addresses.of(5);

        assertEquals(PairKeyStrategy.XOR.key(a1, b1), PairKeyStrategy.XOR.key(a2, b2));
        assertNotEquals(PairKeyStrategy.CANONICAL.key(a1, b1), PairKeyStrategy.CANONICAL.key(a2, b2));
    }

    @Test
    void rejectsNull() {
        assertThrows(NullPointerException.class, () -> PairKeyStrategy.CANONICAL.key(null, Addresses.of(1)));
        assertThrows(NullPointerException.class, () -> PairKeyStrategy.XOR.key(Addresses.of(1), null));
    }
}
