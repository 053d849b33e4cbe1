// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sluice.core.model;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import sh.sluice.core.types.Address;

class PoolRecordTest {

    private static final Address POOL = new Address("0x" + "1".repeat(40));
    private static final Address LP = new Address("0x" + "2".repeat(40));
    private static final Address DAI = new Address("0x" + "3".repeat(40));

    private static PoolRecord record(List<Address> tokens) {
        return new PoolRecord(POOL, LP, AssetClass.USD, "USD", POOL, tokens, List.of(),
                Address.ZERO, Address.ZERO, BigInteger.ZERO, false, false);
    }

    @Test
    void copiesTokenLists() {
        List<Address> tokens = new ArrayList<>(List.of(DAI));
        PoolRecord record = record(tokens);
        tokens.clear();
        assertEquals(List.of(DAI), record.tokens());
        assertThrows(UnsupportedOperationException.class, () -> record.tokens().add(DAI));
    }

    @Test
    void withersOnlyChangeFlags() {
        PoolRecord record = record(List.of(DAI));
        PoolRecord approved = record.withApproved(true);
        PoolRecord removed = record.withRemoved(true);

        assertTrue(approved.approved());
        assertFalse(approved.removed());
        assertTrue(removed.removed());
        assertEquals(record.tokens(), removed.tokens());
        assertEquals(record.withApproved(false), record);
    }

    @Test
    void depositWrapperDetection() {
        assertFalse(record(List.of()).hasDepositWrapper());
    }

    @Test
    void rejectsNullFields() {
        assertThrows(NullPointerException.class, () -> new PoolRecord(POOL, null, AssetClass.USD, "USD", POOL,
                List.of(), List.of(), Address.ZERO, Address.ZERO, BigInteger.ZERO, false, false));
    }
}
