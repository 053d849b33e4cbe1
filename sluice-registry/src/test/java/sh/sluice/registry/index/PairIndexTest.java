// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sluice.registry.index;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import sh.sluice.core.types.Address;
import sh.sluice.registry.Addresses;

class PairIndexTest {

    private static final Address A = Addresses.of(0xa);
    private static final Address B = Addresses.of(0xb);
    private static final Address C = Addresses.of(0xc);
    private static final Address V1 = Addresses.of(0x101);
    private static final Address V2 = Addresses.of(0x102);

    private final PairIndex index = new PairIndex(PairKeyStrategy.CANONICAL);

    @Test
    void stagedAdditionsAreInvisibleUntilCommit() {
        PairIndex.Staging staging = index.stage();
        staging.add(A, B, V1);

        assertEquals(List.of(), index.venues(A, B));
        assertEquals(1, staging.size());

        staging.commit();
        assertEquals(List.of(V1), index.venues(A, B));
        assertEquals(List.of(V1), index.venues(B, A));
    }

    @Test
    void abandonedStagingLeavesIndexUntouched() {
        index.stage().add(A, B, V1);
        assertEquals(0, index.size());
    }

    @Test
    void venuesAreDeduplicatedInFirstSeenOrder() {
        PairIndex.Staging first = index.stage();
        first.add(A, B, V1);
        first.add(B, A, V1);
        first.commit();

        PairIndex.Staging second = index.stage();
        second.add(A, B, V2);
        second.add(A, B, V1);
        second.commit();

        assertEquals(List.of(V1, V2), index.venues(A, B));
        assertEquals(1, index.size());
    }

    @Test
    void identicalTokensAreIgnored() {
        PairIndex.Staging staging = index.stage();
        staging.add(A, A, V1);
        staging.commit();

        assertEquals(0, staging.size());
        assertEquals(0, index.size());
    }

    @Test
    void commitOnlyOnce() {
        PairIndex.Staging staging = index.stage();
        staging.commit();
        assertThrows(IllegalStateException.class, staging::commit);
    }

    @Test
    void venuesViewIsReadOnly() {
        PairIndex.Staging staging = index.stage();
        staging.add(A, B, V1);
        staging.commit();

        assertThrows(UnsupportedOperationException.class, () -> index.venues(A, B).add(V2));
    }

    @Test
    void entriesAreADetachedCopy() {
        PairIndex.Staging staging = index.stage();
        staging.add(A, B, V1);
        staging.add(A, C, V1);
        staging.commit();

        Map<PairKey, List<Address>> entries = index.entries();
        assertEquals(2, entries.size());
        entries.clear();
        assertEquals(2, index.size());
    }
}
