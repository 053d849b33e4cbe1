// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sluice.registry.discovery;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.function.IntFunction;

import org.junit.jupiter.api.Test;

import sh.sluice.core.error.ValidationException;
import sh.sluice.core.types.Address;
import sh.sluice.registry.Addresses;

class TokenProbeTest {

    private static final Address TARGET = Addresses.of(0x99);

    private final List<Integer> probed = new ArrayList<>();

    private IntFunction<Optional<Address>> over(final List<Address> tokens) {
        return index -> {
            probed.add(index);
            return index < tokens.size() ? Optional.of(tokens.get(index)) : Optional.empty();
        };
    }

    @Test
    void stopsAtFirstEmptyPosition() {
        List<Address> tokens = List.of(Addresses.of(1), Addresses.of(2), Addresses.of(3));

        assertEquals(tokens, TokenProbe.of("token", TARGET, over(tokens), 8).toList());
        assertEquals(List.of(0, 1, 2, 3), probed);
    }

    @Test
    void neverProbesPastCap() {
        List<Address> tokens = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            tokens.add(Addresses.of(i + 1));
        }

        assertEquals(tokens.subList(0, 8), TokenProbe.of("token", TARGET, over(tokens), 8).toList());
        assertEquals(8, probed.size());
    }

    @Test
    void emptyEngine() {
        assertEquals(List.of(), TokenProbe.of("token", TARGET, over(List.of()), 8).toList());
        assertEquals(List.of(0), probed);
    }

    @Test
    void zeroTokenFails() {
        List<Address> tokens = List.of(Addresses.of(1), Address.ZERO, Addresses.of(3));

        ValidationException ex = assertThrows(ValidationException.class,
                () -> TokenProbe.of("underlying token", TARGET, over(tokens), 8).toList());
        assertEquals(ValidationException.Reason.ZERO_TOKEN, ex.reason());
        assertTrue(ex.getMessage().contains("underlying token at index 1"));
        assertEquals(List.of(0, 1), probed);
    }

    @Test
    void lazyIteration() {
        TokenProbe probe = TokenProbe.of("token", TARGET, over(List.of(Addresses.of(1))), 8);
        assertTrue(probed.isEmpty());

        assertTrue(probe.hasNext());
        assertTrue(probe.hasNext());
        assertEquals(List.of(0), probed);

        assertEquals(Addresses.of(1), probe.next());
        assertFalse(probe.hasNext());
        assertThrows(NoSuchElementException.class, probe::next);
    }

    @Test
    void rejectsNegativeCap() {
        assertThrows(IllegalArgumentException.class, () -> TokenProbe.of("token", TARGET, over(List.of()), -1));
    }
}
