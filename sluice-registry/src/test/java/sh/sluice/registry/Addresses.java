// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sluice.registry;

import sh.sluice.core.types.Address;

/** Deterministic addresses for tests. */
public final class Addresses {

    private Addresses() {
    }

    public static Address of(final long n) {
        return new Address(String.format("0x%040x", n));
    }
}
