// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sluice.registry.spi;

import java.util.Optional;

import sh.sluice.core.types.Address;

/**
 * Front-end contract that exposes a wrapping pool's tokens with the base pool's LP
 * token expanded into the base pool's own tokens.
 */
public interface DepositWrapper {

    /**
     * Returns the underlying token at {@code index}, or empty past the last position.
     */
    Optional<Address> tokenAt(int index);

    /** The base pool whose LP token the wrapped pool holds. */
    Address baseSwap();

    /** The wrapping pool this wrapper fronts. */
    Address metaSwap();
}
