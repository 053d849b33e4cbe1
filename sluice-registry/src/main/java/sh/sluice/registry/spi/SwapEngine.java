// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sluice.registry.spi;

import java.math.BigInteger;
import java.util.Optional;

import sh.sluice.core.model.SwapParameters;
import sh.sluice.core.types.Address;

/**
 * Asset-custody engine behind a registered pool.
 *
 * <p>The registry never mutates an engine. It only reads from it: token positions
 * during registration, and live values for the proxied accessors.
 *
 * <p>Implementations backed by a chain translate "this call reverted" into the empty
 * results documented below. Transport failures should surface as
 * {@link sh.sluice.core.error.ExternalUnavailableException}.
 */
public interface SwapEngine {

    /**
     * Returns the token at {@code index}, or empty if the engine holds fewer tokens.
     *
     * @param index zero-based token position
     * @return the token, or empty past the last position
     */
    Optional<Address> tokenAt(int index);

    /**
     * Standard storage accessor.
     *
     * @return the parameters, or empty if the engine does not expose this shape
     */
    Optional<SwapParameters> swapStorage();

    /**
     * Storage accessor of guarded engines, which do not report a ramp end time.
     *
     * @return the parameters, or empty if the engine does not expose this shape
     */
    default Optional<GuardedSwapStorage> guardedSwapStorage() {
        return Optional.empty();
    }

    Address owner();

    boolean paused();

    BigInteger virtualPrice();

    /** Current amplification coefficient. */
    BigInteger a();

    /**
     * Live balance of the token at {@code index}.
     *
     * @param index zero-based token position
     * @return the balance in the token's smallest unit
     */
    BigInteger tokenBalance(int index);
}
