// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sluice.registry.spi;

import java.math.BigInteger;
import java.util.Objects;

import sh.sluice.core.model.SwapParameters;
import sh.sluice.core.types.Address;

/**
 * Storage shape reported by guarded engines. It has no ramp end time.
 */
public record GuardedSwapStorage(
        BigInteger initialA,
        BigInteger futureA,
        BigInteger initialATime,
        BigInteger swapFee,
        BigInteger adminFee,
        Address lpToken) {

    public GuardedSwapStorage {
        Objects.requireNonNull(initialA, "initialA");
        Objects.requireNonNull(futureA, "futureA");
        Objects.requireNonNull(initialATime, "initialATime");
        Objects.requireNonNull(swapFee, "swapFee");
        Objects.requireNonNull(adminFee, "adminFee");
        Objects.requireNonNull(lpToken, "lpToken");
    }

    /**
     * Widens to {@link SwapParameters} with a zero {@code futureATime}.
     */
    public SwapParameters toSwapParameters() {
        return new SwapParameters(initialA, futureA, initialATime, BigInteger.ZERO, swapFee, adminFee, lpToken);
    }
}
