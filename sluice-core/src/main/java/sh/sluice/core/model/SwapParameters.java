// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sluice.core.model;

import java.math.BigInteger;
import java.util.Objects;

import sh.sluice.core.types.Address;

/**
 * Aggregate parameters reported by a swap engine's storage accessor.
 *
 * <p>Fees use the engine's own fixed-point denominator (1e10 for Saddle-style engines).
 * Ramp times are unix seconds.
 *
 * @param initialA     amplification coefficient at the start of the current ramp
 * @param futureA      amplification coefficient at the end of the current ramp
 * @param initialATime ramp start
 * @param futureATime  ramp end; zero when the engine does not report it
 * @param swapFee      swap fee
 * @param adminFee     admin share of the swap fee
 * @param lpToken      LP token minted by the engine
 * @since 0.1.0
 */
public record SwapParameters(
        BigInteger initialA,
        BigInteger futureA,
        BigInteger initialATime,
        BigInteger futureATime,
        BigInteger swapFee,
        BigInteger adminFee,
        Address lpToken) {

    public SwapParameters {
        Objects.requireNonNull(initialA, "initialA");
        Objects.requireNonNull(futureA, "futureA");
        Objects.requireNonNull(initialATime, "initialATime");
        Objects.requireNonNull(futureATime, "futureATime");
        Objects.requireNonNull(swapFee, "swapFee");
        Objects.requireNonNull(adminFee, "adminFee");
        Objects.requireNonNull(lpToken, "lpToken");
    }
}
