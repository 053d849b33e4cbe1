// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sluice.core.model;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;

import sh.sluice.core.types.Address;

/**
 * One registered pool.
 *
 * <p>{@code tokens} is in engine order: position {@code i} is the token the engine
 * reports at index {@code i}. {@code underlyingTokens} is empty unless the pool is
 * fronted by a deposit wrapper, in which case it lists the wrapper's tokens with the
 * base pool's LP token expanded into the base pool's own tokens.
 *
 * @param poolAddress           the pool's identifier
 * @param lpToken               LP token minted by the pool, discovered at registration
 * @param assetClass            peg category
 * @param name                  short label, unique among indexed records
 * @param targetAddress         engine implementing the swap
 * @param tokens                discovered top-level tokens
 * @param underlyingTokens      tokens discovered through the deposit wrapper
 * @param basePoolAddress       base pool behind the wrapper, or zero
 * @param depositWrapperAddress deposit wrapper, or zero
 * @param externalId            opaque ordering key
 * @param approved              fully trusted entry
 * @param removed               soft-delete flag
 * @since 0.1.0
 */
public record PoolRecord(
        Address poolAddress,
        Address lpToken,
        AssetClass assetClass,
        String name,
        Address targetAddress,
        List<Address> tokens,
        List<Address> underlyingTokens,
        Address basePoolAddress,
        Address depositWrapperAddress,
        BigInteger externalId,
        boolean approved,
        boolean removed) {

    public PoolRecord {
        Objects.requireNonNull(poolAddress, "poolAddress");
        Objects.requireNonNull(lpToken, "lpToken");
        Objects.requireNonNull(assetClass, "assetClass");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(targetAddress, "targetAddress");
        Objects.requireNonNull(basePoolAddress, "basePoolAddress");
        Objects.requireNonNull(depositWrapperAddress, "depositWrapperAddress");
        Objects.requireNonNull(externalId, "externalId");
        tokens = List.copyOf(Objects.requireNonNull(tokens, "tokens"));
        underlyingTokens = List.copyOf(Objects.requireNonNull(underlyingTokens, "underlyingTokens"));
    }

    /** Returns {@code true} if the pool is fronted by a deposit wrapper. */
    public boolean hasDepositWrapper() {
        return !depositWrapperAddress.isZero();
    }

    public PoolRecord withApproved(final boolean approved) {
        return new PoolRecord(poolAddress, lpToken, assetClass, name, targetAddress, tokens,
                underlyingTokens, basePoolAddress, depositWrapperAddress, externalId, approved, removed);
    }

    public PoolRecord withRemoved(final boolean removed) {
        return new PoolRecord(poolAddress, lpToken, assetClass, name, targetAddress, tokens,
                underlyingTokens, basePoolAddress, depositWrapperAddress, externalId, approved, removed);
    }
}
