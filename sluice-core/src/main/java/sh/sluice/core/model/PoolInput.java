// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sluice.core.model;

import java.math.BigInteger;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.sluice.core.types.Address;

/**
 * Administrator-supplied part of a pool registration.
 * <p>
 * Everything else in a {@link PoolRecord} (LP token, token lists, base pool) is
 * discovered from the pool's engine during registration.
 *
 * @param poolAddress           the pool's identifier
 * @param assetClass            peg category
 * @param name                  short unique label
 * @param targetAddress         engine implementing the swap; {@code null} or zero means the pool itself
 * @param depositWrapperAddress optional wrapper exposing the pool's underlying tokens
 * @param externalId            opaque ordering key
 * @param approved              whether the pool is fully trusted
 * @param removed               initial soft-delete flag
 * @since 0.1.0
 */
public record PoolInput(
        Address poolAddress,
        AssetClass assetClass,
        String name,
        @Nullable Address targetAddress,
        @Nullable Address depositWrapperAddress,
        BigInteger externalId,
        boolean approved,
        boolean removed) {

    public PoolInput {
        Objects.requireNonNull(poolAddress, "poolAddress");
        Objects.requireNonNull(assetClass, "assetClass");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(externalId, "externalId");
        if (externalId.signum() < 0) {
            throw new IllegalArgumentException("externalId must be non-negative");
        }
    }

    /**
     * Returns the engine to probe: {@link #targetAddress()} when set, otherwise the pool.
     */
    public Address effectiveTarget() {
        return Address.isNullOrZero(targetAddress) ? poolAddress : targetAddress;
    }

    /**
     * Returns the deposit wrapper, or {@link Address#ZERO} when the pool has none.
     */
    public Address effectiveDepositWrapper() {
        return depositWrapperAddress == null ? Address.ZERO : depositWrapperAddress;
    }

    public static Builder builder(final Address poolAddress, final String name) {
        return new Builder(poolAddress, name);
    }

    /**
     * Builder with {@link AssetClass#OTHER}, external id zero and all flags unset.
     */
    public static final class Builder {
        private final Address poolAddress;
        private final String name;
        private AssetClass assetClass = AssetClass.OTHER;
        private Address targetAddress;
        private Address depositWrapperAddress;
        private BigInteger externalId = BigInteger.ZERO;
        private boolean approved;
        private boolean removed;

        private Builder(final Address poolAddress, final String name) {
            this.poolAddress = poolAddress;
            this.name = name;
        }

        public Builder assetClass(final AssetClass assetClass) {
            this.assetClass = assetClass;
            return this;
        }

        public Builder targetAddress(final Address targetAddress) {
            this.targetAddress = targetAddress;
            return this;
        }

        public Builder depositWrapperAddress(final Address depositWrapperAddress) {
            this.depositWrapperAddress = depositWrapperAddress;
            return this;
        }

        public Builder externalId(final long externalId) {
            this.externalId = BigInteger.valueOf(externalId);
            return this;
        }

        public Builder approved(final boolean approved) {
            this.approved = approved;
            return this;
        }

        public Builder removed(final boolean removed) {
            this.removed = removed;
            return this;
        }

        public PoolInput build() {
            return new PoolInput(poolAddress, assetClass, name, targetAddress,
                    depositWrapperAddress, externalId, approved, removed);
        }
    }
}
