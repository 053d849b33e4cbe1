// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sluice.registry.memory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

import sh.sluice.core.types.Address;
import sh.sluice.registry.spi.DepositWrapper;

/**
 * Fixed {@link DepositWrapper} held in memory.
 *
 * @param metaSwap         the wrapping pool this wrapper fronts
 * @param baseSwap         the base pool whose LP token the wrapping pool holds
 * @param underlyingTokens the wrapping pool's tokens with the base LP token expanded
 */
public record InMemoryDepositWrapper(Address metaSwap, Address baseSwap, List<Address> underlyingTokens)
        implements DepositWrapper {

    public InMemoryDepositWrapper {
        Objects.requireNonNull(metaSwap, "metaSwap");
        Objects.requireNonNull(baseSwap, "baseSwap");
        underlyingTokens = List.copyOf(underlyingTokens);
    }

    @Override
    public Optional<Address> tokenAt(final int index) {
        return index >= 0 && index < underlyingTokens.size()
                ? Optional.of(underlyingTokens.get(index))
                : Optional.empty();
    }
}
