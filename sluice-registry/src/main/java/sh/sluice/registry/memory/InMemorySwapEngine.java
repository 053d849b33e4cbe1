// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sluice.registry.memory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.jspecify.annotations.Nullable;

import sh.sluice.core.model.SwapParameters;
import sh.sluice.core.types.Address;
import sh.sluice.registry.spi.GuardedSwapStorage;
import sh.sluice.registry.spi.SwapEngine;

/**
 * Mutable {@link SwapEngine} held in memory, for examples and tests.
 *
 * <p>Balances, pause state and prices can be changed after construction to simulate a
 * live engine; the token list is fixed.
 *
 * <pre>{@code
 * InMemorySwapEngine engine = InMemorySwapEngine.builder(owner)
 *         .tokens(dai, usdc, usdt)
 *         .lpToken(usdLp)
 *         .swapFee(4_000_000L)
 *         .build();
 * }</pre>
 */
public final class InMemorySwapEngine implements SwapEngine {

    private final List<Address> tokens;
    private final @Nullable SwapParameters parameters;
    private final boolean guarded;
    private final Address owner;

    private final List<BigInteger> balances;
    private volatile boolean paused;
    private volatile BigInteger virtualPrice;
    private volatile BigInteger a;

    private InMemorySwapEngine(final Builder builder) {
        this.tokens = List.copyOf(builder.tokens);
        this.parameters = builder.withParameters
                ? new SwapParameters(builder.initialA, builder.futureA, builder.initialATime, builder.futureATime,
                        builder.swapFee, builder.adminFee, builder.lpToken)
                : null;
        this.guarded = builder.guarded;
        this.owner = builder.owner;
        this.paused = builder.paused;
        this.virtualPrice = builder.virtualPrice;
        this.a = builder.initialA;
        this.balances = new ArrayList<>(tokens.size());
        for (int i = 0; i < tokens.size(); i++) {
            balances.add(BigInteger.ZERO);
        }
    }

    public static Builder builder(final Address owner) {
        return new Builder(owner);
    }

    @Override
    public Optional<Address> tokenAt(final int index) {
        return index >= 0 && index < tokens.size() ? Optional.of(tokens.get(index)) : Optional.empty();
    }

    @Override
    public Optional<SwapParameters> swapStorage() {
        return guarded ? Optional.empty() : Optional.ofNullable(parameters);
    }

    @Override
    public Optional<GuardedSwapStorage> guardedSwapStorage() {
        if (!guarded || parameters == null) {
            return Optional.empty();
        }
        return Optional.of(new GuardedSwapStorage(parameters.initialA(), parameters.futureA(),
                parameters.initialATime(), parameters.swapFee(), parameters.adminFee(), parameters.lpToken()));
    }

    @Override
    public Address owner() {
        return owner;
    }

    @Override
    public boolean paused() {
        return paused;
    }

    @Override
    public BigInteger virtualPrice() {
        return virtualPrice;
    }

    @Override
    public BigInteger a() {
        return a;
    }

    @Override
    public synchronized BigInteger tokenBalance(final int index) {
        if (index < 0 || index >= balances.size()) {
            throw new IndexOutOfBoundsException("no token at index " + index);
        }
        return balances.get(index);
    }

    public synchronized void setBalance(final int index, final BigInteger balance) {
        Objects.requireNonNull(balance, "balance");
        balances.set(index, balance);
    }

    public void setPaused(final boolean paused) {
        this.paused = paused;
    }

    public void setVirtualPrice(final BigInteger virtualPrice) {
        this.virtualPrice = Objects.requireNonNull(virtualPrice, "virtualPrice");
    }

    public void setA(final BigInteger a) {
        this.a = Objects.requireNonNull(a, "a");
    }

    public static final class Builder {
        private final Address owner;
        private List<Address> tokens = List.of();
        private boolean withParameters = true;
        private boolean guarded;
        private boolean paused;
        private BigInteger initialA = BigInteger.valueOf(200);
        private BigInteger futureA = BigInteger.valueOf(200);
        private BigInteger initialATime = BigInteger.ZERO;
        private BigInteger futureATime = BigInteger.ZERO;
        private BigInteger swapFee = BigInteger.valueOf(4_000_000L);
        private BigInteger adminFee = BigInteger.ZERO;
        private BigInteger virtualPrice = BigInteger.TEN.pow(18);
        private Address lpToken = Address.ZERO;

        private Builder(final Address owner) {
            this.owner = Objects.requireNonNull(owner, "owner");
        }

        public Builder tokens(final Address... tokens) {
            this.tokens = List.of(tokens);
            return this;
        }

        public Builder lpToken(final Address lpToken) {
            this.lpToken = Objects.requireNonNull(lpToken, "lpToken");
            return this;
        }

        public Builder a(final long a) {
            this.initialA = BigInteger.valueOf(a);
            this.futureA = this.initialA;
            return this;
        }

        public Builder ramp(final long futureA, final long initialATime, final long futureATime) {
            this.futureA = BigInteger.valueOf(futureA);
            this.initialATime = BigInteger.valueOf(initialATime);
            this.futureATime = BigInteger.valueOf(futureATime);
            return this;
        }

        public Builder swapFee(final long swapFee) {
            this.swapFee = BigInteger.valueOf(swapFee);
            return this;
        }

        public Builder adminFee(final long adminFee) {
            this.adminFee = BigInteger.valueOf(adminFee);
            return this;
        }

        public Builder virtualPrice(final BigInteger virtualPrice) {
            this.virtualPrice = Objects.requireNonNull(virtualPrice, "virtualPrice");
            return this;
        }

        public Builder paused(final boolean paused) {
            this.paused = paused;
            return this;
        }

        /** Expose parameters only through the guarded storage shape. */
        public Builder guarded() {
            this.guarded = true;
            return this;
        }

        /** Expose no storage shape at all. */
        public Builder withoutParameters() {
            this.withParameters = false;
            return this;
        }

        public InMemorySwapEngine build() {
            return new InMemorySwapEngine(this);
        }
    }
}
