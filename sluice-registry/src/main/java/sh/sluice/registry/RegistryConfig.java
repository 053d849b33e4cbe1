// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sluice.registry;

import java.util.Objects;

import sh.sluice.registry.index.PairKeyStrategy;

/**
 * Configuration for a {@link PoolRegistry}.
 *
 * <ul>
 *   <li>{@code maxTokens} - number of positions probed per token list (default: 8)</li>
 *   <li>{@code pairKeyStrategy} - how pair keys are built (default: {@link PairKeyStrategy#CANONICAL})</li>
 *   <li>{@code removalPolicy} - index handling on removal (default: {@link RemovalPolicy#RELEASE_INDEX})</li>
 * </ul>
 *
 * <p><strong>Example:</strong>
 * <pre>{@code
 * // Bit-compatible with an index keyed by a ^ b, keeping removed pools indexed
 * RegistryConfig legacy = RegistryConfig.builder()
 *     .pairKeyStrategy(PairKeyStrategy.XOR)
 *     .removalPolicy(RemovalPolicy.RETAIN_INDEX)
 *     .build();
 * }</pre>
 *
 * @param maxTokens       probe cap per token list (1..{@value #MAX_TOKENS_LIMIT})
 * @param pairKeyStrategy pair key combinator
 * @param removalPolicy   index handling on removal
 * @since 0.1.0
 */
public record RegistryConfig(
        int maxTokens,
        PairKeyStrategy pairKeyStrategy,
        RemovalPolicy removalPolicy) {

    /** Default probe cap. */
    public static final int DEFAULT_MAX_TOKENS = 8;

    /** Largest accepted probe cap. */
    public static final int MAX_TOKENS_LIMIT = 32;

    public RegistryConfig {
        if (maxTokens < 1 || maxTokens > MAX_TOKENS_LIMIT) {
            throw new IllegalArgumentException(
                    "maxTokens must be in 1.." + MAX_TOKENS_LIMIT + ", got: " + maxTokens);
        }
        Objects.requireNonNull(pairKeyStrategy, "pairKeyStrategy");
        Objects.requireNonNull(removalPolicy, "removalPolicy");
    }

    /**
     * @return 8 tokens, canonical pair keys, index released on removal
     */
    public static RegistryConfig defaults() {
        return new RegistryConfig(DEFAULT_MAX_TOKENS, PairKeyStrategy.CANONICAL, RemovalPolicy.RELEASE_INDEX);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder initialised with the defaults.
     */
    public static final class Builder {
        private int maxTokens = DEFAULT_MAX_TOKENS;
        private PairKeyStrategy pairKeyStrategy = PairKeyStrategy.CANONICAL;
        private RemovalPolicy removalPolicy = RemovalPolicy.RELEASE_INDEX;

        private Builder() {}

        public Builder maxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
            return this;
        }

        public Builder pairKeyStrategy(PairKeyStrategy pairKeyStrategy) {
            this.pairKeyStrategy = pairKeyStrategy;
            return this;
        }

        public Builder removalPolicy(RemovalPolicy removalPolicy) {
            this.removalPolicy = removalPolicy;
            return this;
        }

        /**
         * @throws IllegalArgumentException if {@code maxTokens} is out of range
         */
        public RegistryConfig build() {
            return new RegistryConfig(maxTokens, pairKeyStrategy, removalPolicy);
        }
    }
}
