// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sluice.registry.index;

import java.util.Objects;

import sh.sluice.core.types.Hash;

/**
 * Key of an unordered token pair in the {@link PairIndex}.
 *
 * <p>Built by a {@link PairKeyStrategy}; {@code key(a, b)} and {@code key(b, a)} are
 * always equal.
 */
public record PairKey(@com.fasterxml.jackson.annotation.JsonValue Hash value) {

    public PairKey {
        Objects.requireNonNull(value, "value");
    }

    @Override
    public String toString() {
        return value.value();
    }
}
