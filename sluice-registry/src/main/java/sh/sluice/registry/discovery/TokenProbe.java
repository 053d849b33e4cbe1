// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sluice.registry.discovery;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.function.IntFunction;

import sh.sluice.core.DebugLogger;
import sh.sluice.core.LogFormatter;
import sh.sluice.core.error.ValidationException;
import sh.sluice.core.types.Address;

/**
 * Bounded, lazy enumeration of an externally owned token list.
 *
 * <p>Positions {@code 0..cap-1} are probed in order. The first position that reports no
 * token ends the sequence, and no later position is probed. A position that reports the
 * zero address fails with {@link ValidationException.Reason#ZERO_TOKEN}.
 *
 * <pre>{@code
 * List<Address> tokens = TokenProbe.of("token", target, engine::tokenAt, 8).toList();
 * }</pre>
 */
public final class TokenProbe implements Iterator<Address> {

    private final String kind;
    private final Address target;
    private final IntFunction<Optional<Address>> probe;
    private final int cap;

    private int index;
    private Address lookahead;
    private boolean exhausted;

    private TokenProbe(String kind, Address target, IntFunction<Optional<Address>> probe, int cap) {
        this.kind = kind;
        this.target = target;
        this.probe = probe;
        this.cap = cap;
    }

    /**
     * @param kind   label used in debug lines and error messages
     * @param target collaborator being probed
     * @param probe  per-position lookup
     * @param cap    maximum number of positions to probe
     */
    public static TokenProbe of(String kind, Address target, IntFunction<Optional<Address>> probe, int cap) {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(probe, "probe");
        if (cap < 0) {
            throw new IllegalArgumentException("cap must be non-negative: " + cap);
        }
        return new TokenProbe(kind, target, probe, cap);
    }

    @Override
    public boolean hasNext() {
        if (lookahead != null) {
            return true;
        }
        if (exhausted || index >= cap) {
            return false;
        }
        final Optional<Address> found = Objects.requireNonNull(probe.apply(index),
                "probe returned null at index " + index);
        DebugLogger.logProbe(LogFormatter.formatProbe(kind, target, index, found.orElse(null)));
        if (found.isEmpty()) {
            exhausted = true;
            return false;
        }
        if (found.get().isZero()) {
            throw new ValidationException(ValidationException.Reason.ZERO_TOKEN,
                    kind + " at index " + index + " of " + target + " is the zero address");
        }
        lookahead = found.get();
        return true;
    }

    @Override
    public Address next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        final Address token = lookahead;
        lookahead = null;
        index++;
        return token;
    }

    /**
     * Drains the probe into an unmodifiable list.
     */
    public List<Address> toList() {
        final List<Address> tokens = new ArrayList<>(cap);
        while (hasNext()) {
            tokens.add(next());
        }
        DebugLogger.logProbe(LogFormatter.formatDiscovered(target, tokens));
        return List.copyOf(tokens);
    }
}
