// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sluice.registry.index;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import sh.sluice.core.types.Address;

/**
 * Pair-eligibility index: unordered token pair to the venues that can exchange it.
 *
 * <p>Venue lists only grow. Each venue appears at most once per key, in the order it was
 * first indexed. Additions go through a {@link Staging} so that a registration that
 * fails midway leaves the index untouched.
 *
 * <p>Not thread-safe; the owning registry serialises access.
 */
public final class PairIndex {

    private final PairKeyStrategy strategy;
    private final Map<PairKey, List<Address>> venues = new HashMap<>();

    public PairIndex(final PairKeyStrategy strategy) {
        this.strategy = Objects.requireNonNull(strategy, "strategy");
    }

    public PairKeyStrategy strategy() {
        return strategy;
    }

    /**
     * Returns the venues indexed for the pair {@code (a, b)}, in indexing order.
     *
     * @return an unmodifiable view, empty if the pair was never indexed
     */
    public List<Address> venues(final Address a, final Address b) {
        final List<Address> found = venues.get(strategy.key(a, b));
        return found == null ? List.of() : Collections.unmodifiableList(found);
    }

    /** Number of distinct keys. */
    public int size() {
        return venues.size();
    }

    /**
     * Returns a copy of every entry, keyed in insertion-independent order.
     */
    public Map<PairKey, List<Address>> entries() {
        final Map<PairKey, List<Address>> copy = new LinkedHashMap<>();
        venues.entrySet().stream()
                .sorted(Map.Entry.comparingByKey((x, y) -> x.value().value().compareTo(y.value().value())))
                .forEach(e -> copy.put(e.getKey(), List.copyOf(e.getValue())));
        return copy;
    }

    /**
     * Starts a batch of additions that becomes visible only on {@link Staging#commit()}.
     */
    public Staging stage() {
        return new Staging();
    }

    /**
     * Pending additions for one registration.
     */
    public final class Staging {
        private final List<PairKey> keys = new ArrayList<>();
        private final List<Address> pending = new ArrayList<>();
        private boolean committed;

        private Staging() {
        }

        /**
         * Records that {@code venue} can exchange {@code a} against {@code b}. A pair of
         * identical tokens is ignored.
         */
        public void add(final Address a, final Address b, final Address venue) {
            Objects.requireNonNull(venue, "venue");
            if (a.equals(b)) {
                return;
            }
            keys.add(strategy.key(a, b));
            pending.add(venue);
        }

        /** Number of staged pairs, counting repeats. */
        public int size() {
            return keys.size();
        }

        /**
         * Applies the staged additions.
         *
         * @throws IllegalStateException if already committed
         */
        public void commit() {
            if (committed) {
                throw new IllegalStateException("staging already committed");
            }
            committed = true;
            for (int i = 0; i < keys.size(); i++) {
                final List<Address> list = venues.computeIfAbsent(keys.get(i), k -> new ArrayList<>());
                final Address venue = pending.get(i);
                if (!list.contains(venue)) {
                    list.add(venue);
                }
            }
        }
    }
}
