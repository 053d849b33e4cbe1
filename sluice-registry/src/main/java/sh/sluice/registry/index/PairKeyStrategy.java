// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sluice.registry.index;

import java.util.Objects;

import sh.sluice.core.crypto.Keccak256;
import sh.sluice.core.types.Address;
import sh.sluice.core.types.Hash;

/**
 * How two token addresses are combined into a {@link PairKey}.
 */
public enum PairKeyStrategy {

    /**
     * Keccak-256 of the lower address followed by the higher one. Distinct pairs map to
     * distinct keys.
     */
    CANONICAL {
        @Override
        public PairKey key(final Address a, final Address b) {
            Objects.requireNonNull(a, "a");
            Objects.requireNonNull(b, "b");
            final Address low = a.compareTo(b) <= 0 ? a : b;
            final Address high = low == a ? b : a;
            return new PairKey(Hash.fromBytes(Keccak256.hash(low.toBytes(), high.toBytes())));
        }
    },

    /**
     * Exclusive-or of the two addresses, left-padded to 32 bytes. Bit-compatible with
     * indexes built by {@code a ^ b}; two distinct pairs can share a key.
     */
    XOR {
        @Override
        public PairKey key(final Address a, final Address b) {
            Objects.requireNonNull(a, "a");
            Objects.requireNonNull(b, "b");
            final byte[] left = a.toBytes();
            final byte[] right = b.toBytes();
            final byte[] out = new byte[Hash.BYTE_LENGTH];
            final int offset = Hash.BYTE_LENGTH - Address.BYTE_LENGTH;
            for (int i = 0; i < Address.BYTE_LENGTH; i++) {
                out[offset + i] = (byte) (left[i] ^ right[i]);
            }
            return new PairKey(Hash.fromBytes(out));
        }
    };

    /**
     * Combines two addresses into an order-independent key.
     */
    public abstract PairKey key(Address a, Address b);
}
