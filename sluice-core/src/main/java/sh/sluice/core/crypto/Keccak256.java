// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sluice.core.crypto;

import java.util.Objects;

import org.bouncycastle.jcajce.provider.digest.Keccak;

/**
 * Keccak-256 hashing backed by BouncyCastle's {@code Keccak.Digest256}.
 * <p>
 * Digest instances are cached per thread. Call {@link #cleanup()} from pooled threads
 * that are about to be handed back to a container.
 *
 * @since 0.1.0
 */
public final class Keccak256 {

    private static final ThreadLocal<Keccak.Digest256> DIGEST = ThreadLocal.withInitial(Keccak.Digest256::new);

    private Keccak256() {
        // Utility class
    }

    /**
     * Computes the Keccak-256 hash of the concatenation of {@code inputs}.
     *
     * @param inputs the data arrays to hash, in order
     * @return 32-byte hash
     * @throws NullPointerException if inputs or any element is null
     */
    public static byte[] hash(final byte[]... inputs) {
        Objects.requireNonNull(inputs, "inputs cannot be null");

        final Keccak.Digest256 digest = DIGEST.get();
        digest.reset();
        for (byte[] input : inputs) {
            Objects.requireNonNull(input, "input element cannot be null");
            digest.update(input);
        }
        return digest.digest();
    }

    /**
     * Removes the cached digest instance from the current thread.
     */
    public static void cleanup() {
        DIGEST.remove();
    }
}
