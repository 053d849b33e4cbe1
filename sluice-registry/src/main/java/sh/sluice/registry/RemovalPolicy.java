// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sluice.registry;

/**
 * What {@link PoolRegistry#removePool} does to the lookup indices.
 *
 * <p>Either way the record stays at its position in the record sequence with
 * {@code removed = true}, and the pair index is left as it is.
 */
public enum RemovalPolicy {

    /**
     * Drops the address and name index entries. The removed pool is no longer found by
     * address or name, and both become available for a new registration.
     */
    RELEASE_INDEX,

    /**
     * Keeps the address and name index entries. The removed record is still returned by
     * address and name, and the address can never be registered again.
     */
    RETAIN_INDEX
}
