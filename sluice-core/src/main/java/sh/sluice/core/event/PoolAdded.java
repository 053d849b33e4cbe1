// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sluice.core.event;

import sh.sluice.core.model.PoolRecord;
import sh.sluice.core.types.Address;

/**
 * A pool was registered.
 *
 * @param poolAddress the pool
 * @param index       zero-based position in the record sequence
 * @param record      the committed record
 */
public record PoolAdded(Address poolAddress, int index, PoolRecord record) implements RegistryEvent {
}
