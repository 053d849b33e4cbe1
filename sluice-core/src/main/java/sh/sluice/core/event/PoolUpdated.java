// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sluice.core.event;

import sh.sluice.core.model.PoolRecord;
import sh.sluice.core.types.Address;

/** A pool's record was overwritten. */
public record PoolUpdated(Address poolAddress, int index, PoolRecord record) implements RegistryEvent {
}
