// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sluice.core.event;

import sh.sluice.core.types.Address;

/** A pool was soft-deleted. */
public record PoolRemoved(Address poolAddress, int index) implements RegistryEvent {
}
