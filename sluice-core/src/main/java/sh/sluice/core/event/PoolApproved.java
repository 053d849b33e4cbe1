// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sluice.core.event;

import sh.sluice.core.types.Address;

/** A pool was promoted to approved. */
public record PoolApproved(Address poolAddress, int index) implements RegistryEvent {
}
