// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sluice.core.event;

import sh.sluice.core.types.Address;

/**
 * A new version was appended to a name in the name registry.
 *
 * @param name       the registered name
 * @param identifier the identifier appended
 * @param version    zero-based version assigned
 */
public record RegistryAdded(String name, Address identifier, int version) implements RegistryEvent {
}
