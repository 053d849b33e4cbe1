// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sluice.core.event;

/**
 * Notification emitted after a registry write commits.
 *
 * @since 0.1.0
 */
public sealed interface RegistryEvent
        permits RegistryAdded, PoolAdded, PoolApproved, PoolUpdated, PoolRemoved {
}
