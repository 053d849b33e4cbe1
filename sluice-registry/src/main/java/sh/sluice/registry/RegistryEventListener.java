// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sluice.registry;

import sh.sluice.core.event.RegistryEvent;

/**
 * Receives registry events after the write that produced them has committed.
 *
 * <p>Listeners run on the writing thread, outside the registry lock, so they may read
 * from or write to the registry. An exception thrown by a listener is logged and does
 * not undo the write.
 */
@FunctionalInterface
public interface RegistryEventListener {

    void onEvent(RegistryEvent event);
}
