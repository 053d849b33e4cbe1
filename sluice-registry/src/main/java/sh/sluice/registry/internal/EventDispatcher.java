// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sluice.registry.internal;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.sluice.core.event.RegistryEvent;
import sh.sluice.registry.RegistryEventListener;

/**
 * Fan-out of committed registry events to listeners.
 */
public final class EventDispatcher {

    private static final Logger log = LoggerFactory.getLogger(EventDispatcher.class);

    private final List<RegistryEventListener> listeners = new CopyOnWriteArrayList<>();

    public void addListener(final RegistryEventListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(final RegistryEventListener listener) {
        listeners.remove(listener);
    }

    /**
     * Delivers {@code event} to every listener in registration order. A failing listener
     * is logged and does not stop delivery to the rest.
     */
    public void publish(final RegistryEvent event) {
        for (RegistryEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("Registry listener {} failed on {}", listener, event, e);
            }
        }
    }
}
