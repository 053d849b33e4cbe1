// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sluice.registry.memory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

import sh.sluice.core.error.ExternalUnavailableException;
import sh.sluice.core.types.Address;
import sh.sluice.registry.spi.DepositWrapper;
import sh.sluice.registry.spi.PoolConnector;
import sh.sluice.registry.spi.SwapEngine;

/**
 * {@link PoolConnector} over collaborators registered in memory.
 */
public final class InMemoryPoolConnector implements PoolConnector {

    private final Map<Address, SwapEngine> engines = new ConcurrentHashMap<>();
    private final Map<Address, DepositWrapper> wrappers = new ConcurrentHashMap<>();

    public InMemoryPoolConnector deploy(final Address address, final SwapEngine engine) {
        engines.put(Objects.requireNonNull(address, "address"), Objects.requireNonNull(engine, "engine"));
        return this;
    }

    public InMemoryPoolConnector deploy(final Address address, final DepositWrapper wrapper) {
        wrappers.put(Objects.requireNonNull(address, "address"), Objects.requireNonNull(wrapper, "wrapper"));
        return this;
    }

    @Override
    public SwapEngine swapEngine(final Address address) {
        final SwapEngine engine = address == null ? null : engines.get(address);
        if (engine == null) {
            throw new ExternalUnavailableException(ExternalUnavailableException.Reason.NO_COLLABORATOR,
                    "no swap engine at " + address);
        }
        return engine;
    }

    @Override
    public DepositWrapper depositWrapper(final Address address) {
        final DepositWrapper wrapper = address == null ? null : wrappers.get(address);
        if (wrapper == null) {
            throw new ExternalUnavailableException(ExternalUnavailableException.Reason.NO_COLLABORATOR,
                    "no deposit wrapper at " + address);
        }
        return wrapper;
    }
}
