// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sluice.registry.spi;

import sh.sluice.core.types.Address;

/**
 * Resolves addresses to collaborator handles.
 *
 * <p>Both methods throw {@link sh.sluice.core.error.ExternalUnavailableException} with
 * reason {@code NO_COLLABORATOR} when nothing of the requested kind lives at the address.
 */
public interface PoolConnector {

    SwapEngine swapEngine(Address address);

    DepositWrapper depositWrapper(Address address);
}
