// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sluice.registry.discovery;

import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.sluice.core.error.ExternalUnavailableException;
import sh.sluice.core.model.SwapParameters;
import sh.sluice.core.types.Address;
import sh.sluice.registry.spi.GuardedSwapStorage;
import sh.sluice.registry.spi.SwapEngine;

/**
 * Storage shapes a swap engine may expose, in the order they are tried.
 */
public enum SwapStorageVariant {

    STANDARD {
        @Override
        Optional<SwapParameters> read(final SwapEngine engine) {
            return engine.swapStorage();
        }
    },

    GUARDED {
        @Override
        Optional<SwapParameters> read(final SwapEngine engine) {
            return engine.guardedSwapStorage().map(GuardedSwapStorage::toSwapParameters);
        }
    };

    private static final Logger log = LoggerFactory.getLogger(SwapStorageVariant.class);

    abstract Optional<SwapParameters> read(SwapEngine engine);

    /**
     * Reads the engine's parameters through the first variant that answers.
     *
     * <p>A variant that returns empty or throws is skipped. The last failure is attached
     * as the cause when no variant answers. An {@link IllegalStateException} is not
     * treated as a failed read and propagates unchanged.
     *
     * @param engine the engine to query
     * @param target the engine's address, for messages
     * @return the parameters
     * @throws ExternalUnavailableException with reason {@code NO_PARAMETER_DATA} if no variant answers
     */
    public static SwapParameters resolve(final SwapEngine engine, final Address target) {
        Objects.requireNonNull(engine, "engine");
        RuntimeException lastFailure = null;
        for (SwapStorageVariant variant : values()) {
            try {
                final Optional<SwapParameters> parameters = variant.read(engine);
                if (parameters.isPresent()) {
                    return parameters.get();
                }
            } catch (IllegalStateException e) {
                // a rejected nested write is not a missing storage shape
                throw e;
            } catch (RuntimeException e) {
                log.debug("{} storage read failed for {}: {}", variant, target, e.getMessage());
                lastFailure = e;
            }
        }
        final String message = "no storage variant answered for " + target;
        throw lastFailure == null
                ? new ExternalUnavailableException(ExternalUnavailableException.Reason.NO_PARAMETER_DATA, message)
                : new ExternalUnavailableException(ExternalUnavailableException.Reason.NO_PARAMETER_DATA, message, lastFailure);
    }
}
