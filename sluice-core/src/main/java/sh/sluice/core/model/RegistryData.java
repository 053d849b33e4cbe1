// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sluice.core.model;

import java.util.Objects;

/**
 * Result of a reverse lookup in the name registry.
 *
 * @param name    the name the identifier was registered under
 * @param version zero-based position in the name's version list
 * @param latest  whether this is the name's most recent version
 * @since 0.1.0
 */
public record RegistryData(String name, int version, boolean latest) {

    public RegistryData {
        Objects.requireNonNull(name, "name");
        if (version < 0) {
            throw new IllegalArgumentException("version must be non-negative");
        }
    }
}
