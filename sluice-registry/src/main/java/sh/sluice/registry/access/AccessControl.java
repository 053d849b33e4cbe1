// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sluice.registry.access;

import sh.sluice.core.error.AuthorizationException;
import sh.sluice.core.model.Role;
import sh.sluice.core.types.Address;

/**
 * Role check consumed by the registries.
 */
@FunctionalInterface
public interface AccessControl {

    boolean hasRole(Role role, Address account);

    /**
     * Throws unless {@code account} holds {@code role}.
     *
     * @throws AuthorizationException if the role is missing
     */
    default void checkRole(Role role, Address account) {
        if (account == null || !hasRole(role, account)) {
            throw new AuthorizationException(role, account);
        }
    }
}
