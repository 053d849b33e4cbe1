// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sluice.core.error;

import java.util.Objects;

import sh.sluice.core.model.Role;
import sh.sluice.core.types.Address;

/**
 * Thrown when the caller of a privileged operation does not hold the required role.
 *
 * @since 0.1.0
 */
public final class AuthorizationException extends SluiceException {

    private final Role role;
    private final Address account;

    public AuthorizationException(final Role role, final Address account) {
        this(role, account, "account " + account + " is missing role " + role);
    }

    public AuthorizationException(final Role role, final Address account, final String message) {
        super(message);
        this.role = Objects.requireNonNull(role, "role");
        this.account = account;
    }

    public Role role() {
        return role;
    }

    public Address account() {
        return account;
    }
}
