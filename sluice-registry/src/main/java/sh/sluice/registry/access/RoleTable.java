// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sluice.registry.access;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.sluice.core.model.Role;
import sh.sluice.core.types.Address;

/**
 * In-memory role assignments.
 *
 * <p>{@link Role#ADMIN} implies every other role and is the only role allowed to grant
 * or revoke. The initial admin is fixed at construction. Further admins may be granted.
 *
 * <pre>{@code
 * RoleTable roles = new RoleTable(admin);
 * roles.grantRole(admin, Role.MANAGER, manager);
 * PoolRegistry registry = new PoolRegistry(connector, roles);
 * }</pre>
 */
public final class RoleTable implements AccessControl {

    private static final Logger log = LoggerFactory.getLogger(RoleTable.class);

    private final Map<Role, Set<Address>> members = new EnumMap<>(Role.class);

    public RoleTable(final Address admin) {
        Objects.requireNonNull(admin, "admin");
        if (admin.isZero()) {
            throw new IllegalArgumentException("admin cannot be the zero address");
        }
        for (Role role : Role.values()) {
            members.put(role, ConcurrentHashMap.newKeySet());
        }
        members.get(Role.ADMIN).add(admin);
    }

    @Override
    public boolean hasRole(final Role role, final Address account) {
        Objects.requireNonNull(role, "role");
        if (account == null) {
            return false;
        }
        return members.get(Role.ADMIN).contains(account) || members.get(role).contains(account);
    }

    /**
     * Grants {@code role} to {@code account}.
     *
     * @throws sh.sluice.core.error.AuthorizationException if {@code caller} is not an admin
     */
    public void grantRole(final Address caller, final Role role, final Address account) {
        checkRole(Role.ADMIN, caller);
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(account, "account");
        if (members.get(role).add(account)) {
            log.debug("Granted {} to {}", role, account);
        }
    }

    /**
     * Revokes {@code role} from {@code account}. Revoking a role that is not held is a no-op.
     *
     * @throws sh.sluice.core.error.AuthorizationException if {@code caller} is not an admin
     */
    public void revokeRole(final Address caller, final Role role, final Address account) {
        checkRole(Role.ADMIN, caller);
        Objects.requireNonNull(role, "role");
        if (members.get(role).remove(account)) {
            log.debug("Revoked {} from {}", role, account);
        }
    }
}
