// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sluice.registry.access;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import sh.sluice.core.error.AuthorizationException;
import sh.sluice.core.model.Role;
import sh.sluice.core.types.Address;
import sh.sluice.registry.Addresses;

class RoleTableTest {

    private static final Address ADMIN = Addresses.of(1);
    private static final Address ALICE = Addresses.of(2);
    private static final Address BOB = Addresses.of(3);

    private final RoleTable roles = new RoleTable(ADMIN);

    @Test
    void adminHoldsEveryRole() {
        for (Role role : Role.values()) {
            assertTrue(roles.hasRole(role, ADMIN), role.name());
        }
    }

    @Test
    void grantAndRevoke() {
        roles.grantRole(ADMIN, Role.MANAGER, ALICE);
        assertTrue(roles.hasRole(Role.MANAGER, ALICE));
        assertFalse(roles.hasRole(Role.COMMUNITY_MANAGER, ALICE));

        roles.revokeRole(ADMIN, Role.MANAGER, ALICE);
        assertFalse(roles.hasRole(Role.MANAGER, ALICE));

        // revoking again is a no-op
        roles.revokeRole(ADMIN, Role.MANAGER, ALICE);
    }

    @Test
    void onlyAdminsGrant() {
        roles.grantRole(ADMIN, Role.MANAGER, ALICE);

        AuthorizationException ex = assertThrows(AuthorizationException.class,
                () -> roles.grantRole(ALICE, Role.MANAGER, BOB));
        assertEquals(Role.ADMIN, ex.role());
        assertFalse(roles.hasRole(Role.MANAGER, BOB));

        assertThrows(AuthorizationException.class, () -> roles.revokeRole(ALICE, Role.MANAGER, ALICE));
    }

    @Test
    void grantedAdminMayGrant() {
        roles.grantRole(ADMIN, Role.ADMIN, ALICE);
        roles.grantRole(ALICE, Role.APPROVED_POOL_OWNER, BOB);
        assertTrue(roles.hasRole(Role.APPROVED_POOL_OWNER, BOB));
    }

    @Test
    void checkRoleThrowsForMissingRole() {
        assertDoesNotThrow(() -> roles.checkRole(Role.MANAGER, ADMIN));
        assertThrows(AuthorizationException.class, () -> roles.checkRole(Role.MANAGER, BOB));
        assertThrows(AuthorizationException.class, () -> roles.checkRole(Role.MANAGER, null));
    }

    @Test
    void zeroAdminIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new RoleTable(Address.ZERO));
    }
}
