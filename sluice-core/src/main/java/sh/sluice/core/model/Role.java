// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sluice.core.model;

/**
 * Capabilities checked by the registries.
 *
 * @since 0.1.0
 */
public enum Role {
    /** Grants and revokes roles; implies every other role. */
    ADMIN,
    /** Adds, approves, updates and removes any pool; registers named components. */
    MANAGER,
    /** Adds unapproved (community) pools only. */
    COMMUNITY_MANAGER,
    /** Held by the owners of engines whose pools may be approved. */
    APPROVED_POOL_OWNER
}
