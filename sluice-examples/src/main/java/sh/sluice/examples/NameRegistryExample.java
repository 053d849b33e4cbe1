// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sluice.examples;

import sh.sluice.core.error.NotFoundException;
import sh.sluice.core.model.Role;
import sh.sluice.core.types.Address;
import sh.sluice.registry.NameRegistry;
import sh.sluice.registry.access.RoleTable;

/**
 * Tracks two versions of a component by name and resolves them both ways.
 *
 * <p>Usage:
 * <pre>
 * mvn -pl sluice-examples exec:java -Dexec.mainClass=sh.sluice.examples.NameRegistryExample
 * </pre>
 */
public final class NameRegistryExample {

    private NameRegistryExample() {
    }

    public static void main(String[] args) {
        final Address admin = new Address("0x" + "a".repeat(40));
        final Address registryV1 = new Address("0x" + "e1".repeat(20));
        final Address registryV2 = new Address("0x" + "e2".repeat(20));
        final Address bridge = new Address("0x" + "f1".repeat(20));

        final RoleTable roles = new RoleTable(admin);
        final NameRegistry names = new NameRegistry(roles);

        names.addRegistry(admin, "PoolRegistry", registryV1);
        names.addRegistry(admin, "PoolRegistry", registryV2);
        names.addRegistry(admin, "Bridge", bridge);

        System.out.println("latest PoolRegistry : " + names.resolveNameToLatest("PoolRegistry"));
        System.out.println("PoolRegistry v0     : " + names.resolveNameAndVersion("PoolRegistry", 0));
        System.out.println("all PoolRegistry    : " + names.resolveNameToAllVersions("PoolRegistry"));
        System.out.println("v1 lookup           : " + names.resolveIdentifierToRegistryData(registryV1));
        System.out.println("v2 lookup           : " + names.resolveIdentifierToRegistryData(registryV2));

        try {
            names.resolveNameToLatest("Oracle");
        } catch (NotFoundException e) {
            System.out.println("Oracle              : " + e.getMessage());
        }
    }
}
