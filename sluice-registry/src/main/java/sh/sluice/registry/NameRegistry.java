// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sluice.registry;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.sluice.core.DebugLogger;
import sh.sluice.core.LogFormatter;
import sh.sluice.core.error.ConflictException;
import sh.sluice.core.error.NotFoundException;
import sh.sluice.core.error.ValidationException;
import sh.sluice.core.event.RegistryAdded;
import sh.sluice.core.model.RegistryData;
import sh.sluice.core.model.Role;
import sh.sluice.core.types.Address;
import sh.sluice.registry.access.AccessControl;
import sh.sluice.registry.internal.EventDispatcher;
import sh.sluice.registry.internal.WriteGuard;

/**
 * Append-only registry of named infrastructure components.
 *
 * <p>Each name owns an ordered list of identifiers; the last one is the name's latest
 * version. An identifier can be registered once, under one name, for the lifetime of
 * the registry. There is no update or delete: history is permanent.
 *
 * <pre>{@code
 * NameRegistry names = new NameRegistry(roles);
 * names.addRegistry(manager, "PoolRegistry", registryV1);
 * names.addRegistry(manager, "PoolRegistry", registryV2);
 *
 * names.resolveNameToLatest("PoolRegistry");           // registryV2
 * names.resolveIdentifierToRegistryData(registryV1);   // ("PoolRegistry", 0, false)
 * }</pre>
 *
 * <p>Thread-safe. Writes are serialised and non-reentrant.
 */
public final class NameRegistry {

    private static final Logger log = LoggerFactory.getLogger(NameRegistry.class);

    private record ReverseEntry(String name, int version) {}

    private final AccessControl access;
    private final WriteGuard guard = new WriteGuard("name registry");
    private final EventDispatcher events = new EventDispatcher();

    private final Map<String, List<Address>> versions = new LinkedHashMap<>();
    private final Map<Address, ReverseEntry> reverse = new HashMap<>();

    public NameRegistry(final AccessControl access) {
        this.access = Objects.requireNonNull(access, "access");
    }

    public void addListener(final RegistryEventListener listener) {
        events.addListener(listener);
    }

    public void removeListener(final RegistryEventListener listener) {
        events.removeListener(listener);
    }

    /**
     * Appends {@code identifier} as the next version of {@code name}.
     *
     * @param caller     account performing the registration; needs {@link Role#MANAGER}
     * @param name       component name
     * @param identifier component identifier
     * @return the zero-based version assigned
     * @throws sh.sluice.core.error.AuthorizationException if the caller is not a manager
     * @throws ValidationException                         for an empty name or zero identifier
     * @throws ConflictException                           if the identifier was ever registered
     */
    public int addRegistry(final Address caller, final String name, final Address identifier) {
        access.checkRole(Role.MANAGER, caller);
        if (name == null || name.isBlank()) {
            throw new ValidationException(ValidationException.Reason.INVALID_NAME, "name cannot be empty");
        }
        if (Address.isNullOrZero(identifier)) {
            throw new ValidationException(ValidationException.Reason.INVALID_IDENTIFIER, "identifier cannot be empty");
        }

        final RegistryAdded added = guard.write(() -> {
            final ReverseEntry existing = reverse.get(identifier);
            if (existing != null) {
                throw new ConflictException(ConflictException.Reason.DUPLICATE_IDENTIFIER,
                        identifier + " is already registered as " + existing.name() + " v" + existing.version());
            }
            final List<Address> list = versions.computeIfAbsent(name, n -> new ArrayList<>());
            final int version = list.size();
            list.add(identifier);
            reverse.put(identifier, new ReverseEntry(name, version));
            return new RegistryAdded(name, identifier, version);
        });

        log.debug("Registered {} as {} v{}", identifier, name, added.version());
        DebugLogger.logWrite(LogFormatter.formatRegistryAdded(name, identifier, added.version()));
        events.publish(added);
        return added.version();
    }

    /**
     * @throws NotFoundException with {@code NAME_NOT_FOUND} if the name has no versions
     */
    public Address resolveNameToLatest(final String name) {
        return guard.read(() -> {
            final List<Address> list = versionsOf(name);
            return list.get(list.size() - 1);
        });
    }

    /**
     * @throws NotFoundException with {@code VERSION_NOT_FOUND} if {@code version} is not below the
     *                           name's version count (an unknown name has none)
     */
    public Address resolveNameAndVersion(final String name, final int version) {
        return guard.read(() -> {
            final List<Address> list = versions.getOrDefault(name, List.of());
            if (version < 0 || version >= list.size()) {
                throw new NotFoundException(NotFoundException.Reason.VERSION_NOT_FOUND,
                        "no version " + version + " for name " + name);
            }
            return list.get(version);
        });
    }

    /**
     * @return every version of {@code name}, oldest first
     * @throws NotFoundException with {@code NAME_NOT_FOUND} if the name has no versions
     */
    public List<Address> resolveNameToAllVersions(final String name) {
        return guard.read(() -> List.copyOf(versionsOf(name)));
    }

    /**
     * Reverse lookup of an identifier.
     *
     * @throws NotFoundException with {@code IDENTIFIER_NOT_FOUND} if never registered
     */
    public RegistryData resolveIdentifierToRegistryData(final Address identifier) {
        return guard.read(() -> {
            final ReverseEntry entry = identifier == null ? null : reverse.get(identifier);
            if (entry == null) {
                throw new NotFoundException(NotFoundException.Reason.IDENTIFIER_NOT_FOUND,
                        "no match found for " + identifier);
            }
            final int latest = versions.get(entry.name()).size() - 1;
            return new RegistryData(entry.name(), entry.version(), entry.version() == latest);
        });
    }

    public boolean contains(final Address identifier) {
        return guard.read(() -> identifier != null && reverse.containsKey(identifier));
    }

    /** Registered names in first-registration order. */
    public List<String> names() {
        return guard.read(() -> List.copyOf(versions.keySet()));
    }

    /** Copy of every name's version list, in first-registration order. */
    public Map<String, List<Address>> versions() {
        return guard.read(() -> {
            final Map<String, List<Address>> copy = new LinkedHashMap<>();
            versions.forEach((name, list) -> copy.put(name, List.copyOf(list)));
            return copy;
        });
    }

    private List<Address> versionsOf(final String name) {
        final List<Address> list = name == null ? null : versions.get(name);
        if (list == null || list.isEmpty()) {
            throw new NotFoundException(NotFoundException.Reason.NAME_NOT_FOUND, "no match found for name " + name);
        }
        return list;
    }
}
