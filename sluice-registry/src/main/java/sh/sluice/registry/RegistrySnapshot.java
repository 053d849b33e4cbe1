// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sluice.registry;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import sh.sluice.core.model.PoolRecord;
import sh.sluice.core.model.RegistryData;
import sh.sluice.core.types.Address;

/**
 * Point-in-time export of a pool registry and a name registry, for inspection and audits.
 *
 * <p>Addresses render as lowercase hex strings; pair keys as their hash.
 *
 * @param config       configuration of the pool registry
 * @param pools        every pool record in index order, removed ones included
 * @param addressIndex pool address to record index
 * @param nameIndex    pool name to record index
 * @param pairs        pair key to venues, in key order
 * @param names        component name to its versions, in first-registration order
 * @param identifiers  component identifier to its name and version
 */
public record RegistrySnapshot(
        RegistryConfig config,
        List<PoolRecord> pools,
        Map<String, Integer> addressIndex,
        Map<String, Integer> nameIndex,
        Map<String, List<Address>> pairs,
        Map<String, List<Address>> names,
        Map<String, RegistryData> identifiers) {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    public RegistrySnapshot {
        Objects.requireNonNull(config, "config");
        pools = List.copyOf(pools);
        addressIndex = Map.copyOf(addressIndex);
        nameIndex = Map.copyOf(nameIndex);
        pairs = Map.copyOf(pairs);
        names = Map.copyOf(names);
        identifiers = Map.copyOf(identifiers);
    }

    /**
     * Captures both registries. Each registry is copied under its own read lock, so
     * records and indices within one registry always agree. The two registries are not
     * captured atomically with respect to each other.
     */
    public static RegistrySnapshot of(final PoolRegistry pools, final NameRegistry names) {
        Objects.requireNonNull(pools, "pools");
        Objects.requireNonNull(names, "names");

        final PoolRegistry.State state = pools.state();

        final Map<String, Integer> addressIndex = new TreeMap<>();
        state.addressIndex().forEach((address, index) -> addressIndex.put(address.value(), index));

        final Map<String, List<Address>> pairs = new LinkedHashMap<>();
        state.pairs().forEach((key, venues) -> pairs.put(key.value().value(), venues));

        final Map<String, List<Address>> versions = names.versions();
        final Map<String, RegistryData> identifiers = new TreeMap<>();
        versions.forEach((name, list) -> {
            for (int i = 0; i < list.size(); i++) {
                identifiers.put(list.get(i).value(), new RegistryData(name, i, i == list.size() - 1));
            }
        });

        return new RegistrySnapshot(state.config(), state.records(), addressIndex, state.nameIndex(),
                pairs, versions, identifiers);
    }

    /**
     * Renders the snapshot as indented JSON with map entries sorted by key.
     *
     * @throws IllegalStateException if serialisation fails
     */
    public String toJson() {
        try {
            return MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialise registry snapshot: " + e.getMessage(), e);
        }
    }
}
