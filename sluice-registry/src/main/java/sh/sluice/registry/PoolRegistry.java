// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sluice.registry;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
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
import sh.sluice.core.error.AuthorizationException;
import sh.sluice.core.error.ConflictException;
import sh.sluice.core.error.ExternalMismatchException;
import sh.sluice.core.error.NotFoundException;
import sh.sluice.core.error.SluiceException;
import sh.sluice.core.error.ValidationException;
import sh.sluice.core.event.PoolAdded;
import sh.sluice.core.event.PoolApproved;
import sh.sluice.core.event.PoolRemoved;
import sh.sluice.core.event.PoolUpdated;
import sh.sluice.core.model.PoolInput;
import sh.sluice.core.model.PoolRecord;
import sh.sluice.core.model.Role;
import sh.sluice.core.model.SwapParameters;
import sh.sluice.core.model.TokenBalances;
import sh.sluice.core.types.Address;
import sh.sluice.registry.access.AccessControl;
import sh.sluice.registry.discovery.SwapStorageVariant;
import sh.sluice.registry.discovery.TokenProbe;
import sh.sluice.registry.index.PairIndex;
import sh.sluice.registry.index.PairKey;
import sh.sluice.registry.internal.EventDispatcher;
import sh.sluice.registry.internal.WriteGuard;
import sh.sluice.registry.spi.DepositWrapper;
import sh.sluice.registry.spi.PoolConnector;
import sh.sluice.registry.spi.SwapEngine;

/**
 * Registry of liquidity pools with a pair-eligibility index for routing.
 *
 * <p>{@link #addPool} discovers a pool's tokens from its engine, indexes every token
 * pair the pool can exchange, and, for pools fronted by a deposit wrapper, indexes the
 * pairs that only the wrapper can route. {@link #getEligiblePools} then answers "which
 * venues swap A for B" with a single map lookup.
 *
 * <pre>{@code
 * PoolRegistry registry = new PoolRegistry(connector, roles);
 * registry.addPool(manager, PoolInput.builder(usdPool, "USD").assetClass(AssetClass.USD).build());
 * List<Address> venues = registry.getEligiblePools(dai, usdc);
 * }</pre>
 *
 * <p>Records are never deleted. Positions are stable and {@link #getRecordAt} keeps
 * returning removed records. Whether a removed pool stays reachable by address and name
 * is set by {@link RegistryConfig#removalPolicy()}.
 *
 * <p>Thread-safe. Writes are serialised and non-reentrant; a collaborator that calls
 * back into a write while a registration is in progress gets an
 * {@link IllegalStateException}. Live accessors check registration under the read lock
 * and query the engine after releasing it.
 */
public final class PoolRegistry {

    /** Longest pool name, in UTF-8 bytes. */
    public static final int MAX_NAME_BYTES = 32;

    private static final Logger log = LoggerFactory.getLogger(PoolRegistry.class);

    private final PoolConnector connector;
    private final AccessControl access;
    private final RegistryConfig config;
    private final WriteGuard guard = new WriteGuard("pool registry");
    private final EventDispatcher events = new EventDispatcher();

    private final List<PoolRecord> records = new ArrayList<>();
    private final Map<Address, Integer> addressToIndex = new HashMap<>();
    private final Map<String, Integer> nameToIndex = new HashMap<>();
    private final PairIndex pairs;

    public PoolRegistry(final PoolConnector connector, final AccessControl access) {
        this(connector, access, RegistryConfig.defaults());
    }

    public PoolRegistry(final PoolConnector connector, final AccessControl access, final RegistryConfig config) {
        this.connector = Objects.requireNonNull(connector, "connector");
        this.access = Objects.requireNonNull(access, "access");
        this.config = Objects.requireNonNull(config, "config");
        this.pairs = new PairIndex(config.pairKeyStrategy());
    }

    public RegistryConfig config() {
        return config;
    }

    public void addListener(final RegistryEventListener listener) {
        events.addListener(listener);
    }

    public void removeListener(final RegistryEventListener listener) {
        events.removeListener(listener);
    }

    // ═══════════════════════════════════════════════════════════════════
    // Registration
    // ═══════════════════════════════════════════════════════════════════

    /**
     * Registers a pool, discovering its tokens, LP token and wrapper expansion.
     *
     * <p>Nothing is written unless every step succeeds.
     *
     * @param caller account performing the registration; managers may add any pool,
     *               community managers only unapproved ones
     * @param input  administrator-supplied fields
     * @return the zero-based index assigned to the pool
     * @throws AuthorizationException     if the caller may not add this pool
     * @throws ValidationException        for a zero pool address, a malformed name or a zero token
     * @throws ConflictException          if the address or name is already indexed
     * @throws NotFoundException          with {@code BASE_POOL_NOT_FOUND} if the wrapper's base pool is not indexed
     * @throws ExternalMismatchException  with {@code WRAPPER_MISMATCH} if the wrapper fronts another pool
     * @throws sh.sluice.core.error.ExternalUnavailableException if the engine reports no parameters
     */
    public int addPool(final Address caller, final PoolInput input) {
        Objects.requireNonNull(input, "input");
        checkCanAdd(caller, input);
        if (input.poolAddress().isZero()) {
            throw new ValidationException(ValidationException.Reason.INVALID_POOL_ADDRESS, "poolAddress == 0");
        }
        validateName(input.name());

        final PoolAdded added;
        try {
            added = guard.write(() -> register(input));
        } catch (SluiceException e) {
            DebugLogger.logWrite(LogFormatter.formatPoolRejected(input.poolAddress(), e.getMessage()));
            throw e;
        }

        log.debug("Added pool {} ({}) at index {}", input.poolAddress(), input.name(), added.index());
        DebugLogger.logWrite(LogFormatter.formatPoolAdded(added.poolAddress(), added.index(),
                added.record().tokens().size(), added.record().underlyingTokens().size()));
        events.publish(added);
        return added.index();
    }

    private void checkCanAdd(final Address caller, final PoolInput input) {
        if (access.hasRole(Role.MANAGER, caller)) {
            return;
        }
        if (access.hasRole(Role.COMMUNITY_MANAGER, caller)) {
            if (input.approved()) {
                throw new AuthorizationException(Role.MANAGER, caller,
                        "community managers may only add unapproved pools");
            }
            return;
        }
        throw new AuthorizationException(Role.COMMUNITY_MANAGER, caller);
    }

    // Runs under the write lock.
    private PoolAdded register(final PoolInput input) {
        final Address pool = input.poolAddress();
        if (addressToIndex.containsKey(pool)) {
            throw new ConflictException(ConflictException.Reason.ALREADY_REGISTERED, pool + " is already registered");
        }
        if (nameToIndex.containsKey(input.name())) {
            throw new ConflictException(ConflictException.Reason.DUPLICATE_NAME,
                    "pool name " + input.name() + " already exists");
        }

        final Address target = input.effectiveTarget();
        final SwapEngine engine = connector.swapEngine(target);
        final PairIndex.Staging staging = pairs.stage();

        final List<Address> tokens = TokenProbe.of("token", target, engine::tokenAt, config.maxTokens()).toList();
        for (int i = 0; i < tokens.size(); i++) {
            for (int j = 0; j < i; j++) {
                staging.add(tokens.get(j), tokens.get(i), pool);
            }
        }

        final SwapParameters parameters = SwapStorageVariant.resolve(engine, target);

        final Address wrapperAddress = input.effectiveDepositWrapper();
        Address basePool = Address.ZERO;
        List<Address> underlying = List.of();
        if (!wrapperAddress.isZero()) {
            final DepositWrapper wrapper = connector.depositWrapper(wrapperAddress);
            basePool = wrapper.baseSwap();
            if (Address.isNullOrZero(basePool) || !addressToIndex.containsKey(basePool)) {
                throw new NotFoundException(NotFoundException.Reason.BASE_POOL_NOT_FOUND,
                        "base pool " + basePool + " of " + pool + " is not registered");
            }
            underlying = TokenProbe.of("underlying token", wrapperAddress, wrapper::tokenAt, config.maxTokens()).toList();
            stageWrapperPairs(staging, tokens, underlying, wrapperAddress);

            final Address parent = wrapper.metaSwap();
            if (!pool.equals(parent)) {
                throw new ExternalMismatchException(ExternalMismatchException.Reason.WRAPPER_MISMATCH,
                        "wrapper " + wrapperAddress + " fronts " + parent + ", not " + pool);
            }
        }

        final PoolRecord record = new PoolRecord(pool, parameters.lpToken(), input.assetClass(), input.name(),
                target, tokens, underlying, basePool, wrapperAddress, input.externalId(),
                input.approved(), input.removed());

        final int index = records.size();
        records.add(record);
        addressToIndex.put(pool, index);
        nameToIndex.put(record.name(), index);
        staging.commit();
        DebugLogger.logWrite(LogFormatter.formatPairsIndexed(pool, staging.size()));
        return new PoolAdded(pool, index, record);
    }

    /**
     * The last top-level token is the base pool's LP token. Underlying tokens from that
     * position on come from unwrapping it, and only the wrapper can swap them against the
     * remaining top-level tokens.
     */
    private static void stageWrapperPairs(final PairIndex.Staging staging, final List<Address> tokens,
                                          final List<Address> underlying, final Address wrapper) {
        final int lpPosition = tokens.size() - 1;
        for (int i = Math.max(lpPosition, 0); i < underlying.size(); i++) {
            for (int j = 0; j < lpPosition; j++) {
                staging.add(underlying.get(i), tokens.get(j), wrapper);
            }
        }
    }

    // ═══════════════════════════════════════════════════════════════════
    // Maintenance
    // ═══════════════════════════════════════════════════════════════════

    /**
     * Marks a pool as approved. The engine's owner must hold {@link Role#APPROVED_POOL_OWNER}.
     *
     * @throws AuthorizationException    if the caller is not a manager
     * @throws NotFoundException         if the pool is not indexed
     * @throws ExternalMismatchException with {@code POOL_OWNER_NOT_APPROVED} if the engine's owner is not approved
     */
    public void approvePool(final Address caller, final Address poolAddress) {
        access.checkRole(Role.MANAGER, caller);
        final PoolApproved approved = guard.write(() -> {
            final int index = indexOf(poolAddress);
            final PoolRecord record = records.get(index);
            final Address owner = connector.swapEngine(record.targetAddress()).owner();
            if (!access.hasRole(Role.APPROVED_POOL_OWNER, owner)) {
                throw new ExternalMismatchException(ExternalMismatchException.Reason.POOL_OWNER_NOT_APPROVED,
                        "owner " + owner + " of " + poolAddress + " is not an approved pool owner");
            }
            records.set(index, record.withApproved(true));
            return new PoolApproved(poolAddress, index);
        });
        log.debug("Approved pool {}", poolAddress);
        DebugLogger.logWrite(LogFormatter.formatPoolWrite("approve", poolAddress, approved.index()));
        events.publish(approved);
    }

    /**
     * Overwrites the record registered under {@code record.poolAddress()}.
     *
     * <p>The pair index is not touched, so changing the token lists here does not change
     * routing. A changed name is re-indexed. The stored {@code removed} flag is kept;
     * soft deletion only happens through {@link #removePool}.
     *
     * @throws AuthorizationException if the caller is not a manager
     * @throws NotFoundException      if the pool is not indexed
     * @throws ConflictException      with {@code DUPLICATE_NAME} if the new name belongs to another pool
     */
    public void updatePool(final Address caller, final PoolRecord record) {
        access.checkRole(Role.MANAGER, caller);
        Objects.requireNonNull(record, "record");
        validateName(record.name());
        final PoolUpdated updated = guard.write(() -> {
            final int index = indexOf(record.poolAddress());
            final PoolRecord previous = records.get(index);
            if (!previous.name().equals(record.name())) {
                final Integer holder = nameToIndex.get(record.name());
                if (holder != null && holder != index) {
                    throw new ConflictException(ConflictException.Reason.DUPLICATE_NAME,
                            "pool name " + record.name() + " already exists");
                }
                nameToIndex.remove(previous.name(), index);
                nameToIndex.put(record.name(), index);
            }
            final PoolRecord stored = record.withRemoved(previous.removed());
            records.set(index, stored);
            return new PoolUpdated(stored.poolAddress(), index, stored);
        });
        log.debug("Updated pool {}", record.poolAddress());
        DebugLogger.logWrite(LogFormatter.formatPoolWrite("update", record.poolAddress(), updated.index()));
        events.publish(updated);
    }

    /**
     * Soft-deletes a pool. The record keeps its position; see {@link RemovalPolicy} for
     * the effect on address and name lookups.
     *
     * @throws AuthorizationException if the caller is not a manager
     * @throws NotFoundException      if the pool is not indexed
     */
    public void removePool(final Address caller, final Address poolAddress) {
        access.checkRole(Role.MANAGER, caller);
        final PoolRemoved removed = guard.write(() -> {
            final int index = indexOf(poolAddress);
            final PoolRecord record = records.get(index).withRemoved(true);
            records.set(index, record);
            if (config.removalPolicy() == RemovalPolicy.RELEASE_INDEX) {
                addressToIndex.remove(poolAddress);
                nameToIndex.remove(record.name(), index);
            }
            return new PoolRemoved(poolAddress, index);
        });
        log.debug("Removed pool {} ({})", poolAddress, config.removalPolicy());
        DebugLogger.logWrite(LogFormatter.formatPoolWrite("remove", poolAddress, removed.index()));
        events.publish(removed);
    }

    // ═══════════════════════════════════════════════════════════════════
    // Stored reads
    // ═══════════════════════════════════════════════════════════════════

    /**
     * @throws NotFoundException with {@code POOL_NOT_FOUND} if the address is not indexed
     */
    public PoolRecord getRecord(final Address poolAddress) {
        return guard.read(() -> records.get(indexOf(poolAddress)));
    }

    /**
     * @throws NotFoundException with {@code OUT_OF_BOUNDS} if {@code index} is outside the record sequence
     */
    public PoolRecord getRecordAt(final int index) {
        return guard.read(() -> {
            if (index < 0 || index >= records.size()) {
                throw new NotFoundException(NotFoundException.Reason.OUT_OF_BOUNDS,
                        "index " + index + " out of bounds for " + records.size() + " pools");
            }
            return records.get(index);
        });
    }

    /**
     * @throws NotFoundException with {@code POOL_NOT_FOUND} if no indexed pool has this name
     */
    public PoolRecord getRecordByName(final String name) {
        return guard.read(() -> {
            final Integer index = name == null ? null : nameToIndex.get(name);
            if (index == null) {
                throw new NotFoundException(NotFoundException.Reason.POOL_NOT_FOUND, "no pool named " + name);
            }
            return records.get(index);
        });
    }

    /** Every record in index order, removed ones included. */
    public List<PoolRecord> getRecords() {
        return guard.read(() -> List.copyOf(records));
    }

    /** Number of records ever added. */
    public int size() {
        return guard.read(records::size);
    }

    public boolean isRegistered(final Address poolAddress) {
        return guard.read(() -> poolAddress != null && addressToIndex.containsKey(poolAddress));
    }

    public List<Address> getTokens(final Address poolAddress) {
        return getRecord(poolAddress).tokens();
    }

    public List<Address> getUnderlyingTokens(final Address poolAddress) {
        return getRecord(poolAddress).underlyingTokens();
    }

    /**
     * Venues through which {@code from} can be swapped for {@code to}. Symmetric in its
     * arguments.
     *
     * @return venue addresses in indexing order; empty if none
     * @throws ValidationException with {@code INVALID_PAIR} if {@code from} is zero or equals {@code to}
     */
    public List<Address> getEligiblePools(final Address from, final Address to) {
        if (Address.isNullOrZero(from) || to == null || from.equals(to)) {
            throw new ValidationException(ValidationException.Reason.INVALID_PAIR,
                    "invalid pair (" + from + ", " + to + ")");
        }
        return guard.read(() -> List.copyOf(pairs.venues(from, to)));
    }

    /**
     * Copies records, indices and pair index under one read lock.
     */
    State state() {
        return guard.read(() -> new State(config, List.copyOf(records), new LinkedHashMap<>(addressToIndex),
                new LinkedHashMap<>(nameToIndex), pairs.entries()));
    }

    /** Mutually consistent copy of the registry's stored data. */
    record State(
            RegistryConfig config,
            List<PoolRecord> records,
            Map<Address, Integer> addressIndex,
            Map<String, Integer> nameIndex,
            Map<PairKey, List<Address>> pairs) {
    }

    /** Copy of the address index, keyed by pool address. */
    public Map<Address, Integer> addressIndex() {
        return guard.read(() -> new LinkedHashMap<>(addressToIndex));
    }

    /** Copy of the name index. */
    public Map<String, Integer> nameIndex() {
        return guard.read(() -> new LinkedHashMap<>(nameToIndex));
    }

    /** Copy of the pair index. */
    public Map<PairKey, List<Address>> pairIndex() {
        return guard.read(pairs::entries);
    }

    // ═══════════════════════════════════════════════════════════════════
    // Live reads, proxied to the engine
    // ═══════════════════════════════════════════════════════════════════

    public BigInteger getVirtualPrice(final Address poolAddress) {
        return engineOf(poolAddress).virtualPrice();
    }

    public BigInteger getAmplificationFactor(final Address poolAddress) {
        return engineOf(poolAddress).a();
    }

    public boolean getPaused(final Address poolAddress) {
        return engineOf(poolAddress).paused();
    }

    public BigInteger getSwapFee(final Address poolAddress) {
        return getAggregateParameters(poolAddress).swapFee();
    }

    public BigInteger getAdminFee(final Address poolAddress) {
        return getAggregateParameters(poolAddress).adminFee();
    }

    /**
     * @throws sh.sluice.core.error.ExternalUnavailableException if no storage variant answers
     */
    public SwapParameters getAggregateParameters(final Address poolAddress) {
        final PoolRecord record = getRecord(poolAddress);
        return SwapStorageVariant.resolve(connector.swapEngine(record.targetAddress()), record.targetAddress());
    }

    /**
     * Stored tokens with one live balance query per token, in stored order.
     */
    public TokenBalances getBalances(final Address poolAddress) {
        final PoolRecord record = getRecord(poolAddress);
        final SwapEngine engine = connector.swapEngine(record.targetAddress());
        final List<BigInteger> balances = new ArrayList<>(record.tokens().size());
        for (int i = 0; i < record.tokens().size(); i++) {
            balances.add(engine.tokenBalance(i));
        }
        return new TokenBalances(record.tokens(), balances);
    }

    // ═══════════════════════════════════════════════════════════════════
    // Helpers
    // ═══════════════════════════════════════════════════════════════════

    private SwapEngine engineOf(final Address poolAddress) {
        return connector.swapEngine(getRecord(poolAddress).targetAddress());
    }

    private int indexOf(final Address poolAddress) {
        final Integer index = poolAddress == null ? null : addressToIndex.get(poolAddress);
        if (index == null) {
            throw new NotFoundException(NotFoundException.Reason.POOL_NOT_FOUND,
                    "no matching pool found for " + poolAddress);
        }
        return index;
    }

    private static void validateName(final String name) {
        if (name == null || name.isBlank()) {
            throw new ValidationException(ValidationException.Reason.INVALID_NAME, "pool name cannot be empty");
        }
        if (name.getBytes(StandardCharsets.UTF_8).length > MAX_NAME_BYTES) {
            throw new ValidationException(ValidationException.Reason.INVALID_NAME,
                    "pool name longer than " + MAX_NAME_BYTES + " bytes: " + name);
        }
    }
}
