// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sluice.examples;

import java.math.BigInteger;
import java.util.List;

import sh.sluice.core.SluiceDebug;
import sh.sluice.core.error.SluiceException;
import sh.sluice.core.model.AssetClass;
import sh.sluice.core.model.PoolInput;
import sh.sluice.core.model.Role;
import sh.sluice.core.types.Address;
import sh.sluice.registry.NameRegistry;
import sh.sluice.registry.PoolRegistry;
import sh.sluice.registry.RegistrySnapshot;
import sh.sluice.registry.access.RoleTable;
import sh.sluice.registry.memory.InMemoryDepositWrapper;
import sh.sluice.registry.memory.InMemoryPoolConnector;
import sh.sluice.registry.memory.InMemorySwapEngine;

/**
 * Registers a base pool and a wrapped pool and prints the routes the registry finds.
 *
 * <p>Usage:
 * <pre>
 * mvn -pl sluice-examples -am install -DskipTests
 * mvn -pl sluice-examples exec:java \
 *   -Dexec.mainClass=sh.sluice.examples.PoolRegistryExample \
 *   -Dsluice.examples.debug=true
 * </pre>
 */
public final class PoolRegistryExample {

    private static final Address ADMIN = new Address("0x" + "a".repeat(40));
    private static final Address MANAGER = new Address("0x" + "b".repeat(40));
    private static final Address OWNER = new Address("0x" + "c".repeat(40));

    private static final Address DAI = new Address("0x6b175474e89094c44da98b954eedeac495271d0f");
    private static final Address USDC = new Address("0xa0b86991c6218b36c1d19d4a2e9eb0ce3606eb48");
    private static final Address USDT = new Address("0xdac17f958d2ee523a2206206994597c13d831ec7");
    private static final Address SUSD = new Address("0x57ab1ec28d129707052df4df418d58a2d46d5f51");

    private static final Address BASE_POOL = new Address("0x" + "1".repeat(40));
    private static final Address BASE_LP = new Address("0x" + "2".repeat(40));
    private static final Address META_POOL = new Address("0x" + "3".repeat(40));
    private static final Address META_LP = new Address("0x" + "4".repeat(40));
    private static final Address META_DEPOSIT = new Address("0x" + "5".repeat(40));

    private PoolRegistryExample() {
    }

    public static void main(String[] args) {
        SluiceDebug.setEnabled(Boolean.getBoolean("sluice.examples.debug"));

        final RoleTable roles = new RoleTable(ADMIN);
        roles.grantRole(ADMIN, Role.MANAGER, MANAGER);
        roles.grantRole(ADMIN, Role.APPROVED_POOL_OWNER, OWNER);

        final InMemorySwapEngine baseEngine = InMemorySwapEngine.builder(OWNER)
                .tokens(DAI, USDC, USDT)
                .lpToken(BASE_LP)
                .a(200)
                .swapFee(4_000_000L)
                .build();
        baseEngine.setBalance(0, new BigInteger("1250000000000000000000000"));
        baseEngine.setBalance(1, BigInteger.valueOf(1_310_000_000_000L));
        baseEngine.setBalance(2, BigInteger.valueOf(980_000_000_000L));

        final InMemoryPoolConnector connector = new InMemoryPoolConnector()
                .deploy(BASE_POOL, baseEngine)
                .deploy(META_POOL, InMemorySwapEngine.builder(OWNER).tokens(SUSD, BASE_LP).lpToken(META_LP).build())
                .deploy(META_DEPOSIT, new InMemoryDepositWrapper(META_POOL, BASE_POOL, List.of(SUSD, DAI, USDC, USDT)));

        final PoolRegistry pools = new PoolRegistry(connector, roles);
        pools.addListener(event -> System.out.println("event: " + event));

        pools.addPool(MANAGER, PoolInput.builder(BASE_POOL, "USD").assetClass(AssetClass.USD).build());
        pools.addPool(MANAGER, PoolInput.builder(META_POOL, "sUSD")
                .assetClass(AssetClass.USD)
                .depositWrapperAddress(META_DEPOSIT)
                .build());
        pools.approvePool(MANAGER, BASE_POOL);

        System.out.println();
        printRoute(pools, "DAI", DAI, "USDC", USDC);
        printRoute(pools, "sUSD", SUSD, "USDT", USDT);
        printRoute(pools, "sUSD", SUSD, "USD-LP", BASE_LP);
        printRoute(pools, "DAI", DAI, "USD-LP", BASE_LP);

        System.out.println();
        System.out.println("USD balances: " + pools.getBalances(BASE_POOL));
        System.out.println("USD swap fee: " + pools.getSwapFee(BASE_POOL));

        try {
            pools.getEligiblePools(DAI, DAI);
        } catch (SluiceException e) {
            System.out.println("Rejected as expected: " + e.getMessage());
        }

        System.out.println();
        System.out.println(RegistrySnapshot.of(pools, new NameRegistry(roles)).toJson());
    }

    private static void printRoute(PoolRegistry pools, String fromLabel, Address from, String toLabel, Address to) {
        final List<Address> venues = pools.getEligiblePools(from, to);
        System.out.println(fromLabel + " -> " + toLabel + ": " + (venues.isEmpty() ? "no route" : venues));
    }
}
