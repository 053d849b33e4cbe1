// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sluice.core.model;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;

import sh.sluice.core.types.Address;

/**
 * A pool's tokens paired position-by-position with their live balances.
 *
 * @param tokens   stored token sequence
 * @param balances balance of {@code tokens.get(i)} at position {@code i}
 * @since 0.1.0
 */
public record TokenBalances(List<Address> tokens, List<BigInteger> balances) {

    public TokenBalances {
        tokens = List.copyOf(Objects.requireNonNull(tokens, "tokens"));
        balances = List.copyOf(Objects.requireNonNull(balances, "balances"));
        if (tokens.size() != balances.size()) {
            throw new IllegalArgumentException(
                    "tokens and balances differ in length: " + tokens.size() + " != " + balances.size());
        }
    }
}
