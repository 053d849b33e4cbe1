// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sluice.core.model;

/**
 * Peg category of a pool's assets.
 *
 * @since 0.1.0
 */
public enum AssetClass {
    BTC,
    ETH,
    USD,
    OTHER
}
