// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sluice.core;

import static sh.sluice.core.AnsiColors.*;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Formatter for registry debug lines.
 *
 * <p>Every line uses a bracketed {@code [OPERATION]} tag. Identifiers are shortened to
 * {@code 0x1234...5678}; status is shown with ✓ and ✗ only.
 *
 * <pre>{@code
 * DebugLogger.logWrite(LogFormatter.formatPoolAdded(pool, 0, 3, 0));
 * // ✓ [POOL-ADD] pool=0x1234...5678 index=0 tokens=3 underlying=0
 *
 * DebugLogger.logProbe(LogFormatter.formatProbe("token", engine, 2, token));
 * // [PROBE] kind=token target=0xabcd...ef01 index=2 result=0x9999...0000
 * }</pre>
 *
 * <p>All methods are pure and thread-safe.
 *
 * @see DebugLogger
 */
public final class LogFormatter {

    /** Characters kept at the start of a shortened identifier, including "0x". */
    private static final int PREFIX_LENGTH = 6;

    /** Characters kept at the end of a shortened identifier. */
    private static final int SUFFIX_LENGTH = 4;

    private static final int SHORTEN_THRESHOLD = PREFIX_LENGTH + SUFFIX_LENGTH;

    private LogFormatter() {
    }

    /**
     * Format: ✓ [POOL-ADD] pool=0x1234...5678 index=0 tokens=3 underlying=0
     */
    public static String formatPoolAdded(Object pool, int index, int tokens, int underlying) {
        return String.format(
                "%s✓%s %s[POOL-ADD]%s pool=%s index=%d tokens=%d underlying=%d",
                TEAL, RESET,
                LAVENDER, RESET,
                shorten(pool), index, tokens, underlying);
    }

    /**
     * Format: ✓ [POOL-UPDATE] op=approve pool=0x1234...5678 index=0
     */
    public static String formatPoolWrite(String op, Object pool, int index) {
        return String.format(
                "%s✓%s %s[POOL-UPDATE]%s op=%s pool=%s index=%d",
                TEAL, RESET,
                LAVENDER, RESET,
                op, shorten(pool), index);
    }

    /**
     * Format: ✗ [POOL-REJECT] pool=0x1234...5678 reason=message
     */
    public static String formatPoolRejected(Object pool, String reason) {
        return String.format(
                "%s✗%s %s[POOL-REJECT]%s pool=%s reason=%s%s%s",
                CORAL, RESET,
                CORAL, RESET,
                shorten(pool),
                CORAL, reason, RESET);
    }

    /**
     * Format: [PAIR-INDEX] venue=0x1234...5678 pairs=3
     */
    public static String formatPairsIndexed(Object venue, int pairs) {
        return String.format(
                "%s[PAIR-INDEX]%s venue=%s pairs=%d",
                SLATE, RESET,
                shorten(venue), pairs);
    }

    /**
     * Format: ✓ [REGISTRY-ADD] name=PoolRegistry identifier=0x1234...5678 version=1
     */
    public static String formatRegistryAdded(String name, Object identifier, int version) {
        return String.format(
                "%s✓%s %s[REGISTRY-ADD]%s name=%s identifier=%s version=%d",
                TEAL, RESET,
                INDIGO, RESET,
                name, shorten(identifier), version);
    }

    /**
     * Format: [PROBE] kind=token target=0xabcd...ef01 index=2 result=0x9999...0000
     */
    public static String formatProbe(String kind, Object target, int index, Object result) {
        return String.format(
                "%s[PROBE]%s kind=%s target=%s index=%d result=%s",
                AMBER, RESET,
                kind, shorten(target), index,
                result == null ? "none" : shorten(result));
    }

    /**
     * Format: [DISCOVERED] target=0xabcd...ef01 tokens=[0x1111...1111, 0x2222...2222]
     */
    public static String formatDiscovered(Object target, List<?> tokens) {
        return String.format(
                "%s[DISCOVERED]%s target=%s tokens=[%s]",
                AMBER, RESET,
                shorten(target),
                tokens.stream().map(LogFormatter::shorten).collect(Collectors.joining(", ")));
    }

    /**
     * Shortens an identifier to {@code 0xabcd...ef12}. Short values are returned unchanged.
     *
     * @param value the identifier, may be null
     * @return the shortened text, or "null"
     */
    public static String shorten(Object value) {
        if (value == null) {
            return "null";
        }
        String full = String.valueOf(value);
        if (full.length() <= SHORTEN_THRESHOLD) {
            return full;
        }
        return full.substring(0, PREFIX_LENGTH)
                + "..."
                + full.substring(full.length() - SUFFIX_LENGTH);
    }
}
