// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sluice.core;

/**
 * Global toggles for verbose debug logging across Sluice modules.
 *
 * <p>Write logging covers committed registry mutations. Probe logging covers every
 * collaborator query issued during discovery, which is noisy for pools with many tokens.
 */
public final class SluiceDebug {

    private static volatile boolean writeLogging = false;
    private static volatile boolean probeLogging = false;

    private SluiceDebug() {
    }

    /** Turns write and probe logging on or off together. */
    public static void setEnabled(final boolean enabled) {
        writeLogging = enabled;
        probeLogging = enabled;
    }

    public static void setWriteLogging(final boolean enabled) {
        writeLogging = enabled;
    }

    public static boolean isWriteLoggingEnabled() {
        return writeLogging;
    }

    public static void setProbeLogging(final boolean enabled) {
        probeLogging = enabled;
    }

    public static boolean isProbeLoggingEnabled() {
        return probeLogging;
    }
}
