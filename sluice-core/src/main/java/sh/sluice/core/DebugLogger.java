// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sluice.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Centralized debug logger for registry writes and collaborator probes.
 */
public final class DebugLogger {

    private static final Logger LOG = LoggerFactory.getLogger("sh.sluice.debug");

    private DebugLogger() {
    }

    public static void logWrite(final String message, final Object... args) {
        if (!SluiceDebug.isWriteLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    public static void logProbe(final String message, final Object... args) {
        if (!SluiceDebug.isProbeLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    /**
     * Colored lines go straight to stdout on a TTY; everything else goes through SLF4J.
     */
    private static void logDirect(final String message, final Object... args) {
        final String formatted = (args == null || args.length == 0) ? message : message.formatted(args);
        if (AnsiColors.IS_TTY) {
            System.out.println(formatted);
        } else {
            LOG.info(formatted);
        }
    }
}
