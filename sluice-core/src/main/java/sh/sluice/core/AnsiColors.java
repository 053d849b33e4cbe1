// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sluice.core;

/**
 * ANSI palette for terminal output with automatic TTY detection.
 * <p>
 * Colors are disabled when not running in a TTY unless {@code FORCE_COLOR=true} is set,
 * in which case every constant is the empty string.
 *
 * <ul>
 * <li><b>TEAL</b> - success
 * <li><b>CORAL</b> - failure
 * <li><b>INDIGO</b> - name registry operations
 * <li><b>LAVENDER</b> - pool registry writes
 * <li><b>AMBER</b> - collaborator probes
 * <li><b>SLATE</b> - metadata
 * </ul>
 *
 * @since 0.1.0
 * @see LogFormatter
 */
public final class AnsiColors {

    static final boolean IS_TTY = System.console() != null
            || "true".equals(System.getenv("FORCE_COLOR"));

    public static final String RESET = ansi("0");
    public static final String TEAL = ansi("38;5;44");
    public static final String CORAL = ansi("38;5;204");
    public static final String INDIGO = ansi("38;5;99");
    public static final String AMBER = ansi("38;5;214");
    public static final String SLATE = ansi("38;5;247");
    public static final String LAVENDER = ansi("38;5;183");

    private AnsiColors() {
    }

    private static String ansi(final String code) {
        return IS_TTY ? "\u001B[" + code + "m" : "";
    }
}
