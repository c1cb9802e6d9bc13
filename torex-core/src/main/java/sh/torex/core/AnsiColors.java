// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.torex.core;

/**
 * ANSI palette for debug traces, disabled automatically off a TTY unless
 * {@code FORCE_COLOR=true} is set.
 *
 * <ul>
 * <li><b>TEAL</b> - completed movements</li>
 * <li><b>CORAL</b> - contained controller errors</li>
 * <li><b>INDIGO</b> - flow updates</li>
 * <li><b>AMBER</b> - quotes</li>
 * <li><b>SLATE</b> - secondary fields</li>
 * </ul>
 *
 * @see LogFormatter
 */
public final class AnsiColors {

    static final boolean IS_TTY = System.console() != null
            || "true".equals(System.getenv("FORCE_COLOR"));

    /** ANSI reset code - clears all formatting */
    public static final String RESET = ansi("0");

    public static final String TEAL = ansi("38;5;44");

    public static final String CORAL = ansi("38;5;204");

    public static final String INDIGO = ansi("38;5;99");

    public static final String AMBER = ansi("38;5;214");

    public static final String SLATE = ansi("38;5;247");

    private AnsiColors() {
    }

    private static String ansi(final String code) {
        return IS_TTY ? "\u001B[" + code + "m" : "";
    }

    /**
     * Formats a key-value pair with colored key.
     */
    public static String kv(final String key, final Object value) {
        return SLATE + key + "=" + RESET + value;
    }
}
