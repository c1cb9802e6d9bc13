// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.torex.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Centralized debug logger for exchange traces.
 */
public final class DebugLogger {

    private static final Logger LOG = LoggerFactory.getLogger("sh.torex.debug");

    private DebugLogger() {
    }

    /**
     * Logs a preformatted line when {@code channel} is on.
     *
     * @param channel trace channel
     * @param message line, optionally a {@link String#formatted} template
     * @param args    template arguments
     */
    public static void log(final TorexDebug.Channel channel, final String message, final Object... args) {
        if (!TorexDebug.isEnabled(channel)) {
            return;
        }
        logDirect(message, args);
    }

    private static void logDirect(final String message, final Object... args) {
        final String formatted = (args == null || args.length == 0) ? message : message.formatted(args);
        if (AnsiColors.IS_TTY) {
            System.out.println(formatted);
        } else {
            LOG.info(formatted);
        }
    }
}
