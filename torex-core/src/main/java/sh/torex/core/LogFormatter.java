// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.torex.core;

import static sh.torex.core.AnsiColors.*;

import java.math.BigInteger;

import sh.torex.core.types.Address;
import sh.torex.core.types.FlowRate;

/**
 * Formatter for debug trace lines.
 *
 * <p>
 * All lines use a bracketed {@code [OPERATION]} tag and shortened addresses, followed by
 * {@code key=value} fields:
 * <table border="1">
 * <tr><th>Method</th><th>Format</th><th>Color</th></tr>
 * <tr><td>formatFlowUpdate</td><td>[FLOW-UPDATE]</td><td>Indigo</td></tr>
 * <tr><td>formatQuote</td><td>[QUOTE]</td><td>Amber</td></tr>
 * <tr><td>formatLiquidityMoved</td><td>✓ [LME]</td><td>Teal</td></tr>
 * <tr><td>formatControllerError</td><td>✗ [CONTROLLER-ERROR]</td><td>Coral</td></tr>
 * </table>
 *
 * <pre>{@code
 * DebugLogger.log(Channel.FLOW, LogFormatter.formatFlowUpdate(trader, newRate, contrib, backAdjustment));
 * // [FLOW-UPDATE] trader=0x1234...5678 flowRate=1000 contrib=970 backAdjustment=-86400000
 * }</pre>
 *
 * <p>
 * All methods are pure and thread-safe.
 *
 * @see DebugLogger
 */
public final class LogFormatter {

    private LogFormatter() {
    }

    public static String formatFlowUpdate(
            final Address trader,
            final FlowRate newFlowRate,
            final FlowRate newContribFlowRate,
            final BigInteger backAdjustment) {
        return String.format("%s[FLOW-UPDATE]%s %s %s %s %s",
                INDIGO, RESET,
                kv("trader", trader.shortForm()),
                kv("flowRate", newFlowRate),
                kv("contrib", newContribFlowRate),
                kv("backAdjustment", backAdjustment));
    }

    public static String formatQuote(
            final BigInteger inAmount,
            final BigInteger twap,
            final BigInteger minOutAmount,
            final long duration) {
        return String.format("%s[QUOTE]%s %s %s %s %s",
                AMBER, RESET,
                kv("in", inAmount),
                kv("twap", twap),
                kv("minOut", minOutAmount),
                kv("duration", duration + "s"));
    }

    public static String formatLiquidityMoved(
            final Address mover,
            final BigInteger inAmount,
            final BigInteger outAmount,
            final BigInteger actualOutAmount,
            final long duration) {
        return String.format("%s✓%s [LME] %s %s %s %s %s",
                TEAL, RESET,
                kv("mover", mover.shortForm()),
                kv("in", inAmount),
                kv("out", outAmount),
                kv("distributed", actualOutAmount),
                kv("duration", duration + "s"));
    }

    public static String formatControllerError(final String site, final String reason) {
        return String.format("%s✗%s [CONTROLLER-ERROR] %s %s",
                CORAL, RESET,
                kv("site", site),
                kv("reason", reason));
    }
}
