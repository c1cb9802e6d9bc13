// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.torex.core.gas;

import sh.torex.core.error.OutOfGasException;

/**
 * Execution budget of a call, in abstract gas units.
 * <p>
 * A meter is forked to bound an external call: the child is granted at most the parent's
 * remainder, and {@link #join(GasMeter)} charges the parent for what the child used.
 * <p>
 * Not thread-safe; a meter belongs to a single call.
 *
 * <pre>{@code
 * GasMeter call = GasMeter.of(5_000_000);
 * GasMeter hook = call.fork(3_000_000);
 * try {
 *     controller.onLiquidityMoved(result, hook);
 * } finally {
 *     call.join(hook);
 * }
 * }</pre>
 */
public final class GasMeter {

    private static final long UNLIMITED = Long.MAX_VALUE;

    private final long limit;
    private long consumed;

    private GasMeter(final long limit) {
        this.limit = limit;
    }

    public static GasMeter of(final long limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("gas limit must not be negative");
        }
        return new GasMeter(limit);
    }

    public static GasMeter unlimited() {
        return new GasMeter(UNLIMITED);
    }

    public long limit() {
        return limit;
    }

    public long consumed() {
        return consumed;
    }

    public long remaining() {
        return limit - consumed;
    }

    public boolean isUnlimited() {
        return limit == UNLIMITED;
    }

    /**
     * Consumes {@code units}. On failure the meter is left exhausted.
     *
     * @throws OutOfGasException if {@code units} exceeds the remainder
     */
    public void consume(final long units) {
        if (units < 0) {
            throw new IllegalArgumentException("units must not be negative");
        }
        final long remaining = remaining();
        if (units > remaining) {
            consumed = limit;
            throw new OutOfGasException(units, remaining);
        }
        consumed += units;
    }

    /**
     * Burns everything left and fails.
     *
     * @throws OutOfGasException always
     */
    public void exhaust() {
        final long remaining = remaining();
        consumed = limit;
        throw new OutOfGasException(remaining, 0);
    }

    /**
     * Creates a child meter granted {@code min(limit, remaining())}.
     */
    public GasMeter fork(final long childLimit) {
        if (childLimit < 0) {
            throw new IllegalArgumentException("gas limit must not be negative");
        }
        return new GasMeter(Math.min(childLimit, remaining()));
    }

    /**
     * Charges this meter for what {@code child} consumed.
     */
    public void join(final GasMeter child) {
        consumed = Math.min(limit, consumed + child.consumed);
    }

    @Override
    public String toString() {
        return isUnlimited() ? "GasMeter{unlimited, consumed=" + consumed + "}"
                : "GasMeter{limit=" + limit + ", consumed=" + consumed + "}";
    }
}
