// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.torex.core.error;

/**
 * A liquidity movement was attempted at the timestamp of the previous one.
 */
public final class SameInstantMoveException extends LiquidityMoveException {

    private final long timestamp;

    public SameInstantMoveException(final long timestamp) {
        super("liquidity already moved at timestamp " + timestamp);
        this.timestamp = timestamp;
    }

    public long timestamp() {
        return timestamp;
    }
}
