// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.torex.engine;

import java.math.BigInteger;

/**
 * Time-weighted price source measured from its last checkpoint.
 * <p>
 * Checkpoints are monotonic: {@code duration = time - lastCheckpointTime} is never negative.
 * The exchange creates a checkpoint at creation and after every liquidity movement, so the quote
 * always covers the span since the previous movement.
 */
public interface TwapObserver {

    /**
     * Starts a new measurement window at {@code time}.
     *
     * @throws IllegalArgumentException if {@code time} precedes the current checkpoint
     */
    void createCheckpoint(long time);

    long durationSinceLastCheckpoint(long time);

    /**
     * Converts {@code inAmount} at the average price since the last checkpoint.
     *
     * @param time     the current timestamp
     * @param inAmount amount of in-token to quote
     * @return out-token amount before decimal scaling, and the window length
     */
    TwapQuote twapSinceLastCheckpoint(long time, BigInteger inAmount);
}
