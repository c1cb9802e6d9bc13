// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.torex.observer;

import java.math.BigInteger;

/**
 * Price accumulator of a two-token pool.
 * <p>
 * The accumulator is the running sum of {@code price * dt}, with the price expressed as a
 * {@link HoppableTwapObserver#Q96 Q96} fixed-point number of output token per input token. The
 * average price over a window is the accumulator difference divided by the window length.
 */
public interface CumulativePriceSource {

    /**
     * Which side of the pool is sold.
     */
    enum Direction {
        /** Token0 in, token1 out. */
        ZERO_FOR_ONE,
        /** Token1 in, token0 out. */
        ONE_FOR_ZERO
    }

    /**
     * @param direction the quoted direction
     * @param atTime    timestamp, not in the future
     * @return the accumulator value at {@code atTime}
     */
    BigInteger cumulativePrice(Direction direction, long atTime);
}
