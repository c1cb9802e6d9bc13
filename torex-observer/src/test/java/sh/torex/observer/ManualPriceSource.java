// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.torex.observer;

import java.math.BigInteger;

/**
 * Accumulator whose token0 price is set by hand; the reverse direction quotes the reciprocal.
 */
final class ManualPriceSource implements CumulativePriceSource {

    private long lastTime;
    private BigInteger forward;
    private BigInteger reverse;
    private BigInteger forwardAcc = BigInteger.ZERO;
    private BigInteger reverseAcc = BigInteger.ZERO;

    ManualPriceSource(final long startTime, final long numerator, final long denominator) {
        this.lastTime = startTime;
        this.forward = HoppableTwapObserver.priceQ96(numerator, denominator);
        this.reverse = HoppableTwapObserver.priceQ96(denominator, numerator);
    }

    void setPrice(final long atTime, final long numerator, final long denominator) {
        forwardAcc = cumulativePrice(Direction.ZERO_FOR_ONE, atTime);
        reverseAcc = cumulativePrice(Direction.ONE_FOR_ZERO, atTime);
        lastTime = atTime;
        forward = HoppableTwapObserver.priceQ96(numerator, denominator);
        reverse = HoppableTwapObserver.priceQ96(denominator, numerator);
    }

    @Override
    public BigInteger cumulativePrice(final Direction direction, final long atTime) {
        final BigInteger elapsed = BigInteger.valueOf(atTime - lastTime);
        return direction == Direction.ZERO_FOR_ONE
                ? forwardAcc.add(forward.multiply(elapsed))
                : reverseAcc.add(reverse.multiply(elapsed));
    }
}
