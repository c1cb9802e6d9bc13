// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.torex.engine;

import java.math.BigInteger;

/**
 * Observer quoting a constant {@code numerator / denominator} price.
 */
final class FixedPriceObserver implements TwapObserver {

    private final BigInteger numerator;
    private final BigInteger denominator;
    private long checkpoint = -1;
    private int checkpoints;

    FixedPriceObserver(final long numerator, final long denominator) {
        this.numerator = BigInteger.valueOf(numerator);
        this.denominator = BigInteger.valueOf(denominator);
    }

    long lastCheckpoint() {
        return checkpoint;
    }

    int checkpointCount() {
        return checkpoints;
    }

    @Override
    public void createCheckpoint(final long time) {
        checkpoint = time;
        checkpoints++;
    }

    @Override
    public long durationSinceLastCheckpoint(final long time) {
        return time - checkpoint;
    }

    @Override
    public TwapQuote twapSinceLastCheckpoint(final long time, final BigInteger inAmount) {
        return new TwapQuote(inAmount.multiply(numerator).divide(denominator), durationSinceLastCheckpoint(time));
    }
}
