// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.torex.observer;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.torex.engine.TwapObserver;
import sh.torex.engine.TwapQuote;

/**
 * {@link TwapObserver} quoting through a chain of pools, e.g. {@code USDC -> WETH -> DEGEN}.
 *
 * <p>
 * A checkpoint records every hop's accumulator. A quote converts the input amount hop by hop at
 * each pool's average price since the checkpoint:
 * <pre>
 * amount_{i+1} = amount_i * (acc_i(now) - acc_i(checkpoint)) / duration / 2^96
 * </pre>
 * Every hop truncates. A window of zero seconds has no average price and quotes zero.
 */
public final class HoppableTwapObserver implements TwapObserver {

    private static final Logger log = LoggerFactory.getLogger(HoppableTwapObserver.class);

    /** Fixed-point scale of accumulated prices. */
    public static final BigInteger Q96 = BigInteger.ONE.shiftLeft(96);

    private final List<PoolHop> hops;
    private final BigInteger[] checkpointAccumulators;
    private long checkpointTime = -1;

    public HoppableTwapObserver(final List<PoolHop> hops) {
        Objects.requireNonNull(hops, "hops");
        if (hops.isEmpty()) {
            throw new IllegalArgumentException("at least one hop is required");
        }
        this.hops = List.copyOf(hops);
        this.checkpointAccumulators = new BigInteger[hops.size()];
    }

    public static HoppableTwapObserver of(final PoolHop... hops) {
        return new HoppableTwapObserver(List.of(hops));
    }

    /**
     * Encodes {@code numerator / denominator} as a Q96 price.
     */
    public static BigInteger priceQ96(final long numerator, final long denominator) {
        if (denominator <= 0 || numerator < 0) {
            throw new IllegalArgumentException("invalid price " + numerator + "/" + denominator);
        }
        return BigInteger.valueOf(numerator).shiftLeft(96).divide(BigInteger.valueOf(denominator));
    }

    public List<PoolHop> hops() {
        return hops;
    }

    public long lastCheckpointTime() {
        return checkpointTime;
    }

    @Override
    public void createCheckpoint(final long time) {
        if (checkpointTime >= 0 && time < checkpointTime) {
            throw new IllegalArgumentException("checkpoint at " + time + " precedes " + checkpointTime);
        }
        for (int i = 0; i < hops.size(); i++) {
            final PoolHop hop = hops.get(i);
            checkpointAccumulators[i] = hop.source().cumulativePrice(hop.direction(), time);
        }
        checkpointTime = time;
        log.debug("Checkpoint at {} over {} hops", time, hops.size());
    }

    @Override
    public long durationSinceLastCheckpoint(final long time) {
        if (checkpointTime < 0) {
            throw new IllegalStateException("no checkpoint created");
        }
        if (time < checkpointTime) {
            throw new IllegalArgumentException("time " + time + " precedes checkpoint " + checkpointTime);
        }
        return time - checkpointTime;
    }

    @Override
    public TwapQuote twapSinceLastCheckpoint(final long time, final BigInteger inAmount) {
        final long duration = durationSinceLastCheckpoint(time);
        if (duration == 0) {
            return new TwapQuote(BigInteger.ZERO, 0);
        }
        final BigInteger window = BigInteger.valueOf(duration);
        BigInteger amount = inAmount;
        for (int i = 0; i < hops.size(); i++) {
            final PoolHop hop = hops.get(i);
            final BigInteger accumulated = hop.source().cumulativePrice(hop.direction(), time)
                    .subtract(checkpointAccumulators[i]);
            if (accumulated.signum() < 0) {
                throw new IllegalStateException("price accumulator of hop " + i + " decreased");
            }
            amount = amount.multiply(accumulated).divide(window).shiftRight(96);
        }
        return new TwapQuote(amount, duration);
    }
}
