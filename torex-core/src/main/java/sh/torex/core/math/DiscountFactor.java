// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.torex.core.math;

import java.math.BigInteger;

/**
 * Hyperbolic decay curve applied to the benchmark quote.
 * <p>
 * The factor is {@code tau * (1 - epsilon) / epsilon}, where {@code epsilon} is given in parts per
 * million. A value is discounted over {@code elapsed} seconds as
 * <pre>
 * discounted = fullValue * factor / (factor + elapsed)
 * </pre>
 * so that at {@code elapsed == tau} the discount equals {@code epsilon}. The factor is kept as the
 * exact fraction {@code tau * (PPM - epsilonPM) / epsilonPM} and evaluated as
 * {@code fullValue * num / (num + elapsed * epsilonPM)}, which avoids truncating the factor itself.
 * When {@code epsilonPM} does not divide {@code tau * (PPM - epsilonPM)}, quotes can therefore
 * exceed those of the truncated {@code fullValue * factor() / (factor() + elapsed)} by a unit;
 * {@link #factor()} is informational and never used for pricing.
 * <p>
 * A zero factor disables the discount entirely.
 *
 * @param numerator   {@code tau * (PPM - epsilonPM)}
 * @param denominator {@code epsilonPM}
 */
public record DiscountFactor(BigInteger numerator, long denominator) {

    private static final DiscountFactor DISABLED = new DiscountFactor(BigInteger.ZERO, 1);

    public DiscountFactor {
        if (numerator.signum() < 0) {
            throw new IllegalArgumentException("discount factor must not be negative");
        }
        if (denominator <= 0) {
            throw new IllegalArgumentException("denominator must be positive");
        }
    }

    /**
     * Builds the factor reaching a discount of {@code epsilonPM} after {@code tau} seconds.
     *
     * @param tau       seconds until the discount reaches epsilon
     * @param epsilonPM discount at {@code tau}, parts per million, in {@code (0, 1_000_000]}
     * @return the discount factor
     */
    public static DiscountFactor of(final long tau, final long epsilonPM) {
        if (tau < 0) {
            throw new IllegalArgumentException("tau must not be negative");
        }
        if (epsilonPM <= 0 || epsilonPM > FeeCeiling.PPM) {
            throw new IllegalArgumentException("epsilonPM must be in (0, 1000000]: " + epsilonPM);
        }
        return new DiscountFactor(
                BigInteger.valueOf(tau).multiply(BigInteger.valueOf(FeeCeiling.PPM - epsilonPM)),
                epsilonPM);
    }

    public static DiscountFactor disabled() {
        return DISABLED;
    }

    public boolean isDisabled() {
        return numerator.signum() == 0;
    }

    /** The factor truncated to whole seconds. */
    public BigInteger factor() {
        return numerator.divide(BigInteger.valueOf(denominator));
    }

    public BigInteger discountedValue(final BigInteger fullValue, final long elapsed) {
        if (elapsed < 0) {
            throw new IllegalArgumentException("elapsed must not be negative");
        }
        if (fullValue.signum() == 0) {
            return BigInteger.ZERO;
        }
        if (isDisabled()) {
            return fullValue;
        }
        final BigInteger decay = BigInteger.valueOf(elapsed).multiply(BigInteger.valueOf(denominator));
        return fullValue.multiply(numerator).divide(numerator.add(decay));
    }
}
