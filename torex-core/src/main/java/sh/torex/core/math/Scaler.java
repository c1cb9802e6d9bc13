// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.torex.core.math;

import java.math.BigInteger;

import sh.torex.core.types.FlowRate;

/**
 * Signed multiplier/divisor used for unit conversion.
 * <p>
 * A non-negative value {@code s} multiplies, a negative value divides by {@code -s}:
 * <pre>
 * scale(v) = v * s      if s &gt;= 0
 * scale(v) = v / (-s)   if s &lt;  0
 * </pre>
 * Division truncates toward zero. The exchange uses one scaler to normalize the decimals of the
 * TWAP quote and another to turn contribution flow rates into distribution pool units.
 *
 * @param value the raw scaler, never zero
 */
public record Scaler(long value) {

    /** Identity scaler. */
    public static final Scaler ONE = new Scaler(1);

    public Scaler {
        if (value == 0) {
            throw new IllegalArgumentException("scaler must not be zero");
        }
        if (value == Long.MIN_VALUE) {
            throw new IllegalArgumentException("scaler has no inverse: " + value);
        }
    }

    /**
     * Creates the scaler for {@code 10^exponent}; negative exponents divide.
     *
     * @param exponent power of ten, between -18 and 18
     * @return the scaler
     */
    public static Scaler pow10(final int exponent) {
        if (exponent < -18 || exponent > 18) {
            throw new IllegalArgumentException("exponent out of range: " + exponent);
        }
        final long magnitude = BigInteger.TEN.pow(Math.abs(exponent)).longValueExact();
        return new Scaler(exponent >= 0 ? magnitude : -magnitude);
    }

    public BigInteger scaleValue(final BigInteger v) {
        if (value >= 0) {
            return v.multiply(BigInteger.valueOf(value));
        }
        return v.divide(BigInteger.valueOf(-value));
    }

    public FlowRate scaleFlowRate(final FlowRate rate) {
        return FlowRate.of(scaleValue(rate.perSecond()));
    }

    public Scaler inverse() {
        return new Scaler(-value);
    }

    /** True when scaling never loses precision. */
    public boolean isUpscale() {
        return value >= 0;
    }
}
