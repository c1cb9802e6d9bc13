// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.torex.core.types;

import java.math.BigInteger;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonValue;

import sh.torex.core.math.SafeCast;

/**
 * A signed continuous transfer rate, in token wei per second.
 * <p>
 * Flow rates are bounded to the signed 96-bit range of the host ledger. Construction of an
 * out-of-range value fails with {@link sh.torex.core.error.NumericOverflowException}; arithmetic
 * helpers re-check the bound on every result.
 *
 * @param perSecond the rate in wei per second
 */
public record FlowRate(BigInteger perSecond) implements Comparable<FlowRate> {

    public static final FlowRate ZERO = new FlowRate(BigInteger.ZERO);

    public FlowRate {
        Objects.requireNonNull(perSecond, "perSecond");
        SafeCast.toInt96(perSecond);
    }

    public static FlowRate of(final long perSecond) {
        return new FlowRate(BigInteger.valueOf(perSecond));
    }

    public static FlowRate of(final BigInteger perSecond) {
        return new FlowRate(perSecond);
    }

    public FlowRate plus(final FlowRate other) {
        return new FlowRate(perSecond.add(other.perSecond));
    }

    public FlowRate minus(final FlowRate other) {
        return new FlowRate(perSecond.subtract(other.perSecond));
    }

    /**
     * Amount accrued over {@code seconds} at this rate. May be negative.
     */
    public BigInteger over(final long seconds) {
        return perSecond.multiply(BigInteger.valueOf(seconds));
    }

    public int signum() {
        return perSecond.signum();
    }

    public boolean isZero() {
        return perSecond.signum() == 0;
    }

    public FlowRate max(final FlowRate other) {
        return compareTo(other) >= 0 ? this : other;
    }

    public FlowRate min(final FlowRate other) {
        return compareTo(other) <= 0 ? this : other;
    }

    @Override
    public int compareTo(final FlowRate other) {
        return perSecond.compareTo(other.perSecond);
    }

    @JsonValue
    @Override
    public String toString() {
        return perSecond.toString();
    }
}
