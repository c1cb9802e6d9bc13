// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.torex.core.math;

import java.math.BigInteger;

import sh.torex.core.error.NumericOverflowException;

/**
 * Range checks for the fixed-width integers used by the host ledger.
 * <p>
 * Every conversion either returns the value unchanged or throws
 * {@link NumericOverflowException}; nothing is ever truncated or wrapped.
 */
public final class SafeCast {

    private static final BigInteger INT96_MAX = BigInteger.ONE.shiftLeft(95).subtract(BigInteger.ONE);
    private static final BigInteger INT96_MIN = BigInteger.ONE.shiftLeft(95).negate();
    private static final BigInteger UINT128_MAX = BigInteger.ONE.shiftLeft(128).subtract(BigInteger.ONE);

    private SafeCast() {
    }

    public static BigInteger toInt96(final BigInteger value) {
        if (value.compareTo(INT96_MIN) < 0 || value.compareTo(INT96_MAX) > 0) {
            throw new NumericOverflowException("int96", value);
        }
        return value;
    }

    public static BigInteger toUint128(final BigInteger value) {
        if (value.signum() < 0 || value.compareTo(UINT128_MAX) > 0) {
            throw new NumericOverflowException("uint128", value);
        }
        return value;
    }
}
