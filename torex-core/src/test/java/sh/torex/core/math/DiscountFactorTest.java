// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.torex.core.math;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class DiscountFactorTest {

    private static final BigInteger ONE_MILLION = BigInteger.valueOf(1_000_000);

    @Test
    void noDiscountAtZeroElapsed() {
        final DiscountFactor df = DiscountFactor.of(600, 10_000);
        assertEquals(ONE_MILLION, df.discountedValue(ONE_MILLION, 0));
    }

    @Test
    void discountEqualsEpsilonAfterTau() {
        final DiscountFactor df = DiscountFactor.of(600, 10_000);
        // 1% off after 600 seconds
        assertEquals(BigInteger.valueOf(990_000), df.discountedValue(ONE_MILLION, 600));
    }

    @ParameterizedTest
    @ValueSource(longs = { 1, 10_000, 250_000, 999_999 })
    void discountAtTauIsIndependentOfTau(final long epsilonPM) {
        for (long tau : new long[] { 60, 600, 86_400 }) {
            assertEquals(BigInteger.valueOf(1_000_000 - epsilonPM),
                    DiscountFactor.of(tau, epsilonPM).discountedValue(ONE_MILLION, tau));
        }
    }

    @Test
    void discountIsMonotonicInElapsed() {
        final DiscountFactor df = DiscountFactor.of(3600, 50_000);
        final BigInteger value = new BigInteger("1000000000000000000000");
        BigInteger previous = value;
        for (long t = 0; t <= 86_400; t += 1_200) {
            final BigInteger discounted = df.discountedValue(value, t);
            assertTrue(discounted.compareTo(previous) <= 0, "not monotonic at " + t);
            assertTrue(discounted.compareTo(value) <= 0);
            previous = discounted;
        }
        assertTrue(previous.compareTo(value) < 0);
    }

    @Test
    void disabledFactorReturnsFullValue() {
        final DiscountFactor df = DiscountFactor.disabled();
        assertTrue(df.isDisabled());
        assertEquals(ONE_MILLION, df.discountedValue(ONE_MILLION, 1_000_000));
        assertTrue(DiscountFactor.of(0, 10_000).isDisabled());
    }

    @Test
    void zeroValueStaysZero() {
        assertEquals(BigInteger.ZERO, DiscountFactor.of(600, 10_000).discountedValue(BigInteger.ZERO, 600));
    }

    @Test
    void factorIsTauTimesRemainderOverEpsilon() {
        final DiscountFactor df = DiscountFactor.of(600, 10_000);
        assertEquals(BigInteger.valueOf(600L * 990_000), df.numerator());
        assertEquals(10_000, df.denominator());
        assertEquals(BigInteger.valueOf(59_400), df.factor());
    }

    @Test
    void unevenFactorIsNotTruncated() {
        final DiscountFactor df = DiscountFactor.of(7, 3);
        final BigInteger v = BigInteger.valueOf(1_000_000);

        assertEquals(BigInteger.valueOf(2_333_326), df.factor());
        assertEquals(BigInteger.valueOf(999_997), df.discountedValue(v, 7));
        final BigInteger truncated = v.multiply(df.factor()).divide(df.factor().add(BigInteger.valueOf(7)));
        assertEquals(BigInteger.valueOf(999_996), truncated);
    }

    @Test
    void rejectsInvalidParameters() {
        assertThrows(IllegalArgumentException.class, () -> DiscountFactor.of(600, 0));
        assertThrows(IllegalArgumentException.class, () -> DiscountFactor.of(600, 1_000_001));
        assertThrows(IllegalArgumentException.class, () -> DiscountFactor.of(-1, 10_000));
        assertThrows(IllegalArgumentException.class,
                () -> DiscountFactor.of(600, 10_000).discountedValue(ONE_MILLION, -1));
    }
}
