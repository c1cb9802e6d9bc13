// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.torex.core.math;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;

import org.junit.jupiter.api.Test;

import sh.torex.core.types.FlowRate;

class ScalerTest {

    @Test
    void positiveScalerMultiplies() {
        assertEquals(BigInteger.valueOf(1_000), new Scaler(10).scaleValue(BigInteger.valueOf(100)));
        assertTrue(new Scaler(10).isUpscale());
    }

    @Test
    void negativeScalerDividesWithTruncation() {
        final Scaler down = new Scaler(-1_000);
        assertEquals(BigInteger.ONE, down.scaleValue(BigInteger.valueOf(1_999)));
        assertEquals(BigInteger.ZERO, down.scaleValue(BigInteger.valueOf(999)));
        // truncation toward zero for negative values
        assertEquals(BigInteger.valueOf(-1), down.scaleValue(BigInteger.valueOf(-1_999)));
        assertFalse(down.isUpscale());
    }

    @Test
    void pow10CoversBothDirections() {
        assertEquals(new Scaler(1_000_000_000L), Scaler.pow10(9));
        assertEquals(new Scaler(-1_000_000_000L), Scaler.pow10(-9));
        assertEquals(Scaler.ONE, Scaler.pow10(0));
        assertThrows(IllegalArgumentException.class, () -> Scaler.pow10(19));
    }

    @Test
    void inverseFlipsDirection() {
        assertEquals(new Scaler(-100), new Scaler(100).inverse());
        assertEquals(new Scaler(100), new Scaler(-100).inverse());
    }

    @Test
    void scalesFlowRates() {
        assertEquals(FlowRate.of(3), Scaler.pow10(-3).scaleFlowRate(FlowRate.of(3_500)));
    }

    @Test
    void rejectsZero() {
        assertThrows(IllegalArgumentException.class, () -> new Scaler(0));
        assertThrows(IllegalArgumentException.class, () -> new Scaler(Long.MIN_VALUE));
    }
}
