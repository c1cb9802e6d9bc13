// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.torex.core.math;

import java.math.BigInteger;

import sh.torex.core.types.FlowRate;

/**
 * Parts-per-million fee ceiling applied to controller-requested fee rates.
 */
public final class FeeCeiling {

    /** 100% in parts per million. */
    public static final long PPM = 1_000_000L;

    private FeeCeiling() {
    }

    /**
     * Largest fee rate allowed for a gross inbound rate.
     *
     * @param grossRate  the trader's gross inbound rate
     * @param maxFeePM   ceiling in parts per million
     * @return {@code grossRate * maxFeePM / PPM}, truncated
     */
    public static FlowRate maxFeeRate(final FlowRate grossRate, final long maxFeePM) {
        validate(maxFeePM);
        return FlowRate.of(grossRate.perSecond()
                .multiply(BigInteger.valueOf(maxFeePM))
                .divide(BigInteger.valueOf(PPM)));
    }

    /**
     * Restricts {@code requested} to {@code [0, maxFeeRate(grossRate, maxFeePM)]}.
     */
    public static FlowRate clamp(final FlowRate grossRate, final FlowRate requested, final long maxFeePM) {
        if (requested.signum() <= 0 || grossRate.signum() <= 0) {
            return FlowRate.ZERO;
        }
        return requested.min(maxFeeRate(grossRate, maxFeePM));
    }

    public static void validate(final long maxFeePM) {
        if (maxFeePM < 0 || maxFeePM > PPM) {
            throw new IllegalArgumentException("fee must be between 0 and 1000000 PM: " + maxFeePM);
        }
    }
}
