// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.torex.core.math;

import java.math.BigInteger;

import sh.torex.core.types.FlowRate;

/**
 * Settlement applied to a trader when their flow rate changes between two liquidity movements.
 * <p>
 * A trader whose contribution rate goes up is charged as if the new rate had been streamed since
 * the last movement; a trader whose rate goes down is refunded the difference over the same span.
 * A contribution increase is additionally charged the elapsed fee growth. Fees already
 * distributed are never refunded.
 * <p>
 * The fee-distribution buffer follows the fee flow whatever the contribution does: its growth is
 * charged and its shrinkage refunded, so the exchange always holds exactly the buffer its traders
 * paid for. One adjustment can therefore both charge and refund.
 *
 * @param contribution signed {@code elapsed * (newContrib - prevContrib)}
 * @param feeCharge    elapsed fee growth, only with a contribution increase
 * @param bufferDelta  signed change of the fee-distribution buffer
 */
public record BackAdjustment(BigInteger contribution, BigInteger feeCharge, BigInteger bufferDelta) {

    /**
     * Signed settlement for a contribution change: positive is owed by the trader.
     */
    public static BigInteger settlement(final FlowRate prevContrib, final FlowRate newContrib, final long elapsed) {
        if (elapsed < 0) {
            throw new IllegalArgumentException("elapsed must not be negative");
        }
        return newContrib.perSecond().subtract(prevContrib.perSecond()).multiply(BigInteger.valueOf(elapsed));
    }

    public static BackAdjustment compute(
            final FlowRate prevContrib,
            final FlowRate newContrib,
            final FlowRate prevFee,
            final FlowRate newFee,
            final long elapsed,
            final BigInteger prevBuffer,
            final BigInteger newBuffer) {
        final BigInteger contribution = settlement(prevContrib, newContrib, elapsed);
        final BigInteger fee = contribution.signum() > 0
                ? settlement(prevFee, newFee, elapsed).max(BigInteger.ZERO)
                : BigInteger.ZERO;
        return new BackAdjustment(contribution, fee, newBuffer.subtract(prevBuffer));
    }

    public BigInteger bufferCharge() {
        return bufferDelta.max(BigInteger.ZERO);
    }

    public BigInteger bufferRefund() {
        return bufferDelta.negate().max(BigInteger.ZERO);
    }

    public boolean isCharge() {
        return totalCharge().signum() > 0;
    }

    public boolean isRefund() {
        return refund().signum() > 0;
    }

    /** Total debited from the trader. */
    public BigInteger totalCharge() {
        return contribution.max(BigInteger.ZERO).add(feeCharge).add(bufferCharge());
    }

    /** Total credited to the trader. */
    public BigInteger refund() {
        return contribution.negate().max(BigInteger.ZERO).add(bufferRefund());
    }
}
