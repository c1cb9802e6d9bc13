// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.torex.engine;

import java.util.Objects;

import sh.torex.core.types.FlowRate;

/**
 * Settled split of a trader's gross inbound rate.
 *
 * @param contribFlowRate part funding the exchange
 * @param feeFlowRate     part diverted to the fee-distribution pool
 */
public record TraderState(FlowRate contribFlowRate, FlowRate feeFlowRate) {

    public static final TraderState ZERO = new TraderState(FlowRate.ZERO, FlowRate.ZERO);

    public TraderState {
        Objects.requireNonNull(contribFlowRate, "contribFlowRate");
        Objects.requireNonNull(feeFlowRate, "feeFlowRate");
    }

    /** The gross inbound rate, {@code contribFlowRate + feeFlowRate}. */
    public FlowRate flowRate() {
        return contribFlowRate.plus(feeFlowRate);
    }
}
