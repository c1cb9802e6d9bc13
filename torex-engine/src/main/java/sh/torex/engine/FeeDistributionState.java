// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.torex.engine;

import java.math.BigInteger;
import java.util.Objects;

import sh.torex.core.types.FlowRate;

/**
 * Exchange-wide fee accumulator.
 *
 * @param requestedFlowRate sum of all traders' fee rates
 * @param actualFlowRate    rate the fee pool actually accepted after unit rounding
 * @param buffer            deposit locked by the fee-distribution flow
 */
public record FeeDistributionState(FlowRate requestedFlowRate, FlowRate actualFlowRate, BigInteger buffer) {

    public static final FeeDistributionState ZERO =
            new FeeDistributionState(FlowRate.ZERO, FlowRate.ZERO, BigInteger.ZERO);

    public FeeDistributionState {
        Objects.requireNonNull(requestedFlowRate, "requestedFlowRate");
        Objects.requireNonNull(actualFlowRate, "actualFlowRate");
        Objects.requireNonNull(buffer, "buffer");
    }
}
