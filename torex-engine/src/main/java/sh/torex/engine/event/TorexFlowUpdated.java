// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.torex.engine.event;

import java.math.BigInteger;

import sh.torex.core.types.Address;
import sh.torex.core.types.FlowRate;

/**
 * @param backAdjustment signed contribution settlement, positive when charged
 */
public record TorexFlowUpdated(
        long timestamp,
        Address trader,
        FlowRate newFlowRate,
        FlowRate newContribFlowRate,
        BigInteger backAdjustment,
        FlowRate requestedFeeDistFlowRate,
        FlowRate actualFeeDistFlowRate) implements TorexEvent {
}
