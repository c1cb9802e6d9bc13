// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.torex.engine;

import java.util.Objects;

import sh.torex.core.types.Address;
import sh.torex.core.types.FlowRate;

/**
 * Arguments of {@link TorexController#onInFlowChanged}.
 *
 * @param trader          the flow sender
 * @param prevFlowRate    gross rate before the change
 * @param prevFeeFlowRate fee rate before the change
 * @param lastUpdated     timestamp of the previous change
 * @param newFlowRate     gross rate after the change
 * @param now             current timestamp
 * @param userData        opaque data from the trader
 */
public record TraderFlowUpdate(
        Address trader,
        FlowRate prevFlowRate,
        FlowRate prevFeeFlowRate,
        long lastUpdated,
        FlowRate newFlowRate,
        long now,
        byte[] userData) {

    public TraderFlowUpdate {
        Objects.requireNonNull(trader, "trader");
        Objects.requireNonNull(prevFlowRate, "prevFlowRate");
        Objects.requireNonNull(prevFeeFlowRate, "prevFeeFlowRate");
        Objects.requireNonNull(newFlowRate, "newFlowRate");
        userData = userData == null ? new byte[0] : userData.clone();
    }

    @Override
    public byte[] userData() {
        return userData.clone();
    }
}
