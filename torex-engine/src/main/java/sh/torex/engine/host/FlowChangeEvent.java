// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.torex.engine.host;

import java.util.Objects;

import sh.torex.core.gas.GasMeter;
import sh.torex.core.types.Address;
import sh.torex.core.types.FlowRate;

/**
 * A flow to a listening account changed.
 *
 * @param token            the streamed token
 * @param sender           the flow sender
 * @param receiver         the listening account
 * @param previousFlowRate rate before the change, zero on creation
 * @param lastUpdated      timestamp of the previous change, or of this one on creation
 * @param newFlowRate      rate after the change, zero on deletion
 * @param timestamp        time of the change
 * @param userData         opaque data supplied by the sender
 * @param gas              execution budget of the operation
 */
public record FlowChangeEvent(
        Address token,
        Address sender,
        Address receiver,
        FlowRate previousFlowRate,
        long lastUpdated,
        FlowRate newFlowRate,
        long timestamp,
        byte[] userData,
        GasMeter gas) {

    public FlowChangeEvent {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(sender, "sender");
        Objects.requireNonNull(receiver, "receiver");
        Objects.requireNonNull(previousFlowRate, "previousFlowRate");
        Objects.requireNonNull(newFlowRate, "newFlowRate");
        Objects.requireNonNull(gas, "gas");
        userData = userData == null ? new byte[0] : userData.clone();
    }

    public boolean isCreation() {
        return previousFlowRate.isZero() && !newFlowRate.isZero();
    }

    public boolean isDeletion() {
        return newFlowRate.isZero();
    }

    @Override
    public byte[] userData() {
        return userData.clone();
    }
}
