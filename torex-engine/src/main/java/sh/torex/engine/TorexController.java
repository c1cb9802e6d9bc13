// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.torex.engine;

import sh.torex.core.gas.GasMeter;
import sh.torex.core.types.FlowRate;

/**
 * External policy hook supplying per-trader fee rates and receiving movement notifications.
 *
 * <p>
 * <strong>Containment:</strong> a controller is not trusted.
 * <ul>
 * <li>{@link #onInFlowChanged} on a flow creation or update runs unguarded; a failure aborts the
 * flow change.</li>
 * <li>{@link #onInFlowChanged} on a flow deletion and {@link #onLiquidityMoved} always run with
 * a bounded gas budget; a failure is counted and ignored.</li>
 * <li>The returned fee rate is clamped to the exchange's maximum allowed fee.</li>
 * </ul>
 */
public interface TorexController {

    /**
     * Called when a trader's inbound flow changed.
     *
     * @param update the flow change
     * @param gas    budget the hook may consume
     * @return the fee flow rate to divert from the trader's new gross rate
     */
    FlowRate onInFlowChanged(TraderFlowUpdate update, GasMeter gas);

    /**
     * Called after a liquidity movement completed.
     *
     * @return {@code true} to acknowledge
     */
    boolean onLiquidityMoved(LiquidityMoveResult result, GasMeter gas);

    /**
     * Called once by {@link TorexFactory} after the exchange is wired up.
     */
    default void onRegistered(final Torex torex) {
    }
}
