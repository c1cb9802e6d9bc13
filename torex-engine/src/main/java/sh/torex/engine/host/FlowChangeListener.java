// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.torex.engine.host;

/**
 * Receiver-side hook for flow changes.
 * <p>
 * Called by the host after a flow to the listener's account was created, updated or deleted.
 * Throwing aborts the whole flow change.
 */
@FunctionalInterface
public interface FlowChangeListener {

    void onFlowChanged(FlowChangeEvent event);
}
