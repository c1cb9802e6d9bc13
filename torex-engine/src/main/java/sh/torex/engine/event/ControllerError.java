// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.torex.engine.event;

/**
 * A controller hook failed on a contained call site.
 *
 * @param site   the call site, {@code onInFlowChanged} or {@code onLiquidityMoved}
 * @param reason the captured failure
 */
public record ControllerError(long timestamp, String site, String reason) implements TorexEvent {
}
