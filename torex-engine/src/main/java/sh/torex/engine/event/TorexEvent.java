// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.torex.engine.event;

/**
 * Notification emitted by an exchange after an operation committed.
 */
public sealed interface TorexEvent permits TorexFlowUpdated, LiquidityMoved, ControllerError {

    /** Timestamp of the operation. */
    long timestamp();
}
