// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.torex.engine.event;

import sh.torex.core.types.Address;
import sh.torex.engine.LiquidityMoveResult;

public record LiquidityMoved(long timestamp, Address mover, LiquidityMoveResult result) implements TorexEvent {
}
