// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.torex.core.error;

public final class MoverCallbackRejectedException extends LiquidityMoveException {

    public MoverCallbackRejectedException() {
        super("liquidity mover callback did not acknowledge");
    }
}
