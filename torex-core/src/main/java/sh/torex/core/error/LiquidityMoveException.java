// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.torex.core.error;

/**
 * A liquidity movement was rejected. The movement had no effect.
 */
public sealed class LiquidityMoveException extends TorexException
        permits InsufficientProceedsException,
        SameInstantMoveException,
        ReentrantMoveException,
        MoverCallbackRejectedException {

    public LiquidityMoveException(final String message) {
        super(message);
    }

    public LiquidityMoveException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
