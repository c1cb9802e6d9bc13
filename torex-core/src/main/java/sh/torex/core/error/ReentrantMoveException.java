// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.torex.core.error;

public final class ReentrantMoveException extends LiquidityMoveException {

    public ReentrantMoveException() {
        super("reentrant liquidity movement");
    }
}
