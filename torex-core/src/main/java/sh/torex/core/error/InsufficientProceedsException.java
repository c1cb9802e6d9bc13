// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.torex.core.error;

import java.math.BigInteger;

/**
 * The liquidity mover left less out-token than the discounted benchmark requires.
 * <p>
 * {@link #outAmount()} is the balance actually measured after the callback, not a figure
 * reported by the mover.
 */
public final class InsufficientProceedsException extends LiquidityMoveException {

    private final BigInteger minOutAmount;
    private final BigInteger outAmount;

    public InsufficientProceedsException(final BigInteger minOutAmount, final BigInteger outAmount) {
        super("liquidity mover sent insufficient out-token: required " + minOutAmount + ", received " + outAmount);
        this.minOutAmount = minOutAmount;
        this.outAmount = outAmount;
    }

    public BigInteger minOutAmount() {
        return minOutAmount;
    }

    public BigInteger outAmount() {
        return outAmount;
    }
}
