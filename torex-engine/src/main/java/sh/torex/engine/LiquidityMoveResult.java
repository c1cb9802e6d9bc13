// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.torex.engine;

import java.math.BigInteger;

/**
 * Outcome of one liquidity movement.
 *
 * @param durationSinceLastLME seconds since the previous movement
 * @param twap                 scaled time-weighted quote for {@code inAmount}
 * @param inAmount             in-token handed to the mover
 * @param minOutAmount         out-token floor the mover had to meet
 * @param outAmount            out-token balance measured after the callback
 * @param actualOutAmount      out-token distributed after unit rounding
 */
public record LiquidityMoveResult(
        long durationSinceLastLME,
        BigInteger twap,
        BigInteger inAmount,
        BigInteger minOutAmount,
        BigInteger outAmount,
        BigInteger actualOutAmount) {
}
