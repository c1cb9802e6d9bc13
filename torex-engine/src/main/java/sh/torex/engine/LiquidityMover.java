// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.torex.engine;

import java.math.BigInteger;

import sh.torex.core.types.Address;

/**
 * Third party that swaps the exchange's accumulated in-token for out-token.
 * <p>
 * Before the callback the exchange has transferred {@code inAmount} of in-token to
 * {@link #address()}. The callback must leave at least {@code minOutAmount} of out-token with the
 * exchange before returning; the exchange measures its balance rather than trusting the mover.
 */
public interface LiquidityMover {

    Address address();

    /**
     * @return {@code true} to acknowledge the movement
     */
    boolean moveLiquidityCallback(
            Address inToken,
            Address outToken,
            BigInteger inAmount,
            BigInteger minOutAmount,
            byte[] moverData);
}
