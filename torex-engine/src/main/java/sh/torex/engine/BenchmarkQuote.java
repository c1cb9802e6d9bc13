// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.torex.engine;

import java.math.BigInteger;

/**
 * Price floor a liquidity mover must meet.
 *
 * @param inAmount     in-token amount quoted
 * @param minOutAmount discounted benchmark, the required out-token amount
 * @param duration     seconds covered by the time-weighted price
 * @param twap         scaled time-weighted out-token amount before discount
 */
public record BenchmarkQuote(BigInteger inAmount, BigInteger minOutAmount, long duration, BigInteger twap) {
}
