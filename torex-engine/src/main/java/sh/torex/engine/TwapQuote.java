// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.torex.engine;

import java.math.BigInteger;
import java.util.Objects;

/**
 * @param outAmount out-token amount at the time-weighted price
 * @param duration  seconds since the observer's last checkpoint
 */
public record TwapQuote(BigInteger outAmount, long duration) {

    public TwapQuote {
        Objects.requireNonNull(outAmount, "outAmount");
        if (outAmount.signum() < 0) {
            throw new IllegalArgumentException("outAmount must not be negative");
        }
        if (duration < 0) {
            throw new IllegalArgumentException("duration must not be negative");
        }
    }
}
