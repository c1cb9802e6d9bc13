// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.torex.engine.host;

import java.math.BigInteger;

/**
 * Balance of an account at the current timestamp.
 *
 * @param available spendable balance
 * @param deposit   buffer locked by the account's open flows
 */
public record RealtimeBalance(BigInteger available, BigInteger deposit) {

    public BigInteger total() {
        return available.add(deposit);
    }
}
