// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.torex.engine;

import java.math.BigInteger;
import java.util.Map;

import sh.torex.core.types.Address;

/**
 * Point-in-time view of an exchange's internal state, for debugging and monitoring.
 */
public record TorexDetails(
        Address address,
        Address inToken,
        Address outToken,
        long timestamp,
        long lastLiquidityMovedTime,
        long controllerInternalErrorCounter,
        FeeDistributionState feeDistributionState,
        BigInteger availableInTokens,
        BigInteger outTokenDistributionPoolTotalUnits,
        Map<Address, TraderState> traders) {
}
