// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.torex.engine.host;

import java.math.BigInteger;

import sh.torex.core.types.Address;

/**
 * Proportional payout primitive: every member receives {@code memberUnits / totalUnits} of what is
 * distributed to the pool, instantly or continuously.
 */
public interface DistributionPool {

    Address address();

    Address token();

    Address admin();

    BigInteger memberUnits(Address member);

    BigInteger totalUnits();

    void updateMemberUnits(Address member, BigInteger units);
}
