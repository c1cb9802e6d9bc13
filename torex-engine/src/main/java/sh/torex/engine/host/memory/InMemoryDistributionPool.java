// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.torex.engine.host.memory;

import java.math.BigInteger;
import java.util.Map;

import sh.torex.core.types.Address;
import sh.torex.engine.host.DistributionPool;

/**
 * Handle to a pool held by an {@link InMemoryLedger}. Pool state lives in the ledger, so it
 * follows ledger snapshots. All members are treated as connected.
 */
public final class InMemoryDistributionPool implements DistributionPool {

    private final InMemoryLedger ledger;
    private final Address address;
    private final Address token;
    private final Address admin;

    InMemoryDistributionPool(final InMemoryLedger ledger, final Address address, final Address token, final Address admin) {
        this.ledger = ledger;
        this.address = address;
        this.token = token;
        this.admin = admin;
    }

    @Override
    public Address address() {
        return address;
    }

    @Override
    public Address token() {
        return token;
    }

    @Override
    public Address admin() {
        return admin;
    }

    @Override
    public BigInteger memberUnits(final Address member) {
        return ledger.memberUnits(address, member);
    }

    @Override
    public BigInteger totalUnits() {
        return ledger.totalUnits(address);
    }

    @Override
    public void updateMemberUnits(final Address member, final BigInteger units) {
        ledger.updateMemberUnits(address, member, units);
    }

    public Map<Address, BigInteger> members() {
        return ledger.members(address);
    }

    @Override
    public String toString() {
        return "InMemoryDistributionPool{address=" + address + ", token=" + token + '}';
    }
}
