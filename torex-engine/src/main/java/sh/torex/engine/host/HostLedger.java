// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.torex.engine.host;

import java.math.BigInteger;

import sh.torex.core.error.InsufficientBalanceException;
import sh.torex.core.gas.GasMeter;
import sh.torex.core.types.Address;
import sh.torex.core.types.FlowRate;

/**
 * The host ledger: token balances, continuous flows, distribution pools and the clock.
 * <p>
 * The ledger is also the source of flow-change events: a flow whose receiver registered a
 * {@link FlowChangeListener} notifies it inside the same atomic operation, and the flow change is
 * undone if the listener throws.
 * <p>
 * All timestamps are whole seconds. All amounts are token wei.
 */
public interface HostLedger {

    /** Current block timestamp in seconds. */
    long now();

    /** Allocates a fresh account address. */
    Address newAccount();

    /**
     * Available balance of {@code account}, excluding locked flow deposits. May be negative when
     * an account's outflows outran its inflows.
     */
    BigInteger balanceOf(Address token, Address account);

    RealtimeBalance realtimeBalance(Address token, Address account);

    /**
     * Moves {@code amount} from {@code from} to {@code to}.
     *
     * @throws InsufficientBalanceException if {@code from} holds less than {@code amount}
     */
    void transfer(Address token, Address from, Address to, BigInteger amount);

    FlowRate flowRate(Address token, Address sender, Address receiver);

    /**
     * Creates, updates or (with a zero rate) deletes the flow from {@code sender} to
     * {@code receiver}. The sender's buffer deposit is adjusted to {@link #bufferFor(FlowRate)}.
     */
    void setFlow(Address token, Address sender, Address receiver, FlowRate flowRate, byte[] userData, GasMeter gas);

    /** Deposit locked while a flow of {@code flowRate} is open. */
    BigInteger bufferFor(FlowRate flowRate);

    DistributionPool createPool(Address token, Address admin);

    /**
     * Instantly distributes up to {@code amount} from {@code from} to the members of {@code pool}.
     *
     * @return the amount actually distributed after unit rounding
     */
    BigInteger distribute(Address token, Address from, DistributionPool pool, BigInteger amount);

    /**
     * Sets the continuous distribution from {@code from} to {@code pool}.
     *
     * @return the actual distribution flow rate after unit rounding
     */
    FlowRate distributeFlow(Address token, Address from, DistributionPool pool, FlowRate requestedFlowRate);

    /** Actual rate {@link #distributeFlow} would apply for {@code requestedFlowRate}, without applying it. */
    FlowRate estimateDistributionFlowRate(DistributionPool pool, FlowRate requestedFlowRate);

    void registerListener(Address account, FlowChangeListener listener);

    LedgerSnapshot snapshot();

    /** Restores the state captured by {@code snapshot}; later snapshots become invalid. */
    void revertTo(LedgerSnapshot snapshot);

    /** Discards {@code snapshot} once it is no longer needed. */
    void release(LedgerSnapshot snapshot);
}
