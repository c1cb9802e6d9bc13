// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.torex.engine.host.memory;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.torex.core.error.InsufficientBalanceException;
import sh.torex.core.gas.GasMeter;
import sh.torex.core.math.SafeCast;
import sh.torex.core.types.Address;
import sh.torex.core.types.FlowRate;
import sh.torex.engine.host.DistributionPool;
import sh.torex.engine.host.FlowChangeEvent;
import sh.torex.engine.host.FlowChangeListener;
import sh.torex.engine.host.HostLedger;
import sh.torex.engine.host.LedgerSnapshot;
import sh.torex.engine.host.RealtimeBalance;

/**
 * Single-process {@link HostLedger} with a manually driven clock.
 *
 * <h2>Implementation Notes</h2>
 *
 * <h3>Realtime balances</h3>
 * <p>Each account stores a settled balance, the time it was settled and its net flow rate. The
 * balance at {@code now} is {@code settled + netFlowRate * (now - settledAt)}; accounts are settled
 * before any change to their net flow rate.
 *
 * <h3>Deposits</h3>
 * <p>Opening or increasing a flow locks {@code rate * liquidationPeriod} from the sender's
 * available balance, and the sender must hold it. Pool distribution flows lock their deposit
 * without that check, so an account may fund the buffer of its outgoing distribution from the
 * inflows it is about to receive.
 *
 * <h3>Snapshots</h3>
 * <p>{@link #snapshot()} deep-copies the whole state, clock included, in the manner of a test
 * node's {@code evm_snapshot}. Reverting consumes the snapshot and every later one.
 *
 * <p>Not thread-safe.
 */
public final class InMemoryLedger implements HostLedger {

    private static final Logger log = LoggerFactory.getLogger(InMemoryLedger.class);

    /** Default liquidation period used to size flow buffers (4 hours). */
    public static final long DEFAULT_LIQUIDATION_PERIOD = 4 * 60 * 60;

    /** Default genesis timestamp. */
    public static final long DEFAULT_START_TIME = 1_700_000_000L;

    private final long liquidationPeriod;
    private final Map<Address, FlowChangeListener> listeners = new HashMap<>();
    private final Map<Long, State> snapshots = new HashMap<>();
    private long nextSnapshotId;
    private long nextAccountId = 0x10_000L;
    private State state;

    private InMemoryLedger(final long liquidationPeriod, final long startTime) {
        this.liquidationPeriod = liquidationPeriod;
        this.state = new State(startTime);
    }

    public static InMemoryLedger create() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public long liquidationPeriod() {
        return liquidationPeriod;
    }

    // ==================== Clock ====================

    @Override
    public long now() {
        return state.now;
    }

    public void advanceTime(final long seconds) {
        if (seconds < 0) {
            throw new IllegalArgumentException("cannot move time backwards");
        }
        state.now += seconds;
    }

    public void setTime(final long timestamp) {
        if (timestamp < state.now) {
            throw new IllegalArgumentException("timestamp " + timestamp + " is before now " + state.now);
        }
        state.now = timestamp;
    }

    @Override
    public Address newAccount() {
        return Address.fromId(nextAccountId++);
    }

    // ==================== Balances ====================

    public void mint(final Address token, final Address account, final BigInteger amount) {
        requirePositiveOrZero(amount, "amount");
        final Account a = settled(token, account);
        a.settled = a.settled.add(amount);
    }

    @Override
    public BigInteger balanceOf(final Address token, final Address account) {
        final Account a = accountOrNull(token, account);
        return a == null ? BigInteger.ZERO : a.availableAt(state.now);
    }

    @Override
    public RealtimeBalance realtimeBalance(final Address token, final Address account) {
        final Account a = accountOrNull(token, account);
        return a == null
                ? new RealtimeBalance(BigInteger.ZERO, BigInteger.ZERO)
                : new RealtimeBalance(a.availableAt(state.now), a.deposit);
    }

    @Override
    public void transfer(final Address token, final Address from, final Address to, final BigInteger amount) {
        requirePositiveOrZero(amount, "amount");
        if (amount.signum() == 0) {
            return;
        }
        final Account source = settled(token, from);
        if (source.settled.compareTo(amount) < 0) {
            throw new InsufficientBalanceException(from, source.settled, amount);
        }
        source.settled = source.settled.subtract(amount);
        final Account target = settled(token, to);
        target.settled = target.settled.add(amount);
    }

    // ==================== Flows ====================

    @Override
    public FlowRate flowRate(final Address token, final Address sender, final Address receiver) {
        final FlowRecord flow = state.flows.get(new FlowKey(token, sender, receiver));
        return flow == null ? FlowRate.ZERO : FlowRate.of(flow.rate());
    }

    @Override
    public void setFlow(
            final Address token,
            final Address sender,
            final Address receiver,
            final FlowRate flowRate,
            final byte[] userData,
            final GasMeter gas) {
        Objects.requireNonNull(flowRate, "flowRate");
        Objects.requireNonNull(gas, "gas");
        if (flowRate.signum() < 0) {
            throw new IllegalArgumentException("flow rate must not be negative: " + flowRate);
        }
        if (sender.equals(receiver)) {
            throw new IllegalArgumentException("sender and receiver must differ");
        }
        final FlowKey key = new FlowKey(token, sender, receiver);
        final FlowRecord previous = state.flows.get(key);
        if (previous == null && flowRate.isZero()) {
            throw new IllegalArgumentException("flow does not exist: " + sender + " -> " + receiver);
        }
        final BigInteger previousRate = previous == null ? BigInteger.ZERO : previous.rate();
        final long lastUpdated = previous == null ? state.now : previous.updatedAt();

        final LedgerSnapshot snapshot = snapshot();
        try {
            final BigInteger delta = flowRate.perSecond().subtract(previousRate);
            final Account source = settled(token, sender);
            final Account target = settled(token, receiver);
            source.netFlowRate = source.netFlowRate.subtract(delta);
            target.netFlowRate = target.netFlowRate.add(delta);
            lockDeposit(sender, source,
                    bufferFor(flowRate).subtract(bufferFor(FlowRate.of(previousRate))), true);
            if (flowRate.isZero()) {
                state.flows.remove(key);
            } else {
                state.flows.put(key, new FlowRecord(flowRate.perSecond(), state.now));
            }

            final FlowChangeListener listener = listeners.get(receiver);
            if (listener != null) {
                listener.onFlowChanged(new FlowChangeEvent(
                        token, sender, receiver, FlowRate.of(previousRate), lastUpdated,
                        flowRate, state.now, userData, gas));
            }
        } catch (RuntimeException e) {
            log.debug("Flow change {} -> {} reverted: {}", sender, receiver, e.getMessage());
            revertTo(snapshot);
            throw e;
        }
        release(snapshot);
    }

    @Override
    public BigInteger bufferFor(final FlowRate flowRate) {
        return flowRate.perSecond().max(BigInteger.ZERO).multiply(BigInteger.valueOf(liquidationPeriod));
    }

    // ==================== Pools ====================

    @Override
    public DistributionPool createPool(final Address token, final Address admin) {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(admin, "admin");
        final Address address = newAccount();
        state.pools.put(address, new PoolState(token, admin));
        return new InMemoryDistributionPool(this, address, token, admin);
    }

    @Override
    public BigInteger distribute(
            final Address token,
            final Address from,
            final DistributionPool pool,
            final BigInteger amount) {
        requirePositiveOrZero(amount, "amount");
        final PoolState p = pool(pool.address(), token);
        final BigInteger total = p.totalUnits();
        if (total.signum() == 0) {
            return BigInteger.ZERO;
        }
        final BigInteger perUnit = amount.divide(total);
        final BigInteger actual = perUnit.multiply(total);
        if (actual.signum() == 0) {
            return BigInteger.ZERO;
        }
        final Account source = settled(token, from);
        if (source.settled.compareTo(actual) < 0) {
            throw new InsufficientBalanceException(from, source.settled, actual);
        }
        source.settled = source.settled.subtract(actual);
        for (Map.Entry<Address, BigInteger> member : p.units.entrySet()) {
            final Account target = settled(token, member.getKey());
            target.settled = target.settled.add(perUnit.multiply(member.getValue()));
        }
        return actual;
    }

    @Override
    public FlowRate distributeFlow(
            final Address token,
            final Address from,
            final DistributionPool pool,
            final FlowRate requestedFlowRate) {
        if (requestedFlowRate.signum() < 0) {
            throw new IllegalArgumentException("distribution flow rate must not be negative");
        }
        final PoolState p = pool(pool.address(), token);
        applyPoolFlows(p, -1);
        if (requestedFlowRate.isZero()) {
            p.requestedRates.remove(from);
        } else {
            p.requestedRates.put(from, requestedFlowRate.perSecond());
        }
        applyPoolFlows(p, 1);
        return FlowRate.of(actualRate(requestedFlowRate.perSecond(), p.totalUnits()));
    }

    @Override
    public FlowRate estimateDistributionFlowRate(final DistributionPool pool, final FlowRate requestedFlowRate) {
        final PoolState p = pool(pool.address(), pool.token());
        return FlowRate.of(actualRate(requestedFlowRate.perSecond().max(BigInteger.ZERO), p.totalUnits()));
    }

    BigInteger memberUnits(final Address pool, final Address member) {
        return state.pools.get(pool).units.getOrDefault(member, BigInteger.ZERO);
    }

    BigInteger totalUnits(final Address pool) {
        return state.pools.get(pool).totalUnits();
    }

    Map<Address, BigInteger> members(final Address pool) {
        return Map.copyOf(state.pools.get(pool).units);
    }

    void updateMemberUnits(final Address pool, final Address member, final BigInteger units) {
        Objects.requireNonNull(member, "member");
        SafeCast.toUint128(units);
        final PoolState p = state.pools.get(pool);
        applyPoolFlows(p, -1);
        if (units.signum() == 0) {
            p.units.remove(member);
        } else {
            p.units.put(member, units);
        }
        applyPoolFlows(p, 1);
    }

    // ==================== Listeners & snapshots ====================

    @Override
    public void registerListener(final Address account, final FlowChangeListener listener) {
        Objects.requireNonNull(account, "account");
        Objects.requireNonNull(listener, "listener");
        if (listeners.putIfAbsent(account, listener) != null) {
            throw new IllegalStateException("listener already registered for " + account);
        }
    }

    @Override
    public LedgerSnapshot snapshot() {
        final long id = nextSnapshotId++;
        snapshots.put(id, state.copy());
        return new LedgerSnapshot(id);
    }

    @Override
    public void revertTo(final LedgerSnapshot snapshot) {
        final State captured = snapshots.get(snapshot.id());
        if (captured == null) {
            throw new IllegalStateException("unknown or consumed snapshot: " + snapshot.id());
        }
        state = captured;
        snapshots.keySet().removeIf(id -> id >= snapshot.id());
    }

    @Override
    public void release(final LedgerSnapshot snapshot) {
        snapshots.remove(snapshot.id());
    }

    // ==================== Internals ====================

    private Account accountOrNull(final Address token, final Address account) {
        final Map<Address, Account> byAccount = state.accounts.get(token);
        return byAccount == null ? null : byAccount.get(account);
    }

    private Account settled(final Address token, final Address account) {
        final Account a = state.accounts
                .computeIfAbsent(token, t -> new HashMap<>())
                .computeIfAbsent(account, k -> new Account(state.now));
        a.settle(state.now);
        return a;
    }

    private PoolState pool(final Address pool, final Address token) {
        final PoolState p = state.pools.get(pool);
        if (p == null) {
            throw new IllegalArgumentException("unknown pool: " + pool);
        }
        if (!p.token.equals(token)) {
            throw new IllegalArgumentException("pool " + pool + " distributes " + p.token + ", not " + token);
        }
        return p;
    }

    private void lockDeposit(final Address owner, final Account account, final BigInteger delta, final boolean checked) {
        if (checked && delta.signum() > 0 && account.settled.compareTo(delta) < 0) {
            throw new InsufficientBalanceException(owner, account.settled, delta);
        }
        account.settled = account.settled.subtract(delta);
        account.deposit = account.deposit.add(delta);
    }

    /** Adds ({@code sign = 1}) or removes ({@code sign = -1}) the effect of every distribution flow of a pool. */
    private void applyPoolFlows(final PoolState p, final int sign) {
        final BigInteger total = p.totalUnits();
        final BigInteger s = BigInteger.valueOf(sign);
        for (Map.Entry<Address, BigInteger> flow : p.requestedRates.entrySet()) {
            final BigInteger perUnit = total.signum() == 0 ? BigInteger.ZERO : flow.getValue().divide(total);
            final BigInteger actual = perUnit.multiply(total);
            final Account distributor = settled(p.token, flow.getKey());
            distributor.netFlowRate = distributor.netFlowRate.subtract(actual.multiply(s));
            lockDeposit(flow.getKey(), distributor, bufferFor(FlowRate.of(actual)).multiply(s), false);
            for (Map.Entry<Address, BigInteger> member : p.units.entrySet()) {
                final Account target = settled(p.token, member.getKey());
                target.netFlowRate = target.netFlowRate.add(perUnit.multiply(member.getValue()).multiply(s));
            }
        }
    }

    private static BigInteger actualRate(final BigInteger requested, final BigInteger totalUnits) {
        if (totalUnits.signum() == 0) {
            return BigInteger.ZERO;
        }
        return requested.divide(totalUnits).multiply(totalUnits);
    }

    private static void requirePositiveOrZero(final BigInteger amount, final String name) {
        Objects.requireNonNull(amount, name);
        if (amount.signum() < 0) {
            throw new IllegalArgumentException(name + " must not be negative: " + amount);
        }
    }

    private static final class Account {
        private BigInteger settled = BigInteger.ZERO;
        private long settledAt;
        private BigInteger netFlowRate = BigInteger.ZERO;
        private BigInteger deposit = BigInteger.ZERO;

        private Account(final long settledAt) {
            this.settledAt = settledAt;
        }

        private BigInteger availableAt(final long now) {
            return settled.add(netFlowRate.multiply(BigInteger.valueOf(now - settledAt)));
        }

        private void settle(final long now) {
            settled = availableAt(now);
            settledAt = now;
        }

        private Account copy() {
            final Account a = new Account(settledAt);
            a.settled = settled;
            a.netFlowRate = netFlowRate;
            a.deposit = deposit;
            return a;
        }
    }

    private record FlowKey(Address token, Address sender, Address receiver) {
    }

    private record FlowRecord(BigInteger rate, long updatedAt) {
    }

    private static final class PoolState {
        private final Address token;
        private final Address admin;
        private final Map<Address, BigInteger> units = new LinkedHashMap<>();
        private final Map<Address, BigInteger> requestedRates = new LinkedHashMap<>();

        private PoolState(final Address token, final Address admin) {
            this.token = token;
            this.admin = admin;
        }

        private BigInteger totalUnits() {
            return units.values().stream().reduce(BigInteger.ZERO, BigInteger::add);
        }

        private PoolState copy() {
            final PoolState p = new PoolState(token, admin);
            p.units.putAll(units);
            p.requestedRates.putAll(requestedRates);
            return p;
        }
    }

    private static final class State {
        private long now;
        private final Map<Address, Map<Address, Account>> accounts = new HashMap<>();
        private final Map<FlowKey, FlowRecord> flows = new HashMap<>();
        private final Map<Address, PoolState> pools = new LinkedHashMap<>();

        private State(final long now) {
            this.now = now;
        }

        private State copy() {
            final State s = new State(now);
            accounts.forEach((token, byAccount) -> {
                final Map<Address, Account> copied = new HashMap<>();
                byAccount.forEach((account, a) -> copied.put(account, a.copy()));
                s.accounts.put(token, copied);
            });
            s.flows.putAll(flows);
            pools.forEach((address, p) -> s.pools.put(address, p.copy()));
            return s;
        }
    }

    /**
     * Builder for {@link InMemoryLedger}.
     */
    public static final class Builder {
        private long liquidationPeriod = DEFAULT_LIQUIDATION_PERIOD;
        private long startTime = DEFAULT_START_TIME;

        private Builder() {
        }

        /**
         * Sets the liquidation period used to size flow buffers.
         *
         * @param seconds the period (must not be negative)
         * @return this builder
         */
        public Builder liquidationPeriod(final long seconds) {
            if (seconds < 0) {
                throw new IllegalArgumentException("liquidationPeriod must not be negative");
            }
            this.liquidationPeriod = seconds;
            return this;
        }

        public Builder startTime(final long timestamp) {
            if (timestamp < 0) {
                throw new IllegalArgumentException("startTime must not be negative");
            }
            this.startTime = timestamp;
            return this;
        }

        public InMemoryLedger build() {
            return new InMemoryLedger(liquidationPeriod, startTime);
        }
    }
}
