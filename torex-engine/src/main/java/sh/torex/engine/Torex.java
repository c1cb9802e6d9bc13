// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.torex.engine;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.torex.core.DebugLogger;
import sh.torex.core.LogFormatter;
import sh.torex.core.TorexDebug.Channel;
import sh.torex.core.error.UnsupportedTokenException;
import sh.torex.core.gas.GasMeter;
import sh.torex.core.math.BackAdjustment;
import sh.torex.core.math.FeeCeiling;
import sh.torex.core.math.SafeCast;
import sh.torex.core.types.Address;
import sh.torex.core.types.FlowRate;
import sh.torex.engine.event.ControllerError;
import sh.torex.engine.event.LiquidityMoved;
import sh.torex.engine.event.TorexEvent;
import sh.torex.engine.event.TorexEventListener;
import sh.torex.engine.event.TorexFlowUpdated;
import sh.torex.engine.host.DistributionPool;
import sh.torex.engine.host.FlowChangeEvent;
import sh.torex.engine.host.FlowChangeListener;
import sh.torex.engine.host.HostLedger;
import sh.torex.engine.host.LedgerSnapshot;

/**
 * A continuous-time liquidity exchange of one in-token for one out-token.
 *
 * <p>
 * Traders stream in-token to the exchange. Each trader's gross rate is split into a fee rate,
 * chosen by the {@link TorexController} and streamed on to the fee-distribution pool, and a
 * contribution rate, which sets the trader's units in the out-token distribution pool. Any
 * {@link LiquidityMover} may periodically take the accumulated in-token and must leave at least
 * the discounted benchmark amount of out-token, which is then distributed by units.
 *
 * <h2>Back-adjustment</h2>
 * <p>
 * Units change immediately when a rate changes, while out-token is only distributed at the next
 * movement. To keep shares fair within a movement cycle, a rate change settles the difference
 * since the last movement at once: an increase is charged as if the new rate had been streamed
 * since the last movement, a decrease is refunded. Fees are never refunded. The fee-distribution
 * buffer is charged to the trader whose change grows it and refunded to the one whose change
 * shrinks it. A deletion never fails: its refund is capped at the exchange's balance.
 *
 * <h2>Atomicity</h2>
 * <p>
 * {@link #onFlowChanged} and {@link #moveLiquidity} either complete or leave no trace, including
 * when they run nested inside another operation that later fails: a flow change made from a
 * mover's callback is undone with the movement. Events are queued while any operation is open and
 * delivered to listeners, in order, once the outermost one committed.
 *
 * <p>Not thread-safe; the host executes one operation at a time.
 *
 * @see TorexFactory
 */
public final class Torex implements FlowChangeListener {

    private static final Logger log = LoggerFactory.getLogger(Torex.class);

    static final String SITE_IN_FLOW_CHANGED = "onInFlowChanged";
    static final String SITE_LIQUIDITY_MOVED = "onLiquidityMoved";

    private final Address address;
    private final TorexConfig config;
    private final HostLedger ledger;
    private final DistributionPool outTokenDistributionPool;
    private final DistributionPool feeDistributionPool;
    private final ControllerHookDispatcher dispatcher;
    private final LiquidityMoveEngine engine;
    private final TraderLedger traders = new TraderLedger();
    private final List<TorexEventListener> listeners = new CopyOnWriteArrayList<>();
    private final List<TorexEvent> pendingEvents = new ArrayList<>();

    private FeeDistributionState feeDistributionState = FeeDistributionState.ZERO;
    private long controllerInternalErrorCounter;
    private int depth;

    Torex(
            final Address address,
            final TorexConfig config,
            final HostLedger ledger,
            final DistributionPool outTokenDistributionPool,
            final DistributionPool feeDistributionPool) {
        this.address = Objects.requireNonNull(address, "address");
        this.config = Objects.requireNonNull(config, "config");
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.outTokenDistributionPool = Objects.requireNonNull(outTokenDistributionPool, "outTokenDistributionPool");
        this.feeDistributionPool = Objects.requireNonNull(feeDistributionPool, "feeDistributionPool");
        this.dispatcher = new ControllerHookDispatcher(
                config.controllerSafeCallbackGasLimit(), ledger, this::captureState);
        this.engine = new LiquidityMoveEngine(
                address, config, ledger, outTokenDistributionPool, dispatcher, ledger.now());
    }

    // ==================== Queries ====================

    public Address address() {
        return address;
    }

    public TorexConfig config() {
        return config;
    }

    public TokenPair getPairedTokens() {
        return new TokenPair(config.inToken(), config.outToken());
    }

    public DistributionPool outTokenDistributionPool() {
        return outTokenDistributionPool;
    }

    public DistributionPool feeDistributionPool() {
        return feeDistributionPool;
    }

    public TraderState traderState(final Address trader) {
        return traders.get(trader);
    }

    public FeeDistributionState feeDistributionState() {
        return feeDistributionState;
    }

    public long controllerInternalErrorCounter() {
        return controllerInternalErrorCounter;
    }

    public long lastLiquidityMovedTime() {
        return engine.lastLiquidityMovedTime();
    }

    /** In-token held by the exchange, excluding the fee-distribution buffer. */
    public BigInteger availableInTokens() {
        return engine.availableInTokens();
    }

    public BenchmarkQuote getBenchmarkQuote(final BigInteger inAmount) {
        return engine.benchmarkQuote(inAmount);
    }

    /** Benchmark quote for all {@link #availableInTokens() available} in-token. */
    public BenchmarkQuote getLiquidityEstimations() {
        return engine.liquidityEstimations();
    }

    /**
     * In-token a new trader must allow the exchange to debit when opening a flow of
     * {@code flowRate} now: the back-adjustment since the last movement plus the fee-distribution
     * buffer growth, assuming the controller takes the maximum allowed fee.
     */
    public BigInteger estimateApprovalRequired(final FlowRate flowRate) {
        Objects.requireNonNull(flowRate, "flowRate");
        if (flowRate.signum() <= 0) {
            return BigInteger.ZERO;
        }
        final long elapsed = ledger.now() - engine.lastLiquidityMovedTime();
        final FlowRate maxFee = FeeCeiling.maxFeeRate(flowRate, config.maxAllowedFeePM());
        final FlowRate requested = feeDistributionState.requestedFlowRate().plus(maxFee);
        final BigInteger buffer = ledger.bufferFor(
                ledger.estimateDistributionFlowRate(feeDistributionPool, requested));
        return flowRate.over(elapsed).add(buffer.subtract(feeDistributionState.buffer()).max(BigInteger.ZERO));
    }

    public TorexDetails debugCurrentDetails() {
        return new TorexDetails(
                address,
                config.inToken(),
                config.outToken(),
                ledger.now(),
                engine.lastLiquidityMovedTime(),
                controllerInternalErrorCounter,
                feeDistributionState,
                engine.availableInTokens(),
                outTokenDistributionPool.totalUnits(),
                Map.copyOf(traders.entries()));
    }

    public void addListener(final TorexEventListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(final TorexEventListener listener) {
        listeners.remove(listener);
    }

    // ==================== Liquidity movement ====================

    public LiquidityMoveResult moveLiquidity(final LiquidityMover mover, final byte[] moverData) {
        return moveLiquidity(mover, moverData, GasMeter.unlimited());
    }

    /**
     * Executes one liquidity movement.
     *
     * @param mover     the liquidity mover, paid the available in-token
     * @param moverData opaque data passed to the mover's callback
     * @param gas       execution budget of the call
     * @return the movement result
     * @throws sh.torex.core.error.ReentrantMoveException        if a movement is in progress
     * @throws sh.torex.core.error.SameInstantMoveException      if liquidity already moved at this timestamp
     * @throws sh.torex.core.error.InsufficientProceedsException if the mover left too little out-token
     * @throws sh.torex.core.error.OutOfGasException             if {@code gas} could not fund the controller hook
     */
    public LiquidityMoveResult moveLiquidity(final LiquidityMover mover, final byte[] moverData, final GasMeter gas) {
        return atomically(() -> doMoveLiquidity(mover, moverData, gas));
    }

    private LiquidityMoveResult doMoveLiquidity(final LiquidityMover mover, final byte[] moverData, final GasMeter gas) {
        final LiquidityMoveEngine.MoveOutcome outcome = engine.move(mover, moverData, gas);
        if (outcome.controllerFailure() != null) {
            recordControllerError(outcome.timestamp(), SITE_LIQUIDITY_MOVED, outcome.controllerFailure());
        }
        emit(new LiquidityMoved(outcome.timestamp(), mover.address(), outcome.result()));
        return outcome.result();
    }

    // ==================== Flow changes ====================

    @Override
    public void onFlowChanged(final FlowChangeEvent event) {
        Objects.requireNonNull(event, "event");
        atomically(() -> {
            applyFlowChange(event);
            return null;
        });
    }

    private void applyFlowChange(final FlowChangeEvent event) {
        if (!event.token().equals(config.inToken())) {
            throw new UnsupportedTokenException(event.token());
        }
        if (!event.receiver().equals(address)) {
            throw new IllegalArgumentException("flow receiver " + event.receiver() + " is not " + address);
        }
        final long now = event.timestamp();
        final Address trader = event.sender();
        final TraderState prev = traders.get(trader);
        final FlowRate newFlowRate = event.newFlowRate();

        final TraderFlowUpdate update = new TraderFlowUpdate(
                trader, event.previousFlowRate(), prev.feeFlowRate(), event.lastUpdated(),
                newFlowRate, now, event.userData());
        String controllerFailure = null;
        final FlowRate requestedFee;
        if (event.isDeletion()) {
            final SafeCallResult<FlowRate> result = dispatcher.safeCall(SITE_IN_FLOW_CHANGED, event.gas(),
                    g -> config.controller().onInFlowChanged(update, g));
            controllerFailure = result.failureReason();
            requestedFee = result.orElse(FlowRate.ZERO);
        } else {
            requestedFee = Objects.requireNonNull(
                    dispatcher.unsafeCall(event.gas(), g -> config.controller().onInFlowChanged(update, g)),
                    "controller returned no fee flow rate");
        }

        final FlowRate newFee = FeeCeiling.clamp(newFlowRate, requestedFee, config.maxAllowedFeePM());
        final FlowRate newContrib = newFlowRate.minus(newFee);

        final FlowRate requestedFeeDist = feeDistributionState.requestedFlowRate()
                .plus(newFee).minus(prev.feeFlowRate());
        final FlowRate estimatedFeeDist =
                ledger.estimateDistributionFlowRate(feeDistributionPool, requestedFeeDist);
        final BigInteger newBuffer = ledger.bufferFor(estimatedFeeDist);
        final long elapsed = now - engine.lastLiquidityMovedTime();
        final BackAdjustment adjustment = BackAdjustment.compute(
                prev.contribFlowRate(), newContrib, prev.feeFlowRate(), newFee,
                elapsed, feeDistributionState.buffer(), newBuffer);
        final BigInteger units = SafeCast.toUint128(
                config.outTokenDistributionPoolScaler().scaleValue(newContrib.perSecond()));

        final LedgerSnapshot snapshot = ledger.snapshot();
        final FlowRate actualFeeDist;
        try {
            if (adjustment.isCharge()) {
                ledger.transfer(config.inToken(), trader, address, adjustment.totalCharge());
                if (adjustment.feeCharge().signum() > 0) {
                    ledger.distribute(config.inToken(), address, feeDistributionPool, adjustment.feeCharge());
                }
            }
            actualFeeDist = ledger.distributeFlow(config.inToken(), address, feeDistributionPool, requestedFeeDist);
            outTokenDistributionPool.updateMemberUnits(trader, units);
            if (adjustment.isRefund()) {
                ledger.transfer(config.inToken(), address, trader,
                        event.isDeletion() ? cappedRefund(trader, adjustment.refund()) : adjustment.refund());
            }
        } catch (RuntimeException e) {
            log.debug("Flow update of {} reverted: {}", trader, e.getMessage());
            ledger.revertTo(snapshot);
            throw e;
        }
        ledger.release(snapshot);

        traders.put(trader, new TraderState(newContrib, newFee));
        feeDistributionState = new FeeDistributionState(requestedFeeDist, actualFeeDist, ledger.bufferFor(actualFeeDist));

        log.debug("Flow of {} updated to {} (contrib {}, fee {}), back-adjustment {}",
                trader, newFlowRate, newContrib, newFee, adjustment.contribution());
        DebugLogger.log(Channel.FLOW, LogFormatter.formatFlowUpdate(trader, newFlowRate, newContrib, adjustment.contribution()));

        if (controllerFailure != null) {
            recordControllerError(now, SITE_IN_FLOW_CHANGED, controllerFailure);
        }
        emit(new TorexFlowUpdated(now, trader, newFlowRate, newContrib, adjustment.contribution(),
                requestedFeeDist, actualFeeDist));
    }

    // ==================== Internals ====================

    /** A deletion must not fail, so its refund is limited to what the exchange holds. */
    private BigInteger cappedRefund(final Address trader, final BigInteger refund) {
        final BigInteger held = ledger.balanceOf(config.inToken(), address).max(BigInteger.ZERO);
        if (refund.compareTo(held) <= 0) {
            return refund;
        }
        log.warn("Deletion refund to {} capped at {} (owed {})", trader, held, refund);
        return held;
    }

    private void recordControllerError(final long timestamp, final String site, final String reason) {
        controllerInternalErrorCounter++;
        log.warn("Controller {} failed (error #{}): {}", site, controllerInternalErrorCounter, reason);
        DebugLogger.log(Channel.CONTROLLER, LogFormatter.formatControllerError(site, reason));
        emit(new ControllerError(timestamp, site, reason));
    }

    /**
     * Runs {@code operation}, restoring this exchange's own state if it throws. Ledger state is
     * reverted by the operation itself or by the ledger operation that called into it.
     */
    private <T> T atomically(final Supplier<T> operation) {
        final Runnable restore = captureState();
        depth++;
        final T result;
        try {
            result = operation.get();
        } catch (RuntimeException e) {
            restore.run();
            throw e;
        } finally {
            depth--;
        }
        if (depth == 0) {
            flushEvents();
        }
        return result;
    }

    private Runnable captureState() {
        final Map<Address, TraderState> tradersBefore = traders.snapshot();
        final FeeDistributionState feeBefore = feeDistributionState;
        final long errorsBefore = controllerInternalErrorCounter;
        final int eventsBefore = pendingEvents.size();
        return () -> {
            traders.restore(tradersBefore);
            feeDistributionState = feeBefore;
            controllerInternalErrorCounter = errorsBefore;
            pendingEvents.subList(eventsBefore, pendingEvents.size()).clear();
        };
    }

    private void emit(final TorexEvent event) {
        pendingEvents.add(event);
    }

    private void flushEvents() {
        while (!pendingEvents.isEmpty()) {
            deliver(pendingEvents.remove(0));
        }
    }

    private void deliver(final TorexEvent event) {
        for (TorexEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.error("Exception in event listener for {}", event.getClass().getSimpleName(), e);
            }
        }
    }

    @Override
    public String toString() {
        return "Torex{address=" + address + ", inToken=" + config.inToken() + ", outToken=" + config.outToken() + '}';
    }
}
