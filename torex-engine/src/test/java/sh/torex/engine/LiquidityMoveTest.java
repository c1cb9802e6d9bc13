// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.torex.engine;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import sh.torex.core.error.InsufficientProceedsException;
import sh.torex.core.error.MoverCallbackRejectedException;
import sh.torex.core.error.OutOfGasException;
import sh.torex.core.error.ReentrantMoveException;
import sh.torex.core.error.SameInstantMoveException;
import sh.torex.core.gas.GasMeter;
import sh.torex.core.types.Address;
import sh.torex.core.types.FlowRate;
import sh.torex.engine.event.ControllerError;
import sh.torex.engine.event.LiquidityMoved;
import sh.torex.engine.event.TorexEvent;
import sh.torex.engine.event.TorexFlowUpdated;

@ExtendWith(MockitoExtension.class)
class LiquidityMoveTest {

    private static final long HOUR = 3_600;
    private static final BigInteger HELD = BigInteger.valueOf(4_000L * HOUR);

    @Mock
    private TorexController controller;

    /** Two traders at 1000/s and 3000/s, one hour into the cycle. */
    private TorexFixture streaming(final TorexController c) {
        final TorexFixture fx = new TorexFixture(c);
        fx.setFlow(fx.fundedTrader(), 1_000);
        fx.setFlow(fx.fundedTrader(), 3_000);
        fx.ledger.advanceTime(HOUR);
        return fx;
    }

    @Test
    void benchmarkQuoteIsDiscountedTwap() {
        final TorexFixture fx = new TorexFixture(new ZeroFeeController());
        fx.ledger.advanceTime(600);

        final BenchmarkQuote quote = fx.torex.getBenchmarkQuote(BigInteger.valueOf(1_000_000));

        assertEquals(BigInteger.valueOf(2_000_000), quote.twap());
        assertEquals(BigInteger.valueOf(1_980_000), quote.minOutAmount());
        assertEquals(600, quote.duration());
    }

    @Test
    void exactProceedsAreDistributedByContribution() {
        final TorexFixture fx = new TorexFixture(new ZeroFeeController());
        final Address small = fx.fundedTrader();
        final Address large = fx.fundedTrader();
        fx.setFlow(small, 1_000);
        fx.setFlow(large, 3_000);
        fx.ledger.advanceTime(HOUR);
        final TestMover mover = fx.mover();

        final BenchmarkQuote estimate = fx.torex.getLiquidityEstimations();
        assertEquals(HELD, estimate.inAmount());

        final LiquidityMoveResult result = fx.torex.moveLiquidity(mover, new byte[0]);

        final BigInteger y = estimate.minOutAmount();
        final BigInteger perUnit = y.divide(BigInteger.valueOf(4_000));
        assertEquals(HELD, result.inAmount());
        assertEquals(y, result.outAmount());
        assertEquals(perUnit.multiply(BigInteger.valueOf(4_000)), result.actualOutAmount());
        assertEquals(HOUR, result.durationSinceLastLME());

        assertEquals(BigInteger.ZERO, fx.inBalance(fx.torex.address()));
        assertEquals(HELD, fx.inBalance(mover.address()));
        assertEquals(perUnit.multiply(BigInteger.valueOf(1_000)), fx.outBalance(small));
        assertEquals(perUnit.multiply(BigInteger.valueOf(3_000)), fx.outBalance(large));
        assertEquals(y.subtract(result.actualOutAmount()), fx.outBalance(fx.torex.address()));

        assertEquals(fx.ledger.now(), fx.torex.lastLiquidityMovedTime());
        assertEquals(fx.ledger.now(), fx.observer.lastCheckpoint());
    }

    @Test
    void insufficientProceedsRevertEverything() {
        final TorexFixture fx = streaming(new ZeroFeeController());
        final TestMover mover = fx.mover().supplying(y -> y.subtract(BigInteger.ONE));
        final long createdAt = fx.torex.lastLiquidityMovedTime();

        final InsufficientProceedsException ex = assertThrows(InsufficientProceedsException.class,
                () -> fx.torex.moveLiquidity(mover, new byte[0]));

        assertEquals(ex.minOutAmount().subtract(BigInteger.ONE), ex.outAmount());
        assertEquals(HELD, fx.inBalance(fx.torex.address()));
        assertEquals(BigInteger.ZERO, fx.inBalance(mover.address()));
        assertEquals(TorexFixture.INITIAL_BALANCE, fx.outBalance(mover.address()));
        assertEquals(BigInteger.ZERO, fx.outBalance(fx.torex.address()));
        assertEquals(createdAt, fx.torex.lastLiquidityMovedTime());
        assertEquals(1, fx.observer.checkpointCount());
    }

    @Test
    void surplusProceedsAreDistributed() {
        final TorexFixture fx = streaming(new ZeroFeeController());
        final TestMover mover = fx.mover().supplying(y -> y.multiply(BigInteger.TWO));

        final LiquidityMoveResult result = fx.torex.moveLiquidity(mover, new byte[0]);

        assertEquals(result.minOutAmount().multiply(BigInteger.TWO), result.outAmount());
    }

    @Test
    void secondMoveAtSameInstantFails() {
        final TorexFixture fx = streaming(new ZeroFeeController());
        fx.torex.moveLiquidity(fx.mover(), new byte[0]);

        final SameInstantMoveException ex = assertThrows(SameInstantMoveException.class,
                () -> fx.torex.moveLiquidity(fx.mover(), new byte[0]));
        assertEquals(fx.ledger.now(), ex.timestamp());
    }

    @Test
    void moveAtCreationInstantFails() {
        final TorexFixture fx = new TorexFixture(new ZeroFeeController());

        assertThrows(SameInstantMoveException.class, () -> fx.torex.moveLiquidity(fx.mover(), null));
    }

    @Test
    void rejectedCallbackReverts() {
        final TorexFixture fx = streaming(new ZeroFeeController());
        final TestMover mover = fx.mover().acknowledging(false);

        assertThrows(MoverCallbackRejectedException.class, () -> fx.torex.moveLiquidity(mover, new byte[0]));

        assertEquals(HELD, fx.inBalance(fx.torex.address()));
        assertEquals(TorexFixture.INITIAL_BALANCE, fx.outBalance(mover.address()));
    }

    @Test
    void reentrantMoveIsRejected() {
        final TorexFixture fx = streaming(new ZeroFeeController());
        final TestMover inner = fx.mover();
        final AtomicReference<RuntimeException> reentry = new AtomicReference<>();
        final TestMover outer = fx.mover().onCallback(() -> reentry.set(assertThrows(
                ReentrantMoveException.class, () -> fx.torex.moveLiquidity(inner, new byte[0]))));

        fx.torex.moveLiquidity(outer, new byte[0]);

        assertNotNull(reentry.get());
        assertEquals(0, inner.calls());
        fx.ledger.advanceTime(60);
        fx.torex.moveLiquidity(inner, new byte[0]);
        assertEquals(1, inner.calls());
    }

    @Test
    void controllerFailureIsContained() {
        when(controller.onInFlowChanged(any(), any())).thenReturn(FlowRate.ZERO);
        when(controller.onLiquidityMoved(any(), any())).thenThrow(new IllegalStateException("boom"));
        final TorexFixture fx = streaming(controller);
        final List<TorexEvent> events = new ArrayList<>();
        fx.torex.addListener(events::add);

        fx.torex.moveLiquidity(fx.mover(), new byte[0]);

        assertEquals(1, fx.torex.controllerInternalErrorCounter());
        assertEquals(BigInteger.ZERO, fx.inBalance(fx.torex.address()));
        assertEquals(2, events.size());
        assertEquals(Torex.SITE_LIQUIDITY_MOVED, ((ControllerError) events.get(0)).site());
        assertInstanceOf(LiquidityMoved.class, events.get(1));
    }

    @Test
    void unacknowledgedControllerIsCounted() {
        when(controller.onInFlowChanged(any(), any())).thenReturn(FlowRate.ZERO);
        when(controller.onLiquidityMoved(any(), any())).thenReturn(false);
        final TorexFixture fx = streaming(controller);

        fx.torex.moveLiquidity(fx.mover(), new byte[0]);

        assertEquals(1, fx.torex.controllerInternalErrorCounter());
    }

    @Test
    void underFundedGasExhaustionReverts() {
        when(controller.onInFlowChanged(any(), any())).thenReturn(FlowRate.ZERO);
        when(controller.onLiquidityMoved(any(), any())).thenAnswer(inv -> {
            final GasMeter gas = inv.getArgument(1);
            gas.consume(gas.remaining() + 1);
            return true;
        });
        final TorexFixture fx = streaming(controller);
        final TestMover mover = fx.mover();
        final long createdAt = fx.torex.lastLiquidityMovedTime();

        assertThrows(OutOfGasException.class,
                () -> fx.torex.moveLiquidity(mover, new byte[0], GasMeter.of(1_000_000)));

        assertEquals(HELD, fx.inBalance(fx.torex.address()));
        assertEquals(TorexFixture.INITIAL_BALANCE, fx.outBalance(mover.address()));
        assertEquals(createdAt, fx.torex.lastLiquidityMovedTime());
        assertEquals(0, fx.torex.controllerInternalErrorCounter());
    }

    @Test
    void fullyFundedGasExhaustionIsContained() {
        when(controller.onInFlowChanged(any(), any())).thenReturn(FlowRate.ZERO);
        when(controller.onLiquidityMoved(any(), any())).thenAnswer(inv -> {
            final GasMeter gas = inv.getArgument(1);
            gas.consume(gas.remaining() + 1);
            return true;
        });
        final TorexFixture fx = streaming(controller);

        fx.torex.moveLiquidity(fx.mover(), new byte[0], GasMeter.of(5_000_000));

        assertEquals(1, fx.torex.controllerInternalErrorCounter());
        assertEquals(BigInteger.ZERO, fx.inBalance(fx.torex.address()));
    }

    @Test
    void flowChangeInsideRevertedMoveIsUndone() {
        final TorexFixture fx = streaming(new ZeroFeeController());
        final List<TorexEvent> events = new ArrayList<>();
        fx.torex.addListener(events::add);
        final Address sneaky = fx.fundedTrader();
        final TestMover mover = fx.mover()
                .onCallback(() -> fx.setFlow(sneaky, 5_000))
                .supplying(y -> y.subtract(BigInteger.ONE));

        assertThrows(InsufficientProceedsException.class, () -> fx.torex.moveLiquidity(mover, new byte[0]));

        assertEquals(TraderState.ZERO, fx.torex.traderState(sneaky));
        assertEquals(FlowRate.ZERO, fx.ledger.flowRate(TorexFixture.IN_TOKEN, sneaky, fx.torex.address()));
        assertEquals(BigInteger.ZERO, fx.torex.outTokenDistributionPool().memberUnits(sneaky));
        assertEquals(TorexFixture.INITIAL_BALANCE, fx.inBalance(sneaky));
        assertTrue(events.isEmpty());
    }

    @Test
    void flowChangeInsideMoveIsReportedBeforeTheMove() {
        final TorexFixture fx = streaming(new ZeroFeeController());
        final List<TorexEvent> events = new ArrayList<>();
        fx.torex.addListener(events::add);
        final Address joiner = fx.fundedTrader();
        final TestMover mover = fx.mover().onCallback(() -> fx.setFlow(joiner, 5_000));

        fx.torex.moveLiquidity(mover, new byte[0]);

        assertEquals(FlowRate.of(5_000), fx.torex.traderState(joiner).contribFlowRate());
        assertEquals(2, events.size());
        assertEquals(joiner, ((TorexFlowUpdated) events.get(0)).trader());
        assertInstanceOf(LiquidityMoved.class, events.get(1));
    }

    @Test
    void failedControllerHookLeavesNoSideEffects() {
        final Address attacker = Address.fromId(0xBAD);
        final AtomicReference<TorexFixture> fixture = new AtomicReference<>();
        final AtomicReference<Address> trader = new AtomicReference<>();
        final MeddlingController meddling = new MeddlingController(torex -> {
            torex.feeDistributionPool().updateMemberUnits(attacker, BigInteger.valueOf(1_000));
            fixture.get().setFlow(trader.get(), 7_000);
        });
        final TorexFixture fx = streaming(meddling);
        fixture.set(fx);
        trader.set(fx.fundedTrader());
        final List<TorexEvent> events = new ArrayList<>();
        fx.torex.addListener(events::add);

        fx.torex.moveLiquidity(fx.mover(), new byte[0]);

        assertEquals(BigInteger.ZERO, fx.torex.feeDistributionPool().memberUnits(attacker));
        assertEquals(TraderState.ZERO, fx.torex.traderState(trader.get()));
        assertEquals(FlowRate.ZERO, fx.ledger.flowRate(TorexFixture.IN_TOKEN, trader.get(), fx.torex.address()));
        assertEquals(1, fx.torex.controllerInternalErrorCounter());
        assertEquals(BigInteger.ZERO, fx.inBalance(fx.torex.address()));
        assertEquals(2, events.size());
        assertInstanceOf(ControllerError.class, events.get(0));
        assertInstanceOf(LiquidityMoved.class, events.get(1));
    }

    /** Charges no fee, then meddles with the exchange and fails on every movement. */
    private static final class MeddlingController implements TorexController {

        private final Consumer<Torex> meddle;
        private Torex torex;

        MeddlingController(final Consumer<Torex> meddle) {
            this.meddle = meddle;
        }

        @Override
        public void onRegistered(final Torex torex) {
            this.torex = torex;
        }

        @Override
        public FlowRate onInFlowChanged(final TraderFlowUpdate update, final GasMeter gas) {
            return FlowRate.ZERO;
        }

        @Override
        public boolean onLiquidityMoved(final LiquidityMoveResult result, final GasMeter gas) {
            meddle.accept(torex);
            throw new IllegalStateException("meddled");
        }
    }
}
