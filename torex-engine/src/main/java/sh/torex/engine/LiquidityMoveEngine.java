// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.torex.engine;

import java.math.BigInteger;
import java.util.Objects;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.torex.core.DebugLogger;
import sh.torex.core.LogFormatter;
import sh.torex.core.TorexDebug.Channel;
import sh.torex.core.error.InsufficientProceedsException;
import sh.torex.core.error.MoverCallbackRejectedException;
import sh.torex.core.error.ReentrantMoveException;
import sh.torex.core.error.SameInstantMoveException;
import sh.torex.core.gas.GasMeter;
import sh.torex.core.types.Address;
import sh.torex.engine.host.DistributionPool;
import sh.torex.engine.host.HostLedger;
import sh.torex.engine.host.LedgerSnapshot;

/**
 * Quoting and the liquidity movement protocol of one exchange.
 *
 * <h2>Movement steps</h2>
 * <ol>
 * <li>Reject a reentrant call, then a call at the timestamp of the previous movement.</li>
 * <li>Quote all available in-token against the discounted benchmark.</li>
 * <li>Transfer the in-token to the mover and invoke its callback.</li>
 * <li>Measure the exchange's out-token balance; fail if it is below the floor.</li>
 * <li>Distribute the out-token through the out-token pool.</li>
 * <li>Notify the controller under a safe call.</li>
 * <li>Advance the observer checkpoint and the last-movement time.</li>
 * </ol>
 * Every step up to the checkpoint runs inside a ledger snapshot that is reverted on failure. The
 * checkpoint is advanced last so an aborted movement never moves the benchmark clock.
 */
final class LiquidityMoveEngine {

    private static final Logger log = LoggerFactory.getLogger(LiquidityMoveEngine.class);

    private final Address torex;
    private final TorexConfig config;
    private final HostLedger ledger;
    private final DistributionPool outTokenDistributionPool;
    private final ControllerHookDispatcher dispatcher;

    private long lastLiquidityMovedTime;
    private boolean moving;

    LiquidityMoveEngine(
            final Address torex,
            final TorexConfig config,
            final HostLedger ledger,
            final DistributionPool outTokenDistributionPool,
            final ControllerHookDispatcher dispatcher,
            final long createdAt) {
        this.torex = torex;
        this.config = config;
        this.ledger = ledger;
        this.outTokenDistributionPool = outTokenDistributionPool;
        this.dispatcher = dispatcher;
        this.lastLiquidityMovedTime = createdAt;
    }

    long lastLiquidityMovedTime() {
        return lastLiquidityMovedTime;
    }

    BigInteger availableInTokens() {
        return ledger.balanceOf(config.inToken(), torex).max(BigInteger.ZERO);
    }

    BenchmarkQuote benchmarkQuote(final BigInteger inAmount) {
        Objects.requireNonNull(inAmount, "inAmount");
        if (inAmount.signum() < 0) {
            throw new IllegalArgumentException("inAmount must not be negative");
        }
        final TwapQuote quote = config.observer().twapSinceLastCheckpoint(ledger.now(), inAmount);
        final BigInteger twap = config.twapScaler().scaleValue(quote.outAmount());
        final BigInteger minOutAmount = config.discountFactor().discountedValue(twap, quote.duration());
        DebugLogger.log(Channel.MOVE, LogFormatter.formatQuote(inAmount, twap, minOutAmount, quote.duration()));
        return new BenchmarkQuote(inAmount, minOutAmount, quote.duration(), twap);
    }

    BenchmarkQuote liquidityEstimations() {
        return benchmarkQuote(availableInTokens());
    }

    MoveOutcome move(final LiquidityMover mover, final byte[] moverData, final GasMeter gas) {
        Objects.requireNonNull(mover, "mover");
        Objects.requireNonNull(gas, "gas");
        if (moving) {
            throw new ReentrantMoveException();
        }
        moving = true;
        try {
            return doMove(mover, moverData == null ? new byte[0] : moverData, gas);
        } finally {
            moving = false;
        }
    }

    private MoveOutcome doMove(final LiquidityMover mover, final byte[] moverData, final GasMeter gas) {
        final long now = ledger.now();
        if (now == lastLiquidityMovedTime) {
            throw new SameInstantMoveException(now);
        }
        final long duration = now - lastLiquidityMovedTime;
        final BenchmarkQuote quote = liquidityEstimations();

        final LedgerSnapshot snapshot = ledger.snapshot();
        final LiquidityMoveResult result;
        final SafeCallResult<Boolean> ack;
        try {
            ledger.transfer(config.inToken(), torex, mover.address(), quote.inAmount());
            if (!mover.moveLiquidityCallback(
                    config.inToken(), config.outToken(), quote.inAmount(), quote.minOutAmount(), moverData)) {
                throw new MoverCallbackRejectedException();
            }

            final BigInteger outAmount = ledger.balanceOf(config.outToken(), torex);
            if (outAmount.compareTo(quote.minOutAmount()) < 0) {
                throw new InsufficientProceedsException(quote.minOutAmount(), outAmount);
            }

            final BigInteger actualOutAmount =
                    ledger.distribute(config.outToken(), torex, outTokenDistributionPool, outAmount);
            result = new LiquidityMoveResult(
                    duration, quote.twap(), quote.inAmount(), quote.minOutAmount(), outAmount, actualOutAmount);

            ack = dispatcher.safeCall(Torex.SITE_LIQUIDITY_MOVED, gas,
                    g -> config.controller().onLiquidityMoved(result, g));

            config.observer().createCheckpoint(now);
        } catch (RuntimeException e) {
            log.debug("Liquidity movement by {} reverted: {}", mover.address(), e.getMessage());
            ledger.revertTo(snapshot);
            throw e;
        }
        ledger.release(snapshot);
        lastLiquidityMovedTime = now;

        log.info("Liquidity moved by {}: in={} out={} distributed={} after {}s",
                mover.address(), result.inAmount(), result.outAmount(), result.actualOutAmount(), duration);
        DebugLogger.log(Channel.MOVE, LogFormatter.formatLiquidityMoved(
                mover.address(), result.inAmount(), result.outAmount(), result.actualOutAmount(), duration));

        final String controllerFailure = ack.isSuccess() && !Boolean.TRUE.equals(ack.value())
                ? "onLiquidityMoved not acknowledged"
                : ack.failureReason();
        return new MoveOutcome(now, result, controllerFailure);
    }

    /**
     * @param controllerFailure contained controller failure to record, null if none
     */
    record MoveOutcome(long timestamp, LiquidityMoveResult result, @Nullable String controllerFailure) {
    }
}
