// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.torex.engine;

import java.util.Objects;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.torex.core.error.OutOfGasException;
import sh.torex.core.gas.GasMeter;
import sh.torex.engine.host.HostLedger;
import sh.torex.engine.host.LedgerSnapshot;

/**
 * Invokes controller hooks under one of two failure policies.
 *
 * <p>
 * <strong>Unsafe calls</strong> run on the caller's own budget and let every failure propagate.
 *
 * <p>
 * <strong>Safe calls</strong> run on a child budget of at most {@code safeCallbackGasLimit}:
 * <ul>
 * <li>Success returns the hook's value.</li>
 * <li>Any failure is captured as a {@link SafeCallResult#failure(String) failure result}; the
 * caller decides on a default.</li>
 * <li>Running out of gas is captured too, but only when the hook was granted the full limit. If
 * the caller supplied less, the caller's own budget is exhausted and the {@link OutOfGasException}
 * propagates, so under-funding a call cannot be used to skip the hook.</li>
 * </ul>
 * A failed safe call leaves no trace: ledger changes made by the hook are reverted and the
 * caller's {@link StateCapture captured state} is restored before the failure is returned or the
 * exhaustion propagates. {@link Error}s are never captured.
 */
public final class ControllerHookDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ControllerHookDispatcher.class);

    private final long safeCallbackGasLimit;
    private final HostLedger ledger;
    private final StateCapture local;

    public ControllerHookDispatcher(final long safeCallbackGasLimit, final HostLedger ledger) {
        this(safeCallbackGasLimit, ledger, () -> () -> { });
    }

    ControllerHookDispatcher(final long safeCallbackGasLimit, final HostLedger ledger, final StateCapture local) {
        if (safeCallbackGasLimit <= 0) {
            throw new IllegalArgumentException("safeCallbackGasLimit must be positive");
        }
        this.safeCallbackGasLimit = safeCallbackGasLimit;
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.local = Objects.requireNonNull(local, "local");
    }

    public long safeCallbackGasLimit() {
        return safeCallbackGasLimit;
    }

    public <T> SafeCallResult<T> safeCall(final String site, final GasMeter caller, final Function<GasMeter, T> hook) {
        final GasMeter child = caller.fork(safeCallbackGasLimit);
        final LedgerSnapshot snapshot = ledger.snapshot();
        final Runnable restore = local.capture();
        try {
            final T value = hook.apply(child);
            ledger.release(snapshot);
            caller.join(child);
            return SafeCallResult.success(value);
        } catch (OutOfGasException e) {
            rollback(snapshot, restore);
            caller.join(child);
            if (child.limit() < safeCallbackGasLimit) {
                log.warn("Controller {} ran out of an under-funded budget ({} < {}), propagating",
                        site, child.limit(), safeCallbackGasLimit);
                caller.exhaust();
            }
            return SafeCallResult.failure(describe(e));
        } catch (RuntimeException e) {
            log.debug("Controller {} failed, rolling back: {}", site, e.getMessage());
            rollback(snapshot, restore);
            caller.join(child);
            return SafeCallResult.failure(describe(e));
        }
    }

    public <T> T unsafeCall(final GasMeter caller, final Function<GasMeter, T> hook) {
        return hook.apply(caller);
    }

    private void rollback(final LedgerSnapshot snapshot, final Runnable restore) {
        ledger.revertTo(snapshot);
        restore.run();
    }

    private static String describe(final RuntimeException e) {
        final String message = e.getMessage();
        return message == null ? e.getClass().getSimpleName() : e.getClass().getSimpleName() + ": " + message;
    }

    /**
     * Captures state held outside the ledger before a safe call.
     */
    @FunctionalInterface
    interface StateCapture {

        /**
         * @return action restoring the captured state
         */
        Runnable capture();
    }
}
