// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.torex.core.error;

/**
 * Base runtime exception for all exchange failures.
 *
 * <p>
 * This sealed class forms the root of the exception hierarchy, so every exchange-specific error
 * can be caught with a single catch clause while the subtypes stay exhaustive.
 *
 * <p>
 * <strong>Exception Hierarchy:</strong>
 * <pre>
 * TorexException
 * ├── {@link LiquidityMoveException} - liquidity movement protocol violations
 * │   ├── {@link InsufficientProceedsException} - mover delivered less than the minimum
 * │   ├── {@link SameInstantMoveException} - second movement at the same timestamp
 * │   ├── {@link ReentrantMoveException} - movement started from inside a movement
 * │   └── {@link MoverCallbackRejectedException} - mover callback did not acknowledge
 * ├── {@link OutOfGasException} - execution budget exhausted
 * ├── {@link NumericOverflowException} - value outside its fixed-width range
 * └── {@link LedgerException} - host ledger failures
 *     ├── {@link InsufficientBalanceException} - transfer exceeds available balance
 *     └── {@link UnsupportedTokenException} - flow in a token the receiver does not accept
 * </pre>
 *
 * <p>
 * Every failure surfaces synchronously to the triggering call and leaves no partial state.
 *
 * <pre>{@code
 * try {
 *     torex.moveLiquidity(mover, data);
 * } catch (InsufficientProceedsException e) {
 *     // mover did not deliver e.minOutAmount()
 * } catch (TorexException e) {
 *     // any other exchange error
 * }
 * }</pre>
 */
public sealed class TorexException extends RuntimeException
        permits LiquidityMoveException,
        OutOfGasException,
        NumericOverflowException,
        LedgerException {

    public TorexException(final String message) {
        super(message);
    }

    public TorexException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
