// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.torex.core.error;

/**
 * Base class for host ledger failures.
 * <p>
 * <strong>Design Note:</strong> This class is {@code non-sealed} so alternative ledger
 * implementations can report their own failure types while still being caught as a
 * {@link TorexException}.
 */
public non-sealed class LedgerException extends TorexException {

    public LedgerException(final String message) {
        super(message);
    }

    public LedgerException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
