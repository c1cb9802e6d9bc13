// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.torex.core.error;

/**
 * The execution budget of a call was exhausted.
 *
 * @see sh.torex.core.gas.GasMeter
 */
public final class OutOfGasException extends TorexException {

    private final long requested;
    private final long remaining;

    public OutOfGasException(final long requested, final long remaining) {
        super("out of gas: requested " + requested + ", remaining " + remaining);
        this.requested = requested;
        this.remaining = remaining;
    }

    public long requested() {
        return requested;
    }

    public long remaining() {
        return remaining;
    }
}
