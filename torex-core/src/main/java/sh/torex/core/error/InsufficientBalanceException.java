// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.torex.core.error;

import java.math.BigInteger;

import sh.torex.core.types.Address;

public class InsufficientBalanceException extends LedgerException {

    private final Address account;
    private final BigInteger available;
    private final BigInteger requested;

    public InsufficientBalanceException(final Address account, final BigInteger available, final BigInteger requested) {
        super("insufficient balance for " + account + ": available " + available + ", requested " + requested);
        this.account = account;
        this.available = available;
        this.requested = requested;
    }

    public Address account() {
        return account;
    }

    public BigInteger available() {
        return available;
    }

    public BigInteger requested() {
        return requested;
    }
}
