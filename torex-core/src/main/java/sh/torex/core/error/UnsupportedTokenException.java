// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.torex.core.error;

import sh.torex.core.types.Address;

public class UnsupportedTokenException extends LedgerException {

    private final Address token;

    public UnsupportedTokenException(final Address token) {
        super("unsupported token: " + token);
        this.token = token;
    }

    public Address token() {
        return token;
    }
}
