// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.torex.engine;

import java.util.Objects;

import sh.torex.core.types.Address;

public record TokenPair(Address inToken, Address outToken) {

    public TokenPair {
        Objects.requireNonNull(inToken, "inToken");
        Objects.requireNonNull(outToken, "outToken");
    }
}
