// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.torex.core.error;

import java.math.BigInteger;

/**
 * A value does not fit the fixed-width integer type it is converted to.
 */
public final class NumericOverflowException extends TorexException {

    private final String targetType;
    private final BigInteger value;

    public NumericOverflowException(final String targetType, final BigInteger value) {
        super("value out of " + targetType + " range: " + value);
        this.targetType = targetType;
        this.value = value;
    }

    public String targetType() {
        return targetType;
    }

    public BigInteger value() {
        return value;
    }
}
