// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.torex.core.types;

import java.util.HexFormat;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Hex-encoded 20-byte account address.
 * <p>
 * Identifies every party the exchange deals with: traders, tokens, pools, liquidity movers
 * and the exchange instance itself.
 * <p>
 * <strong>Validation:</strong>
 * <ul>
 * <li>Must start with "0x"</li>
 * <li>Must be exactly 40 hex characters long (20 bytes)</li>
 * </ul>
 * <p>
 * The value is stored in lowercase.
 */
public record Address(@JsonValue String value) {
    private static final int BYTE_LENGTH = 20;
    private static final Pattern HEX = Pattern.compile("^0x[0-9a-fA-F]{" + (BYTE_LENGTH * 2) + "}$");

    /**
     * The zero address ({@code 0x0000000000000000000000000000000000000000}).
     * <p>
     * Used as a sentinel for "no account".
     */
    public static final Address ZERO = new Address("0x0000000000000000000000000000000000000000");

    public Address {
        Objects.requireNonNull(value, "address");
        if (!HEX.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid address: " + value);
        }
        value = value.toLowerCase(Locale.ROOT);
    }

    public byte[] toBytes() {
        return HexFormat.of().parseHex(value.substring(2));
    }

    public static Address fromBytes(final byte[] bytes) {
        if (bytes == null || bytes.length != BYTE_LENGTH) {
            throw new IllegalArgumentException("Address must be exactly " + BYTE_LENGTH + " bytes");
        }
        return new Address("0x" + HexFormat.of().formatHex(bytes));
    }

    /**
     * Creates an address whose low-order bytes hold {@code id}.
     * <p>
     * Handy for deterministic fixtures: {@code Address.fromId(1)} is
     * {@code 0x0000000000000000000000000000000000000001}.
     *
     * @param id non-negative identifier
     * @return the address
     */
    public static Address fromId(final long id) {
        if (id < 0) {
            throw new IllegalArgumentException("id must be non-negative");
        }
        final String hex = Long.toHexString(id);
        return new Address("0x" + "0".repeat(BYTE_LENGTH * 2 - hex.length()) + hex);
    }

    /**
     * Returns the shortened {@code 0x1234...abcd} form used in log lines.
     */
    public String shortForm() {
        return value.substring(0, 6) + "..." + value.substring(value.length() - 4);
    }

    @Override
    public String toString() {
        return value;
    }
}
