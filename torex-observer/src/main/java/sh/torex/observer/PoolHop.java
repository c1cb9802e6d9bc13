// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.torex.observer;

import java.util.Objects;

/**
 * One leg of a quote path.
 *
 * @param source    the pool accumulator
 * @param direction direction the leg trades in
 */
public record PoolHop(CumulativePriceSource source, CumulativePriceSource.Direction direction) {

    public PoolHop {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(direction, "direction");
    }
}
