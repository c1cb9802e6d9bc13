// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.torex.engine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import sh.torex.core.types.Address;

/**
 * Per-trader flow-rate split. A trader is implicitly zero until first observed; a deleted flow
 * zeroes the entry rather than removing it.
 */
final class TraderLedger {

    private final Map<Address, TraderState> traders = new LinkedHashMap<>();

    TraderState get(final Address trader) {
        return traders.getOrDefault(Objects.requireNonNull(trader, "trader"), TraderState.ZERO);
    }

    void put(final Address trader, final TraderState state) {
        traders.put(trader, state);
    }

    Map<Address, TraderState> snapshot() {
        return new LinkedHashMap<>(traders);
    }

    void restore(final Map<Address, TraderState> snapshot) {
        traders.clear();
        traders.putAll(snapshot);
    }

    Map<Address, TraderState> entries() {
        return Collections.unmodifiableMap(traders);
    }
}
