// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.torex.engine.host;

/**
 * Handle to a captured ledger state.
 *
 * @param id ledger-assigned identifier, increasing
 */
public record LedgerSnapshot(long id) {

    public LedgerSnapshot {
        if (id < 0) {
            throw new IllegalArgumentException("snapshot id must not be negative: " + id);
        }
    }
}
