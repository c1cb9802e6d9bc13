// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.torex.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.torex.core.types.Address;
import sh.torex.engine.host.DistributionPool;
import sh.torex.engine.host.HostLedger;

/**
 * Creates exchanges on a host ledger and keeps a registry of them.
 *
 * <p>Creation allocates the exchange account, creates its two distribution pools with the
 * exchange as admin, opens the first observer checkpoint, registers the exchange as the flow
 * listener of its account and finally hands it to {@link TorexController#onRegistered}.
 *
 * <pre>{@code
 * TorexFactory factory = new TorexFactory(ledger);
 * Torex torex = factory.createTorex(config);
 * }</pre>
 */
public final class TorexFactory {

    private static final Logger log = LoggerFactory.getLogger(TorexFactory.class);

    private final HostLedger ledger;
    private final List<Torex> torexes = new ArrayList<>();

    public TorexFactory(final HostLedger ledger) {
        this.ledger = Objects.requireNonNull(ledger, "ledger");
    }

    public Torex createTorex(final TorexConfig config) {
        Objects.requireNonNull(config, "config");
        final Address address = ledger.newAccount();
        final DistributionPool outPool = ledger.createPool(config.outToken(), address);
        final DistributionPool feePool = ledger.createPool(config.inToken(), address);
        config.observer().createCheckpoint(ledger.now());

        final Torex torex = new Torex(address, config, ledger, outPool, feePool);
        ledger.registerListener(address, torex);
        config.controller().onRegistered(torex);
        torexes.add(torex);

        log.info("Created Torex {} for {} -> {} ({})", address, config.inToken(), config.outToken(), config);
        return torex;
    }

    public List<Torex> allTorexes() {
        return Collections.unmodifiableList(torexes);
    }

    public Optional<Torex> findByTokens(final Address inToken, final Address outToken) {
        return torexes.stream()
                .filter(t -> t.config().inToken().equals(inToken) && t.config().outToken().equals(outToken))
                .findFirst();
    }
}
