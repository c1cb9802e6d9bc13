// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.torex.engine;

import java.math.BigInteger;

import sh.torex.core.gas.GasMeter;
import sh.torex.core.types.Address;
import sh.torex.core.types.FlowRate;
import sh.torex.engine.host.memory.InMemoryLedger;

/**
 * A ledger with two tokens and one exchange between them.
 */
final class TorexFixture {

    static final Address IN_TOKEN = Address.fromId(0xA0001);
    static final Address OUT_TOKEN = Address.fromId(0xB0001);
    static final BigInteger INITIAL_BALANCE = BigInteger.TEN.pow(12);

    final InMemoryLedger ledger = InMemoryLedger.create();
    final TorexFactory factory = new TorexFactory(ledger);
    final FixedPriceObserver observer = new FixedPriceObserver(2, 1);
    final Torex torex;

    TorexFixture(final TorexController controller) {
        this(controller, TorexConfig.builder());
    }

    TorexFixture(final TorexController controller, final TorexConfig.Builder config) {
        this.torex = factory.createTorex(config
                .inToken(IN_TOKEN)
                .outToken(OUT_TOKEN)
                .observer(observer)
                .controller(controller)
                .build());
    }

    Address fundedTrader() {
        final Address trader = ledger.newAccount();
        ledger.mint(IN_TOKEN, trader, INITIAL_BALANCE);
        return trader;
    }

    void setFlow(final Address trader, final long rate) {
        ledger.setFlow(IN_TOKEN, trader, torex.address(), FlowRate.of(rate), new byte[0], GasMeter.unlimited());
    }

    BigInteger inBalance(final Address account) {
        return ledger.balanceOf(IN_TOKEN, account);
    }

    BigInteger outBalance(final Address account) {
        return ledger.balanceOf(OUT_TOKEN, account);
    }

    TestMover mover() {
        return new TestMover(ledger, torex, INITIAL_BALANCE);
    }
}
