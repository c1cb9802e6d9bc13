// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.torex.engine;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;

import org.junit.jupiter.api.Test;

import sh.torex.core.error.OutOfGasException;
import sh.torex.core.gas.GasMeter;
import sh.torex.core.types.Address;
import sh.torex.core.types.FlowRate;

class SimpleTorexControllerTest {

    private static final Address FEE_RECEIVER = Address.fromId(0xFEE);

    private final SimpleTorexController controller = new SimpleTorexController(5_000, FEE_RECEIVER);

    private static TraderFlowUpdate update(final long newRate) {
        return new TraderFlowUpdate(Address.fromId(0x1), FlowRate.ZERO, FlowRate.ZERO, 0, FlowRate.of(newRate), 0, null);
    }

    @Test
    void chargesConfiguredFee() {
        final GasMeter gas = GasMeter.of(100_000);

        assertEquals(FlowRate.of(500), controller.onInFlowChanged(update(100_000), gas));
        assertEquals(SimpleTorexController.HOOK_GAS, gas.consumed());
        assertEquals(FlowRate.ZERO, controller.onInFlowChanged(update(0), gas));
    }

    @Test
    void runsOutOfGasOnTinyBudget() {
        assertThrows(OutOfGasException.class, () -> controller.onInFlowChanged(update(100), GasMeter.of(1_000)));
    }

    @Test
    void registersFeeReceiverInFeePool() {
        final TorexFixture fx = new TorexFixture(controller);

        assertEquals(BigInteger.ONE, fx.torex.feeDistributionPool().memberUnits(FEE_RECEIVER));
        assertEquals(BigInteger.ONE, fx.torex.feeDistributionPool().totalUnits());
    }

    @Test
    void rejectsFeeAboveOneHundredPercent() {
        assertThrows(IllegalArgumentException.class, () -> new SimpleTorexController(1_000_001, FEE_RECEIVER));
    }
}
