// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.torex.engine;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import sh.torex.core.math.DiscountFactor;
import sh.torex.core.math.Scaler;
import sh.torex.core.types.Address;

class TorexConfigTest {

    private static final Address IN = Address.fromId(0xA0001);
    private static final Address OUT = Address.fromId(0xB0001);

    private final TwapObserver observer = new FixedPriceObserver(1, 1);
    private final TorexController controller = new ZeroFeeController();

    private TorexConfig.Builder minimal() {
        return TorexConfig.builder().inToken(IN).outToken(OUT).observer(observer).controller(controller);
    }

    @Test
    void appliesDefaults() {
        final TorexConfig config = minimal().build();

        assertEquals(Scaler.ONE, config.twapScaler());
        assertEquals(Scaler.ONE, config.outTokenDistributionPoolScaler());
        assertEquals(TorexConfig.DEFAULT_DISCOUNT_FACTOR, config.discountFactor());
        assertEquals(3_000_000L, config.controllerSafeCallbackGasLimit());
        assertEquals(30_000L, config.maxAllowedFeePM());
    }

    @Test
    void overridesDefaults() {
        final TorexConfig config = minimal()
                .twapScaler(Scaler.pow10(-12))
                .outTokenDistributionPoolScaler(Scaler.pow10(-9))
                .discountFactor(DiscountFactor.disabled())
                .controllerSafeCallbackGasLimit(500_000)
                .maxAllowedFeePM(0)
                .build();

        assertEquals(Scaler.pow10(-12), config.twapScaler());
        assertTrue(config.discountFactor().isDisabled());
        assertEquals(500_000L, config.controllerSafeCallbackGasLimit());
        assertEquals(0L, config.maxAllowedFeePM());
    }

    @Test
    void requiresCollaborators() {
        assertThrows(NullPointerException.class, () -> TorexConfig.builder().inToken(IN).outToken(OUT).build());
        assertThrows(NullPointerException.class, () -> minimal().observer(null).build());
    }

    @Test
    void rejectsInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> minimal().outToken(IN).build());
        assertThrows(IllegalArgumentException.class, () -> minimal().maxAllowedFeePM(1_000_001));
        assertThrows(IllegalArgumentException.class, () -> minimal().controllerSafeCallbackGasLimit(0));
    }

    @Test
    void equalityUsesCollaboratorIdentity() {
        assertEquals(minimal().build(), minimal().build());
        assertNotEquals(minimal().build(), minimal().controller(new ZeroFeeController()).build());
    }
}
