// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.torex.engine;

import java.math.BigInteger;
import java.util.Objects;

import sh.torex.core.gas.GasMeter;
import sh.torex.core.math.FeeCeiling;
import sh.torex.core.types.Address;
import sh.torex.core.types.FlowRate;

/**
 * Controller charging a fixed fee and paying it all to one receiver.
 */
public final class SimpleTorexController implements TorexController {

    /** Gas charged per hook invocation. */
    static final long HOOK_GAS = 21_000L;

    private final long feePM;
    private final Address feeReceiver;

    public SimpleTorexController(final long feePM, final Address feeReceiver) {
        FeeCeiling.validate(feePM);
        this.feePM = feePM;
        this.feeReceiver = Objects.requireNonNull(feeReceiver, "feeReceiver");
    }

    public long feePM() {
        return feePM;
    }

    public Address feeReceiver() {
        return feeReceiver;
    }

    @Override
    public FlowRate onInFlowChanged(final TraderFlowUpdate update, final GasMeter gas) {
        gas.consume(HOOK_GAS);
        return FeeCeiling.maxFeeRate(update.newFlowRate(), feePM);
    }

    @Override
    public boolean onLiquidityMoved(final LiquidityMoveResult result, final GasMeter gas) {
        gas.consume(HOOK_GAS);
        return true;
    }

    @Override
    public void onRegistered(final Torex torex) {
        torex.feeDistributionPool().updateMemberUnits(feeReceiver, BigInteger.ONE);
    }
}
