// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.torex.benchmark;

import java.math.BigInteger;
import java.util.concurrent.TimeUnit;

import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import sh.torex.core.math.BackAdjustment;
import sh.torex.core.math.DiscountFactor;
import sh.torex.core.math.Scaler;
import sh.torex.core.types.FlowRate;

/**
 * Cost of the arithmetic run on every quote and every flow update.
 */
@State(Scope.Benchmark)
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(1)
public class PricingBenchmark {

    private DiscountFactor discountFactor;
    private Scaler unitScaler;
    private BigInteger fullValue;
    private FlowRate prevContrib;
    private FlowRate newContrib;
    private FlowRate prevFee;
    private FlowRate newFee;

    @Param({ "60", "3600", "86400" })
    private long elapsed;

    @Setup
    public void setup() {
        discountFactor = DiscountFactor.of(600, 10_000);
        unitScaler = Scaler.pow10(-9);
        fullValue = new BigInteger("123456789012345678901234");
        prevContrib = FlowRate.of(385_802_469_135L);
        newContrib = FlowRate.of(771_604_938_271L);
        prevFee = FlowRate.of(3_858_024_691L);
        newFee = FlowRate.of(7_716_049_382L);
    }

    @Benchmark
    public void discountedValue(Blackhole bh) {
        bh.consume(discountFactor.discountedValue(fullValue, elapsed));
    }

    @Benchmark
    public void backAdjustment(Blackhole bh) {
        bh.consume(BackAdjustment.compute(prevContrib, newContrib, prevFee, newFee, elapsed,
                BigInteger.ZERO, BigInteger.valueOf(55_555_555_500_000L)));
    }

    @Benchmark
    public void unitScaling(Blackhole bh) {
        bh.consume(unitScaler.scaleFlowRate(newContrib));
    }
}
