// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.torex.engine;

import java.util.Objects;

import sh.torex.core.math.DiscountFactor;
import sh.torex.core.math.FeeCeiling;
import sh.torex.core.math.Scaler;
import sh.torex.core.types.Address;

/**
 * Immutable configuration of one exchange instance.
 *
 * <p><strong>Usage Example:</strong>
 * <pre>{@code
 * var config = TorexConfig.builder()
 *     .inToken(usdc)
 *     .outToken(eth)
 *     .observer(observer)
 *     .controller(controller)
 *     .twapScaler(Scaler.pow10(12))
 *     .discountFactor(DiscountFactor.of(600, 10_000))
 *     .outTokenDistributionPoolScaler(Scaler.pow10(-6))
 *     .maxAllowedFeePM(30_000)
 *     .build();
 * }</pre>
 */
public final class TorexConfig {

    /** Default gas budget of a safe controller callback. */
    public static final long DEFAULT_CONTROLLER_SAFE_CALLBACK_GAS_LIMIT = 3_000_000L;

    /** Default maximum fee (3%). */
    public static final long DEFAULT_MAX_ALLOWED_FEE_PM = 30_000L;

    /** Default discount: 1% after 10 minutes. */
    public static final DiscountFactor DEFAULT_DISCOUNT_FACTOR = DiscountFactor.of(600, 10_000);

    private final Address inToken;
    private final Address outToken;
    private final TwapObserver observer;
    private final Scaler twapScaler;
    private final DiscountFactor discountFactor;
    private final Scaler outTokenDistributionPoolScaler;
    private final TorexController controller;
    private final long controllerSafeCallbackGasLimit;
    private final long maxAllowedFeePM;

    private TorexConfig(final Builder b) {
        this.inToken = b.inToken;
        this.outToken = b.outToken;
        this.observer = b.observer;
        this.twapScaler = b.twapScaler;
        this.discountFactor = b.discountFactor;
        this.outTokenDistributionPoolScaler = b.outTokenDistributionPoolScaler;
        this.controller = b.controller;
        this.controllerSafeCallbackGasLimit = b.controllerSafeCallbackGasLimit;
        this.maxAllowedFeePM = b.maxAllowedFeePM;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Address inToken() {
        return inToken;
    }

    public Address outToken() {
        return outToken;
    }

    public TwapObserver observer() {
        return observer;
    }

    public Scaler twapScaler() {
        return twapScaler;
    }

    public DiscountFactor discountFactor() {
        return discountFactor;
    }

    public Scaler outTokenDistributionPoolScaler() {
        return outTokenDistributionPoolScaler;
    }

    public TorexController controller() {
        return controller;
    }

    public long controllerSafeCallbackGasLimit() {
        return controllerSafeCallbackGasLimit;
    }

    public long maxAllowedFeePM() {
        return maxAllowedFeePM;
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof TorexConfig other)) {
            return false;
        }
        return inToken.equals(other.inToken)
                && outToken.equals(other.outToken)
                && observer == other.observer
                && twapScaler.equals(other.twapScaler)
                && discountFactor.equals(other.discountFactor)
                && outTokenDistributionPoolScaler.equals(other.outTokenDistributionPoolScaler)
                && controller == other.controller
                && controllerSafeCallbackGasLimit == other.controllerSafeCallbackGasLimit
                && maxAllowedFeePM == other.maxAllowedFeePM;
    }

    @Override
    public int hashCode() {
        return Objects.hash(inToken, outToken, System.identityHashCode(observer), twapScaler, discountFactor,
                outTokenDistributionPoolScaler, System.identityHashCode(controller),
                controllerSafeCallbackGasLimit, maxAllowedFeePM);
    }

    @Override
    public String toString() {
        return "TorexConfig{"
                + "inToken=" + inToken
                + ", outToken=" + outToken
                + ", twapScaler=" + twapScaler.value()
                + ", discountFactor=" + discountFactor.factor()
                + ", outTokenDistributionPoolScaler=" + outTokenDistributionPoolScaler.value()
                + ", controllerSafeCallbackGasLimit=" + controllerSafeCallbackGasLimit
                + ", maxAllowedFeePM=" + maxAllowedFeePM
                + '}';
    }

    /**
     * Builder for creating TorexConfig instances.
     */
    public static final class Builder {
        private Address inToken;
        private Address outToken;
        private TwapObserver observer;
        private Scaler twapScaler = Scaler.ONE;
        private DiscountFactor discountFactor = DEFAULT_DISCOUNT_FACTOR;
        private Scaler outTokenDistributionPoolScaler = Scaler.ONE;
        private TorexController controller;
        private long controllerSafeCallbackGasLimit = DEFAULT_CONTROLLER_SAFE_CALLBACK_GAS_LIMIT;
        private long maxAllowedFeePM = DEFAULT_MAX_ALLOWED_FEE_PM;

        private Builder() {
        }

        public Builder inToken(final Address inToken) {
            this.inToken = Objects.requireNonNull(inToken, "inToken must not be null");
            return this;
        }

        public Builder outToken(final Address outToken) {
            this.outToken = Objects.requireNonNull(outToken, "outToken must not be null");
            return this;
        }

        public Builder observer(final TwapObserver observer) {
            this.observer = Objects.requireNonNull(observer, "observer must not be null");
            return this;
        }

        /**
         * Sets the scaler normalizing the observer's quote to out-token decimals.
         */
        public Builder twapScaler(final Scaler twapScaler) {
            this.twapScaler = Objects.requireNonNull(twapScaler, "twapScaler must not be null");
            return this;
        }

        public Builder discountFactor(final DiscountFactor discountFactor) {
            this.discountFactor = Objects.requireNonNull(discountFactor, "discountFactor must not be null");
            return this;
        }

        /**
         * Sets the scaler turning contribution flow rates into out-token pool units.
         */
        public Builder outTokenDistributionPoolScaler(final Scaler scaler) {
            this.outTokenDistributionPoolScaler = Objects.requireNonNull(scaler, "scaler must not be null");
            return this;
        }

        public Builder controller(final TorexController controller) {
            this.controller = Objects.requireNonNull(controller, "controller must not be null");
            return this;
        }

        /**
         * Sets the gas budget of safe controller callbacks.
         *
         * @param gasLimit the budget (must be positive)
         * @return this builder
         * @throws IllegalArgumentException if gasLimit is not positive
         */
        public Builder controllerSafeCallbackGasLimit(final long gasLimit) {
            if (gasLimit <= 0) {
                throw new IllegalArgumentException("controllerSafeCallbackGasLimit must be positive");
            }
            this.controllerSafeCallbackGasLimit = gasLimit;
            return this;
        }

        /**
         * Sets the immutable fee ceiling.
         *
         * @param maxAllowedFeePM parts per million, at most 1,000,000
         * @return this builder
         * @throws IllegalArgumentException if out of range
         */
        public Builder maxAllowedFeePM(final long maxAllowedFeePM) {
            FeeCeiling.validate(maxAllowedFeePM);
            this.maxAllowedFeePM = maxAllowedFeePM;
            return this;
        }

        /**
         * @throws NullPointerException     if a token, the observer or the controller is missing
         * @throws IllegalArgumentException if in-token and out-token are the same
         */
        public TorexConfig build() {
            Objects.requireNonNull(inToken, "inToken must be set");
            Objects.requireNonNull(outToken, "outToken must be set");
            Objects.requireNonNull(observer, "observer must be set");
            Objects.requireNonNull(controller, "controller must be set");
            if (inToken.equals(outToken)) {
                throw new IllegalArgumentException("inToken and outToken must differ");
            }
            return new TorexConfig(this);
        }
    }
}
