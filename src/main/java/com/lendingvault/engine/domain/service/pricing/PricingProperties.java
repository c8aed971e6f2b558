package com.lendingvault.engine.domain.service.pricing;

import com.lendingvault.engine.domain.model.CollateralRiskParameters;
import com.lendingvault.engine.domain.model.RateComponentWeights;
import com.lendingvault.engine.domain.model.RateModel;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "vault.pricing")
public class PricingProperties {

    private Duration minimumLoanDuration = Duration.ofDays(7);

    private Curve utilization = new Curve("0.05", "0.10", "2.00", "0.90", "1.00");

    /** Keyed by collateral class. */
    private Map<String, Collateral> collaterals = new LinkedHashMap<>();

    /**
     * Rate curve described by annual rates at zero, at the kink and at max.
     */
    @Getter
    @Setter
    public static class Curve {
        private BigDecimal minRate;
        private BigDecimal kinkRate;
        private BigDecimal maxRate;
        private BigDecimal kink;
        private BigDecimal max;

        public Curve() {
        }

        Curve(String minRate, String kinkRate, String maxRate, String kink, String max) {
            this.minRate = new BigDecimal(minRate);
            this.kinkRate = new BigDecimal(kinkRate);
            this.maxRate = new BigDecimal(maxRate);
            this.kink = new BigDecimal(kink);
            this.max = new BigDecimal(max);
        }

        public RateModel toRateModel() {
            return RateModel.fromRates(minRate, kinkRate, maxRate, kink, max);
        }
    }

    @Getter
    @Setter
    public static class Weights {
        private int utilization = 50;
        private int loanToValue = 25;
        private int duration = 25;
    }

    @Getter
    @Setter
    public static class Collateral {
        private boolean enabled = true;
        private Curve loanToValue;
        private Curve duration;
        private Weights weights = new Weights();

        /** Static collateral value; unset means the collateral is not priced. */
        private BigDecimal value;

        public CollateralRiskParameters toParameters() {
            if (loanToValue == null || duration == null) {
                throw new IllegalStateException("collateral requires loan-to-value and duration curves");
            }
            return new CollateralRiskParameters(enabled,
                    loanToValue.toRateModel(),
                    duration.toRateModel(),
                    new RateComponentWeights(weights.getUtilization(), weights.getLoanToValue(), weights.getDuration()));
        }
    }
}
