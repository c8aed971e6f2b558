package com.lendingvault.engine.domain.service.pricing;

import com.lendingvault.engine.domain.exception.VaultErrorCode;
import com.lendingvault.engine.domain.math.FixedPoint;
import com.lendingvault.engine.domain.model.CollateralRef;
import com.lendingvault.engine.domain.model.LoanQuote;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;

import static com.lendingvault.engine.domain.service.pricing.PricingFixtures.COLLATERAL_CLASS;
import static com.lendingvault.engine.domain.service.pricing.PricingFixtures.THIRTY_DAYS;
import static com.lendingvault.engine.support.VaultAssertions.assertRejected;
import static org.assertj.core.api.Assertions.assertThat;

class LoanPricerTest {

    private static final CollateralRef TOKEN = new CollateralRef(COLLATERAL_CLASS, "7");

    private PricingParameterStore parameterStore;
    private StaticCollateralValueOracle oracle;
    private LoanPricer pricer;

    @BeforeEach
    void setUp() {
        PricingProperties properties = PricingFixtures.properties();
        parameterStore = new PricingParameterStore(properties);
        oracle = new StaticCollateralValueOracle(properties);
        pricer = new LoanPricer(parameterStore, oracle);
    }

    @Test
    @DisplayName("prices a 10 → 11 loan over 30 days at zero utilization")
    void pricesLoan() {
        LoanQuote quote = pricer.priceLoan(TOKEN, new BigDecimal("10"), new BigDecimal("11"), THIRTY_DAYS, FixedPoint.ZERO);

        assertThat(quote.loanToValue()).isEqualByComparingTo("0.1");
        assertThat(quote.utilizationRate()).isEqualByComparingTo("0.000000001585489599");
        assertThat(quote.loanToValueRate()).isEqualByComparingTo("0.000000002113986132");
        assertThat(quote.durationRate()).isEqualByComparingTo("0.000000003169201599");
        assertThat(quote.discountRate()).isEqualByComparingTo("0.000000002113541732");
        assertThat(quote.purchasePrice()).isEqualByComparingTo("10.940067028942708449");
        assertThat(quote.durationRemaining()).isEqualTo(THIRTY_DAYS);
    }

    @Test
    @DisplayName("a riskier loan-to-value yields a lower price")
    void higherLoanToValueDiscountsMore() {
        LoanQuote safe = pricer.priceLoan(TOKEN, new BigDecimal("10"), new BigDecimal("11"), THIRTY_DAYS, FixedPoint.ZERO);
        LoanQuote risky = pricer.priceLoan(TOKEN, new BigDecimal("50"), new BigDecimal("11"), THIRTY_DAYS, FixedPoint.ZERO);

        assertThat(risky.purchasePrice()).isLessThan(safe.purchasePrice());
    }

    @Test
    void perTokenValueOverridesClassValue() {
        oracle.setCollateralValue(COLLATERAL_CLASS, "7", new BigDecimal("50"));

        LoanQuote quote = pricer.priceLoan(TOKEN, new BigDecimal("10"), new BigDecimal("11"), THIRTY_DAYS, FixedPoint.ZERO);

        assertThat(quote.loanToValue()).isEqualByComparingTo("0.2");
    }

    @Nested
    @DisplayName("rejections")
    class Rejections {

        @Test
        @DisplayName("remaining time is checked before collateral support")
        void shortDurationFirst() {
            CollateralRef unknown = new CollateralRef("unknown", "1");

            assertRejected(() -> pricer.priceLoan(unknown, BigDecimal.ONE, BigDecimal.TEN, 3600, FixedPoint.ZERO),
                    VaultErrorCode.INSUFFICIENT_TIME_REMAINING);
        }

        @Test
        @DisplayName("a matured loan is rejected even with no minimum duration")
        void maturedLoanWithoutMinimum() {
            PricingProperties properties = PricingFixtures.properties();
            properties.setMinimumLoanDuration(Duration.ZERO);
            LoanPricer lenient = new LoanPricer(new PricingParameterStore(properties), new StaticCollateralValueOracle(properties));

            assertRejected(() -> lenient.priceLoan(TOKEN, BigDecimal.ONE, BigDecimal.TEN, -60, FixedPoint.ZERO),
                    VaultErrorCode.INSUFFICIENT_TIME_REMAINING);
            assertRejected(() -> lenient.priceLoan(TOKEN, BigDecimal.ONE, BigDecimal.TEN, 0, FixedPoint.ZERO),
                    VaultErrorCode.INSUFFICIENT_TIME_REMAINING);
        }

        @Test
        void unknownCollateralClass() {
            CollateralRef unknown = new CollateralRef("unknown", "1");

            assertRejected(() -> pricer.priceLoan(unknown, BigDecimal.ONE, BigDecimal.TEN, THIRTY_DAYS, FixedPoint.ZERO),
                    VaultErrorCode.UNSUPPORTED_COLLATERAL);
        }

        @Test
        void disabledCollateralClass() {
            parameterStore.setCollateralParameters(COLLATERAL_CLASS,
                    parameterStore.collateralParameters(COLLATERAL_CLASS).orElseThrow().withEnabled(false));

            assertRejected(() -> pricer.priceLoan(TOKEN, BigDecimal.ONE, BigDecimal.TEN, THIRTY_DAYS, FixedPoint.ZERO),
                    VaultErrorCode.UNSUPPORTED_COLLATERAL);
        }

        @Test
        @DisplayName("loan-to-value above the curve max")
        void loanToValueOutOfRange() {
            assertRejected(() -> pricer.priceLoan(TOKEN, new BigDecimal("61"), new BigDecimal("70"), THIRTY_DAYS, FixedPoint.ZERO),
                    VaultErrorCode.PARAMETER_OUT_OF_RANGE);
        }

        @Test
        @DisplayName("duration above the curve max")
        void durationOutOfRange() {
            assertRejected(() -> pricer.priceLoan(TOKEN, BigDecimal.ONE, BigDecimal.TEN, 3 * THIRTY_DAYS + 1, FixedPoint.ZERO),
                    VaultErrorCode.PARAMETER_OUT_OF_RANGE);
        }
    }
}
