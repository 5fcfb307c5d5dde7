// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.kestrel.core.fee;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.math.BigDecimal;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import sh.kestrel.core.KestrelDebug;
import sh.kestrel.core.error.ErrorKind;
import sh.kestrel.core.error.FeeBumpException;
import sh.kestrel.core.types.FeeRate;

class FeeBumpCalculatorTest {

    private final FeeBumpCalculator calculator = new FeeBumpCalculator();

    @Test
    void quoteIsWrittenToTheEstimationDebugLog() {
        Logger logger = (Logger) LoggerFactory.getLogger("sh.kestrel.debug");
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        try {
            calculator.quote(rbf(1000, "200", 50_000, "10"));
            assertTrue(appender.list.isEmpty());

            KestrelDebug.setEstimationLogging(true);
            BumpQuote quote = calculator.quote(rbf(1000, "200", 50_000, "10"));

            assertEquals(1, appender.list.size());
            String message = appender.list.get(0).getFormattedMessage();
            assertTrue(message.startsWith("bump BumpRequest["), message);
            assertTrue(message.endsWith(" -> " + quote), message);
        } finally {
            KestrelDebug.setEnabled(false);
            logger.detachAppender(appender);
        }
    }

    @Nested
    class Rbf {

        @Test
        void computesReplacementFeeAndAdditionalCost() {
            BumpQuote quote = calculator.quote(rbf(1000, "200", 50_000, "10"));

            assertEquals(BumpMethod.RBF, quote.method());
            assertEquals(2000, quote.newTotalFeeSats());
            assertEquals(1000, quote.additionalCostSats());
            assertTrue(quote.affordable());
            assertFalse(quote.willConsolidate());
            assertNull(quote.error());
        }

        @Test
        void rejectsTargetAtOrBelowCurrentEffectiveRate() {
            FeeBumpException equal = assertThrows(FeeBumpException.class,
                    () -> calculator.quote(rbf(1000, "200", 50_000, "5")));
            assertEquals(ErrorKind.FEE_BUMP_NOT_HIGHER_THAN_CURRENT, equal.kind());

            assertThrows(FeeBumpException.class, () -> calculator.quote(rbf(1000, "200", 50_000, "4")));
        }

        @Test
        void acceptsFractionalTargetJustAboveCurrent() {
            BumpQuote quote = calculator.quote(rbf(1000, "200", 50_000, "5.01"));

            assertEquals(1002, quote.newTotalFeeSats());
            assertEquals(2, quote.additionalCostSats());
        }

        @Test
        void roundsNewFeeUp() {
            BumpQuote quote = calculator.quote(rbf(100, "140.25", 50_000, "2.5"));

            // 2.5 * 140.25 = 350.625
            assertEquals(351, quote.newTotalFeeSats());
            assertEquals(251, quote.additionalCostSats());
        }

        @Test
        void affordableExactlyAtBalance() {
            assertTrue(calculator.quote(rbf(1000, "200", 1000, "10")).affordable());

            BumpQuote short1 = calculator.quote(rbf(1000, "200", 999, "10"));
            assertFalse(short1.affordable());
            assertEquals(ErrorKind.FEE_BUMP_INSUFFICIENT_FUNDS, short1.error());
            FeeBumpException ex = assertThrows(FeeBumpException.class, short1::requireAffordable);
            assertEquals(ErrorKind.FEE_BUMP_INSUFFICIENT_FUNDS, ex.kind());
        }

        @Test
        void fallsBackToReportedRateWhenSizeUnknown() {
            BumpRequest request = BumpRequest.builder(BumpMethod.RBF)
                    .currentFeeSats(1000)
                    .currentFeeRateSatPerVb(new BigDecimal("3"))
                    .vsizeVb(BigDecimal.ZERO)
                    .availableWalletBalanceSats(10_000)
                    .targetFeeRate(FeeRate.of(3))
                    .build();

            assertEquals(0, new BigDecimal("3").compareTo(calculator.currentEffectiveRate(request)));
            assertThrows(FeeBumpException.class, () -> calculator.quote(request));
        }
    }

    @Nested
    class Cpfp {

        @Test
        void parentAloneInsufficientRequiresConsolidation() {
            BumpQuote quote = calculator.quote(cpfp(2000, 0, 1, "10"));

            assertEquals(BumpMethod.CPFP, quote.method());
            assertEquals(1500, quote.additionalCostSats());
            assertEquals(150, quote.childVBytes());
            assertTrue(quote.willConsolidate());
            assertFalse(quote.affordable());
            assertEquals(ErrorKind.FEE_BUMP_INSUFFICIENT_FUNDS, quote.error());
        }

        @Test
        void walletBalanceCoversShortfall() {
            BumpQuote quote = calculator.quote(cpfp(2000, 46, 1, "10"));

            assertTrue(quote.affordable());
            assertTrue(quote.willConsolidate());
            assertSame(quote, quote.requireAffordable());
        }

        @Test
        void parentSufficiencyIsStrict() {
            assertTrue(calculator.quote(cpfp(2046, 0, 1, "10")).willConsolidate());

            BumpQuote enough = calculator.quote(cpfp(2047, 0, 1, "10"));
            assertFalse(enough.willConsolidate());
            assertTrue(enough.affordable());
        }

        @Test
        void roundsTargetRateUp() {
            assertEquals(1500, calculator.quote(cpfp(10_000, 0, 1, "9.2")).additionalCostSats());
        }

        @Test
        void addsSizePerExtraParentOutput() {
            BumpQuote quote = calculator.quote(cpfp(10_000, 0, 3, "10"));

            assertEquals(286, quote.childVBytes());
            assertEquals(2860, quote.additionalCostSats());
        }

        @Test
        void rejectsTargetNotAboveReportedRate() {
            BumpRequest request = BumpRequest.builder(BumpMethod.CPFP)
                    .currentFeeRateSatPerVb(new BigDecimal("5"))
                    .cpfpParentOutputSats(10_000)
                    .targetFeeRate(FeeRate.of(5))
                    .build();

            FeeBumpException ex = assertThrows(FeeBumpException.class, () -> calculator.quote(request));
            assertEquals(ErrorKind.FEE_BUMP_NOT_HIGHER_THAN_CURRENT, ex.kind());
        }

        @Test
        void customDustLimit() {
            FeeBumpCalculator noDust = new FeeBumpCalculator(0);

            BumpQuote quote = noDust.quote(cpfp(1500, 0, 1, "10"));
            assertTrue(quote.affordable());
            assertTrue(quote.willConsolidate());
        }
    }

    @Test
    void childSizeRequiresAtLeastOneOutput() {
        assertEquals(150, FeeBumpCalculator.cpfpChildVBytes(1));
        assertEquals(218, FeeBumpCalculator.cpfpChildVBytes(2));
        assertThrows(IllegalArgumentException.class, () -> FeeBumpCalculator.cpfpChildVBytes(0));
    }

    @Test
    void requestValidatesRanges() {
        assertThrows(IllegalArgumentException.class,
                () -> BumpRequest.builder(BumpMethod.RBF).currentFeeSats(-1).targetFeeRate(FeeRate.of(1)).build());
        assertThrows(IllegalArgumentException.class,
                () -> BumpRequest.builder(BumpMethod.CPFP).cpfpParentOutputCount(0).targetFeeRate(FeeRate.of(1)).build());
        assertThrows(NullPointerException.class, () -> BumpRequest.builder(BumpMethod.RBF).build());
    }

    private static BumpRequest rbf(long fee, String vsize, long balance, String target) {
        return BumpRequest.builder(BumpMethod.RBF)
                .currentFeeSats(fee)
                .vsizeVb(new BigDecimal(vsize))
                .availableWalletBalanceSats(balance)
                .targetFeeRate(FeeRate.of(target))
                .build();
    }

    private static BumpRequest cpfp(long parentOutput, long balance, int outputs, String target) {
        return BumpRequest.builder(BumpMethod.CPFP)
                .currentFeeRateSatPerVb(new BigDecimal("2"))
                .cpfpParentOutputSats(parentOutput)
                .cpfpParentOutputCount(outputs)
                .availableWalletBalanceSats(balance)
                .targetFeeRate(FeeRate.of(target))
                .build();
    }
}
