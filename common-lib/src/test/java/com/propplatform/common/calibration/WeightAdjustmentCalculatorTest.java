package com.propplatform.common.calibration;

import com.propplatform.common.model.AdjustmentAction;
import com.propplatform.common.model.WeightAdjustmentRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Deterministic verification of {@link WeightAdjustmentCalculator}.
 */
class WeightAdjustmentCalculatorTest {

    private static final CalibrationPolicy POLICY = CalibrationPolicy.DEFAULT;

    /** {@code n} samples with mean predicted probability {@code meanPredicted}. */
    private static EvaluatorAccuracy stats(int n, int hits, double meanPredicted) {
        return new EvaluatorAccuracy("Efficiency", n, hits, meanPredicted * n);
    }

    // ── delta() ────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("delta(): bounded Δ from overconfidence and accuracy")
    class DeltaTests {

        @Test
        @DisplayName("20 samples, predicted 0.70, 11 hits → overconfidence 0.15, Δ −0.45")
        void overconfident_negativeDelta() {
            EvaluatorAccuracy s = stats(20, 11, 0.70);

            assertEquals(0.55, s.accuracy(), 1e-9);
            assertEquals(0.15, s.overconfidence(), 1e-9);
            assertEquals(-0.45, WeightAdjustmentCalculator.delta(s.accuracy(), s.overconfidence(), POLICY), 1e-9);
        }

        @Test
        @DisplayName("high accuracy adds a bonus on top of the calibration term")
        void highAccuracyBonus() {
            // over = 0.70 − 0.80 = −0.10 → +0.30; bonus (0.80 − 0.70) × 2 = +0.20 → 0.50
            assertEquals(0.5, WeightAdjustmentCalculator.delta(0.80, -0.10, POLICY), 1e-9);
        }

        @Test
        @DisplayName("low accuracy subtracts a penalty")
        void lowAccuracyPenalty() {
            // −0.02 × 3 = −0.06; (0.50 − 0.40) × 2 = −0.20 → −0.26
            assertEquals(-0.26, WeightAdjustmentCalculator.delta(0.40, 0.02, POLICY), 1e-9);
        }

        @Test
        @DisplayName("|Δ| never exceeds maxDelta")
        void clampedToMaxDelta() {
            assertEquals(-0.5, WeightAdjustmentCalculator.delta(0.10, 0.60, POLICY), 1e-9);
            assertEquals(0.5,  WeightAdjustmentCalculator.delta(0.95, -0.40, POLICY), 1e-9);
        }

        @Test
        @DisplayName("well calibrated mid-accuracy evaluator barely moves")
        void calibrated_smallDelta() {
            assertEquals(-0.03, WeightAdjustmentCalculator.delta(0.60, 0.01, POLICY), 1e-9);
        }
    }

    // ── adjust() ───────────────────────────────────────────────────────────

    @Nested
    @DisplayName("adjust(): new weight and audit fields")
    class AdjustTests {

        @Test
        @DisplayName("applied adjustment moves the weight by Δ")
        void applied() {
            WeightAdjustment adj = WeightAdjustmentCalculator.adjust(2.5, stats(20, 11, 0.70), POLICY);

            assertEquals(AdjustmentAction.APPLIED, adj.action());
            assertTrue(adj.applied());
            assertEquals(2.05, adj.newWeight(), 1e-9);
            assertEquals(20, adj.sampleSize());
            assertEquals("overconfident (+15.0%)", adj.reason());
        }

        @Test
        @DisplayName("8 samples (< 10) → skipped, weight unchanged, reason 'insufficient data'")
        void insufficientData() {
            WeightAdjustment adj = WeightAdjustmentCalculator.adjust(1.8, stats(8, 2, 0.75), POLICY);

            assertEquals(AdjustmentAction.SKIPPED, adj.action());
            assertEquals(1.8, adj.newWeight());
            assertEquals(WeightAdjustmentCalculator.INSUFFICIENT_DATA, adj.reason());
            assertEquals(8, adj.sampleSize());
        }

        @Test
        @DisplayName("no samples at all → skipped")
        void emptyStats() {
            WeightAdjustment adj = WeightAdjustmentCalculator.adjust(1.0, EvaluatorAccuracy.empty("Trend"), POLICY);

            assertEquals(AdjustmentAction.SKIPPED, adj.action());
            assertEquals(0, adj.sampleSize());
        }

        @Test
        @DisplayName("new weight is clamped to [0.1, 5.0]")
        void weightBounds() {
            WeightAdjustment low  = WeightAdjustmentCalculator.adjust(0.3, stats(30, 3, 0.80), POLICY);
            WeightAdjustment high = WeightAdjustmentCalculator.adjust(4.8, stats(30, 27, 0.60), POLICY);

            assertEquals(0.1, low.newWeight(), 1e-9);
            assertEquals(5.0, high.newWeight(), 1e-9);
        }

        @Test
        @DisplayName("reason names the dominant cause")
        void reasons() {
            assertEquals("underconfident (-20.0%)",
                WeightAdjustmentCalculator.adjust(1.0, stats(10, 8, 0.60), POLICY).reason());
            assertEquals("high accuracy (75.0%)",
                WeightAdjustmentCalculator.adjust(1.0, stats(20, 15, 0.74), POLICY).reason());
            assertEquals("low accuracy (40.0%)",
                WeightAdjustmentCalculator.adjust(1.0, stats(20, 8, 0.42), POLICY).reason());
            assertEquals("minor calibration adjustment",
                WeightAdjustmentCalculator.adjust(1.0, stats(20, 12, 0.61), POLICY).reason());
        }

        @Test
        @DisplayName("record carries period, delta and timestamp")
        void toRecord() {
            WeightAdjustment adj = WeightAdjustmentCalculator.adjust(2.5, stats(20, 11, 0.70), POLICY);

            WeightAdjustmentRecord record = adj.toRecord("2024-W07", Instant.EPOCH);

            assertEquals("2024-W07", record.period());
            assertEquals(-0.45, record.delta(), 1e-9);
            assertEquals(Instant.EPOCH, record.timestamp());
        }
    }

    @Test
    @DisplayName("inconsistent policies are rejected")
    void invalidPolicy() {
        assertThrows(IllegalArgumentException.class,
            () -> new CalibrationPolicy(3.0, 10, 0.5, 0.0, 5.0, 0.7, 0.5, 2.0));
        assertThrows(IllegalArgumentException.class,
            () -> new CalibrationPolicy(3.0, 10, 0.5, 2.0, 1.0, 0.7, 0.5, 2.0));
        assertThrows(IllegalArgumentException.class,
            () -> new CalibrationPolicy(3.0, 10, 0.5, 0.1, 5.0, 0.4, 0.5, 2.0));
    }
}
