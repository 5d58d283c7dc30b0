package com.propplatform.common.calibration;

import com.propplatform.common.model.CalibrationSample;
import com.propplatform.common.model.Outcome;
import com.propplatform.common.model.ScoredProposition;
import com.propplatform.common.model.Side;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.propplatform.common.Fixtures.contribution;
import static com.propplatform.common.Fixtures.proposition;
import static com.propplatform.common.Fixtures.scored;
import static org.junit.jupiter.api.Assertions.*;

class AccuracyMeasurerTest {

    private static CalibrationSample sample(String id, Side side, boolean hit, double efficiencyScore) {
        ScoredProposition scored = scored(proposition(id, "Player " + id, "KC", "LV"), side,
                                          contribution("Efficiency", efficiencyScore, 2.5));
        return new CalibrationSample(scored, new Outcome(id, 70.0, hit));
    }

    @Test
    @DisplayName("UNDER maps to (100 − score) / 100, OVER to score / 100")
    void probabilityMapping() {
        assertEquals(0.72, ProbabilityMapping.predictedProbability(72, Side.OVER), 1e-9);
        assertEquals(0.28, ProbabilityMapping.predictedProbability(72, Side.UNDER), 1e-9);
        assertEquals(1.0,  ProbabilityMapping.predictedProbability(130, Side.OVER), 1e-9);
    }

    @Test
    @DisplayName("each contribution is graded against the side that was wagered")
    void gradesPerSide() {
        Map<String, EvaluatorAccuracy> result = AccuracyMeasurer.measure(List.of(
            sample("1", Side.OVER,  true,  80),   // predicted 0.80, hit
            sample("2", Side.UNDER, false, 40),   // predicted 0.60, miss
            sample("3", Side.OVER,  true,  70)),  // predicted 0.70, hit
            Set.of());

        EvaluatorAccuracy efficiency = result.get("Efficiency");
        assertEquals(3, efficiency.sampleSize());
        assertEquals(2, efficiency.hits());
        assertEquals(0.70, efficiency.meanPredicted(), 1e-9);
        assertEquals(0.70 - 2.0 / 3.0, efficiency.overconfidence(), 1e-9);
    }

    @Test
    @DisplayName("abstaining evaluators are never graded but still listed when requested")
    void abstainersNotGraded() {
        Map<String, EvaluatorAccuracy> result = AccuracyMeasurer.measure(
            List.of(sample("1", Side.OVER, true, 80)), List.of("Health"));

        assertEquals(0, result.get("Health").sampleSize());
        assertEquals(0.0, result.get("Health").overconfidence());
        assertEquals(1, result.get("Efficiency").sampleSize());
    }
}
