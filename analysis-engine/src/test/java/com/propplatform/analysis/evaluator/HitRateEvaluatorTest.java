package com.propplatform.analysis.evaluator;

import com.propplatform.common.model.EvaluationResult;
import com.propplatform.common.model.Position;
import com.propplatform.common.model.PropositionContext;
import com.propplatform.common.model.StatCategory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.propplatform.analysis.evaluator.EvaluatorTestSupport.*;
import static org.junit.jupiter.api.Assertions.*;

class HitRateEvaluatorTest {

    private final HitRateEvaluator evaluator = new HitRateEvaluator();

    private EvaluationResult analyze(double line, Double... results) {
        PropositionContext context = PropositionContext.builder().recentResults(List.of(results)).build();
        return evaluator.analyze(prop(Position.WR, StatCategory.REC_YARDS, line), context);
    }

    @Test
    @DisplayName("4 of 5 over → 70 + (80 − 70) × 0.5 = 75")
    void mostlyOver() {
        assertEquals(75, scoreOf(analyze(60.5, 70.0, 65.0, 50.0, 72.0, 80.0)), 1e-9);
    }

    @Test
    @DisplayName("5 of 6 under with a 3-game under streak → 30 − 6.67 − 5")
    void mostlyUnderWithStreak() {
        EvaluationResult result = analyze(60.5, 40.0, 45.0, 70.0, 50.0, 55.0, 52.0);

        assertEquals(30 - (500.0 / 6 - 70) * 0.5 - 5, scoreOf(result), 1e-9);
        List<String> rationale = ((EvaluationResult.Scored) result).rationale();
        assertTrue(rationale.contains("3-game streak under the line"));
        assertEquals("Last 5 games: 45.0, 70.0, 50.0, 55.0, 52.0 (line 60.5)", rationale.get(rationale.size() - 1));
    }

    @Test
    @DisplayName("pushes count toward neither side")
    void pushes() {
        assertEquals(50, scoreOf(analyze(50.0, 50.0, 60.0, 40.0, 50.0)), 1e-9);
    }

    @Test
    @DisplayName("fewer than 3 results → abstain")
    void tooFewResults() {
        assertTrue(abstained(analyze(60.5, 70.0, 40.0)).reason().contains("need 3"));
    }
}
