package com.propplatform.analysis.evaluator;

import com.propplatform.common.model.EvaluationResult;
import com.propplatform.common.model.Proposition;
import com.propplatform.common.model.PropositionContext;
import com.propplatform.common.model.SignalFamily;
import com.propplatform.common.model.TrendDirection;
import com.propplatform.common.model.TrendProfile;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Opportunity trend for touchdown, reception and completion lines. Volume
 * lines (yards, attempts) are left to the matchup signal.
 */
@Component
public class TrendEvaluator implements Evaluator {

    @Override
    public SignalFamily family() { return SignalFamily.TREND; }

    @Override
    public EvaluationResult analyze(Proposition proposition, PropositionContext context) {
        if (proposition.category().isVolume()) {
            return EvaluationResult.abstain(evaluatorName(), "volume line, matchup takes precedence");
        }
        TrendProfile trend = context.trend();
        TrendDirection direction = trend == null ? null
            : proposition.position().isPassCatcher() ? trend.targetShareTrend() : trend.snapShareTrend();
        if (direction == null) {
            return EvaluationResult.abstain(evaluatorName(), "insufficient trend data");
        }

        List<String> rationale = new ArrayList<>();
        double score;
        if (direction == TrendDirection.INCREASING) {
            score = 65;
            rationale.add("Opportunity trending up");
        } else if (direction == TrendDirection.DECREASING) {
            score = 35;
            rationale.add("Opportunity trending down");
        } else {
            score = 55;
            rationale.add("Stable opportunity trend");
        }

        if (score >= 65) {
            rationale.add(0, "Strong trend supports OVER");
        } else if (score <= 35) {
            rationale.add(0, "Negative trend indicates UNDER");
        }
        return EvaluationResult.scored(evaluatorName(), score, rationale);
    }
}
