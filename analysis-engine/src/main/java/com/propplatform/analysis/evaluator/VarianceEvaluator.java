package com.propplatform.analysis.evaluator;

import com.propplatform.common.model.EvaluationResult;
import com.propplatform.common.model.Proposition;
import com.propplatform.common.model.PropositionContext;
import com.propplatform.common.model.SignalFamily;
import com.propplatform.common.model.StatCategory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Reliability of the line itself. Volume-type lines are steadier than
 * touchdown lines; categories without a rule abstain.
 */
@Component
public class VarianceEvaluator implements Evaluator {

    @Override
    public SignalFamily family() { return SignalFamily.VARIANCE; }

    @Override
    public EvaluationResult analyze(Proposition proposition, PropositionContext context) {
        StatCategory category = proposition.category();
        Rule rule = switch (proposition.position()) {
            case QB -> quarterback(category);
            case WR, TE -> passCatcher(category);
            case RB -> runningBack(category);
        };
        if (rule == null) {
            return EvaluationResult.abstain(evaluatorName(),
                "no reliability rule for " + proposition.position() + " " + category.label());
        }
        return EvaluationResult.scored(evaluatorName(), 50 + rule.adjustment(), List.of(rule.note()));
    }

    private record Rule(double adjustment, String note) {}

    private static Rule quarterback(StatCategory category) {
        if (category.isTouchdown())                  return new Rule(-8, "Passing TD: moderate variance");
        if (category == StatCategory.PASS_YARDS)       return new Rule(12, "Pass yards: high reliability");
        if (category == StatCategory.PASS_ATTEMPTS)    return new Rule(10, "Pass attempts: high reliability");
        if (category == StatCategory.PASS_COMPLETIONS) return new Rule(8, "Pass completions: good reliability");
        return null;
    }

    private static Rule passCatcher(StatCategory category) {
        if (category.isTouchdown())            return new Rule(-10, "TD line: high variance");
        if (category == StatCategory.REC_YARDS)  return new Rule(5, "Receiving yards: moderate reliability");
        if (category == StatCategory.RECEPTIONS) return new Rule(8, "Receptions: high reliability");
        return null;
    }

    private static Rule runningBack(StatCategory category) {
        if (category.isTouchdown())             return new Rule(-10, "TD line: high variance");
        if (category == StatCategory.RUSH_YARDS) return new Rule(3, "Rushing yards: moderate reliability");
        return null;
    }
}
