package com.propplatform.analysis.evaluator;

import com.propplatform.common.model.EvaluationResult;
import com.propplatform.common.model.Proposition;
import com.propplatform.common.model.PropositionContext;
import com.propplatform.common.model.SignalFamily;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * How often the entity's recent results cleared this line.
 *
 * <pre>
 *   over rate  ≥ 70% → 70 + (rate − 70) × 0.5
 *   over rate  ≥ 60% → 60 + (rate − 60)
 *   under rate ≥ 70% → 30 − (rate − 70) × 0.5
 *   under rate ≥ 60% → 40 − (rate − 60)
 *   otherwise        → 50 ± |over − under| × 0.3
 * </pre>
 * The last three results all on one side add or subtract a further 5.
 */
@Component
public class HitRateEvaluator implements Evaluator {

    private static final Logger log = LoggerFactory.getLogger(HitRateEvaluator.class);

    public static final int MIN_RESULTS = 3;
    private static final int STREAK     = 3;
    private static final int SHOWN      = 5;

    @Override
    public SignalFamily family() { return SignalFamily.HIT_RATE; }

    @Override
    public EvaluationResult analyze(Proposition proposition, PropositionContext context) {
        List<Double> results = context.recentResults();
        if (results.size() < MIN_RESULTS) {
            return EvaluationResult.abstain(evaluatorName(),
                "only " + results.size() + " recent results (need " + MIN_RESULTS + ")");
        }

        double line = proposition.line();
        int games  = results.size();
        int overs  = (int) results.stream().filter(v -> v > line).count();
        int unders = (int) results.stream().filter(v -> v < line).count();
        int pushes = games - overs - unders;
        double overRate  = overs * 100.0 / games;
        double underRate = unders * 100.0 / games;

        List<String> rationale = new ArrayList<>();
        double score;
        if (overRate >= 70) {
            score = 70 + (overRate - 70) * 0.5;
            rationale.add(fmt("Hit OVER in %d/%d games (%.0f%%)", overs, games, overRate));
        } else if (overRate >= 60) {
            score = 60 + (overRate - 60);
            rationale.add(fmt("Hit OVER in %d/%d games (%.0f%%)", overs, games, overRate));
        } else if (underRate >= 70) {
            score = 30 - (underRate - 70) * 0.5;
            rationale.add(fmt("Hit UNDER in %d/%d games (%.0f%%)", unders, games, underRate));
        } else if (underRate >= 60) {
            score = 40 - (underRate - 60);
            rationale.add(fmt("Hit UNDER in %d/%d games (%.0f%%)", unders, games, underRate));
        } else {
            score = overRate > underRate
                ? 50 + (overRate - underRate) * 0.3
                : 50 - (underRate - overRate) * 0.3;
            rationale.add(fmt("Inconsistent: %dO/%dU/%dP in %d games", overs, unders, pushes, games));
        }

        List<Double> recent = results.subList(games - STREAK, games);
        if (recent.stream().allMatch(v -> v > line)) {
            score += 5;
            rationale.add("3-game streak over the line");
        } else if (recent.stream().allMatch(v -> v < line)) {
            score -= 5;
            rationale.add("3-game streak under the line");
        }

        String shown = results.subList(Math.max(0, games - SHOWN), games).stream()
            .map(v -> fmt("%.1f", v))
            .collect(Collectors.joining(", "));
        rationale.add(fmt("Last %d games: %s (line %.1f)", Math.min(SHOWN, games), shown, line));

        log.debug("[{}] entity={} overRate={} underRate={} score={}",
                  evaluatorName(), proposition.entity(), overRate, underRate, score);
        return EvaluationResult.scored(evaluatorName(), score, rationale);
    }

    private static String fmt(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }
}
