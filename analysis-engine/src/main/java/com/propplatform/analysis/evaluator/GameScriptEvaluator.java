package com.propplatform.analysis.evaluator;

import com.propplatform.common.model.EvaluationResult;
import com.propplatform.common.model.GameLine;
import com.propplatform.common.model.Position;
import com.propplatform.common.model.Proposition;
import com.propplatform.common.model.PropositionContext;
import com.propplatform.common.model.SignalFamily;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Expected game flow from the market's total and spread. High totals lift every
 * position; a large spread favours the favourite's running game and the
 * underdog's passing game.
 */
@Component
public class GameScriptEvaluator implements Evaluator {

    private static final Logger log = LoggerFactory.getLogger(GameScriptEvaluator.class);

    private static final double LARGE_SPREAD = 7.0;

    @Override
    public SignalFamily family() { return SignalFamily.GAME_SCRIPT; }

    @Override
    public EvaluationResult analyze(Proposition proposition, PropositionContext context) {
        GameLine line = context.gameLine();
        if (line == null) {
            return EvaluationResult.abstain(evaluatorName(), "no game line");
        }

        Position position = proposition.position();
        boolean rbRushing = position == Position.RB && proposition.category().isRushing();
        double total = line.total();
        List<String> rationale = new ArrayList<>();
        double score = 50;

        if (total >= 51) {
            score += 18;
            rationale.add(fmt("Shootout expected (%.1f total)", total));
            if (position.isPassingGame()) {
                score += 7;
                rationale.add("Passing volume elevated in shootout");
            }
        } else if (total >= 48) {
            score += 12;
            rationale.add(fmt("High-scoring game (%.1f total)", total));
        } else if (total >= 44) {
            score += 5;
            rationale.add(fmt("Moderate-scoring game (%.1f total)", total));
            if (position.isPassingGame()) {
                score += 3;
                rationale.add("Pass-friendly environment expected");
            }
        } else if (total <= 40) {
            score -= 12;
            rationale.add(fmt("Low total (%.1f) limits opportunities", total));
            if (rbRushing) {
                score += 15;
                rationale.add("Low total favors running back volume");
            }
        }

        if (Math.abs(line.spread()) >= LARGE_SPREAD) {
            if (line.teamFavoured()) {
                if (rbRushing) {
                    score += 12;
                    rationale.add("Big favorite, clock-killing run volume");
                } else if (position.isPassCatcher() && total < 48) {
                    score -= 8;
                    rationale.add("Big favorite may ease off passing");
                }
            } else {
                if (position.isPassingGame()) {
                    score += 15;
                    rationale.add("Big underdog, pass-heavy game script");
                } else if (rbRushing) {
                    score -= 12;
                    rationale.add("Big underdog, limited run volume");
                }
            }
        }

        if (score >= 65) {
            rationale.add(0, "Game script strongly favors OVER");
        }
        log.debug("[{}] entity={} total={} spread={} score={}",
                  evaluatorName(), proposition.entity(), total, line.spread(), score);
        return EvaluationResult.scored(evaluatorName(), score, rationale);
    }

    private static String fmt(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }
}
