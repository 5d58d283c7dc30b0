package com.propplatform.analysis.evaluator;

import com.propplatform.common.model.DefenseProfile;
import com.propplatform.common.model.EvaluationResult;
import com.propplatform.common.model.Position;
import com.propplatform.common.model.Proposition;
import com.propplatform.common.model.PropositionContext;
import com.propplatform.common.model.SignalFamily;
import com.propplatform.common.model.TeamEfficiency;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Team efficiency: the offence's DVOA against the opponent's defensive DVOA.
 *
 * <p>Passing-game positions read passing DVOA on both sides. Running backs read
 * rushing DVOA for rushing categories and passing DVOA for receiving ones.
 */
@Component
public class EfficiencyEvaluator implements Evaluator {

    private static final Logger log = LoggerFactory.getLogger(EfficiencyEvaluator.class);

    @Override
    public SignalFamily family() { return SignalFamily.EFFICIENCY; }

    @Override
    public EvaluationResult analyze(Proposition proposition, PropositionContext context) {
        TeamEfficiency offense = context.offense();
        DefenseProfile defense = context.opponentDefense();
        if (offense == null || defense == null) {
            return EvaluationResult.abstain(evaluatorName(), "efficiency data not available");
        }

        List<String> rationale = new ArrayList<>();
        double score;
        if (proposition.position().isPassingGame()) {
            score = 50 + passingGame(offense, defense, proposition, rationale);
        } else if (proposition.position() == Position.RB && proposition.category().isRushing()) {
            score = 50 + rushing(offense, defense, proposition, rationale);
        } else if (proposition.position() == Position.RB && proposition.category().isReceiving()) {
            score = 50 + backfieldReceiving(offense, defense, rationale);
        } else {
            return EvaluationResult.abstain(evaluatorName(),
                "no efficiency rule for " + proposition.position() + " " + proposition.category().label());
        }

        if (score >= 65) {
            rationale.add(0, "Efficiency strongly favors OVER");
        } else if (score <= 35) {
            rationale.add(0, "Efficiency strongly favors UNDER");
        }
        log.debug("[{}] entity={} score={}", evaluatorName(), proposition.entity(), score);
        return EvaluationResult.scored(evaluatorName(), score, rationale);
    }

    private double passingGame(TeamEfficiency offense, DefenseProfile defense,
                               Proposition proposition, List<String> rationale) {
        double passOff = offense.passingDvoa();
        double passDef = defense.passDefenseDvoa();
        double adjustment = 0;

        if (passOff >= 10) {
            adjustment += 12;
            rationale.add(fmt("Elite passing offense: %s %+.1f%% pass DVOA", proposition.team(), passOff));
        } else if (passOff >= 5) {
            adjustment += 7;
            rationale.add(fmt("Strong passing offense: %+.1f%% pass DVOA", passOff));
        } else if (passOff >= 0) {
            adjustment += 2;
            rationale.add(fmt("Average passing offense: %+.1f%% pass DVOA", passOff));
        } else if (passOff <= -10) {
            adjustment -= 10;
            rationale.add(fmt("Weak passing offense: %.1f%% pass DVOA", passOff));
        }

        if (passDef >= 10) {
            adjustment += 14;
            rationale.add(fmt("Weak pass defense: %s %+.1f%%", proposition.opponent(), passDef));
        } else if (passDef >= 3) {
            adjustment += 9;
            rationale.add(fmt("Favorable pass defense: %+.1f%%", passDef));
        } else if (passDef >= 0) {
            adjustment += 3;
            rationale.add(fmt("Average pass defense: %+.1f%%", passDef));
        } else if (passDef <= -10) {
            adjustment -= 14;
            rationale.add(fmt("Elite pass defense: %.1f%%", passDef));
        }

        if (passOff >= 10 && passDef >= 5) {
            adjustment += 8;
            rationale.add("Premium matchup: elite passing offense vs weak pass defense");
        }
        return adjustment;
    }

    private double rushing(TeamEfficiency offense, DefenseProfile defense,
                           Proposition proposition, List<String> rationale) {
        double rushOff = offense.rushingDvoa();
        double rushDef = defense.rushDefenseDvoa();
        double adjustment = 0;

        if (rushOff >= 10) {
            adjustment += 12;
            rationale.add(fmt("Strong rushing offense: %+.1f%% rush DVOA", rushOff));
        } else if (rushOff <= -10) {
            adjustment -= 10;
            rationale.add(fmt("Weak rushing offense: %.1f%% rush DVOA", rushOff));
        }

        if (rushDef >= 10) {
            adjustment += 15;
            rationale.add(fmt("Weak run defense: %s %+.1f%%", proposition.opponent(), rushDef));
        } else if (rushDef <= -10) {
            adjustment -= 12;
            rationale.add(fmt("Elite run defense: %.1f%%", rushDef));
        }
        return adjustment;
    }

    private double backfieldReceiving(TeamEfficiency offense, DefenseProfile defense, List<String> rationale) {
        double adjustment = 0;
        if (offense.passingDvoa() >= 10) {
            adjustment += 10;
            rationale.add(fmt("Pass-catching back benefits: %+.1f%% pass DVOA", offense.passingDvoa()));
        }
        if (defense.passDefenseDvoa() >= 10) {
            adjustment += 8;
            rationale.add(fmt("Favorable for backfield receiving: %+.1f%% pass defense", defense.passDefenseDvoa()));
        }
        return adjustment;
    }

    private static String fmt(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }
}
