package com.propplatform.analysis.evaluator;

import com.propplatform.common.model.EvaluationResult;
import com.propplatform.common.model.Proposition;
import com.propplatform.common.model.PropositionContext;
import com.propplatform.common.model.SignalFamily;
import com.propplatform.common.model.TrendDirection;
import com.propplatform.common.model.UsageProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Opportunity share: snaps and pass attempts for quarterbacks, target share for
 * pass catchers, snaps / touches / carries for running backs. A usage trend
 * shifts every position by the same amount.
 */
@Component
public class UsageEvaluator implements Evaluator {

    private static final Logger log = LoggerFactory.getLogger(UsageEvaluator.class);

    @Override
    public SignalFamily family() { return SignalFamily.USAGE; }

    @Override
    public EvaluationResult analyze(Proposition proposition, PropositionContext context) {
        UsageProfile usage = context.usage();
        if (usage == null) {
            return EvaluationResult.abstain(evaluatorName(), "limited usage data");
        }

        List<String> rationale = new ArrayList<>();
        double score = 50;
        switch (proposition.position()) {
            case QB -> score += quarterback(usage, rationale);
            case WR, TE -> score += passCatcher(usage, rationale);
            case RB -> score += runningBack(usage, proposition, rationale);
            default -> throw new IllegalStateException("Unhandled position " + proposition.position());
        }

        if (usage.trend() == TrendDirection.INCREASING) {
            score += 10;
            rationale.add("Usage trending up");
        } else if (usage.trend() == TrendDirection.DECREASING) {
            score -= 10;
            rationale.add("Usage trending down");
        }

        if (score >= 70) {
            rationale.add(0, "Volume strongly supports OVER");
        }
        log.debug("[{}] entity={} score={}", evaluatorName(), proposition.entity(), score);
        return EvaluationResult.scored(evaluatorName(), score, rationale);
    }

    private double quarterback(UsageProfile usage, List<String> rationale) {
        double adjustment = 0;
        double snaps = usage.snapSharePct();
        if (snaps >= 90) {
            adjustment += 15;
            rationale.add(fmt("Elite starter: %.1f%% snaps", snaps));
        } else if (snaps >= 75) {
            adjustment += 10;
            rationale.add(fmt("Strong starter: %.1f%% snaps", snaps));
        } else if (snaps >= 50) {
            adjustment += 5;
            rationale.add(fmt("Regular starter: %.1f%% snaps", snaps));
        } else if (snaps < 30) {
            adjustment -= 15;
            rationale.add(fmt("Limited role: %.1f%% snaps", snaps));
        }

        double attempts = usage.passAttempts();
        if (attempts >= 40) {
            adjustment += 8;
            rationale.add(fmt("High volume: %.0f attempts", attempts));
        } else if (attempts > 0 && attempts < 15) {
            adjustment -= 8;
            rationale.add(fmt("Low volume: %.0f attempts", attempts));
        }
        return adjustment;
    }

    private double passCatcher(UsageProfile usage, List<String> rationale) {
        double share = usage.targetSharePct();
        if (share >= 28) {
            rationale.add(fmt("Elite volume: %.1f%% targets", share));
            return 22;
        } else if (share >= 22) {
            rationale.add(fmt("High volume: %.1f%% targets", share));
            return 15;
        } else if (share >= 15) {
            rationale.add(fmt("Solid volume: %.1f%% targets", share));
            return 8;
        } else if (share < 10) {
            rationale.add(fmt("Low volume: only %.1f%% targets", share));
            return -15;
        }
        return 0;
    }

    private double runningBack(UsageProfile usage, Proposition proposition, List<String> rationale) {
        double adjustment = 0;

        double snaps = usage.snapSharePct();
        if (snaps >= 75) {
            adjustment += 22;
            rationale.add(fmt("Bellcow: %.1f%% snaps", snaps));
        } else if (snaps >= 60) {
            adjustment += 12;
            rationale.add(fmt("Lead back: %.1f%% snaps", snaps));
        } else if (snaps < 35) {
            adjustment -= 18;
            rationale.add(fmt("Limited role: %.1f%% snaps", snaps));
        }

        double touches = usage.touchPct();
        if (touches >= 50) {
            adjustment += 10;
            rationale.add(fmt("High touch share: %.1f%%", touches));
        } else if (touches >= 35) {
            adjustment += 5;
            rationale.add(fmt("Good touch share: %.1f%%", touches));
        } else if (touches > 0 && touches < 25) {
            adjustment -= 10;
            rationale.add(fmt("Low touch share: %.1f%%", touches));
        }

        double carryShare = usage.rushAttemptPct();
        if (carryShare >= 70) {
            adjustment += 8;
            rationale.add(fmt("Workhorse: %.1f%% of team carries", carryShare));
        } else if (carryShare >= 50) {
            adjustment += 4;
            rationale.add(fmt("Primary back: %.1f%% of team carries", carryShare));
        }

        if (proposition.category().isRushing()) {
            double carries = usage.rushAttempts();
            if (carries >= 18) {
                adjustment += 8;
                rationale.add(fmt("Elite volume: %.0f attempts/game", carries));
            } else if (carries >= 12) {
                adjustment += 4;
                rationale.add(fmt("Good volume: %.0f attempts/game", carries));
            }
        }
        return adjustment;
    }

    private static String fmt(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }
}
