package com.propplatform.analysis.evaluator;

import com.propplatform.common.model.AlignmentProfile;
import com.propplatform.common.model.DefenseProfile;
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

/**
 * Position-specific defensive matchup.
 *
 * <ul>
 *   <li>QB: opponent pass-defense DVOA</li>
 *   <li>WR: coverage DVOA against the receiver's role (WR1/WR2/WR3), where the
 *       role is derived from alignment and target share</li>
 *   <li>TE: coverage DVOA against tight ends</li>
 *   <li>RB: run-defense DVOA for rushing, coverage DVOA against backs for receiving</li>
 * </ul>
 */
@Component
public class MatchupEvaluator implements Evaluator {

    private static final Logger log = LoggerFactory.getLogger(MatchupEvaluator.class);

    enum ReceiverRole { WR1, WR2, WR3 }

    @Override
    public SignalFamily family() { return SignalFamily.MATCHUP; }

    @Override
    public EvaluationResult analyze(Proposition proposition, PropositionContext context) {
        DefenseProfile defense = context.opponentDefense();
        if (defense == null) {
            return EvaluationResult.abstain(evaluatorName(),
                "position-specific defensive data unavailable for " + proposition.opponent());
        }

        List<String> rationale = new ArrayList<>();
        double score;
        switch (proposition.position()) {
            case QB -> score = 50 + quarterback(defense, proposition, rationale);
            case WR -> score = 50 + receiver(defense, context, rationale);
            case TE -> score = 50 + tightEnd(defense, rationale);
            case RB -> {
                if (proposition.category().isRushing()) {
                    score = 50 + runningBackRushing(defense, proposition, rationale);
                } else if (proposition.category().isReceiving()) {
                    score = 50 + runningBackReceiving(defense, rationale);
                } else {
                    return EvaluationResult.abstain(evaluatorName(),
                        "no matchup rule for RB " + proposition.category().label());
                }
            }
            default -> throw new IllegalStateException("Unhandled position " + proposition.position());
        }

        if (score > 50) {
            rationale.add(0, "Position matchup favors OVER");
        } else if (score < 50) {
            rationale.add(0, "Position matchup favors UNDER");
        }
        log.debug("[{}] entity={} score={}", evaluatorName(), proposition.entity(), score);
        return EvaluationResult.scored(evaluatorName(), score, rationale);
    }

    private double quarterback(DefenseProfile defense, Proposition proposition, List<String> rationale) {
        double dvoa = defense.passDefenseDvoa();
        if (dvoa >= 20) {
            rationale.add(fmt("Weak pass defense: %s allows %+.1f%% DVOA", proposition.opponent(), dvoa));
            return 25;
        } else if (dvoa >= 5) {
            rationale.add(fmt("Favorable pass matchup: %+.1f%% DVOA", dvoa));
            return 15;
        } else if (dvoa >= -10) {
            rationale.add(fmt("Neutral pass matchup: %.1f%% DVOA", dvoa));
            return 0;
        } else if (dvoa >= -25) {
            rationale.add(fmt("Strong pass defense: %.1f%% DVOA", dvoa));
            return -12;
        }
        rationale.add(fmt("Elite pass defense: %.1f%% DVOA", dvoa));
        return -20;
    }

    private double receiver(DefenseProfile defense, PropositionContext context, List<String> rationale) {
        AlignmentProfile alignment = context.alignment() != null
            ? context.alignment()
            : new AlignmentProfile(0, 0, 0, 0);
        double targetShare = context.usage() != null ? context.usage().targetSharePct() : 0;
        ReceiverRole role = classify(alignment, targetShare);

        double adjustment = 0;
        if (alignment.slotPct() >= 60) {
            rationale.add(fmt("Slot receiver (%.0f%% slot routes)", alignment.slotPct()));
        } else if (alignment.widePct() >= 70) {
            rationale.add(fmt("Outside receiver (%.0f%% wide routes)", alignment.widePct()));
        }
        if (alignment.slotPct() >= 50 && alignment.slotYardsPerRoute() >= 2.0) {
            adjustment += 5;
            rationale.add(fmt("Efficient from slot: %.1f yds/route", alignment.slotYardsPerRoute()));
        } else if (alignment.widePct() >= 50 && alignment.wideYardsPerRoute() >= 2.5) {
            adjustment += 5;
            rationale.add(fmt("Efficient from outside: %.1f yds/route", alignment.wideYardsPerRoute()));
        }

        double dvoa = switch (role) {
            case WR1 -> defense.vsWr1Dvoa();
            case WR2 -> defense.vsWr2Dvoa();
            case WR3 -> defense.vsWr3Dvoa();
        };
        return adjustment + coverage(role.name(), dvoa, rationale);
    }

    /** Slot-heavy receivers face slot coverage; otherwise role follows target share. */
    static ReceiverRole classify(AlignmentProfile alignment, double targetShare) {
        if (alignment.slotPct() >= 60) return ReceiverRole.WR3;
        if (alignment.widePct() >= 70 && targetShare >= 22) return ReceiverRole.WR1;
        if (alignment.widePct() >= 50 && targetShare >= 15) return ReceiverRole.WR2;
        if (targetShare >= 22) return ReceiverRole.WR1;
        if (targetShare >= 15) return ReceiverRole.WR2;
        return ReceiverRole.WR3;
    }

    private double coverage(String role, double dvoa, List<String> rationale) {
        if (dvoa >= 50) {
            rationale.add(fmt("Premium %s matchup: %+.1f%% DVOA", role, dvoa));
            return 25;
        } else if (dvoa >= 30) {
            rationale.add(fmt("Elite %s matchup: %+.1f%% DVOA", role, dvoa));
            return 20;
        } else if (dvoa >= 15) {
            rationale.add(fmt("Great %s matchup: %+.1f%% DVOA", role, dvoa));
            return 12;
        } else if (dvoa >= 5) {
            rationale.add(fmt("Favorable %s matchup: %+.1f%% DVOA", role, dvoa));
            return 5;
        } else if (dvoa >= -15) {
            rationale.add(fmt("Neutral %s matchup: %.1f%% DVOA", role, dvoa));
            return 0;
        } else if (dvoa >= -30) {
            rationale.add(fmt("Tough %s matchup: %.1f%% DVOA", role, dvoa));
            return -10;
        }
        rationale.add(fmt("Elite %s coverage: %.1f%% DVOA", role, dvoa));
        return -20;
    }

    private double tightEnd(DefenseProfile defense, List<String> rationale) {
        double dvoa = defense.vsTeDvoa();
        if (dvoa >= 5 && dvoa < 15) {
            // tight ends get no credit for a merely favorable matchup
            rationale.add(fmt("Neutral TE matchup: %.1f%% DVOA", dvoa));
            return 0;
        }
        return coverage("TE", dvoa, rationale);
    }

    private double runningBackRushing(DefenseProfile defense, Proposition proposition, List<String> rationale) {
        double dvoa = defense.rushDefenseDvoa();
        if (dvoa >= 25) {
            rationale.add(fmt("Weak run defense: %s allows %+.1f%% DVOA", proposition.opponent(), dvoa));
            return 25;
        } else if (dvoa >= 15) {
            rationale.add(fmt("Soft run defense: %+.1f%% DVOA", dvoa));
            return 20;
        } else if (dvoa >= 5) {
            rationale.add(fmt("Favorable run matchup: %+.1f%% DVOA", dvoa));
            return 12;
        } else if (dvoa >= -5) {
            rationale.add(fmt("Neutral run matchup: %.1f%% DVOA", dvoa));
            return 0;
        } else if (dvoa >= -15) {
            rationale.add(fmt("Strong run defense: %.1f%% DVOA", dvoa));
            return -12;
        } else if (dvoa >= -25) {
            rationale.add(fmt("Elite run defense: %.1f%% DVOA", dvoa));
            return -18;
        }
        rationale.add(fmt("Dominant run defense: %.1f%% DVOA", dvoa));
        return -25;
    }

    private double runningBackReceiving(DefenseProfile defense, List<String> rationale) {
        double dvoa = defense.vsRbDvoa();
        if (dvoa >= 40) {
            rationale.add(fmt("Weak against backfield receiving: %+.1f%% DVOA", dvoa));
            return 20;
        } else if (dvoa >= 15) {
            rationale.add(fmt("Favorable backfield receiving: %+.1f%% DVOA", dvoa));
            return 10;
        } else if (dvoa >= -15) {
            rationale.add(fmt("Neutral backfield receiving: %.1f%% DVOA", dvoa));
            return 0;
        } else if (dvoa <= -30) {
            rationale.add(fmt("Strong against backfield receiving: %.1f%% DVOA", dvoa));
            return -15;
        }
        return 0;
    }

    private static String fmt(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }
}
