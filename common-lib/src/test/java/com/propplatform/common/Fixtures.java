package com.propplatform.common;

import com.propplatform.common.model.Direction;
import com.propplatform.common.model.EvaluatorContribution;
import com.propplatform.common.model.Position;
import com.propplatform.common.model.Proposition;
import com.propplatform.common.model.RecommendationTier;
import com.propplatform.common.model.ScoredProposition;
import com.propplatform.common.model.Side;
import com.propplatform.common.model.StatCategory;
import com.propplatform.common.scoring.AggregateConfidence;
import com.propplatform.common.scoring.ConfidenceAggregator;

import java.util.ArrayList;
import java.util.List;

/** Builders for test data shared across common-lib tests. */
public final class Fixtures {

    private Fixtures() {}

    public static Proposition proposition(String id, String entity, String team, String opponent) {
        return new Proposition(id, entity, team, opponent, Position.WR, StatCategory.REC_YARDS, 64.5, Side.OVER, true);
    }

    public static EvaluatorContribution contribution(String evaluator, double score, double weight) {
        return new EvaluatorContribution(evaluator, score, weight, Direction.fromScore(score), List.of());
    }

    /**
     * A scored OVER proposition whose drivers are computed from {@code contributions}
     * exactly as the orchestrator would.
     */
    public static ScoredProposition scored(Proposition proposition, EvaluatorContribution... contributions) {
        List<EvaluatorContribution> list = List.of(contributions);
        AggregateConfidence aggregate = ConfidenceAggregator.aggregate(list);
        return new ScoredProposition(proposition, aggregate.confidence(), aggregate.noSignal(),
                                     RecommendationTier.LEAN, list, aggregate.drivers(), new ArrayList<>(), "");
    }

    public static ScoredProposition scored(Proposition proposition, Side side, EvaluatorContribution... contributions) {
        ScoredProposition over = scored(proposition, contributions);
        int confidence = side == Side.OVER ? over.confidence() : 100 - over.confidence();
        return new ScoredProposition(proposition.withSide(side), confidence, over.noSignal(), over.tier(),
                                     over.contributions(), over.drivers(), over.abstained(), "");
    }
}
