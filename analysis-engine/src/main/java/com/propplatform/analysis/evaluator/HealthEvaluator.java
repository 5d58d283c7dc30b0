package com.propplatform.analysis.evaluator;

import com.propplatform.common.model.EvaluationResult;
import com.propplatform.common.model.InjuryStatus;
import com.propplatform.common.model.Proposition;
import com.propplatform.common.model.PropositionContext;
import com.propplatform.common.model.SignalFamily;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Injury report designation. Only a listed, limited player produces a signal;
 * healthy players abstain rather than voting neutral.
 *
 * <pre>
 *   OUT / IR / PUP / NFI → 0
 *   DOUBTFUL             → 20
 *   QUESTIONABLE         → 40
 * </pre>
 */
@Component
public class HealthEvaluator implements Evaluator {

    private static final Logger log = LoggerFactory.getLogger(HealthEvaluator.class);

    @Override
    public SignalFamily family() { return SignalFamily.HEALTH; }

    @Override
    public EvaluationResult analyze(Proposition proposition, PropositionContext context) {
        InjuryStatus status = context.injuryStatus();
        if (status == null || status == InjuryStatus.ACTIVE) {
            return EvaluationResult.abstain(evaluatorName(), "not on the injury report");
        }

        log.debug("[{}] entity={} status={}", evaluatorName(), proposition.entity(), status);
        if (status.isUnavailable()) {
            return EvaluationResult.scored(evaluatorName(), 0, List.of("Player out (" + status + ")"));
        }
        if (status == InjuryStatus.DOUBTFUL) {
            return EvaluationResult.scored(evaluatorName(), 20, List.of("Player doubtful"));
        }
        return EvaluationResult.scored(evaluatorName(), 40, List.of("Player questionable"));
    }
}
