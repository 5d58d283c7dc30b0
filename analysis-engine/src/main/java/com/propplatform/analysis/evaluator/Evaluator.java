package com.propplatform.analysis.evaluator;

import com.propplatform.common.model.EvaluationResult;
import com.propplatform.common.model.Proposition;
import com.propplatform.common.model.PropositionContext;
import com.propplatform.common.model.SignalFamily;

/**
 * One independent heuristic signal. Implementations are pure: they read only
 * the proposition and its already-materialised context, and return
 * {@link EvaluationResult.Abstain} when the data they depend on is missing.
 *
 * <p>Scores are always OVER-oriented; the orchestrator derives the UNDER side.
 */
public interface Evaluator {

    EvaluationResult analyze(Proposition proposition, PropositionContext context);

    SignalFamily family();

    default String evaluatorName() {
        return family().evaluatorName();
    }
}
