package com.propplatform.analysis.service;

import com.propplatform.analysis.evaluator.Evaluator;
import com.propplatform.common.model.EvaluationResult;
import com.propplatform.common.model.Proposition;
import com.propplatform.common.model.PropositionContext;
import com.propplatform.common.model.SignalFamily;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;
import java.util.function.Supplier;

/** Evaluator with a fixed behaviour that counts its invocations. */
class StubEvaluator implements Evaluator {

    private final SignalFamily family;
    private final BiFunction<Proposition, PropositionContext, EvaluationResult> behaviour;
    final AtomicInteger calls = new AtomicInteger();

    StubEvaluator(SignalFamily family, BiFunction<Proposition, PropositionContext, EvaluationResult> behaviour) {
        this.family    = family;
        this.behaviour = behaviour;
    }

    static StubEvaluator scoring(SignalFamily family, double score) {
        return new StubEvaluator(family,
            (p, c) -> EvaluationResult.scored(family.evaluatorName(), score, List.of("stub " + score)));
    }

    static StubEvaluator abstaining(SignalFamily family) {
        return new StubEvaluator(family, (p, c) -> EvaluationResult.abstain(family.evaluatorName(), "stub"));
    }

    /** Returns whatever {@code supplier} builds, including null or an invalid score. */
    static StubEvaluator returning(SignalFamily family, Supplier<EvaluationResult> supplier) {
        return new StubEvaluator(family, (p, c) -> supplier.get());
    }

    static StubEvaluator failing(SignalFamily family, String message) {
        return new StubEvaluator(family, (p, c) -> { throw new IllegalStateException(message); });
    }

    @Override
    public EvaluationResult analyze(Proposition proposition, PropositionContext context) {
        calls.incrementAndGet();
        return behaviour.apply(proposition, context);
    }

    @Override
    public SignalFamily family() {
        return family;
    }
}
