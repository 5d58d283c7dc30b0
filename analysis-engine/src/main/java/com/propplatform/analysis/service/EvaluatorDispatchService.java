package com.propplatform.analysis.service;

import com.propplatform.analysis.evaluator.Evaluator;
import com.propplatform.common.exception.EvaluatorException;
import com.propplatform.common.model.EvaluationResult;
import com.propplatform.common.model.Proposition;
import com.propplatform.common.model.PropositionContext;
import com.propplatform.common.scoring.WeightSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Runs every enabled evaluator against one proposition on the scoring scheduler.
 *
 * <p>An evaluator whose snapshot weight is zero is not invoked. A failing
 * evaluator never fails the dispatch: its exception is wrapped in an
 * {@link EvaluatorException}, logged, and reported as an abstention. So is an
 * evaluator that returns {@code null} or a score outside [0, 100].
 * Results come back in evaluator registration order.
 */
@Service
public class EvaluatorDispatchService {

    private static final Logger log = LoggerFactory.getLogger(EvaluatorDispatchService.class);

    private final List<Evaluator> evaluators;
    private final Scheduler scheduler;

    public EvaluatorDispatchService(List<Evaluator> evaluators,
                                    @Qualifier("scoringScheduler") Scheduler scheduler) {
        this.evaluators = List.copyOf(evaluators);
        this.scheduler  = scheduler;
    }

    public Mono<List<EvaluationResult>> dispatchAll(Proposition proposition, PropositionContext context,
                                                    WeightSnapshot snapshot) {
        List<Evaluator> enabled = evaluators.stream()
            .filter(e -> snapshot.weightFor(e.evaluatorName()) > 0.0)
            .collect(Collectors.toList());
        log.debug("Dispatching {} of {} evaluators for proposition={}",
                  enabled.size(), evaluators.size(), proposition.id());

        return Flux.fromIterable(enabled)
            .flatMapSequential(evaluator -> Mono.fromCallable(() -> evaluator.analyze(proposition, context))
                .subscribeOn(scheduler)
                .switchIfEmpty(Mono.fromSupplier(() -> {
                    log.warn("Evaluator={} returned no result for proposition={}; treated as abstention",
                             evaluator.evaluatorName(), proposition.id());
                    return EvaluationResult.abstain(evaluator.evaluatorName(), "evaluator returned no result");
                }))
                .doOnNext(result -> logResult(proposition, result))
                .onErrorResume(e -> {
                    EvaluatorException failure = e instanceof EvaluatorException ee
                        ? ee
                        : new EvaluatorException(evaluator.evaluatorName(),
                              "failed for proposition=" + proposition.id() + ": " + e.getMessage(), e);
                    log.warn("Evaluator failure treated as abstention. {}", failure.getMessage(), failure);
                    return Mono.just(EvaluationResult.abstain(evaluator.evaluatorName(),
                        "evaluator failed: " + e.getMessage()));
                }))
            .collectList();
    }

    public List<String> evaluatorNames() {
        return evaluators.stream().map(Evaluator::evaluatorName).collect(Collectors.toList());
    }

    private void logResult(Proposition proposition, EvaluationResult result) {
        if (result instanceof EvaluationResult.Abstain abstain) {
            log.debug("Evaluator={} abstained for proposition={}. reason={}",
                      abstain.evaluator(), proposition.id(), abstain.reason());
        } else if (result instanceof EvaluationResult.Scored scored) {
            log.debug("Evaluator={} complete for proposition={}. score={} direction={}",
                      scored.evaluator(), proposition.id(), scored.score(), scored.direction());
        }
    }
}
