package com.propplatform.analysis.service;

import com.propplatform.analysis.config.ScoringProperties;
import com.propplatform.analysis.logger.ScoringFlowLogger;
import com.propplatform.common.exception.ScoringAbortedException;
import com.propplatform.common.exception.ValidationException;
import com.propplatform.common.model.EvaluationResult;
import com.propplatform.common.model.EvaluatorContribution;
import com.propplatform.common.model.Proposition;
import com.propplatform.common.model.PropositionContext;
import com.propplatform.common.model.ScoredProposition;
import com.propplatform.common.model.Side;
import com.propplatform.common.model.TierThresholds;
import com.propplatform.common.provider.DataProvider;
import com.propplatform.common.scoring.AggregateConfidence;
import com.propplatform.common.scoring.ConfidenceAggregator;
import com.propplatform.common.scoring.SideTransform;
import com.propplatform.common.scoring.WeightSnapshot;
import com.propplatform.common.store.EvaluatorWeightStore;
import com.propplatform.common.trace.RunContextUtil;
import com.propplatform.common.validation.PropositionValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Turns propositions into {@link ScoredProposition}s.
 *
 * <h3>Per proposition</h3>
 * <ol>
 *   <li>Validate the proposition and its context.</li>
 *   <li>Dispatch every evaluator with a positive snapshot weight.</li>
 *   <li>Aggregate the OVER-oriented scores of the non-abstaining evaluators
 *       ({@link ConfidenceAggregator}).</li>
 *   <li>Orient to the proposition's side: UNDER confidence is the
 *       {@link SideTransform#complement} of the OVER confidence.</li>
 *   <li>Assign the tier and build the edge explanation.</li>
 * </ol>
 *
 * <h3>Runs</h3>
 * {@link #scoreAll} reads one {@link WeightSnapshot} and resolves every context
 * before the first evaluator runs, so a calibration that commits mid-run has no
 * effect on it. Propositions are scored with bounded concurrency and the result
 * keeps the input order. A timeout aborts the whole run.
 */
@Service
public class ScoringOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ScoringOrchestrator.class);

    private final EvaluatorDispatchService dispatchService;
    private final EvaluatorWeightStore weightStore;
    private final Optional<DataProvider> dataProvider;
    private final ScoringProperties properties;
    private final ScoringFlowLogger flowLogger;
    private final TierThresholds tiers;

    public ScoringOrchestrator(EvaluatorDispatchService dispatchService,
                               EvaluatorWeightStore weightStore,
                               Optional<DataProvider> dataProvider,
                               ScoringProperties properties,
                               ScoringFlowLogger flowLogger) {
        this.dispatchService = dispatchService;
        this.weightStore     = weightStore;
        this.dataProvider    = dataProvider;
        this.properties      = properties;
        this.flowLogger      = flowLogger;
        this.tiers           = properties.tierThresholds();
    }

    /** Scores with the context supplied by the configured {@link DataProvider}. */
    public Mono<ScoredProposition> score(Proposition proposition) {
        return Mono.defer(() -> {
            PropositionValidator.validate(proposition);
            return resolveContext(proposition).flatMap(context -> score(proposition, context));
        });
    }

    public Mono<ScoredProposition> score(Proposition proposition, PropositionContext context) {
        return Mono.defer(() -> {
            PropositionValidator.validate(proposition, context);
            return loadSnapshot().flatMap(snapshot -> evaluate(proposition, context, snapshot));
        });
    }

    public Mono<ScoredProposition> score(Proposition proposition, PropositionContext context,
                                         WeightSnapshot snapshot) {
        return Mono.defer(() -> {
            PropositionValidator.validate(proposition, context);
            return evaluate(proposition, context, snapshot);
        });
    }

    /** Scores both sides of one line; the UNDER entry is the complement of the OVER entry. */
    public Mono<List<ScoredProposition>> scoreBothSides(Proposition proposition, PropositionContext context) {
        return score(proposition.withSide(Side.OVER), context)
            .map(over -> List.of(over, complementOf(over)));
    }

    public Mono<List<ScoredProposition>> scoreAll(List<Proposition> propositions) {
        return scoreAll(propositions, properties.getTimeout());
    }

    /**
     * @param timeout upper bound for the whole run, or {@code null} for none
     * @return scored propositions in input order; fails with
     *         {@link ScoringAbortedException} on timeout, without partial results
     */
    public Mono<List<ScoredProposition>> scoreAll(List<Proposition> propositions, Duration timeout) {
        String runId = RunContextUtil.newRunId();
        Mono<List<ScoredProposition>> run = Mono.defer(() -> {
            propositions.forEach(PropositionValidator::validate);
            flowLogger.logWithRunId(ScoringFlowLogger.RUN_STARTED, runId, propositions.size());

            return loadSnapshot()
                .doOnEach(flowLogger.stage(ScoringFlowLogger.SNAPSHOT_LOADED))
                .flatMap(snapshot -> resolveContexts(propositions)
                    .doOnEach(flowLogger.stage(ScoringFlowLogger.CONTEXTS_RESOLVED))
                    .flatMap(contexts -> Flux.range(0, propositions.size())
                        .flatMapSequential(i -> evaluate(propositions.get(i), contexts.get(i), snapshot),
                                           Math.max(1, properties.getMaxConcurrency()))
                        .collectList()))
                .doOnNext(scored -> flowLogger.logWithRunId(ScoringFlowLogger.RUN_COMPLETED, runId, scored.size()));
        });

        if (timeout != null) {
            run = run.timeout(timeout)
                .onErrorMap(TimeoutException.class, e -> {
                    log.warn("Scoring run aborted. runId={} timeout={}", runId, timeout);
                    return new ScoringAbortedException(
                        "Scoring run " + runId + " exceeded " + timeout + " for " + propositions.size()
                            + " propositions", e);
                });
        }
        return RunContextUtil.withRunId(run, runId);
    }

    /** The opposite side of an already scored line, derived only through {@link SideTransform}. */
    public ScoredProposition complementOf(ScoredProposition scored) {
        Proposition flipped = scored.proposition().withSide(scored.proposition().side().opposite());
        int confidence = SideTransform.complement(scored.confidence());
        return new ScoredProposition(
            flipped, confidence, scored.noSignal(), tiers.tierFor(confidence),
            scored.contributions(), scored.drivers(), scored.abstained(),
            ConfidenceAggregator.explain(confidence, flipped.side(), scored.noSignal(),
                                         scored.contributions(), scored.drivers()));
    }

    /** Stored weights with configured overrides and disabled evaluators applied. */
    public Mono<WeightSnapshot> loadSnapshot() {
        return weightStore.findAllWeights()
            .map(WeightSnapshot::fromWeights)
            .map(snapshot -> snapshot.withOverrides(properties.effectiveOverrides()));
    }

    private Mono<ScoredProposition> evaluate(Proposition proposition, PropositionContext context,
                                             WeightSnapshot snapshot) {
        return dispatchService.dispatchAll(proposition, context, snapshot)
            .map(results -> assemble(proposition, results, snapshot));
    }

    ScoredProposition assemble(Proposition proposition, List<EvaluationResult> results, WeightSnapshot snapshot) {
        List<EvaluatorContribution> contributions = new ArrayList<>();
        List<String> abstained = new ArrayList<>();
        for (EvaluationResult result : results) {
            if (result instanceof EvaluationResult.Scored scored) {
                contributions.add(new EvaluatorContribution(scored.evaluator(), scored.score(),
                    snapshot.weightFor(scored.evaluator()), scored.direction(), scored.rationale()));
            } else {
                abstained.add(result.evaluator());
            }
        }

        AggregateConfidence aggregate = ConfidenceAggregator.aggregate(contributions);
        int confidence = proposition.side() == Side.OVER
            ? aggregate.confidence()
            : SideTransform.complement(aggregate.confidence());

        if (aggregate.noSignal()) {
            log.info("No signal for proposition={} entity={}; all {} evaluators abstained",
                     proposition.id(), proposition.entity(), abstained.size());
        } else {
            log.debug("Scored proposition={} side={} confidence={} contributors={} abstained={}",
                      proposition.id(), proposition.side(), confidence, contributions.size(), abstained);
        }

        return new ScoredProposition(
            proposition, confidence, aggregate.noSignal(), tiers.tierFor(confidence),
            contributions, aggregate.drivers(), abstained,
            ConfidenceAggregator.explain(confidence, proposition.side(), aggregate.noSignal(),
                                         contributions, aggregate.drivers()));
    }

    private Mono<PropositionContext> resolveContext(Proposition proposition) {
        return dataProvider
            .map(provider -> provider.getContext(proposition.id())
                .switchIfEmpty(Mono.error(() -> new ValidationException(
                    "context", "no context for proposition " + proposition.id()))))
            .orElseGet(() -> Mono.error(new IllegalStateException(
                "No DataProvider configured; supply a context to score proposition " + proposition.id())));
    }

    private Mono<List<PropositionContext>> resolveContexts(List<Proposition> propositions) {
        return Flux.fromIterable(propositions)
            .flatMapSequential(p -> resolveContext(p)
                .doOnNext(context -> PropositionValidator.validate(p, context)))
            .collectList();
    }
}
