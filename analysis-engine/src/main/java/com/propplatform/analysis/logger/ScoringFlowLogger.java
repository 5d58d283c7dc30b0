package com.propplatform.analysis.logger;

import com.propplatform.common.trace.RunContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Logs the stages of a scoring run without touching the pipeline's values.
 *
 * <p>Stages, in order:
 * <ol>
 *   <li>{@link #RUN_STARTED}        propositions accepted and validated</li>
 *   <li>{@link #SNAPSHOT_LOADED}    weight snapshot read for the run</li>
 *   <li>{@link #CONTEXTS_RESOLVED}  every proposition's context materialised</li>
 *   <li>{@link #RUN_COMPLETED}      all propositions scored</li>
 * </ol>
 *
 * <p>The run id is read from the Reactor Context carried by the signal and
 * bridged into MDC only for the duration of the log call:
 * <pre>
 *     .doOnEach(flowLogger.stage(ScoringFlowLogger.SNAPSHOT_LOADED))
 * </pre>
 */
@Component
public class ScoringFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(ScoringFlowLogger.class);

    public static final String RUN_STARTED       = "RUN_STARTED";
    public static final String SNAPSHOT_LOADED   = "SNAPSHOT_LOADED";
    public static final String CONTEXTS_RESOLVED = "CONTEXTS_RESOLVED";
    public static final String RUN_COMPLETED     = "RUN_COMPLETED";

    /** A {@code doOnEach} consumer that logs {@code stageName} for each emitted value. */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String runId = RunContextUtil.getRunId(signal.getContextView());
            RunContextUtil.withMdc(runId, () ->
                log.info("[ScoringFlow] stage={} runId={}", stageName, runId)
            );
        };
    }

    /** Logs a stage with a count when the run id is already at hand. */
    public void logWithRunId(String stageName, String runId, int count) {
        RunContextUtil.withMdc(runId, () ->
            log.info("[ScoringFlow] stage={} runId={} count={}", stageName, runId, count)
        );
    }
}
