package com.propplatform.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

import java.util.UUID;

/**
 * Carries the id of a scoring or calibration run through reactive pipelines.
 *
 * <p>Reactor Context is the single source of truth for the run id. MDC is only
 * written as a temporary bridge around a log statement, never as a persistent
 * ThreadLocal store.
 *
 * <pre>
 *     return RunContextUtil.withRunId(pipeline, runId);
 *     ...
 *     .doOnEach(signal -> RunContextUtil.withMdc(RunContextUtil.getRunId(signal.getContextView()), ...))
 * </pre>
 */
public final class RunContextUtil {

    public static final String RUN_ID_KEY = "runId";

    private RunContextUtil() {}

    public static String newRunId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * Stores {@code runId} in the Reactor Context. {@code contextWrite} propagates
     * upstream during subscription, so call this at the end of pipeline assembly.
     */
    public static <T> Mono<T> withRunId(Mono<T> mono, String runId) {
        return mono.contextWrite(ctx -> ctx.put(RUN_ID_KEY, runId));
    }

    /** Returns {@code "unknown"} if no run id is present: never {@code null}. */
    public static String getRunId(ContextView ctx) {
        return ctx.getOrDefault(RUN_ID_KEY, "unknown");
    }

    /**
     * Bridges {@code runId} into MDC for the duration of {@code logAction} only.
     */
    public static void withMdc(String runId, Runnable logAction) {
        MDC.put(RUN_ID_KEY, runId);
        try {
            logAction.run();
        } finally {
            MDC.remove(RUN_ID_KEY);
        }
    }
}
