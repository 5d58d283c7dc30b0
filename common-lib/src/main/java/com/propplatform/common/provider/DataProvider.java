package com.propplatform.common.provider;

import com.propplatform.common.model.PropositionContext;
import reactor.core.publisher.Mono;

/**
 * Source of the read-only context an evaluator may need. How the statistics are
 * gathered is outside the platform; the context must be fully materialised when
 * the returned {@link Mono} emits, because scoring never performs I/O.
 */
public interface DataProvider {

    /**
     * @return the context for {@code propositionId}; empty when nothing is known about it
     */
    Mono<PropositionContext> getContext(String propositionId);
}
