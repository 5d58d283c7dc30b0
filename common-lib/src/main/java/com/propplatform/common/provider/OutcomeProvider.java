package com.propplatform.common.provider;

import com.propplatform.common.model.Outcome;
import reactor.core.publisher.Mono;

/**
 * Source of realised results, consumed only by weight calibration.
 */
public interface OutcomeProvider {

    /**
     * @return the outcome of {@code propositionId}; empty while it is still unresolved
     */
    Mono<Outcome> getOutcome(String propositionId);
}
