package com.propplatform.common.scoring;

import com.propplatform.common.model.DriverShare;

import java.util.List;

/**
 * OVER-oriented result of {@link ConfidenceAggregator#aggregate}.
 *
 * @param confidence rounded weighted average in [0, 100]; 50 when {@code noSignal}
 * @param noSignal   true when nothing contributed
 * @param drivers    top contributors by pull, strongest first
 */
public record AggregateConfidence(int confidence, boolean noSignal, List<DriverShare> drivers) {

    public static final int NEUTRAL = 50;

    public static AggregateConfidence none() {
        return new AggregateConfidence(NEUTRAL, true, List.of());
    }
}
