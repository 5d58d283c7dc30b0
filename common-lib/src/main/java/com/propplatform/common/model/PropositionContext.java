package com.propplatform.common.model;

import lombok.Builder;

import java.util.List;

/**
 * Read-only bundle of every input an evaluator may read for one proposition.
 *
 * <p>All inputs are resolved into memory before scoring starts; evaluators
 * never perform I/O. Any component may be {@code null} when the data source
 * had nothing for this proposition, and evaluators that depend on it abstain.
 *
 * @param recentResults the entity's recent results in this category, oldest first
 */
@Builder(toBuilder = true)
public record PropositionContext(
    String propositionId,
    TeamEfficiency offense,
    DefenseProfile opponentDefense,
    UsageProfile usage,
    AlignmentProfile alignment,
    GameLine gameLine,
    InjuryStatus injuryStatus,
    TrendProfile trend,
    WeatherReport weather,
    List<Double> recentResults
) {
    public PropositionContext {
        recentResults = recentResults == null ? List.of() : List.copyOf(recentResults);
    }

    public static PropositionContext empty(String propositionId) {
        return PropositionContext.builder().propositionId(propositionId).build();
    }
}
