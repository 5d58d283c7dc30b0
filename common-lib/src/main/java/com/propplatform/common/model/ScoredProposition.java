package com.propplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Final scoring of one proposition.
 *
 * <ul>
 *   <li>{@code confidence}   : calibrated confidence in [0, 100] for {@code proposition.side()}</li>
 *   <li>{@code noSignal}     : true when no evaluator contributed; confidence is then the neutral 50</li>
 *   <li>{@code contributions}: non-abstaining evaluators with their OVER-oriented scores and weights</li>
 *   <li>{@code drivers}      : top contributing evaluators, strongest first, with % of total pull</li>
 *   <li>{@code abstained}    : evaluators that had no opinion (or failed) on this proposition</li>
 * </ul>
 */
public record ScoredProposition(
    @JsonProperty("proposition")     Proposition proposition,
    @JsonProperty("confidence")      int confidence,
    @JsonProperty("noSignal")        boolean noSignal,
    @JsonProperty("tier")            RecommendationTier tier,
    @JsonProperty("contributions")   List<EvaluatorContribution> contributions,
    @JsonProperty("drivers")         List<DriverShare> drivers,
    @JsonProperty("abstained")       List<String> abstained,
    @JsonProperty("edgeExplanation") String edgeExplanation
) {
    public ScoredProposition {
        contributions = contributions == null ? List.of() : List.copyOf(contributions);
        drivers       = drivers == null ? List.of() : List.copyOf(drivers);
        abstained     = abstained == null ? List.of() : List.copyOf(abstained);
    }

    /** Names of the top contributing evaluators, strongest first. */
    public Set<String> driverNames() {
        Set<String> names = new LinkedHashSet<>();
        for (DriverShare driver : drivers) {
            names.add(driver.evaluator());
        }
        return names;
    }

    public String entity() {
        return proposition.entity();
    }
}
