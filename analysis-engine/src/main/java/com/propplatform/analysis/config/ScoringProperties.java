package com.propplatform.analysis.config;

import com.propplatform.common.model.TierThresholds;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Data
@ConfigurationProperties(prefix = "scoring")
public class ScoringProperties {

    // --- Worker pool ---
    private int workerThreads = 4;
    private int maxConcurrency = 16;

    /** Upper bound for one {@code scoreAll} run; unset means no limit. */
    private Duration timeout;

    // --- Recommendation tiers ---
    private int eliteThreshold = 75;
    private int strongThreshold = 70;
    private int moderateThreshold = 65;
    private int leanThreshold = 60;

    // --- Evaluator weights ---
    /** Applied on top of the stored weights for every run. */
    private Map<String, Double> weightOverrides = new HashMap<>();

    /** Evaluators that are never invoked. */
    private List<String> disabled = new ArrayList<>();

    public TierThresholds tierThresholds() {
        return new TierThresholds(eliteThreshold, strongThreshold, moderateThreshold, leanThreshold);
    }

    /** Overrides merged with the disable list (weight 0). */
    public Map<String, Double> effectiveOverrides() {
        Map<String, Double> merged = new HashMap<>(weightOverrides);
        disabled.forEach(name -> merged.put(name, 0.0));
        return merged;
    }
}
