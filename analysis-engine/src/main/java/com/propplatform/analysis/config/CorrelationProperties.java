package com.propplatform.analysis.config;

import com.propplatform.common.correlation.CorrelationAnalyzer;
import com.propplatform.common.correlation.CorrelationStrengthTable;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "correlation")
public class CorrelationProperties {

    private double baseMagnitude = CorrelationAnalyzer.DEFAULT_BASE_MAGNITUDE;
    private double floor = CorrelationAnalyzer.DEFAULT_FLOOR;

    /** When false, {@link #strengths} are layered on top of the built-in table. */
    private boolean replaceDefaults = false;

    private List<PairStrength> strengths = new ArrayList<>();

    @Data
    public static class PairStrength {
        private String first;
        private String second;
        private double strength;
    }

    public CorrelationStrengthTable strengthTable() {
        CorrelationStrengthTable.Builder builder = replaceDefaults
            ? CorrelationStrengthTable.builder()
            : CorrelationStrengthTable.defaults().toBuilder();
        strengths.forEach(p -> builder.pair(p.getFirst(), p.getSecond(), p.getStrength()));
        return builder.build();
    }
}
