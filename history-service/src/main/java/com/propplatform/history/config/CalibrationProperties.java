package com.propplatform.history.config;

import com.propplatform.common.calibration.CalibrationPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "calibration")
public class CalibrationProperties {

    /** Auto-learning switch; when off, calibration computes and writes nothing. */
    private boolean enabled = true;

    // --- Delta rule ---
    private double sensitivity = 3.0;
    private int minSamples = 10;
    private double maxDelta = 0.5;

    // --- Weight bounds ---
    private double minWeight = 0.1;
    private double maxWeight = 5.0;

    // --- Accuracy bands ---
    private double highAccuracy = 0.70;
    private double lowAccuracy = 0.50;
    private double accuracyFactor = 2.0;

    private int defaultHistoryLimit = 50;

    public CalibrationPolicy toPolicy() {
        return new CalibrationPolicy(sensitivity, minSamples, maxDelta, minWeight, maxWeight,
                                     highAccuracy, lowAccuracy, accuracyFactor);
    }
}
