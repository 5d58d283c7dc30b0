package com.propplatform.common.correlation;

import java.util.List;

/** One pair of legs driven by the same underlying signal. */
public record CorrelationWarning(
    String firstEntity,
    String secondEntity,
    List<String> sharedDrivers,
    double strength,
    double penalty,
    CorrelationSeverity severity,
    String message
) {
    public CorrelationWarning {
        sharedDrivers = List.copyOf(sharedDrivers);
    }
}
