package com.propplatform.common.correlation;

/**
 * Severity of a flagged leg pair, from its correlation strength:
 * <pre>
 *   strength ≥ 1.3 → HIGH
 *   strength ≥ 0.7 → MEDIUM
 *   otherwise      → LOW
 * </pre>
 */
public enum CorrelationSeverity {
    HIGH,
    MEDIUM,
    LOW;

    public static CorrelationSeverity fromStrength(double strength) {
        if (strength >= 1.3) return HIGH;
        if (strength >= 0.7) return MEDIUM;
        return LOW;
    }
}
