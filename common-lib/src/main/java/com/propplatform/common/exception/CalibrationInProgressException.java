package com.propplatform.common.exception;

/** A second calibration was requested while one is still running. */
public class CalibrationInProgressException extends RuntimeException {
    private final String period;

    public CalibrationInProgressException(String period) {
        super("Calibration already in progress; rejected period=" + period);
        this.period = period;
    }

    public String getPeriod() {
        return period;
    }
}
