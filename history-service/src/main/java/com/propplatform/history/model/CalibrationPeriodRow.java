package com.propplatform.history.model;

import com.propplatform.common.model.CalibrationPeriod;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.Instant;

@Data
@NoArgsConstructor
@Table("calibration_period")
public class CalibrationPeriodRow {

    @Id
    private String period;

    private int sampleCount;

    private Instant calibratedAt;

    public CalibrationPeriod toDomain() {
        return new CalibrationPeriod(period, sampleCount, calibratedAt);
    }
}
