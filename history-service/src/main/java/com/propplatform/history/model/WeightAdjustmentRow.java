package com.propplatform.history.model;

import com.propplatform.common.model.AdjustmentAction;
import com.propplatform.common.model.WeightAdjustmentRecord;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.Instant;

/** Append-only audit row; never updated or deleted. */
@Data
@NoArgsConstructor
@Table("weight_adjustment_history")
public class WeightAdjustmentRow {

    @Id
    private Long id;

    private String evaluatorName;

    private double oldWeight;

    private double newWeight;

    private String action;

    private String reason;

    private String period;

    private double accuracy;

    private double overconfidence;

    private int sampleSize;

    private Instant createdAt;

    public static WeightAdjustmentRow from(WeightAdjustmentRecord record) {
        WeightAdjustmentRow row = new WeightAdjustmentRow();
        row.setEvaluatorName(record.evaluator());
        row.setOldWeight(record.oldWeight());
        row.setNewWeight(record.newWeight());
        row.setAction(record.action().name());
        row.setReason(record.reason());
        row.setPeriod(record.period());
        row.setAccuracy(record.accuracy());
        row.setOverconfidence(record.overconfidence());
        row.setSampleSize(record.sampleSize());
        row.setCreatedAt(record.timestamp());
        return row;
    }

    public WeightAdjustmentRecord toDomain() {
        return new WeightAdjustmentRecord(evaluatorName, oldWeight, newWeight,
                                          AdjustmentAction.valueOf(action), reason, period,
                                          accuracy, overconfidence, sampleSize, createdAt);
    }
}
