package com.propplatform.history.model;

import com.propplatform.common.model.EvaluatorWeight;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.Instant;

/**
 * Current weight of one evaluator. Written only through the upsert in
 * {@link com.propplatform.history.repository.EvaluatorWeightRepository}.
 */
@Data
@NoArgsConstructor
@Table("evaluator_weight")
public class EvaluatorWeightRow {

    @Id
    private String evaluatorName;

    private double weight;

    private String lastUpdatedPeriod;

    private long sampleCount;

    private double cumulativeAccuracy;

    private Instant lastUpdated;

    public EvaluatorWeight toDomain() {
        return new EvaluatorWeight(evaluatorName, weight, lastUpdatedPeriod,
                                   sampleCount, cumulativeAccuracy, lastUpdated);
    }
}
