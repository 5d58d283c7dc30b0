package com.propplatform.analysis.evaluator;

import com.propplatform.common.model.EvaluationResult;
import com.propplatform.common.model.Proposition;
import com.propplatform.common.model.PropositionContext;
import com.propplatform.common.model.SignalFamily;
import com.propplatform.common.model.VenueType;
import com.propplatform.common.model.WeatherReport;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/** Extreme cold and high wind suppress the passing game at outdoor venues. */
@Component
public class WeatherEvaluator implements Evaluator {

    static final double EXTREME_COLD_F = 20.0;
    static final double HIGH_WIND_MPH  = 20.0;

    @Override
    public SignalFamily family() { return SignalFamily.ENVIRONMENT; }

    @Override
    public EvaluationResult analyze(Proposition proposition, PropositionContext context) {
        WeatherReport weather = context.weather();
        if (weather == null) {
            return EvaluationResult.abstain(evaluatorName(), "no weather report");
        }
        if (weather.venue() == VenueType.INDOOR) {
            return EvaluationResult.abstain(evaluatorName(), "indoor venue");
        }

        List<String> rationale = new ArrayList<>();
        double score = 50;
        if (proposition.position().isPassingGame()) {
            if (weather.temperatureF() <= EXTREME_COLD_F) {
                score -= 10;
                rationale.add(String.format(Locale.ROOT, "Extreme cold: %.0fF affects passing", weather.temperatureF()));
            }
            if (weather.windMph() >= HIGH_WIND_MPH) {
                score -= 12;
                rationale.add(String.format(Locale.ROOT, "High wind: %.0f mph", weather.windMph()));
            }
        }
        return EvaluationResult.scored(evaluatorName(), score, rationale);
    }
}
