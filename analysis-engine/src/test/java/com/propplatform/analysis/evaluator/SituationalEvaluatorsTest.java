package com.propplatform.analysis.evaluator;

import com.propplatform.common.model.GameLine;
import com.propplatform.common.model.InjuryStatus;
import com.propplatform.common.model.Position;
import com.propplatform.common.model.PropositionContext;
import com.propplatform.common.model.StatCategory;
import com.propplatform.common.model.TrendDirection;
import com.propplatform.common.model.TrendProfile;
import com.propplatform.common.model.VenueType;
import com.propplatform.common.model.WeatherReport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static com.propplatform.analysis.evaluator.EvaluatorTestSupport.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Health, trend, game script, variance and weather evaluators.
 */
class SituationalEvaluatorsTest {

    @Nested
    @DisplayName("HealthEvaluator")
    class HealthTests {

        private final HealthEvaluator evaluator = new HealthEvaluator();

        private double score(InjuryStatus status) {
            return scoreOf(evaluator.analyze(prop(Position.RB, StatCategory.RUSH_YARDS),
                PropositionContext.builder().injuryStatus(status).build()));
        }

        @Test
        @DisplayName("unavailable → 0, doubtful → 20, questionable → 40")
        void designations() {
            assertEquals(0, score(InjuryStatus.OUT));
            assertEquals(0, score(InjuryStatus.INJURED_RESERVE));
            assertEquals(20, score(InjuryStatus.DOUBTFUL));
            assertEquals(40, score(InjuryStatus.QUESTIONABLE));
        }

        @Test
        @DisplayName("healthy or unlisted players abstain instead of voting neutral")
        void healthyAbstains() {
            abstained(evaluator.analyze(prop(Position.RB, StatCategory.RUSH_YARDS),
                PropositionContext.builder().injuryStatus(InjuryStatus.ACTIVE).build()));
            abstained(evaluator.analyze(prop(Position.RB, StatCategory.RUSH_YARDS), PropositionContext.empty(null)));
        }
    }

    @Nested
    @DisplayName("TrendEvaluator")
    class TrendTests {

        private final TrendEvaluator evaluator = new TrendEvaluator();
        private final PropositionContext rising = PropositionContext.builder()
            .trend(new TrendProfile(TrendDirection.DECREASING, TrendDirection.INCREASING)).build();

        @Test
        @DisplayName("pass catchers read target-share trend, others snap-share trend")
        void trendSource() {
            assertEquals(65, scoreOf(evaluator.analyze(prop(Position.WR, StatCategory.RECEPTIONS), rising)));
            assertEquals(35, scoreOf(evaluator.analyze(prop(Position.RB, StatCategory.RUSH_TDS), rising)));
        }

        @Test
        @DisplayName("stable trend → 55")
        void stable() {
            PropositionContext stable = PropositionContext.builder()
                .trend(new TrendProfile(TrendDirection.STABLE, TrendDirection.STABLE)).build();

            assertEquals(55, scoreOf(evaluator.analyze(prop(Position.TE, StatCategory.REC_TDS), stable)));
        }

        @Test
        @DisplayName("volume lines and missing trends abstain")
        void abstains() {
            abstained(evaluator.analyze(prop(Position.WR, StatCategory.REC_YARDS), rising));
            abstained(evaluator.analyze(prop(Position.WR, StatCategory.RECEPTIONS), PropositionContext.empty(null)));
        }
    }

    @Nested
    @DisplayName("GameScriptEvaluator")
    class GameScriptTests {

        private final GameScriptEvaluator evaluator = new GameScriptEvaluator();

        private double score(Position position, StatCategory category, double total, double spread) {
            return scoreOf(evaluator.analyze(prop(position, category),
                PropositionContext.builder().gameLine(new GameLine(total, spread)).build()));
        }

        @Test
        @DisplayName("shootout with a big underdog passing game → 50 + 18 + 7 + 15")
        void shootoutUnderdog() {
            assertEquals(90, score(Position.WR, StatCategory.REC_YARDS, 52, 8));
        }

        @Test
        @DisplayName("low total favourite running back → 50 − 12 + 15 + 12")
        void lowTotalFavouriteBack() {
            assertEquals(65, score(Position.RB, StatCategory.RUSH_YARDS, 39, -8));
        }

        @Test
        @DisplayName("big favourite may ease off passing in a modest total")
        void favouritePassCatcher() {
            assertEquals(50, score(Position.WR, StatCategory.REC_YARDS, 45, -7.5));
        }

        @Test
        @DisplayName("no game line → abstain")
        void noLine() {
            abstained(evaluator.analyze(prop(Position.QB, StatCategory.PASS_YARDS), PropositionContext.empty(null)));
        }
    }

    @Nested
    @DisplayName("VarianceEvaluator")
    class VarianceTests {

        private final VarianceEvaluator evaluator = new VarianceEvaluator();
        private final PropositionContext none = PropositionContext.empty(null);

        @Test
        @DisplayName("volume lines are steadier than touchdown lines")
        void reliability() {
            assertEquals(62, scoreOf(evaluator.analyze(prop(Position.QB, StatCategory.PASS_YARDS), none)));
            assertEquals(58, scoreOf(evaluator.analyze(prop(Position.WR, StatCategory.RECEPTIONS), none)));
            assertEquals(40, scoreOf(evaluator.analyze(prop(Position.TE, StatCategory.REC_TDS), none)));
            assertEquals(42, scoreOf(evaluator.analyze(prop(Position.QB, StatCategory.PASS_TDS), none)));
        }

        @Test
        @DisplayName("categories without a rule abstain")
        void noRule() {
            abstained(evaluator.analyze(prop(Position.RB, StatCategory.RECEPTIONS), none));
            abstained(evaluator.analyze(prop(Position.QB, StatCategory.RUSH_YARDS), none));
        }
    }

    @Nested
    @DisplayName("WeatherEvaluator")
    class WeatherTests {

        private final WeatherEvaluator evaluator = new WeatherEvaluator();

        private PropositionContext weather(double temperature, double wind, VenueType venue) {
            return PropositionContext.builder().weather(new WeatherReport(temperature, wind, venue)).build();
        }

        @Test
        @DisplayName("cold and wind both suppress the passing game outdoors")
        void coldAndWind() {
            assertEquals(28, scoreOf(evaluator.analyze(prop(Position.QB, StatCategory.PASS_YARDS),
                weather(15, 22, VenueType.OUTDOOR))));
        }

        @Test
        @DisplayName("running backs are unaffected")
        void runningBack() {
            assertEquals(50, scoreOf(evaluator.analyze(prop(Position.RB, StatCategory.RUSH_YARDS),
                weather(15, 22, VenueType.OUTDOOR))));
        }

        @Test
        @DisplayName("indoor venue or missing report → abstain")
        void abstains() {
            abstained(evaluator.analyze(prop(Position.QB, StatCategory.PASS_YARDS), weather(15, 22, VenueType.INDOOR)));
            abstained(evaluator.analyze(prop(Position.QB, StatCategory.PASS_YARDS), PropositionContext.empty(null)));
        }
    }
}
