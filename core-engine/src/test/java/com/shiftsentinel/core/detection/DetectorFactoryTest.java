package com.shiftsentinel.core.detection;

import com.shiftsentinel.core.changepoint.ChangepointLocator;
import com.shiftsentinel.core.changepoint.LocatorStrategy;
import com.shiftsentinel.core.model.DetectionRule;
import com.shiftsentinel.core.tracker.CusumAccumulator;
import com.shiftsentinel.core.tracker.EwmaAccumulator;
import com.shiftsentinel.core.tracker.GroupedRankSumScorer;
import com.shiftsentinel.core.tracker.SequentialTracker;
import com.shiftsentinel.core.tracker.TIndependentScorer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.shiftsentinel.core.SampleSeries.SHIFT_UP;
import static com.shiftsentinel.core.SampleSeries.TRACK_UP;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DetectorFactory}.
 */
class DetectorFactoryTest {

    @Test
    @DisplayName("Should create a rank-sum locator for type=rank_sum_locator")
    void shouldCreateRankSumLocator() {
        DetectionRule rule = ruleOfType("rank_sum_locator");
        rule.setThreshold(2);
        rule.setMinPercentDifference(15);
        rule.setMinSearchSize(40);

        ChangepointLocator locator = DetectorFactory.createLocator(rule);

        assertThat(locator.getStrategy()).isEqualTo(LocatorStrategy.RANK_SUM);
        assertThat(locator.getThreshold()).isEqualTo(2.0);
        assertThat(locator.getMinPercentDifference()).isEqualTo(15.0);
        assertThat(locator.getMinSearchSize()).isEqualTo(40);
        assertThat(locator.locate(SHIFT_UP)).hasSize(1);
    }

    @Test
    @DisplayName("Should create a T locator with default gate for type=t_locator")
    void shouldCreateTLocator() {
        ChangepointLocator locator = DetectorFactory.createLocator(ruleOfType("T_LOCATOR"));

        assertThat(locator.getStrategy()).isEqualTo(LocatorStrategy.T_INDEPENDENT);
        assertThat(locator.getThreshold()).isEqualTo(ChangepointLocator.DEFAULT_THRESHOLD);
        assertThat(locator.getMinSearchSize()).isEqualTo(ChangepointLocator.DEFAULT_MIN_SEARCH_SIZE);
    }

    @Test
    @DisplayName("Should create a fresh tracker for each call")
    void shouldCreateTracker() {
        DetectionRule rule = ruleOfType("ti_ewma");
        rule.setSmoothing(0.33);

        SequentialTracker first = DetectorFactory.createTracker(rule, TRACK_UP.length);
        SequentialTracker second = DetectorFactory.createTracker(rule, TRACK_UP.length);

        assertThat(first).isNotSameAs(second);
        assertThat(first.getSource()).isInstanceOf(TIndependentScorer.class);
        assertThat(first.getAccumulator()).isInstanceOf(EwmaAccumulator.class);
        assertThat(first.firstCrossing(TRACK_UP, 2.5)).hasValueSatisfying(c -> assertThat(c.getIndex()).isEqualTo(32));
        assertThat(second.scoreAll(TRACK_UP)).hasSize(TRACK_UP.length);
    }

    @Test
    @DisplayName("Should detect with the threshold configured on the rule")
    void shouldDetectWithRuleThreshold() {
        DetectionRule rule = ruleOfType("ti_ewma");
        rule.setSmoothing(0.33);
        rule.setThreshold(2.5);

        assertThat(DetectorFactory.detect(rule, TRACK_UP))
                .hasValueSatisfying(c -> assertThat(c.getIndex()).isEqualTo(32));

        rule.setThreshold(10);
        assertThat(DetectorFactory.detect(rule, TRACK_UP)).isEmpty();
        assertThatThrownBy(() -> DetectorFactory.detect(ruleOfType("rank_sum_locator"), TRACK_UP))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("is not a tracker");
    }

    @Test
    @DisplayName("Should create a grouped tracker from rule parameters")
    void shouldCreateGroupedTracker() {
        DetectionRule rule = ruleOfType("grs_cusum");
        rule.setGroupSize(4);
        rule.setSlack(0.5);

        SequentialTracker tracker = DetectorFactory.createTracker(rule, 100);

        assertThat(tracker.getSource()).isInstanceOf(GroupedRankSumScorer.class);
        assertThat(tracker.getAccumulator()).isInstanceOf(CusumAccumulator.class);
        assertThat(((CusumAccumulator) tracker.getAccumulator()).getSlack()).isEqualTo(0.5);
    }

    @Test
    @DisplayName("Should throw when a tracker rule is used as a locator and vice versa")
    void shouldRejectMismatchedTypes() {
        assertThatThrownBy(() -> DetectorFactory.createLocator(ruleOfType("pr_cusum")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("is not a locator");
        assertThatThrownBy(() -> DetectorFactory.createTracker(ruleOfType("t_locator"), 100))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("is not a tracker");
    }

    @Test
    @DisplayName("Should throw for unknown type")
    void shouldThrowForUnknownType() {
        assertThatThrownBy(() -> DetectorFactory.createTracker(ruleOfType("magic"), 100))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown tracker type");
    }

    @Test
    @DisplayName("Should throw NPE for null rule")
    void shouldThrowForNullRule() {
        assertThatThrownBy(() -> DetectorFactory.createLocator(null))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    @DisplayName("Should build locators only for locator rules")
    void shouldCreateLocatorsFromMixedRules() {
        DetectionRule tracker = ruleOfType("pr_ewma");
        tracker.setSmoothing(0.2);

        List<ChangepointLocator> locators = DetectorFactory.createLocators(
                List.of(ruleOfType("rank_sum_locator"), tracker, ruleOfType("t_locator")));

        assertThat(locators).extracting(ChangepointLocator::getStrategy)
                .containsExactly(LocatorStrategy.RANK_SUM, LocatorStrategy.T_INDEPENDENT);
        assertThatThrownBy(() -> locators.add(null)).isInstanceOf(UnsupportedOperationException.class);
    }

    // ------------------------------------------------------------------
    // Helper
    // ------------------------------------------------------------------

    private static DetectionRule ruleOfType(String type) {
        DetectionRule rule = new DetectionRule();
        rule.setName("test_" + type);
        rule.setType(type);
        return rule;
    }
}
