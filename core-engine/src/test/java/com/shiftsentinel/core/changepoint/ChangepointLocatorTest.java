package com.shiftsentinel.core.changepoint;

import com.shiftsentinel.core.error.InsufficientDataException;
import com.shiftsentinel.core.error.InvalidParameterException;
import com.shiftsentinel.core.model.Changepoint;
import com.shiftsentinel.core.stats.BaseStats;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static com.shiftsentinel.core.SampleSeries.DOWN_THEN_UP;
import static com.shiftsentinel.core.SampleSeries.SHIFT_UP;
import static com.shiftsentinel.core.SampleSeries.UP_THEN_DOWN;
import static com.shiftsentinel.core.SampleSeries.constant;
import static com.shiftsentinel.core.SampleSeries.weibullSeries;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link ChangepointLocator}.
 */
class ChangepointLocatorTest {

    private static final double SHAPE = 1.5;

    @Test
    @DisplayName("Should locate a drop and a recovery with rank-sum scoring")
    void shouldLocateTwoRankSumChangepoints() {
        List<Changepoint> cps = ChangepointLocator.rankSum(2).locate(DOWN_THEN_UP);

        assertThat(cps).hasSize(2);
        assertThat(cps.get(0).getChangeIndex()).isEqualTo(50);
        assertThat(cps.get(0).getTestScore()).isCloseTo(-2.455, within(5e-4));
        assertThat(cps.get(0).isIncrease()).isFalse();
        assertThat(cps.get(0).getAfter()).isLessThan(cps.get(0).getBefore());
        assertThat(cps.get(1).getChangeIndex()).isEqualTo(102);
        assertThat(cps.get(1).getTestScore()).isCloseTo(2.226, within(5e-4));
        assertThat(cps.get(1).isIncrease()).isTrue();
    }

    @Test
    @DisplayName("Should locate a rise and a fall with T scoring")
    void shouldLocateTwoTChangepoints() {
        List<Changepoint> cps = ChangepointLocator.tIndependent(1.5).locate(UP_THEN_DOWN);

        assertThat(cps).hasSize(2);
        assertThat(cps.get(0).getChangeIndex()).isEqualTo(50);
        assertThat(cps.get(0).getTestScore()).isCloseTo(2.712, within(5e-4));
        assertThat(cps.get(1).getChangeIndex()).isEqualTo(100);
        assertThat(cps.get(1).getTestScore()).isCloseTo(-4.021, within(5e-4));
        assertThat(cps.get(1).getPercentDifference()).isNegative();
    }

    @Test
    @DisplayName("Should report consistent indices and percentage difference")
    void shouldReportConsistentChangepoint() {
        List<Changepoint> cps = ChangepointLocator.rankSum(2).locate(SHIFT_UP);

        assertThat(cps).hasSize(1);
        Changepoint cp = cps.get(0);
        assertThat(cp.getStartIndex()).isZero();
        assertThat(cp.getChangeIndex()).isEqualTo(30);
        assertThat(cp.getEndIndex()).isEqualTo(SHIFT_UP.length);
        assertThat(cp.getPercentDifference())
                .isCloseTo(BaseStats.pctDiff(cp.getAfter(), cp.getBefore()),
                        within(1e-12));
        assertThat(cp.isIncrease()).isTrue();
    }

    @Test
    @DisplayName("Should reject a significant split whose percentage difference is too small")
    void shouldApplyPercentDifferenceGate() {
        ChangepointLocator strict = new ChangepointLocator(LocatorStrategy.RANK_SUM, 2, 500, 30);
        // sign of the configured minimum is ignored
        ChangepointLocator negative = new ChangepointLocator(LocatorStrategy.RANK_SUM, 2, -500, 30);

        assertThat(strict.locate(SHIFT_UP)).isEmpty();
        assertThat(negative.locate(SHIFT_UP)).isEmpty();
    }

    @Test
    @DisplayName("Should reject splits below the score threshold")
    void shouldApplyScoreThreshold() {
        assertThat(ChangepointLocator.rankSum(10).locate(SHIFT_UP)).isEmpty();
    }

    @Test
    @DisplayName("Should find nothing in a constant series")
    void shouldFindNothingInConstantSeries() {
        assertThat(ChangepointLocator.rankSum(0).locate(constant(100, 5))).isEmpty();
        assertThat(ChangepointLocator.tIndependent(0).locate(constant(100, 5))).isEmpty();
    }

    @Test
    @DisplayName("Should keep false positives rare on stationary Weibull data")
    void shouldRarelyFireOnStationaryData() {
        Random random = new Random(42);
        ChangepointLocator rs = ChangepointLocator.rankSum(3);
        ChangepointLocator ti = ChangepointLocator.tIndependent(3);
        int trials = 100;
        int rsFalse = 0;
        int tiFalse = 0;

        for (int t = 0; t < trials; t++) {
            double[] data = weibullSeries(random, 500, 1, SHAPE);
            if (!rs.locate(data).isEmpty()) {
                rsFalse++;
            }
            if (!ti.locate(data).isEmpty()) {
                tiFalse++;
            }
        }

        assertThat(rsFalse).isLessThan(trials / 20);
        assertThat(tiFalse).isLessThan(trials / 20);
    }

    @Test
    @DisplayName("Should locate a tripling of scale near the true change")
    void shouldLocateScaleShift() {
        Random random = new Random(7);

        for (LocatorStrategy strategy : LocatorStrategy.values()) {
            ChangepointLocator locator = new ChangepointLocator(strategy, 3, 10, 30);
            for (int t = 0; t < 30; t++) {
                double[] data = concat(weibullSeries(random, 250, 1, SHAPE), weibullSeries(random, 250, 3, SHAPE));

                List<Changepoint> cps = locator.locate(data);

                assertThat(cps)
                        .as("%s trial %d", strategy, t)
                        .anySatisfy(cp -> {
                            assertThat(Math.abs(cp.getChangeIndex() - 250)).isLessThanOrEqualTo(20);
                            assertThat(cp.getTestScore()).isGreaterThan(3);
                        });
            }
        }
    }

    @Test
    @DisplayName("Should return changepoints ordered by change index")
    void shouldOrderByChangeIndex() {
        Random random = new Random(11);
        double[] data = concat(weibullSeries(random, 150, 1, SHAPE),
                concat(weibullSeries(random, 150, 4, SHAPE), weibullSeries(random, 150, 1, SHAPE)));

        List<Changepoint> cps = ChangepointLocator.rankSum(3).locate(data);

        assertThat(cps).isNotEmpty();
        assertThat(cps).isSortedAccordingTo((a, b) -> Integer.compare(a.getChangeIndex(), b.getChangeIndex()));
        assertThat(cps).allSatisfy(cp -> {
            assertThat(cp.getStartIndex()).isLessThan(cp.getChangeIndex());
            assertThat(cp.getChangeIndex()).isLessThan(cp.getEndIndex());
        });
    }

    @Test
    @DisplayName("Should not modify the input series")
    void shouldNotModifyInput() {
        double[] data = UP_THEN_DOWN.clone();

        ChangepointLocator.tIndependent(1.5).locate(data);

        assertThat(data).containsExactly(UP_THEN_DOWN);
    }

    @Test
    @DisplayName("Should throw when the series is too short to split")
    void shouldRejectShortSeries() {
        assertThatThrownBy(() -> ChangepointLocator.rankSum(3).locate(new double[18]))
                .isInstanceOf(InsufficientDataException.class)
                .hasMessageContaining("need at least " + ChangepointLocator.MIN_SERIES_LENGTH);
    }

    @Test
    @DisplayName("Should reject invalid configuration")
    void shouldRejectInvalidParameters() {
        assertThatThrownBy(() -> new ChangepointLocator(LocatorStrategy.RANK_SUM, -1, 10, 30))
                .isInstanceOf(InvalidParameterException.class)
                .hasMessageContaining("threshold");
        assertThatThrownBy(() -> new ChangepointLocator(LocatorStrategy.RANK_SUM, 3, Double.NaN, 30))
                .isInstanceOf(InvalidParameterException.class)
                .hasMessageContaining("minPercentDifference");
        assertThatThrownBy(() -> new ChangepointLocator(LocatorStrategy.T_INDEPENDENT, 3, 10, 0))
                .isInstanceOf(InvalidParameterException.class)
                .hasMessageContaining("minSearchSize");
    }

    // ---- Helpers ----

    private static double[] concat(double[] a, double[] b) {
        double[] out = new double[a.length + b.length];
        System.arraycopy(a, 0, out, 0, a.length);
        System.arraycopy(b, 0, out, a.length, b.length);
        return out;
    }
}
