package com.shiftsentinel.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * The first tracker output whose magnitude exceeded an alert threshold.
 *
 * <p>
 * {@code index} counts tracker outputs, not raw inputs: for grouped
 * trackers it is the group number.
 * </p>
 *
 * @since 1.0.0
 */
public final class ThresholdCrossing implements Serializable {

    private static final long serialVersionUID = 1L;

    private final int index;
    private final double score;

    public ThresholdCrossing(int index, double score) {
        if (index < 0) {
            throw new IllegalArgumentException("index must be >= 0, got: " + index);
        }
        this.index = index;
        this.score = score;
    }

    public int getIndex() {
        return index;
    }

    public double getScore() {
        return score;
    }

    /**
     * Outputs between the true change and its detection.
     *
     * @param changeIndex output index at which the change really began
     * @return detection delay, negative if the crossing came first
     */
    public int delayFrom(int changeIndex) {
        return index - changeIndex;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ThresholdCrossing that))
            return false;
        return index == that.index && Double.compare(score, that.score) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, score);
    }

    @Override
    public String toString() {
        return "ThresholdCrossing{index=" + index + ", score=" + score + '}';
    }
}
