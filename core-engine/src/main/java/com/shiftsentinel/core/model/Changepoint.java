package com.shiftsentinel.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * A significant shift located by the offline changepoint search.
 *
 * <p>
 * All indices are absolute offsets into the series passed to the locator.
 * {@code before} and {@code after} are the location estimates (median or
 * mean, depending on the strategy) of the values on either side of
 * {@code changeIndex} within {@code [startIndex, endIndex)}.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Instances are immutable. Use the {@link Builder}; it rejects an index
 * triple that is not ordered {@code startIndex < changeIndex < endIndex}.
 * </p>
 *
 * @since 1.0.0
 */
public final class Changepoint implements Serializable {

    private static final long serialVersionUID = 1L;

    private final int startIndex;
    private final int changeIndex;
    private final int endIndex;
    private final double before;
    private final double after;
    private final double percentDifference;
    private final double testScore;

    private Changepoint(Builder builder) {
        if (!(builder.startIndex < builder.changeIndex && builder.changeIndex < builder.endIndex)) {
            throw new IllegalStateException("Changepoint indices must satisfy start < change < end, got: "
                    + builder.startIndex + ", " + builder.changeIndex + ", " + builder.endIndex);
        }
        this.startIndex = builder.startIndex;
        this.changeIndex = builder.changeIndex;
        this.endIndex = builder.endIndex;
        this.before = builder.before;
        this.after = builder.after;
        this.percentDifference = builder.percentDifference;
        this.testScore = builder.testScore;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Changepoint} instances.
     */
    public static class Builder {
        private int startIndex;
        private int changeIndex;
        private int endIndex;
        private double before;
        private double after;
        private double percentDifference;
        private double testScore;

        public Builder startIndex(int startIndex) {
            this.startIndex = startIndex;
            return this;
        }

        public Builder changeIndex(int changeIndex) {
            this.changeIndex = changeIndex;
            return this;
        }

        public Builder endIndex(int endIndex) {
            this.endIndex = endIndex;
            return this;
        }

        public Builder before(double before) {
            this.before = before;
            return this;
        }

        public Builder after(double after) {
            this.after = after;
            return this;
        }

        public Builder percentDifference(double percentDifference) {
            this.percentDifference = percentDifference;
            return this;
        }

        public Builder testScore(double testScore) {
            this.testScore = testScore;
            return this;
        }

        /**
         * @return a new {@link Changepoint}
         * @throws IllegalStateException if the indices are not strictly ordered
         */
        public Changepoint build() {
            return new Changepoint(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public int getStartIndex() {
        return startIndex;
    }

    public int getChangeIndex() {
        return changeIndex;
    }

    public int getEndIndex() {
        return endIndex;
    }

    public double getBefore() {
        return before;
    }

    public double getAfter() {
        return after;
    }

    public double getPercentDifference() {
        return percentDifference;
    }

    public double getTestScore() {
        return testScore;
    }

    /**
     * @return {@code true} when the series moved up at this changepoint
     */
    public boolean isIncrease() {
        return testScore > 0;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Changepoint that))
            return false;
        return startIndex == that.startIndex
                && changeIndex == that.changeIndex
                && endIndex == that.endIndex
                && Double.compare(before, that.before) == 0
                && Double.compare(after, that.after) == 0
                && Double.compare(percentDifference, that.percentDifference) == 0
                && Double.compare(testScore, that.testScore) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(startIndex, changeIndex, endIndex, before, after, percentDifference, testScore);
    }

    @Override
    public String toString() {
        return "Changepoint{" +
                "startIndex=" + startIndex +
                ", changeIndex=" + changeIndex +
                ", endIndex=" + endIndex +
                ", before=" + before +
                ", after=" + after +
                ", percentDifference=" + percentDifference +
                ", testScore=" + testScore +
                '}';
    }
}
