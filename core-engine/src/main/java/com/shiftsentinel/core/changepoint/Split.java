package com.shiftsentinel.core.changepoint;

import java.util.Objects;

/**
 * Best single split of a series: the largest-magnitude score found and the
 * offset (relative to the searched range) at which the "after" part begins.
 *
 * @since 1.0.0
 */
public final class Split {

    /** No candidate split was scanned. */
    public static final Split NONE = new Split(0, 0);

    private final double score;
    private final int index;

    public Split(double score, int index) {
        this.score = score;
        this.index = index;
    }

    public double getScore() {
        return score;
    }

    public int getIndex() {
        return index;
    }

    /**
     * @return {@code true} if a candidate with a non-zero score was found
     */
    public boolean isFound() {
        return index > 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Split split))
            return false;
        return index == split.index && Double.compare(score, split.score) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(score, index);
    }

    @Override
    public String toString() {
        return "Split{score=" + score + ", index=" + index + '}';
    }
}
