package com.shiftsentinel.core.tracker;

import com.shiftsentinel.core.error.InvalidParameterException;

/**
 * Cumulative-sum accumulator. Each score, less a slack {@code k}, is added
 * to the upper sum and, plus {@code k}, to the lower sum; a sum that crosses
 * zero is reset to zero. The slack drains noise so that only a sustained
 * shift keeps growing.
 *
 * @since 1.0.0
 */
public class CusumAccumulator implements Accumulator {

    private final double slack;
    private double lower;
    private double upper;

    /**
     * @param slack noise allowance {@code k}, {@code > 0}
     * @throws InvalidParameterException if {@code slack <= 0}
     */
    public CusumAccumulator(double slack) {
        if (!(slack > 0)) {
            throw InvalidParameterException.of("k", "> 0", slack);
        }
        this.slack = slack;
    }

    @Override
    public double observe(double score) {
        lower = Math.min(lower + score + slack, 0);
        upper = Math.max(upper + score - slack, 0);
        return Accumulator.signedMax(lower, upper);
    }

    @Override
    public void reset() {
        lower = 0;
        upper = 0;
    }

    @Override
    public double getLower() {
        return lower;
    }

    @Override
    public double getUpper() {
        return upper;
    }

    public double getSlack() {
        return slack;
    }
}
