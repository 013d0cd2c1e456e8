package com.shiftsentinel.core.error;

/**
 * Raised by top-level entry points when a series is too short to be
 * analysed at all.
 *
 * <p>
 * Score primitives never throw this; they degrade to a neutral score of
 * {@code 0} so that recursive searches over shrinking partitions can
 * terminate normally.
 * </p>
 *
 * @since 1.0.0
 */
public class InsufficientDataException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final int required;
    private final int actual;

    /**
     * @param required minimum number of values the operation needs
     * @param actual   number of values supplied
     */
    public InsufficientDataException(int required, int actual) {
        super("Not enough data: need at least " + required + " values, got: " + actual);
        this.required = required;
        this.actual = actual;
    }

    public int getRequired() {
        return required;
    }

    public int getActual() {
        return actual;
    }
}
