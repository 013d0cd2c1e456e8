package com.shiftsentinel.core.error;

/**
 * Raised immediately, before any data is processed, when a tuning
 * coefficient lies outside its domain.
 *
 * @since 1.0.0
 */
public class InvalidParameterException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final String parameter;

    /**
     * @param parameter name of the offending parameter
     * @param message   human-readable constraint violation
     */
    public InvalidParameterException(String parameter, String message) {
        super(message);
        this.parameter = parameter;
    }

    /**
     * Build an exception with the standard "{@code name must be <constraint>,
     * got: value}" message.
     *
     * @param parameter  parameter name
     * @param constraint constraint description, e.g. {@code "> 0"}
     * @param value      rejected value
     * @return the exception, ready to throw
     */
    public static InvalidParameterException of(String parameter, String constraint, Object value) {
        return new InvalidParameterException(parameter,
                parameter + " must be " + constraint + ", got: " + value);
    }

    public String getParameter() {
        return parameter;
    }
}
