package com.shiftsentinel.core.stats;

import java.util.Objects;

/**
 * A robust location estimate paired with its standard error.
 *
 * @since 1.0.0
 */
public final class LocationEstimate {

    private final double location;
    private final double standardError;

    public LocationEstimate(double location, double standardError) {
        this.location = location;
        this.standardError = standardError;
    }

    public double getLocation() {
        return location;
    }

    public double getStandardError() {
        return standardError;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof LocationEstimate that))
            return false;
        return Double.compare(location, that.location) == 0
                && Double.compare(standardError, that.standardError) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(location, standardError);
    }

    @Override
    public String toString() {
        return "LocationEstimate{location=" + location + ", standardError=" + standardError + '}';
    }
}
