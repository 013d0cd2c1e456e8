package com.shiftsentinel.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Describes a single change-detection rule loaded from configuration.
 *
 * <p>
 * Supported rule types:
 * </p>
 * <ul>
 * <li>{@code rank_sum_locator}, {@code t_locator}: offline changepoint
 * location</li>
 * <li>{@code pr_cusum}, {@code pr_ewma}, {@code ti_cusum}, {@code ti_ewma}:
 * per-value online trackers</li>
 * <li>{@code grs_cusum}, {@code grs_ewma}, {@code gti_cusum},
 * {@code gti_ewma}: grouped online trackers</li>
 * </ul>
 *
 * <p>
 * Call {@link #validate()} after construction / deserialization to verify
 * that all required fields for the declared rule type are present and valid.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectionRule implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String RANK_SUM_LOCATOR = "rank_sum_locator";
    public static final String T_LOCATOR = "t_locator";

    private static final Set<String> LOCATOR_TYPES = Set.of(RANK_SUM_LOCATOR, T_LOCATOR);
    private static final Set<String> TRACKER_TYPES = Set.of(
            "pr_cusum", "pr_ewma", "ti_cusum", "ti_ewma",
            "grs_cusum", "grs_ewma", "gti_cusum", "gti_ewma");

    /** Unique rule name used in logs. */
    private String name;

    /** Rule type, see class documentation. */
    private String type;

    /** Alert threshold {@code h} on the absolute score. */
    private double threshold = 3;

    // --- Locator fields ---
    /** Minimum absolute percentage difference between after and before. */
    private double minPercentDifference = 10;

    /** Smallest range the locator will search. */
    private int minSearchSize = 30;

    // --- Tracker fields ---
    /** Values per group for grouped trackers. */
    private int groupSize;

    /** CUSUM slack {@code k}. */
    private double slack;

    /** EWMA smoothing weight {@code a}. */
    private double smoothing;

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate that all required fields for the declared rule type are present
     * and contain legal values.
     *
     * @throws IllegalStateException if validation fails
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (name == null || name.isBlank()) {
            errors.add("Rule 'name' is required");
        }
        if (type == null || type.isBlank()) {
            errors.add("Rule 'type' is required");
        }
        if (!(threshold >= 0)) {
            errors.add("Rule '" + name + "' requires 'threshold' >= 0");
        }

        if (type != null && !type.isBlank()) {
            if (isLocator()) {
                if (minSearchSize < 1) {
                    errors.add("Locator rule '" + name + "' requires 'minSearchSize' >= 1");
                }
            } else if (isTracker()) {
                if (type.startsWith("g") && groupSize < 1) {
                    errors.add("Grouped tracker rule '" + name + "' requires 'groupSize' >= 1");
                }
                if (type.endsWith("_cusum") && !(slack > 0)) {
                    errors.add("CUSUM rule '" + name + "' requires 'slack' > 0");
                }
                if (type.endsWith("_ewma") && !(smoothing > 0 && smoothing < 1)) {
                    errors.add("EWMA rule '" + name + "' requires 0 < 'smoothing' < 1");
                }
            } else {
                errors.add("Unknown rule type: '" + type + "'. Supported: "
                        + RANK_SUM_LOCATOR + ", " + T_LOCATOR + ", " + String.join(", ", TRACKER_TYPES));
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid DetectionRule: " + String.join("; ", errors));
        }
    }

    public boolean isLocator() {
        return type != null && LOCATOR_TYPES.contains(type);
    }

    public boolean isTracker() {
        return type != null && TRACKER_TYPES.contains(type);
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getType() {
        return type;
    }

    /**
     * Set the rule type, normalised to lowercase.
     *
     * @param type rule type string
     */
    public void setType(String type) {
        this.type = type != null ? type.toLowerCase(Locale.ROOT) : null;
    }

    public double getThreshold() {
        return threshold;
    }

    public void setThreshold(double threshold) {
        this.threshold = threshold;
    }

    public double getMinPercentDifference() {
        return minPercentDifference;
    }

    public void setMinPercentDifference(double minPercentDifference) {
        this.minPercentDifference = minPercentDifference;
    }

    public int getMinSearchSize() {
        return minSearchSize;
    }

    public void setMinSearchSize(int minSearchSize) {
        this.minSearchSize = minSearchSize;
    }

    public int getGroupSize() {
        return groupSize;
    }

    public void setGroupSize(int groupSize) {
        this.groupSize = groupSize;
    }

    public double getSlack() {
        return slack;
    }

    public void setSlack(double slack) {
        this.slack = slack;
    }

    public double getSmoothing() {
        return smoothing;
    }

    public void setSmoothing(double smoothing) {
        this.smoothing = smoothing;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DetectionRule that))
            return false;
        return Objects.equals(name, that.name) && Objects.equals(type, that.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type);
    }

    @Override
    public String toString() {
        return "DetectionRule{" +
                "name='" + name + '\'' +
                ", type='" + type + '\'' +
                ", threshold=" + threshold +
                ", minPercentDifference=" + minPercentDifference +
                ", minSearchSize=" + minSearchSize +
                ", groupSize=" + groupSize +
                ", slack=" + slack +
                ", smoothing=" + smoothing +
                '}';
    }
}
