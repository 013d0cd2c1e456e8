package com.shiftsentinel.core.tracker;

import com.shiftsentinel.core.error.InvalidParameterException;
import com.shiftsentinel.core.tracker.EwmaAccumulator.Scaling;

import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * The built-in tracker combinations: a scoring family crossed with CUSUM or
 * EWMA accumulation.
 *
 * <ul>
 * <li>{@code pr_*}: percentile rank of each value</li>
 * <li>{@code ti_*}: T score of each square-root transformed value</li>
 * <li>{@code grs_*}: rank-sum score of each group</li>
 * <li>{@code gti_*}: T score of each group mean</li>
 * </ul>
 *
 * <p>
 * Each EWMA variant carries the output scaling that puts its family on a
 * common alert scale.
 * </p>
 *
 * @since 1.0.0
 */
public enum TrackerType {

    PR_CUSUM(Family.PERCENTILE_RANK, null),
    PR_EWMA(Family.PERCENTILE_RANK, Scaling.POWER),
    TI_CUSUM(Family.T_INDEPENDENT, null),
    TI_EWMA(Family.T_INDEPENDENT, Scaling.STANDARD_ERROR),
    GRS_CUSUM(Family.GROUPED_RANK_SUM, null),
    GRS_EWMA(Family.GROUPED_RANK_SUM, Scaling.CAPPED_CONTROL_LIMIT),
    GTI_CUSUM(Family.GROUPED_T_INDEPENDENT, null),
    GTI_EWMA(Family.GROUPED_T_INDEPENDENT, Scaling.CONTROL_LIMIT);

    enum Family {
        PERCENTILE_RANK,
        T_INDEPENDENT,
        GROUPED_RANK_SUM,
        GROUPED_T_INDEPENDENT
    }

    private final Family family;
    private final Scaling scaling;

    TrackerType(Family family, Scaling scaling) {
        this.family = family;
        this.scaling = scaling;
    }

    /**
     * @return {@code true} for types that score groups rather than values
     */
    public boolean isGrouped() {
        return family == Family.GROUPED_RANK_SUM || family == Family.GROUPED_T_INDEPENDENT;
    }

    /**
     * @return {@code true} for EWMA types, {@code false} for CUSUM types
     */
    public boolean isEwma() {
        return scaling != null;
    }

    /**
     * Lower-case name used in configuration, e.g. {@code "pr_cusum"}.
     */
    public String configName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Build a tracker of this type. Parameters that the type does not use are
     * ignored.
     *
     * @param seriesLength expected number of values; sets the staging size
     *                     {@code sqrt(seriesLength)} of per-value types
     * @param groupSize    values per group for grouped types
     * @param slack        CUSUM slack {@code k}
     * @param smoothing    EWMA weight {@code a}
     * @return a new, independent tracker
     * @throws InvalidParameterException if a used parameter is out of range
     */
    public SequentialTracker create(int seriesLength, int groupSize, double slack, double smoothing) {
        Accumulator accumulator = isEwma()
                ? new EwmaAccumulator(smoothing, scaling)
                : new CusumAccumulator(slack);
        return new SequentialTracker(createSource(seriesLength, groupSize), accumulator);
    }

    private ScoreSource createSource(int seriesLength, int groupSize) {
        return switch (family) {
            case PERCENTILE_RANK -> new PercentileRankScorer(stageSize(seriesLength));
            case T_INDEPENDENT -> new TIndependentScorer(stageSize(seriesLength));
            case GROUPED_RANK_SUM -> new GroupedRankSumScorer(groupSize);
            case GROUPED_T_INDEPENDENT -> new GroupedTIndependentScorer(groupSize);
        };
    }

    /**
     * Staging size for a per-value scorer over {@code seriesLength} values.
     *
     * @param seriesLength expected series length, {@code >= 1}
     * @return {@code floor(sqrt(seriesLength))}
     */
    public static int stageSize(int seriesLength) {
        if (seriesLength < 1) {
            throw InvalidParameterException.of("seriesLength", ">= 1", seriesLength);
        }
        return (int) Math.sqrt(seriesLength);
    }

    /**
     * Resolve a configuration name such as {@code "ti_ewma"}.
     *
     * @param name type name, case-insensitive; must not be {@code null}
     * @return the matching type
     * @throws IllegalArgumentException if no type has that name
     */
    public static TrackerType fromConfigName(String name) {
        Objects.requireNonNull(name, "Tracker type name must not be null");
        String key = name.trim().toUpperCase(Locale.ROOT);
        for (TrackerType type : values()) {
            if (type.name().equals(key)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown tracker type: '" + name + "'. Supported types: "
                + Arrays.stream(values()).map(TrackerType::configName).collect(Collectors.joining(", ")));
    }
}
