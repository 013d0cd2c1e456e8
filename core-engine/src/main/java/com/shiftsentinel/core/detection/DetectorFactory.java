package com.shiftsentinel.core.detection;

import com.shiftsentinel.core.changepoint.ChangepointLocator;
import com.shiftsentinel.core.changepoint.LocatorStrategy;
import com.shiftsentinel.core.model.DetectionRule;
import com.shiftsentinel.core.model.ThresholdCrossing;
import com.shiftsentinel.core.tracker.SequentialTracker;
import com.shiftsentinel.core.tracker.TrackerType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds locators and trackers from {@link DetectionRule} configurations.
 *
 * <p>
 * Locators are stateless and can be shared. Trackers hold the baseline of
 * one series, so {@link #createTracker(DetectionRule, int)} returns a fresh
 * instance on every call.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorFactory {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorFactory.class);

    private DetectorFactory() {
        // utility class, not instantiable
    }

    /**
     * Create an offline locator for a {@code rank_sum_locator} or
     * {@code t_locator} rule.
     *
     * @param rule the rule configuration; must not be {@code null}
     * @return a configured locator
     * @throws NullPointerException     if {@code rule} or its type is {@code null}
     * @throws IllegalArgumentException if the rule is not a locator rule or a
     *                                  parameter is out of range
     */
    public static ChangepointLocator createLocator(DetectionRule rule) {
        Objects.requireNonNull(rule, "DetectionRule must not be null");
        Objects.requireNonNull(rule.getType(), "Rule type must not be null");

        LocatorStrategy strategy = switch (rule.getType()) {
            case DetectionRule.RANK_SUM_LOCATOR -> LocatorStrategy.RANK_SUM;
            case DetectionRule.T_LOCATOR -> LocatorStrategy.T_INDEPENDENT;
            default -> throw new IllegalArgumentException(
                    "Rule '" + rule.getName() + "' of type '" + rule.getType()
                            + "' is not a locator. Supported types: "
                            + DetectionRule.RANK_SUM_LOCATOR + ", " + DetectionRule.T_LOCATOR);
        };
        return new ChangepointLocator(strategy, rule.getThreshold(),
                rule.getMinPercentDifference(), rule.getMinSearchSize());
    }

    /**
     * Create an online tracker for a tracker rule.
     *
     * <p>
     * The tracker itself has no threshold. Pass {@code rule.getThreshold()}
     * to {@link SequentialTracker#firstCrossing(double[], double)}, or use
     * {@link #detect(DetectionRule, double[])}.
     * </p>
     *
     * @param rule         the rule configuration; must not be {@code null}
     * @param seriesLength expected series length, used to size the baseline
     *                     stage of per-value trackers
     * @return a new tracker with an empty baseline
     * @throws NullPointerException     if {@code rule} or its type is {@code null}
     * @throws IllegalArgumentException if the rule is not a tracker rule or a
     *                                  parameter is out of range
     */
    public static SequentialTracker createTracker(DetectionRule rule, int seriesLength) {
        Objects.requireNonNull(rule, "DetectionRule must not be null");
        Objects.requireNonNull(rule.getType(), "Rule type must not be null");
        if (rule.isLocator()) {
            throw new IllegalArgumentException(
                    "Rule '" + rule.getName() + "' of type '" + rule.getType() + "' is not a tracker");
        }
        TrackerType type = TrackerType.fromConfigName(rule.getType());
        return type.create(seriesLength, rule.getGroupSize(), rule.getSlack(), rule.getSmoothing());
    }

    /**
     * Run a fresh tracker for {@code rule} over {@code data} and report the
     * first output whose magnitude exceeds the rule's threshold.
     *
     * @param rule a tracker rule; must not be {@code null}
     * @param data the whole series; its length sizes the baseline stage
     * @return the first crossing, or empty if the series never crossed
     * @throws IllegalArgumentException if the rule is not a tracker rule
     */
    public static Optional<ThresholdCrossing> detect(DetectionRule rule, double[] data) {
        Objects.requireNonNull(data, "data must not be null");
        SequentialTracker tracker = createTracker(rule, Math.max(data.length, 1));
        Optional<ThresholdCrossing> crossing = tracker.firstCrossing(data, rule.getThreshold());
        crossing.ifPresent(c -> LOG.debug("Rule '{}' crossed {} at output {}",
                rule.getName(), rule.getThreshold(), c.getIndex()));
        return crossing;
    }

    /**
     * Create locators for every locator rule in the supplied list, skipping
     * tracker rules.
     *
     * @param rules rule configurations; must not be {@code null}
     * @return unmodifiable list of locators in rule order
     */
    public static List<ChangepointLocator> createLocators(List<DetectionRule> rules) {
        Objects.requireNonNull(rules, "Rules list must not be null");
        List<ChangepointLocator> locators = rules.stream()
                .filter(DetectionRule::isLocator)
                .map(DetectorFactory::createLocator)
                .toList();
        LOG.info("Created {} locator(s) from {} rule(s)", locators.size(), rules.size());
        return Collections.unmodifiableList(locators);
    }
}
