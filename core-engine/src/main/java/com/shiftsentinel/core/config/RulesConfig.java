package com.shiftsentinel.core.config;

import com.shiftsentinel.core.model.DetectionRule;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Top-level POJO for the change-detection rules YAML.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * rules:
 *   - name: latency_shift
 *     type: rank_sum_locator
 *     threshold: 3
 *     minPercentDifference: 10
 *   - name: latency_watch
 *     type: ti_ewma
 *     threshold: 2.5
 *     smoothing: 0.15
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading to verify every rule is valid and
 * that rule names are unique.
 * </p>
 *
 * @since 1.0.0
 */
public class RulesConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private List<DetectionRule> rules = new ArrayList<>();

    /**
     * Return the rules list. The returned list is <strong>unmodifiable</strong>.
     *
     * @return unmodifiable list of detection rules
     */
    public List<DetectionRule> getRules() {
        return Collections.unmodifiableList(rules);
    }

    /**
     * Set the rules list (used by SnakeYAML during deserialization).
     *
     * @param rules the detection rules
     */
    public void setRules(List<DetectionRule> rules) {
        this.rules = rules != null ? new ArrayList<>(rules) : new ArrayList<>();
    }

    /**
     * Look up a rule by name.
     *
     * @param name rule name; must not be {@code null}
     * @return the rule, or empty if none has that name
     */
    public Optional<DetectionRule> findRule(String name) {
        Objects.requireNonNull(name, "Rule name must not be null");
        return rules.stream().filter(r -> name.equals(r.getName())).findFirst();
    }

    /**
     * @return unmodifiable list of the offline locator rules
     */
    public List<DetectionRule> getLocatorRules() {
        return rules.stream().filter(DetectionRule::isLocator).toList();
    }

    /**
     * @return unmodifiable list of the online tracker rules
     */
    public List<DetectionRule> getTrackerRules() {
        return rules.stream().filter(DetectionRule::isTracker).toList();
    }

    /**
     * Validate every rule in this configuration.
     *
     * <p>
     * Delegates to {@link DetectionRule#validate()} for each rule and checks
     * names for duplicates. Collects all errors and throws a single exception
     * if anything is invalid.
     * </p>
     *
     * @throws IllegalStateException if one or more rules are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        Set<String> names = new HashSet<>();

        for (int i = 0; i < rules.size(); i++) {
            DetectionRule rule = Objects.requireNonNull(rules.get(i),
                    "Rule at index " + i + " is null");
            try {
                rule.validate();
            } catch (IllegalStateException e) {
                errors.add(e.getMessage());
            }
            if (rule.getName() != null && !names.add(rule.getName())) {
                errors.add("Duplicate rule name: '" + rule.getName() + "'");
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Rules configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    @Override
    public String toString() {
        return "RulesConfig{rules=" + rules + '}';
    }
}
