package com.shiftsentinel.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads locator and tracker rules from YAML.
 *
 * <p>
 * {@link #load()} prefers a file named by {@value #ENV_RULES_PATH} and
 * otherwise reads the bundled {@value #DEFAULT_RESOURCE}. Every entry point
 * runs {@link RulesConfig#validate()}, so a rule with a bad slack, smoothing
 * or group size is rejected before any tracker is built from it.
 * </p>
 *
 * @since 1.0.0
 */
public final class RulesLoader {

    private static final Logger LOG = LoggerFactory.getLogger(RulesLoader.class);

    /** Environment variable that can override the default config location. */
    public static final String ENV_RULES_PATH = "SHIFT_RULES_PATH";

    /** Classpath resource used when no override is set. */
    public static final String DEFAULT_RESOURCE = "shift-rules.yml";

    private RulesLoader() {
        // utility class, not instantiable
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Load rules from {@value #ENV_RULES_PATH} if it names an existing file,
     * otherwise from {@value #DEFAULT_RESOURCE} on the classpath.
     *
     * @return parsed and validated rules configuration
     * @throws IllegalStateException if rule validation fails
     */
    public static RulesConfig load() {
        Optional<Path> override = overridePath(System.getenv(ENV_RULES_PATH));
        if (override.isPresent()) {
            LOG.info("Loading rules from {}={}", ENV_RULES_PATH, override.get());
            return fromFile(override.get().toString());
        }
        LOG.info("Loading bundled rules: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * The override file named by {@code value}, if it is set and exists.
     * A value naming a missing file is ignored with a warning.
     */
    static Optional<Path> overridePath(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        Path path = Path.of(value.trim());
        if (!Files.isRegularFile(path)) {
            LOG.warn("{} points to {}, which is not a file; using bundled rules", ENV_RULES_PATH, path);
            return Optional.empty();
        }
        return Optional.of(path);
    }

    /**
     * Load rules from a file system path.
     *
     * @param path path to the YAML file; must not be {@code null}
     * @return parsed and validated rules configuration
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static RulesConfig fromFile(String path) {
        Objects.requireNonNull(path, "Rules file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Rules file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read rules file: " + path, e);
        }
    }

    /**
     * Load rules from a classpath resource.
     *
     * @param resource classpath resource name; must not be {@code null}
     * @return parsed and validated rules configuration
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static RulesConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = RulesLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    /**
     * Parse rules from inline YAML text.
     *
     * @param yaml YAML document; must not be {@code null}
     * @return parsed and validated rules configuration
     * @throws IllegalStateException if parsing or validation fails
     */
    public static RulesConfig fromString(String yaml) {
        Objects.requireNonNull(yaml, "YAML text must not be null");
        try (Reader reader = new StringReader(yaml)) {
            return validated(newYaml().load(reader));
        } catch (IOException | YAMLException e) {
            throw new IllegalStateException("Failed to parse rules YAML", e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static RulesConfig parseAndValidate(InputStream is) {
        RulesConfig config;
        try {
            config = newYaml().load(is);
        } catch (YAMLException e) {
            throw new IllegalStateException("Failed to parse rules YAML", e);
        }
        return validated(config);
    }

    private static Yaml newYaml() {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        return new Yaml(new Constructor(RulesConfig.class, options));
    }

    private static RulesConfig validated(RulesConfig config) {
        if (config == null || config.getRules().isEmpty()) {
            LOG.warn("No detection rules defined in configuration");
            config = new RulesConfig();
        } else {
            config.validate();
        }
        LOG.info("Loaded {} detection rule(s): {} locator(s), {} tracker(s)",
                config.getRules().size(), config.getLocatorRules().size(), config.getTrackerRules().size());
        return config;
    }
}
