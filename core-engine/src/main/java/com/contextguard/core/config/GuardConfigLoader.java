package com.contextguard.core.config;

import com.contextguard.core.model.DetectionRule;
import com.contextguard.core.model.JsonMappers;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Resolves, merges and validates a {@link GuardConfig}.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_CONFIG_PATH}, when it names an
 * existing file</li>
 * <li>The file given to {@link #withFile(Path)}</li>
 * <li>The classpath resource, {@value #DEFAULT_RESOURCE} unless changed with
 * {@link #withResource(String)}</li>
 * </ol>
 *
 * <h3>Merging</h3>
 * <p>
 * The document is read as a plain YAML tree. Each section present in it is
 * applied over the defaults of its settings object, so a document that only
 * sets {@code cache.maxEntries} keeps every other cache default and every
 * other section untouched. Unknown sections or keys are configuration errors.
 * </p>
 *
 * <p>
 * Every load ends in {@link GuardConfig#validate()}, and all section errors
 * are collected into the same {@link IllegalStateException}.
 * </p>
 *
 * @since 1.0.0
 */
public final class GuardConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(GuardConfigLoader.class);

    /** Environment variable naming a YAML file that overrides every other source. */
    public static final String ENV_CONFIG_PATH = "CONTEXT_GUARD_CONFIG";

    /** Classpath resource shipped with the default rule set. */
    public static final String DEFAULT_RESOURCE = "context-guard.yml";

    private static final TypeReference<List<DetectionRule>> RULE_LIST = new TypeReference<>() {
    };

    private static final ObjectMapper BINDER = JsonMappers.create()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);

    private final Function<String, String> environment;
    private final Path file;
    private final String resource;

    private GuardConfigLoader(Function<String, String> environment, Path file, String resource) {
        this.environment = environment;
        this.file = file;
        this.resource = resource;
    }

    /**
     * @return a loader reading the process environment and the bundled defaults
     */
    public static GuardConfigLoader create() {
        return new GuardConfigLoader(System::getenv, null, DEFAULT_RESOURCE);
    }

    /**
     * Shorthand for the full resolution order with no explicit file.
     */
    public static GuardConfig load() {
        return create().resolve();
    }

    /**
     * Load one classpath resource, ignoring the environment.
     *
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if parsing or validation fails
     */
    public static GuardConfig fromClasspath(String resource) {
        return new GuardConfigLoader(name -> null, null, resource).resolve();
    }

    /**
     * Load one file, ignoring the environment.
     *
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if parsing or validation fails
     */
    public static GuardConfig fromFile(Path file) {
        return new GuardConfigLoader(name -> null, file, DEFAULT_RESOURCE).resolve();
    }

    public GuardConfigLoader withFile(Path file) {
        return new GuardConfigLoader(environment,
                Objects.requireNonNull(file, "Configuration file must not be null"), resource);
    }

    public GuardConfigLoader withResource(String resource) {
        return new GuardConfigLoader(environment, file,
                Objects.requireNonNull(resource, "Classpath resource name must not be null"));
    }

    GuardConfigLoader withEnvironment(Function<String, String> environment) {
        return new GuardConfigLoader(Objects.requireNonNull(environment, "environment"), file, resource);
    }

    /**
     * Pick the first available source, merge it over the defaults and validate.
     *
     * @return the validated configuration
     * @throws IllegalArgumentException if an explicit file or the resource is missing
     * @throws IllegalStateException    if parsing or validation fails
     */
    public GuardConfig resolve() {
        String envPath = environment.apply(ENV_CONFIG_PATH);
        if (envPath != null && !envPath.isBlank()) {
            Path envFile = Path.of(envPath);
            if (Files.isRegularFile(envFile)) {
                LOG.info("Loading configuration from {} ({})", envFile, ENV_CONFIG_PATH);
                return readFile(envFile);
            }
            LOG.warn("{} points at missing file {}, ignoring it", ENV_CONFIG_PATH, envFile);
        }
        if (file != null) {
            LOG.info("Loading configuration from {}", file);
            return readFile(file);
        }
        LOG.info("Loading configuration from classpath: {}", resource);
        InputStream in = GuardConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (in) {
            return merge(in, "classpath:" + resource);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read classpath resource: " + resource, e);
        }
    }

    private static GuardConfig readFile(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new IllegalArgumentException("Configuration file not found: " + path);
        }
        try (InputStream in = Files.newInputStream(path)) {
            return merge(in, path.toString());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read configuration file: " + path, e);
        }
    }

    private static GuardConfig merge(InputStream in, String source) {
        Object document;
        try {
            LoaderOptions options = new LoaderOptions();
            options.setAllowDuplicateKeys(false);
            document = new Yaml(new SafeConstructor(options)).load(in);
        } catch (YAMLException e) {
            throw new IllegalStateException("Malformed YAML in " + source + ": " + e.getMessage(), e);
        }

        GuardConfig config = new GuardConfig();
        if (document == null) {
            LOG.warn("Empty configuration document {}, using defaults", source);
        } else if (document instanceof Map<?, ?> sections) {
            List<String> errors = new ArrayList<>();
            for (Map.Entry<?, ?> section : sections.entrySet()) {
                applySection(config, String.valueOf(section.getKey()), section.getValue(), errors);
            }
            if (!errors.isEmpty()) {
                throw new IllegalStateException("Context Guard configuration in " + source
                        + " could not be bound:\n  - " + String.join("\n  - ", errors));
            }
        } else {
            throw new IllegalStateException("Configuration " + source + " must be a YAML mapping");
        }

        if (config.getRules().isEmpty()) {
            LOG.warn("No detection rules defined in {}", source);
        }
        config.validate();

        LOG.info("Loaded configuration with {} detection rule(s), remote tier {}",
                config.getRules().size(), config.getRemote().isEnabled() ? "enabled" : "disabled");
        return config;
    }

    private static void applySection(GuardConfig config, String name, Object value, List<String> errors) {
        if (value == null) {
            return;
        }
        try {
            switch (name) {
                case "remote" -> BINDER.updateValue(config.getRemote(), value);
                case "cache" -> BINDER.updateValue(config.getCache(), value);
                case "monitor" -> BINDER.updateValue(config.getMonitor(), value);
                case "history" -> BINDER.updateValue(config.getHistory(), value);
                case "rules" -> config.setRules(BINDER.convertValue(value, RULE_LIST));
                default -> errors.add("unknown section '" + name + "'");
            }
        } catch (IOException | IllegalArgumentException e) {
            errors.add("section '" + name + "': " + e.getMessage());
        }
    }
}
