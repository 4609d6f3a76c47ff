package com.adaptivesentinel.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loads and validates {@link EngineConfig} from a YAML source.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_CONFIG_PATH} (file system path)</li>
 * <li>Explicit file system path passed to {@link #fromFile(String)}</li>
 * <li>Classpath resource via {@link #fromClasspath(String)}</li>
 * </ol>
 *
 * <h3>Validation</h3>
 * <p>
 * All {@code load*} methods call {@link EngineConfig#validate()} after
 * parsing so that the engine <strong>fails fast</strong> on bad tuning
 * rather than computing thresholds from nonsense.
 * </p>
 *
 * @since 1.0.0
 */
public final class EngineConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(EngineConfigLoader.class);

    /** Environment variable that can override the default config location. */
    public static final String ENV_CONFIG_PATH = "ENGINE_CONFIG_PATH";

    /** Classpath resource used when nothing else is configured. */
    public static final String DEFAULT_RESOURCE = "engine.yml";

    private EngineConfigLoader() {
        // utility class, not instantiable
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Load configuration using automatic resolution.
     *
     * <ol>
     * <li>If {@code ENGINE_CONFIG_PATH} is set and the file exists, load from
     * there.</li>
     * <li>Otherwise, fall back to {@code engine.yml} on the classpath.</li>
     * <li>If that is missing too, use the built-in defaults.</li>
     * </ol>
     *
     * @return parsed and validated configuration
     * @throws IllegalStateException if validation fails
     */
    public static EngineConfig load() {
        String envPath = System.getenv(ENV_CONFIG_PATH);
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Loading engine config from environment path: {}", envPath);
            return fromFile(envPath);
        }
        if (EngineConfigLoader.class.getClassLoader().getResource(DEFAULT_RESOURCE) == null) {
            LOG.info("No {} on the classpath, using default engine config", DEFAULT_RESOURCE);
            return new EngineConfig();
        }
        LOG.info("Loading engine config from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * Load configuration from a file system path.
     *
     * @param path absolute or relative path to the YAML file; must not be
     *             {@code null}
     * @return parsed and validated configuration
     * @throws NullPointerException     if {@code path} is {@code null}
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading or validation fails
     */
    public static EngineConfig fromFile(String path) {
        Objects.requireNonNull(path, "Engine config path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Engine config file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read engine config file: " + path, e);
        }
    }

    /**
     * Load configuration from a classpath resource.
     *
     * @param resource classpath resource name; must not be {@code null}
     * @return parsed and validated configuration
     * @throws NullPointerException     if {@code resource} is {@code null}
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading or validation fails
     */
    public static EngineConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = EngineConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static EngineConfig parseAndValidate(InputStream is) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(EngineConfig.class, options));
        EngineConfig config = yaml.load(is);

        if (config == null) {
            LOG.warn("Engine config is empty, using defaults");
            config = new EngineConfig();
        }
        config.validate();

        LOG.info("Loaded {}", config);
        return config;
    }
}
