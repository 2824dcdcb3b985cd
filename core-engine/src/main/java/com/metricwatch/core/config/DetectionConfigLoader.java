package com.metricwatch.core.config;

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
 * Loads and validates {@link DetectionConfig} from a YAML source.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_CONFIG_PATH} (file system path)</li>
 * <li>Explicit file system path passed to {@link #fromFile(String)}</li>
 * <li>Classpath resource via {@link #fromClasspath(String)}</li>
 * </ol>
 *
 * <p>
 * All {@code load*} methods call {@link DetectionConfig#validate()} after
 * parsing so that the application fails fast on invalid tuning.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectionConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(DetectionConfigLoader.class);

    /** Environment variable that can override the default config location. */
    public static final String ENV_CONFIG_PATH = "DETECTION_CONFIG_PATH";

    /** Default classpath resource name. */
    public static final String DEFAULT_RESOURCE = "detection.yml";

    private DetectionConfigLoader() {
        // utility class - not instantiable
    }

    /**
     * Load configuration using automatic resolution.
     *
     * <ol>
     * <li>If {@code DETECTION_CONFIG_PATH} is set and the file exists, load from
     * there.</li>
     * <li>Otherwise, if {@code detection.yml} is on the classpath, load it.</li>
     * <li>Otherwise, use {@link DetectionConfig#defaults()}.</li>
     * </ol>
     *
     * @return parsed and validated configuration
     * @throws IllegalStateException if validation fails
     */
    public static DetectionConfig load() {
        String envPath = System.getenv(ENV_CONFIG_PATH);
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Loading detection config from environment path: {}", envPath);
            return fromFile(envPath);
        }
        if (DetectionConfigLoader.class.getClassLoader().getResource(DEFAULT_RESOURCE) != null) {
            LOG.info("Loading detection config from classpath: {}", DEFAULT_RESOURCE);
            return fromClasspath(DEFAULT_RESOURCE);
        }
        LOG.info("No detection config found, using defaults");
        return DetectionConfig.defaults();
    }

    /**
     * Load configuration from a file system path.
     *
     * @param path path to the YAML file; must not be {@code null}
     * @return parsed and validated configuration
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading or validation fails
     */
    public static DetectionConfig fromFile(String path) {
        Objects.requireNonNull(path, "Config file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Detection config file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read detection config file: " + path, e);
        }
    }

    /**
     * Load configuration from a classpath resource.
     *
     * @param resource classpath resource name; must not be {@code null}
     * @return parsed and validated configuration
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading or validation fails
     */
    public static DetectionConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = DetectionConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    private static DetectionConfig parseAndValidate(InputStream is) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(DetectionConfig.class, options));
        DetectionConfig config = yaml.load(is);

        if (config == null) {
            LOG.warn("Detection config is empty, using defaults");
            config = DetectionConfig.defaults();
        }
        config.validate();

        LOG.info("Loaded detection config: {}", config);
        return config;
    }
}
