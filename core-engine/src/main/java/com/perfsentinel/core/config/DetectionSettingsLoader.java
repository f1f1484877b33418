package com.perfsentinel.core.config;

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
 * Loads and validates {@link DetectionSettings} from a YAML source.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_SETTINGS_PATH} (file system path)</li>
 * <li>Classpath resource {@value #DEFAULT_RESOURCE}</li>
 * <li>Built-in defaults when neither exists</li>
 * </ol>
 *
 * <p>
 * Every {@code load*} method validates after parsing so the process fails
 * fast on bad settings.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectionSettingsLoader {

    private static final Logger LOG = LoggerFactory.getLogger(DetectionSettingsLoader.class);

    /** Environment variable that can override the default settings location. */
    public static final String ENV_SETTINGS_PATH = "DETECTION_CONFIG_PATH";

    public static final String DEFAULT_RESOURCE = "detection.yml";

    private DetectionSettingsLoader() {
        // utility class
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Load settings using automatic resolution.
     *
     * @return parsed and validated settings
     * @throws IllegalStateException if validation fails
     */
    public static DetectionSettings load() {
        return load(System.getenv(ENV_SETTINGS_PATH));
    }

    /**
     * Load settings from {@code path} if it names an existing file, otherwise
     * from the classpath, otherwise use the defaults.
     *
     * @param path file system path, may be {@code null} or blank
     * @return parsed and validated settings
     */
    public static DetectionSettings load(String path) {
        if (path != null && !path.isBlank() && Files.exists(Path.of(path))) {
            LOG.info("Loading detection settings from path: {}", path);
            return fromFile(path);
        }
        if (DetectionSettingsLoader.class.getClassLoader().getResource(DEFAULT_RESOURCE) != null) {
            LOG.info("Loading detection settings from classpath: {}", DEFAULT_RESOURCE);
            return fromClasspath(DEFAULT_RESOURCE);
        }
        LOG.info("No detection settings found, using defaults");
        return DetectionSettings.defaults();
    }

    /**
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading or validation fails
     */
    public static DetectionSettings fromFile(String path) {
        Objects.requireNonNull(path, "Settings file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Settings file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read settings file: " + path, e);
        }
    }

    /**
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading or validation fails
     */
    public static DetectionSettings fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = DetectionSettingsLoader.class.getClassLoader().getResourceAsStream(resource);
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

    private static DetectionSettings parseAndValidate(InputStream is) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(DetectionSettings.class, options));
        DetectionSettings settings = yaml.load(is);

        if (settings == null) {
            LOG.warn("Detection settings document is empty, using defaults");
            settings = DetectionSettings.defaults();
        }
        settings.validate();

        LOG.info("Loaded {}", settings);
        return settings;
    }
}
