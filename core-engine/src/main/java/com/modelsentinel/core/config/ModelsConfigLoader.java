package com.modelsentinel.core.config;

import com.modelsentinel.core.error.ValidationException;
import com.modelsentinel.core.store.InMemoryModelRegistry;
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
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loads and validates {@link ModelsConfig} from YAML.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_MODELS_PATH} (file system path)</li>
 * <li>{@value #DEFAULT_RESOURCE} on the classpath</li>
 * </ol>
 *
 * <p>
 * Every load validates the result, so a misconfigured model stops startup
 * instead of silently never alerting.
 * </p>
 *
 * @since 1.0.0
 */
public final class ModelsConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ModelsConfigLoader.class);

    public static final String ENV_MODELS_PATH = "MODELS_CONFIG_PATH";
    public static final String DEFAULT_RESOURCE = "models.yml";

    private ModelsConfigLoader() {
        // utility class, not instantiable
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * @throws IllegalStateException if validation fails
     */
    public static ModelsConfig load() {
        String envPath = System.getenv(ENV_MODELS_PATH);
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Loading models from environment path: {}", envPath);
            return fromFile(envPath);
        }
        LOG.info("Loading models from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static ModelsConfig fromFile(String path) {
        Objects.requireNonNull(path, "Models file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is, path);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Models file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read models file: " + path, e);
        }
    }

    /**
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static ModelsConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = ModelsConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is, resource);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    /**
     * Register every configured model in a fresh registry.
     */
    public static InMemoryModelRegistry toRegistry(ModelsConfig config) {
        InMemoryModelRegistry registry = new InMemoryModelRegistry();
        config.getModels().forEach(registry::register);
        return registry;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static ModelsConfig parseAndValidate(InputStream is, String source) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(ModelsConfig.class, options));

        ModelsConfig config;
        try {
            config = yaml.load(is);
        } catch (YAMLException e) {
            throw new IllegalStateException("Malformed models configuration in " + source, e);
        }

        if (config == null || config.getModels().isEmpty()) {
            LOG.warn("No models defined in {}", source);
            return new ModelsConfig();
        }
        try {
            config.validate();
        } catch (ValidationException e) {
            throw new IllegalStateException(e.getMessage(), e);
        }

        LOG.info("Loaded {} model configuration(s) from {}", config.getModels().size(), source);
        return config;
    }
}
