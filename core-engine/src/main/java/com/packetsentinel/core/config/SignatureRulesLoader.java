package com.packetsentinel.core.config;

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
 * Loads and validates {@link SignatureRulesConfig} from a YAML source.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_RULES_PATH} (file system path)</li>
 * <li>Classpath resource {@value #DEFAULT_RESOURCE}</li>
 * </ol>
 *
 * <h3>Validation</h3>
 * <p>
 * All {@code load*} methods call {@link SignatureRulesConfig#validate()}
 * after parsing so that the application <strong>fails fast</strong> on
 * structurally invalid rules. Regexes are compiled later by the rule
 * factory, which skips broken ones.
 * </p>
 *
 * @since 1.0.0
 */
public final class SignatureRulesLoader {

    private static final Logger LOG = LoggerFactory.getLogger(SignatureRulesLoader.class);

    /** Environment variable that can override the default rules location. */
    public static final String ENV_RULES_PATH = "SIGNATURE_RULES_PATH";

    /** Rule set bundled with the engine. */
    public static final String DEFAULT_RESOURCE = "signatures.yml";

    private SignatureRulesLoader() {
        // utility class
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Load rules from {@value #ENV_RULES_PATH} when it points to an existing
     * file, otherwise from the bundled {@value #DEFAULT_RESOURCE}.
     *
     * @return parsed and validated rules configuration
     * @throws IllegalStateException if rule validation fails
     */
    public static SignatureRulesConfig load() {
        return load(System.getenv(ENV_RULES_PATH));
    }

    /**
     * Load rules from {@code path} when it is set and exists, otherwise from
     * the bundled {@value #DEFAULT_RESOURCE}.
     *
     * @param path optional file system path, may be {@code null} or blank
     * @return parsed and validated rules configuration
     */
    public static SignatureRulesConfig load(String path) {
        if (path != null && !path.isBlank()) {
            if (Files.exists(Path.of(path))) {
                LOG.info("Loading signature rules from {}", path);
                return fromFile(path);
            }
            LOG.warn("Signature rules file {} does not exist, using bundled {}", path, DEFAULT_RESOURCE);
        }
        LOG.info("Loading signature rules from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * Load rules from a file system path.
     *
     * @param path path to the YAML file; must not be {@code null}
     * @return parsed and validated rules configuration
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static SignatureRulesConfig fromFile(String path) {
        Objects.requireNonNull(path, "Rules file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is, path);
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
    public static SignatureRulesConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = SignatureRulesLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is, resource);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static SignatureRulesConfig parseAndValidate(InputStream is, String source) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(SignatureRulesConfig.class, options));

        SignatureRulesConfig config;
        try {
            config = yaml.load(is);
        } catch (YAMLException e) {
            throw new IllegalStateException("Malformed signature rules in " + source + ": " + e.getMessage(), e);
        }

        if (config == null || config.getRules().isEmpty()) {
            LOG.warn("No signature rules defined in {}", source);
            config = new SignatureRulesConfig();
        } else {
            config.validate();
        }

        LOG.info("Loaded {} signature rule(s) from {}", config.getRules().size(), source);
        return config;
    }
}
