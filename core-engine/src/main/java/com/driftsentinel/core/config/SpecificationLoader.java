package com.driftsentinel.core.config;

import com.driftsentinel.core.detection.SpecificationRegistry;
import com.driftsentinel.core.error.ConfigException;
import com.driftsentinel.core.error.SpecLoadException;
import com.driftsentinel.core.model.Specification;
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
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds a {@link SpecificationRegistry} from a {@link SpecificationsFile}
 * YAML document.
 *
 * @since 1.0.0
 */
public final class SpecificationLoader {

    private static final Logger LOG = LoggerFactory.getLogger(SpecificationLoader.class);

    private SpecificationLoader() {
    }

    /**
     * @param path YAML file path; must not be {@code null}
     * @return registry of every declared specification
     * @throws IllegalArgumentException if the file does not exist
     * @throws SpecLoadException        if the file cannot be read
     * @throws ConfigException          if the content is malformed or invalid
     */
    public static SpecificationRegistry fromFile(String path) {
        Objects.requireNonNull(path, "Specifications file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parse(is, path);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Specifications file not found: " + path, e);
        } catch (IOException e) {
            throw new SpecLoadException("Failed to read specifications file: " + path, e);
        }
    }

    public static SpecificationRegistry fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = SpecificationLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parse(is, resource);
        } catch (IOException e) {
            throw new SpecLoadException("Failed to read classpath resource: " + resource, e);
        }
    }

    private static SpecificationRegistry parse(InputStream is, String source) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(SpecificationsFile.class, options));
        SpecificationsFile file;
        try {
            file = yaml.load(is);
        } catch (YAMLException e) {
            throw new ConfigException("Malformed specifications YAML in " + source + ": " + e.getMessage(), e);
        }
        if (file == null || file.getSpecifications().isEmpty()) {
            LOG.warn("No specifications defined in {}", source);
            return SpecificationRegistry.empty();
        }

        List<String> errors = new ArrayList<>();
        SpecificationRegistry.Builder registry = SpecificationRegistry.builder();
        int specs = 0;
        for (SpecificationsFile.Entry entry : file.getSpecifications()) {
            if (entry.getPaths().isEmpty()) {
                errors.add("Specification '" + entry.getName() + "' declares no paths");
                continue;
            }
            Specification specification;
            try {
                specification = entry.toSpecification();
            } catch (RuntimeException e) {
                errors.add("Specification '" + entry.getName() + "': " + e.getMessage());
                continue;
            }
            for (String path : entry.getPaths()) {
                registry.register(path, specification);
            }
            specs++;
        }
        if (!errors.isEmpty()) {
            throw new ConfigException("Invalid specifications in " + source + ":\n  - "
                    + String.join("\n  - ", errors));
        }

        SpecificationRegistry built = registry.build();
        LOG.info("Loaded {} specification(s) covering {} path pattern(s) from {}", specs, built.size(), source);
        return built;
    }
}
