package patcher.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.stream.Collectors;

import patcher.config.EditCatalog.CallEdit;
import patcher.config.EditCatalog.ConstructorEdit;
import patcher.config.EditCatalog.FieldEdit;
import patcher.config.EditCatalog.ImportEdit;
import patcher.config.EditCatalog.PlaceholderEdit;
import patcher.config.PatchConfig.DocumentEdit;

/**
 * Loads patch configuration from properties or YAML files.
 *
 * <p>Configuration is searched in the following order:
 * <ol>
 *   <li>{@code patch.properties} on the classpath</li>
 *   <li>{@code patch.yml} on the classpath</li>
 * </ol>
 *
 * <p>System properties can override file-based configuration. Use the
 * {@code patch.} prefix for property names (e.g., {@code -Dpatch.write.mode=STAGED}).
 * YAML files are flattened to dotted keys; YAML lists become comma-separated values.
 *
 * <h2>Run properties:</h2>
 * <ul>
 *   <li>{@code patch.files.pattern} - glob of files to patch, relative to the root</li>
 *   <li>{@code patch.write.mode} - INCREMENTAL or STAGED</li>
 *   <li>{@code patch.match.mode} - STRICT or SUBSTRING</li>
 *   <li>{@code patch.report.unchanged} - list unchanged files in the report</li>
 *   <li>{@code patch.dry.run} - compute without writing</li>
 *   <li>{@code patch.alert.level} - DEBUG, WARNING, or ERROR</li>
 * </ul>
 *
 * <h2>Catalog properties:</h2>
 * <ul>
 *   <li>{@code patch.import.anchor}, {@code patch.import.entry}</li>
 *   <li>{@code patch.placeholder.marker}, {@code .fallback}, {@code .replacement}</li>
 *   <li>{@code patch.field.types}, {@code .name} (optional), {@code .declaration}</li>
 *   <li>{@code patch.constructor.types}, {@code .prefix} (default New), {@code .parameter}, {@code .assignment}</li>
 *   <li>{@code patch.call.functions}, {@code .argument}, {@code .suppress}</li>
 *   <li>{@code patch.document.path}, {@code .anchor}, {@code .line}</li>
 * </ul>
 *
 * @see PatchConfig
 */
public final class PatchConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(PatchConfigLoader.class);

    private PatchConfigLoader() {}

    /**
     * Load from classpath (patch.properties or patch.yml).
     * @throws PatchConfigException if no config file found
     */
    public static PatchConfig load() {
        InputStream is = getResource("patch.properties");
        if (is != null) {
            return loadProperties(is, "patch.properties");
        }

        is = getResource("patch.yml");
        if (is != null) {
            return loadYaml(is, "patch.yml");
        }

        throw new PatchConfigException(
                "Config file required: patch.properties or patch.yml");
    }

    /**
     * Loads configuration from an external file.
     *
     * @param path path to the configuration file (.properties or .yml/.yaml)
     * @return the loaded configuration
     * @throws IOException if the file cannot be read
     * @throws PatchConfigException if the configuration is invalid
     */
    public static PatchConfig loadFromFile(Path path) throws IOException {
        String name = path.getFileName().toString();
        try (InputStream is = Files.newInputStream(path)) {
            if (name.endsWith(".yml") || name.endsWith(".yaml")) {
                return loadYaml(is, name);
            }
            return loadProperties(is, name);
        }
    }

    /**
     * Loads configuration from a classpath resource.
     *
     * @param resource resource name (.properties or .yml/.yaml)
     * @return the loaded configuration
     * @throws PatchConfigException if the resource is missing or invalid
     */
    public static PatchConfig loadResource(String resource) {
        InputStream is = getResource(resource);
        if (is == null) {
            throw new PatchConfigException("Config resource not found: " + resource);
        }
        if (resource.endsWith(".yml") || resource.endsWith(".yaml")) {
            return loadYaml(is, resource);
        }
        return loadProperties(is, resource);
    }

    private static InputStream getResource(String name) {
        return PatchConfigLoader.class.getClassLoader().getResourceAsStream(name);
    }

    private static PatchConfig loadProperties(InputStream is, String source) {
        try (is) {
            Properties props = new Properties();
            props.load(is);
            log.info("Loaded config from {}", source);
            return parse(props);
        } catch (IOException e) {
            throw new PatchConfigException("Failed to load " + source, e);
        }
    }

    private static PatchConfig loadYaml(InputStream is, String source) {
        Map<String, Object> root;
        try (is) {
            root = new Yaml().load(is);
        } catch (IOException | YAMLException e) {
            throw new PatchConfigException("Failed to load " + source, e);
        }
        if (root == null) {
            return PatchConfig.DEFAULTS;
        }
        Properties props = new Properties();
        flatten("", root, props);
        log.info("Loaded config from {}", source);
        return parse(props);
    }

    @SuppressWarnings("unchecked")
    private static void flatten(String prefix, Map<String, Object> map, Properties props) {
        for (var entry : map.entrySet()) {
            String key = prefix.isEmpty() ? entry.getKey() : prefix + "." + entry.getKey();
            Object val = entry.getValue();
            if (val instanceof Map) {
                flatten(key, (Map<String, Object>) val, props);
            } else if (val instanceof Collection<?> items) {
                props.setProperty(key, items.stream()
                        .map(String::valueOf)
                        .collect(Collectors.joining(",")));
            } else if (val != null) {
                props.setProperty(key, val.toString());
            }
        }
    }

    private static PatchConfig parse(Properties props) {
        PatchConfig.Builder b = PatchConfig.builder();

        getString(props, "patch.files.pattern").ifPresent(b::filePattern);

        getString(props, "patch.write.mode").ifPresent(v -> {
            try {
                b.writeMode(WriteMode.valueOf(v.toUpperCase()));
            } catch (IllegalArgumentException e) {
                log.warn("Invalid write.mode: {}", v);
            }
        });

        getString(props, "patch.match.mode").ifPresent(v -> {
            try {
                b.matchMode(MatchMode.valueOf(v.toUpperCase()));
            } catch (IllegalArgumentException e) {
                log.warn("Invalid match.mode: {}", v);
            }
        });

        getBoolean(props, "patch.report.unchanged").ifPresent(b::reportUnchanged);
        getBoolean(props, "patch.dry.run").ifPresent(b::dryRun);

        getString(props, "patch.alert.level").ifPresent(v -> {
            try {
                b.alertLevel(AlertLevel.valueOf(v.toUpperCase()));
            } catch (IllegalArgumentException e) {
                log.warn("Invalid alert.level: {}", v);
            }
        });

        b.catalog(parseCatalog(props));
        parseDocument(props).ifPresent(b::documentEdit);

        return b.build();
    }

    private static EditCatalog parseCatalog(Properties props) {
        EditCatalog.Builder c = EditCatalog.builder();

        Optional<String> anchor = getString(props, "patch.import.anchor");
        Optional<String> entry = getString(props, "patch.import.entry");
        if (anchor.isPresent() || entry.isPresent()) {
            c.importEdit(new ImportEdit(
                    require(anchor, "patch.import.anchor"),
                    require(entry, "patch.import.entry")));
        }

        Optional<String> marker = getString(props, "patch.placeholder.marker");
        if (marker.isPresent()) {
            c.placeholderEdit(new PlaceholderEdit(
                    marker.get(),
                    require(getString(props, "patch.placeholder.fallback"), "patch.placeholder.fallback"),
                    require(getString(props, "patch.placeholder.replacement"), "patch.placeholder.replacement")));
        }

        List<String> fieldTypes = getList(props, "patch.field.types");
        if (!fieldTypes.isEmpty()) {
            String declaration = require(getString(props, "patch.field.declaration"), "patch.field.declaration");
            String name = getString(props, "patch.field.name").orElse(EditCatalog.firstToken(declaration));
            c.fieldEdit(new FieldEdit(fieldTypes, name, declaration));
        }

        List<String> ctorTypes = getList(props, "patch.constructor.types");
        if (!ctorTypes.isEmpty()) {
            c.constructorEdit(new ConstructorEdit(
                    ctorTypes,
                    getString(props, "patch.constructor.prefix").orElse("New"),
                    require(getString(props, "patch.constructor.parameter"), "patch.constructor.parameter"),
                    getString(props, "patch.constructor.assignment").orElse(null)));
        }

        List<String> functions = getList(props, "patch.call.functions");
        if (!functions.isEmpty()) {
            c.callEdit(new CallEdit(
                    functions,
                    require(getString(props, "patch.call.argument"), "patch.call.argument"),
                    getList(props, "patch.call.suppress")));
        }

        return c.build();
    }

    private static Optional<DocumentEdit> parseDocument(Properties props) {
        Optional<String> path = getString(props, "patch.document.path");
        if (path.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new DocumentEdit(
                path.get(),
                require(getString(props, "patch.document.anchor"), "patch.document.anchor"),
                require(getString(props, "patch.document.line"), "patch.document.line")));
    }

    private static String require(Optional<String> value, String key) {
        return value.orElseThrow(() -> new PatchConfigException("Missing required property: " + key));
    }

    private static Optional<String> getString(Properties props, String key) {
        String val = System.getProperty(key);
        if (val == null) val = props.getProperty(key);
        if (val == null || val.isBlank()) return Optional.empty();
        return Optional.of(val.trim());
    }

    private static List<String> getList(Properties props, String key) {
        return getString(props, key)
                .map(v -> Arrays.stream(v.split(","))
                        .map(String::trim)
                        .filter(s -> !s.isEmpty())
                        .collect(Collectors.toCollection(ArrayList::new)))
                .map(List::copyOf)
                .orElse(List.of());
    }

    private static Optional<Boolean> getBoolean(Properties props, String key) {
        return getString(props, key).flatMap(v -> {
            if ("true".equalsIgnoreCase(v)) return Optional.of(Boolean.TRUE);
            if ("false".equalsIgnoreCase(v)) return Optional.of(Boolean.FALSE);
            log.warn("Invalid boolean for {}: {}", key, v);
            return Optional.empty();
        });
    }
}
