package io.gdcc.repository.collections.config;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Properties;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class CollectionsConfigLoader {
    public static final String SYS_PROP = "repository.collections.config";
    public static final String DEFAULT_RESOURCE = "repository-collections.properties";

    private static final Logger LOG = LoggerFactory.getLogger(CollectionsConfigLoader.class);

    private CollectionsConfigLoader() {}

    /**
     * Load the config from the location given in the system property, or the classpath default
     * when the property is unset. Built-in defaults apply when neither exists.
     *
     * @return CollectionsConfig
     * @throws IOException when the configured file cannot be read
     */
    public static CollectionsConfig load() throws IOException {
        String location = System.getProperty(SYS_PROP);
        if (location == null || location.isBlank()) {
            try (InputStream in = classpath(DEFAULT_RESOURCE)) {
                if (in == null) {
                    LOG.debug("No {} on classpath, using defaults", DEFAULT_RESOURCE);
                    return CollectionsConfig.defaults();
                }
                return parse(read(in));
            }
        }
        return load(location.trim());
    }

    /**
     * Load the config from a filesystem path, falling back to a classpath resource of that name.
     *
     * @throws FileNotFoundException when neither exists
     */
    public static CollectionsConfig load(String location) throws IOException {
        Path path = Path.of(location);
        if (Files.isRegularFile(path)) {
            LOG.debug("Loading collections config from {}", path.toAbsolutePath());
            try (InputStream in = Files.newInputStream(path)) {
                return parse(read(in));
            }
        }
        try (InputStream in = classpath(location)) {
            if (in == null) {
                throw new FileNotFoundException(
                        "Collections config '" + location + "' not found on disk or classpath");
            }
            LOG.debug("Loading collections config from classpath:{}", location);
            return parse(read(in));
        }
    }

    static CollectionsConfig parse(Properties properties) {
        CollectionsConfig defaults = CollectionsConfig.defaults();
        boolean restricted =
                Boolean.parseBoolean(
                        properties.getProperty("collections.namespace.restricted", "false").trim());
        Set<String> allowed =
                namespaces(properties.getProperty("collections.namespace.allowed", ""));
        int pageSize = integer(properties, "collections.page.size", defaults.defaultPageSize());
        int maxPageSize = integer(properties, "collections.page.max", defaults.maxPageSize());
        String contentModel =
                properties
                        .getProperty(
                                "collections.content.model", defaults.collectionContentModel())
                        .trim();
        int timeoutSeconds =
                integer(
                        properties,
                        "collections.query.timeout.seconds",
                        (int) defaults.queryTimeout().toSeconds());

        if (restricted && allowed.isEmpty()) {
            LOG.warn("Namespace restriction enabled but no namespace is allowed");
        }
        return new CollectionsConfig(
                restricted,
                allowed,
                pageSize,
                maxPageSize,
                contentModel,
                Duration.ofSeconds(timeoutSeconds));
    }

    /** Namespaces separated by whitespace or commas; a trailing ':' is tolerated. */
    private static Set<String> namespaces(String raw) {
        return Arrays.stream(raw.split("[\\s,]+"))
                .map(String::trim)
                .map(ns -> ns.endsWith(":") ? ns.substring(0, ns.length() - 1) : ns)
                .filter(ns -> !ns.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private static int integer(Properties properties, String key, int defaultValue) {
        String raw = properties.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Property '" + key + "' is not a number: " + raw, e);
        }
    }

    private static Properties read(InputStream in) throws IOException {
        Properties properties = new Properties();
        properties.load(in);
        return properties;
    }

    private static InputStream classpath(String resource) {
        return CollectionsConfigLoader.class.getClassLoader().getResourceAsStream(resource);
    }
}
