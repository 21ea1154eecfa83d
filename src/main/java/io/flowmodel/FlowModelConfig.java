package io.flowmodel;

import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Settings of the modeling layer and the class-file loader, loaded from YAML.
 * <p>
 * The bundled {@code /flow-model.yaml} holds the defaults. A user file only needs the keys it
 * changes: every absent key keeps its default value.
 */
public class FlowModelConfig {

    private static final String DEFAULT_CONFIG = "/flow-model.yaml";

    private final Set<String> collectionTypes;
    private final Set<String> collectionWriteMethods;
    private final Set<String> collectionReadMethods;
    private final boolean hierarchyPruning;
    private final boolean staticFieldJumpSteps;
    private final List<String> includeClasses;
    private final List<String> excludeClasses;

    private FlowModelConfig(Map<String, Object> config, FlowModelConfig defaults) {
        Map<String, Object> collections = getSection(config, "collections");
        Map<String, Object> types = getSection(config, "types");
        Map<String, Object> jumpSteps = getSection(config, "jumpSteps");
        Map<String, Object> loader = getSection(config, "loader");

        this.collectionTypes = getStringSet(collections, "types",
                defaults != null ? defaults.collectionTypes : Set.of());
        this.collectionWriteMethods = getStringSet(collections, "writeMethods",
                defaults != null ? defaults.collectionWriteMethods : Set.of());
        this.collectionReadMethods = getStringSet(collections, "readMethods",
                defaults != null ? defaults.collectionReadMethods : Set.of());
        this.hierarchyPruning = getBoolean(types, "hierarchyPruning",
                defaults == null || defaults.hierarchyPruning);
        this.staticFieldJumpSteps = getBoolean(jumpSteps, "staticFields",
                defaults != null && defaults.staticFieldJumpSteps);
        this.includeClasses = getStringList(loader, "includeClasses",
                defaults != null ? defaults.includeClasses : List.of());
        this.excludeClasses = getStringList(loader, "excludeClasses",
                defaults != null ? defaults.excludeClasses : List.of());
    }

    /**
     * Loads the bundled default configuration from the classpath.
     *
     * @throws IllegalStateException if the bundled file is missing or unreadable
     */
    public static FlowModelConfig loadDefault() {
        try (InputStream is = FlowModelConfig.class.getResourceAsStream(DEFAULT_CONFIG)) {
            if (is == null) {
                throw new IllegalStateException("Default configuration not found: " + DEFAULT_CONFIG);
            }
            return new FlowModelConfig(parse(is), null);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load default configuration", e);
        }
    }

    /**
     * Loads a user configuration file on top of the defaults.
     */
    public static FlowModelConfig loadFromFile(Path path) throws IOException {
        try (InputStream is = Files.newInputStream(path)) {
            return load(is);
        }
    }

    /**
     * Loads a user configuration from a stream on top of the defaults.
     */
    public static FlowModelConfig load(InputStream is) {
        return new FlowModelConfig(parse(is), loadDefault());
    }

    private static Map<String, Object> parse(InputStream is) {
        Object loaded = new Yaml().load(is);
        if (loaded == null) {
            return Map.of();
        }
        if (!(loaded instanceof Map<?, ?>)) {
            throw new IllegalArgumentException("Configuration root must be a mapping, got "
                    + loaded.getClass().getSimpleName());
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> map = (Map<String, Object>) loaded;
        return map;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> getSection(Map<String, Object> config, String key) {
        Object value = config.get(key);
        if (value instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        return Map.of();
    }

    private static Set<String> getStringSet(Map<String, Object> section, String key, Set<String> fallback) {
        if (!section.containsKey(key)) {
            return fallback;
        }
        return Set.copyOf(new LinkedHashSet<>(getStringList(section, key, List.of())));
    }

    private static List<String> getStringList(Map<String, Object> section, String key, List<String> fallback) {
        Object value = section.get(key);
        if (!section.containsKey(key)) {
            return fallback;
        }
        List<String> result = new ArrayList<>();
        if (value instanceof List<?> list) {
            for (Object item : list) {
                if (item instanceof String s && !s.isBlank()) {
                    result.add(s.trim());
                }
            }
        }
        return List.copyOf(result);
    }

    private static boolean getBoolean(Map<String, Object> section, String key, boolean fallback) {
        Object value = section.get(key);
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof String s) {
            return Boolean.parseBoolean(s.trim());
        }
        return fallback;
    }

    public Set<String> collectionTypes() {
        return collectionTypes;
    }

    public Set<String> collectionWriteMethods() {
        return collectionWriteMethods;
    }

    public Set<String> collectionReadMethods() {
        return collectionReadMethods;
    }

    public boolean hierarchyPruning() {
        return hierarchyPruning;
    }

    public boolean staticFieldJumpSteps() {
        return staticFieldJumpSteps;
    }

    public List<String> includeClasses() {
        return includeClasses;
    }

    public List<String> excludeClasses() {
        return excludeClasses;
    }

    /**
     * Whether the loader should read a class, given its dotted name.
     * An empty include list includes everything; excludes win over includes.
     */
    public boolean shouldLoadClass(String className) {
        for (String pattern : excludeClasses) {
            if (matchesPattern(className, pattern)) {
                return false;
            }
        }
        if (includeClasses.isEmpty()) {
            return true;
        }
        for (String pattern : includeClasses) {
            if (matchesPattern(className, pattern)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Glob matching on dotted class names: {@code *} matches within one segment,
     * {@code **} matches across segments.
     */
    static boolean matchesPattern(String className, String pattern) {
        StringBuilder regex = new StringBuilder();
        int i = 0;
        while (i < pattern.length()) {
            char c = pattern.charAt(i);
            if (c == '*') {
                if (i + 1 < pattern.length() && pattern.charAt(i + 1) == '*') {
                    regex.append(".*");
                    i += 2;
                    continue;
                }
                regex.append("[^.]*");
            } else {
                regex.append(Pattern.quote(String.valueOf(c)));
            }
            i++;
        }
        return className.matches(regex.toString());
    }

    /**
     * Copy with hierarchy pruning switched on or off.
     */
    public FlowModelConfig withHierarchyPruning(boolean enabled) {
        return new FlowModelConfig(Map.of("types", Map.of("hierarchyPruning", enabled)), this);
    }

    /**
     * Copy with the static-field jump steps switched on or off.
     */
    public FlowModelConfig withStaticFieldJumpSteps(boolean enabled) {
        return new FlowModelConfig(Map.of("jumpSteps", Map.of("staticFields", enabled)), this);
    }
}
