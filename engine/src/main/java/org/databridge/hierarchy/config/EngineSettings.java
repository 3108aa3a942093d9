package org.databridge.hierarchy.config;

import org.databridge.hierarchy.compiler.CompilationCache;
import org.databridge.hierarchy.compiler.SourceMapping;
import org.databridge.hierarchy.plan.QualifiedName;
import org.databridge.hierarchy.script.ScriptOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Properties;

/**
 * Engine configuration, layered from lowest to highest priority:
 * <ol>
 *   <li>{@value #RESOURCE_NAME} on the classpath</li>
 *   <li>the properties file named by the {@value #CONFIG_FILE_PROPERTY} system property</li>
 *   <li>system properties prefixed with {@value #SYSTEM_PREFIX}</li>
 * </ol>
 */
public final class EngineSettings {

    private static final Logger LOGGER = LoggerFactory.getLogger(EngineSettings.class);

    public static final String RESOURCE_NAME = "formula-engine.properties";
    public static final String CONFIG_FILE_PROPERTY = "formula.engine.config";
    public static final String SYSTEM_PREFIX = "formula.engine.";

    public static final String SERVER_PORT = "server.port";
    public static final String SNAPSHOT_PATH = "snapshot.path";
    public static final String SOURCE_TABLE = "source.table";
    public static final String SOURCE_ALIAS = "source.alias";
    public static final String SOURCE_KEYS = "source.keys";
    public static final String SOURCE_VALUE_SUFFIX = "source.value-suffix";
    public static final String EXTERNAL_VALUE_COLUMN = "external.value-column";
    public static final String TARGET_DATABASE = "target.database";
    public static final String TARGET_SCHEMA = "target.schema";
    public static final String TARGET_TABLE = "target.table";
    public static final String DYNAMIC_TARGET_LAG = "dynamic.target-lag";
    public static final String DYNAMIC_WAREHOUSE = "dynamic.warehouse";
    public static final String CACHE_MAXIMUM_SIZE = "cache.maximum-size";
    public static final String CACHE_EXPIRE_AFTER_ACCESS_MINUTES = "cache.expire-after-access-minutes";

    private final Properties properties;

    private EngineSettings(Properties properties) {
        this.properties = properties;
    }

    /**
     * Loads every layer from the running JVM.
     */
    public static EngineSettings load() {
        return load(System.getProperties());
    }

    /**
     * Loads the classpath defaults, then the layers selected by the given system properties.
     */
    public static EngineSettings load(Properties systemProperties) {
        Properties merged = new Properties();
        loadResource(merged);

        String configFile = systemProperties.getProperty(CONFIG_FILE_PROPERTY);
        if (configFile != null && !configFile.isBlank()) {
            loadFile(merged, Path.of(configFile));
        }

        for (String name : systemProperties.stringPropertyNames()) {
            if (name.startsWith(SYSTEM_PREFIX) && !name.equals(CONFIG_FILE_PROPERTY)) {
                merged.setProperty(name.substring(SYSTEM_PREFIX.length()), systemProperties.getProperty(name));
            }
        }
        return new EngineSettings(merged);
    }

    /**
     * Settings backed by the given properties only, without any defaults.
     */
    public static EngineSettings of(Properties properties) {
        Properties copy = new Properties();
        copy.putAll(properties);
        return new EngineSettings(copy);
    }

    private static void loadResource(Properties target) {
        try (InputStream in = EngineSettings.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
            if (in == null) {
                LOGGER.debug("No {} on the classpath, using built-in defaults", RESOURCE_NAME);
                return;
            }
            target.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE_NAME + " from the classpath", e);
        }
    }

    private static void loadFile(Properties target, Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            target.load(in);
            LOGGER.info("Loaded engine settings from {}", file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read engine settings from " + file, e);
        }
    }

    public String get(String key, String defaultValue) {
        String value = properties.getProperty(key);
        return value == null || value.isBlank() ? defaultValue : value.trim();
    }

    public Optional<String> get(String key) {
        return Optional.ofNullable(get(key, null));
    }

    public int getInt(String key, int defaultValue) {
        String value = get(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Setting " + key + " must be an integer, got '" + value + "'", e);
        }
    }

    public List<String> getList(String key) {
        List<String> values = new ArrayList<>();
        String raw = get(key, null);
        if (raw != null) {
            for (String part : raw.split(",")) {
                if (!part.isBlank()) {
                    values.add(part.trim());
                }
            }
        }
        return values;
    }

    public int serverPort() {
        return getInt(SERVER_PORT, 8080);
    }

    public Optional<Path> snapshotPath() {
        return get(SNAPSHOT_PATH).map(Path::of);
    }

    public SourceMapping sourceMapping() {
        SourceMapping defaults = SourceMapping.DEFAULT;
        return new SourceMapping(
                QualifiedName.of(get(SOURCE_TABLE, defaults.sourceTable().toString())),
                get(SOURCE_ALIAS, defaults.sourceAlias()),
                getList(SOURCE_KEYS),
                get(SOURCE_VALUE_SUFFIX, defaults.valueSuffix()),
                get(EXTERNAL_VALUE_COLUMN, defaults.externalValueColumn()),
                defaults.columnOverrides());
    }

    public ScriptOptions scriptOptions() {
        ScriptOptions defaults = ScriptOptions.DEFAULT;
        return new ScriptOptions(
                get(TARGET_DATABASE, null),
                get(TARGET_SCHEMA, null),
                get(TARGET_TABLE, defaults.targetTable()),
                get(DYNAMIC_TARGET_LAG, defaults.targetLag()),
                get(DYNAMIC_WAREHOUSE, defaults.warehouse()));
    }

    public CompilationCache compilationCache() {
        return new CompilationCache(
                getInt(CACHE_MAXIMUM_SIZE, (int) CompilationCache.DEFAULT_MAXIMUM_SIZE),
                Duration.ofMinutes(getInt(CACHE_EXPIRE_AFTER_ACCESS_MINUTES,
                        (int) CompilationCache.DEFAULT_EXPIRE_AFTER_ACCESS.toMinutes())));
    }
}
