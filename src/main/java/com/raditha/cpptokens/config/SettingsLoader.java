package com.raditha.cpptokens.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Loads {@link Settings} from a YAML configuration file.
 * <p>
 * All keys live under the {@code cpptokens} section:
 *
 * <pre>
 * cpptokens:
 *   platform: unix32            # or a map with "base" and sizeof_* overrides
 *   standards:
 *     c: c99
 *     cpp: c++11
 *   relative_paths: true
 *   base_paths: [/src/project]
 *   cpp_header_probe: false
 *   platform_types:
 *     - name: MYINT
 *       value: int
 *       unsigned: true
 *       platforms: [unix32]
 * </pre>
 *
 * Configuration priority: explicit API/CLI overrides > YAML > defaults
 */
public class SettingsLoader {

    private static final Logger logger = LoggerFactory.getLogger(SettingsLoader.class);

    public static final String CONFIG_KEY = "cpptokens";
    public static final String DEFAULT_RESOURCE = "cpptokens.yml";

    private SettingsLoader() {
    }

    /**
     * Load settings from the given YAML file.
     *
     * @throws IOException if the file cannot be read
     * @throws IllegalArgumentException if the file contents are not valid settings
     */
    public static Settings load(File file) throws IOException {
        try (Reader reader = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
            return load(reader);
        }
    }

    public static Settings load(Reader reader) {
        Object root;
        try {
            root = new Yaml().load(reader);
        } catch (YAMLException e) {
            throw new IllegalArgumentException("Invalid YAML configuration: " + e.getMessage(), e);
        }
        if (!(root instanceof Map)) {
            logger.debug("Configuration is empty, using defaults");
            return Settings.defaults();
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> map = (Map<String, Object>) root;
        return fromMap(map);
    }

    /**
     * Load the {@value #DEFAULT_RESOURCE} resource from the classpath, or defaults
     * when no such resource is present.
     */
    public static Settings loadDefault() {
        try (InputStream in = SettingsLoader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                return Settings.defaults();
            }
            Object root = new Yaml().load(in);
            if (root instanceof Map) {
                @SuppressWarnings("unchecked")
                Map<String, Object> map = (Map<String, Object>) root;
                return fromMap(map);
            }
            return Settings.defaults();
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read " + DEFAULT_RESOURCE, e);
        }
    }

    /**
     * Build settings from an already parsed YAML document.
     */
    public static Settings fromMap(Map<String, Object> document) {
        Object section = document.get(CONFIG_KEY);
        if (!(section instanceof Map)) {
            return Settings.defaults();
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> config = (Map<String, Object>) section;

        Platform platform = buildPlatform(config.get("platform"));
        Standards standards = buildStandards(config.get("standards"));
        PlatformTypes platformTypes = buildPlatformTypes(config.get("platform_types"));
        boolean relativePaths = getBoolean(config, "relative_paths", false);
        List<String> basePaths = getListString(config, "base_paths");
        boolean cppHeaderProbe = getBoolean(config, "cpp_header_probe", false);

        logger.debug("Loaded settings: platform={}, c={}, cpp={}",
                platform.name(), standards.c(), standards.cpp());
        return new Settings(platform, standards, platformTypes, relativePaths, basePaths, cppHeaderProbe);
    }

    private static Platform buildPlatform(Object value) {
        if (value == null) {
            return Platform.nativePlatform();
        }
        if (!(value instanceof Map)) {
            return Platform.fromName(value.toString());
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> map = (Map<String, Object>) value;
        Platform base = Platform.fromName(getString(map, "base", Platform.NATIVE));
        return new Platform(
                getString(map, "name", base.name()),
                getInt(map, "char_bit", base.charBit()),
                getInt(map, "sizeof_short", base.sizeofShort()),
                getInt(map, "sizeof_int", base.sizeofInt()),
                getInt(map, "sizeof_long", base.sizeofLong()),
                getInt(map, "sizeof_long_long", base.sizeofLongLong()),
                getInt(map, "sizeof_pointer", base.sizeofPointer()),
                getInt(map, "sizeof_size_t", base.sizeofSizeT()),
                getInt(map, "sizeof_wchar_t", base.sizeofWcharT()),
                getBoolean(map, "default_sign_char", base.defaultSignChar()));
    }

    private static Standards buildStandards(Object value) {
        Standards defaults = Standards.defaults();
        if (!(value instanceof Map)) {
            return defaults;
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> map = (Map<String, Object>) value;
        String c = getString(map, "c", null);
        String cpp = getString(map, "cpp", null);
        return new Standards(
                c != null ? Standards.CStandard.fromString(c) : defaults.c(),
                cpp != null ? Standards.CppStandard.fromString(cpp) : defaults.cpp());
    }

    private static PlatformTypes buildPlatformTypes(Object value) {
        PlatformTypes defaults = PlatformTypes.defaults();
        if (!(value instanceof List)) {
            return defaults;
        }
        PlatformTypes.Builder builder = defaults.toBuilder();
        for (Object entry : (List<?>) value) {
            if (!(entry instanceof Map)) {
                throw new IllegalArgumentException("platform_types entries must be maps, got: " + entry);
            }
            @SuppressWarnings("unchecked")
            Map<String, Object> map = (Map<String, Object>) entry;
            String name = getString(map, "name", null);
            String type = getString(map, "value", null);
            if (name == null || type == null) {
                throw new IllegalArgumentException("platform_types entry needs 'name' and 'value': " + map);
            }
            PlatformType platformType = new PlatformType(
                    type,
                    getBoolean(map, "signed", false),
                    getBoolean(map, "unsigned", false),
                    getBoolean(map, "long_long", false),
                    getBoolean(map, "pointer", false),
                    getBoolean(map, "ptr_ptr", false),
                    getBoolean(map, "const_ptr", false));
            builder.add(name, platformType, getListString(map, "platforms"));
        }
        return builder.build();
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return defaultValue;
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return defaultValue;
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        if (value != null) {
            return value.toString();
        }
        return defaultValue;
    }

    private static List<String> getListString(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value instanceof List) {
            List<String> result = new ArrayList<>();
            for (Object o : (List<?>) value) {
                result.add(String.valueOf(o));
            }
            return result;
        }
        return List.of();
    }
}
