package io.paramsetconfig.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Function;

/**
 * Loads {@link StoreSettings} from a YAML file with an optional environment
 * variable overlay.
 *
 * <p>
 * YAML layout:
 *
 * <pre>
 * change-log:
 *   max-entries: 500
 * session:
 *   undo-history-limit: 0
 * profiles:
 *   default-locale: en
 *   catalog-resource: /profiles/catalog.yaml
 * </pre>
 *
 * Missing keys receive the defaults of {@link StoreSettings.Builder}.
 *
 * <p>
 * Environment variables take precedence over YAML values. A variable is
 * considered "set" if and only if it is defined AND its trimmed value is
 * non-empty.
 */
public final class SettingsLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    static final String ENV_CHANGE_LOG_MAX_ENTRIES = "PARAMCONFIG_CHANGE_LOG_MAX_ENTRIES";
    static final String ENV_UNDO_HISTORY_LIMIT = "PARAMCONFIG_UNDO_HISTORY_LIMIT";
    static final String ENV_DEFAULT_LOCALE = "PARAMCONFIG_DEFAULT_LOCALE";
    static final String ENV_CATALOG_RESOURCE = "PARAMCONFIG_CATALOG_RESOURCE";

    private SettingsLoader() {
        // utility class
    }

    /**
     * Loads settings from the given YAML file, applying environment variable
     * overrides from {@link System#getenv}.
     *
     * @throws SettingsLoadException if the file is missing or invalid
     */
    public static StoreSettings load(Path settingsPath) {
        return load(settingsPath, System::getenv);
    }

    /**
     * Loads settings from the given YAML file, applying environment variable
     * overrides from the supplied lookup function. Returning {@code null}
     * means the variable is not defined.
     *
     * @throws SettingsLoadException if the file is missing or invalid
     */
    public static StoreSettings load(Path settingsPath, Function<String, String> envLookup) {
        if (!Files.exists(settingsPath)) {
            throw new SettingsLoadException("Settings file not found: " + settingsPath);
        }
        try (InputStream in = Files.newInputStream(settingsPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            return mapToSettings(root, envLookup);
        } catch (SettingsLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new SettingsLoadException("Failed to parse YAML settings: " + settingsPath, e);
        } catch (IllegalArgumentException e) {
            throw new SettingsLoadException("Invalid settings in " + settingsPath + ": " + e.getMessage(), e);
        }
    }

    /**
     * Builds settings from defaults plus environment overrides only.
     */
    public static StoreSettings fromEnvironment(Function<String, String> envLookup) {
        try {
            return mapToSettings(null, envLookup);
        } catch (IllegalArgumentException e) {
            throw new SettingsLoadException("Invalid settings in environment: " + e.getMessage(), e);
        }
    }

    private static StoreSettings mapToSettings(JsonNode root, Function<String, String> envLookup) {
        StoreSettings.Builder builder = StoreSettings.builder();

        // --- YAML mapping ---
        if (root != null && !root.isMissingNode() && !root.isNull()) {
            if (!root.isObject()) {
                throw new SettingsLoadException("Settings document must be a YAML mapping");
            }
            JsonNode changeLog = root.path("change-log");
            if (changeLog.has("max-entries")) {
                builder.changeLogMaxEntries(requireInt(changeLog.get("max-entries"), "change-log.max-entries"));
            }
            JsonNode session = root.path("session");
            if (session.has("undo-history-limit")) {
                builder.undoHistoryLimit(
                        requireInt(session.get("undo-history-limit"), "session.undo-history-limit"));
            }
            JsonNode profiles = root.path("profiles");
            if (profiles.has("default-locale")) {
                builder.defaultLocale(profiles.get("default-locale").asText());
            }
            if (profiles.has("catalog-resource")) {
                builder.catalogResource(profiles.get("catalog-resource").asText());
            }
        }

        // --- Environment overlay ---
        String maxEntries = env(envLookup, ENV_CHANGE_LOG_MAX_ENTRIES);
        if (maxEntries != null) builder.changeLogMaxEntries(parseInt(maxEntries, ENV_CHANGE_LOG_MAX_ENTRIES));
        String undoLimit = env(envLookup, ENV_UNDO_HISTORY_LIMIT);
        if (undoLimit != null) builder.undoHistoryLimit(parseInt(undoLimit, ENV_UNDO_HISTORY_LIMIT));
        String locale = env(envLookup, ENV_DEFAULT_LOCALE);
        if (locale != null) builder.defaultLocale(locale);
        String catalog = env(envLookup, ENV_CATALOG_RESOURCE);
        if (catalog != null) builder.catalogResource(catalog);

        return builder.build();
    }

    private static int requireInt(JsonNode node, String key) {
        if (!node.canConvertToInt() || !node.isIntegralNumber()) {
            throw new SettingsLoadException("Setting '" + key + "' must be an integer, got '" + node.asText() + "'");
        }
        return node.intValue();
    }

    private static int parseInt(String value, String name) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new SettingsLoadException(
                    "Environment variable " + name + " must be an integer, got '" + value + "'", e);
        }
    }

    private static String env(Function<String, String> envLookup, String name) {
        String value = envLookup.apply(name);
        return value == null || value.isBlank() ? null : value.trim();
    }
}
