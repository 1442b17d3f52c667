package io.paramsetconfig.core.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.paramsetconfig.core.error.ConfigurationImportException;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Exports paramset values to a versioned JSON document and imports them back.
 *
 * <p>
 * Import is strict: a document that is not a JSON object, carries a version
 * other than {@value #EXPORT_VERSION}, or lacks an identifying field is
 * rejected with {@link ConfigurationImportException}. Stale or foreign
 * documents are never coerced.
 *
 * <p>
 * Thread-safe.
 */
public final class ConfigurationExporter {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigurationExporter.class);
    private static final ObjectMapper JSON = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private static final TypeReference<Map<String, Object>> VALUE_MAP = new TypeReference<>() {};

    /** Current export document version. */
    public static final String EXPORT_VERSION = "1.0";

    private static final List<String> REQUIRED_FIELDS =
            List.of("exported_at", "device_address", "model", "channel_address", "channel_type", "paramset_key");

    private final Clock clock;

    /** Creates an exporter stamping UTC system time. */
    public ConfigurationExporter() {
        this(Clock.systemUTC());
    }

    /** Creates an exporter using the given clock for {@code exported_at}. */
    public ConfigurationExporter(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Exports a configuration as pretty-printed JSON.
     *
     * @return the JSON document
     */
    public String exportConfiguration(
            String deviceAddress,
            String model,
            String channelAddress,
            String channelType,
            String paramsetKey,
            Map<String, Object> values) {
        Objects.requireNonNull(values, "values must not be null");
        ObjectNode root = JSON.createObjectNode();
        root.put("version", EXPORT_VERSION);
        root.put("exported_at", OffsetDateTime.now(clock).format(DateTimeFormatter.ISO_OFFSET_DATE_TIME));
        root.put("device_address", deviceAddress);
        root.put("model", model);
        root.put("channel_address", channelAddress);
        root.put("channel_type", channelType);
        root.put("paramset_key", paramsetKey);
        root.set("values", JSON.valueToTree(values));
        try {
            String json = JSON.writeValueAsString(root);
            LOG.debug("Exported configuration channel={} parameters={}", channelAddress, values.size());
            return json;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize configuration for " + channelAddress, e);
        }
    }

    /**
     * Imports a configuration document produced by
     * {@link #exportConfiguration}.
     *
     * @throws ConfigurationImportException if the document is invalid, has an
     *                                      unsupported version or is incomplete
     */
    public ExportedConfiguration importConfiguration(String json) {
        Objects.requireNonNull(json, "json must not be null");
        JsonNode root;
        try {
            root = JSON.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ConfigurationImportException("Invalid configuration: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new ConfigurationImportException("Invalid configuration: expected a JSON object.");
        }

        String version = root.path("version").asText("");
        if (!EXPORT_VERSION.equals(version)) {
            throw new ConfigurationImportException(String.format(
                    "Unsupported configuration version: '%s' (expected '%s').", version, EXPORT_VERSION));
        }
        for (String field : REQUIRED_FIELDS) {
            if (!root.path(field).isTextual()) {
                throw new ConfigurationImportException("Invalid configuration: missing field '" + field + "'.");
            }
        }
        JsonNode valuesNode = root.get("values");
        if (valuesNode == null || !valuesNode.isObject()) {
            throw new ConfigurationImportException("Invalid configuration: 'values' must be an object.");
        }

        Map<String, Object> values = JSON.convertValue(valuesNode, VALUE_MAP);
        return new ExportedConfiguration(
                version,
                root.get("exported_at").asText(),
                root.get("device_address").asText(),
                root.get("model").asText(),
                root.get("channel_address").asText(),
                root.get("channel_type").asText(),
                root.get("paramset_key").asText(),
                values);
    }
}
