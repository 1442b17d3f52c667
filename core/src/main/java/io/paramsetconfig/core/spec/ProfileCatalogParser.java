package io.paramsetconfig.core.spec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import io.paramsetconfig.core.error.CatalogLoadException;
import io.paramsetconfig.core.model.ChannelTypePair;
import io.paramsetconfig.core.model.ParamConstraint;
import io.paramsetconfig.core.model.ProfileDef;
import io.paramsetconfig.core.profile.ProfileCatalog;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses profile catalog documents (YAML or JSON) into a {@link ProfileCatalog}.
 *
 * <p>
 * Document shape: receiver channel type, then sender channel type, then
 * {@code profiles: [...]}. Each profile has an integer {@code id}, localized
 * {@code name} / {@code description} maps and {@code params} mapping parameter
 * ids to constraints with a {@code constraint_type} of {@code fixed},
 * {@code list} or {@code range}. HTML entities in names and descriptions
 * (e.g. {@code &uuml;}) are decoded.
 *
 * <p>
 * The document is first validated against the bundled JSON Schema
 * ({@value #SCHEMA_RESOURCE}); semantic checks (list default in values,
 * {@code min <= max}, reserved and duplicate ids) follow. Every failure is a
 * {@link CatalogLoadException} naming the source.
 *
 * <p>
 * Thread-safe: holds no mutable state.
 */
public final class ProfileCatalogParser {

    private static final Logger LOG = LoggerFactory.getLogger(ProfileCatalogParser.class);

    /** Classpath location of the catalog JSON Schema. */
    public static final String SCHEMA_RESOURCE = "/schemas/profile-catalog.schema.json";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final JsonSchemaFactory SCHEMA_FACTORY =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);

    private final JsonSchema catalogSchema;

    /** Creates a parser using the bundled catalog schema. */
    public ProfileCatalogParser() {
        this.catalogSchema = loadSchema();
    }

    /**
     * Parses the catalog file at the given path.
     *
     * @throws CatalogLoadException if the file cannot be read or the catalog
     *                              is malformed
     */
    public ProfileCatalog parse(Path path) {
        String source = path.toString();
        try (InputStream in = Files.newInputStream(path)) {
            return parse(in, source);
        } catch (IOException e) {
            throw new CatalogLoadException("Failed to read profile catalog: " + e.getMessage(), e, source);
        }
    }

    /**
     * Parses a catalog bundled on the classpath.
     *
     * @param resourceName absolute resource name, e.g. "/profiles/catalog.yaml"
     * @throws CatalogLoadException if the resource is missing or malformed
     */
    public ProfileCatalog parseResource(String resourceName) {
        InputStream in = ProfileCatalogParser.class.getResourceAsStream(resourceName);
        if (in == null) {
            throw new CatalogLoadException("Profile catalog resource not found", resourceName);
        }
        try (in) {
            return parse(in, resourceName);
        } catch (IOException e) {
            throw new CatalogLoadException("Failed to read profile catalog: " + e.getMessage(), e, resourceName);
        }
    }

    /**
     * Parses a catalog from a stream. The stream is not closed.
     *
     * @param in     the document
     * @param source identifier used in error messages
     */
    public ProfileCatalog parse(InputStream in, String source) {
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(in);
        } catch (IOException e) {
            throw new CatalogLoadException("Failed to parse profile catalog: " + e.getMessage(), e, source);
        }
        return parse(root, source);
    }

    /**
     * Builds a catalog from an already parsed document tree.
     */
    public ProfileCatalog parse(JsonNode root, String source) {
        if (root == null || root.isMissingNode() || root.isNull()) {
            throw new CatalogLoadException("Profile catalog is empty", source);
        }
        validateAgainstSchema(root, source);

        ProfileCatalog.Builder builder = ProfileCatalog.builder(source);
        Iterator<Map.Entry<String, JsonNode>> receivers = root.fields();
        while (receivers.hasNext()) {
            Map.Entry<String, JsonNode> receiver = receivers.next();
            Iterator<Map.Entry<String, JsonNode>> senders = receiver.getValue().fields();
            while (senders.hasNext()) {
                Map.Entry<String, JsonNode> sender = senders.next();
                ChannelTypePair pair = new ChannelTypePair(sender.getKey(), receiver.getKey());
                builder.add(pair, parseProfiles(sender.getValue().get("profiles"), pair, source));
            }
        }
        ProfileCatalog catalog = builder.build();
        LOG.info(
                "Profile catalog loaded: source={}, pairs={}, profiles={}",
                source,
                catalog.pairCount(),
                catalog.profileCount());
        return catalog;
    }

    // --- Private helpers ---

    private List<ProfileDef> parseProfiles(JsonNode profilesNode, ChannelTypePair pair, String source) {
        List<ProfileDef> profiles = new ArrayList<>();
        for (JsonNode profileNode : profilesNode) {
            JsonNode idNode = profileNode.get("id");
            if (!idNode.canConvertToInt()) {
                throw new CatalogLoadException(
                        String.format("Pair %s: profile id %s is out of range", pair, idNode.asText()), source);
            }
            int id = idNode.intValue();
            Map<String, ParamConstraint> params = new LinkedHashMap<>();
            JsonNode paramsNode = profileNode.path("params");
            Iterator<Map.Entry<String, JsonNode>> fields = paramsNode.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                params.put(field.getKey(), parseConstraint(field.getValue(), pair, id, field.getKey(), source));
            }
            profiles.add(new ProfileDef(
                    id, textMap(profileNode.path("name")), textMap(profileNode.path("description")), params));
        }
        return profiles;
    }

    private ParamConstraint parseConstraint(
            JsonNode node, ChannelTypePair pair, int profileId, String parameter, String source) {
        String type = node.get("constraint_type").asText();
        ParamConstraint.Kind kind = ParamConstraint.Kind.fromWireName(type);
        if (kind == null) {
            throw new CatalogLoadException(
                    String.format(
                            "Pair %s profile %d parameter '%s': unknown constraint type '%s'",
                            pair, profileId, parameter, type),
                    source);
        }
        try {
            return switch (kind) {
                case FIXED -> ParamConstraint.fixed(scalar(require(node, "value", type)));
                case LIST -> ParamConstraint.oneOf(scalars(require(node, "values", type)), scalar(node.get("default")));
                case RANGE -> ParamConstraint.range(
                        require(node, "min_value", type).doubleValue(),
                        require(node, "max_value", type).doubleValue(),
                        optionalDouble(node.get("default")));
            };
        } catch (IllegalArgumentException e) {
            throw new CatalogLoadException(
                    String.format(
                            "Pair %s profile %d parameter '%s': %s", pair, profileId, parameter, e.getMessage()),
                    e,
                    source);
        }
    }

    private static JsonNode require(JsonNode node, String field, String type) {
        JsonNode child = node.get(field);
        if (child == null || child.isNull()) {
            throw new IllegalArgumentException("'" + type + "' constraint requires '" + field + "'");
        }
        return child;
    }

    private static Object scalar(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isIntegralNumber()) {
            return node.canConvertToInt() ? (Object) node.intValue() : (Object) node.longValue();
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        if (node.isTextual()) {
            return node.textValue();
        }
        throw new IllegalArgumentException("expected a scalar value, got " + node.getNodeType());
    }

    private static List<Object> scalars(JsonNode node) {
        List<Object> values = new ArrayList<>();
        for (JsonNode item : node) {
            values.add(scalar(item));
        }
        return values;
    }

    private static Double optionalDouble(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isNumber()) {
            throw new IllegalArgumentException("range default must be a number, got " + node.getNodeType());
        }
        return node.doubleValue();
    }

    private static Map<String, String> textMap(JsonNode node) {
        Map<String, String> texts = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            texts.put(field.getKey(), Parser.unescapeEntities(field.getValue().asText(), false));
        }
        return texts;
    }

    private void validateAgainstSchema(JsonNode root, String source) {
        Set<ValidationMessage> errors = catalogSchema.validate(root);
        if (!errors.isEmpty()) {
            String detail = errors.stream()
                    .map(ValidationMessage::getMessage)
                    .sorted()
                    .collect(Collectors.joining("; "));
            throw new CatalogLoadException("Profile catalog violates schema: " + detail, source);
        }
    }

    private static JsonSchema loadSchema() {
        try (InputStream in = ProfileCatalogParser.class.getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Catalog schema resource missing: " + SCHEMA_RESOURCE);
            }
            return SCHEMA_FACTORY.getSchema(YAML_MAPPER.readTree(in));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read catalog schema " + SCHEMA_RESOURCE, e);
        }
    }
}
