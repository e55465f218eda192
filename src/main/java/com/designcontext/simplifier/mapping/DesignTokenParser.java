package com.designcontext.simplifier.mapping;

import com.designcontext.simplifier.util.JsonMappers;
import com.designcontext.simplifier.util.NamingUtil;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Reads a design-token export and turns its leaves into mappings.
 *
 * A token is any object carrying {@code extensions["org.lukasoppermann.figmaDesignTokens"]};
 * a {@code variableId} there makes it a variable mapping, a {@code styleId} a text-style
 * mapping whose font properties come from the token's {@code value}.
 *
 * Names are {@code Namespace/camelPath}: the namespace is the token's collection, or is
 * derived from its type ({@code color} -> Colors, {@code custom-fontStyle} -> TextStyles);
 * the path is the token's position below its top-level group.
 * <pre>
 * {"color": {"surface": {"inverse": {"type": "color", "extensions": {..: {"variableId": "VariableID:50:7"}}}}}}
 *   -> VariableID:50:7 = Colors/surfaceInverse
 * </pre>
 */
public class DesignTokenParser {
    private static final Logger log = LoggerFactory.getLogger(DesignTokenParser.class);

    public static final String PLUGIN_NAMESPACE = "org.lukasoppermann.figmaDesignTokens";

    private final ObjectMapper mapper;

    public DesignTokenParser() {
        this(JsonMappers.shared());
    }

    public DesignTokenParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public MappingDocument parse(Path tokenFile) throws IOException {
        String content = Files.readString(tokenFile, StandardCharsets.UTF_8);
        return parse(content, tokenFile.toString());
    }

    public MappingDocument parse(String content, String origin) {
        JsonNode root;
        try {
            root = mapper.readTree(content);
        } catch (JsonProcessingException e) {
            throw new MappingParseException("Invalid JSON in token document " + origin + ": " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new MappingParseException("Token document must be a JSON object: " + origin);
        }

        MappingDocument doc = new MappingDocument();
        doc.setSourceFile(origin);
        visit(root, new ArrayList<>(), origin, doc);
        log.debug("Read {} variable and {} text-style tokens from {}",
                doc.getVariableMappings().size(), doc.getTextStyleMappings().size(), origin);
        return doc;
    }

    private void visit(JsonNode node, List<String> path, String origin, MappingDocument doc) {
        JsonNode extension = node.path("extensions").path(PLUGIN_NAMESPACE);
        if (extension.isObject()) {
            readToken(node, extension, path, origin, doc);
            return;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (field.getValue().isObject() && !"extensions".equals(field.getKey())) {
                path.add(field.getKey());
                visit(field.getValue(), path, origin, doc);
                path.remove(path.size() - 1);
            }
        }
    }

    private void readToken(JsonNode token, JsonNode extension, List<String> path, String origin, MappingDocument doc) {
        String name = tokenName(token, extension, path);
        if (name == null) {
            doc.addWarning("Token at " + String.join(".", path) + " has no usable name");
            return;
        }

        String variableId = extension.path("variableId").asText("");
        if (!variableId.isBlank()) {
            doc.addVariableMapping(VariableMapping.builder()
                    .id(variableId.trim())
                    .name(name)
                    .description(blankToNull(token.path("description").asText(null)))
                    .origin(origin)
                    .build());
            return;
        }

        String styleId = extension.path("styleId").asText("");
        if (!styleId.isBlank()) {
            JsonNode value = token.path("value");
            doc.addTextStyleMapping(TextStyleMapping.builder()
                    .id(stripTrailingComma(styleId.trim()))
                    .name(name)
                    .fontFamily(blankToNull(value.path("fontFamily").asText(null)))
                    .fontWeight(dimension(value, "fontWeight"))
                    .fontSize(dimension(value, "fontSize"))
                    .lineHeight(dimension(value, "lineHeight"))
                    .letterSpacing(dimension(value, "letterSpacing"))
                    .build());
            return;
        }

        doc.addWarning("Token " + name + " carries neither variableId nor styleId");
    }

    /**
     * Builds {@code Namespace/camelPath}; null when neither a namespace nor a path can be derived.
     */
    static String tokenName(JsonNode token, JsonNode extension, List<String> path) {
        String namespace = namespace(token, extension);
        List<String> below = path.size() > 1 ? path.subList(1, path.size()) : path;
        String joined = NamingUtil.joinCamelCase(below);
        if (joined.isEmpty()) {
            return null;
        }
        return namespace == null || namespace.isEmpty() ? joined : namespace + "/" + joined;
    }

    private static String namespace(JsonNode token, JsonNode extension) {
        String collection = extension.path("collection").asText("");
        if (!collection.isBlank()) {
            return NamingUtil.toPascalCase(collection);
        }
        String type = token.path("type").asText("");
        if (type.isBlank()) {
            return null;
        }
        return switch (type) {
            case "color" -> "Colors";
            case "custom-fontStyle" -> "TextStyles";
            default -> NamingUtil.toPascalCase(type.replace("custom-", ""));
        };
    }

    /**
     * Token dimensions come as plain numbers, strings like {@code "16px"} or
     * {@code {"value": 16, "unit": "pixels"}}.
     */
    private static Double dimension(JsonNode value, String field) {
        JsonNode raw = value.get(field);
        if (raw != null && raw.isObject()) {
            return MappingFileParser.number(raw, "value");
        }
        return MappingFileParser.number(value, field);
    }

    private static String stripTrailingComma(String id) {
        return id.endsWith(",") ? id.substring(0, id.length() - 1) : id;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
