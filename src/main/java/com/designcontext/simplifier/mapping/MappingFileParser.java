package com.designcontext.simplifier.mapping;

import com.designcontext.simplifier.util.JsonMappers;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Parser for variable mapping documents.
 *
 * Accepted shapes:
 * - Mapping file: {"lastSynced": "...", "sourceFile": "...", "variableMappings": [...], "textStyleMappings": [...]}
 * - Remote payload: a bare array of mappings, or {"mappings": [...]}
 *
 * A variable mapping is {"id": "VariableID:50:7", "name": "Surface/Inverse", "description": "..."}.
 * Entries missing an id or a name are skipped and reported as errors on the document.
 */
public class MappingFileParser {
    private static final Logger log = LoggerFactory.getLogger(MappingFileParser.class);

    private final ObjectMapper mapper;

    public MappingFileParser() {
        this(JsonMappers.shared());
    }

    public MappingFileParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public MappingDocument parse(Path mappingFile) throws IOException {
        String content = Files.readString(mappingFile, StandardCharsets.UTF_8);
        return parse(content, mappingFile.toString());
    }

    public MappingDocument parse(String content, String origin) {
        JsonNode root;
        try {
            root = mapper.readTree(content);
        } catch (JsonProcessingException e) {
            throw new MappingParseException("Invalid JSON in mapping document " + origin + ": " + e.getOriginalMessage(), e);
        }
        if (root == null || root.isMissingNode()) {
            throw new MappingParseException("Empty mapping document: " + origin);
        }
        return parse(root, origin);
    }

    public MappingDocument parse(JsonNode root, String origin) {
        MappingDocument doc = new MappingDocument();

        if (root.isArray()) {
            readVariableMappings(root, origin, doc);
            return doc;
        }
        if (!root.isObject()) {
            throw new MappingParseException("Mapping document must be an object or an array: " + origin);
        }

        doc.setLastSynced(root.path("lastSynced").asText(null));
        doc.setSourceFile(root.path("sourceFile").asText(null));

        JsonNode variables = root.has("variableMappings") ? root.get("variableMappings") : root.get("mappings");
        if (variables == null || !variables.isArray()) {
            throw new MappingParseException("No variableMappings array in " + origin);
        }
        readVariableMappings(variables, origin, doc);

        JsonNode textStyles = root.get("textStyleMappings");
        if (textStyles != null && textStyles.isArray()) {
            readTextStyleMappings(textStyles, origin, doc);
        }

        if (doc.getLastSynced() != null) {
            log.debug("Mapping document {} last synced {}", origin, doc.getLastSynced());
        }
        return doc;
    }

    private void readVariableMappings(JsonNode entries, String origin, MappingDocument doc) {
        int index = 0;
        for (JsonNode entry : entries) {
            index++;
            String id = entry.path("id").asText("");
            String name = entry.path("name").asText("");
            if (id.isBlank() || name.isBlank()) {
                doc.addError("Entry " + index + ": missing id or name");
                log.warn("Skipping variable mapping {} in {}: missing id or name", index, origin);
                continue;
            }
            doc.addVariableMapping(VariableMapping.builder()
                    .id(id.trim())
                    .name(name.trim())
                    .description(blankToNull(entry.path("description").asText(null)))
                    .origin(origin)
                    .build());
        }
    }

    private void readTextStyleMappings(JsonNode entries, String origin, MappingDocument doc) {
        int index = 0;
        for (JsonNode entry : entries) {
            index++;
            String id = entry.path("id").asText("");
            String name = entry.path("name").asText("");
            if (name.isBlank()) {
                doc.addError("Text style " + index + ": missing name");
                log.warn("Skipping text style mapping {} in {}: missing name", index, origin);
                continue;
            }
            doc.addTextStyleMapping(TextStyleMapping.builder()
                    .id(blankToNull(id))
                    .name(name.trim())
                    .fontFamily(blankToNull(entry.path("fontFamily").asText(null)))
                    .fontWeight(number(entry, "fontWeight"))
                    .fontSize(number(entry, "fontSize"))
                    .lineHeight(number(entry, "lineHeight"))
                    .letterSpacing(number(entry, "letterSpacing"))
                    .build());
        }
    }

    static Double number(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null) {
            return null;
        }
        if (value.isNumber()) {
            return value.doubleValue();
        }
        if (value.isTextual()) {
            try {
                return Double.parseDouble(value.textValue().replace("px", "").trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
