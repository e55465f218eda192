package com.designcontext.simplifier.walker;

import com.designcontext.simplifier.model.RawDesign;
import com.designcontext.simplifier.model.RawNode;
import com.designcontext.simplifier.util.JsonMappers;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;

/**
 * Reads API responses saved to disk into a {@link RawDesign}.
 *
 * Accepted design shapes:
 * - file response: {@code {name, lastModified, thumbnailUrl, document, components, componentSets, styles}};
 *   the document's pages become the roots
 * - nodes response: {@code {name, ..., nodes: {id: {document, components, componentSets, styles}}}}
 * - a bare node
 * Variables come from {@code {meta: {variables, variableCollections}}} or the bare tables.
 */
public class RawDesignReader {
    private static final Logger log = LoggerFactory.getLogger(RawDesignReader.class);

    private final ObjectMapper mapper;

    public RawDesignReader() {
        this(JsonMappers.shared());
    }

    public RawDesignReader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public RawDesign read(Path designFile, Path variablesFile) throws IOException {
        JsonNode design = mapper.readTree(designFile.toFile());
        JsonNode variables = variablesFile != null ? mapper.readTree(variablesFile.toFile()) : null;
        return read(design, variables, designFile.toString());
    }

    public RawDesign read(JsonNode design, JsonNode variablesResponse, String origin) throws IOException {
        if (design == null || !design.isObject()) {
            throw new IOException("Design document is not a JSON object: " + origin);
        }

        RawDesign.RawDesignBuilder builder = RawDesign.builder()
                .name(design.path("name").asText(null))
                .lastModified(design.path("lastModified").asText(null))
                .thumbnailUrl(design.path("thumbnailUrl").asText(null));

        if (design.path("nodes").isObject()) {
            readNodesResponse(design.get("nodes"), builder);
        } else if (design.path("document").isObject()) {
            JsonNode document = design.get("document");
            if (document.path("children").isArray()) {
                document.get("children").forEach(page -> builder.root(RawNode.of(page)));
            } else {
                builder.root(RawNode.of(document));
            }
            builder.components(table(design, "components"))
                    .componentSets(table(design, "componentSets"))
                    .styles(table(design, "styles"));
        } else if (design.has("type") && design.has("id")) {
            builder.root(RawNode.of(design));
            if (design.path("name").isTextual()) {
                builder.name(design.get("name").textValue());
            }
        } else {
            throw new IOException("Unrecognised design document (expected document, nodes or a node): " + origin);
        }

        if (variablesResponse != null && variablesResponse.isObject()) {
            JsonNode tables = variablesResponse.path("meta").isObject() ? variablesResponse.get("meta") : variablesResponse;
            builder.variables(table(tables, "variables"))
                    .variableCollections(table(tables, "variableCollections"));
        }
        return builder.build();
    }

    private void readNodesResponse(JsonNode nodes, RawDesign.RawDesignBuilder builder) {
        ObjectNode components = mapper.createObjectNode();
        ObjectNode componentSets = mapper.createObjectNode();
        ObjectNode styles = mapper.createObjectNode();
        Iterator<Map.Entry<String, JsonNode>> entries = nodes.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            JsonNode wrapper = entry.getValue();
            if (!wrapper.path("document").isObject()) {
                log.warn("Node {} has no document, skipping", entry.getKey());
                continue;
            }
            builder.root(RawNode.of(wrapper.get("document")));
            merge(components, wrapper.get("components"));
            merge(componentSets, wrapper.get("componentSets"));
            merge(styles, wrapper.get("styles"));
        }
        builder.components(components).componentSets(componentSets).styles(styles);
    }

    private static void merge(ObjectNode target, JsonNode source) {
        if (source != null && source.isObject()) {
            target.setAll((ObjectNode) source);
        }
    }

    private static JsonNode table(JsonNode container, String field) {
        JsonNode value = container.get(field);
        return value != null && value.isObject() ? value : MissingNode.getInstance();
    }
}
