package com.designcontext.simplifier.resolver;

import com.designcontext.simplifier.model.SimplifiedDesign;
import com.designcontext.simplifier.util.JsonMappers;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Second pass over a simplified design that swaps variable references in the style
 * store for design-system names.
 *
 * Works on a deep copy. Every object carrying {@code variable} is considered: its id is
 * taken from {@code variableId}, from a {@code Variable[..]} placeholder or from a raw id in
 * {@code variable}. Resolved objects get the name in {@code variable} and the canonical id
 * in {@code variableId} (added, never overwritten). Text styles that still carry a
 * {@code styleId} collapse to the style's name when one is found. Running the pass on its
 * own output changes nothing.
 */
public class ReferenceResolutionPass {
    private static final Logger log = LoggerFactory.getLogger(ReferenceResolutionPass.class);

    private static final String VARIABLE = "variable";
    private static final String VARIABLE_ID = "variableId";
    private static final String STYLE_ID = "styleId";

    private final VariableResolver resolver;
    private final ObjectMapper mapper;

    public ReferenceResolutionPass(VariableResolver resolver) {
        this(resolver, JsonMappers.shared());
    }

    public ReferenceResolutionPass(VariableResolver resolver, ObjectMapper mapper) {
        this.resolver = resolver;
        this.mapper = mapper;
    }

    public SimplifiedDesign resolveReferences(SimplifiedDesign design) {
        return resolve(design).getDesign();
    }

    public ResolutionOutcome resolve(SimplifiedDesign design) {
        SimplifiedDesign copy;
        try {
            copy = deepCopy(design);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.error("Could not copy design for reference resolution, returning it unresolved", e);
            return ResolutionOutcome.builder().design(design).build();
        }

        ResolutionOutcome.ResolutionOutcomeBuilder outcome = ResolutionOutcome.builder().design(copy);
        try {
            Map<String, JsonNode> styles = copy.getGlobalVars().getStyles();

            Set<String> ids = new LinkedHashSet<>();
            styles.values().forEach(value -> collectIds(value, ids));
            log.info("Found {} unique variable IDs to resolve", ids.size());
            outcome.referencesFound(ids.size());

            Map<String, String> names = new LinkedHashMap<>();
            for (String id : ids) {
                Optional<String> name = resolver.lookup(id);
                if (name.isPresent()) {
                    names.put(id, name.get());
                    log.debug("Resolved: {} -> {}", id, name.get());
                } else {
                    outcome.unresolved(id);
                    log.info("Could not resolve: {}", id);
                }
            }
            styles.values().forEach(value -> applyNames(value, names));
            outcome.resolvedCount(names.size());
            log.info("Resolved {} variable references", names.size());

            outcome.textStylesResolved(resolveTextStyles(styles));
        } catch (RuntimeException e) {
            log.error("Reference resolution stopped early", e);
        }
        return outcome.build();
    }

    private SimplifiedDesign deepCopy(SimplifiedDesign design) throws JsonProcessingException {
        JsonNode tree = mapper.valueToTree(design);
        return mapper.treeToValue(tree, SimplifiedDesign.class);
    }

    private static void collectIds(JsonNode node, Set<String> ids) {
        if (node.isObject()) {
            referenceId((ObjectNode) node).ifPresent(ids::add);
        }
        if (node.isContainerNode()) {
            node.forEach(child -> collectIds(child, ids));
        }
    }

    private static void applyNames(JsonNode node, Map<String, String> names) {
        if (node.isObject()) {
            ObjectNode object = (ObjectNode) node;
            referenceId(object).ifPresent(id -> {
                String name = names.get(id);
                if (name != null) {
                    if (!object.hasNonNull(VARIABLE_ID)) {
                        object.put(VARIABLE_ID, id);
                    }
                    object.put(VARIABLE, name);
                } else if (VariableIds.isRawId(object.path(VARIABLE).asText())) {
                    object.put(VARIABLE, VariableIds.placeholder(id));
                }
            });
        }
        if (node.isContainerNode()) {
            node.forEach(child -> applyNames(child, names));
        }
    }

    /**
     * The canonical id an object refers to, or empty when it carries no reference or only
     * a name without an id.
     */
    static Optional<String> referenceId(ObjectNode object) {
        JsonNode variable = object.get(VARIABLE);
        if (variable == null || !variable.isTextual()) {
            return Optional.empty();
        }
        JsonNode variableId = object.get(VARIABLE_ID);
        if (variableId != null && variableId.isTextual() && !variableId.textValue().isBlank()) {
            return Optional.ofNullable(VariableIds.canonical(variableId.textValue()));
        }
        String value = variable.textValue();
        if (VariableIds.isPlaceholder(value) || VariableIds.isRawId(value)) {
            return Optional.ofNullable(VariableIds.canonical(value));
        }
        return Optional.empty();
    }

    private int resolveTextStyles(Map<String, JsonNode> styles) {
        int resolved = 0;
        for (Map.Entry<String, JsonNode> entry : styles.entrySet()) {
            JsonNode value = entry.getValue();
            if (!value.isObject() || !value.has(STYLE_ID)) {
                continue;
            }
            Optional<String> name = resolver.resolveTextStyle(
                    value.path(STYLE_ID).asText(null),
                    value.path("fontFamily").asText(null),
                    value.hasNonNull("fontSize") ? value.get("fontSize").asDouble() : null,
                    value.hasNonNull("fontWeight") ? value.get("fontWeight").asDouble() : null);
            if (name.isPresent()) {
                entry.setValue(TextNode.valueOf(name.get()));
                resolved++;
            } else {
                log.debug("No text style name for {}", entry.getKey());
            }
        }
        return resolved;
    }
}
