package com.designcontext.simplifier.walker.extractor;

import com.designcontext.simplifier.model.RawNode;
import com.designcontext.simplifier.model.SimplifiedNode;
import com.designcontext.simplifier.model.style.SimplifiedEffects;
import com.designcontext.simplifier.model.style.SimplifiedStroke;
import com.designcontext.simplifier.model.style.VariableBoundPaint;
import com.designcontext.simplifier.resolver.ApiVariableTable;
import com.designcontext.simplifier.resolver.VariableIds;
import com.designcontext.simplifier.transform.EffectsTransformer;
import com.designcontext.simplifier.transform.PaintTransformer;
import com.designcontext.simplifier.util.CssUtil;
import com.designcontext.simplifier.walker.NodeExtractor;
import com.designcontext.simplifier.walker.TraversalContext;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Fills, strokes, effects, opacity and corner radius.
 *
 * A paint bound to a variable becomes {@code {value, variable, variableId?}}. The binding
 * is looked up in the node's {@code boundVariables.fills[i]} (or {@code strokes[i]}) first,
 * then in the paint's own {@code boundVariables.color}. Names come from the fetch's variable
 * table only; anything else is left as a {@code Variable[..]} placeholder for the
 * reference pass.
 */
public class VisualsExtractor implements NodeExtractor {

    @Override
    public void extract(RawNode node, SimplifiedNode result, TraversalContext context) {
        boolean hasChildren = node.hasChildren();
        ApiVariableTable variables = context.getVariables();

        List<Object> fills = paints(node, "fills", hasChildren, variables);
        if (!fills.isEmpty()) {
            result.setFills(context.getStore().intern("fill", fills));
        }

        List<Object> strokeColors = paints(node, "strokes", hasChildren, variables);
        if (!strokeColors.isEmpty()) {
            SimplifiedStroke stroke = SimplifiedStroke.builder().colors(strokeColors).build();
            PaintTransformer.applyStrokeAttributes(node, stroke);
            result.setStrokes(context.getStore().intern("stroke", stroke));
        }

        SimplifiedEffects effects = EffectsTransformer.buildEffects(node);
        if (!effects.isEmpty()) {
            result.setEffects(context.getStore().intern("effect", effects));
        }

        node.number("opacity").ifPresent(opacity -> {
            if (opacity != 1) {
                result.setOpacity(opacity);
            }
        });

        node.number("cornerRadius").ifPresent(radius -> result.setBorderRadius(CssUtil.px(radius)));
        List<JsonNode> radii = node.array("rectangleCornerRadii");
        if (radii.size() == 4 && radii.stream().allMatch(JsonNode::isNumber)) {
            result.setBorderRadius(CssUtil.px(radii.get(0).asDouble()) + " " + CssUtil.px(radii.get(1).asDouble())
                    + " " + CssUtil.px(radii.get(2).asDouble()) + " " + CssUtil.px(radii.get(3).asDouble()));
        }
    }

    private List<Object> paints(RawNode node, String field, boolean hasChildren, ApiVariableTable variables) {
        List<Object> values = new ArrayList<>();
        List<JsonNode> paints = node.array(field);
        for (int index = 0; index < paints.size(); index++) {
            JsonNode paint = paints.get(index);
            if (!PaintTransformer.isVisible(paint)) {
                continue;
            }
            Object parsed = PaintTransformer.parsePaint(paint, hasChildren);
            if (parsed == null) {
                continue;
            }
            Optional<String> binding = binding(node, field, index, paint);
            if (binding.isPresent()) {
                String id = binding.get();
                Optional<String> name = variables.lookup(id);
                values.add(name.isPresent()
                        ? new VariableBoundPaint(parsed, name.get(), VariableIds.canonical(id))
                        : new VariableBoundPaint(parsed, VariableIds.placeholder(id), null));
            } else {
                values.add(parsed);
            }
        }
        return values;
    }

    /**
     * First match wins: node-level binding for this paint index, then the paint's colour binding.
     */
    static Optional<String> binding(RawNode node, String field, int index, JsonNode paint) {
        JsonNode nodeLevel = node.path("boundVariables", field, String.valueOf(index), "id");
        if (nodeLevel.isTextual() && !nodeLevel.textValue().isBlank()) {
            return Optional.of(nodeLevel.textValue());
        }
        if ("SOLID".equals(paint.path("type").asText())) {
            JsonNode paintLevel = paint.path("boundVariables").path("color").path("id");
            if (paintLevel.isTextual() && !paintLevel.textValue().isBlank()) {
                return Optional.of(paintLevel.textValue());
            }
        }
        return Optional.empty();
    }
}
