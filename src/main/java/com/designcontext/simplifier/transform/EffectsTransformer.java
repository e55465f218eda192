package com.designcontext.simplifier.transform;

import com.designcontext.simplifier.model.RawNode;
import com.designcontext.simplifier.model.style.SimplifiedEffects;
import com.designcontext.simplifier.util.CssUtil;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns shadow and blur effects into CSS {@code box-shadow}/{@code filter} strings.
 */
public final class EffectsTransformer {

    private EffectsTransformer() {
    }

    public static SimplifiedEffects buildEffects(RawNode node) {
        SimplifiedEffects result = new SimplifiedEffects();
        List<JsonNode> effects = new ArrayList<>();
        for (JsonNode effect : node.array("effects")) {
            if (effect.path("visible").asBoolean(true)) {
                effects.add(effect);
            }
        }
        if (effects.isEmpty()) {
            return result;
        }

        List<String> shadows = new ArrayList<>();
        effects.stream().filter(e -> "DROP_SHADOW".equals(type(e))).forEach(e -> shadows.add(shadow(e, false)));
        effects.stream().filter(e -> "INNER_SHADOW".equals(type(e))).forEach(e -> shadows.add(shadow(e, true)));

        List<String> blurs = new ArrayList<>();
        List<String> backdropBlurs = new ArrayList<>();
        for (JsonNode effect : effects) {
            if ("LAYER_BLUR".equals(type(effect))) {
                blurs.add(blur(effect));
            } else if ("BACKGROUND_BLUR".equals(type(effect))) {
                backdropBlurs.add(blur(effect));
            }
        }

        if (!shadows.isEmpty()) {
            String boxShadow = String.join(", ", shadows);
            if (node.isType("TEXT")) {
                result.setTextShadow(boxShadow);
            } else {
                result.setBoxShadow(boxShadow);
            }
        }
        if (!blurs.isEmpty()) {
            result.setFilter(String.join(" ", blurs));
        }
        if (!backdropBlurs.isEmpty()) {
            result.setBackdropFilter(String.join(" ", backdropBlurs));
        }
        return result;
    }

    private static String type(JsonNode effect) {
        return effect.path("type").asText("");
    }

    private static String shadow(JsonNode effect, boolean inset) {
        JsonNode offset = effect.path("offset");
        String value = CssUtil.px(offset.path("x").asDouble(0)) + " "
                + CssUtil.px(offset.path("y").asDouble(0)) + " "
                + CssUtil.px(effect.path("radius").asDouble(0)) + " "
                + CssUtil.px(effect.path("spread").asDouble(0)) + " "
                + PaintTransformer.formatRgba(effect.path("color"), null);
        return inset ? "inset " + value : value;
    }

    private static String blur(JsonNode effect) {
        return "blur(" + CssUtil.px(effect.path("radius").asDouble(0)) + ")";
    }
}
