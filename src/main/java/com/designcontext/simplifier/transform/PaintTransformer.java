package com.designcontext.simplifier.transform;

import com.designcontext.simplifier.model.RawNode;
import com.designcontext.simplifier.model.style.ColorValue;
import com.designcontext.simplifier.model.style.GradientFill;
import com.designcontext.simplifier.model.style.ImageFill;
import com.designcontext.simplifier.model.style.SimplifiedStroke;
import com.designcontext.simplifier.util.CssUtil;
import com.fasterxml.jackson.databind.JsonNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Converts platform paints into compact fill values: a hex string for opaque solids,
 * an {@code rgba(...)} string for translucent ones, or an image / gradient object.
 */
public final class PaintTransformer {
    private static final Logger log = LoggerFactory.getLogger(PaintTransformer.class);

    private static final Set<String> GRADIENT_TYPES = Set.of(
            "GRADIENT_LINEAR", "GRADIENT_RADIAL", "GRADIENT_ANGULAR", "GRADIENT_DIAMOND");

    private PaintTransformer() {
    }

    public static boolean isVisible(JsonNode paint) {
        JsonNode visible = paint.get("visible");
        return visible == null || !visible.isBoolean() || visible.booleanValue();
    }

    /**
     * Parses one paint. Returns null for paint types this tool does not understand, so the
     * caller can drop the entry.
     *
     * @param hasChildren whether the painted node has children; decides between background
     *                    and content semantics for image fills
     */
    public static Object parsePaint(JsonNode paint, boolean hasChildren) {
        String type = paint.path("type").asText("");
        if ("SOLID".equals(type)) {
            JsonNode color = paint.path("color");
            double paintOpacity = paint.has("opacity") ? paint.path("opacity").asDouble(1.0) : 1.0;
            ColorValue value = convertColor(color, paintOpacity);
            if (value.getOpacity() == 1.0) {
                return value.getHex();
            }
            return formatRgba(color, value.getOpacity());
        }
        if ("IMAGE".equals(type)) {
            return parseImage(paint, hasChildren);
        }
        if (GRADIENT_TYPES.contains(type)) {
            List<GradientFill.Stop> stops = new ArrayList<>();
            for (JsonNode stop : paint.path("gradientStops")) {
                stops.add(new GradientFill.Stop(stop.path("position").asDouble(0),
                        convertColor(stop.path("color"), 1.0)));
            }
            return GradientFill.builder()
                    .type(type)
                    .gradientHandlePositions(paint.has("gradientHandlePositions")
                            ? paint.get("gradientHandlePositions").deepCopy() : null)
                    .gradientStops(stops)
                    .build();
        }
        log.debug("Skipping unsupported paint type: {}", type);
        return null;
    }

    private static ImageFill parseImage(JsonNode paint, boolean hasChildren) {
        String scaleMode = paint.path("scaleMode").asText(null);
        ImageFill.ImageFillBuilder builder = ImageFill.builder()
                .imageRef(paint.path("imageRef").asText(null))
                .scaleMode(scaleMode);
        String mode = scaleMode == null ? "FILL" : scaleMode.toUpperCase(Locale.ROOT);
        if (hasChildren) {
            builder.backgroundSize(switch (mode) {
                case "FIT" -> "contain";
                case "TILE" -> "auto";
                case "STRETCH" -> "100% 100%";
                default -> "cover";
            });
        } else {
            builder.objectFit(switch (mode) {
                case "FIT" -> "contain";
                case "TILE" -> "none";
                case "STRETCH" -> "fill";
                default -> "cover";
            });
        }
        return builder.build();
    }

    /**
     * Splits an RGBA colour (components 0..1) into an uppercase hex code and an opacity
     * combining the colour's alpha with the paint opacity, rounded to two decimals.
     */
    public static ColorValue convertColor(JsonNode color, double opacity) {
        int r = channel(color, "r");
        int g = channel(color, "g");
        int b = channel(color, "b");
        double alpha = color.has("a") ? color.path("a").asDouble(1.0) : 1.0;
        double combined = Math.round(opacity * alpha * 100.0) / 100.0;
        String hex = String.format(Locale.ROOT, "#%02X%02X%02X", r, g, b);
        return new ColorValue(hex, combined);
    }

    public static String formatRgba(JsonNode color, Double opacity) {
        double alpha = opacity != null ? opacity
                : color.has("a") ? color.path("a").asDouble(1.0) : 1.0;
        double rounded = Math.round(alpha * 100.0) / 100.0;
        return "rgba(" + channel(color, "r") + ", " + channel(color, "g") + ", " + channel(color, "b")
                + ", " + CssUtil.formatNumber(rounded) + ")";
    }

    /**
     * Fills in weight and dash settings of a stroke; colours are handled by the caller.
     */
    public static void applyStrokeAttributes(RawNode node, SimplifiedStroke stroke) {
        node.number("strokeWeight").ifPresent(weight -> {
            if (weight > 0) {
                stroke.setStrokeWeight(CssUtil.px(weight));
            }
        });
        List<JsonNode> dashes = node.array("strokeDashes");
        if (!dashes.isEmpty()) {
            List<Double> values = new ArrayList<>();
            dashes.forEach(d -> values.add(d.asDouble()));
            stroke.setStrokeDashes(values);
        }
        JsonNode individual = node.get("individualStrokeWeights");
        if (individual.isObject()) {
            String shorthand = CssUtil.boxShorthand(
                    individual.path("top").asDouble(0),
                    individual.path("right").asDouble(0),
                    individual.path("bottom").asDouble(0),
                    individual.path("left").asDouble(0));
            if (shorthand != null) {
                stroke.setStrokeWeight(shorthand);
            }
        }
    }

    private static int channel(JsonNode color, String name) {
        return (int) Math.round(color.path(name).asDouble(0) * 255);
    }
}
