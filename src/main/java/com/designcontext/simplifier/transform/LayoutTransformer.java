package com.designcontext.simplifier.transform;

import com.designcontext.simplifier.model.RawNode;
import com.designcontext.simplifier.model.style.SimplifiedLayout;
import com.designcontext.simplifier.util.CssUtil;
import com.fasterxml.jackson.databind.JsonNode;

import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Maps the platform's auto-layout model onto flexbox terms.
 *
 * A frame with {@code layoutMode} HORIZONTAL/VERTICAL becomes a row/column container;
 * its children are described by sizing, and only get explicit coordinates when their
 * parent does not lay them out (no auto layout, or absolute positioning).
 */
@UtilityClass
public class LayoutTransformer {

    private static final Set<String> FRAME_TYPES = Set.of(
            "FRAME", "COMPONENT", "COMPONENT_SET", "INSTANCE", "SECTION");

    public static SimplifiedLayout buildLayout(RawNode node, RawNode parent) {
        SimplifiedLayout layout = buildFrameValues(node);
        applyLayoutValues(node, parent, layout);
        return layout;
    }

    public static boolean isFrame(RawNode node) {
        return node != null && (node.has("layoutMode") || FRAME_TYPES.contains(node.getType()));
    }

    public static String layoutMode(RawNode node) {
        if (node == null) {
            return "none";
        }
        String mode = node.text("layoutMode").orElse("NONE");
        if ("HORIZONTAL".equals(mode)) {
            return "row";
        }
        if ("VERTICAL".equals(mode)) {
            return "column";
        }
        return "none";
    }

    private static SimplifiedLayout buildFrameValues(RawNode node) {
        SimplifiedLayout layout = new SimplifiedLayout();
        if (!isFrame(node)) {
            layout.setMode("none");
            return layout;
        }
        String mode = layoutMode(node);
        layout.setMode(mode);

        List<String> overflow = new ArrayList<>();
        String overflowDirection = node.text("overflowDirection").orElse("");
        if (overflowDirection.contains("HORIZONTAL")) {
            overflow.add("x");
        }
        if (overflowDirection.contains("VERTICAL")) {
            overflow.add("y");
        }
        if (!overflow.isEmpty()) {
            layout.setOverflowScroll(overflow);
        }

        if ("none".equals(mode)) {
            return layout;
        }

        List<RawNode> children = node.getChildren();
        layout.setJustifyContent(convertAlign(node.text("primaryAxisAlignItems").orElse("MIN"),
                children, "primary", mode));
        layout.setAlignItems(convertAlign(node.text("counterAxisAlignItems").orElse("MIN"),
                children, "counter", mode));
        layout.setAlignSelf(convertSelfAlign(node.text("layoutAlign").orElse(null)));
        if ("WRAP".equals(node.text("layoutWrap").orElse(null))) {
            layout.setWrap(Boolean.TRUE);
        }
        double spacing = node.number("itemSpacing").orElse(0);
        if (spacing != 0) {
            layout.setGap(CssUtil.px(spacing));
        }
        layout.setPadding(CssUtil.boxShorthand(
                node.number("paddingTop").orElse(0),
                node.number("paddingRight").orElse(0),
                node.number("paddingBottom").orElse(0),
                node.number("paddingLeft").orElse(0)));
        return layout;
    }

    private static void applyLayoutValues(RawNode node, RawNode parent, SimplifiedLayout layout) {
        if (!node.has("absoluteBoundingBox")) {
            return;
        }

        String horizontal = convertSizing(node.text("layoutSizingHorizontal").orElse(null));
        String vertical = convertSizing(node.text("layoutSizingVertical").orElse(null));
        if (horizontal != null || vertical != null) {
            layout.setSizing(new SimplifiedLayout.Sizing(horizontal, vertical));
        }

        boolean absolute = "ABSOLUTE".equals(node.text("layoutPositioning").orElse(null));
        if (isFrame(parent) && ("none".equals(layoutMode(parent)) || absolute)) {
            if (absolute) {
                layout.setPosition("absolute");
            }
            JsonNode box = node.get("absoluteBoundingBox");
            JsonNode parentBox = parent.get("absoluteBoundingBox");
            if (box.isObject() && parentBox.isObject()) {
                layout.setLocationRelativeToParent(new SimplifiedLayout.Location(
                        CssUtil.pixelRound(box.path("x").asDouble(0) - parentBox.path("x").asDouble(0)),
                        CssUtil.pixelRound(box.path("y").asDouble(0) - parentBox.path("y").asDouble(0))));
            }
        }

        SimplifiedLayout.Dimensions dimensions = buildDimensions(node, layoutMode(parent));
        if (!dimensions.isEmpty()) {
            layout.setDimensions(dimensions);
        }
    }

    private static SimplifiedLayout.Dimensions buildDimensions(RawNode node, String parentMode) {
        JsonNode box = node.get("absoluteBoundingBox");
        double width = box.path("width").asDouble(0);
        double height = box.path("height").asDouble(0);
        String sizingH = node.text("layoutSizingHorizontal").orElse(null);
        String sizingV = node.text("layoutSizingVertical").orElse(null);
        boolean grows = node.number("layoutGrow").orElse(0) != 0;
        boolean stretched = "STRETCH".equals(node.text("layoutAlign").orElse(null));

        SimplifiedLayout.Dimensions dimensions = new SimplifiedLayout.Dimensions();
        if ("row".equals(parentMode)) {
            if (!grows && "FIXED".equals(sizingH)) {
                dimensions.setWidth(width);
            }
            if (!stretched && "FIXED".equals(sizingV)) {
                dimensions.setHeight(height);
            }
        } else if ("column".equals(parentMode)) {
            if (!stretched && "FIXED".equals(sizingH)) {
                dimensions.setWidth(width);
            }
            if (!grows && "FIXED".equals(sizingV)) {
                dimensions.setHeight(height);
            }
            if (node.flag("preserveRatio") && height != 0) {
                dimensions.setAspectRatio(CssUtil.pixelRound(width / height));
            }
        } else {
            if (sizingH == null || "FIXED".equals(sizingH)) {
                dimensions.setWidth(width);
            }
            if (sizingV == null || "FIXED".equals(sizingV)) {
                dimensions.setHeight(height);
            }
        }
        if (dimensions.getWidth() != null) {
            dimensions.setWidth(CssUtil.pixelRound(dimensions.getWidth()));
        }
        if (dimensions.getHeight() != null) {
            dimensions.setHeight(CssUtil.pixelRound(dimensions.getHeight()));
        }
        return dimensions;
    }

    /**
     * Converts an axis alignment; reports {@code stretch} when every in-flow child fills
     * the axis. MIN is the flex default and is left out.
     */
    private static String convertAlign(String axisAlign, List<RawNode> children, String axis, String mode) {
        if (!children.isEmpty()) {
            String direction = direction(axis, mode);
            boolean stretch = true;
            for (RawNode child : children) {
                if ("ABSOLUTE".equals(child.text("layoutPositioning").orElse(null))) {
                    continue;
                }
                String sizing = "horizontal".equals(direction)
                        ? child.text("layoutSizingHorizontal").orElse(null)
                        : child.text("layoutSizingVertical").orElse(null);
                if (!"FILL".equals(sizing)) {
                    stretch = false;
                    break;
                }
            }
            if (stretch) {
                return "stretch";
            }
        }
        switch (axisAlign) {
            case "MAX":
                return "flex-end";
            case "CENTER":
                return "center";
            case "SPACE_BETWEEN":
                return "space-between";
            case "BASELINE":
                return "baseline";
            default:
                return null;
        }
    }

    private static String convertSelfAlign(String align) {
        if (align == null) {
            return null;
        }
        switch (align) {
            case "MAX":
                return "flex-end";
            case "CENTER":
                return "center";
            case "STRETCH":
                return "stretch";
            default:
                return null;
        }
    }

    private static String convertSizing(String sizing) {
        if ("FIXED".equals(sizing)) return "fixed";
        if ("FILL".equals(sizing)) return "fill";
        if ("HUG".equals(sizing)) return "hug";
        return null;
    }

    private static String direction(String axis, String mode) {
        if ("primary".equals(axis)) {
            return "row".equals(mode) ? "horizontal" : "vertical";
        }
        return "row".equals(mode) ? "vertical" : "horizontal";
    }
}
