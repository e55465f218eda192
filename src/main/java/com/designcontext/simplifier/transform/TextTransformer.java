package com.designcontext.simplifier.transform;

import com.designcontext.simplifier.model.RawNode;
import com.designcontext.simplifier.model.style.SimplifiedTextStyle;
import com.designcontext.simplifier.util.CssUtil;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

public final class TextTransformer {

    private TextTransformer() {
    }

    public static boolean isTextNode(RawNode node) {
        return node.isType("TEXT");
    }

    public static Optional<String> extractText(RawNode node) {
        return node.text("characters").filter(text -> !text.isEmpty());
    }

    public static boolean hasTextStyle(RawNode node) {
        JsonNode style = node.get("style");
        return style.isObject() && style.size() > 0;
    }

    /**
     * Reads the node's typography. Line height becomes a multiple of the font size (em),
     * letter spacing a percentage of it.
     */
    public static SimplifiedTextStyle extractTextStyle(RawNode node) {
        JsonNode style = node.get("style");
        Double fontSize = number(style, "fontSize");
        Double lineHeightPx = number(style, "lineHeightPx");
        Double letterSpacing = number(style, "letterSpacing");

        SimplifiedTextStyle.SimplifiedTextStyleBuilder builder = SimplifiedTextStyle.builder()
                .fontFamily(text(style, "fontFamily"))
                .fontWeight(number(style, "fontWeight"))
                .fontSize(fontSize)
                .textCase(text(style, "textCase"))
                .textAlignHorizontal(text(style, "textAlignHorizontal"))
                .textAlignVertical(text(style, "textAlignVertical"));

        if (lineHeightPx != null && lineHeightPx != 0 && fontSize != null && fontSize != 0) {
            builder.lineHeight(CssUtil.formatNumber(CssUtil.pixelRound(lineHeightPx / fontSize)) + "em");
        }
        if (letterSpacing != null && letterSpacing != 0 && fontSize != null && fontSize != 0) {
            builder.letterSpacing(CssUtil.formatNumber(CssUtil.pixelRound(letterSpacing / fontSize * 100)) + "%");
        }
        JsonNode styleId = node.path("styles", "text");
        if (styleId.isTextual()) {
            builder.styleId(styleId.textValue());
        }
        return builder.build();
    }

    private static Double number(JsonNode style, String field) {
        JsonNode value = style.get(field);
        return value != null && value.isNumber() ? value.doubleValue() : null;
    }

    private static String text(JsonNode style, String field) {
        JsonNode value = style.get(field);
        return value != null && value.isTextual() ? value.textValue() : null;
    }
}
