package com.designcontext.simplifier.transform;

import com.designcontext.simplifier.model.style.ColorValue;
import com.designcontext.simplifier.model.style.GradientFill;
import com.designcontext.simplifier.model.style.ImageFill;
import com.designcontext.simplifier.util.JsonMappers;
import com.fasterxml.jackson.databind.JsonNode;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for PaintTransformer.
 */
class PaintTransformerTest {

    @Test
    void testOpaqueSolidBecomesHex() throws IOException {
        Object value = PaintTransformer.parsePaint(json("""
                {"type": "SOLID", "color": {"r": 1, "g": 0.5, "b": 0, "a": 1}}
                """), false);

        assertThat(value).isEqualTo("#FF8000");
    }

    @Test
    void testTranslucentSolidBecomesRgba() throws IOException {
        Object value = PaintTransformer.parsePaint(json("""
                {"type": "SOLID", "opacity": 0.5, "color": {"r": 0, "g": 0, "b": 0, "a": 0.8}}
                """), false);

        assertThat(value).isEqualTo("rgba(0, 0, 0, 0.4)");
    }

    @ParameterizedTest
    @CsvSource({
            "FILL, true, cover,",
            "FIT, true, contain,",
            "TILE, false, , none",
            "STRETCH, false, , fill"
    })
    void testImageScaleModes(String scaleMode, boolean hasChildren, String backgroundSize, String objectFit)
            throws IOException {
        ImageFill fill = (ImageFill) PaintTransformer.parsePaint(
                json("{\"type\": \"IMAGE\", \"imageRef\": \"abc\", \"scaleMode\": \"" + scaleMode + "\"}"), hasChildren);

        assertThat(fill.getImageRef()).isEqualTo("abc");
        assertThat(fill.getBackgroundSize()).isEqualTo(backgroundSize);
        assertThat(fill.getObjectFit()).isEqualTo(objectFit);
    }

    @Test
    void testGradientKeepsStops() throws IOException {
        GradientFill fill = (GradientFill) PaintTransformer.parsePaint(json("""
                {
                  "type": "GRADIENT_LINEAR",
                  "gradientStops": [
                    {"position": 0, "color": {"r": 1, "g": 1, "b": 1, "a": 1}},
                    {"position": 1, "color": {"r": 0, "g": 0, "b": 0, "a": 0.5}}
                  ]
                }
                """), false);

        assertThat(fill.getType()).isEqualTo("GRADIENT_LINEAR");
        assertThat(fill.getGradientStops()).hasSize(2);
        assertThat(fill.getGradientStops().get(1).getColor().getOpacity()).isEqualTo(0.5);
    }

    @Test
    void testUnsupportedPaintIsNull() throws IOException {
        assertThat(PaintTransformer.parsePaint(json("{\"type\": \"VIDEO\"}"), false)).isNull();
    }

    @Test
    void testConvertColorCombinesAlphaAndOpacity() throws IOException {
        ColorValue color = PaintTransformer.convertColor(json("{\"r\": 0, \"g\": 0, \"b\": 1, \"a\": 0.5}"), 0.5);

        assertThat(color.getHex()).isEqualTo("#0000FF");
        assertThat(color.getOpacity()).isEqualTo(0.25);
    }

    private static JsonNode json(String text) throws IOException {
        return JsonMappers.shared().readTree(text);
    }
}
