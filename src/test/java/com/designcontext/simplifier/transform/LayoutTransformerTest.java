package com.designcontext.simplifier.transform;

import com.designcontext.simplifier.model.RawNode;
import com.designcontext.simplifier.model.style.SimplifiedLayout;
import com.designcontext.simplifier.util.JsonMappers;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for LayoutTransformer.
 */
class LayoutTransformerTest {

    private static final String ROW = """
            {
              "id": "1:0", "name": "Toolbar", "type": "FRAME",
              "layoutMode": "HORIZONTAL", "itemSpacing": 8,
              "primaryAxisAlignItems": "SPACE_BETWEEN", "counterAxisAlignItems": "CENTER",
              "paddingTop": 4, "paddingRight": 12, "paddingBottom": 4, "paddingLeft": 12,
              "absoluteBoundingBox": {"x": 100, "y": 50, "width": 360, "height": 48},
              "children": [
                {"id": "1:1", "name": "Back", "type": "INSTANCE", "layoutSizingHorizontal": "FIXED",
                 "layoutSizingVertical": "FIXED",
                 "absoluteBoundingBox": {"x": 112, "y": 54, "width": 40, "height": 40}},
                {"id": "1:2", "name": "Badge", "type": "FRAME", "layoutPositioning": "ABSOLUTE",
                 "absoluteBoundingBox": {"x": 440, "y": 46, "width": 16.333, "height": 16}}
              ]
            }
            """;

    @Test
    void testAutoLayoutFrameBecomesFlexRow() throws IOException {
        RawNode toolbar = node(ROW);

        SimplifiedLayout layout = LayoutTransformer.buildLayout(toolbar, null);

        assertThat(layout.getMode()).isEqualTo("row");
        assertThat(layout.getJustifyContent()).isEqualTo("space-between");
        assertThat(layout.getAlignItems()).isEqualTo("center");
        assertThat(layout.getGap()).isEqualTo("8px");
        assertThat(layout.getPadding()).isEqualTo("4px 12px");
    }

    @Test
    void testChildInRowKeepsFixedSize() throws IOException {
        RawNode toolbar = node(ROW);
        RawNode back = toolbar.getChildren().get(0);

        SimplifiedLayout layout = LayoutTransformer.buildLayout(back, toolbar);

        assertThat(layout.getSizing().getHorizontal()).isEqualTo("fixed");
        assertThat(layout.getDimensions().getWidth()).isEqualTo(40.0);
        assertThat(layout.getLocationRelativeToParent()).isNull();
    }

    @Test
    void testAbsoluteChildGetsPosition() throws IOException {
        RawNode toolbar = node(ROW);
        RawNode badge = toolbar.getChildren().get(1);

        SimplifiedLayout layout = LayoutTransformer.buildLayout(badge, toolbar);

        assertThat(layout.getPosition()).isEqualTo("absolute");
        assertThat(layout.getLocationRelativeToParent().getX()).isEqualTo(340.0);
        assertThat(layout.getLocationRelativeToParent().getY()).isEqualTo(-4.0);
    }

    @Test
    void testNonFrameHasNoMode() throws IOException {
        SimplifiedLayout layout = LayoutTransformer.buildLayout(
                node("{\"id\": \"2:1\", \"name\": \"Dot\", \"type\": \"ELLIPSE\"}"), null);

        assertThat(layout.getMode()).isEqualTo("none");
        assertThat(layout.getDimensions()).isNull();
    }

    private static RawNode node(String json) throws IOException {
        return RawNode.of(JsonMappers.shared().readTree(json));
    }
}
