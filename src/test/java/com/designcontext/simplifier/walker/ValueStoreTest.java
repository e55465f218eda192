package com.designcontext.simplifier.walker;

import com.designcontext.simplifier.model.GlobalVars;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ValueStore.
 */
class ValueStoreTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void testEqualPayloadsShareKey() {
        ValueStore store = new ValueStore();

        String first = store.intern("fill", List.of("#FF0000"));
        String second = store.intern("fill", List.of("#FF0000"));

        assertThat(first).isEqualTo("fill_1");
        assertThat(second).isEqualTo(first);
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void testKeysCountPerCategory() {
        ValueStore store = new ValueStore();

        assertThat(store.intern("fill", List.of("#FF0000"))).isEqualTo("fill_1");
        assertThat(store.intern("layout", Map.of("mode", "row", "gap", "8px"))).isEqualTo("layout_1");
        assertThat(store.intern("fill", List.of("#00FF00"))).isEqualTo("fill_2");
        assertThat(store.intern("stroke", Map.of("strokeWeight", "1px"))).isEqualTo("stroke_1");
    }

    @Test
    void testFieldOrderIsSignificant() {
        ValueStore store = new ValueStore();
        ObjectNode ab = mapper.createObjectNode().put("a", 1).put("b", 2);
        ObjectNode ba = mapper.createObjectNode().put("b", 2).put("a", 1);

        String first = store.intern("layout", ab);
        String second = store.intern("layout", ba);

        assertThat(first).isNotEqualTo(second);
    }

    @Test
    void testLookupIgnoresCategory() {
        ValueStore store = new ValueStore();

        String fill = store.intern("fill", List.of("#000000"));
        String stroke = store.intern("stroke", List.of("#000000"));

        assertThat(stroke).isEqualTo(fill);
    }

    @Test
    void testStoredValueIsDetachedFromInput() {
        ValueStore store = new ValueStore();
        ObjectNode payload = mapper.createObjectNode().put("mode", "row");

        String key = store.intern("layout", payload);
        payload.put("mode", "column");

        assertThat(store.get(key).path("mode").asText()).isEqualTo("row");
        assertThat(store.intern("layout", mapper.createObjectNode().put("mode", "row"))).isEqualTo(key);
    }

    @Test
    void testGlobalVarsKeepInsertionOrder() {
        ValueStore store = new ValueStore();
        store.intern("layout", Map.of("mode", "row"));
        store.intern("fill", List.of("#FFFFFF"));
        store.intern("style", Map.of("fontSize", 14));

        GlobalVars vars = store.toGlobalVars();

        assertThat(vars.getStyles().keySet()).containsExactly("layout_1", "fill_1", "style_1");
        assertThat(store.styles()).isUnmodifiable();
    }
}
