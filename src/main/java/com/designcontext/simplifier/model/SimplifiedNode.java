package com.designcontext.simplifier.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Compact counterpart of a raw design node.
 *
 * Style-bearing fields ({@code layout}, {@code textStyle}, {@code fills}, {@code strokes},
 * {@code effects}) hold keys into the design's {@link GlobalVars} store; {@code opacity}
 * and {@code borderRadius} are literals. Fields left null are omitted on output.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"id", "name", "type"})
public class SimplifiedNode {
    private String id;
    private String name;
    private String type;

    private String text;
    private String textStyle;

    private String fills;
    private String strokes;
    private String effects;
    private Double opacity;
    private String borderRadius;

    private String layout;

    // instance
    private String componentId;
    private List<ComponentProperty> componentProperties;

    // component / component set
    private String key;
    private String description;
    private String componentSetId;

    private List<SimplifiedNode> children;

    public SimplifiedNode(String id, String name, String type) {
        this.id = id;
        this.name = name;
        this.type = type;
    }

    public boolean isType(String candidate) {
        return candidate.equals(type);
    }

    public boolean hasChildren() {
        return children != null && !children.isEmpty();
    }
}
