package com.designcontext.simplifier.variant.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Visibility rule for a component property: the property only matters when every
 * condition in {@code visibleWhen} holds. {@code childProperties} lists the properties
 * this one gates.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonPropertyOrder({"property", "visibleWhen", "childProperties", "source"})
public class PropertyRule {
    private String property;

    @Builder.Default
    private List<VisibilityCondition> visibleWhen = new ArrayList<>();

    @Builder.Default
    private List<String> childProperties = new ArrayList<>();

    @Builder.Default
    private RuleSource source = RuleSource.INFERRED;

    public void addCondition(VisibilityCondition condition) {
        if (!visibleWhen.contains(condition)) {
            visibleWhen.add(condition);
        }
    }

    public void addChild(String childProperty) {
        if (!childProperties.contains(childProperty)) {
            childProperties.add(childProperty);
        }
    }
}
