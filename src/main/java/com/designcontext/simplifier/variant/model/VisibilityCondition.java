package com.designcontext.simplifier.variant.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One term of a visibility conjunction: either {@code equals} or {@code notEquals} is set.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class VisibilityCondition {
    private String property;
    private Object equals;
    private Object notEquals;

    public static VisibilityCondition equalTo(String property, Object value) {
        return new VisibilityCondition(property, value, null);
    }

    public static VisibilityCondition notEqualTo(String property, Object value) {
        return new VisibilityCondition(property, null, value);
    }
}
