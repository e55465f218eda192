package com.designcontext.simplifier.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * A component property as set on an instance node: {@code name} still carries the
 * platform's positional suffix (e.g. {@code "Icon#187:1"}).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class ComponentProperty {
    private String name;
    private String value;
    private PropertyType type;
    private List<PreferredValue> preferredValues;
}
