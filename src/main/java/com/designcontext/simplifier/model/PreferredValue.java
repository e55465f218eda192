package com.designcontext.simplifier.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A component or component set suggested for an instance-swap property.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PreferredValue {
    /** {@code COMPONENT} or {@code COMPONENT_SET}. */
    private String type;
    private String key;
}
