package com.designcontext.simplifier.mapping;

import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Builder;
import lombok.Value;

/**
 * Maps a variable identifier to its design-system name.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class VariableMapping {
    String id;
    String name;
    String description;
    /** Where the mapping was read from, for diagnostics. */
    String origin;
}
