package com.designcontext.simplifier.model.style;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A paint whose colour is bound to a design variable. {@code variable} is the semantic
 * name when known, otherwise the placeholder form {@code Variable[12:34]};
 * {@code variableId} keeps the canonical identifier once a name has been found.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"value", "variable", "variableId"})
public class VariableBoundPaint {
    private Object value;
    private String variable;
    private String variableId;
}
