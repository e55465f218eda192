package com.designcontext.simplifier.model.style;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Typography of a text node. {@code styleId} is set when the node is bound to a
 * named text style; the reference pass collapses such entries to the style's name.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"fontFamily", "fontWeight", "fontSize", "lineHeight", "letterSpacing",
        "textCase", "textAlignHorizontal", "textAlignVertical", "styleId"})
public class SimplifiedTextStyle {
    private String fontFamily;
    private Double fontWeight;
    private Double fontSize;
    private String lineHeight;
    private String letterSpacing;
    private String textCase;
    private String textAlignHorizontal;
    private String textAlignVertical;
    private String styleId;
}
