package com.designcontext.simplifier.mapping;

import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Builder;
import lombok.Value;

/**
 * A named text style together with the font properties used for similarity matching.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TextStyleMapping {
    String id;
    String name;
    String fontFamily;
    Double fontWeight;
    Double fontSize;
    Double lineHeight;
    Double letterSpacing;
}
