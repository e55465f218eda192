package com.designcontext.simplifier.model.style;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A colour split into an opaque hex code and a separate opacity.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ColorValue {
    private String hex;
    private double opacity;
}
