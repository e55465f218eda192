package com.designcontext.simplifier.model.style;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Stroke paints of a node. Entries of {@code colors} are the same shapes as fills.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"colors", "strokeWeight", "strokeDashes"})
public class SimplifiedStroke {
    @Builder.Default
    private List<Object> colors = new ArrayList<>();
    private String strokeWeight;
    private List<Double> strokeDashes;
}
