package com.designcontext.simplifier.model.style;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"type", "gradientHandlePositions", "gradientStops"})
public class GradientFill {
    private String type;
    private JsonNode gradientHandlePositions;
    private List<Stop> gradientStops;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Stop {
        private double position;
        private ColorValue color;
    }
}
