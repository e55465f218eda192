package com.designcontext.simplifier.model.style;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * CSS-flavoured layout of a node: flex settings when the node is an auto-layout frame,
 * sizing and positioning relative to its parent otherwise.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"mode", "justifyContent", "alignItems", "alignSelf", "wrap", "gap",
        "locationRelativeToParent", "dimensions", "padding", "sizing", "overflowScroll", "position"})
public class SimplifiedLayout {
    /** {@code none}, {@code row} or {@code column}. */
    private String mode;
    private String justifyContent;
    private String alignItems;
    private String alignSelf;
    private Boolean wrap;
    private String gap;
    private Location locationRelativeToParent;
    private Dimensions dimensions;
    private String padding;
    private Sizing sizing;
    private List<String> overflowScroll;
    private String position;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Location {
        private double x;
        private double y;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Dimensions {
        private Double width;
        private Double height;
        private Double aspectRatio;

        @JsonIgnore
        public boolean isEmpty() {
            return width == null && height == null && aspectRatio == null;
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Sizing {
        /** {@code fixed}, {@code fill} or {@code hug}. */
        private String horizontal;
        private String vertical;
    }
}
