package com.designcontext.simplifier.model.style;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"type", "imageRef", "scaleMode", "backgroundSize", "objectFit"})
public class ImageFill {
    @Builder.Default
    private String type = "IMAGE";
    private String imageRef;
    private String scaleMode;
    /** Set when the image paints behind children. */
    private String backgroundSize;
    /** Set when the image is the node's own content. */
    private String objectFit;
}
