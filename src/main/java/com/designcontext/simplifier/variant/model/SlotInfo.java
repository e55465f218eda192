package com.designcontext.simplifier.variant.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * A position inside a variant meant to receive swappable content.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class SlotInfo {
    private String slot;
    private String content;
    private String nodeId;
    /** Keys of components suggested for this slot. */
    private List<String> accepts;
}
