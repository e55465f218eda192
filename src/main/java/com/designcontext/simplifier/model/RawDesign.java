package com.designcontext.simplifier.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A fetched design document: the raw node roots plus the metadata tables that came
 * with them. Produced by the API client (or {@code RawDesignReader}); read only.
 */
@Value
@Builder
public class RawDesign {
    String name;
    String lastModified;
    String thumbnailUrl;

    @Singular
    List<RawNode> roots;

    /** Component id -> component metadata ({@code key, name, componentSetId, description, ...}). */
    @Builder.Default
    JsonNode components = MissingNode.getInstance();

    /** Component-set id -> component-set metadata. */
    @Builder.Default
    JsonNode componentSets = MissingNode.getInstance();

    /** Style id -> {@code {name, styleType, ...}}. */
    @Builder.Default
    JsonNode styles = MissingNode.getInstance();

    /** Variable id -> variable; absent when the document has no accessible variable source. */
    @Builder.Default
    JsonNode variables = MissingNode.getInstance();

    /** Collection id -> collection. */
    @Builder.Default
    JsonNode variableCollections = MissingNode.getInstance();
}
