package com.designcontext.simplifier.model.style;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"boxShadow", "textShadow", "filter", "backdropFilter"})
public class SimplifiedEffects {
    private String boxShadow;
    private String textShadow;
    private String filter;
    private String backdropFilter;

    @JsonIgnore
    public boolean isEmpty() {
        return boxShadow == null && textShadow == null && filter == null && backdropFilter == null;
    }
}
