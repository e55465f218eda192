package com.designcontext.simplifier.resolver;

import com.designcontext.simplifier.model.SimplifiedDesign;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ResolutionOutcome {
    SimplifiedDesign design;
    int referencesFound;
    int resolvedCount;
    int textStylesResolved;
    @Singular("unresolved")
    List<String> unresolved;
}
