package com.designcontext.simplifier.walker;

import com.designcontext.simplifier.model.GlobalVars;
import com.designcontext.simplifier.model.SimplifiedComponentDefinition;
import com.designcontext.simplifier.model.SimplifiedComponentSetDefinition;
import com.designcontext.simplifier.model.SimplifiedNode;

import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
public class WalkResult {
    List<SimplifiedNode> nodes;
    GlobalVars globalVars;
    Map<String, SimplifiedComponentDefinition> components;
    Map<String, SimplifiedComponentSetDefinition> componentSets;
}
