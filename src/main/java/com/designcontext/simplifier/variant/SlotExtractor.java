package com.designcontext.simplifier.variant;

import com.designcontext.simplifier.model.ComponentProperty;
import com.designcontext.simplifier.model.PreferredValue;
import com.designcontext.simplifier.model.PropertyType;
import com.designcontext.simplifier.model.SimplifiedNode;
import com.designcontext.simplifier.variant.model.SlotInfo;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Finds the positions in a variant meant to take swappable content: instances exposing an
 * instance-swap property, and layers whose name matches a slot pattern.
 */
public class SlotExtractor {

    private final List<String> slotPatterns;

    public SlotExtractor(List<String> slotPatterns) {
        this.slotPatterns = slotPatterns.stream()
                .map(pattern -> pattern.toLowerCase(Locale.ROOT))
                .toList();
    }

    public List<SlotInfo> extract(SimplifiedNode variant) {
        List<SlotInfo> slots = new ArrayList<>();
        visit(variant, "", slots);
        return slots;
    }

    private void visit(SimplifiedNode node, String path, List<SlotInfo> slots) {
        if (node.isType("INSTANCE") && node.getComponentProperties() != null) {
            Optional<ComponentProperty> swap = node.getComponentProperties().stream()
                    .filter(property -> property.getType() == PropertyType.INSTANCE_SWAP)
                    .findFirst();
            if (swap.isPresent()) {
                slots.add(SlotInfo.builder()
                        .slot(node.getName() != null && !node.getName().isEmpty() ? node.getName() : path)
                        .content("Instance swap: " + PropertyNames.clean(swap.get().getName()))
                        .nodeId(node.getId())
                        .accepts(acceptedKeys(node))
                        .build());
            }
        }
        if (matchesSlotPattern(node.getName())) {
            slots.add(SlotInfo.builder()
                    .slot(node.getName())
                    .content(node.getType())
                    .nodeId(node.getId())
                    .build());
        }
        if (node.getChildren() != null) {
            for (int i = 0; i < node.getChildren().size(); i++) {
                SimplifiedNode child = node.getChildren().get(i);
                String segment = child.getName() != null && !child.getName().isEmpty() ? child.getName() : String.valueOf(i);
                visit(child, path + "/" + segment, slots);
            }
        }
    }

    private boolean matchesSlotPattern(String name) {
        if (name == null || name.isEmpty()) {
            return false;
        }
        String lower = name.toLowerCase(Locale.ROOT);
        return slotPatterns.stream().anyMatch(lower::contains);
    }

    private static List<String> acceptedKeys(SimplifiedNode instance) {
        List<String> keys = new ArrayList<>();
        for (ComponentProperty property : instance.getComponentProperties()) {
            if (property.getPreferredValues() == null) {
                continue;
            }
            for (PreferredValue value : property.getPreferredValues()) {
                if (value.getKey() != null) {
                    keys.add(value.getKey());
                }
            }
        }
        return keys;
    }
}
