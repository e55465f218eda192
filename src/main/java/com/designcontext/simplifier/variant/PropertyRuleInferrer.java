package com.designcontext.simplifier.variant;

import com.designcontext.simplifier.model.ComponentProperty;
import com.designcontext.simplifier.model.ComponentPropertyDefinition;
import com.designcontext.simplifier.model.PropertyType;
import com.designcontext.simplifier.model.SimplifiedNode;
import com.designcontext.simplifier.util.NamingUtil;
import com.designcontext.simplifier.variant.model.PropertyRule;
import com.designcontext.simplifier.variant.model.RuleSource;
import com.designcontext.simplifier.variant.model.VariantInfo;
import com.designcontext.simplifier.variant.model.VisibilityCondition;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Infers when a component property is visible and which properties gate others.
 *
 * Dimensions are VARIANT properties with at least two options. A non-variant property that
 * is structurally present (a component property or a layer of that name) under exactly one
 * value of a dimension is visible only for that value. A property present nowhere gets a
 * rule on the primary dimension's default only when configured as structurally dependent.
 *
 * Numbered properties ({@code Icon 1}) are grouped under a boolean parent whose name is
 * the base name or mentions it ({@code Trailing icons}); a child is visible when its
 * parent is, and the parent is {@code true}. Configured rules and groups take precedence
 * and are marked {@link RuleSource#CONFIGURED}.
 */
public class PropertyRuleInferrer {
    private static final Logger log = LoggerFactory.getLogger(PropertyRuleInferrer.class);

    private static final Pattern NUMBERED = Pattern.compile("^(.+?)\\s+\\d+$");

    private final HeuristicsConfig config;

    public PropertyRuleInferrer(HeuristicsConfig config) {
        this.config = config;
    }

    /**
     * @param variantNodes variant components, index-aligned with {@code variants}
     */
    public List<PropertyRule> infer(List<SimplifiedNode> variantNodes, List<VariantInfo> variants,
                                    List<ComponentPropertyDefinition> definitions) {
        List<ComponentPropertyDefinition> dimensions = definitions.stream()
                .filter(d -> d.getType() == PropertyType.VARIANT)
                .filter(d -> d.getVariantOptions() != null && d.getVariantOptions().size() >= 2)
                .toList();
        ComponentPropertyDefinition primary = primaryDimension(dimensions);

        Map<String, PropertyRule> rules = new LinkedHashMap<>();
        for (ComponentPropertyDefinition definition : definitions) {
            if (definition.getType() == PropertyType.VARIANT) {
                continue;
            }
            List<VisibilityCondition> conditions =
                    presenceConditions(definition.getName(), variantNodes, variants, dimensions, primary);
            if (!conditions.isEmpty()) {
                PropertyRule rule = PropertyRule.builder().property(definition.getName()).build();
                conditions.forEach(rule::addCondition);
                rules.put(definition.getName(), rule);
            }
        }

        Set<String> explicit = applyConfiguredRules(rules);
        Map<String, List<String>> groups = groups(definitions);
        for (String parent : parentsFirst(groups)) {
            attachChildren(parent, groups.get(parent), rules, explicit);
        }

        List<PropertyRule> result = new ArrayList<>();
        for (PropertyRule rule : rules.values()) {
            if (!rule.getVisibleWhen().isEmpty() || !rule.getChildProperties().isEmpty()) {
                result.add(rule);
            }
        }
        return result;
    }

    private ComponentPropertyDefinition primaryDimension(List<ComponentPropertyDefinition> dimensions) {
        if (config.getPrimaryDimension() != null) {
            for (ComponentPropertyDefinition dimension : dimensions) {
                if (dimension.getName().equalsIgnoreCase(config.getPrimaryDimension())) {
                    return dimension;
                }
            }
        }
        return dimensions.isEmpty() ? null : dimensions.get(0);
    }

    private List<VisibilityCondition> presenceConditions(String property, List<SimplifiedNode> variantNodes,
                                                         List<VariantInfo> variants,
                                                         List<ComponentPropertyDefinition> dimensions,
                                                         ComponentPropertyDefinition primary) {
        Map<String, Set<Object>> presentUnder = new LinkedHashMap<>();
        boolean seen = false;
        for (int i = 0; i < variantNodes.size(); i++) {
            if (!isPresent(property, variantNodes.get(i))) {
                continue;
            }
            seen = true;
            for (ComponentPropertyDefinition dimension : dimensions) {
                Object value = variants.get(i).getProperties().get(dimension.getName());
                if (value != null) {
                    presentUnder.computeIfAbsent(dimension.getName(), k -> new LinkedHashSet<>()).add(value);
                }
            }
        }

        List<VisibilityCondition> conditions = new ArrayList<>();
        if (seen) {
            presentUnder.forEach((dimension, values) -> {
                if (values.size() == 1) {
                    conditions.add(VisibilityCondition.equalTo(dimension, values.iterator().next()));
                }
            });
        } else if (primary != null && isStructurallyDependent(property)) {
            log.debug("{} not found in any variant, assuming {}={}", property, primary.getName(), primary.getDefaultValue());
            conditions.add(VisibilityCondition.equalTo(primary.getName(), primary.getDefaultValue()));
        }
        return conditions;
    }

    /**
     * Whether the variant's subtree carries a component property or a layer with this name.
     * The variant node itself is not checked; its name is the variant name.
     */
    static boolean isPresent(String property, SimplifiedNode variant) {
        String wanted = NamingUtil.normalizeLabel(property);
        if (variant.getChildren() == null) {
            return false;
        }
        for (SimplifiedNode child : variant.getChildren()) {
            if (containsLabel(child, wanted)) {
                return true;
            }
        }
        return false;
    }

    private static boolean containsLabel(SimplifiedNode node, String wanted) {
        if (wanted.equals(NamingUtil.normalizeLabel(node.getName()))) {
            return true;
        }
        if (node.getComponentProperties() != null) {
            for (ComponentProperty property : node.getComponentProperties()) {
                if (wanted.equals(NamingUtil.normalizeLabel(PropertyNames.clean(property.getName())))) {
                    return true;
                }
            }
        }
        if (node.getChildren() != null) {
            for (SimplifiedNode child : node.getChildren()) {
                if (containsLabel(child, wanted)) {
                    return true;
                }
            }
        }
        return false;
    }

    private boolean isStructurallyDependent(String property) {
        String wanted = NamingUtil.normalizeLabel(property);
        return config.getStructurallyDependentProperties().stream()
                .anyMatch(name -> wanted.equals(NamingUtil.normalizeLabel(name)));
    }

    private Set<String> applyConfiguredRules(Map<String, PropertyRule> rules) {
        Set<String> explicit = new HashSet<>();
        for (PropertyRule configured : config.getRules()) {
            if (configured == null || configured.getProperty() == null) {
                continue;
            }
            PropertyRule inferred = rules.get(configured.getProperty());
            PropertyRule rule = PropertyRule.builder()
                    .property(configured.getProperty())
                    .source(RuleSource.CONFIGURED)
                    .build();
            if (configured.getVisibleWhen() != null) {
                configured.getVisibleWhen().stream().filter(Objects::nonNull).forEach(rule::addCondition);
            }
            if (configured.getChildProperties() != null) {
                configured.getChildProperties().stream().filter(Objects::nonNull).forEach(rule::addChild);
            }
            if (inferred != null) {
                inferred.getChildProperties().forEach(rule::addChild);
            }
            rules.put(rule.getProperty(), rule);
            explicit.add(rule.getProperty());
        }
        return explicit;
    }

    /**
     * Parent -> children, configured groups first, then numbered properties matched to a
     * boolean parent.
     */
    private Map<String, List<String>> groups(List<ComponentPropertyDefinition> definitions) {
        Set<String> names = new LinkedHashSet<>();
        definitions.forEach(d -> names.add(d.getName()));

        Map<String, List<String>> groups = new LinkedHashMap<>();
        Set<String> grouped = new HashSet<>();
        config.getPropertyGroups().forEach((parent, children) -> {
            if (children == null || !names.contains(parent)) {
                log.debug("Configured group parent {} is not a property of this component set", parent);
                return;
            }
            for (String child : children) {
                if (names.contains(child)) {
                    groups.computeIfAbsent(parent, k -> new ArrayList<>()).add(child);
                    grouped.add(child);
                }
            }
        });

        List<String> booleanParents = definitions.stream()
                .filter(d -> d.getType() == PropertyType.BOOLEAN)
                .map(ComponentPropertyDefinition::getName)
                .toList();
        for (String name : names) {
            if (grouped.contains(name)) {
                continue;
            }
            Matcher matcher = NUMBERED.matcher(name);
            if (!matcher.matches()) {
                continue;
            }
            String base = matcher.group(1).trim();
            findParent(base, name, booleanParents).ifPresent(parent -> {
                groups.computeIfAbsent(parent, k -> new ArrayList<>()).add(name);
                grouped.add(name);
            });
        }
        return groups;
    }

    static Optional<String> findParent(String base, String child, List<String> candidates) {
        String wanted = NamingUtil.normalizeLabel(base);
        for (String candidate : candidates) {
            if (!candidate.equals(child) && NamingUtil.normalizeLabel(candidate).equals(wanted)) {
                return Optional.of(candidate);
            }
        }
        for (String candidate : candidates) {
            if (candidate.equals(child)) {
                continue;
            }
            List<String> words = Arrays.asList(NamingUtil.normalizeLabel(candidate).split(" "));
            if (words.contains(wanted) || words.contains(wanted + "s")) {
                return Optional.of(candidate);
            }
        }
        for (String candidate : candidates) {
            if (!candidate.equals(child) && NamingUtil.normalizeLabel(candidate).contains(wanted)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /**
     * Group parents ordered so a group nested in another comes after it, letting children
     * inherit conditions the outer group already attached. Cycles are broken at first visit.
     */
    static List<String> parentsFirst(Map<String, List<String>> groups) {
        Map<String, String> enclosing = new HashMap<>();
        groups.forEach((parent, children) -> children.forEach(child -> enclosing.putIfAbsent(child, parent)));

        List<String> ordered = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        for (String parent : groups.keySet()) {
            visitParentFirst(parent, groups, enclosing, visited, ordered);
        }
        return ordered;
    }

    private static void visitParentFirst(String parent, Map<String, List<String>> groups, Map<String, String> enclosing,
                                         Set<String> visited, List<String> ordered) {
        if (!visited.add(parent)) {
            return;
        }
        String outer = enclosing.get(parent);
        if (outer != null && groups.containsKey(outer)) {
            visitParentFirst(outer, groups, enclosing, visited, ordered);
        }
        ordered.add(parent);
    }

    private void attachChildren(String parent, List<String> children, Map<String, PropertyRule> rules,
                                Set<String> explicit) {
        boolean configuredGroup = config.getPropertyGroups().containsKey(parent);
        PropertyRule parentRule = rules.computeIfAbsent(parent, name -> PropertyRule.builder()
                .property(name)
                .source(configuredGroup ? RuleSource.CONFIGURED : RuleSource.INFERRED)
                .build());
        for (String child : children) {
            parentRule.addChild(child);
            if (explicit.contains(child)) {
                continue;
            }
            PropertyRule childRule = rules.computeIfAbsent(child, name -> PropertyRule.builder()
                    .property(name)
                    .source(configuredGroup ? RuleSource.CONFIGURED : RuleSource.INFERRED)
                    .build());
            parentRule.getVisibleWhen().forEach(childRule::addCondition);
            childRule.addCondition(VisibilityCondition.equalTo(parent, Boolean.TRUE));
        }
    }
}
