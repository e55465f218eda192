package com.designcontext.simplifier.variant;

import com.designcontext.simplifier.model.PropertyType;
import com.designcontext.simplifier.model.SimplifiedNode;
import com.designcontext.simplifier.variant.model.ComponentVariantAnalysis;
import com.designcontext.simplifier.variant.model.PropertyRule;
import com.designcontext.simplifier.variant.model.RuleSource;
import com.designcontext.simplifier.variant.model.VisibilityCondition;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.designcontext.simplifier.variant.VariantAnalyzerTest.node;
import static com.designcontext.simplifier.variant.VariantAnalyzerTest.property;
import static com.designcontext.simplifier.variant.VariantAnalyzerTest.set;
import static com.designcontext.simplifier.variant.VariantAnalyzerTest.variant;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the configurable parts of rule inference.
 */
class PropertyRuleInferrerTest {

    @Test
    void testStructurallyDependentPropertyUsesPrimaryDefault() {
        SimplifiedNode set = set("1:0", "Top App Bar",
                variant("1:1", "Layout=Default, Size=Small"),
                variant("1:2", "Layout=Compact, Size=Large"));
        // Declared on the variant itself, so no layer below any variant carries it.
        set.getChildren().get(0).setComponentProperties(List.of(property("Subtitle#8:8", "", PropertyType.TEXT)));
        HeuristicsConfig config = HeuristicsConfig.builder()
                .primaryDimension("Size")
                .structurallyDependentProperties(List.of("Subtitle"))
                .build();

        ComponentVariantAnalysis analysis = new VariantAnalyzer(config).analyze(set);

        PropertyRule subtitle = rule(analysis, "Subtitle").orElseThrow();
        assertThat(subtitle.getVisibleWhen()).containsExactly(VisibilityCondition.equalTo("Size", "Small"));
    }

    @Test
    void testPropertyPresentNowhereWithoutConfigurationGetsNoRule() {
        SimplifiedNode set = set("1:0", "Top App Bar",
                variant("1:1", "Layout=Default"),
                variant("1:2", "Layout=Compact"));
        set.getChildren().get(0).setComponentProperties(List.of(property("Subtitle#8:8", "", PropertyType.TEXT)));

        ComponentVariantAnalysis analysis = new VariantAnalyzer().analyze(set);

        assertThat(rule(analysis, "Subtitle")).isEmpty();
    }

    @Test
    void testConfiguredRuleReplacesInferredOne() {
        SimplifiedNode header = node("1:10", "Header", "INSTANCE");
        header.setComponentProperties(List.of(property("Title#10:2", "Inbox", PropertyType.TEXT)));
        SimplifiedNode set = set("1:0", "Top App Bar",
                variant("1:1", "Layout=Default", header),
                variant("1:2", "Layout=Compact"));
        PropertyRule configured = PropertyRule.builder()
                .property("Title")
                .visibleWhen(List.of(VisibilityCondition.notEqualTo("Layout", "Compact")))
                .build();
        HeuristicsConfig config = HeuristicsConfig.builder().rules(List.of(configured)).build();

        ComponentVariantAnalysis analysis = new VariantAnalyzer(config).analyze(set);

        PropertyRule title = rule(analysis, "Title").orElseThrow();
        assertThat(title.getSource()).isEqualTo(RuleSource.CONFIGURED);
        assertThat(title.getVisibleWhen()).containsExactly(VisibilityCondition.notEqualTo("Layout", "Compact"));
    }

    @Test
    void testConfiguredGroupWinsOverNameMatching() {
        SimplifiedNode icon = node("1:11", "Icon 1", "INSTANCE");
        icon.setComponentProperties(List.of(property("Icon 1#20:1", "5:5", PropertyType.INSTANCE_SWAP)));
        SimplifiedNode set = set("1:0", "Toolbar",
                variant("1:1", "Show actions=true, Trailing icons=true", icon),
                variant("1:2", "Show actions=false, Trailing icons=false"));
        HeuristicsConfig config = HeuristicsConfig.builder()
                .propertyGroups(Map.of("Show actions", List.of("Icon 1")))
                .build();

        ComponentVariantAnalysis analysis = new VariantAnalyzer(config).analyze(set);

        PropertyRule parent = rule(analysis, "Show actions").orElseThrow();
        assertThat(parent.getChildProperties()).containsExactly("Icon 1");
        assertThat(parent.getSource()).isEqualTo(RuleSource.CONFIGURED);
        assertThat(rule(analysis, "Trailing icons")).isEmpty();
        assertThat(rule(analysis, "Icon 1").orElseThrow().getVisibleWhen())
                .containsExactly(VisibilityCondition.equalTo("Show actions", Boolean.TRUE));
    }

    @Test
    void testNestedGroupInheritsOuterConditions() {
        SimplifiedNode icon = node("1:11", "Icon 1", "INSTANCE");
        icon.setComponentProperties(List.of(property("Icon 1#20:1", "5:5", PropertyType.INSTANCE_SWAP)));
        SimplifiedNode set = set("1:0", "Toolbar",
                variant("1:1", "Show actions=true, Icons=true", icon),
                variant("1:2", "Show actions=false, Icons=false"));
        Map<String, List<String>> groups = new LinkedHashMap<>();
        groups.put("Icons", List.of("Icon 1"));
        groups.put("Show actions", List.of("Icons"));
        HeuristicsConfig config = HeuristicsConfig.builder().propertyGroups(groups).build();

        ComponentVariantAnalysis analysis = new VariantAnalyzer(config).analyze(set);

        assertThat(rule(analysis, "Icons").orElseThrow().getVisibleWhen())
                .containsExactly(VisibilityCondition.equalTo("Show actions", Boolean.TRUE));
        assertThat(rule(analysis, "Icon 1").orElseThrow().getVisibleWhen()).containsExactly(
                VisibilityCondition.equalTo("Show actions", Boolean.TRUE),
                VisibilityCondition.equalTo("Icons", Boolean.TRUE));
    }

    @Test
    void testParentsFirstOrdersEnclosingGroupEarlier() {
        Map<String, List<String>> groups = new LinkedHashMap<>();
        groups.put("Icon", List.of("Icon 1"));
        groups.put("Icons", List.of("Icon"));
        groups.put("Show actions", List.of("Icons"));
        groups.put("Toolbar actions", List.of("Show actions"));

        assertThat(PropertyRuleInferrer.parentsFirst(groups)).containsExactly("Toolbar actions", "Show actions", "Icons", "Icon");
    }

    @ParameterizedTest
    @CsvSource({
            "Icon, 'Icon|Trailing icons', Icon",
            "Icon, 'Show label|Trailing icons', Trailing icons",
            "Action, 'Show label|Has actions', Has actions",
            "Badge, 'Badges visible|Show label', Badges visible",
            "Avatar, 'Show label|Trailing icons', ''"
    })
    void testFindParent(String base, String candidates, String expected) {
        Optional<String> parent = PropertyRuleInferrer.findParent(base, base + " 1", List.of(candidates.split("\\|")));

        if (expected.isEmpty()) {
            assertThat(parent).isEmpty();
        } else {
            assertThat(parent).contains(expected);
        }
    }

    private static Optional<PropertyRule> rule(ComponentVariantAnalysis analysis, String property) {
        return analysis.getPropertyRules().stream().filter(r -> r.getProperty().equals(property)).findFirst();
    }
}
