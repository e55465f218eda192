package com.designcontext.simplifier.variant;

import com.designcontext.simplifier.util.JsonMappers;
import com.designcontext.simplifier.variant.model.PropertyRule;
import com.designcontext.simplifier.variant.model.RuleSource;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reads a {@link HeuristicsConfig} from JSON. A missing or malformed file falls back to the
 * defaults with a warning.
 */
public class HeuristicsConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(HeuristicsConfigLoader.class);

    private final ObjectMapper mapper;

    public HeuristicsConfigLoader() {
        this(JsonMappers.shared());
    }

    public HeuristicsConfigLoader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public HeuristicsConfig load(Path file) {
        if (file == null) {
            return HeuristicsConfig.defaults();
        }
        if (!Files.isRegularFile(file)) {
            log.warn("Heuristics file not found, using defaults: {}", file);
            return HeuristicsConfig.defaults();
        }
        try {
            HeuristicsConfig config = mapper.readValue(file.toFile(), HeuristicsConfig.class);
            return normalize(config);
        } catch (IOException e) {
            log.warn("Ignoring malformed heuristics file {}: {}", file, e.getMessage());
            return HeuristicsConfig.defaults();
        }
    }

    private static HeuristicsConfig normalize(HeuristicsConfig config) {
        HeuristicsConfig defaults = HeuristicsConfig.defaults();
        if (config.getSlotPatterns() == null) {
            config.setSlotPatterns(defaults.getSlotPatterns());
        }
        if (config.getStructurallyDependentProperties() == null) {
            config.setStructurallyDependentProperties(defaults.getStructurallyDependentProperties());
        }
        Map<String, List<String>> groups = new LinkedHashMap<>();
        if (config.getPropertyGroups() != null) {
            config.getPropertyGroups().forEach((parent, children) -> {
                if (parent == null || children == null) {
                    log.warn("Ignoring property group {} without children", parent);
                    return;
                }
                groups.put(parent, withoutNulls(children));
            });
        }
        config.setPropertyGroups(groups);

        List<PropertyRule> rules = new ArrayList<>();
        if (config.getRules() != null) {
            for (PropertyRule rule : config.getRules()) {
                if (rule == null || rule.getProperty() == null || rule.getProperty().isBlank()) {
                    log.warn("Ignoring heuristics rule without a property: {}", rule);
                    continue;
                }
                rule.setVisibleWhen(withoutNulls(rule.getVisibleWhen()));
                rule.setChildProperties(withoutNulls(rule.getChildProperties()));
                rule.setSource(RuleSource.CONFIGURED);
                rules.add(rule);
            }
        }
        config.setRules(rules);
        log.info("Loaded heuristics: {} rules, {} property groups, {} structurally dependent properties",
                config.getRules().size(), config.getPropertyGroups().size(),
                config.getStructurallyDependentProperties().size());
        return config;
    }

    private static <T> List<T> withoutNulls(List<T> values) {
        List<T> kept = new ArrayList<>();
        if (values != null) {
            values.stream().filter(Objects::nonNull).forEach(kept::add);
        }
        return kept;
    }
}
