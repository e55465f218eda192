package com.designcontext.simplifier.walker;

import com.designcontext.simplifier.model.GlobalVars;
import com.designcontext.simplifier.util.JsonMappers;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Deduplicating store for style values shared between nodes.
 *
 * Payloads are indexed by their compact canonical JSON, so two structurally equal payloads
 * (same fields, same order, same values) always get the same key. Keys look like
 * {@code fill_3}; the number counts per category. One store per walk.
 */
public class ValueStore {

    private final ObjectMapper mapper;
    private final Map<String, String> keysByCanonical = new HashMap<>();
    private final Map<String, JsonNode> values = new LinkedHashMap<>();
    private final Map<String, Integer> sequences = new HashMap<>();

    public ValueStore() {
        this(JsonMappers.shared());
    }

    public ValueStore(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Returns the key of an equal payload already stored, else stores this one under a
     * new {@code category_N} key.
     */
    public String intern(String category, Object payload) {
        JsonNode tree = payload instanceof JsonNode json ? json.deepCopy() : mapper.valueToTree(payload);
        String canonical = tree.toString();
        String existing = keysByCanonical.get(canonical);
        if (existing != null) {
            return existing;
        }
        int sequence = sequences.merge(category, 1, Integer::sum);
        String key = category + "_" + sequence;
        keysByCanonical.put(canonical, key);
        values.put(key, tree);
        return key;
    }

    public JsonNode get(String key) {
        return values.get(key);
    }

    public boolean contains(String key) {
        return values.containsKey(key);
    }

    public int size() {
        return values.size();
    }

    public Map<String, JsonNode> styles() {
        return Collections.unmodifiableMap(values);
    }

    public GlobalVars toGlobalVars() {
        Map<String, JsonNode> copy = new LinkedHashMap<>();
        values.forEach((key, value) -> copy.put(key, value.deepCopy()));
        return new GlobalVars(copy);
    }
}
