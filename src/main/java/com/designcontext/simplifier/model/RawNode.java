package com.designcontext.simplifier.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Read-only view over a design-platform node as delivered by the API.
 *
 * All accessors check for presence before reading; a missing or wrongly typed field
 * yields an empty result instead of an exception. The wrapped tree is never mutated.
 */
public final class RawNode {

    private final JsonNode json;

    private RawNode(JsonNode json) {
        this.json = json;
    }

    public static RawNode of(JsonNode json) {
        return new RawNode(json != null ? json : MissingNode.getInstance());
    }

    public JsonNode json() {
        return json;
    }

    public String getId() {
        return text("id").orElse("");
    }

    public String getName() {
        return text("name").orElse("");
    }

    public String getType() {
        return text("type").orElse("");
    }

    public boolean isType(String type) {
        return type.equals(getType());
    }

    public boolean isVisible() {
        JsonNode visible = json.get("visible");
        return visible == null || !visible.isBoolean() || visible.booleanValue();
    }

    public boolean has(String field) {
        JsonNode value = json.get(field);
        return value != null && !value.isNull() && !value.isMissingNode();
    }

    public JsonNode get(String field) {
        JsonNode value = json.get(field);
        return value != null ? value : MissingNode.getInstance();
    }

    /**
     * Follows a path of object fields and array indexes, e.g. {@code path("boundVariables", "fills", "0")}.
     */
    public JsonNode path(String... segments) {
        JsonNode current = json;
        for (String segment : segments) {
            if (current.isArray() && isIndex(segment)) {
                current = current.path(Integer.parseInt(segment));
            } else {
                current = current.path(segment);
            }
        }
        return current;
    }

    public Optional<String> text(String field) {
        JsonNode value = json.get(field);
        if (value == null || !value.isTextual()) {
            return Optional.empty();
        }
        return Optional.of(value.textValue());
    }

    public OptionalDouble number(String field) {
        JsonNode value = json.get(field);
        if (value == null || !value.isNumber()) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(value.doubleValue());
    }

    public boolean flag(String field) {
        JsonNode value = json.get(field);
        return value != null && value.isBoolean() && value.booleanValue();
    }

    public List<JsonNode> array(String field) {
        JsonNode value = json.get(field);
        if (value == null || !value.isArray()) {
            return Collections.emptyList();
        }
        List<JsonNode> items = new ArrayList<>(value.size());
        value.forEach(items::add);
        return items;
    }

    public boolean hasChildren() {
        JsonNode children = json.get("children");
        return children != null && children.isArray() && children.size() > 0;
    }

    public List<RawNode> getChildren() {
        List<RawNode> children = new ArrayList<>();
        for (JsonNode child : array("children")) {
            children.add(RawNode.of(child));
        }
        return children;
    }

    private static boolean isIndex(String segment) {
        if (segment.isEmpty()) {
            return false;
        }
        for (int i = 0; i < segment.length(); i++) {
            if (!Character.isDigit(segment.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RawNode other)) return false;
        return Objects.equals(json, other.json);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(json);
    }

    @Override
    public String toString() {
        return getType() + "(" + getId() + " '" + getName() + "')";
    }
}
