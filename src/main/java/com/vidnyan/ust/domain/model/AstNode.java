package com.vidnyan.ust.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * A node of the universal syntax tree.
 *
 * One concrete shape for every syntax category: the {@link NodeType} tag
 * discriminates, and anything kind-specific (names, parameters, operators,
 * literal values, import specifiers) lives in the schema-less attribute map.
 * A node owns its children; there is no parent pointer.
 */
public final class AstNode {

    private final String id;
    private final NodeType type;
    private final List<AstNode> children = new ArrayList<>();
    private final Map<String, Object> attributes = new LinkedHashMap<>();
    private SourceRange sourceRange;
    private String originalLanguage;

    public AstNode(NodeType type) {
        this(UUID.randomUUID().toString(), type);
    }

    public AstNode(NodeType type, String originalLanguage) {
        this(type);
        this.originalLanguage = originalLanguage;
    }

    public AstNode(String id, NodeType type) {
        this.id = Objects.requireNonNull(id, "id");
        this.type = Objects.requireNonNull(type, "type");
    }

    public String getId() {
        return id;
    }

    public NodeType getType() {
        return type;
    }

    /**
     * Children in source order. Read-only view; use {@link #addChild(AstNode)}.
     */
    public List<AstNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public void addChild(AstNode child) {
        children.add(Objects.requireNonNull(child, "child"));
    }

    public Map<String, Object> getAttributes() {
        return Collections.unmodifiableMap(attributes);
    }

    public Object getAttribute(String key) {
        return attributes.get(key);
    }

    public Object getAttribute(String key, Object defaultValue) {
        return attributes.getOrDefault(key, defaultValue);
    }

    public void setAttribute(String key, Object value) {
        attributes.put(key, value);
    }

    public boolean hasAttribute(String key) {
        return attributes.containsKey(key);
    }

    public SourceRange getSourceRange() {
        return sourceRange;
    }

    public void setSourceRange(SourceRange sourceRange) {
        this.sourceRange = sourceRange;
    }

    public String getOriginalLanguage() {
        return originalLanguage;
    }

    public void setOriginalLanguage(String originalLanguage) {
        this.originalLanguage = originalLanguage;
    }

    /**
     * Line where the node starts, or null when no range is attached.
     */
    public Integer startLine() {
        return sourceRange != null ? sourceRange.start().line() : null;
    }

    /**
     * Canonical map form, children converted depth-first.
     */
    public Map<String, Object> toCanonical() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("id", id);
        map.put("type", type.value());
        List<Map<String, Object>> childMaps = new ArrayList<>(children.size());
        for (AstNode child : children) {
            childMaps.add(child.toCanonical());
        }
        map.put("children", childMaps);
        map.put("attributes", new LinkedHashMap<>(attributes));
        map.put("source_range", sourceRange != null ? sourceRange.toCanonical() : null);
        map.put("original_language", originalLanguage);
        return map;
    }

    /**
     * Rebuild a node (and its subtree) from its canonical map form.
     *
     * @throws IllegalArgumentException if the type tag is unknown
     */
    @SuppressWarnings("unchecked")
    public static AstNode fromCanonical(Map<String, ?> map) {
        AstNode node = new AstNode((String) map.get("id"), NodeType.fromValue((String) map.get("type")));

        Object attrs = map.get("attributes");
        if (attrs instanceof Map<?, ?> attrMap) {
            attrMap.forEach((k, v) -> node.attributes.put(String.valueOf(k), v));
        }

        Object range = map.get("source_range");
        if (range instanceof Map<?, ?> rangeMap) {
            node.sourceRange = SourceRange.fromCanonical((Map<String, ?>) rangeMap);
        }
        node.originalLanguage = (String) map.get("original_language");

        Object kids = map.get("children");
        if (kids instanceof List<?> childList) {
            for (Object child : childList) {
                node.children.add(fromCanonical((Map<String, ?>) child));
            }
        }
        return node;
    }

    @Override
    public String toString() {
        return "AstNode{" + type.value()
                + (attributes.containsKey("name") ? " name=" + attributes.get("name") : "")
                + ", children=" + children.size()
                + (sourceRange != null ? " @ " + sourceRange.start().format() : "") + "}";
    }
}
