package com.vidnyan.ust.domain.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * A complete universal syntax tree: root node, parser metadata and format version.
 *
 * Traversals are iterative so arbitrarily deep trees cannot exhaust the call stack.
 */
public record UniversalSyntaxTree(
    AstNode root,
    Map<String, Object> metadata,
    String version
) {

    public static final String CURRENT_VERSION = "1.0";

    public static final String META_LANGUAGE = "language";
    public static final String META_FILE_PATH = "file_path";
    public static final String META_PARSER = "parser";

    public UniversalSyntaxTree {
        Objects.requireNonNull(root, "root");
        // LinkedHashMap rather than Map.copyOf: file_path may be null
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata != null ? metadata : Map.of()));
        version = version != null ? version : CURRENT_VERSION;
    }

    public UniversalSyntaxTree(AstNode root, Map<String, Object> metadata) {
        this(root, metadata, CURRENT_VERSION);
    }

    public String language() {
        return (String) metadata.get(META_LANGUAGE);
    }

    /**
     * All nodes of the given type, in pre-order encounter order.
     */
    public List<AstNode> getNodesByType(NodeType type) {
        List<AstNode> result = new ArrayList<>();
        walk(node -> {
            if (node.getType() == type) {
                result.add(node);
            }
        });
        return result;
    }

    /**
     * Pre-order search, first match wins.
     */
    public Optional<AstNode> findNodeById(String id) {
        Deque<AstNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            AstNode node = stack.pop();
            if (node.getId().equals(id)) {
                return Optional.of(node);
            }
            pushChildren(stack, node);
        }
        return Optional.empty();
    }

    /**
     * Every node, pre-order.
     */
    public List<AstNode> allNodes() {
        List<AstNode> result = new ArrayList<>();
        walk(result::add);
        return result;
    }

    /**
     * Visit every node in pre-order.
     */
    public void walk(Consumer<AstNode> visitor) {
        Deque<AstNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            AstNode node = stack.pop();
            visitor.accept(node);
            pushChildren(stack, node);
        }
    }

    private static void pushChildren(Deque<AstNode> stack, AstNode node) {
        List<AstNode> children = node.getChildren();
        for (int i = children.size() - 1; i >= 0; i--) {
            stack.push(children.get(i));
        }
    }

    public Map<String, Object> toCanonical() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("version", version);
        map.put("metadata", new LinkedHashMap<>(metadata));
        map.put("root", root.toCanonical());
        return map;
    }

    @SuppressWarnings("unchecked")
    public static UniversalSyntaxTree fromCanonical(Map<String, ?> map) {
        Object root = map.get("root");
        if (!(root instanceof Map<?, ?>)) {
            throw new IllegalArgumentException("Canonical tree has no root node");
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (map.get("metadata") instanceof Map<?, ?> meta) {
            meta.forEach((k, v) -> metadata.put(String.valueOf(k), v));
        }
        return new UniversalSyntaxTree(
                AstNode.fromCanonical((Map<String, ?>) root),
                metadata,
                (String) map.get("version")
        );
    }
}
