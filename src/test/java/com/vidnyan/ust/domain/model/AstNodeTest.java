package com.vidnyan.ust.domain.model;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AstNodeTest {

    @Test
    void newNode_ShouldGetUniqueIdAndEmptyState() {
        AstNode first = new AstNode(NodeType.IDENTIFIER);
        AstNode second = new AstNode(NodeType.IDENTIFIER);

        assertNotEquals(first.getId(), second.getId());
        assertTrue(first.getChildren().isEmpty());
        assertTrue(first.getAttributes().isEmpty());
        assertNull(first.getSourceRange());
        assertNull(first.startLine());
    }

    @Test
    void addChild_ShouldKeepInsertionOrder() {
        AstNode parent = new AstNode(NodeType.BLOCK_STATEMENT);
        AstNode a = AstNodes.identifier("a", "python");
        AstNode b = AstNodes.identifier("b", "python");

        parent.addChild(a);
        parent.addChild(b);

        assertEquals(List.of(a, b), parent.getChildren());
        assertThrows(UnsupportedOperationException.class, () -> parent.getChildren().add(a));
    }

    @Test
    void getAttribute_ShouldFallBackToDefault() {
        AstNode node = new AstNode(NodeType.FUNCTION_DECLARATION);
        node.setAttribute("name", "f");

        assertEquals("f", node.getAttribute("name"));
        assertEquals("anonymous", node.getAttribute("missing", "anonymous"));
        assertTrue(node.hasAttribute("name"));
        assertFalse(node.hasAttribute("missing"));
    }

    @Test
    void toCanonical_ShouldUseWireKeys() {
        AstNode node = AstNodes.literal(5L, DataType.INTEGER, "javascript");
        node.setSourceRange(SourceRange.of(1, 10, 1, 11, "a.js"));

        Map<String, Object> canonical = node.toCanonical();

        assertEquals("literal", canonical.get("type"));
        assertEquals("javascript", canonical.get("original_language"));
        assertEquals(Map.of("value", 5, "data_type", "integer"), canonical.get("attributes"));
        assertInstanceOf(Map.class, canonical.get("source_range"));
        assertEquals(List.of(), canonical.get("children"));
    }

    @Test
    void fromCanonical_ShouldRebuildSubtree() {
        AstNode root = AstNodes.program("python");
        AstNode fn = AstNodes.function("f", List.of("x"), "python");
        fn.setSourceRange(SourceRange.of(2, 0, 3, 12, null));
        root.addChild(fn);

        AstNode copy = AstNode.fromCanonical(root.toCanonical());

        assertEquals(root.getId(), copy.getId());
        assertEquals(NodeType.PROGRAM, copy.getType());
        AstNode copiedFn = copy.getChildren().get(0);
        assertEquals(fn.getId(), copiedFn.getId());
        assertEquals("f", copiedFn.getAttribute("name"));
        assertEquals(List.of("x"), copiedFn.getAttribute("parameters"));
        assertEquals(fn.getSourceRange(), copiedFn.getSourceRange());
        assertEquals(2, copiedFn.startLine());
    }

    @Test
    void toString_ShouldShowNameAndPosition() {
        AstNode fn = AstNodes.function("run", List.of(), "python");
        fn.setSourceRange(SourceRange.of(4, 2, 5, 0, "svc.py"));

        assertEquals("AstNode{function_declaration name=run, children=0 @ svc.py:4:2}", fn.toString());
        assertEquals("<source>:1:0", new SourceLocation(1, 0, null).format());
    }

    @Test
    void fromCanonical_ShouldRejectUnknownType() {
        Map<String, Object> map = Map.of("id", "x", "type", "spaceship");

        assertThrows(IllegalArgumentException.class, () -> AstNode.fromCanonical(map));
    }

    @Test
    void normalizeNumber_ShouldPickNarrowestIntegralType() {
        assertEquals(7, AstNodes.normalizeNumber(7L));
        assertEquals(5_000_000_000L, AstNodes.normalizeNumber(5_000_000_000L));
        assertEquals(12, AstNodes.normalizeNumber(BigInteger.valueOf(12)));
        assertEquals(1.5d, AstNodes.normalizeNumber(1.5f));
        BigInteger huge = BigInteger.TWO.pow(70);
        assertEquals(huge, AstNodes.normalizeNumber(huge));
        assertEquals(255, AstNodes.parseInteger("ff", 16));
    }
}
