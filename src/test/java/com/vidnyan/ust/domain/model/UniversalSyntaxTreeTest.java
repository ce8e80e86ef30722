package com.vidnyan.ust.domain.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class UniversalSyntaxTreeTest {

    private static UniversalSyntaxTree sampleTree() {
        AstNode root = AstNodes.program("javascript");
        AstNode fn = AstNodes.function("f", List.of("x"), "javascript");
        AstNode body = new AstNode(NodeType.BLOCK_STATEMENT, "javascript");
        fn.addChild(body);
        AstNode variable = AstNodes.variable("y", "const", "javascript");
        variable.addChild(AstNodes.literal(1, DataType.INTEGER, "javascript"));
        root.addChild(fn);
        root.addChild(variable);
        return new UniversalSyntaxTree(root, Map.of(UniversalSyntaxTree.META_LANGUAGE, "javascript"));
    }

    @Test
    void constructor_ShouldDefaultVersion() {
        UniversalSyntaxTree tree = sampleTree();

        assertEquals(UniversalSyntaxTree.CURRENT_VERSION, tree.version());
        assertEquals("javascript", tree.language());
        assertThrows(UnsupportedOperationException.class, () -> tree.metadata().put("k", "v"));
    }

    @Test
    void getNodesByType_ShouldReturnPreOrderMatches() {
        UniversalSyntaxTree tree = sampleTree();

        List<AstNode> declarations = new ArrayList<>(tree.getNodesByType(NodeType.FUNCTION_DECLARATION));
        declarations.addAll(tree.getNodesByType(NodeType.VARIABLE_DECLARATION));

        assertEquals(1, tree.getNodesByType(NodeType.FUNCTION_DECLARATION).size());
        assertEquals("f", declarations.get(0).getAttribute("name"));
        assertEquals("y", declarations.get(1).getAttribute("name"));
        assertTrue(tree.getNodesByType(NodeType.WHILE_STATEMENT).isEmpty());
    }

    @Test
    void allNodes_ShouldVisitInPreOrder() {
        UniversalSyntaxTree tree = sampleTree();

        List<NodeType> order = tree.allNodes().stream().map(AstNode::getType).toList();

        assertEquals(List.of(
                NodeType.PROGRAM,
                NodeType.FUNCTION_DECLARATION,
                NodeType.BLOCK_STATEMENT,
                NodeType.VARIABLE_DECLARATION,
                NodeType.LITERAL), order);
    }

    @Test
    void findNodeById_ShouldLocateNestedNode() {
        UniversalSyntaxTree tree = sampleTree();
        AstNode literal = tree.getNodesByType(NodeType.LITERAL).get(0);

        assertSame(literal, tree.findNodeById(literal.getId()).orElseThrow());
        assertTrue(tree.findNodeById("no-such-id").isEmpty());
    }

    @Test
    void walk_ShouldHandleVeryDeepTrees() {
        AstNode root = AstNodes.program("python");
        AstNode current = root;
        for (int i = 0; i < 100_000; i++) {
            AstNode child = new AstNode(NodeType.BLOCK_STATEMENT);
            current.addChild(child);
            current = child;
        }
        UniversalSyntaxTree tree = new UniversalSyntaxTree(root, Map.of());

        assertEquals(100_001, tree.allNodes().size());
        assertEquals(100_000, tree.getNodesByType(NodeType.BLOCK_STATEMENT).size());
    }

    @Test
    void fromCanonical_ShouldRequireRoot() {
        assertThrows(IllegalArgumentException.class,
                () -> UniversalSyntaxTree.fromCanonical(Map.of("version", "1.0")));
    }

    @Test
    void canonicalRoundTrip_ShouldPreserveStructure() {
        UniversalSyntaxTree tree = sampleTree();

        UniversalSyntaxTree copy = UniversalSyntaxTree.fromCanonical(tree.toCanonical());

        assertEquals(tree.toCanonical(), copy.toCanonical());
    }
}
