package com.vidnyan.ust.adapter.out.parser.python;

import com.vidnyan.ust.domain.analysis.TreeMetrics;
import com.vidnyan.ust.domain.error.SourceParseException;
import com.vidnyan.ust.domain.model.AstNode;
import com.vidnyan.ust.domain.model.NodeType;
import com.vidnyan.ust.domain.model.UniversalSyntaxTree;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TreeSitterPythonParserTest {

    private final TreeSitterPythonParser parser = new TreeSitterPythonParser();

    private static AstNode first(UniversalSyntaxTree tree, NodeType type) {
        return tree.getNodesByType(type).get(0);
    }

    @Test
    void parse_Function_ShouldExtractNameParametersAndReturn() {
        UniversalSyntaxTree tree = parser.parse("def f(x): return x", "f.py");

        List<AstNode> functions = tree.getNodesByType(NodeType.FUNCTION_DECLARATION);
        assertEquals(1, functions.size());
        AstNode fn = functions.get(0);
        assertEquals("f", fn.getAttribute("name"));
        assertEquals(List.of("x"), fn.getAttribute("parameters"));
        assertEquals(false, fn.getAttribute("is_async"));

        UniversalSyntaxTree subtree = new UniversalSyntaxTree(fn, Map.of());
        assertEquals(1, subtree.getNodesByType(NodeType.RETURN_STATEMENT).size());
        assertEquals(1, fn.getSourceRange().start().line());
        assertEquals(0, fn.getSourceRange().start().column());
        assertEquals("f.py", fn.getSourceRange().start().filePath());
    }

    @Test
    void parse_ShouldRecordMetadata() {
        UniversalSyntaxTree tree = parser.parse("def f(x): return x", "f.py");

        assertEquals("python", tree.metadata().get("language"));
        assertEquals("f.py", tree.metadata().get("file_path"));
        assertEquals("TreeSitterPythonParser", tree.metadata().get("parser"));
        assertEquals(TreeMetrics.nodeCount(tree), tree.metadata().get("node_count"));
        assertEquals("module", tree.root().getAttribute("type"));
        assertTrue(tree.allNodes().stream().allMatch(n -> "python".equals(n.getOriginalLanguage())));
    }

    @Test
    void parse_SyntaxError_ShouldReportPosition() {
        SourceParseException error = assertThrows(SourceParseException.class,
                () -> parser.parse("def f(:", "bad.py"));

        assertEquals("python", error.getLanguage());
        assertTrue(error.hasPosition());
        assertTrue(error.getLine() >= 1);
    }

    @Test
    void parse_SyntaxErrorOnLaterLine_ShouldPointAtThatLine() {
        SourceParseException error = assertThrows(SourceParseException.class,
                () -> parser.parse("x = 1\ny = 2\nif :\n", null));

        assertEquals(3, error.getLine());
    }

    @Test
    void parse_EmptySource_ShouldYieldEmptyModule() {
        UniversalSyntaxTree tree = parser.parse("", null);

        assertEquals(NodeType.PROGRAM, tree.root().getType());
        assertTrue(tree.root().getChildren().isEmpty());
    }

    @Test
    void parse_AsyncDecoratedFunction_ShouldCollectSignature() {
        String source = """
                @app.route("/")
                @cached
                async def handler(a, b=1, *args, c: int = 2, **kw) -> int:
                    pass
                """;

        AstNode fn = first(parser.parse(source, null), NodeType.FUNCTION_DECLARATION);

        assertEquals("handler", fn.getAttribute("name"));
        assertEquals(true, fn.getAttribute("is_async"));
        assertEquals(List.of("a", "b", "c"), fn.getAttribute("parameters"));
        assertEquals(List.of("route", "cached"), fn.getAttribute("decorators"));
        assertEquals("int", fn.getAttribute("return_type"));
    }

    @Test
    void parse_Class_ShouldCollectBaseClasses() {
        AstNode cls = first(parser.parse("class A(B, mod.C, metaclass=M):\n    pass\n", null),
                NodeType.CLASS_DECLARATION);

        assertEquals("A", cls.getAttribute("name"));
        assertEquals(List.of("B", "mod.C"), cls.getAttribute("base_classes"));
    }

    @Test
    void parse_Imports_ShouldCaptureModuleLevelAndAliases() {
        UniversalSyntaxTree tree = parser.parse("import os.path as p\nfrom ..pkg import a as b, c\n", null);

        List<AstNode> imports = tree.getNodesByType(NodeType.IMPORT_DECLARATION);
        assertEquals(2, imports.size());
        assertEquals(List.of(Map.of("name", "os.path", "alias", "p")), imports.get(0).getAttribute("names"));

        AstNode from = imports.get(1);
        assertEquals("pkg", from.getAttribute("module"));
        assertEquals(2, from.getAttribute("level"));
        assertEquals(List.of(Map.of("name", "a", "alias", "b"), Map.of("name", "c")), from.getAttribute("names"));
    }

    @Test
    void parse_OverflowingFloat_ShouldKeepRawText() {
        UniversalSyntaxTree tree = parser.parse("big = 1e400\nsmall = 1e-400\n", null);

        List<AstNode> literals = tree.getNodesByType(NodeType.LITERAL);
        assertEquals("1e400", literals.get(0).getAttribute("value"));
        assertEquals("any", literals.get(0).getAttribute("data_type"));
        assertEquals(0.0, literals.get(1).getAttribute("value"));
        assertEquals("float", literals.get(1).getAttribute("data_type"));
    }

    @Test
    void parse_Literals_ShouldCarryTypedValues() {
        UniversalSyntaxTree tree = parser.parse(
                "a = 0x1F\nb = 1_000\nc = 2.5\nd = 'hi\\n'\ne = r'\\d'\nf = None\ng = True\n", null);

        List<AstNode> literals = tree.getNodesByType(NodeType.LITERAL);
        assertEquals(31, literals.get(0).getAttribute("value"));
        assertEquals("integer", literals.get(0).getAttribute("data_type"));
        assertEquals(1000, literals.get(1).getAttribute("value"));
        assertEquals(2.5, literals.get(2).getAttribute("value"));
        assertEquals("float", literals.get(2).getAttribute("data_type"));
        assertEquals("hi\n", literals.get(3).getAttribute("value"));
        assertEquals("string", literals.get(3).getAttribute("data_type"));
        assertEquals("\\d", literals.get(4).getAttribute("value"));
        assertNull(literals.get(5).getAttribute("value"));
        assertEquals("null", literals.get(5).getAttribute("data_type"));
        assertEquals(true, literals.get(6).getAttribute("value"));
        assertTrue(literals.stream().allMatch(l -> l.getChildren().isEmpty()));
    }

    @Test
    void parse_Operators_ShouldRecordOperatorText() {
        UniversalSyntaxTree tree = parser.parse("r = a + b\nok = x < y <= z\nn = not done\n", null);

        List<AstNode> binaries = tree.getNodesByType(NodeType.BINARY_EXPRESSION);
        assertEquals("+", binaries.get(0).getAttribute("operator"));
        assertEquals("<", binaries.get(1).getAttribute("operator"));
        assertEquals(List.of("<", "<="), binaries.get(1).getAttribute("operators"));
        assertEquals("not", first(tree, NodeType.UNARY_EXPRESSION).getAttribute("operator"));
    }

    @Test
    void parse_CallsAndAttributes_ShouldNameTheTarget() {
        UniversalSyntaxTree tree = parser.parse("print(x)\nself.client.get(url)\n", null);

        List<AstNode> calls = tree.getNodesByType(NodeType.CALL_EXPRESSION);
        assertEquals("print", calls.get(0).getAttribute("function_name"));
        assertEquals("get", calls.get(1).getAttribute("function_name"));
        assertEquals("get", first(tree, NodeType.MEMBER_EXPRESSION).getAttribute("attribute"));
    }

    @Test
    void parse_UnmappedKinds_ShouldFallBackWithKind() {
        UniversalSyntaxTree tree = parser.parse("# note\nraise ValueError()\n", null);

        assertEquals(NodeType.COMMENT, tree.root().getChildren().get(0).getType());
        AstNode raise = tree.root().getChildren().get(1);
        assertEquals(NodeType.EXPRESSION_STATEMENT, raise.getType());
        assertEquals("raise_statement", raise.getAttribute("kind"));
    }

    @Test
    void parse_AnnotatedAssignment_ShouldRecordAnnotation() {
        AstNode assignment = first(parser.parse("count: int = 0\n", null), NodeType.ASSIGNMENT_EXPRESSION);

        assertEquals("int", assignment.getAttribute("annotation"));
    }
}
