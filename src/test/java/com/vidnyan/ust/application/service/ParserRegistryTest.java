package com.vidnyan.ust.application.service;

import com.vidnyan.ust.adapter.out.parser.javascript.JavaScriptParser;
import com.vidnyan.ust.adapter.out.parser.python.TreeSitterPythonParser;
import com.vidnyan.ust.application.port.out.LanguageParser;
import com.vidnyan.ust.domain.model.AstNodes;
import com.vidnyan.ust.domain.model.UniversalSyntaxTree;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ParserRegistryTest {

    private final ParserRegistry registry =
            new ParserRegistry(List.of(new TreeSitterPythonParser(), new JavaScriptParser()));

    @Test
    void getParser_ShouldIgnoreCase() {
        assertInstanceOf(TreeSitterPythonParser.class, registry.getParser("Python").orElseThrow());
        assertInstanceOf(JavaScriptParser.class, registry.getParser(" JAVASCRIPT ").orElseThrow());
        assertTrue(registry.getParser("ruby").isEmpty());
        assertTrue(registry.getParser(null).isEmpty());
    }

    @Test
    void getParserByExtension_ShouldAcceptWithOrWithoutDot() {
        assertInstanceOf(TreeSitterPythonParser.class, registry.getParserByExtension(".PY").orElseThrow());
        assertInstanceOf(JavaScriptParser.class, registry.getParserByExtension("tsx").orElseThrow());
        assertTrue(registry.getParserByExtension(".xyz").isEmpty());
        assertTrue(registry.getParser("python").orElseThrow().canParse("PYI"));
        assertFalse(registry.getParser("python").orElseThrow().canParse(".js"));
    }

    @Test
    void listings_ShouldKeepRegistrationOrder() {
        assertEquals(List.of("python", "javascript"), registry.listSupportedLanguages());
        assertEquals(List.of(".py", ".pyw", ".pyi", ".js", ".jsx", ".mjs", ".ts", ".tsx"),
                registry.listSupportedExtensions());
        assertEquals("python", registry.describe().get(0).name());
    }

    @Test
    void register_ShouldReplaceParserForSameLanguage() {
        LanguageParser replacement = new StubParser("python", List.of(".py"));

        registry.register(replacement);

        assertSame(replacement, registry.getParser("python").orElseThrow());
        assertSame(replacement, registry.getParserByExtension(".py").orElseThrow());
        assertEquals(List.of("python", "javascript"), registry.listSupportedLanguages());
    }

    @Test
    void extensionOf_ShouldHandleEdgeCases() {
        assertEquals(Optional.of(".py"), ParserRegistry.extensionOf("src/app/Main.PY"));
        assertEquals(Optional.of(".js"), ParserRegistry.extensionOf("C:\\work\\a.b\\x.js"));
        assertTrue(ParserRegistry.extensionOf("Makefile").isEmpty());
        assertTrue(ParserRegistry.extensionOf("dir.d/Makefile").isEmpty());
        assertTrue(ParserRegistry.extensionOf(".bashrc").isEmpty());
        assertTrue(ParserRegistry.extensionOf("name.").isEmpty());
        assertTrue(ParserRegistry.extensionOf(null).isEmpty());
    }

    private record StubParser(String language, List<String> extensions) implements LanguageParser {
        @Override
        public UniversalSyntaxTree parse(String source, String filePath) {
            return new UniversalSyntaxTree(AstNodes.program(language), Map.of());
        }
    }
}
