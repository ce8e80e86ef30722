package com.vidnyan.ust.application.service;

import com.vidnyan.ust.adapter.out.parser.java.JavaSourceParser;
import com.vidnyan.ust.adapter.out.parser.javascript.JavaScriptParser;
import com.vidnyan.ust.adapter.out.parser.python.TreeSitterPythonParser;
import com.vidnyan.ust.application.port.in.ParseCodeUseCase.AnalysisRequest;
import com.vidnyan.ust.application.port.in.ParseCodeUseCase.AnalysisResult;
import com.vidnyan.ust.domain.analysis.AnalysisType;
import com.vidnyan.ust.domain.error.SourceParseException;
import com.vidnyan.ust.domain.error.UnsupportedLanguageException;
import com.vidnyan.ust.domain.model.NodeType;
import com.vidnyan.ust.domain.model.UniversalSyntaxTree;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ParsingServiceTest {

    private final ParserRegistry registry = new ParserRegistry(List.of(
            new TreeSitterPythonParser(), new JavaScriptParser(), new JavaSourceParser()));
    private final ParsingService service = new ParsingService(registry, new LanguageDetector(registry));

    @Test
    void parseCode_ShouldUseExplicitLanguage() {
        UniversalSyntaxTree tree = service.parseCode("def f(x): return x", "python", null);

        assertEquals("python", tree.language());
        assertEquals(1, tree.getNodesByType(NodeType.FUNCTION_DECLARATION).size());
    }

    @Test
    void parseCode_ShouldFallBackToExtension() {
        UniversalSyntaxTree tree = service.parseCode("const x = 5;", null, "src/app.js");

        assertEquals("javascript", tree.language());
        assertEquals("src/app.js", tree.metadata().get("file_path"));
    }

    @Test
    void parseCode_UnknownLanguageHint_ShouldStillResolveByExtension() {
        UniversalSyntaxTree tree = service.parseCode("class A {}", "kotlin", "A.java");

        assertEquals("java", tree.language());
    }

    @Test
    void parseCode_UnknownExtension_ShouldThrowUnsupported() {
        UnsupportedLanguageException error = assertThrows(UnsupportedLanguageException.class,
                () -> service.parseCode("whatever", null, "notes.xyz"));

        assertEquals("notes.xyz", error.getFilePath());
        assertNull(error.getLanguage());
    }

    @Test
    void parseCode_ShouldPropagateSyntaxErrors() {
        assertThrows(SourceParseException.class, () -> service.parseCode("def f(:", "python", null));
    }

    @Test
    void parseCode_NullSource_ShouldParseAsEmpty() {
        UniversalSyntaxTree tree = service.parseCode(null, "javascript", null);

        assertTrue(tree.root().getChildren().isEmpty());
    }

    @Test
    void analyze_ShouldParseAndSummarize() {
        AnalysisResult result = service.analyze(new AnalysisRequest(
                "import os\nclass A(B):\n    async def run(self):\n        pass\n",
                "python", "a.py", AnalysisType.ALL));

        assertEquals("run", result.report().functions().get(0).name());
        assertTrue(result.report().functions().get(0).isAsync());
        assertEquals(List.of("B"), result.report().classes().get(0).baseClasses());
        assertEquals("import", result.report().imports().get(0).type());
        assertTrue(result.report().complexity().totalNodes() > 1);
        assertTrue(result.durationMs() >= 0);
    }

    @Test
    void analyze_NullType_ShouldDefaultToAll() {
        AnalysisResult result = service.analyze(new AnalysisRequest("let a = 1;", "javascript", null, null));

        assertNotNull(result.report().variables());
        assertNotNull(result.report().complexity());
    }

    @Test
    void supportedLanguages_ShouldListRegisteredParsers() {
        assertEquals(List.of("python", "javascript", "java"), service.supportedLanguages());
        assertTrue(service.supportedExtensions().contains(".java"));
        assertEquals(Optional.of("python"), service.detectLanguage("from x import y", null));
    }
}
