package com.vidnyan.ust.application.service;

import com.vidnyan.ust.adapter.out.parser.java.JavaSourceParser;
import com.vidnyan.ust.adapter.out.parser.javascript.JavaScriptParser;
import com.vidnyan.ust.adapter.out.parser.python.TreeSitterPythonParser;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class LanguageDetectorTest {

    private final LanguageDetector detector = new LanguageDetector(new ParserRegistry(List.of(
            new TreeSitterPythonParser(), new JavaScriptParser(), new JavaSourceParser())));

    @Test
    void detect_ShouldPreferFileExtension() {
        assertEquals(Optional.of("javascript"), detector.detect("def f(): pass", "lib/util.MJS"));
        assertEquals(Optional.of("java"), detector.detect("", "Main.java"));
    }

    @Test
    void detect_ShouldApplyKeywordRulesInOrder() {
        assertEquals(Optional.of("python"), detector.detect("def main():\n    pass", null));
        assertEquals(Optional.of("javascript"), detector.detect("const x = () => 1;", null));
        assertEquals(Optional.of("java"), detector.detect("public static void main(String[] args) {}", "Main.txt"));
        assertEquals(Optional.of("c"), detector.detect("#include <stdio.h>\nint main() { printf(\"hi\"); }", null));
        assertEquals(Optional.of("cpp"), detector.detect("#include <iostream>\nint main() { std::cout << 1; }", null));
    }

    @Test
    void detect_EarlierRuleShouldWinOnOverlap() {
        // "class " is a python keyword and python is tried first
        assertEquals(Optional.of("python"), detector.detect("public class Main {}", null));
    }

    @Test
    void detect_ShouldBeCaseInsensitiveOnSource() {
        assertEquals(Optional.of("python"), detector.detect("  DEF F(): PASS", null));
    }

    @Test
    void detect_ShouldReturnEmptyWhenNothingMatches() {
        assertTrue(detector.detect("SELECT 1", "query.sql").isEmpty());
        assertTrue(detector.detect(null, null).isEmpty());
        assertTrue(detector.detect("", null).isEmpty());
    }
}
