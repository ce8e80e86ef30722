package com.vidnyan.ust;

import com.vidnyan.ust.adapter.in.cli.ParseCliRunner;
import com.vidnyan.ust.application.port.in.ParseCodeUseCase;
import com.vidnyan.ust.application.service.ParserRegistry;
import com.vidnyan.ust.domain.model.NodeType;
import com.vidnyan.ust.domain.model.UniversalSyntaxTree;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = "ust.java.language-level=JAVA_21")
class UstApplicationTest {

    @Autowired
    private ParseCodeUseCase parseCodeUseCase;

    @Autowired
    private ParserRegistry registry;

    @Autowired
    private ParseCliRunner cliRunner;

    @Test
    void context_ShouldRegisterEveryParserBean() {
        assertEquals(3, registry.listSupportedLanguages().size());
        assertTrue(registry.listSupportedLanguages().containsAll(List.of("python", "javascript", "java")));
        assertEquals(0, cliRunner.getExitCode());
    }

    @Test
    void parseCode_ShouldRouteThroughWiredParsers() {
        UniversalSyntaxTree tree = parseCodeUseCase.parseCode("record Point(int x, int y) {}", null, "Point.java");

        assertEquals("JAVA_21", tree.metadata().get("language_level"));
        assertEquals("Point", tree.getNodesByType(NodeType.CLASS_DECLARATION).get(0).getAttribute("name"));
    }
}
