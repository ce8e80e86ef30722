package com.vidnyan.ust.adapter.out.parser.java;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Position;
import com.github.javaparser.Problem;
import com.github.javaparser.Range;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.vidnyan.ust.application.port.out.LanguageParser;
import com.vidnyan.ust.config.UstProperties;
import com.vidnyan.ust.domain.error.SourceParseException;
import com.vidnyan.ust.domain.model.AstNode;
import com.vidnyan.ust.domain.model.NodeType;
import com.vidnyan.ust.domain.model.SourceRange;
import com.vidnyan.ust.domain.model.UniversalSyntaxTree;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Java adapter over JavaParser.
 *
 * Columns are converted to the 0-based convention of the tree; JavaParser's
 * inclusive end column becomes the exclusive 0-based end.
 */
@Slf4j
@Component
public class JavaSourceParser implements LanguageParser {

    public static final String LANGUAGE = "java";
    private static final List<String> EXTENSIONS = List.of(".java");

    private final ParserConfiguration.LanguageLevel languageLevel;

    public JavaSourceParser() {
        this(ParserConfiguration.LanguageLevel.JAVA_17);
    }

    @Autowired
    public JavaSourceParser(UstProperties properties) {
        this(ParserConfiguration.LanguageLevel.valueOf(
                properties.getJava().getLanguageLevel().trim().toUpperCase(Locale.ROOT)));
    }

    JavaSourceParser(ParserConfiguration.LanguageLevel languageLevel) {
        this.languageLevel = languageLevel;
    }

    @Override
    public String language() {
        return LANGUAGE;
    }

    @Override
    public List<String> extensions() {
        return EXTENSIONS;
    }

    @Override
    public LanguageInfo languageInfo() {
        return new LanguageInfo(LANGUAGE, EXTENSIONS, "javaparser " + languageLevel);
    }

    @Override
    public UniversalSyntaxTree parse(String source, String filePath) {
        ParserConfiguration config = new ParserConfiguration()
                .setLanguageLevel(languageLevel)
                .setAttributeComments(false);
        // JavaParser instances are not thread safe
        ParseResult<CompilationUnit> result = new JavaParser(config).parse(source != null ? source : "");

        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            throw syntaxError(result.getProblems());
        }

        CompilationUnit unit = result.getResult().get();
        AstNode root = convert(unit, filePath);
        root.setAttribute("language", LANGUAGE);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(UniversalSyntaxTree.META_LANGUAGE, LANGUAGE);
        metadata.put(UniversalSyntaxTree.META_FILE_PATH, filePath);
        metadata.put(UniversalSyntaxTree.META_PARSER, getClass().getSimpleName());
        metadata.put("language_level", languageLevel.name());

        log.debug("Parsed {} with {} types", filePath != null ? filePath : "<source>", unit.getTypes().size());
        return new UniversalSyntaxTree(root, metadata);
    }

    private AstNode convert(Node node, String filePath) {
        AstNode ust = new AstNode(JavaNodeKinds.typeOf(node), LANGUAGE);
        if (ust.getType() == NodeType.FALLBACK && !JavaNodeKinds.isMapped(node)) {
            ust.setAttribute("kind", node.getClass().getSimpleName());
        }
        node.getRange().ifPresent(range -> ust.setSourceRange(toSourceRange(range, filePath)));
        JavaAttributeExtractors.apply(node, ust);

        if (!JavaNodeKinds.isAtomic(node)) {
            for (Node child : node.getChildNodes()) {
                if (!JavaNodeKinds.isSkipped(child)) {
                    ust.addChild(convert(child, filePath));
                }
            }
        }
        return ust;
    }

    private static SourceRange toSourceRange(Range range, String filePath) {
        return SourceRange.of(range.begin.line, range.begin.column - 1, range.end.line, range.end.column, filePath);
    }

    static SourceParseException syntaxError(List<Problem> problems) {
        if (problems.isEmpty()) {
            return new SourceParseException(LANGUAGE, "unparseable source", null, null);
        }
        Problem first = problems.get(0);
        Optional<Position> begin = first.getLocation()
                .flatMap(tokens -> tokens.getBegin().getRange())
                .map(range -> range.begin);
        return new SourceParseException(LANGUAGE, first.getMessage(),
                begin.map(p -> p.line).orElse(null),
                begin.map(p -> p.column - 1).orElse(null),
                first.getCause().orElse(null));
    }
}
