package com.vidnyan.ust.adapter.out.parser.python;

import com.vidnyan.ust.application.port.out.LanguageParser;
import com.vidnyan.ust.domain.error.SourceParseException;
import com.vidnyan.ust.domain.model.AstNode;
import com.vidnyan.ust.domain.model.NodeType;
import com.vidnyan.ust.domain.model.SourceRange;
import com.vidnyan.ust.domain.model.UniversalSyntaxTree;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.treesitter.TSLanguage;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterPython;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Python adapter over the tree-sitter Python grammar.
 *
 * Every named grammar node becomes one universal node; anonymous tokens
 * (keywords, punctuation, operators) only contribute attributes. Source that
 * the grammar cannot parse without error recovery is rejected.
 */
@Slf4j
@Component
public class TreeSitterPythonParser implements LanguageParser {

    public static final String LANGUAGE = "python";
    private static final List<String> EXTENSIONS = List.of(".py", ".pyw", ".pyi");
    private static final TSLanguage PY_LANGUAGE = new TreeSitterPython();

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
        return new LanguageInfo(LANGUAGE, EXTENSIONS, "tree-sitter-python");
    }

    @Override
    public UniversalSyntaxTree parse(String source, String filePath) {
        String text = source != null ? source : "";

        // TSParser is not thread safe; one per call
        TSParser parser = new TSParser();
        parser.setLanguage(PY_LANGUAGE);
        TSTree tree = parser.parseString(null, text);
        TSNode root = tree.getRootNode();

        if (root.hasError()) {
            throw syntaxError(root);
        }

        int[] nodeCount = {0};
        AstNode ust = convert(root, new SourceText(text), filePath, nodeCount);
        ust.setAttribute("language", LANGUAGE);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(UniversalSyntaxTree.META_LANGUAGE, LANGUAGE);
        metadata.put(UniversalSyntaxTree.META_FILE_PATH, filePath);
        metadata.put(UniversalSyntaxTree.META_PARSER, getClass().getSimpleName());
        metadata.put("node_count", nodeCount[0]);

        log.debug("Converted {} python nodes from {}", nodeCount[0], filePath != null ? filePath : "<source>");
        return new UniversalSyntaxTree(ust, metadata);
    }

    private AstNode convert(TSNode node, SourceText text, String filePath, int[] nodeCount) {
        String kind = node.getType();
        AstNode ust = new AstNode(PythonNodeKinds.typeOf(kind), LANGUAGE);
        nodeCount[0]++;

        if (ust.getType() == NodeType.FALLBACK && !PythonNodeKinds.MAPPING.containsKey(kind)) {
            ust.setAttribute("kind", kind);
        }
        ust.setSourceRange(SourceRange.of(
                node.getStartPoint().getRow() + 1, node.getStartPoint().getColumn(),
                node.getEndPoint().getRow() + 1, node.getEndPoint().getColumn(),
                filePath));
        PythonAttributeExtractors.apply(node, text, ust);

        if (!PythonNodeKinds.ATOMIC.contains(kind)) {
            for (int i = 0; i < node.getNamedChildCount(); i++) {
                ust.addChild(convert(node.getNamedChild(i), text, filePath, nodeCount));
            }
        }
        return ust;
    }

    /**
     * Locates the first error or missing node in document order.
     */
    static SourceParseException syntaxError(TSNode root) {
        Deque<TSNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            TSNode node = stack.pop();
            if ("ERROR".equals(node.getType()) || node.isMissing()) {
                String message = node.isMissing()
                        ? "missing '" + node.getType() + "'"
                        : "invalid syntax";
                return new SourceParseException(LANGUAGE, message,
                        node.getStartPoint().getRow() + 1, node.getStartPoint().getColumn());
            }
            for (int i = node.getChildCount() - 1; i >= 0; i--) {
                TSNode child = node.getChild(i);
                if (child.hasError() || child.isMissing()) {
                    stack.push(child);
                }
            }
        }
        return new SourceParseException(LANGUAGE, "invalid syntax", null, null);
    }
}
