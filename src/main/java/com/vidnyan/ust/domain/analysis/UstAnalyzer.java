package com.vidnyan.ust.domain.analysis;

import com.vidnyan.ust.domain.model.AstNode;
import com.vidnyan.ust.domain.model.NodeType;
import com.vidnyan.ust.domain.model.UniversalSyntaxTree;

import java.util.List;

/**
 * Builds {@link AnalysisReport}s: declarations found in a tree plus complexity metrics.
 */
public final class UstAnalyzer {

    private UstAnalyzer() {
    }

    public static AnalysisReport analyze(UniversalSyntaxTree tree, AnalysisType type) {
        return new AnalysisReport(
                type.includes(AnalysisType.FUNCTIONS) ? functions(tree) : null,
                type.includes(AnalysisType.VARIABLES) ? variables(tree) : null,
                type.includes(AnalysisType.CLASSES) ? classes(tree) : null,
                type.includes(AnalysisType.IMPORTS) ? imports(tree) : null,
                type.includes(AnalysisType.COMPLEXITY) ? complexity(tree) : null
        );
    }

    static List<AnalysisReport.FunctionSummary> functions(UniversalSyntaxTree tree) {
        return tree.getNodesByType(NodeType.FUNCTION_DECLARATION).stream()
                .map(fn -> new AnalysisReport.FunctionSummary(
                        stringAttr(fn, "name", "anonymous"),
                        stringList(fn, "parameters"),
                        fn.startLine(),
                        Boolean.TRUE.equals(fn.getAttribute("is_async"))))
                .toList();
    }

    static List<AnalysisReport.VariableSummary> variables(UniversalSyntaxTree tree) {
        return tree.getNodesByType(NodeType.VARIABLE_DECLARATION).stream()
                .map(var -> new AnalysisReport.VariableSummary(
                        stringAttr(var, "name", "unknown"),
                        stringAttr(var, "type", null),
                        stringAttr(var, "kind", null),
                        var.startLine()))
                .toList();
    }

    static List<AnalysisReport.ClassSummary> classes(UniversalSyntaxTree tree) {
        return tree.getNodesByType(NodeType.CLASS_DECLARATION).stream()
                .map(cls -> new AnalysisReport.ClassSummary(
                        stringAttr(cls, "name", "unknown"),
                        stringList(cls, "base_classes"),
                        cls.startLine()))
                .toList();
    }

    static List<AnalysisReport.ImportSummary> imports(UniversalSyntaxTree tree) {
        return tree.getNodesByType(NodeType.IMPORT_DECLARATION).stream()
                .map(imp -> new AnalysisReport.ImportSummary(
                        stringAttr(imp, "module", null),
                        imp.getAttribute("names") instanceof List<?> names ? List.copyOf(names) : List.of(),
                        stringAttr(imp, "type", "import"),
                        imp.startLine()))
                .toList();
    }

    static AnalysisReport.Complexity complexity(UniversalSyntaxTree tree) {
        return new AnalysisReport.Complexity(
                TreeMetrics.nodeCount(tree),
                TreeMetrics.nodeTypeHistogram(tree),
                TreeMetrics.depth(tree),
                TreeMetrics.cyclomaticEstimate(tree)
        );
    }

    private static String stringAttr(AstNode node, String key, String defaultValue) {
        Object value = node.getAttribute(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static List<String> stringList(AstNode node, String key) {
        if (node.getAttribute(key) instanceof List<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        return List.of();
    }
}
