package com.vidnyan.ust.domain.analysis;

import com.vidnyan.ust.domain.model.NodeType;

import java.util.List;
import java.util.Map;

/**
 * Summary of a parsed tree. Sections not requested are null.
 */
public record AnalysisReport(
    List<FunctionSummary> functions,
    List<VariableSummary> variables,
    List<ClassSummary> classes,
    List<ImportSummary> imports,
    Complexity complexity
) {

    public record FunctionSummary(
        String name,
        List<String> parameters,
        Integer line,
        boolean isAsync
    ) {}

    public record VariableSummary(
        String name,
        String type,
        String kind,
        Integer line
    ) {}

    public record ClassSummary(
        String name,
        List<String> baseClasses,
        Integer line
    ) {}

    public record ImportSummary(
        String module,
        List<Object> names,
        String type,
        Integer line
    ) {}

    public record Complexity(
        int totalNodes,
        Map<NodeType, Long> nodeTypes,
        int depth,
        int cyclomaticComplexity
    ) {}
}
