package com.vidnyan.ust.domain.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Span of source text covered by a node.
 */
public record SourceRange(
    SourceLocation start,
    SourceLocation end
) {

    public static SourceRange of(int startLine, int startColumn, int endLine, int endColumn, String filePath) {
        return new SourceRange(
                new SourceLocation(startLine, startColumn, filePath),
                new SourceLocation(endLine, endColumn, filePath)
        );
    }

    Map<String, Object> toCanonical() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("start", start.toCanonical());
        map.put("end", end.toCanonical());
        return map;
    }

    @SuppressWarnings("unchecked")
    static SourceRange fromCanonical(Map<String, ?> map) {
        return new SourceRange(
                SourceLocation.fromCanonical((Map<String, ?>) map.get("start")),
                SourceLocation.fromCanonical((Map<String, ?>) map.get("end"))
        );
    }
}
