package com.vidnyan.ust.domain.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Position in the original source.
 * Lines are 1-based, columns 0-based.
 */
public record SourceLocation(
    int line,
    int column,
    String filePath
) {

    /**
     * Format as readable string.
     */
    public String format() {
        return (filePath != null ? filePath : "<source>") + ":" + line + ":" + column;
    }

    Map<String, Object> toCanonical() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("line", line);
        map.put("column", column);
        map.put("file_path", filePath);
        return map;
    }

    static SourceLocation fromCanonical(Map<String, ?> map) {
        return new SourceLocation(
                ((Number) map.get("line")).intValue(),
                ((Number) map.get("column")).intValue(),
                (String) map.get("file_path")
        );
    }
}
