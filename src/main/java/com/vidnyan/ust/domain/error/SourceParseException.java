package com.vidnyan.ust.domain.error;

import lombok.Getter;

/**
 * Raised when a parser rejects malformed source text.
 * Carries the position reported by the underlying grammar when it supplies one.
 */
@Getter
public class SourceParseException extends RuntimeException {

    private final String language;
    private final Integer line;
    private final Integer column;

    public SourceParseException(String language, String message, Integer line, Integer column) {
        super(format(language, message, line, column));
        this.language = language;
        this.line = line;
        this.column = column;
    }

    public SourceParseException(String language, String message, Integer line, Integer column, Throwable cause) {
        super(format(language, message, line, column), cause);
        this.language = language;
        this.line = line;
        this.column = column;
    }

    public boolean hasPosition() {
        return line != null;
    }

    private static String format(String language, String message, Integer line, Integer column) {
        StringBuilder sb = new StringBuilder();
        sb.append(language).append(" syntax error");
        if (line != null) {
            sb.append(" at line ").append(line);
            if (column != null) {
                sb.append(", column ").append(column);
            }
        }
        return sb.append(": ").append(message).toString();
    }
}
