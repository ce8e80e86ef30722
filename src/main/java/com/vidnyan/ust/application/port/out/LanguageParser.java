package com.vidnyan.ust.application.port.out;

import com.vidnyan.ust.domain.model.UniversalSyntaxTree;

import java.util.List;
import java.util.Locale;

/**
 * Port every language adapter implements.
 * Implementations are stateless: each call builds and returns a fresh tree.
 */
public interface LanguageParser {

    /**
     * Parse source text into a universal syntax tree.
     * @param source Raw source text
     * @param filePath Originating file, may be null
     * @return Fully built tree owned by the caller
     * @throws com.vidnyan.ust.domain.error.SourceParseException if the source is malformed
     */
    UniversalSyntaxTree parse(String source, String filePath);

    /**
     * Language name used as registry key.
     */
    String language();

    /**
     * File extensions handled, lower case with leading dot.
     */
    List<String> extensions();

    default boolean canParse(String extension) {
        return extension != null && extensions().contains(normalizeExtension(extension));
    }

    default LanguageInfo languageInfo() {
        return new LanguageInfo(language(), extensions(), LanguageInfo.DEFAULT_PARSER_VERSION);
    }

    static String normalizeExtension(String extension) {
        String ext = extension.trim().toLowerCase(Locale.ROOT);
        return ext.startsWith(".") ? ext : "." + ext;
    }

    /**
     * Description of a parser's language support.
     */
    record LanguageInfo(
        String name,
        List<String> extensions,
        String parserVersion
    ) {
        public static final String DEFAULT_PARSER_VERSION = "1.0";
    }
}
