package com.vidnyan.ust.application.port.in;

import com.vidnyan.ust.domain.analysis.AnalysisReport;
import com.vidnyan.ust.domain.analysis.AnalysisType;
import com.vidnyan.ust.domain.model.UniversalSyntaxTree;

import java.util.List;
import java.util.Optional;

/**
 * Primary entry points consumed by external collaborators.
 */
public interface ParseCodeUseCase {

    /**
     * Parse source, resolving the parser from the language hint first and the
     * file extension second.
     * @throws com.vidnyan.ust.domain.error.UnsupportedLanguageException if neither resolves
     * @throws com.vidnyan.ust.domain.error.SourceParseException if the source is malformed
     */
    UniversalSyntaxTree parseCode(String source, String language, String filePath);

    /**
     * Best-effort language guess. Never throws.
     */
    Optional<String> detectLanguage(String source, String filePath);

    /**
     * Parse and summarize in one step.
     */
    AnalysisResult analyze(AnalysisRequest request);

    List<String> supportedLanguages();

    List<String> supportedExtensions();

    /**
     * Analysis request.
     */
    record AnalysisRequest(
        String source,
        String language,
        String filePath,
        AnalysisType analysisType
    ) {
        public static AnalysisRequest of(String source, String language) {
            return new AnalysisRequest(source, language, null, AnalysisType.ALL);
        }
    }

    /**
     * Analysis result.
     */
    record AnalysisResult(
        UniversalSyntaxTree tree,
        AnalysisReport report,
        long durationMs
    ) {}
}
