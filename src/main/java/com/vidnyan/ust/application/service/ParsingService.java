package com.vidnyan.ust.application.service;

import com.vidnyan.ust.application.port.in.ParseCodeUseCase;
import com.vidnyan.ust.application.port.out.LanguageParser;
import com.vidnyan.ust.domain.analysis.AnalysisReport;
import com.vidnyan.ust.domain.analysis.AnalysisType;
import com.vidnyan.ust.domain.analysis.UstAnalyzer;
import com.vidnyan.ust.domain.error.UnsupportedLanguageException;
import com.vidnyan.ust.domain.model.UniversalSyntaxTree;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Dispatches source text to the right language parser.
 * Parse and syntax errors propagate unchanged: a fixed input cannot succeed on retry.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ParsingService implements ParseCodeUseCase {

    private final ParserRegistry registry;
    private final LanguageDetector languageDetector;

    @Override
    public UniversalSyntaxTree parseCode(String source, String language, String filePath) {
        LanguageParser parser = resolveParser(language, filePath);
        log.debug("Parsing {} with {}", filePath != null ? filePath : "<source>", parser.getClass().getSimpleName());
        return parser.parse(source != null ? source : "", filePath);
    }

    @Override
    public Optional<String> detectLanguage(String source, String filePath) {
        return languageDetector.detect(source, filePath);
    }

    @Override
    public AnalysisResult analyze(AnalysisRequest request) {
        Instant startTime = Instant.now();

        UniversalSyntaxTree tree = parseCode(request.source(), request.language(), request.filePath());
        AnalysisType type = request.analysisType() != null ? request.analysisType() : AnalysisType.ALL;
        AnalysisReport report = UstAnalyzer.analyze(tree, type);

        long durationMs = Duration.between(startTime, Instant.now()).toMillis();
        log.debug("Analyzed {} tree ({}) in {}ms", tree.language(), type, durationMs);
        return new AnalysisResult(tree, report, durationMs);
    }

    @Override
    public List<String> supportedLanguages() {
        return registry.listSupportedLanguages();
    }

    @Override
    public List<String> supportedExtensions() {
        return registry.listSupportedExtensions();
    }

    /**
     * Explicit language first, then the file extension.
     */
    LanguageParser resolveParser(String language, String filePath) {
        return registry.getParser(language)
                .or(() -> ParserRegistry.extensionOf(filePath).flatMap(registry::getParserByExtension))
                .orElseThrow(() -> new UnsupportedLanguageException(language, filePath));
    }
}
