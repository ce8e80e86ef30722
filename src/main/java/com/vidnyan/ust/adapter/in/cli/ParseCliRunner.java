package com.vidnyan.ust.adapter.in.cli;

import com.vidnyan.ust.adapter.out.json.UstJsonCodec;
import com.vidnyan.ust.application.port.in.ParseCodeUseCase;
import com.vidnyan.ust.application.port.in.ParseCodeUseCase.AnalysisRequest;
import com.vidnyan.ust.application.port.in.ParseCodeUseCase.AnalysisResult;
import com.vidnyan.ust.config.UstProperties;
import com.vidnyan.ust.domain.analysis.AnalysisReport;
import com.vidnyan.ust.domain.analysis.AnalysisType;
import com.vidnyan.ust.domain.error.SourceParseException;
import com.vidnyan.ust.domain.error.UnsupportedLanguageException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * CLI runner for one-shot parsing.
 * Runs when ust.parse.path is set; the exit code reports whether the file parsed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ParseCliRunner implements CommandLineRunner, ExitCodeGenerator {

    static final int EXIT_PARSE_ERROR = 1;
    static final int EXIT_UNSUPPORTED = 2;
    static final int EXIT_IO_ERROR = 3;
    static final int EXIT_BAD_ANALYSIS = 4;

    private final ParseCodeUseCase parseCodeUseCase;
    private final UstJsonCodec jsonCodec;
    private final UstProperties properties;

    private int exitCode = 0;

    @Override
    public void run(String... args) {
        UstProperties.Parse parse = properties.getParse();
        if (parse.getPath() == null || parse.getPath().isBlank()) {
            log.info("No source path specified. Set ust.parse.path property.");
            return;
        }

        AnalysisType analysisType;
        try {
            analysisType = AnalysisType.parse(parse.getAnalysis());
        } catch (IllegalArgumentException e) {
            log.warn("Invalid ust.parse.analysis: {}", e.getMessage());
            exitCode = EXIT_BAD_ANALYSIS;
            return;
        }

        Path path = Path.of(parse.getPath());
        log.info("══════════════════════════════════════════════════════════════");
        log.info(" UST - Universal Syntax Tree");
        log.info(" Parsing: {}", truncatePath(path.toString(), 50));
        log.info("══════════════════════════════════════════════════════════════");

        try {
            String source = Files.readString(path);
            AnalysisRequest request = new AnalysisRequest(
                    source,
                    parse.getLanguage(),
                    path.toString(),
                    analysisType);
            AnalysisResult result = parseCodeUseCase.analyze(request);

            printReport(result);
            if (parse.isPrintTree()) {
                log.info("{}", jsonCodec.toJson(result.tree()));
            }
        } catch (SourceParseException e) {
            log.warn("Rejected {}: {}", path, e.getMessage());
            exitCode = EXIT_PARSE_ERROR;
        } catch (UnsupportedLanguageException e) {
            log.warn("{}. Supported: {}", e.getMessage(), parseCodeUseCase.supportedExtensions());
            exitCode = EXIT_UNSUPPORTED;
        } catch (IOException e) {
            log.error("Cannot read {}: {}", path, e.getMessage());
            exitCode = EXIT_IO_ERROR;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private void printReport(AnalysisResult result) {
        AnalysisReport report = result.report();
        log.info(" Language: {}", result.tree().language());
        log.info(" Duration: {}ms", result.durationMs());
        log.info("──────────────────────────────────────────────────────────────");

        if (report.functions() != null) {
            log.info(" FUNCTIONS ({})", report.functions().size());
            report.functions().forEach(f ->
                    log.info("   {}{}({}) line {}", f.isAsync() ? "async " : "", f.name(),
                            String.join(", ", f.parameters()), f.line()));
        }
        if (report.classes() != null) {
            log.info(" CLASSES ({})", report.classes().size());
            report.classes().forEach(c -> log.info("   {} {} line {}", c.name(), c.baseClasses(), c.line()));
        }
        if (report.variables() != null) {
            log.info(" VARIABLES ({})", report.variables().size());
            report.variables().forEach(v -> log.info("   {} {} line {}", v.kind() != null ? v.kind() : "", v.name(), v.line()));
        }
        if (report.imports() != null) {
            log.info(" IMPORTS ({})", report.imports().size());
            report.imports().forEach(i -> log.info("   {} {} line {}", i.module(), i.names(), i.line()));
        }
        if (report.complexity() != null) {
            AnalysisReport.Complexity complexity = report.complexity();
            log.info(" COMPLEXITY");
            log.info("   Nodes:      {}", complexity.totalNodes());
            log.info("   Depth:      {}", complexity.depth());
            log.info("   Cyclomatic: {}", complexity.cyclomaticComplexity());
        }
        log.info("══════════════════════════════════════════════════════════════");
    }

    private String truncatePath(String path, int maxLen) {
        if (path.length() <= maxLen)
            return path;
        return "..." + path.substring(path.length() - maxLen + 3);
    }
}
