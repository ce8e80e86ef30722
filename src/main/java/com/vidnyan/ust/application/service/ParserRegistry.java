package com.vidnyan.ust.application.service;

import com.vidnyan.ust.application.port.out.LanguageParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Lookup table of language parsers, keyed by language name and by file extension.
 *
 * Populated once from the parser beans at startup and read-only afterwards.
 * Lookups are lock free; {@link #register(LanguageParser)} is serialized so a
 * late registration cannot interleave with another one.
 */
@Slf4j
@Component
public class ParserRegistry {

    private final Map<String, LanguageParser> parsers = new ConcurrentHashMap<>();
    private final Map<String, String> extensionMap = new ConcurrentHashMap<>();

    // registration order, for listing
    private final List<String> languageOrder = new CopyOnWriteArrayList<>();
    private final List<String> extensionOrder = new CopyOnWriteArrayList<>();

    public ParserRegistry() {
    }

    @Autowired
    public ParserRegistry(List<LanguageParser> languageParsers) {
        languageParsers.forEach(this::register);
    }

    /**
     * Register a parser. A later parser for the same language or extension replaces the earlier one.
     */
    public synchronized void register(LanguageParser parser) {
        String language = normalizeLanguage(parser.language());
        if (parsers.put(language, parser) == null) {
            languageOrder.add(language);
        }
        for (String ext : parser.extensions()) {
            String normalized = LanguageParser.normalizeExtension(ext);
            if (extensionMap.put(normalized, language) == null) {
                extensionOrder.add(normalized);
            }
        }
        log.info("Registered parser {} for '{}' {}", parser.getClass().getSimpleName(), language, parser.extensions());
    }

    public Optional<LanguageParser> getParser(String language) {
        if (language == null || language.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(parsers.get(normalizeLanguage(language)));
    }

    /**
     * Case-insensitive; the leading dot is optional.
     */
    public Optional<LanguageParser> getParserByExtension(String extension) {
        return languageOf(extension).map(parsers::get);
    }

    /**
     * Language registered for an extension.
     */
    public Optional<String> languageOf(String extension) {
        if (extension == null || extension.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(extensionMap.get(LanguageParser.normalizeExtension(extension)));
    }

    public List<String> listSupportedLanguages() {
        return List.copyOf(languageOrder);
    }

    public List<String> listSupportedExtensions() {
        return List.copyOf(extensionOrder);
    }

    public List<LanguageParser.LanguageInfo> describe() {
        List<LanguageParser.LanguageInfo> infos = new ArrayList<>();
        for (String language : languageOrder) {
            infos.add(parsers.get(language).languageInfo());
        }
        return infos;
    }

    /**
     * Extension of a file path including the dot, if it has one.
     */
    public static Optional<String> extensionOf(String filePath) {
        if (filePath == null) {
            return Optional.empty();
        }
        int sep = Math.max(filePath.lastIndexOf('/'), filePath.lastIndexOf('\\'));
        int dot = filePath.lastIndexOf('.');
        if (dot <= sep + 1 || dot == filePath.length() - 1) {
            return Optional.empty();
        }
        return Optional.of(filePath.substring(dot).toLowerCase(Locale.ROOT));
    }

    private static String normalizeLanguage(String language) {
        return language.trim().toLowerCase(Locale.ROOT);
    }
}
