package com.vidnyan.ust.application.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Best-effort language classifier.
 *
 * File extension first (against the registry), then keyword rules over the
 * lower-cased, trimmed source, tried in a fixed order. A classifier, not a
 * parser: it never throws.
 */
@Component
@RequiredArgsConstructor
public class LanguageDetector {

    /**
     * Ordered keyword rules. The first rule with any substring present wins.
     */
    static final List<Rule> RULES = List.of(
            new Rule("python", List.of("def ", "import ", "from ", "class ", "if __name__")),
            new Rule("javascript", List.of("function ", "const ", "let ", "var ", "=>", "console.log")),
            new Rule("java", List.of("public class", "public static void main", "import java")),
            new Rule("c", List.of("#include", "int main(", "printf(", "cout <<"),
                    source -> source.contains("cout") ? "cpp" : "c")
    );

    private final ParserRegistry registry;

    public Optional<String> detect(String source, String filePath) {
        Optional<String> byExtension = ParserRegistry.extensionOf(filePath).flatMap(registry::languageOf);
        if (byExtension.isPresent()) {
            return byExtension;
        }
        if (source == null) {
            return Optional.empty();
        }

        String normalized = source.toLowerCase(Locale.ROOT).strip();
        for (Rule rule : RULES) {
            if (rule.matches(normalized)) {
                return Optional.of(rule.resolve(normalized));
            }
        }
        return Optional.empty();
    }

    /**
     * Keyword-presence rule for one language family.
     */
    record Rule(String language, List<String> keywords, UnaryOperator<String> refine) {

        Rule(String language, List<String> keywords) {
            this(language, keywords, source -> language);
        }

        boolean matches(String source) {
            return keywords.stream().anyMatch(source::contains);
        }

        String resolve(String source) {
            return refine.apply(source);
        }
    }
}
