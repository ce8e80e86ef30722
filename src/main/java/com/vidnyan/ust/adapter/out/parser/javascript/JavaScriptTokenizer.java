package com.vidnyan.ust.adapter.out.parser.javascript;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;

/**
 * Ordered-rule scanner over line-split source text.
 *
 * At each position the first {@link TokenType} (declaration order) that matches
 * wins. Discarded rules advance the position without emitting a token. When no
 * rule matches, exactly one character is skipped, so scanning always terminates
 * and never fails; unrecognized characters are lost.
 */
public final class JavaScriptTokenizer {

    private static final TokenType[] RULES = TokenType.values();

    private JavaScriptTokenizer() {
    }

    public static List<Token> tokenize(String source) {
        List<Token> tokens = new ArrayList<>();
        if (source == null || source.isEmpty()) {
            return tokens;
        }

        String[] lines = source.split("\n", -1);
        for (int lineIndex = 0; lineIndex < lines.length; lineIndex++) {
            tokenizeLine(lines[lineIndex], lineIndex + 1, tokens);
        }
        return tokens;
    }

    private static void tokenizeLine(String line, int lineNumber, List<Token> tokens) {
        int column = 0;
        while (column < line.length()) {
            int end = -1;
            for (TokenType rule : RULES) {
                Matcher matcher = rule.pattern().matcher(line);
                // transparent bounds let \b see the character before the scan position
                matcher.region(column, line.length()).useTransparentBounds(true);
                if (matcher.lookingAt() && matcher.end() > column) {
                    end = matcher.end();
                    if (!rule.isDiscarded()) {
                        tokens.add(new Token(rule, matcher.group(), lineNumber, column));
                    }
                    break;
                }
            }
            column = end > column ? end : column + 1;
        }
    }
}
