package com.vidnyan.ust.adapter.out.parser.javascript;

import java.util.regex.Pattern;

/**
 * Lexical rules, in priority order.
 *
 * The declaration order is load-bearing: the tokenizer tries the rules top to
 * bottom and the first match wins. Keywords come before IDENTIFIER so they are
 * never read as names, and multi-character operators come before their
 * single-character prefixes.
 */
public enum TokenType {

    COMMENT_SINGLE("//.*", true),
    COMMENT_MULTI("/\\*[\\s\\S]*?\\*/", true),
    STRING_DOUBLE("\"(?:[^\"\\\\]|\\\\.)*\""),
    STRING_SINGLE("'(?:[^'\\\\]|\\\\.)*'"),
    STRING_TEMPLATE("`(?:[^`\\\\]|\\\\.)*`"),
    NUMBER("\\d+\\.?\\d*"),

    FUNCTION("\\bfunction\\b"),
    CONST("\\bconst\\b"),
    LET("\\blet\\b"),
    VAR("\\bvar\\b"),
    IF("\\bif\\b"),
    ELSE("\\belse\\b"),
    FOR("\\bfor\\b"),
    WHILE("\\bwhile\\b"),
    RETURN("\\breturn\\b"),
    BREAK("\\bbreak\\b"),
    CONTINUE("\\bcontinue\\b"),
    CLASS("\\bclass\\b"),
    IMPORT("\\bimport\\b"),
    EXPORT("\\bexport\\b"),
    FROM("\\bfrom\\b"),
    TRUE("\\btrue\\b"),
    FALSE("\\bfalse\\b"),
    NULL("\\bnull\\b"),
    UNDEFINED("\\bundefined\\b"),

    EQUALITY("===|=="),
    INEQUALITY("!==|!="),
    ARROW("=>"),
    PLUS_ASSIGN("\\+="),
    MINUS_ASSIGN("-="),
    MULTIPLY_ASSIGN("\\*="),
    DIVIDE_ASSIGN("/="),
    LESS_EQUAL("<="),
    GREATER_EQUAL(">="),
    AND("&&"),
    OR("\\|\\|"),
    ASSIGN("="),
    LESS("<"),
    GREATER(">"),
    PLUS("\\+"),
    MINUS("-"),
    MULTIPLY("\\*"),
    DIVIDE("/"),
    MODULO("%"),
    NOT("!"),
    SEMICOLON(";"),
    COMMA(","),
    DOT("\\."),
    LPAREN("\\("),
    RPAREN("\\)"),
    LBRACE("\\{"),
    RBRACE("\\}"),
    LBRACKET("\\["),
    RBRACKET("\\]"),

    IDENTIFIER("[a-zA-Z_$][a-zA-Z0-9_$]*"),
    WHITESPACE("\\s+", true);

    private final Pattern pattern;
    private final boolean discarded;

    TokenType(String regex) {
        this(regex, false);
    }

    TokenType(String regex, boolean discarded) {
        this.pattern = Pattern.compile(regex);
        this.discarded = discarded;
    }

    public Pattern pattern() {
        return pattern;
    }

    /**
     * Matched text is skipped without emitting a token.
     */
    public boolean isDiscarded() {
        return discarded;
    }

    public boolean isString() {
        return this == STRING_DOUBLE || this == STRING_SINGLE || this == STRING_TEMPLATE;
    }

    public boolean isVariableKeyword() {
        return this == CONST || this == LET || this == VAR;
    }
}
