package com.vidnyan.ust.adapter.out.parser.javascript;

import com.vidnyan.ust.application.port.out.LanguageParser;
import com.vidnyan.ust.domain.model.AstNode;
import com.vidnyan.ust.domain.model.AstNodes;
import com.vidnyan.ust.domain.model.DataType;
import com.vidnyan.ust.domain.model.NodeType;
import com.vidnyan.ust.domain.model.SourceRange;
import com.vidnyan.ust.domain.model.UniversalSyntaxTree;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Hand-written JavaScript parser: {@link JavaScriptTokenizer} followed by a
 * single-pass statement dispatcher with one token of lookahead.
 *
 * <p>Only declaration headers and top-level statement shapes are decomposed.
 * Function, class, if, for and while bodies are matched by brace depth and kept
 * as one opaque {@code block_statement} without children.
 *
 * <p>Never throws on malformed input: a handler that runs out of tokens before
 * its closing delimiter returns the partial node it has built.
 */
@Slf4j
@Component
public class JavaScriptParser implements LanguageParser {

    public static final String LANGUAGE = "javascript";
    private static final List<String> EXTENSIONS = List.of(".js", ".jsx", ".mjs", ".ts", ".tsx");

    @Override
    public String language() {
        return LANGUAGE;
    }

    @Override
    public List<String> extensions() {
        return EXTENSIONS;
    }

    @Override
    public UniversalSyntaxTree parse(String source, String filePath) {
        List<Token> tokens = JavaScriptTokenizer.tokenize(source);
        AstNode root = new StatementParser(tokens, filePath).parseProgram();

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(UniversalSyntaxTree.META_LANGUAGE, LANGUAGE);
        metadata.put(UniversalSyntaxTree.META_FILE_PATH, filePath);
        metadata.put(UniversalSyntaxTree.META_PARSER, getClass().getSimpleName());
        metadata.put("token_count", tokens.size());

        log.debug("Parsed {} tokens into {} top-level statements", tokens.size(), root.getChildren().size());
        return new UniversalSyntaxTree(root, metadata);
    }

    /**
     * Node built by a handler and the number of tokens it consumed.
     */
    record Parsed(AstNode node, int consumed) {}

    /**
     * End index (exclusive) of a delimited span and whether its closer was found.
     */
    record Span(int end, boolean matched) {}

    /**
     * Statement dispatch over one token list. Every handler consumes at least one token.
     */
    static final class StatementParser {

        private static final Set<TokenType> STATEMENT_STARTERS = EnumSet.of(
                TokenType.FUNCTION, TokenType.CONST, TokenType.LET, TokenType.VAR,
                TokenType.IF, TokenType.FOR, TokenType.WHILE, TokenType.RETURN,
                TokenType.BREAK, TokenType.CONTINUE, TokenType.CLASS,
                TokenType.IMPORT, TokenType.EXPORT
        );

        private static final Set<TokenType> EXPRESSION_ENDS = EnumSet.of(
                TokenType.IDENTIFIER, TokenType.NUMBER, TokenType.STRING_DOUBLE,
                TokenType.STRING_SINGLE, TokenType.STRING_TEMPLATE, TokenType.TRUE,
                TokenType.FALSE, TokenType.NULL, TokenType.UNDEFINED,
                TokenType.RPAREN, TokenType.RBRACKET, TokenType.RBRACE
        );

        private static final Set<TokenType> EXPRESSION_STARTS = EnumSet.of(
                TokenType.IDENTIFIER, TokenType.NUMBER, TokenType.STRING_DOUBLE,
                TokenType.STRING_SINGLE, TokenType.STRING_TEMPLATE, TokenType.TRUE,
                TokenType.FALSE, TokenType.NULL, TokenType.UNDEFINED
        );

        private final List<Token> tokens;
        private final String filePath;

        StatementParser(List<Token> tokens, String filePath) {
            this.tokens = tokens;
            this.filePath = filePath;
        }

        AstNode parseProgram() {
            AstNode root = AstNodes.program(LANGUAGE);
            int i = 0;
            while (i < tokens.size()) {
                Parsed parsed = parseStatement(i);
                if (parsed.node() != null) {
                    root.addChild(parsed.node());
                }
                i += Math.max(1, parsed.consumed());
            }
            return root;
        }

        Parsed parseStatement(int start) {
            Token token = tokens.get(start);
            if (isAsyncFunction(start)) {
                return parseFunction(start, start + 1, true);
            }
            return switch (token.type()) {
                case FUNCTION -> parseFunction(start, start, false);
                case CONST, LET, VAR -> parseVariable(start);
                case IF -> parseIf(start);
                case FOR -> parseLoop(start, NodeType.FOR_STATEMENT, "header");
                case WHILE -> parseLoop(start, NodeType.WHILE_STATEMENT, "condition");
                case RETURN -> parseReturn(start);
                case BREAK -> parseJump(start, NodeType.BREAK_STATEMENT);
                case CONTINUE -> parseJump(start, NodeType.CONTINUE_STATEMENT);
                case CLASS -> parseClass(start);
                case IMPORT, EXPORT -> parseImportExport(start);
                default -> parseExpressionStatement(start);
            };
        }

        /**
         * Function declaration whose {@code function} keyword sits at {@code keyword};
         * an {@code async} modifier before it starts the node at {@code start}.
         */
        Parsed parseFunction(int start, int keyword, boolean async) {
            AstNode node = new AstNode(NodeType.FUNCTION_DECLARATION, LANGUAGE);
            if (async) {
                node.setAttribute("is_async", true);
            }
            int i = keyword + 1;

            if (at(i, TokenType.IDENTIFIER)) {
                node.setAttribute("name", tokens.get(i).value());
                i++;
            }

            if (at(i, TokenType.LPAREN)) {
                List<String> parameters = new ArrayList<>();
                int end = skipBalanced(i, TokenType.LPAREN, TokenType.RPAREN).end();
                int depth = 0;
                for (int p = i; p < end; p++) {
                    Token t = tokens.get(p);
                    if (t.is(TokenType.LPAREN)) {
                        depth++;
                    } else if (t.is(TokenType.RPAREN)) {
                        depth--;
                    } else if (depth == 1 && t.is(TokenType.IDENTIFIER)) {
                        // names only: skip default values
                        TokenType prev = tokens.get(p - 1).type();
                        if (prev == TokenType.LPAREN || prev == TokenType.COMMA) {
                            parameters.add(t.value());
                        }
                    }
                }
                node.setAttribute("parameters", parameters);
                i = end;
            }

            if (at(i, TokenType.LBRACE)) {
                Parsed body = parseOpaqueBlock(i);
                node.addChild(body.node());
                i += body.consumed();
            }

            return finish(node, start, i);
        }

        Parsed parseVariable(int start) {
            AstNode node = new AstNode(NodeType.VARIABLE_DECLARATION, LANGUAGE);
            node.setAttribute("kind", tokens.get(start).value());
            int i = start + 1;

            if (at(i, TokenType.IDENTIFIER)) {
                node.setAttribute("name", tokens.get(i).value());
                i++;
            }

            if (at(i, TokenType.ASSIGN)) {
                i++;
                AstNode value = parsePrimary(i);
                if (value != null) {
                    node.addChild(value);
                    i++;
                }
                i = skipExpressionRemainder(i);
            } else if (at(i, TokenType.SEMICOLON)) {
                i++;
            }

            return finish(node, start, i);
        }

        Parsed parseIf(int start) {
            AstNode node = new AstNode(NodeType.IF_STATEMENT, LANGUAGE);
            int i = parseHeader(node, start + 1, "condition");

            Parsed consequent = parseBody(i);
            if (consequent != null) {
                node.addChild(consequent.node());
                i += consequent.consumed();
            }

            if (at(i, TokenType.ELSE)) {
                node.setAttribute("has_else", true);
                i++;
                Parsed alternate = at(i, TokenType.IF) ? parseIf(i) : parseBody(i);
                if (alternate != null) {
                    node.addChild(alternate.node());
                    i += alternate.consumed();
                }
            }

            return finish(node, start, i);
        }

        Parsed parseLoop(int start, NodeType type, String headerAttribute) {
            AstNode node = new AstNode(type, LANGUAGE);
            int i = parseHeader(node, start + 1, headerAttribute);

            Parsed body = parseBody(i);
            if (body != null) {
                node.addChild(body.node());
                i += body.consumed();
            }

            return finish(node, start, i);
        }

        Parsed parseReturn(int start) {
            AstNode node = new AstNode(NodeType.RETURN_STATEMENT, LANGUAGE);
            int i = start + 1;

            if (i < tokens.size() && !at(i, TokenType.SEMICOLON)
                    && tokens.get(i).line() == tokens.get(start).line()) {
                AstNode value = parsePrimary(i);
                if (value != null) {
                    node.addChild(value);
                    i++;
                }
                i = skipExpressionRemainder(i);
            } else if (at(i, TokenType.SEMICOLON)) {
                i++;
            }

            return finish(node, start, i);
        }

        Parsed parseJump(int start, NodeType type) {
            AstNode node = new AstNode(type, LANGUAGE);
            int i = start + 1;

            if (at(i, TokenType.IDENTIFIER) && tokens.get(i).line() == tokens.get(start).line()) {
                node.setAttribute("label", tokens.get(i).value());
                i++;
            }
            if (at(i, TokenType.SEMICOLON)) {
                i++;
            }

            return finish(node, start, i);
        }

        Parsed parseClass(int start) {
            AstNode node = new AstNode(NodeType.CLASS_DECLARATION, LANGUAGE);
            int i = start + 1;

            if (at(i, TokenType.IDENTIFIER)) {
                node.setAttribute("name", tokens.get(i).value());
                i++;
            }

            List<String> baseClasses = new ArrayList<>();
            if (at(i, TokenType.IDENTIFIER) && "extends".equals(tokens.get(i).value())) {
                i++;
                StringBuilder base = new StringBuilder();
                while (at(i, TokenType.IDENTIFIER) || at(i, TokenType.DOT)) {
                    base.append(tokens.get(i).value());
                    i++;
                }
                if (!base.isEmpty()) {
                    baseClasses.add(base.toString());
                }
            }
            node.setAttribute("base_classes", baseClasses);

            while (i < tokens.size() && !at(i, TokenType.LBRACE)) {
                i++;
            }
            if (at(i, TokenType.LBRACE)) {
                Parsed body = parseOpaqueBlock(i);
                node.addChild(body.node());
                i += body.consumed();
            }

            return finish(node, start, i);
        }

        Parsed parseImportExport(int start) {
            AstNode node = new AstNode(NodeType.IMPORT_DECLARATION, LANGUAGE);
            Token keyword = tokens.get(start);
            node.setAttribute("type", keyword.value());
            int i = start + 1;

            if (keyword.is(TokenType.EXPORT)) {
                if (at(i, TokenType.IDENTIFIER) && "default".equals(tokens.get(i).value())) {
                    node.setAttribute("default", true);
                    i++;
                }
                if (i < tokens.size() && (isDeclarationKeyword(tokens.get(i).type()) || isAsyncFunction(i))) {
                    Parsed declaration = parseStatement(i);
                    node.addChild(declaration.node());
                    i += declaration.consumed();
                    return finish(node, start, i);
                }
            }

            int end = skipExpressionRemainder(i);
            collectImportSpecifiers(node, i, end);
            return finish(node, start, end);
        }

        Parsed parseExpressionStatement(int start) {
            AstNode expression = parsePrimary(start);
            if (expression == null) {
                return new Parsed(null, 1);
            }
            AstNode node = new AstNode(NodeType.EXPRESSION_STATEMENT, LANGUAGE);
            node.addChild(expression);
            int end = skipExpressionRemainder(start + 1);
            return finish(node, start, end);
        }

        /**
         * Literal or identifier at the given position, or null.
         */
        AstNode parsePrimary(int index) {
            if (index >= tokens.size()) {
                return null;
            }
            Token token = tokens.get(index);
            AstNode node = switch (token.type()) {
                case STRING_DOUBLE, STRING_SINGLE, STRING_TEMPLATE -> AstNodes.literal(
                        token.value().substring(1, token.value().length() - 1), DataType.STRING, LANGUAGE);
                case NUMBER -> token.value().contains(".")
                        ? AstNodes.literal(Double.parseDouble(token.value()), DataType.FLOAT, LANGUAGE)
                        : AstNodes.literal(AstNodes.parseInteger(token.value(), 10), DataType.INTEGER, LANGUAGE);
                case TRUE, FALSE -> AstNodes.literal(token.is(TokenType.TRUE), DataType.BOOLEAN, LANGUAGE);
                case NULL -> AstNodes.literal(null, DataType.NULL, LANGUAGE);
                case UNDEFINED -> AstNodes.literal(null, DataType.UNDEFINED, LANGUAGE);
                case IDENTIFIER -> AstNodes.identifier(token.value(), LANGUAGE);
                default -> null;
            };
            if (node != null) {
                node.setSourceRange(range(token, token));
            }
            return node;
        }

        /**
         * Parenthesized header after if/for/while, recorded as text. Returns the index after it.
         */
        private int parseHeader(AstNode node, int i, String attribute) {
            if (!at(i, TokenType.LPAREN)) {
                return i;
            }
            Span span = skipBalanced(i, TokenType.LPAREN, TokenType.RPAREN);
            int innerEnd = span.matched() ? span.end() - 1 : span.end();
            node.setAttribute(attribute, joinValues(i + 1, innerEnd));
            return span.end();
        }

        /**
         * Braced body, or a single statement ending where an expression statement
         * would. Null at end of input.
         */
        private Parsed parseBody(int i) {
            if (i >= tokens.size()) {
                return null;
            }
            if (at(i, TokenType.LBRACE)) {
                return parseOpaqueBlock(i);
            }
            int end = at(i, TokenType.SEMICOLON) ? i + 1 : skipExpressionRemainder(i + 1);
            AstNode block = opaqueBlock(end - i);
            block.setSourceRange(range(tokens.get(i), tokens.get(end - 1)));
            return new Parsed(block, end - i);
        }

        /**
         * Span from an opening brace to its matching close, as one childless block.
         */
        private Parsed parseOpaqueBlock(int open) {
            Span span = skipBalanced(open, TokenType.LBRACE, TokenType.RBRACE);
            int end = span.end();
            int inner = span.matched() ? end - open - 2 : end - open - 1;
            AstNode block = opaqueBlock(inner);
            block.setSourceRange(range(tokens.get(open), tokens.get(end - 1)));
            return new Parsed(block, end - open);
        }

        private static AstNode opaqueBlock(int tokenCount) {
            AstNode block = new AstNode(NodeType.BLOCK_STATEMENT, LANGUAGE);
            block.setAttribute("opaque", true);
            block.setAttribute("token_count", Math.max(0, tokenCount));
            return block;
        }

        /**
         * Span from the open token at {@code open} to just past its matching close.
         * Unmatched spans end at the end of input.
         */
        private Span skipBalanced(int open, TokenType openType, TokenType closeType) {
            int depth = 0;
            int i = open;
            while (i < tokens.size()) {
                Token t = tokens.get(i);
                if (t.is(openType)) {
                    depth++;
                } else if (t.is(closeType)) {
                    depth--;
                    if (depth == 0) {
                        return new Span(i + 1, true);
                    }
                }
                i++;
            }
            return new Span(i, false);
        }

        /**
         * Skip the rest of an expression: up to and including a top-level semicolon,
         * stopping before an unbalanced closer, an {@code else}, or where a new line
         * plainly starts a new statement.
         */
        private int skipExpressionRemainder(int i) {
            int depth = 0;
            while (i < tokens.size()) {
                Token t = tokens.get(i);
                if (depth == 0) {
                    if (t.is(TokenType.SEMICOLON)) {
                        return i + 1;
                    }
                    if (t.is(TokenType.RPAREN) || t.is(TokenType.RBRACKET) || t.is(TokenType.RBRACE)
                            || t.is(TokenType.ELSE)) {
                        return i;
                    }
                    if (i > 0 && startsNewStatement(tokens.get(i - 1), t)) {
                        return i;
                    }
                }
                switch (t.type()) {
                    case LPAREN, LBRACKET, LBRACE -> depth++;
                    case RPAREN, RBRACKET, RBRACE -> depth--;
                    default -> { }
                }
                i++;
            }
            return i;
        }

        private static boolean startsNewStatement(Token previous, Token current) {
            if (current.line() <= previous.line()) {
                return false;
            }
            return STATEMENT_STARTERS.contains(current.type())
                    || (EXPRESSION_ENDS.contains(previous.type()) && EXPRESSION_STARTS.contains(current.type()));
        }

        private void collectImportSpecifiers(AstNode node, int from, int to) {
            List<Map<String, Object>> names = new ArrayList<>();
            boolean afterFrom = false;
            for (int i = from; i < to; i++) {
                Token t = tokens.get(i);
                if (t.is(TokenType.FROM)) {
                    afterFrom = true;
                } else if (t.type().isString()) {
                    node.setAttribute("module", t.value().substring(1, t.value().length() - 1));
                } else if (afterFrom) {
                    continue;
                } else if (t.is(TokenType.IDENTIFIER) && "as".equals(t.value()) && at(i + 1, TokenType.IDENTIFIER)) {
                    if (!names.isEmpty()) {
                        names.get(names.size() - 1).put("alias", tokens.get(i + 1).value());
                    }
                    i++;
                } else if (t.is(TokenType.IDENTIFIER) || t.is(TokenType.MULTIPLY)) {
                    Map<String, Object> name = new LinkedHashMap<>();
                    name.put("name", t.value());
                    names.add(name);
                }
            }
            node.setAttribute("names", names);
        }

        private boolean isAsyncFunction(int index) {
            return at(index, TokenType.IDENTIFIER) && "async".equals(tokens.get(index).value())
                    && at(index + 1, TokenType.FUNCTION);
        }

        private static boolean isDeclarationKeyword(TokenType type) {
            return type == TokenType.FUNCTION || type == TokenType.CLASS || type.isVariableKeyword();
        }

        private String joinValues(int from, int to) {
            StringBuilder sb = new StringBuilder();
            for (int i = from; i < to && i < tokens.size(); i++) {
                if (!sb.isEmpty()) {
                    sb.append(' ');
                }
                sb.append(tokens.get(i).value());
            }
            return sb.toString();
        }

        private boolean at(int index, TokenType type) {
            return index < tokens.size() && tokens.get(index).is(type);
        }

        private Parsed finish(AstNode node, int start, int end) {
            int last = Math.min(Math.max(end, start + 1), tokens.size()) - 1;
            node.setSourceRange(range(tokens.get(start), tokens.get(last)));
            return new Parsed(node, Math.max(1, end - start));
        }

        private SourceRange range(Token first, Token last) {
            return SourceRange.of(first.line(), first.column(), last.line(), last.endColumn(), filePath);
        }
    }
}
