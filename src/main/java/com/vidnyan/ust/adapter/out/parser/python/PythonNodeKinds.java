package com.vidnyan.ust.adapter.out.parser.python;

import com.vidnyan.ust.domain.model.NodeType;

import java.util.Map;
import java.util.Set;

import static java.util.Map.entry;

/**
 * Static mapping from tree-sitter Python node kinds to universal node types.
 * Kinds not listed fall back to {@link NodeType#FALLBACK}.
 */
final class PythonNodeKinds {

    static final Map<String, NodeType> MAPPING = Map.ofEntries(
            entry("module", NodeType.PROGRAM),

            // declarations
            entry("function_definition", NodeType.FUNCTION_DECLARATION),
            entry("lambda", NodeType.FUNCTION_DECLARATION),
            entry("class_definition", NodeType.CLASS_DECLARATION),
            entry("import_statement", NodeType.IMPORT_DECLARATION),
            entry("import_from_statement", NodeType.IMPORT_DECLARATION),
            entry("future_import_statement", NodeType.IMPORT_DECLARATION),
            entry("decorator", NodeType.ANNOTATION),

            // statements
            entry("expression_statement", NodeType.EXPRESSION_STATEMENT),
            entry("return_statement", NodeType.RETURN_STATEMENT),
            entry("if_statement", NodeType.IF_STATEMENT),
            entry("elif_clause", NodeType.IF_STATEMENT),
            entry("conditional_expression", NodeType.IF_STATEMENT),
            entry("for_statement", NodeType.FOR_STATEMENT),
            entry("while_statement", NodeType.WHILE_STATEMENT),
            entry("break_statement", NodeType.BREAK_STATEMENT),
            entry("continue_statement", NodeType.CONTINUE_STATEMENT),
            entry("block", NodeType.BLOCK_STATEMENT),
            entry("with_statement", NodeType.BLOCK_STATEMENT),
            entry("try_statement", NodeType.BLOCK_STATEMENT),

            // expressions
            entry("assignment", NodeType.ASSIGNMENT_EXPRESSION),
            entry("augmented_assignment", NodeType.ASSIGNMENT_EXPRESSION),
            entry("binary_operator", NodeType.BINARY_EXPRESSION),
            entry("boolean_operator", NodeType.BINARY_EXPRESSION),
            entry("comparison_operator", NodeType.BINARY_EXPRESSION),
            entry("unary_operator", NodeType.UNARY_EXPRESSION),
            entry("not_operator", NodeType.UNARY_EXPRESSION),
            entry("call", NodeType.CALL_EXPRESSION),
            entry("attribute", NodeType.MEMBER_EXPRESSION),
            entry("subscript", NodeType.MEMBER_EXPRESSION),
            entry("identifier", NodeType.IDENTIFIER),

            // literals
            entry("string", NodeType.LITERAL),
            entry("concatenated_string", NodeType.LITERAL),
            entry("integer", NodeType.LITERAL),
            entry("float", NodeType.LITERAL),
            entry("true", NodeType.LITERAL),
            entry("false", NodeType.LITERAL),
            entry("none", NodeType.LITERAL),
            entry("list", NodeType.LITERAL),
            entry("tuple", NodeType.LITERAL),
            entry("dictionary", NodeType.LITERAL),
            entry("set", NodeType.LITERAL),

            // types and metadata
            entry("type", NodeType.PRIMITIVE_TYPE),
            entry("comment", NodeType.COMMENT)
    );

    /**
     * Kinds converted as leaves: their sub-tokens (quotes, string content) are not walked.
     */
    static final Set<String> ATOMIC = Set.of(
            "identifier", "string", "integer", "float", "true", "false", "none"
    );

    private PythonNodeKinds() {
    }

    static NodeType typeOf(String kind) {
        return MAPPING.getOrDefault(kind, NodeType.FALLBACK);
    }
}
