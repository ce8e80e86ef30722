package com.vidnyan.ust.domain.model;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Syntax categories of the universal syntax tree.
 * Every node carries exactly one of these as its discriminator.
 */
public enum NodeType {

    // Roots
    PROGRAM("program"),
    MODULE("module"),

    // Declarations
    VARIABLE_DECLARATION("variable_declaration"),
    FUNCTION_DECLARATION("function_declaration"),
    CLASS_DECLARATION("class_declaration"),
    INTERFACE_DECLARATION("interface_declaration"),
    IMPORT_DECLARATION("import_declaration"),

    // Expressions
    LITERAL("literal"),
    IDENTIFIER("identifier"),
    BINARY_EXPRESSION("binary_expression"),
    UNARY_EXPRESSION("unary_expression"),
    CALL_EXPRESSION("call_expression"),
    MEMBER_EXPRESSION("member_expression"),
    ASSIGNMENT_EXPRESSION("assignment_expression"),

    // Statements
    EXPRESSION_STATEMENT("expression_statement"),
    BLOCK_STATEMENT("block_statement"),
    IF_STATEMENT("if_statement"),
    WHILE_STATEMENT("while_statement"),
    FOR_STATEMENT("for_statement"),
    RETURN_STATEMENT("return_statement"),
    BREAK_STATEMENT("break_statement"),
    CONTINUE_STATEMENT("continue_statement"),

    // Types
    PRIMITIVE_TYPE("primitive_type"),
    ARRAY_TYPE("array_type"),
    OBJECT_TYPE("object_type"),
    FUNCTION_TYPE("function_type"),

    // Metadata
    COMMENT("comment"),
    ANNOTATION("annotation");

    /**
     * Category assigned to native constructs that have no explicit mapping.
     */
    public static final NodeType FALLBACK = EXPRESSION_STATEMENT;

    private static final Map<String, NodeType> BY_VALUE = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(NodeType::value, Function.identity()));

    private final String value;

    NodeType(String value) {
        this.value = value;
    }

    /**
     * Wire value used in the canonical form.
     */
    public String value() {
        return value;
    }

    /**
     * Resolve a wire value back to its constant.
     *
     * @throws IllegalArgumentException if the value names no node type
     */
    public static NodeType fromValue(String value) {
        NodeType type = BY_VALUE.get(value);
        if (type == null) {
            throw new IllegalArgumentException("Unknown node type: " + value);
        }
        return type;
    }
}
